package com.killfeed.engine.infra.disruptor.handler;

import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.model.SessionEventType;
import com.killfeed.engine.infra.disruptor.event.IngestEvent;
import com.killfeed.engine.infra.disruptor.event.IngestEventType;
import com.killfeed.engine.infra.disruptor.publish.FeedNotificationPublisher;
import com.lmax.disruptor.EventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SessionRelayHandler implements EventHandler<IngestEvent> {

    private final FeedNotificationPublisher notificationPublisher;

    @Override
    public void onEvent(IngestEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == IngestEventType.SESSION_RESET) {
            notificationPublisher.publishSession(SessionEvent.builder()
                    .type(SessionEventType.SESSION_RESET)
                    .timestamp(System.currentTimeMillis())
                    .value(event.getOrigin())
                    .build());
            return;
        }

        if (event.getScanResult() == null) return;
        for (SessionEvent sessionEvent : event.getScanResult().sessionEvents()) {
            notificationPublisher.publishSession(sessionEvent);
        }
    }
}
