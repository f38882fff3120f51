package com.killfeed.engine.infra.disruptor.handler;

import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.service.store.EventChange;
import com.killfeed.engine.infra.disruptor.event.FeedNotification;
import com.lmax.disruptor.EventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FeedBroadcastHandler implements EventHandler<FeedNotification> {

    public static final String EVENTS_TOPIC = "/topic/events";
    public static final String SESSION_TOPIC = "/topic/session";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onEvent(FeedNotification notification, long sequence, boolean endOfBatch) {
        if (notification.getType() == null) return;

        switch (notification.getType()) {
            case EVENT_CHANGE -> broadcastChange(notification.getChange());
            case SESSION -> broadcastSession(notification.getSessionEvent());
        }
    }

    private void broadcastChange(EventChange change) {
        if (change == null) return;
        messagingTemplate.convertAndSend(EVENTS_TOPIC, change);
        log.debug("[Broadcast] {} → {}, id={}, persisted={}",
                change.type(), EVENTS_TOPIC, change.eventId(), change.persisted());
    }

    private void broadcastSession(SessionEvent sessionEvent) {
        if (sessionEvent == null) return;
        messagingTemplate.convertAndSend(SESSION_TOPIC, sessionEvent);
        log.debug("[Broadcast] {} → {}", sessionEvent, SESSION_TOPIC);
    }
}
