package com.killfeed.engine.infra.disruptor.publish;

import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.service.session.SessionContextTracker;
import com.killfeed.engine.domain.service.store.EventChange;
import com.killfeed.engine.domain.service.store.EventStore;
import com.killfeed.engine.domain.service.store.EventStoreListener;
import com.killfeed.engine.infra.disruptor.event.FeedNotification;
import com.killfeed.engine.infra.disruptor.event.FeedNotificationType;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class FeedNotificationPublisher {

    private final RingBuffer<FeedNotification> feedNotificationRingBuffer;
    private final EventStore eventStore;
    private final SessionContextTracker sessionTracker;
    private final MeterRegistry meterRegistry;

    private final EventStoreListener storeListener = this::publishChange;

    private Counter droppedCounter;

    @PostConstruct
    void init() {
        droppedCounter = Counter.builder("killfeed.events.dropped")
                .tag("reason", "output_full")
                .tag("source", "output")
                .description("Feed notifications dropped because the output ring was full")
                .register(meterRegistry);
        eventStore.subscribe(storeListener);
        sessionTracker.addListener(this::publishSession);
        log.info("[Output] 저장소 변경 및 세션 이벤트 구독 등록 완료");
    }

    @PreDestroy
    void close() {
        eventStore.unsubscribe(storeListener);
    }

    public void publishChange(EventChange change) {
        boolean published = feedNotificationRingBuffer.tryPublishEvent((notification, sequence) -> {
            notification.clear();
            notification.setType(FeedNotificationType.EVENT_CHANGE);
            notification.setChange(change);
            notification.setPublishNanoTime(System.nanoTime());
        });
        if (!published) {
            droppedCounter.increment();
            log.warn("[Output] 출력 RingBuffer 포화 - 변경 알림 드롭: {} {}", change.type(), change.eventId());
        }
    }

    public void publishSession(SessionEvent sessionEvent) {
        boolean published = feedNotificationRingBuffer.tryPublishEvent((notification, sequence) -> {
            notification.clear();
            notification.setType(FeedNotificationType.SESSION);
            notification.setSessionEvent(sessionEvent);
            notification.setPublishNanoTime(System.nanoTime());
        });
        if (!published) {
            droppedCounter.increment();
            log.warn("[Output] 출력 RingBuffer 포화 - 세션 이벤트 드롭: {}", sessionEvent);
        }
    }
}
