package com.killfeed.engine.infra.disruptor.publish;

import com.killfeed.engine.infra.disruptor.event.IngestEvent;
import com.killfeed.engine.infra.disruptor.event.IngestEventType;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class IngestPublisher {

    private static final double BACKPRESSURE_THRESHOLD = 0.9;

    private final RingBuffer<IngestEvent> ingestRingBuffer;
    private final MeterRegistry meterRegistry;

    private Counter backpressureDropCounter;
    private Counter publishedCounter;

    @PostConstruct
    void initMetrics() {
        backpressureDropCounter = Counter.builder("killfeed.events.dropped")
                .tag("reason", "backpressure")
                .tag("source", "ingest")
                .description("Log chunks rejected while the ingest ring was near capacity")
                .register(meterRegistry);
        publishedCounter = Counter.builder("killfeed.ingest.chunks")
                .description("Log chunks published to the ingest ring")
                .register(meterRegistry);
    }

    public synchronized boolean publishChunk(String chunk, String origin) {
        if (chunk == null || chunk.isEmpty()) return true;

        if (isBackpressureActive()) {
            backpressureDropCounter.increment();
            log.warn("[Ingest] 백프레셔 활성 - chunk 게시 보류 (util={}%, origin={})",
                    String.format("%.1f", getRingBufferUtilization() * 100), origin);
            return false;
        }

        ingestRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(IngestEventType.LOG_CHUNK);
            event.setChunk(chunk);
            event.setOrigin(origin);
            event.setIngestNanoTime(System.nanoTime());
        });
        publishedCounter.increment();
        return true;
    }

    public synchronized void publishReset(String origin) {
        ingestRingBuffer.publishEvent((event, sequence) -> {
            event.clear();
            event.setType(IngestEventType.SESSION_RESET);
            event.setOrigin(origin);
            event.setIngestNanoTime(System.nanoTime());
        });
        log.info("[Ingest] 세션 초기화 요청 게시: origin={}", origin);
    }

    public double getRingBufferUtilization() {
        return 1.0 - ((double) ingestRingBuffer.remainingCapacity() / ingestRingBuffer.getBufferSize());
    }

    private boolean isBackpressureActive() {
        return getRingBufferUtilization() > BACKPRESSURE_THRESHOLD;
    }
}
