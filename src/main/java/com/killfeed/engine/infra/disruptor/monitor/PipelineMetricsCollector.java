package com.killfeed.engine.infra.disruptor.monitor;

import com.killfeed.engine.infra.disruptor.event.FeedNotification;
import com.killfeed.engine.infra.disruptor.event.IngestEvent;
import com.lmax.disruptor.RingBuffer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class PipelineMetricsCollector {

    private final RingBuffer<IngestEvent> ingestRingBuffer;
    private final RingBuffer<FeedNotification> outputRingBuffer;
    private final MeterRegistry meterRegistry;

    public PipelineMetricsCollector(
            RingBuffer<IngestEvent> ingestRingBuffer,
            RingBuffer<FeedNotification> feedNotificationRingBuffer,
            MeterRegistry meterRegistry) {
        this.ingestRingBuffer = ingestRingBuffer;
        this.outputRingBuffer = feedNotificationRingBuffer;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        registerRingGauges(ingestRingBuffer, "ingest");
        registerRingGauges(outputRingBuffer, "output");
        log.info("[Metrics] RingBuffer 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 30_000)
    public void logMetricsSummary() {
        log.info("[Metrics] Ingest RB: {}% ({}/{}) | Output RB: {}% ({}/{})",
                String.format("%.1f", utilization(ingestRingBuffer) * 100),
                ingestRingBuffer.getBufferSize() - ingestRingBuffer.remainingCapacity(),
                ingestRingBuffer.getBufferSize(),
                String.format("%.1f", utilization(outputRingBuffer) * 100),
                outputRingBuffer.getBufferSize() - outputRingBuffer.remainingCapacity(),
                outputRingBuffer.getBufferSize());

        Timer chunkTimer = meterRegistry.find("killfeed.scanner.chunk_duration").timer();
        Counter lines = meterRegistry.find("killfeed.scanner.lines").counter();
        Counter resolved = meterRegistry.find("killfeed.correlation.resolved").counter();
        Counter duplicates = meterRegistry.find("killfeed.death.duplicates_prevented").counter();

        if (chunkTimer != null && chunkTimer.count() > 0) {
            log.info("[Metrics] Scan avg={}μs chunks={} lines={} | resolved={} dupPrevented={}",
                    String.format("%.0f", chunkTimer.mean(TimeUnit.MICROSECONDS)),
                    chunkTimer.count(),
                    lines != null ? (long) lines.count() : 0,
                    resolved != null ? (long) resolved.count() : 0,
                    duplicates != null ? (long) duplicates.count() : 0);
        }
    }

    private void registerRingGauges(RingBuffer<?> ringBuffer, String pipeline) {
        Gauge.builder("killfeed.ringbuffer.utilization", ringBuffer, PipelineMetricsCollector::utilization)
                .tag("pipeline", pipeline)
                .description("RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);
        Gauge.builder("killfeed.ringbuffer.remaining", ringBuffer, rb -> (double) rb.remainingCapacity())
                .tag("pipeline", pipeline)
                .description("RingBuffer remaining capacity")
                .register(meterRegistry);
    }

    private static double utilization(RingBuffer<?> ringBuffer) {
        return 1.0 - ((double) ringBuffer.remainingCapacity() / ringBuffer.getBufferSize());
    }
}
