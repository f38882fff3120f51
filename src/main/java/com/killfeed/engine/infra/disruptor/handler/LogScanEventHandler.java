package com.killfeed.engine.infra.disruptor.handler;

import com.killfeed.engine.domain.service.scan.LogScanner;
import com.killfeed.engine.domain.service.scan.ScanResult;
import com.killfeed.engine.infra.disruptor.event.IngestEvent;
import com.lmax.disruptor.EventHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
@RequiredArgsConstructor
public class LogScanEventHandler implements EventHandler<IngestEvent> {

    private final LogScanner logScanner;
    private final MeterRegistry meterRegistry;

    private Timer e2eLatencyTimer;

    @PostConstruct
    void initMetrics() {
        e2eLatencyTimer = Timer.builder("killfeed.pipeline.e2e_latency")
                .description("Time from chunk publish to scan complete")
                .register(meterRegistry);
    }

    @Override
    public void onEvent(IngestEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) return;

        switch (event.getType()) {
            case LOG_CHUNK -> {
                ScanResult result = logScanner.parse(event.getChunk());
                event.setScanResult(result);
                if (result.linesFailed() > 0) {
                    log.warn("[Scan] 처리 실패 라인 {}건 (origin={}, lines={})",
                            result.linesFailed(), event.getOrigin(), result.linesScanned());
                }
                log.debug("[Scan] chunk 처리: origin={}, lines={}, signals={}, session={}",
                        event.getOrigin(), result.linesScanned(), result.signals().size(),
                        result.sessionEvents().size());
            }
            case SESSION_RESET -> {
                logScanner.reset();
                event.setScanResult(ScanResult.EMPTY);
            }
        }

        if (event.getIngestNanoTime() > 0) {
            e2eLatencyTimer.record(System.nanoTime() - event.getIngestNanoTime(), TimeUnit.NANOSECONDS);
        }
    }
}
