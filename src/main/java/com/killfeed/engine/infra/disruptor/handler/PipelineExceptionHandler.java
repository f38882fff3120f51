package com.killfeed.engine.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class PipelineExceptionHandler<T> implements ExceptionHandler<T> {

    private static final int STREAK_WARN_THRESHOLD = 10;

    private final String pipelineName;
    private final MeterRegistry meterRegistry;
    private final AtomicLong failureStreak = new AtomicLong();
    private volatile long lastFailedSequence = -1;

    public PipelineExceptionHandler(String pipelineName, MeterRegistry meterRegistry) {
        this.pipelineName = pipelineName;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, T event) {
        meterRegistry.counter("killfeed.pipeline.exceptions",
                "pipeline", pipelineName,
                "cause", ex.getClass().getSimpleName()).increment();

        long streak = sequence == lastFailedSequence + 1 ? failureStreak.incrementAndGet() : resetStreak();
        lastFailedSequence = sequence;

        log.error("[Pipeline-{}] seq={} 슬롯 드롭: {} ({})", pipelineName, sequence, event, ex.toString(), ex);
        if (streak == STREAK_WARN_THRESHOLD) {
            log.warn("[Pipeline-{}] 연속 {}건 처리 실패. 핸들러 상태 확인 필요", pipelineName, streak);
        }
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Pipeline-{}] 핸들러 기동 실패. 파이프라인 중단", pipelineName, ex);
        throw new IllegalStateException("pipeline " + pipelineName + " failed to start", ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.warn("[Pipeline-{}] 종료 중 예외 무시: {}", pipelineName, ex.toString());
    }

    public long currentFailureStreak() {
        return failureStreak.get();
    }

    private long resetStreak() {
        failureStreak.set(1);
        return 1;
    }
}
