package com.killfeed.engine.infra.disruptor.config;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.Locale;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
final class PipelineThreads {

    private PipelineThreads() {
    }

    static WaitStrategy waitStrategy(PipelineProperties properties, Environment environment) {
        String configured = properties.getWaitStrategy();
        if (configured == null || configured.isBlank()) {
            boolean prod = Arrays.asList(environment.getActiveProfiles()).contains("prod");
            configured = prod ? "yielding" : "sleeping";
        }
        switch (configured.trim().toLowerCase(Locale.ROOT)) {
            case "yielding":
                return new YieldingWaitStrategy();
            case "blocking":
                return new BlockingWaitStrategy();
            case "sleeping":
                return new SleepingWaitStrategy();
            default:
                throw new IllegalArgumentException("unknown killfeed.pipeline.wait-strategy: " + configured);
        }
    }

    static int checkedSize(int size, String name) {
        if (size < 2 || Integer.bitCount(size) != 1) {
            throw new IllegalArgumentException(name + " must be a power of two, got " + size);
        }
        return size;
    }

    static ThreadFactory consumerThreads(String ring) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "killfeed-" + ring + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    static void drainAndStop(Disruptor<?> disruptor, String ring, long timeoutMs) {
        if (disruptor == null) {
            return;
        }
        try {
            disruptor.shutdown(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("[Disruptor] {} 링 드레인 후 종료", ring);
        } catch (TimeoutException e) {
            log.warn("[Disruptor] {} 링 드레인 {}ms 초과. 강제 중단", ring, timeoutMs);
            disruptor.halt();
        }
    }
}
