package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathNoticeFormat;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class DeathNoticeDeduplicator {

    private static final long MINUTE_MS = 60_000L;

    public enum Decision {
        ACCEPTED,
        SUPPRESSED,
        UPGRADED
    }

    private final CorrelationProperties properties;
    private final Counter duplicatesCounter;
    private final AtomicLong duplicatesPrevented = new AtomicLong();
    private final Map<String, RecordedNotice> recorded = new HashMap<>();

    public DeathNoticeDeduplicator(CorrelationProperties properties, MeterRegistry meterRegistry) {
        this.properties = properties;
        this.duplicatesCounter = Counter.builder("killfeed.death.duplicates_prevented")
                .description("Player death reports suppressed as duplicates of an earlier format")
                .register(meterRegistry);
    }

    public synchronized Decision evaluate(String playerName, DeathNoticeFormat format, long timestamp) {
        String player = playerName.toLowerCase(Locale.ROOT);
        long minute = Math.floorDiv(timestamp, MINUTE_MS);
        prune(timestamp);

        for (long m = minute - 1; m <= minute + 1; m++) {
            String key = key(player, m);
            RecordedNotice previous = recorded.get(key);
            if (previous == null || Math.abs(timestamp - previous.timestamp()) > properties.getDeathCoincidenceWindowMs()) {
                continue;
            }
            countDuplicate();
            if (format.outranks(previous.format())) {
                recorded.put(key, new RecordedNotice(format, previous.timestamp()));
                log.info("[Dedup] 사망 감지 방식 승격: player={}, {} → {}", playerName, previous.format(), format);
                return Decision.UPGRADED;
            }
            log.debug("[Dedup] 중복 사망 보고 무시: player={}, format={}, 기록={}", playerName, format, previous.format());
            return Decision.SUPPRESSED;
        }

        recorded.put(key(player, minute), new RecordedNotice(format, timestamp));
        return Decision.ACCEPTED;
    }

    public long getDuplicatesPrevented() {
        return duplicatesPrevented.get();
    }

    public synchronized void reset() {
        recorded.clear();
    }

    private void countDuplicate() {
        duplicatesPrevented.incrementAndGet();
        duplicatesCounter.increment();
    }

    private void prune(long now) {
        Iterator<RecordedNotice> it = recorded.values().iterator();
        while (it.hasNext()) {
            if (now - it.next().timestamp() > 2 * MINUTE_MS) {
                it.remove();
            }
        }
    }

    private static String key(String player, long minute) {
        return player + ":" + minute;
    }

    private record RecordedNotice(DeathNoticeFormat format, long timestamp) {
    }
}
