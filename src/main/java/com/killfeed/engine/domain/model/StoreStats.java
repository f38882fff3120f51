package com.killfeed.engine.domain.model;

import java.util.Map;

public record StoreStats(
        long totalEvents,
        long playerEvents,
        Map<EventSource, Long> sources,
        Long oldestEpochMs,
        Long newestEpochMs
) {
}
