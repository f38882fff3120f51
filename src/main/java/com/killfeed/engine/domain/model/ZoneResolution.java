package com.killfeed.engine.domain.model;

public record ZoneResolution(
        Zone zone,
        double confidence,
        MatchMethod matchMethod,
        boolean fallbackUsed,
        long resolvedAt
) {
}
