package com.killfeed.engine.domain.model;

import java.util.List;
import java.util.Map;

public record ZoneStatistics(
        long totalZoneChanges,
        long sessionStartEpochMs,
        double averageDwellTimeMs,
        List<ZoneVisit> mostVisitedZones,
        Map<StarSystem, Long> systemDistribution,
        Map<ZoneClassification, Long> classificationDistribution
) {

    public record ZoneVisit(String zone, int visits, long totalTimeMs) {
    }
}
