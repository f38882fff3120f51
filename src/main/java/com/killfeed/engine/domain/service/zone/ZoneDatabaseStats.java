package com.killfeed.engine.domain.service.zone;

import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.ZoneKnowledgeSource;

import java.util.Map;

public record ZoneDatabaseStats(
        int totalZones,
        long primaryZones,
        long secondaryZones,
        Map<StarSystem, Long> bySystem,
        long lastUpdatedEpochMs,
        String version,
        ZoneKnowledgeSource source
) {
}
