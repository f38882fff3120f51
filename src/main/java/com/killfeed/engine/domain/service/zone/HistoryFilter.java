package com.killfeed.engine.domain.service.zone;

import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.ZoneClassification;

public record HistoryFilter(
        ZoneClassification classification,
        StarSystem system,
        Long sinceEpochMs,
        Integer limit
) {

    public static HistoryFilter none() {
        return new HistoryFilter(null, null, null, null);
    }
}
