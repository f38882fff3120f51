package com.killfeed.engine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ZoneHistoryEntry {

    private long timestamp;
    private String zoneId;
    private String zoneName;
    private ZoneClassification classification;
    private StarSystem system;
    private String source;
    private Coordinates coordinates;
    private long dwellTimeMs;
    private int eventCount;
}
