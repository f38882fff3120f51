package com.killfeed.engine.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventLocation {

    private String zoneId;
    private String displayName;
    private ZoneClassification classification;
    private StarSystem system;
    private String primaryZoneId;
    private String primaryZoneName;
    private double confidence;
    private MatchMethod matchMethod;
    private boolean fallback;

    public String describe() {
        if (classification == ZoneClassification.SECONDARY && primaryZoneName != null
                && !primaryZoneName.equals(displayName)) {
            return displayName + ", " + primaryZoneName;
        }
        return displayName;
    }
}
