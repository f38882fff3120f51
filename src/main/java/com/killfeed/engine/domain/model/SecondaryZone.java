package com.killfeed.engine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class SecondaryZone extends Zone {

    private SecondaryZoneType type = SecondaryZoneType.POI;
    private String primaryZoneId;
    private String orbitingBody;
    private String purpose;

    @Builder
    public SecondaryZone(String id, String displayName, StarSystem system, Coordinates coordinates, double confidence,
                         SecondaryZoneType type, String primaryZoneId, String orbitingBody, String purpose) {
        super(id, displayName, system, coordinates, confidence);
        this.type = type == null ? SecondaryZoneType.POI : type;
        this.primaryZoneId = primaryZoneId;
        this.orbitingBody = orbitingBody;
        this.purpose = purpose;
    }

    @Override
    public ZoneClassification getClassification() {
        return ZoneClassification.SECONDARY;
    }
}
