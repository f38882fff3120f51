package com.killfeed.engine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
public class PrimaryZone extends Zone {

    private PrimaryZoneType type = PrimaryZoneType.SYSTEM;
    private String parentId;
    private List<String> childIds = new ArrayList<>();
    private String jurisdiction;

    @Builder
    public PrimaryZone(String id, String displayName, StarSystem system, Coordinates coordinates, double confidence,
                       PrimaryZoneType type, String parentId, List<String> childIds, String jurisdiction) {
        super(id, displayName, system, coordinates, confidence);
        this.type = type == null ? PrimaryZoneType.SYSTEM : type;
        this.parentId = parentId;
        this.childIds = childIds == null ? new ArrayList<>() : new ArrayList<>(childIds);
        this.jurisdiction = jurisdiction;
    }

    @Override
    public ZoneClassification getClassification() {
        return ZoneClassification.PRIMARY;
    }
}
