package com.killfeed.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "classification", visible = true)
@JsonSubTypes({
        @JsonSubTypes.Type(value = PrimaryZone.class, name = "PRIMARY"),
        @JsonSubTypes.Type(value = SecondaryZone.class, name = "SECONDARY")
})
public abstract class Zone {

    private String id;
    private String displayName;
    private StarSystem system = StarSystem.UNKNOWN;
    private Coordinates coordinates;
    private double confidence;

    protected Zone(String id, String displayName, StarSystem system, Coordinates coordinates, double confidence) {
        this.id = id;
        this.displayName = displayName;
        this.system = system == null ? StarSystem.UNKNOWN : system;
        this.coordinates = coordinates;
        this.confidence = confidence;
    }

    public abstract ZoneClassification getClassification();

    public boolean isPrimary() {
        return getClassification() == ZoneClassification.PRIMARY;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", name=" + displayName + ", system=" + system + "}";
    }
}
