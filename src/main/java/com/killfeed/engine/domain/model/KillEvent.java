package com.killfeed.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KillEvent {

    private String id;
    private long timestamp;

    @Builder.Default
    private List<String> killers = new ArrayList<>();
    @Builder.Default
    private List<String> victims = new ArrayList<>();

    private DeathType deathType;
    private int destructionLevel;
    private String vehicleType;
    private String vehicleModel;
    private String vehicleId;
    private String location;
    private EventLocation locationInfo;
    private String weapon;
    private String damageType;
    private GameMode gameMode;
    private String gameVersion;
    private Coordinates coordinates;
    private String playerShip;
    private String playerName;
    private String eventDescription;
    private boolean playerInvolved;

    @Builder.Default
    private ProfileData victimProfile = ProfileData.DEFAULT;
    @Builder.Default
    private ProfileData attackerProfile = ProfileData.DEFAULT;

    @Builder.Default
    private List<String> mergedFrom = new ArrayList<>();

    public KillEvent copy() {
        return toBuilder()
                .killers(new ArrayList<>(killers))
                .victims(new ArrayList<>(victims))
                .mergedFrom(new ArrayList<>(mergedFrom))
                .build();
    }

    public boolean involves(String name) {
        if (name == null || name.isBlank()) return false;
        return killers.stream().anyMatch(name::equalsIgnoreCase)
                || victims.stream().anyMatch(name::equalsIgnoreCase);
    }

    @Override
    public String toString() {
        return "KillEvent{id=" + id + ", killers=" + killers + ", victims=" + victims
                + ", deathType=" + deathType + ", ts=" + timestamp + "}";
    }
}
