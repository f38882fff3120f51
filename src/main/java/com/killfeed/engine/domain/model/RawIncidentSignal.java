package com.killfeed.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder(toBuilder = true)
public class RawIncidentSignal {

    private final IncidentKind kind;
    private final String incidentId;
    private final long timestamp;

    @Builder.Default
    private final List<String> killers = List.of();
    @Builder.Default
    private final List<String> victims = List.of();

    private final boolean placeholderVictim;

    private final int destructionLevel;
    private final String damageType;
    private final String causer;
    private final String driver;
    private final String weapon;

    private final String locationToken;
    private final boolean locationFallback;
    private final Coordinates coordinates;

    private final String vehicleId;
    private final String vehicleModel;

    private final DeathNoticeFormat deathNoticeFormat;

    private final GameMode gameMode;
    private final String gameVersion;
    private final String playerShip;
    private final String playerName;

    @Override
    public String toString() {
        return "RawIncidentSignal{kind=" + kind + ", id=" + incidentId + ", killers=" + killers
                + ", victims=" + victims + ", ts=" + timestamp + "}";
    }
}
