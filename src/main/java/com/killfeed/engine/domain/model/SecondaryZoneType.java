package com.killfeed.engine.domain.model;

public enum SecondaryZoneType {
    STATION,
    LANDING_ZONE,
    OUTPOST,
    DERELICT,
    ASTEROID,
    SHIP,
    POI
}
