package com.killfeed.engine.domain.model;

public enum PrimaryZoneType {
    SYSTEM,
    PLANET,
    MOON,
    JUMP_POINT,
    ASTEROID_FIELD
}
