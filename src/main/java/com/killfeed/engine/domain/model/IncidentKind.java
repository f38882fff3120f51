package com.killfeed.engine.domain.model;

public enum IncidentKind {
    VEHICLE_DESTRUCTION,
    ACTOR_DEATH,
    ENVIRONMENT_DEATH,
    PLAYER_DEATH
}
