package com.killfeed.engine.domain.model;

public enum ZoneClassification {
    PRIMARY,
    SECONDARY
}
