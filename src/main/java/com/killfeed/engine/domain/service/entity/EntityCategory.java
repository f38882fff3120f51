package com.killfeed.engine.domain.service.entity;

public enum EntityCategory {
    SHIP,
    WEAPON,
    OBJECT,
    NPC,
    UNKNOWN
}
