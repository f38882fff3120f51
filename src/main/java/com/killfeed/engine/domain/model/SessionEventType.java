package com.killfeed.engine.domain.model;

public enum SessionEventType {
    LOGIN,
    SESSION_START,
    MODE_CHANGED,
    MODE_OBSERVED,
    SYSTEM_QUIT,
    GAME_VERSION,
    PLAYER_SHIP,
    INCAPACITATION,
    SESSION_RESET
}
