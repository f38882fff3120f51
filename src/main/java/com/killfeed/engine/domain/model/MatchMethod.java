package com.killfeed.engine.domain.model;

public enum MatchMethod {
    EXACT,
    PATTERN,
    FALLBACK
}
