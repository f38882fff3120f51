package com.killfeed.engine.domain.model;

import java.util.EnumSet;
import java.util.Set;

public enum DeathType {
    COMBAT("Combat"),
    HARD("Hard"),
    SOFT("Soft"),
    COLLISION("Collision"),
    CRASH("Crash"),
    BLEED_OUT("BleedOut"),
    SUFFOCATION("Suffocation"),
    UNKNOWN("Unknown");

    private static final Set<DeathType> SIGNIFICANT =
            EnumSet.of(HARD, COMBAT, COLLISION, CRASH, BLEED_OUT, SUFFOCATION);

    private final String label;

    DeathType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isSignificant() {
        return SIGNIFICANT.contains(this);
    }
}
