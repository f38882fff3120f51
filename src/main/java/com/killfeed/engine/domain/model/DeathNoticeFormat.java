package com.killfeed.engine.domain.model;

public enum DeathNoticeFormat {
    ACTOR_STATE_DEAD(3, true),
    LEGACY_CORPSE(2, true),
    LOCAL_DEATH_STATE(1, false);

    private final int priority;
    private final boolean nameBearing;

    DeathNoticeFormat(int priority, boolean nameBearing) {
        this.priority = priority;
        this.nameBearing = nameBearing;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isNameBearing() {
        return nameBearing;
    }

    public boolean outranks(DeathNoticeFormat other) {
        return other == null || priority > other.priority;
    }
}
