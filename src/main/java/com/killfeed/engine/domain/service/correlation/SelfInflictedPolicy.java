package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathType;

public enum SelfInflictedPolicy {
    UNKNOWN(DeathType.UNKNOWN),
    CRASH(DeathType.CRASH);

    private final DeathType deathType;

    SelfInflictedPolicy(DeathType deathType) {
        this.deathType = deathType;
    }

    public DeathType deathType() {
        return deathType;
    }
}
