package com.killfeed.engine.domain.model;

public enum StarSystem {
    STANTON("OOC_Stanton"),
    PYRO("OOC_Pyro"),
    UNKNOWN(null);

    private final String defaultPrimaryZoneId;

    StarSystem(String defaultPrimaryZoneId) {
        this.defaultPrimaryZoneId = defaultPrimaryZoneId;
    }

    public String getDefaultPrimaryZoneId() {
        return defaultPrimaryZoneId;
    }
}
