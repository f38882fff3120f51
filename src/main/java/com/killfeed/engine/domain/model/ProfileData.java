package com.killfeed.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ProfileData(
        String enlisted,
        String record,
        String organization,
        String avatarUrl
) {

    public static final String UNAVAILABLE = "-";

    public static final ProfileData DEFAULT = new ProfileData(UNAVAILABLE, UNAVAILABLE, UNAVAILABLE, UNAVAILABLE);

    @JsonIgnore
    public boolean isDefault() {
        return UNAVAILABLE.equals(enlisted) && UNAVAILABLE.equals(record)
                && UNAVAILABLE.equals(organization) && UNAVAILABLE.equals(avatarUrl);
    }
}
