package com.killfeed.engine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ZoneKnowledgeUpdate(
        String version,
        boolean replace,
        List<Zone> zones
) {
}
