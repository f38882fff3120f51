package com.killfeed.engine.domain.model;

public enum ZoneKnowledgeSource {
    LOCAL,
    SERVER
}
