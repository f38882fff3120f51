package com.killfeed.engine.domain.service.entity;

public interface EntityNameResolver {

    ResolvedEntity resolve(String entityId);

    boolean isNpc(String entityId);

    void applyDefinitions(EntityDefinitions definitions);

    String definitionsVersion();
}
