package com.killfeed.engine.domain.service.entity;

import com.killfeed.engine.domain.model.MatchMethod;

public record ResolvedEntity(
        String originalId,
        String displayName,
        boolean npc,
        EntityCategory category,
        MatchMethod matchMethod
) {

    public boolean isDefined() {
        return matchMethod != MatchMethod.FALLBACK;
    }
}
