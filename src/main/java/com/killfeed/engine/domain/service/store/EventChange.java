package com.killfeed.engine.domain.service.store;

import com.killfeed.engine.domain.model.EventSource;
import com.killfeed.engine.domain.model.KillEvent;

public record EventChange(
        ChangeType type,
        String eventId,
        KillEvent event,
        EventSource source,
        boolean persisted
) {

    static EventChange added(KillEvent event, EventSource source, boolean persisted) {
        return new EventChange(ChangeType.ADDED, event.getId(), event, source, persisted);
    }

    static EventChange updated(KillEvent event, EventSource source, boolean persisted) {
        return new EventChange(ChangeType.UPDATED, event.getId(), event, source, persisted);
    }

    static EventChange removed(ChangeType type, String eventId) {
        return new EventChange(type, eventId, null, null, true);
    }

    static EventChange cleared() {
        return new EventChange(ChangeType.CLEARED, null, null, null, true);
    }
}
