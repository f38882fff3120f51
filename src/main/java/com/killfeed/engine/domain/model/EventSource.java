package com.killfeed.engine.domain.model;

public enum EventSource {
    LOCAL(1),
    SERVER(2),
    MERGED(3);

    private final int priority;

    EventSource(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    public static EventSource combine(EventSource existing, EventSource incoming) {
        if (existing == null) return incoming;
        if (incoming == null || existing == incoming) return existing;
        return MERGED;
    }
}
