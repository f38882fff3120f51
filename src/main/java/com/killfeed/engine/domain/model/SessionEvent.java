package com.killfeed.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SessionEvent {

    private final SessionEventType type;
    private final long timestamp;
    private final String value;
    private final String detail;

    @Override
    public String toString() {
        return "SessionEvent{type=" + type + ", value=" + value + "}";
    }
}
