package com.killfeed.engine.infra.disruptor.event;

public enum IngestEventType {
    LOG_CHUNK,
    SESSION_RESET
}
