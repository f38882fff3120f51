package com.killfeed.engine.infra.disruptor.event;

public enum FeedNotificationType {
    EVENT_CHANGE,
    SESSION
}
