package com.killfeed.engine.domain.service.store;

public enum ChangeType {
    ADDED,
    UPDATED,
    EVICTED,
    DELETED,
    CLEARED
}
