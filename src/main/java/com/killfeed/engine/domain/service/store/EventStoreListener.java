package com.killfeed.engine.domain.service.store;

@FunctionalInterface
public interface EventStoreListener {

    void onChange(EventChange change);
}
