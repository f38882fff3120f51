package com.killfeed.engine.domain.service.store;

import com.killfeed.engine.domain.model.KillEvent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

public class EventMirror implements EventStoreListener {

    private static final Comparator<KillEvent> NEWEST_FIRST =
            Comparator.comparingLong(KillEvent::getTimestamp).reversed();

    private final int capacity;
    private final List<KillEvent> events = new ArrayList<>();

    public EventMirror(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public synchronized void onChange(EventChange change) {
        switch (change.type()) {
            case ADDED, UPDATED -> put(change.event());
            case EVICTED, DELETED -> events.removeIf(e -> e.getId().equals(change.eventId()));
            case CLEARED -> events.clear();
        }
    }

    public synchronized void rebuild(List<KillEvent> latest) {
        events.clear();
        latest.forEach(this::put);
    }

    public synchronized List<KillEvent> latest(int limit) {
        return events.stream().limit(limit).map(KillEvent::copy).toList();
    }

    public synchronized List<KillEvent> matching(Predicate<KillEvent> filter) {
        return events.stream().filter(filter).map(KillEvent::copy).toList();
    }

    public synchronized Optional<KillEvent> get(String id) {
        return events.stream().filter(e -> e.getId().equals(id)).findFirst().map(KillEvent::copy);
    }

    public synchronized int size() {
        return events.size();
    }

    public int capacity() {
        return capacity;
    }

    private void put(KillEvent event) {
        if (event == null) return;
        events.removeIf(e -> e.getId().equals(event.getId()));
        if (events.size() >= capacity && NEWEST_FIRST.compare(events.get(events.size() - 1), event) <= 0) {
            return;
        }
        int index = 0;
        while (index < events.size() && NEWEST_FIRST.compare(events.get(index), event) <= 0) {
            index++;
        }
        events.add(index, event.copy());
        while (events.size() > capacity) {
            events.remove(events.size() - 1);
        }
    }
}
