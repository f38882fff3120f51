package com.killfeed.engine.domain.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.killfeed.engine.domain.model.EventPage;
import com.killfeed.engine.domain.model.EventQuery;
import com.killfeed.engine.domain.model.EventSource;
import com.killfeed.engine.domain.model.KillEvent;
import com.killfeed.engine.domain.model.ProfileData;
import com.killfeed.engine.domain.model.StoreStats;
import com.killfeed.engine.domain.model.StoredEventRecord;
import com.killfeed.engine.domain.repository.StoredEventRepository;
import com.killfeed.engine.domain.service.session.SessionContextTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

@Slf4j
@Component
public class EventStore {

    private final StoredEventRepository repository;
    private final EventStoreProperties properties;
    private final ObjectMapper objectMapper;
    private final SessionContextTracker sessionContextTracker;
    private final EventMirror mirror;
    private final List<EventStoreListener> listeners = new CopyOnWriteArrayList<>();

    private final Counter insertedCounter;
    private final Counter updatedCounter;
    private final Counter fingerprintMergeCounter;
    private final Counter evictedCounter;
    private final Counter persistFailureCounter;

    public EventStore(StoredEventRepository repository, EventStoreProperties properties,
                      ObjectMapper objectMapper, SessionContextTracker sessionContextTracker,
                      MeterRegistry meterRegistry) {
        this.repository = repository;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.sessionContextTracker = sessionContextTracker;
        this.mirror = new EventMirror(properties.getMirrorSize());
        this.listeners.add(mirror);

        this.insertedCounter = counter(meterRegistry, "killfeed.store.inserted", "Events inserted");
        this.updatedCounter = counter(meterRegistry, "killfeed.store.updated", "Events updated in place");
        this.fingerprintMergeCounter = counter(meterRegistry, "killfeed.store.fingerprint_merges",
                "Near-duplicate events merged by fingerprint");
        this.evictedCounter = counter(meterRegistry, "killfeed.store.evicted", "Events evicted by retention");
        this.persistFailureCounter = counter(meterRegistry, "killfeed.store.persist_failures",
                "Events kept in memory only after persistence failed");
    }

    @PostConstruct
    public void warmUpMirror() {
        try {
            List<KillEvent> latest = repository
                    .findAllByOrderByTimestampEpochMsDesc(PageRequest.of(0, mirror.capacity()))
                    .stream()
                    .map(this::deserialize)
                    .flatMap(Optional::stream)
                    .toList();
            mirror.rebuild(latest);
            log.info("[EventStore] 미러 초기화 완료: {}건", latest.size());
        } catch (DataAccessException e) {
            log.error("[EventStore] 미러 초기화 실패, 빈 상태로 시작", e);
        }
    }

    public synchronized AddResult addEvent(KillEvent event, EventSource source) {
        return store(event, source == null ? EventSource.LOCAL : source);
    }

    public synchronized AddResult upsert(KillEvent event) {
        return store(event, null);
    }

    public synchronized Optional<KillEvent> patchProfiles(String eventId, Map<String, ProfileData> profiles) {
        Optional<KillEvent> found = findById(eventId);
        if (found.isEmpty() || profiles.isEmpty()) return found;

        KillEvent event = found.get();
        ProfileData victim = firstProfile(event.getVictims(), profiles);
        ProfileData attacker = firstProfile(event.getKillers(), profiles);
        if (victim == null && attacker == null) return found;

        if (victim != null) event.setVictimProfile(victim);
        if (attacker != null) event.setAttackerProfile(attacker);
        return Optional.of(upsert(event).event());
    }

    public Optional<KillEvent> findById(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        try {
            return repository.findById(id)
                    .flatMap(this::deserialize)
                    .or(() -> mirror.get(id));
        } catch (DataAccessException e) {
            log.error("[EventStore] 조회 실패, 미러에서 검색: id={}", id, e);
            return mirror.get(id);
        }
    }

    public EventPage query(EventQuery query) {
        int limit = query.getLimit() <= 0
                ? properties.getDefaultPageSize()
                : Math.min(query.getLimit(), properties.getMaxPageSize());
        EventQuery normalized = query.toBuilder()
                .limit(limit)
                .offset(Math.max(0, query.getOffset()))
                .build();

        try {
            if (normalized.isUnfiltered() && normalized.getOffset() == 0 && mirror.size() >= limit) {
                long total = repository.count();
                return new EventPage(mirror.latest(limit), total, total > limit);
            }
            List<KillEvent> events = repository.search(normalized).stream()
                    .map(this::deserialize)
                    .flatMap(Optional::stream)
                    .toList();
            long total = repository.countMatching(normalized);
            return new EventPage(events, total, normalized.getOffset() + events.size() < total);
        } catch (DataAccessException e) {
            log.error("[EventStore] 조회 실패, 미러로 대체: playerOnly={}, q='{}'",
                    normalized.isPlayerOnly(), normalized.getSearchQuery(), e);
            return queryMirror(normalized);
        }
    }

    public StoreStats getStats() {
        Map<EventSource, Long> sources = new EnumMap<>(EventSource.class);
        for (Object[] row : repository.countBySource()) {
            if (row[0] instanceof EventSource source) {
                sources.put(source, ((Number) row[1]).longValue());
            }
        }
        return new StoreStats(
                repository.count(),
                repository.countByPlayerInvolvedTrue(),
                sources,
                repository.findOldestTimestamp(),
                repository.findNewestTimestamp());
    }

    public synchronized boolean deleteEvent(String id) {
        boolean persisted = repository.existsById(id);
        boolean mirrored = mirror.get(id).isPresent();
        if (!persisted && !mirrored) return false;

        if (persisted) {
            repository.deleteById(id);
        }
        log.info("[EventStore] 이벤트 삭제: id={}", id);
        notifyListeners(EventChange.removed(ChangeType.DELETED, id));
        return true;
    }

    public synchronized void clearAllEvents() {
        repository.deleteAllInBatch();
        log.info("[EventStore] 전체 이벤트 삭제");
        notifyListeners(EventChange.cleared());
    }

    public void subscribe(EventStoreListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(EventStoreListener listener) {
        if (listener != mirror) {
            listeners.remove(listener);
        }
    }

    private AddResult store(KillEvent event, EventSource source) {
        if (event == null || event.getId() == null || event.getId().isBlank()) {
            throw new IllegalArgumentException("event id is required");
        }
        KillEvent incoming = event.copy();
        incoming.setPlayerInvolved(isPlayerInvolved(incoming));

        int attempts = Math.max(0, properties.getWriteRetries()) + 1;
        DataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                AddResult result = write(incoming, source);
                if (result.isNew()) {
                    evictOverflow();
                }
                return result;
            } catch (DataAccessException e) {
                lastFailure = e;
                log.warn("[EventStore] 저장 실패 ({}/{}): id={}, cause={}",
                        attempt, attempts, incoming.getId(), e.getMessage());
            }
        }

        persistFailureCounter.increment();
        log.error("[EventStore] 저장 포기, 메모리 전용으로 유지: id={}", incoming.getId(), lastFailure);
        return keepInMemory(incoming, source == null ? EventSource.LOCAL : source);
    }

    private AddResult write(KillEvent incoming, EventSource source) {
        Optional<StoredEventRecord> sameId = repository.findById(incoming.getId());
        if (sameId.isPresent()) {
            StoredEventRecord row = sameId.get();
            KillEvent replaced = deserialize(row)
                    .map(existing -> EventMerger.replace(existing, incoming))
                    .orElse(incoming);
            EventSource newSource = source == null ? row.getSource() : EventSource.combine(row.getSource(), source);
            persist(row, replaced, newSource);
            updatedCounter.increment();
            log.debug("[EventStore] 이벤트 갱신: {}", replaced);
            notifyListeners(EventChange.updated(replaced, newSource, true));
            return new AddResult(false, replaced, true);
        }

        EventSource effectiveSource = source == null ? EventSource.LOCAL : source;
        long window = properties.getFingerprintWindowMs();
        Optional<StoredEventRecord> similar = repository
                .findFirstByFingerprintAndTimestampEpochMsBetweenOrderByTimestampEpochMsDesc(
                        EventFingerprint.of(incoming),
                        incoming.getTimestamp() - window,
                        incoming.getTimestamp() + window);
        Optional<KillEvent> similarEvent = similar.flatMap(this::deserialize);
        if (similar.isPresent() && similarEvent.isPresent()) {
            StoredEventRecord row = similar.get();
            KillEvent merged = EventMerger.merge(similarEvent.get(), incoming);
            merged.setPlayerInvolved(isPlayerInvolved(merged));
            EventSource newSource = EventSource.combine(row.getSource(), effectiveSource);
            persist(row, merged, newSource);
            fingerprintMergeCounter.increment();
            log.info("[EventStore] 지문 중복 병합: {} ← {}", row.getId(), incoming.getId());
            notifyListeners(EventChange.updated(merged, newSource, true));
            return new AddResult(false, merged, true);
        }

        StoredEventRecord row = StoredEventRecord.builder()
                .id(incoming.getId())
                .createdAtEpochMs(Instant.now().toEpochMilli())
                .build();
        persist(row, incoming, effectiveSource);
        insertedCounter.increment();
        log.debug("[EventStore] 이벤트 추가: {}", incoming);
        notifyListeners(EventChange.added(incoming, effectiveSource, true));
        return new AddResult(true, incoming, true);
    }

    private void persist(StoredEventRecord row, KillEvent event, EventSource source) {
        row.setTimestampEpochMs(event.getTimestamp());
        row.setEventData(serialize(event));
        row.setPlayerInvolved(event.isPlayerInvolved());
        row.setSource(source);
        row.setFingerprint(EventFingerprint.of(event));
        row.setSearchText(EventFingerprint.searchText(event, StoredEventRecord.SEARCH_TEXT_LENGTH));
        repository.save(row);
    }

    private void evictOverflow() {
        try {
            long overflow = repository.count() - properties.getMaxEvents();
            if (overflow <= 0) return;

            List<String> oldest = repository.findOldestIds(PageRequest.of(0, (int) overflow));
            repository.deleteAllByIdInBatch(oldest);
            evictedCounter.increment(oldest.size());
            log.debug("[EventStore] 보존 한도 초과 → {}건 제거", oldest.size());
            oldest.forEach(id -> notifyListeners(EventChange.removed(ChangeType.EVICTED, id)));
        } catch (DataAccessException e) {
            log.error("[EventStore] 오래된 이벤트 제거 실패", e);
        }
    }

    private AddResult keepInMemory(KillEvent incoming, EventSource source) {
        Optional<KillEvent> existing = mirror.get(incoming.getId());
        KillEvent kept = existing.map(e -> EventMerger.replace(e, incoming)).orElse(incoming);
        notifyListeners(existing.isPresent()
                ? EventChange.updated(kept, source, false)
                : EventChange.added(kept, source, false));
        return new AddResult(existing.isEmpty(), kept, false);
    }

    private EventPage queryMirror(EventQuery query) {
        List<String> terms = query.searchTerms();
        Predicate<KillEvent> filter = event -> !query.isPlayerOnly() || event.isPlayerInvolved();
        filter = filter.and(event -> query.getFromEpochMs() == null || event.getTimestamp() >= query.getFromEpochMs());
        filter = filter.and(event -> query.getToEpochMs() == null || event.getTimestamp() <= query.getToEpochMs());
        if (!terms.isEmpty()) {
            filter = filter.and(event -> {
                String text = EventFingerprint.searchText(event, StoredEventRecord.SEARCH_TEXT_LENGTH);
                return terms.stream().anyMatch(text::contains);
            });
        }

        List<KillEvent> matches = mirror.matching(filter);
        List<KillEvent> page = matches.stream()
                .skip(query.getOffset())
                .limit(query.getLimit())
                .toList();
        return new EventPage(page, matches.size(), query.getOffset() + page.size() < matches.size());
    }

    private boolean isPlayerInvolved(KillEvent event) {
        return event.involves(sessionContextTracker.currentPlayer());
    }

    private void notifyListeners(EventChange change) {
        for (EventStoreListener listener : listeners) {
            try {
                listener.onChange(change);
            } catch (RuntimeException e) {
                log.warn("[EventStore] 구독자 처리 실패: type={}, id={}", change.type(), change.eventId(), e);
            }
        }
    }

    private Optional<KillEvent> deserialize(StoredEventRecord row) {
        try {
            return Optional.of(objectMapper.readValue(row.getEventData(), KillEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("[EventStore] 이벤트 역직렬화 실패: id={}", row.getId(), e);
            return Optional.empty();
        }
    }

    private String serialize(KillEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("KillEvent 직렬화 실패: " + event.getId(), e);
        }
    }

    private static ProfileData firstProfile(List<String> names, Map<String, ProfileData> profiles) {
        for (String name : names) {
            ProfileData profile = profiles.get(name);
            if (profile != null && !profile.isDefault()) return profile;
        }
        return null;
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }
}
