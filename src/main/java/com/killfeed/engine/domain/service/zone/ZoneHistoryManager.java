package com.killfeed.engine.domain.service.zone;

import com.killfeed.engine.domain.model.Coordinates;
import com.killfeed.engine.domain.model.EventLocation;
import com.killfeed.engine.domain.model.PrimaryZone;
import com.killfeed.engine.domain.model.SecondaryZone;
import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.Zone;
import com.killfeed.engine.domain.model.ZoneClassification;
import com.killfeed.engine.domain.model.ZoneHistoryEntry;
import com.killfeed.engine.domain.model.ZoneResolution;
import com.killfeed.engine.domain.model.ZoneStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class ZoneHistoryManager {

    private static final int MOST_VISITED_LIMIT = 10;

    private final ZoneResolver zoneResolver;
    private final ZoneProperties properties;

    private final Deque<ZoneHistoryEntry> history = new ArrayDeque<>();
    private ZoneResolution currentZone;
    private PrimaryZone lastPrimaryZone;
    private StarSystem currentSystem = StarSystem.UNKNOWN;
    private long totalZoneChanges;
    private long sessionStartEpochMs = System.currentTimeMillis();

    public ZoneHistoryManager(ZoneResolver zoneResolver, ZoneProperties properties) {
        this.zoneResolver = zoneResolver;
        this.properties = properties;
    }

    public synchronized ZoneResolution addZoneToHistory(String token, String source, Coordinates coordinates,
                                                        Long timestamp) {
        ZoneResolution resolution = zoneResolver.resolveZone(token, coordinates);
        long ts = timestamp != null ? timestamp : System.currentTimeMillis();

        ZoneHistoryEntry last = history.peekLast();
        if (last != null && last.getZoneId().equals(resolution.zone().getId())) {
            return resolution;
        }

        if (last != null) {
            last.setDwellTimeMs(Math.max(0L, ts - last.getTimestamp()));
        }

        Zone zone = resolution.zone();
        history.addLast(ZoneHistoryEntry.builder()
                .timestamp(ts)
                .zoneId(zone.getId())
                .zoneName(zone.getDisplayName())
                .classification(zone.getClassification())
                .system(zone.getSystem())
                .source(source)
                .coordinates(coordinates)
                .build());

        currentZone = resolution;
        totalZoneChanges++;
        if (zone.getSystem() != StarSystem.UNKNOWN) {
            currentSystem = zone.getSystem();
        }
        if (zone instanceof PrimaryZone primary) {
            lastPrimaryZone = primary;
        }

        while (history.size() > properties.getHistorySize()) {
            history.pollFirst();
        }

        log.info("[Zone] 이동: {} ({}, {}){}", zone.getDisplayName(), zone.getClassification(), zone.getSystem(),
                last == null ? " (최초)" : " (from " + last.getZoneName() + ")");
        return resolution;
    }

    public synchronized Optional<PrimaryZone> matchSecondaryToPrimary(SecondaryZone secondary) {
        return secondary == null ? Optional.empty() : matchSecondaryToPrimary(secondary, secondary.getCoordinates());
    }

    private Optional<PrimaryZone> matchSecondaryToPrimary(SecondaryZone secondary, Coordinates coordinates) {

        if (secondary.getPrimaryZoneId() != null) {
            Zone direct = zoneResolver.resolveZone(secondary.getPrimaryZoneId()).zone();
            if (direct instanceof PrimaryZone primary) {
                return Optional.of(primary);
            }
        }

        Optional<PrimaryZone> fromHistory = findLastPrimaryZone(secondary.getSystem());
        if (fromHistory.isPresent()) {
            return fromHistory;
        }

        if (coordinates != null) {
            Optional<PrimaryZone> nearby = findNearbyPrimaryZone(coordinates, secondary.getSystem());
            if (nearby.isPresent()) {
                return nearby;
            }
        }

        String defaultId = secondary.getSystem().getDefaultPrimaryZoneId();
        if (defaultId != null) {
            Zone systemDefault = zoneResolver.resolveZone(defaultId).zone();
            if (systemDefault instanceof PrimaryZone primary) {
                return Optional.of(primary);
            }
        }

        log.debug("[Zone] primary 매칭 실패: {}", secondary.getDisplayName());
        return Optional.empty();
    }

    public synchronized EventLocation resolveEventLocation(String token, String source, Coordinates coordinates,
                                                           long timestamp, boolean inherited) {
        ZoneResolution resolution;
        if (token == null || token.isBlank() || ZoneResolver.FALLBACK_ZONE_NAME.equals(token)) {
            resolution = zoneResolver.fallback();
        } else if (inherited) {
            resolution = zoneResolver.resolveZone(token, coordinates);
        } else {
            resolution = addZoneToHistory(token, source, coordinates, timestamp);
        }

        Zone zone = resolution.zone();
        EventLocation.EventLocationBuilder location = EventLocation.builder()
                .zoneId(zone.getId())
                .displayName(zone.getDisplayName())
                .classification(zone.getClassification())
                .system(zone.getSystem())
                .confidence(resolution.confidence())
                .matchMethod(resolution.matchMethod())
                .fallback(resolution.fallbackUsed());

        if (zone instanceof SecondaryZone secondary && !resolution.fallbackUsed()) {
            matchSecondaryToPrimary(secondary, coordinates != null ? coordinates : secondary.getCoordinates()).ifPresent(primary -> location
                    .primaryZoneId(primary.getId())
                    .primaryZoneName(primary.getDisplayName()));
        } else if (zone instanceof PrimaryZone primary) {
            location.primaryZoneId(primary.getId()).primaryZoneName(primary.getDisplayName());
        }

        if (!resolution.fallbackUsed()) {
            recordEventInCurrentZone();
        }
        return location.build();
    }

    public synchronized void recordEventInCurrentZone() {
        ZoneHistoryEntry last = history.peekLast();
        if (last != null) {
            last.setEventCount(last.getEventCount() + 1);
        }
    }

    public synchronized StarSystem getCurrentSystem() {
        if (currentZone != null && currentZone.zone().getSystem() != StarSystem.UNKNOWN) {
            return currentZone.zone().getSystem();
        }
        if (currentSystem != StarSystem.UNKNOWN) {
            return currentSystem;
        }
        Iterator<ZoneHistoryEntry> it = history.descendingIterator();
        while (it.hasNext()) {
            ZoneHistoryEntry entry = it.next();
            if (entry.getSystem() != StarSystem.UNKNOWN) return entry.getSystem();
        }
        return StarSystem.UNKNOWN;
    }

    public synchronized Optional<ZoneResolution> getCurrentZone() {
        return Optional.ofNullable(currentZone);
    }

    public synchronized List<ZoneHistoryEntry> getHistory(HistoryFilter filter) {
        HistoryFilter f = filter == null ? HistoryFilter.none() : filter;
        List<ZoneHistoryEntry> result = new ArrayList<>();
        for (ZoneHistoryEntry entry : history) {
            if (f.classification() != null && entry.getClassification() != f.classification()) continue;
            if (f.system() != null && entry.getSystem() != f.system()) continue;
            if (f.sinceEpochMs() != null && entry.getTimestamp() < f.sinceEpochMs()) continue;
            result.add(entry.toBuilder().build());
        }
        if (f.limit() != null && f.limit() > 0 && result.size() > f.limit()) {
            return new ArrayList<>(result.subList(result.size() - f.limit(), result.size()));
        }
        return result;
    }

    public synchronized ZoneStatistics getZoneStatistics() {
        Map<String, int[]> visits = new LinkedHashMap<>();
        Map<String, Long> visitTime = new LinkedHashMap<>();
        Map<StarSystem, Long> systems = new EnumMap<>(StarSystem.class);
        Map<ZoneClassification, Long> classifications = new EnumMap<>(ZoneClassification.class);
        for (StarSystem s : StarSystem.values()) systems.put(s, 0L);

        long totalDwell = 0;
        int dwellCount = 0;
        for (ZoneHistoryEntry entry : history) {
            visits.computeIfAbsent(entry.getZoneName(), k -> new int[1])[0]++;
            if (entry.getDwellTimeMs() > 0) {
                visitTime.merge(entry.getZoneName(), entry.getDwellTimeMs(), Long::sum);
                totalDwell += entry.getDwellTimeMs();
                dwellCount++;
            }
            systems.merge(entry.getSystem(), 1L, Long::sum);
            classifications.merge(entry.getClassification(), 1L, Long::sum);
        }

        List<ZoneStatistics.ZoneVisit> mostVisited = visits.entrySet().stream()
                .map(e -> new ZoneStatistics.ZoneVisit(e.getKey(), e.getValue()[0],
                        visitTime.getOrDefault(e.getKey(), 0L)))
                .sorted(Comparator.comparingInt(ZoneStatistics.ZoneVisit::visits).reversed())
                .limit(MOST_VISITED_LIMIT)
                .toList();

        return new ZoneStatistics(totalZoneChanges, sessionStartEpochMs,
                dwellCount > 0 ? (double) totalDwell / dwellCount : 0.0,
                mostVisited, systems, classifications);
    }

    public synchronized void clearHistory() {
        history.clear();
        currentZone = null;
        lastPrimaryZone = null;
        currentSystem = StarSystem.UNKNOWN;
        totalZoneChanges = 0;
        sessionStartEpochMs = System.currentTimeMillis();
        log.info("[Zone] 이력 초기화");
    }

    private Optional<PrimaryZone> findLastPrimaryZone(StarSystem system) {
        if (lastPrimaryZone != null && lastPrimaryZone.getSystem() == system) {
            return Optional.of(lastPrimaryZone);
        }
        return Optional.empty();
    }

    private Optional<PrimaryZone> findNearbyPrimaryZone(Coordinates coordinates, StarSystem system) {
        ZoneHistoryEntry nearest = null;
        double nearestDistance = Double.MAX_VALUE;
        for (ZoneHistoryEntry entry : history) {
            if (entry.getClassification() != ZoneClassification.PRIMARY
                    || entry.getSystem() != system
                    || entry.getCoordinates() == null) {
                continue;
            }
            double distance = coordinates.distanceTo(entry.getCoordinates());
            if (distance <= properties.getProximityRadius() && distance < nearestDistance) {
                nearest = entry;
                nearestDistance = distance;
            }
        }
        if (nearest == null) return Optional.empty();
        Zone zone = zoneResolver.resolveZone(nearest.getZoneId()).zone();
        return zone instanceof PrimaryZone primary ? Optional.of(primary) : Optional.empty();
    }
}
