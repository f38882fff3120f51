package com.killfeed.engine.domain.service.zone;

import com.killfeed.engine.domain.model.Coordinates;
import com.killfeed.engine.domain.model.MatchMethod;
import com.killfeed.engine.domain.model.PrimaryZone;
import com.killfeed.engine.domain.model.PrimaryZoneType;
import com.killfeed.engine.domain.model.SecondaryZone;
import com.killfeed.engine.domain.model.SecondaryZoneType;
import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.Zone;
import com.killfeed.engine.domain.model.ZoneClassification;
import com.killfeed.engine.domain.model.ZoneKnowledgeSource;
import com.killfeed.engine.domain.model.ZoneResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class ZoneResolver {

    public static final String FALLBACK_ZONE_ID = "unknown";
    public static final String FALLBACK_ZONE_NAME = "Unknown";

    private static final double PRIMARY_PATTERN_CONFIDENCE = 0.8;
    private static final double SECONDARY_PATTERN_CONFIDENCE = 0.6;
    private static final Pattern STANTON_BODY_INDEX = Pattern.compile("^OOC_Stanton_(\\d)");
    private static final Pattern STANTON_PLANET = Pattern.compile("^OOC_Stanton_\\d+$");

    private final ZoneClassifier classifier;
    private final ZoneProperties properties;

    private final Map<String, Zone> zones = new ConcurrentHashMap<>();
    private volatile String version = "1.0.0";
    private volatile ZoneKnowledgeSource source = ZoneKnowledgeSource.LOCAL;
    private volatile long lastUpdatedEpochMs = System.currentTimeMillis();

    public ZoneResolver(ZoneClassifier classifier, ZoneProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
        seedKnownZones();
    }

    public ZoneResolution resolveZone(String token) {
        return resolveZone(token, null);
    }

    public ZoneResolution resolveZone(String token, Coordinates coordinates) {
        if (token == null || token.isBlank()) {
            return fallback();
        }

        try {
            String cleanId = classifier.cleanZoneId(token);
            if (cleanId.isEmpty()) {
                return fallback();
            }

            Zone exact = zones.get(cleanId);
            if (exact != null) {
                return new ZoneResolution(exact, 1.0, MatchMethod.EXACT, false, System.currentTimeMillis());
            }

            StarSystem system = classifier.determineSystem(cleanId);
            Zone guessed = classifier.classify(cleanId) == ZoneClassification.PRIMARY
                    ? buildPrimary(cleanId, system, coordinates)
                    : buildSecondary(cleanId, system, coordinates);

            if (guessed.getConfidence() >= properties.getConfidenceThreshold()) {
                zones.putIfAbsent(cleanId, guessed);
            }

            log.debug("[Zone] 패턴 해석: token={}, zone={}, confidence={}", token, guessed, guessed.getConfidence());
            return new ZoneResolution(guessed, guessed.getConfidence(), MatchMethod.PATTERN, false,
                    System.currentTimeMillis());

        } catch (RuntimeException e) {
            log.warn("[Zone] 해석 실패, fallback 사용: token={}", token, e);
            return fallback();
        }
    }

    public synchronized void updateKnowledgeBase(Collection<Zone> incoming, String newVersion,
                                                 ZoneKnowledgeSource newSource, boolean replace) {
        if (incoming == null) {
            throw new IllegalArgumentException("zone list is required");
        }
        if (replace) {
            zones.clear();
        }
        int applied = 0;
        for (Zone zone : incoming) {
            if (zone == null || zone.getId() == null || zone.getId().isBlank()) continue;
            zones.put(zone.getId(), zone);
            applied++;
        }
        version = newVersion == null ? version : newVersion;
        source = newSource == null ? ZoneKnowledgeSource.SERVER : newSource;
        lastUpdatedEpochMs = System.currentTimeMillis();

        log.info("[Zone] 지식 베이스 갱신: applied={}, total={}, version={}, source={}, replace={}",
                applied, zones.size(), version, source, replace);
    }

    public synchronized void resetToSeed() {
        zones.clear();
        seedKnownZones();
        version = "1.0.0";
        source = ZoneKnowledgeSource.LOCAL;
        lastUpdatedEpochMs = System.currentTimeMillis();
    }

    public List<Zone> searchZones(String query) {
        if (query == null || query.isBlank()) return List.of();
        String term = query.toLowerCase(Locale.ROOT);
        return zones.values().stream()
                .filter(z -> z.getId().toLowerCase(Locale.ROOT).contains(term)
                        || (z.getDisplayName() != null && z.getDisplayName().toLowerCase(Locale.ROOT).contains(term)))
                .sorted(Comparator.comparing(Zone::getDisplayName, Comparator.nullsLast(String::compareTo)))
                .toList();
    }

    public List<Zone> getZonesByClassification(ZoneClassification classification, StarSystem system) {
        return zones.values().stream()
                .filter(z -> z.getClassification() == classification)
                .filter(z -> system == null || z.getSystem() == system)
                .sorted(Comparator.comparing(Zone::getDisplayName, Comparator.nullsLast(String::compareTo)))
                .toList();
    }

    public ZoneDatabaseStats getDatabaseStats() {
        Map<StarSystem, Long> bySystem = new EnumMap<>(StarSystem.class);
        for (StarSystem s : StarSystem.values()) {
            bySystem.put(s, 0L);
        }
        long primary = 0;
        long secondary = 0;
        for (Zone zone : zones.values()) {
            if (zone.isPrimary()) primary++;
            else secondary++;
            bySystem.merge(zone.getSystem(), 1L, Long::sum);
        }
        return new ZoneDatabaseStats(zones.size(), primary, secondary, bySystem, lastUpdatedEpochMs, version, source);
    }

    public ZoneResolution fallback() {
        SecondaryZone zone = SecondaryZone.builder()
                .id(FALLBACK_ZONE_ID)
                .displayName(FALLBACK_ZONE_NAME)
                .system(StarSystem.UNKNOWN)
                .type(SecondaryZoneType.POI)
                .confidence(0.0)
                .build();
        return new ZoneResolution(zone, 0.0, MatchMethod.FALLBACK, true, System.currentTimeMillis());
    }

    private PrimaryZone buildPrimary(String cleanId, StarSystem system, Coordinates coordinates) {
        return PrimaryZone.builder()
                .id(cleanId)
                .displayName(classifier.generateDisplayName(cleanId))
                .system(system)
                .coordinates(coordinates)
                .confidence(PRIMARY_PATTERN_CONFIDENCE)
                .type(classifier.determinePrimaryType(cleanId))
                .parentId(classifier.deriveParentZoneId(cleanId).orElse(null))
                .childIds(findChildZoneIds(cleanId))
                .jurisdiction(determineJurisdiction(cleanId, system))
                .build();
    }

    private SecondaryZone buildSecondary(String cleanId, StarSystem system, Coordinates coordinates) {
        SecondaryZoneType type = classifier.determineSecondaryType(cleanId);
        String primaryId = classifier.derivePrimaryZoneId(cleanId).orElse(null);
        return SecondaryZone.builder()
                .id(cleanId)
                .displayName(classifier.generateDisplayName(cleanId))
                .system(system)
                .coordinates(coordinates)
                .confidence(SECONDARY_PATTERN_CONFIDENCE)
                .type(type)
                .primaryZoneId(primaryId)
                .orbitingBody(primaryId == null ? null : classifier.generateDisplayName(primaryId))
                .purpose(determinePurpose(cleanId, type))
                .build();
    }

    private List<String> findChildZoneIds(String cleanId) {
        List<String> children = new ArrayList<>();
        if ("OOC_Stanton".equals(cleanId)) {
            children.addAll(List.of("OOC_Stanton_1", "OOC_Stanton_2", "OOC_Stanton_3", "OOC_Stanton_4"));
        } else if (STANTON_PLANET.matcher(cleanId).matches()) {
            children.addAll(List.of(cleanId + "a", cleanId + "b", cleanId + "c"));
        }
        return children;
    }

    private String determineJurisdiction(String cleanId, StarSystem system) {
        if (system == StarSystem.STANTON) {
            Matcher m = STANTON_BODY_INDEX.matcher(cleanId);
            if (m.find()) {
                return switch (m.group(1)) {
                    case "1" -> "Hurston Dynamics";
                    case "2" -> "Crusader Industries";
                    case "3" -> "ArcCorp";
                    case "4" -> "Microtech Corporation";
                    default -> "UEE";
                };
            }
        }
        return "UEE";
    }

    private String determinePurpose(String cleanId, SecondaryZoneType type) {
        String lower = cleanId.toLowerCase(Locale.ROOT);
        if (lower.contains("mining")) return "Mining Operations";
        if (lower.contains("research")) return "Research Facility";
        if (lower.contains("security")) return "Security Operations";
        if (lower.contains("medical")) return "Medical Facility";
        if (lower.contains("commercial")) return "Commercial Hub";
        if (type == SecondaryZoneType.LANDING_ZONE) return "Urban Center";
        if (type == SecondaryZoneType.STATION) return "Orbital Platform";
        return null;
    }

    private void seedKnownZones() {
        List<Zone> seed = List.of(
                primary("OOC_Stanton", "Stanton System", PrimaryZoneType.SYSTEM, null, "UEE"),
                primary("OOC_Stanton_1", "Hurston", PrimaryZoneType.PLANET, "OOC_Stanton", "Hurston Dynamics"),
                primary("OOC_Stanton_2", "Crusader", PrimaryZoneType.PLANET, "OOC_Stanton", "Crusader Industries"),
                primary("OOC_Stanton_3", "ArcCorp", PrimaryZoneType.PLANET, "OOC_Stanton", "ArcCorp"),
                primary("OOC_Stanton_4", "microTech", PrimaryZoneType.PLANET, "OOC_Stanton", "Microtech Corporation"),
                primary("OOC_Stanton_1a", "Arial", PrimaryZoneType.MOON, "OOC_Stanton_1", "Hurston Dynamics"),
                primary("OOC_Stanton_1b", "Aberdeen", PrimaryZoneType.MOON, "OOC_Stanton_1", "Hurston Dynamics"),
                primary("OOC_Stanton_2c", "Yela", PrimaryZoneType.MOON, "OOC_Stanton_2", "Crusader Industries"),
                secondary("PortOlisar", "Port Olisar", SecondaryZoneType.STATION, "OOC_Stanton_2", "Crusader",
                        "Orbital Platform"),
                secondary("GrimHex", "GrimHEX", SecondaryZoneType.STATION, "OOC_Stanton_2c", "Yela", "Outlaw Base"),
                secondary("Lorville", "Lorville", SecondaryZoneType.LANDING_ZONE, "OOC_Stanton_1", "Hurston",
                        "Urban Center"),
                secondary("Area18", "Area18", SecondaryZoneType.LANDING_ZONE, "OOC_Stanton_3", "ArcCorp",
                        "Urban Center")
        );
        for (Zone zone : seed) {
            zones.put(zone.getId(), zone);
        }
        log.info("[Zone] 기본 zone {}개 등록", zones.size());
    }

    private PrimaryZone primary(String id, String name, PrimaryZoneType type, String parentId, String jurisdiction) {
        return PrimaryZone.builder()
                .id(id)
                .displayName(name)
                .system(StarSystem.STANTON)
                .confidence(1.0)
                .type(type)
                .parentId(parentId)
                .childIds(findChildZoneIds(id))
                .jurisdiction(jurisdiction)
                .build();
    }

    private SecondaryZone secondary(String id, String name, SecondaryZoneType type, String primaryId,
                                    String orbitingBody, String purpose) {
        return SecondaryZone.builder()
                .id(id)
                .displayName(name)
                .system(StarSystem.STANTON)
                .confidence(1.0)
                .type(type)
                .primaryZoneId(primaryId)
                .orbitingBody(orbitingBody)
                .purpose(purpose)
                .build();
    }
}
