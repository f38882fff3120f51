package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathType;
import com.killfeed.engine.domain.model.EventLocation;
import com.killfeed.engine.domain.model.EventSource;
import com.killfeed.engine.domain.model.GameMode;
import com.killfeed.engine.domain.model.IncidentKind;
import com.killfeed.engine.domain.model.KillEvent;
import com.killfeed.engine.domain.model.RawIncidentSignal;
import com.killfeed.engine.domain.service.enrichment.ProfileEnrichmentService;
import com.killfeed.engine.domain.service.entity.EntityNameResolver;
import com.killfeed.engine.domain.service.entity.ResolvedEntity;
import com.killfeed.engine.domain.service.store.AddResult;
import com.killfeed.engine.domain.service.store.EventStore;
import com.killfeed.engine.domain.service.zone.ZoneHistoryManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class CorrelationEngine implements IncidentSignalListener {

    static final String NPC_VEHICLE_TYPE = "NPC";
    static final String ON_FOOT = "Player";

    private final CorrelationProperties properties;
    private final DeathTypeClassifier deathTypeClassifier;
    private final EventDescriptionFormatter descriptionFormatter;
    private final EntityNameResolver entityNameResolver;
    private final ZoneHistoryManager zoneHistoryManager;
    private final EventStore eventStore;
    private final ProfileEnrichmentService enrichmentService;

    private final Counter attemptsCounter;
    private final Counter resolvedCounter;
    private final Counter missesCounter;

    private final List<OpenPlaceholder> openPlaceholders = new ArrayList<>();
    private final List<RecentDeath> recentDeaths = new ArrayList<>();
    private final Map<String, String> resolvedVictims = new HashMap<>();

    public CorrelationEngine(CorrelationProperties properties,
                             DeathTypeClassifier deathTypeClassifier,
                             EventDescriptionFormatter descriptionFormatter,
                             EntityNameResolver entityNameResolver,
                             ZoneHistoryManager zoneHistoryManager,
                             EventStore eventStore,
                             ProfileEnrichmentService enrichmentService,
                             MeterRegistry meterRegistry) {
        this.properties = properties;
        this.deathTypeClassifier = deathTypeClassifier;
        this.descriptionFormatter = descriptionFormatter;
        this.entityNameResolver = entityNameResolver;
        this.zoneHistoryManager = zoneHistoryManager;
        this.eventStore = eventStore;
        this.enrichmentService = enrichmentService;
        this.attemptsCounter = Counter.builder("killfeed.correlation.attempts")
                .description("Player deaths checked against open placeholder events")
                .register(meterRegistry);
        this.resolvedCounter = Counter.builder("killfeed.correlation.resolved")
                .description("Placeholder victims replaced by a confirmed player")
                .register(meterRegistry);
        this.missesCounter = Counter.builder("killfeed.correlation.misses")
                .description("Player deaths without a matching placeholder event")
                .register(meterRegistry);
    }

    @Override
    public void onSignal(RawIncidentSignal signal) {
        resolve(signal);
    }

    public synchronized Optional<KillEvent> resolve(RawIncidentSignal signal) {
        if (signal == null || signal.getKind() == null) return Optional.empty();
        pruneExpired(signal.getTimestamp());

        if (signal.getKind() == IncidentKind.PLAYER_DEATH) {
            return correlateDeath(signal);
        }
        return Optional.of(createEvent(signal));
    }

    @Override
    public synchronized void onSessionReset() {
        openPlaceholders.clear();
        recentDeaths.clear();
        resolvedVictims.clear();
        zoneHistoryManager.clearHistory();
        log.info("[Correlation] 세션 초기화: 상관 캐시 및 구역 이력 삭제");
    }

    public synchronized int openPlaceholderCount() {
        return openPlaceholders.size();
    }

    private KillEvent createEvent(RawIncidentSignal signal) {
        KillEvent event = buildEvent(signal);
        boolean placeholder = signal.getKind() == IncidentKind.VEHICLE_DESTRUCTION && signal.isPlaceholderVictim();

        String confirmed = placeholder ? resolvedVictims.get(event.getId()) : null;
        if (confirmed != null) {
            event.setVictims(new ArrayList<>(List.of(confirmed)));
            event.setEventDescription(describe(event));
            placeholder = false;
        }

        AddResult result = eventStore.addEvent(event, EventSource.LOCAL);
        KillEvent stored = result.event();
        logStored(stored, result.isNew());

        if (placeholder) {
            OpenPlaceholder open = new OpenPlaceholder(stored.getId(), stored.getTimestamp());
            openPlaceholders.removeIf(p -> p.eventId().equals(open.eventId()));
            openPlaceholders.add(open);

            if (properties.isReverseOrderEnabled()) {
                Optional<RecentDeath> earlierDeath = closestUnconsumedDeath(open.timestamp());
                if (earlierDeath.isPresent()) {
                    earlierDeath.get().consumed = true;
                    log.debug("[Correlation] 선행 사망 기록으로 해소 시도: player={}, id={}",
                            earlierDeath.get().playerName, open.eventId());
                    return applyDeath(open, earlierDeath.get().playerName).orElse(stored);
                }
            }
        }

        enrichmentService.enrich(stored);
        return stored;
    }

    private Optional<KillEvent> correlateDeath(RawIncidentSignal signal) {
        String player = signal.getVictims().isEmpty() ? signal.getPlayerName() : signal.getVictims().get(0);
        if (player == null || player.isBlank()) return Optional.empty();

        attemptsCounter.increment();
        long ts = signal.getTimestamp();
        Optional<OpenPlaceholder> match = openPlaceholders.stream()
                .filter(p -> Math.abs(ts - p.timestamp()) < properties.getDestructionDeathWindowMs())
                .min(Comparator.comparingLong(p -> Math.abs(ts - p.timestamp())));

        if (match.isEmpty()) {
            recentDeaths.add(new RecentDeath(player, ts));
            missesCounter.increment();
            log.debug("[Correlation] 대응하는 파괴 이벤트 없음: player={}, ts={}", player, ts);
            return Optional.empty();
        }
        return applyDeath(match.get(), player);
    }

    private Optional<KillEvent> applyDeath(OpenPlaceholder placeholder, String player) {
        openPlaceholders.remove(placeholder);

        Optional<KillEvent> found = eventStore.findById(placeholder.eventId());
        if (found.isEmpty()) {
            missesCounter.increment();
            log.debug("[Correlation] 플레이스홀더 이벤트가 저장소에 없음: id={}", placeholder.eventId());
            return Optional.empty();
        }

        KillEvent event = found.get();
        if (!EventDescriptionFormatter.isPlaceholderVictim(event.getVictims(), event.getVehicleModel())) {
            log.debug("[Correlation] 이미 해소된 이벤트: id={}, victims={}", event.getId(), event.getVictims());
            return Optional.empty();
        }

        String previousVictim = event.getVictims().get(0);
        event.setVictims(new ArrayList<>(List.of(player)));
        event.setEventDescription(describe(event));

        KillEvent updated = eventStore.upsert(event).event();
        resolvedVictims.put(updated.getId(), player);
        resolvedCounter.increment();
        log.info("[Correlation] 플레이스홀더 해소: id={}, {} → {}, desc='{}'",
                updated.getId(), previousVictim, player, updated.getEventDescription());

        enrichmentService.enrich(updated);
        return Optional.of(updated);
    }

    private KillEvent buildEvent(RawIncidentSignal signal) {
        long ts = signal.getTimestamp();
        DeathType deathType = deathTypeClassifier.classify(
                signal.getDestructionLevel(), signal.getDamageType(), signal.getCauser(), signal.getDriver());

        String vehicleModel;
        String vehicleType;
        if (signal.getKind() == IncidentKind.VEHICLE_DESTRUCTION) {
            vehicleModel = signal.getVehicleModel();
            ResolvedEntity vehicle = entityNameResolver.resolve(vehicleModel);
            vehicleType = vehicle.npc() ? NPC_VEHICLE_TYPE : vehicle.displayName();
        } else {
            vehicleModel = ON_FOOT;
            String victim = signal.getVictims().isEmpty() ? null : signal.getVictims().get(0);
            vehicleType = victim != null && entityNameResolver.isNpc(victim) ? NPC_VEHICLE_TYPE : ON_FOOT;
        }

        EventLocation location = zoneHistoryManager.resolveEventLocation(
                signal.getLocationToken(), sourceTag(signal.getKind()), signal.getCoordinates(), ts,
                signal.isLocationFallback());

        KillEvent event = KillEvent.builder()
                .id(signal.getIncidentId())
                .timestamp(ts)
                .killers(new ArrayList<>(signal.getKillers()))
                .victims(new ArrayList<>(signal.getVictims()))
                .deathType(deathType)
                .destructionLevel(signal.getDestructionLevel())
                .vehicleType(vehicleType)
                .vehicleModel(vehicleModel)
                .vehicleId(signal.getVehicleId())
                .location(signal.getLocationToken())
                .locationInfo(location)
                .weapon(signal.getWeapon())
                .damageType(signal.getDamageType())
                .gameMode(signal.getGameMode() != null ? signal.getGameMode() : GameMode.UNKNOWN)
                .gameVersion(signal.getGameVersion())
                .coordinates(signal.getCoordinates())
                .playerShip(signal.getPlayerShip())
                .playerName(signal.getPlayerName())
                .build();
        event.setEventDescription(describe(event));
        return event;
    }

    private String describe(KillEvent event) {
        return descriptionFormatter.format(
                event.getKillers(), event.getVictims(), event.getVehicleModel(), event.getDeathType());
    }

    private Optional<RecentDeath> closestUnconsumedDeath(long timestamp) {
        return recentDeaths.stream()
                .filter(d -> !d.consumed)
                .filter(d -> Math.abs(timestamp - d.timestamp) < properties.getDestructionDeathWindowMs())
                .min(Comparator.comparingLong(d -> Math.abs(timestamp - d.timestamp)));
    }

    private void pruneExpired(long now) {
        long retention = properties.getRecentDeathRetentionMs();
        recentDeaths.removeIf(d -> d.consumed || now - d.timestamp > retention);
        openPlaceholders.removeIf(p -> now - p.timestamp() > retention);
    }

    private void logStored(KillEvent event, boolean isNew) {
        if (event.getDeathType() != null && event.getDeathType().isSignificant()) {
            log.info("[Correlation] 이벤트 {}: {} (id={}, involved={})",
                    isNew ? "추가" : "갱신", event.getEventDescription(), event.getId(), event.isPlayerInvolved());
        } else {
            log.debug("[Correlation] 이벤트 {}: {} (id={})",
                    isNew ? "추가" : "갱신", event.getEventDescription(), event.getId());
        }
    }

    private static String sourceTag(IncidentKind kind) {
        return switch (kind) {
            case VEHICLE_DESTRUCTION -> "vehicle_destruction";
            case ACTOR_DEATH -> "actor_death";
            case ENVIRONMENT_DEATH -> "environmental_death";
            case PLAYER_DEATH -> "player_death";
        };
    }

    private record OpenPlaceholder(String eventId, long timestamp) {
    }

    private static final class RecentDeath {
        private final String playerName;
        private final long timestamp;
        private boolean consumed;

        private RecentDeath(String playerName, long timestamp) {
            this.playerName = playerName;
            this.timestamp = timestamp;
        }
    }
}
