package com.killfeed.engine.domain.service.session;

import com.killfeed.engine.domain.model.GameMode;
import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.model.SessionEventType;
import com.killfeed.engine.domain.service.zone.ZoneClassifier;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class SessionContextTracker {

    private static final Set<String> MANUFACTURER_PREFIXES = Set.of(
            "ORIG", "CRUS", "RSI", "AEGS", "VNCL", "DRAK", "ANVL", "BANU", "MISC",
            "CNOU", "XIAN", "GAMA", "TMBL", "ESPR", "KRIG", "GRIN", "XNAA", "MRAI");

    private static final Pattern VEHICLE_INSTANCE_SUFFIX = Pattern.compile("^(.+?)_\\d+$");

    private final SessionProperties properties;
    private final LastKnownUserStore lastKnownUserStore;
    private final ZoneClassifier zoneClassifier;
    private final SessionContext context;
    private final ScheduledExecutorService debounceScheduler;
    private final List<SessionRule> rules;
    private final List<Consumer<SessionEvent>> listeners = new CopyOnWriteArrayList<>();

    private ScheduledFuture<?> pendingPromotion;

    public SessionContextTracker(SessionProperties properties, LastKnownUserStore lastKnownUserStore,
                                 ZoneClassifier zoneClassifier) {
        this.properties = properties;
        this.lastKnownUserStore = lastKnownUserStore;
        this.zoneClassifier = zoneClassifier;
        this.context = new SessionContext(properties.getLocationHistorySize());
        this.debounceScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "session-debounce");
            thread.setDaemon(true);
            return thread;
        });
        this.rules = List.of(
                new SessionRule("login", Pattern.compile(
                        "<AccountLoginCharacterStatus_Character>.*?name\\s+(\\S+)\\s+-"), this::onLogin),
                new SessionRule("login-legacy", Pattern.compile(
                        "<Legacy login response>.*?Handle\\[([A-Za-z0-9_-]+)\\]"), this::onLogin),
                new SessionRule("system-quit", Pattern.compile(
                        "<SystemQuit>|System Fast Shutdown", Pattern.CASE_INSENSITIVE), this::onSystemQuit),
                new SessionRule("mode-pu", Pattern.compile(
                        "Loading GameModeRecord='SC_Default'"), (m, line) -> onExplicitMode(GameMode.PU, line)),
                new SessionRule("mode-ac", Pattern.compile(
                        "Loading GameModeRecord='EA_[^']*'"), (m, line) -> onExplicitMode(GameMode.AC, line)),
                new SessionRule("mode-frontend", Pattern.compile(
                        "Requesting game mode Frontend_Main/SC_Frontend|Loading screen for Frontend_Main : SC_Frontend closed"),
                        (m, line) -> onExplicitMode(GameMode.UNKNOWN, line)),
                new SessionRule("mode-hint", Pattern.compile(
                        "<Context Establisher Done>.*?gamerules=\"(?<rules>[^\"]+)\""), this::onModeHint),
                new SessionRule("version", Pattern.compile(
                        "--system-trace-env-id='pub-sc-alpha-(?<build>\\d{3,4}-\\d{7})'"), this::onVersion),
                new SessionRule("loadout", Pattern.compile(
                        "\\[InstancedInterior\\] OnEntityLeaveZone - InstancedInterior \\[(?<interior>[^\\]]+)\\] \\[\\d+\\] "
                                + "-> Entity \\[(?<entity>[^\\]]+)\\] \\[\\d+\\] --.*?m_ownerGEID\\[(?<owner>[^\\[\\]]+)\\]"),
                        this::onLoadout),
                new SessionRule("session-start", Pattern.compile(
                        "<(?<ts>[^>]+)>.*?Starting new game session"), this::onSessionStart)
        );
        context.reset(lastKnownUserStore.load().orElse(null));
    }

    public void observeLine(String line) {
        observe(line);
    }

    public synchronized Optional<SessionEvent> observe(String line) {
        if (line == null || line.isEmpty()) return Optional.empty();
        for (SessionRule rule : rules) {
            Matcher matcher = rule.pattern().matcher(line);
            if (matcher.find()) {
                Optional<SessionEvent> event = rule.handler().apply(matcher, line);
                if (event.isPresent()) {
                    return event;
                }
            }
        }
        return Optional.empty();
    }

    public synchronized void observeRawMode(GameMode mode) {
        context.setRawMode(mode);
        cancelPendingPromotion();

        if (mode == context.getStableMode()) {
            return;
        }

        context.setPendingMode(mode);
        pendingPromotion = debounceScheduler.schedule(
                () -> promote(mode), properties.getModeDebounceMs(), TimeUnit.MILLISECONDS);
        log.debug("[Session] 모드 관측: raw={}, stable={}, {}ms 후 확정 예정",
                mode, context.getStableMode(), properties.getModeDebounceMs());
    }

    public synchronized void setStableModeImmediately(GameMode mode) {
        cancelPendingPromotion();
        context.setRawMode(mode);
        changeStableMode(mode);
    }

    public synchronized void setPlayer(String playerName) {
        if (playerName == null || playerName.isBlank()) return;
        String previous = context.getPlayerName();
        context.setPlayerName(playerName);
        lastKnownUserStore.save(playerName);
        if (!playerName.equals(previous)) {
            log.info("[Session] 플레이어 로그인: {} (이전={})", playerName, previous);
        }
    }

    public synchronized LocationAttribution attributeLocation(String rawToken) {
        if (rawToken != null && !rawToken.isBlank()) {
            String cleaned = zoneClassifier.cleanZoneId(rawToken);
            context.recordLocation(cleaned);
            return new LocationAttribution(cleaned, false);
        }
        String last = context.getCurrentLocation();
        return new LocationAttribution(last == null ? SessionContext.UNKNOWN_LOCATION : last, true);
    }

    public synchronized void reset() {
        cancelPendingPromotion();
        context.reset(lastKnownUserStore.load().orElse(null));
        log.info("[Session] 세션 초기화: player={}", context.getPlayerName());
    }

    public synchronized String currentPlayer() {
        return context.getPlayerName();
    }

    public synchronized String currentVehicle() {
        return context.getVehicleName();
    }

    public synchronized GameMode currentMode() {
        return context.getStableMode();
    }

    public synchronized String currentGameVersion() {
        return context.getGameVersion();
    }

    public synchronized boolean isCurrentPlayer(String name) {
        return name != null && name.equalsIgnoreCase(context.getPlayerName());
    }

    public synchronized SessionSnapshot snapshot() {
        return new SessionSnapshot(
                context.getPlayerName(),
                context.getVehicleName(),
                context.getStableMode(),
                context.getRawMode(),
                context.getPendingMode(),
                context.getGameVersion(),
                context.getCurrentLocation(),
                context.getLocationHistory(),
                context.getSessionStartEpochMs());
    }

    public void addListener(Consumer<SessionEvent> listener) {
        listeners.add(listener);
    }

    @PreDestroy
    public void shutdown() {
        debounceScheduler.shutdownNow();
    }

    private synchronized void promote(GameMode mode) {
        if (context.getRawMode() != mode || context.getPendingMode() != mode) {
            return;
        }
        pendingPromotion = null;
        changeStableMode(mode);
    }

    private void changeStableMode(GameMode mode) {
        context.setPendingMode(null);
        GameMode previous = context.getStableMode();
        if (previous == mode) return;
        context.setStableMode(mode);
        log.info("[Session] 게임 모드 변경: {} → {}", previous, mode);
        notifyListeners(SessionEvent.builder()
                .type(SessionEventType.MODE_CHANGED)
                .timestamp(System.currentTimeMillis())
                .value(mode.getLabel())
                .detail(previous.getLabel())
                .build());
    }

    private void cancelPendingPromotion() {
        if (pendingPromotion != null) {
            pendingPromotion.cancel(false);
            pendingPromotion = null;
        }
        context.setPendingMode(null);
    }

    private void notifyListeners(SessionEvent event) {
        for (Consumer<SessionEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("[Session] 리스너 처리 실패: event={}", event, e);
            }
        }
    }

    private Optional<SessionEvent> onLogin(Matcher m, String line) {
        setPlayer(m.group(1));
        return event(SessionEventType.LOGIN, line, m.group(1), null);
    }

    private Optional<SessionEvent> onSystemQuit(Matcher m, String line) {
        setStableModeImmediately(GameMode.UNKNOWN);
        context.setCurrentLocation(SessionContext.UNKNOWN_LOCATION);
        return event(SessionEventType.SYSTEM_QUIT, line, GameMode.UNKNOWN.getLabel(), null);
    }

    private Optional<SessionEvent> onExplicitMode(GameMode mode, String line) {
        setStableModeImmediately(mode);
        return event(SessionEventType.MODE_CHANGED, line, mode.getLabel(), "explicit");
    }

    private Optional<SessionEvent> onModeHint(Matcher m, String line) {
        String gameRules = m.group("rules");
        GameMode mode;
        if ("SC_Default".equalsIgnoreCase(gameRules)) {
            mode = GameMode.PU;
        } else if (gameRules.toUpperCase(Locale.ROOT).startsWith("EA_")) {
            mode = GameMode.AC;
        } else {
            return Optional.empty();
        }
        observeRawMode(mode);
        return event(SessionEventType.MODE_OBSERVED, line, mode.getLabel(), gameRules);
    }

    private Optional<SessionEvent> onVersion(Matcher m, String line) {
        String build = m.group("build");
        context.setGameVersion(build);
        log.info("[Session] 게임 빌드: {}", build);
        return event(SessionEventType.GAME_VERSION, line, build, null);
    }

    private Optional<SessionEvent> onLoadout(Matcher m, String line) {
        String owner = m.group("owner").trim();
        String entity = m.group("entity");
        if (!owner.equals(context.getPlayerName())) {
            return Optional.empty();
        }
        String prefix = entity.contains("_") ? entity.substring(0, entity.indexOf('_')) : entity;
        if (!MANUFACTURER_PREFIXES.contains(prefix)) {
            return Optional.empty();
        }
        Matcher base = VEHICLE_INSTANCE_SUFFIX.matcher(entity);
        String vehicle = base.matches() ? base.group(1) : entity;
        context.setVehicleName(vehicle);
        log.info("[Session] 현재 함선: {}", vehicle);
        return event(SessionEventType.PLAYER_SHIP, line, vehicle, m.group("interior"));
    }

    private Optional<SessionEvent> onSessionStart(Matcher m, String line) {
        long ts = LogTimestamps.parse(m.group("ts"));
        context.setSessionStartEpochMs(ts);
        return event(SessionEventType.SESSION_START, line, null, null);
    }

    private Optional<SessionEvent> event(SessionEventType type, String line, String value, String detail) {
        return Optional.of(SessionEvent.builder()
                .type(type)
                .timestamp(LogTimestamps.leadingOrDefault(line, System.currentTimeMillis()))
                .value(value)
                .detail(detail)
                .build());
    }

    private record SessionRule(String name, Pattern pattern, SessionRuleHandler handler) {
    }

    @FunctionalInterface
    private interface SessionRuleHandler {
        Optional<SessionEvent> apply(Matcher matcher, String line);
    }
}
