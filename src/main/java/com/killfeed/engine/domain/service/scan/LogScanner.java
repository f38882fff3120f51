package com.killfeed.engine.domain.service.scan;

import com.killfeed.engine.domain.model.Coordinates;
import com.killfeed.engine.domain.model.DeathNoticeFormat;
import com.killfeed.engine.domain.model.IncidentKind;
import com.killfeed.engine.domain.model.RawIncidentSignal;
import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.model.SessionEventType;
import com.killfeed.engine.domain.service.correlation.DeathNoticeDeduplicator;
import com.killfeed.engine.domain.service.correlation.IncidentSignalListener;
import com.killfeed.engine.domain.service.session.LocationAttribution;
import com.killfeed.engine.domain.service.session.LogTimestamps;
import com.killfeed.engine.domain.service.session.SessionContextTracker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class LogScanner {

    static final String ENVIRONMENT = "Environment";
    static final String UNKNOWN = "unknown";

    private static final Pattern INSTANCE_SUFFIX = Pattern.compile("^(.+?)_\\d+$");
    private static final Pattern ID_UNSAFE = Pattern.compile("[^A-Za-z0-9_]");
    private static final int MAX_LOGGED_LINE = 300;

    private final SessionContextTracker sessionTracker;
    private final DeathNoticeDeduplicator deathNoticeDeduplicator;
    private final IncidentSignalListener signalListener;
    private final List<LineRecognizer> recognizers;

    private final Counter linesCounter;
    private final Counter lineFailureCounter;
    private final Timer chunkTimer;

    public LogScanner(SessionContextTracker sessionTracker,
                      DeathNoticeDeduplicator deathNoticeDeduplicator,
                      IncidentSignalListener signalListener,
                      MeterRegistry meterRegistry) {
        this.sessionTracker = sessionTracker;
        this.deathNoticeDeduplicator = deathNoticeDeduplicator;
        this.signalListener = signalListener;
        this.recognizers = List.of(
                new LineRecognizer("vehicle-destruction", Pattern.compile(
                        "<(?<ts>[^>]+)> \\[Notice\\] <Vehicle Destruction>.*?Vehicle '(?<vehicle>[^']+)' \\[\\d+\\] "
                                + "in zone '(?<zone>[^']+)' \\[pos x: (?<x>[-\\d.]+), y: (?<y>[-\\d.]+), z: (?<z>[-\\d.]+) "
                                + ".*? driven by '(?<driver>[^']+)' \\[\\d+\\] advanced from destroy level (?<from>\\d+) "
                                + "to (?<to>\\d+) caused by '(?<causer>[^']+)' \\[\\d+\\] with '(?<damage>[^']+)'"),
                        this::onVehicleDestruction),
                new LineRecognizer("environment-death", Pattern.compile(
                        "<(?<ts>[^>]+)>.*?<Actor Death> CActor::Kill: '(?<player>[^']+)' .*? "
                                + "damage type '(?<damage>BleedOut|SuffocationDamage|Suffocation)'"),
                        this::onEnvironmentDeath),
                new LineRecognizer("actor-death", Pattern.compile(
                        "<(?<ts>[^>]+)>.*?<Actor Death> CActor::Kill: '(?<victim>[^']+)' \\[\\d+\\] in zone '(?<zone>[^']+)' "
                                + "killed by '(?<killer>[^']+)' \\[[^\\]]+\\] using '(?<weapon>[^']+)' "
                                + "\\[Class (?<weaponClass>[^\\]]+)\\] with damage type '(?<damage>[^']+)'"),
                        this::onActorDeath),
                new LineRecognizer("death-actor-state", Pattern.compile(
                        "<(?<ts>[^>]+)>.*?<\\[ActorState\\] Dead>.*?Player '(?<player>[^']+)'"),
                        (m, line, sink) -> onDeathNotice(DeathNoticeFormat.ACTOR_STATE_DEAD, m, sink)),
                new LineRecognizer("death-corpse", Pattern.compile(
                        "<(?<ts>[^>]+)>.*?<\\[ActorState\\] Corpse>.*?Player '(?<player>[^']+)'"),
                        (m, line, sink) -> onDeathNotice(DeathNoticeFormat.LEGACY_CORPSE, m, sink)),
                new LineRecognizer("death-local-state", Pattern.compile(
                        "<(?<ts>[^>]+)>.*?<CLocalPlayerDeathState::Enter>"),
                        (m, line, sink) -> onDeathNotice(DeathNoticeFormat.LOCAL_DEATH_STATE, m, sink)),
                new LineRecognizer("incapacitation", Pattern.compile(
                        "Logged an incap\\.! nickname: (?<player>[^,]+), causes: \\[(?<cause>[^\\]]+)\\]"),
                        this::onIncapacitation)
        );

        this.linesCounter = Counter.builder("killfeed.scanner.lines")
                .description("Log lines scanned")
                .register(meterRegistry);
        this.lineFailureCounter = Counter.builder("killfeed.scanner.line_failures")
                .description("Log lines skipped after a processing failure")
                .register(meterRegistry);
        this.chunkTimer = Timer.builder("killfeed.scanner.chunk_duration")
                .description("Time to scan one log chunk")
                .register(meterRegistry);
    }

    public ScanResult parse(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return ScanResult.EMPTY;
        }
        return chunkTimer.record(() -> scanChunk(chunk));
    }

    public void reset() {
        sessionTracker.reset();
        deathNoticeDeduplicator.reset();
        signalListener.onSessionReset();
        log.info("[Scanner] 세션 초기화 완료");
    }

    public long getDuplicatesPrevented() {
        return deathNoticeDeduplicator.getDuplicatesPrevented();
    }

    private ScanResult scanChunk(String chunk) {
        ChunkSink sink = new ChunkSink();
        int scanned = 0;
        int failed = 0;

        for (String rawLine : chunk.split("\n")) {
            String line = rawLine.endsWith("\r") ? rawLine.substring(0, rawLine.length() - 1) : rawLine;
            if (line.isBlank()) continue;
            scanned++;
            try {
                scanLine(line, sink);
            } catch (RuntimeException e) {
                failed++;
                lineFailureCounter.increment();
                log.warn("[Scanner] 라인 처리 실패, 건너뜀: {} ({})", abbreviate(line), e.toString());
            }
        }

        linesCounter.increment(scanned);
        if (!sink.signals.isEmpty() || failed > 0) {
            log.debug("[Scanner] 청크 처리: lines={}, signals={}, sessionEvents={}, failed={}",
                    scanned, sink.signals.size(), sink.sessionEvents.size(), failed);
        }
        return new ScanResult(List.copyOf(sink.signals), List.copyOf(sink.sessionEvents), scanned, failed);
    }

    private void scanLine(String line, ChunkSink sink) {
        Optional<SessionEvent> sessionEvent = sessionTracker.observe(line);
        if (sessionEvent.isPresent()) {
            sink.sessionEvents.add(sessionEvent.get());
            return;
        }
        for (LineRecognizer recognizer : recognizers) {
            Matcher matcher = recognizer.pattern().matcher(line);
            if (matcher.find()) {
                recognizer.handler().handle(matcher, line, sink);
                return;
            }
        }
    }

    private void onVehicleDestruction(Matcher m, String line, ChunkSink sink) {
        long ts = LogTimestamps.parse(m.group("ts"));
        int level = Integer.parseInt(m.group("to"));
        String vehicle = m.group("vehicle");
        LocationAttribution location = sessionTracker.attributeLocation(m.group("zone"));
        if (level < 1) {
            log.debug("[Scanner] 파괴 단계 0 무시: vehicle={}", vehicle);
            return;
        }

        String vehicleBase = baseName(vehicle);
        String causer = m.group("causer");
        String driver = m.group("driver");
        boolean driverKnown = isNamed(driver);
        Coordinates coordinates = new Coordinates(
                Double.parseDouble(m.group("x")), Double.parseDouble(m.group("y")), Double.parseDouble(m.group("z")));

        RawIncidentSignal signal = signal(IncidentKind.VEHICLE_DESTRUCTION, "v_kill_" + vehicle, ts)
                .killers(isNamed(causer) ? List.of(causer) : List.of())
                .victims(List.of(driverKnown ? driver : vehicleBase))
                .placeholderVictim(!driverKnown)
                .destructionLevel(level)
                .damageType(m.group("damage"))
                .weapon(m.group("damage"))
                .causer(causer)
                .driver(driver)
                .vehicleId(vehicle)
                .vehicleModel(vehicleBase)
                .locationToken(location.token())
                .locationFallback(location.fallback())
                .coordinates(coordinates)
                .build();

        log.debug("[Scanner] 함선 파괴: {} level {}→{}, causer={}, driver={}",
                vehicle, m.group("from"), level, causer, driver);
        forwardIfInvolved(signal, sink);
    }

    private void onEnvironmentDeath(Matcher m, String line, ChunkSink sink) {
        long ts = LogTimestamps.parse(m.group("ts"));
        String player = m.group("player");
        String damage = m.group("damage");
        LocationAttribution location = sessionTracker.attributeLocation(null);

        RawIncidentSignal signal = signal(IncidentKind.ENVIRONMENT_DEATH, "env_death_" + player + "_" + ts, ts)
                .killers(List.of(ENVIRONMENT))
                .victims(List.of(player))
                .damageType(damage)
                .weapon(damage)
                .causer(ENVIRONMENT)
                .driver(player)
                .locationToken(location.token())
                .locationFallback(location.fallback())
                .build();
        forwardIfInvolved(signal, sink);
    }

    private void onActorDeath(Matcher m, String line, ChunkSink sink) {
        String damage = m.group("damage");
        if ("Crash".equalsIgnoreCase(damage)) {
            return;
        }
        long ts = LogTimestamps.parse(m.group("ts"));
        String victim = m.group("victim");
        String killer = m.group("killer");
        String zone = m.group("zone");
        String weapon = m.group("weapon");
        LocationAttribution location = sessionTracker.attributeLocation(zone);

        String id = "kill_" + killer + "_" + victim + "_" + zone + "_" + weapon + "_" + (ts / 1000);
        RawIncidentSignal signal = signal(IncidentKind.ACTOR_DEATH, id, ts)
                .killers(List.of(killer))
                .victims(List.of(victim))
                .damageType(damage)
                .weapon(weapon)
                .causer(killer)
                .driver(victim)
                .vehicleId(zone)
                .locationToken(location.token())
                .locationFallback(location.fallback())
                .build();
        forwardIfInvolved(signal, sink);
    }

    private void onDeathNotice(DeathNoticeFormat format, Matcher m, ChunkSink sink) {
        long ts = LogTimestamps.parse(m.group("ts"));
        String player = format.isNameBearing() ? m.group("player") : sessionTracker.currentPlayer();
        if (!isNamed(player)) {
            log.debug("[Scanner] 플레이어 미확인 상태의 사망 보고 무시: format={}", format);
            return;
        }

        DeathNoticeDeduplicator.Decision decision = deathNoticeDeduplicator.evaluate(player, format, ts);
        if (decision != DeathNoticeDeduplicator.Decision.ACCEPTED) {
            return;
        }

        RawIncidentSignal signal = signal(IncidentKind.PLAYER_DEATH, "death_" + player + "_" + ts, ts)
                .victims(List.of(player))
                .deathNoticeFormat(format)
                .build();
        forward(signal, sink);
    }

    private void onIncapacitation(Matcher m, String line, ChunkSink sink) {
        String player = m.group("player").trim();
        sink.sessionEvents.add(SessionEvent.builder()
                .type(SessionEventType.INCAPACITATION)
                .timestamp(LogTimestamps.leadingOrDefault(line, System.currentTimeMillis()))
                .value(player)
                .detail(m.group("cause"))
                .build());
        log.debug("[Scanner] 행동 불능: player={}, cause={}", player, m.group("cause"));
    }

    private RawIncidentSignal.RawIncidentSignalBuilder signal(IncidentKind kind, String rawId, long ts) {
        return RawIncidentSignal.builder()
                .kind(kind)
                .incidentId(ID_UNSAFE.matcher(rawId).replaceAll(""))
                .timestamp(ts)
                .gameMode(sessionTracker.currentMode())
                .gameVersion(sessionTracker.currentGameVersion())
                .playerShip(sessionTracker.currentVehicle())
                .playerName(sessionTracker.currentPlayer());
    }

    private void forwardIfInvolved(RawIncidentSignal signal, ChunkSink sink) {
        String player = sessionTracker.currentPlayer();
        boolean involved = isNamed(player)
                && (signal.getKillers().stream().anyMatch(player::equalsIgnoreCase)
                || signal.getVictims().stream().anyMatch(player::equalsIgnoreCase));

        if (involved) {
            forward(signal, sink);
        } else {
            log.trace("[Scanner] 타인 간 사건 제외: {}", signal);
        }
    }

    private void forward(RawIncidentSignal signal, ChunkSink sink) {
        sink.signals.add(signal);
        signalListener.onSignal(signal);
    }

    private static String baseName(String vehicle) {
        Matcher m = INSTANCE_SUFFIX.matcher(vehicle);
        return m.matches() ? m.group(1) : vehicle;
    }

    private static boolean isNamed(String name) {
        return name != null && !name.isBlank() && !UNKNOWN.equalsIgnoreCase(name);
    }

    private static String abbreviate(String line) {
        return line.length() > MAX_LOGGED_LINE ? line.substring(0, MAX_LOGGED_LINE) + "..." : line;
    }

    private static final class ChunkSink {
        private final List<RawIncidentSignal> signals = new ArrayList<>();
        private final List<SessionEvent> sessionEvents = new ArrayList<>();
    }

    private record LineRecognizer(String name, Pattern pattern, LineHandler handler) {
    }

    @FunctionalInterface
    private interface LineHandler {
        void handle(Matcher matcher, String line, ChunkSink sink);
    }
}
