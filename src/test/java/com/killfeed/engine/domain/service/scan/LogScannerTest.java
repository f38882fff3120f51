package com.killfeed.engine.domain.service.scan;

import com.killfeed.engine.domain.model.DeathNoticeFormat;
import com.killfeed.engine.domain.model.IncidentKind;
import com.killfeed.engine.domain.model.RawIncidentSignal;
import com.killfeed.engine.domain.model.SessionEventType;
import com.killfeed.engine.domain.service.correlation.CorrelationProperties;
import com.killfeed.engine.domain.service.correlation.DeathNoticeDeduplicator;
import com.killfeed.engine.domain.service.correlation.IncidentSignalListener;
import com.killfeed.engine.domain.service.session.InMemoryLastKnownUserStore;
import com.killfeed.engine.domain.service.session.SessionContextTracker;
import com.killfeed.engine.domain.service.session.SessionProperties;
import com.killfeed.engine.domain.service.zone.ZoneClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogScannerTest {

    private static final String LOGIN = "<2024-05-01T18:20:00.000Z> [Notice] <AccountLoginCharacterStatus_Character> "
            + "Character: createdAt 1 - updatedAt 2 - geid 3 - accountId 4 - name Kelvin - state STATE_CURRENT";

    private SessionContextTracker tracker;
    private DeathNoticeDeduplicator deduplicator;
    private CapturingListener listener;
    private SimpleMeterRegistry meterRegistry;
    private LogScanner scanner;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        tracker = new SessionContextTracker(new SessionProperties(), new InMemoryLastKnownUserStore(), new ZoneClassifier());
        deduplicator = new DeathNoticeDeduplicator(new CorrelationProperties(), meterRegistry);
        listener = new CapturingListener();
        scanner = new LogScanner(tracker, deduplicator, listener, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    @Test
    void loginLineBecomesSessionEvent() {
        ScanResult result = scanner.parse(LOGIN + "\n");

        assertThat(result.sessionEvents()).singleElement()
                .satisfies(event -> assertThat(event.getType()).isEqualTo(SessionEventType.LOGIN));
        assertThat(result.signals()).isEmpty();
        assertThat(tracker.currentPlayer()).isEqualTo("Kelvin");
    }

    @Test
    void destructionOfUnknownDriverUsesVehicleAsPlaceholderVictim() {
        ScanResult result = scanner.parse(LOGIN + "\n" + destruction("AEGS_Avenger_01", "unknown", 0, 2, "Kelvin"));

        assertThat(result.signals()).singleElement().satisfies(signal -> {
            assertThat(signal.getKind()).isEqualTo(IncidentKind.VEHICLE_DESTRUCTION);
            assertThat(signal.getIncidentId()).isEqualTo("v_kill_AEGS_Avenger_01");
            assertThat(signal.getKillers()).containsExactly("Kelvin");
            assertThat(signal.getVictims()).containsExactly("AEGS_Avenger");
            assertThat(signal.isPlaceholderVictim()).isTrue();
            assertThat(signal.getDestructionLevel()).isEqualTo(2);
            assertThat(signal.getDamageType()).isEqualTo("Combat");
            assertThat(signal.getVehicleModel()).isEqualTo("AEGS_Avenger");
            assertThat(signal.getCoordinates().x()).isEqualTo(1.0);
            assertThat(signal.getPlayerName()).isEqualTo("Kelvin");
            assertThat(signal.getTimestamp()).isEqualTo(1_714_587_723_114L);
        });
        assertThat(listener.signals).hasSize(1);
    }

    @Test
    void destructionLevelZeroIsIgnored() {
        ScanResult result = scanner.parse(LOGIN + "\n" + destruction("AEGS_Avenger_01", "unknown", 0, 0, "Kelvin"));

        assertThat(result.signals()).isEmpty();
    }

    @Test
    void destructionLevelZeroStillUpdatesLocation() {
        scanner.parse(LOGIN + "\n" + destruction("AEGS_Avenger_01", "unknown", 0, 0, "Kelvin"));

        ScanResult result = scanner.parse(environmentDeath("Kelvin"));

        assertThat(result.signals()).singleElement().satisfies(signal -> {
            assertThat(signal.getLocationToken()).isEqualTo(new ZoneClassifier().cleanZoneId("OOC_Stanton_2b"));
            assertThat(signal.isLocationFallback()).isTrue();
        });
    }

    @Test
    void sameModelAsPlayerShipOwnedBySomeoneElseIsNotForwarded() {
        ScanResult result = scanner.parse(LOGIN + "\n"
                + "<2024-05-01T18:21:00.000Z> [InstancedInterior] OnEntityLeaveZone - InstancedInterior [Hangar_MedFront] [11] "
                + "-> Entity [DRAK_Cutlass_Black_3301] [22] -- m_openDoors[0], m_ownerGEID[Kelvin]\n"
                + destruction("DRAK_Cutlass_Black_999", "OtherGuy", 0, 2, "ThirdGuy"));

        assertThat(tracker.currentVehicle()).isEqualTo("DRAK_Cutlass_Black");
        assertThat(result.signals()).isEmpty();
        assertThat(listener.signals).isEmpty();
    }

    @Test
    void incidentsBetweenOtherPlayersAreNotForwarded() {
        ScanResult result = scanner.parse(LOGIN + "\n"
                + destruction("DRAK_Cutlass_Black_7", "Stranger", 0, 2, "Outlaw") + "\n"
                + actorDeath("Stranger", "Outlaw", "Bullet"));

        assertThat(result.signals()).isEmpty();
        assertThat(listener.signals).isEmpty();
        assertThat(result.linesScanned()).isEqualTo(3);
    }

    @Test
    void actorDeathInvolvingPlayerGetsSanitizedId() {
        ScanResult result = scanner.parse(LOGIN + "\n" + actorDeath("TestPilot", "Kelvin", "Bullet"));

        RawIncidentSignal signal = result.signals().get(0);
        assertThat(signal.getKind()).isEqualTo(IncidentKind.ACTOR_DEATH);
        assertThat(signal.getIncidentId())
                .isEqualTo("kill_Kelvin_TestPilot_OOC_Stanton_2b_KLWE_LaserRepeater_S3_1714587725");
        assertThat(signal.getWeapon()).isEqualTo("KLWE_LaserRepeater_S3");
        assertThat(signal.getDamageType()).isEqualTo("Bullet");
    }

    @Test
    void crashActorDeathIsLeftToDestructionLine() {
        ScanResult result = scanner.parse(LOGIN + "\n" + actorDeath("Kelvin", "Kelvin", "Crash"));

        assertThat(result.signals()).isEmpty();
    }

    @Test
    void environmentDeathBlamesEnvironment() {
        ScanResult result = scanner.parse(LOGIN + "\n"
                + "<2024-05-01T18:25:00.000Z> [Notice] <Actor Death> CActor::Kill: 'Kelvin' [1] in zone 'OOC_Stanton_2b' "
                + "killed by 'Kelvin' [1] using 'unknown' [Class unknown] with damage type 'BleedOut' from direction x: 0");

        assertThat(result.signals()).singleElement().satisfies(signal -> {
            assertThat(signal.getKind()).isEqualTo(IncidentKind.ENVIRONMENT_DEATH);
            assertThat(signal.getKillers()).containsExactly("Environment");
            assertThat(signal.getVictims()).containsExactly("Kelvin");
            assertThat(signal.getDamageType()).isEqualTo("BleedOut");
        });
    }

    @Test
    void deathNoticesAreForwardedOncePerDeath() {
        ScanResult result = scanner.parse(LOGIN + "\n"
                + corpse("2024-05-01T18:22:06.000Z", "TestPilot") + "\n"
                + corpse("2024-05-01T18:22:08.000Z", "TestPilot"));

        assertThat(result.signals()).singleElement().satisfies(signal -> {
            assertThat(signal.getKind()).isEqualTo(IncidentKind.PLAYER_DEATH);
            assertThat(signal.getVictims()).containsExactly("TestPilot");
            assertThat(signal.getDeathNoticeFormat()).isEqualTo(DeathNoticeFormat.LEGACY_CORPSE);
        });
        assertThat(scanner.getDuplicatesPrevented()).isEqualTo(1);
    }

    @Test
    void localDeathStateNeedsKnownPlayer() {
        String line = "<2024-05-01T18:22:06.000Z> [Notice] <CLocalPlayerDeathState::Enter> entering death state";

        assertThat(scanner.parse(line).signals()).isEmpty();

        scanner.parse(LOGIN);
        assertThat(scanner.parse(line.replace("18:22:06", "18:24:06")).signals())
                .singleElement()
                .satisfies(signal -> assertThat(signal.getVictims()).containsExactly("Kelvin"));
    }

    @Test
    void incapacitationBecomesSessionEvent() {
        ScanResult result = scanner.parse("<2024-05-01T18:22:00.000Z> [Notice] Logged an incap.! nickname: Kelvin, causes: [Bleed]");

        assertThat(result.sessionEvents()).singleElement().satisfies(event -> {
            assertThat(event.getType()).isEqualTo(SessionEventType.INCAPACITATION);
            assertThat(event.getValue()).isEqualTo("Kelvin");
            assertThat(event.getDetail()).isEqualTo("Bleed");
        });
    }

    @Test
    void failingLineIsSkippedAndChunkContinues() {
        ScanResult result = scanner.parse(LOGIN + "\r\n"
                + corpse("not-a-timestamp", "TestPilot") + "\r\n"
                + corpse("2024-05-01T18:22:06.000Z", "TestPilot") + "\r\n");

        assertThat(result.linesFailed()).isEqualTo(1);
        assertThat(result.linesScanned()).isEqualTo(3);
        assertThat(result.signals()).hasSize(1);
        assertThat(meterRegistry.get("killfeed.scanner.line_failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    void emptyChunkYieldsEmptyResult() {
        assertThat(scanner.parse("")).isSameAs(ScanResult.EMPTY);
        assertThat(scanner.parse(null)).isSameAs(ScanResult.EMPTY);
    }

    @Test
    void resetClearsSessionAndNotifiesCorrelation() {
        scanner.parse(LOGIN + "\n" + corpse("2024-05-01T18:22:06.000Z", "Kelvin"));

        scanner.reset();

        assertThat(listener.resets).isEqualTo(1);
        ScanResult again = scanner.parse(corpse("2024-05-01T18:22:07.000Z", "Kelvin"));
        assertThat(again.signals()).hasSize(1);
    }

    private static String destruction(String vehicle, String driver, int from, int to, String causer) {
        return "<2024-05-01T18:22:03.114Z> [Notice] <Vehicle Destruction> CVehicle::OnAdvanceDestroyLevel: "
                + "Vehicle '" + vehicle + "' [123] in zone 'OOC_Stanton_2b' "
                + "[pos x: 1.0, y: 2.0, z: 3.0 vel x: 0, y: 0, z: 0] driven by '" + driver + "' [0] "
                + "advanced from destroy level " + from + " to " + to + " caused by '" + causer + "' [456] "
                + "with 'Combat' [Team_CGP4][Vehicle]";
    }

    private static String environmentDeath(String player) {
        return "<2024-05-01T18:25:00.000Z> [Notice] <Actor Death> CActor::Kill: '" + player + "' [1] in zone 'OOC_Stanton_2b' "
                + "killed by '" + player + "' [1] using 'unknown' [Class unknown] with damage type 'BleedOut' from direction x: 0";
    }

    private static String actorDeath(String victim, String killer, String damage) {
        return "<2024-05-01T18:22:05.500Z> [Notice] <Actor Death> CActor::Kill: '" + victim + "' [1] in zone 'OOC_Stanton_2b' "
                + "killed by '" + killer + "' [2] using 'KLWE_LaserRepeater_S3' [Class KLWE_LaserRepeater_S3] "
                + "with damage type '" + damage + "' from direction x: 0, y: 0, z: 0 [Team_ActorTech][Actor]";
    }

    private static String corpse(String timestamp, String player) {
        return "<" + timestamp + "> [Notice] <[ActorState] Corpse> [ACTOR STATE][SSCActorStateCVars::LogCorpse] "
                + "Player '" + player + "' <remote client>: Running corpsify for corpse. [Team_ActorFeatures][Actor]";
    }

    private static final class CapturingListener implements IncidentSignalListener {

        private final List<RawIncidentSignal> signals = new ArrayList<>();
        private int resets;

        @Override
        public void onSignal(RawIncidentSignal signal) {
            signals.add(signal);
        }

        @Override
        public void onSessionReset() {
            resets++;
        }
    }
}
