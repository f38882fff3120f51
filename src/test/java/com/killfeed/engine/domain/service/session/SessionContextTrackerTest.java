package com.killfeed.engine.domain.service.session;

import com.killfeed.engine.domain.model.GameMode;
import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.model.SessionEventType;
import com.killfeed.engine.domain.service.zone.ZoneClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class SessionContextTrackerTest {

    private static final String LOGIN = "<2024-05-01T18:20:00.000Z> [Notice] <AccountLoginCharacterStatus_Character> "
            + "Character: createdAt 1 - updatedAt 2 - geid 3 - accountId 4 - name Kelvin - state STATE_CURRENT";
    private static final String PU_HINT = "<2024-05-01T18:20:05.000Z> [Notice] <Context Establisher Done> "
            + "establisher=\"CReplicationModel\" map=\"megamap\" gamerules=\"SC_Default\" sessionId=\"abc\"";

    private InMemoryLastKnownUserStore userStore;
    private SessionProperties properties;
    private SessionContextTracker tracker;
    private final List<SessionEvent> notified = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        userStore = new InMemoryLastKnownUserStore();
        properties = new SessionProperties();
        properties.setModeDebounceMs(100);
        tracker = new SessionContextTracker(properties, userStore, new ZoneClassifier());
        tracker.addListener(notified::add);
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    @Test
    void loginSetsPlayerAndPersistsIt() {
        Optional<SessionEvent> event = tracker.observe(LOGIN);

        assertThat(event).isPresent();
        assertThat(event.get().getType()).isEqualTo(SessionEventType.LOGIN);
        assertThat(event.get().getValue()).isEqualTo("Kelvin");
        assertThat(tracker.currentPlayer()).isEqualTo("Kelvin");
        assertThat(tracker.isCurrentPlayer("kelvin")).isTrue();
        assertThat(userStore.load()).contains("Kelvin");
    }

    @Test
    void legacyLoginIsRecognized() {
        tracker.observe("<2024-05-01T18:20:00.000Z> <Legacy login response> [CIG-net] User Login Success - Handle[Old_Timer] - Time[1]");

        assertThat(tracker.currentPlayer()).isEqualTo("Old_Timer");
    }

    @Test
    void modeHintIsPromotedAfterQuietWindow() throws InterruptedException {
        properties.setModeDebounceMs(300);
        Optional<SessionEvent> observed = tracker.observe(PU_HINT);

        assertThat(observed).map(SessionEvent::getType).contains(SessionEventType.MODE_OBSERVED);
        assertThat(tracker.currentMode()).isEqualTo(GameMode.UNKNOWN);
        assertThat(tracker.snapshot().pendingMode()).isEqualTo(GameMode.PU);

        awaitTrue(() -> tracker.currentMode() == GameMode.PU);
        assertThat(tracker.snapshot().pendingMode()).isNull();
        assertThat(notified).extracting(SessionEvent::getType).containsExactly(SessionEventType.MODE_CHANGED);
        assertThat(notified.get(0).getValue()).isEqualTo("PU");
    }

    @Test
    void contradictingObservationRestartsDebounce() throws InterruptedException {
        tracker.observeRawMode(GameMode.PU);
        tracker.observeRawMode(GameMode.AC);

        awaitTrue(() -> tracker.currentMode() == GameMode.AC);
        Thread.sleep(200);

        assertThat(notified).extracting(SessionEvent::getValue).containsExactly("AC");
    }

    @Test
    void flappingBackWithinWindowNeverPromotesMiddleMode() throws InterruptedException {
        properties.setModeDebounceMs(200);
        tracker.observeRawMode(GameMode.PU);
        tracker.observeRawMode(GameMode.AC);
        tracker.observeRawMode(GameMode.PU);

        awaitTrue(() -> tracker.currentMode() == GameMode.PU);
        Thread.sleep(400);

        assertThat(tracker.currentMode()).isEqualTo(GameMode.PU);
        assertThat(notified).extracting(SessionEvent::getValue).containsExactly("PU");
    }

    @Test
    void systemQuitCancelsPendingPromotion() throws InterruptedException {
        properties.setModeDebounceMs(150);
        tracker.setStableModeImmediately(GameMode.PU);
        tracker.observeRawMode(GameMode.AC);
        assertThat(tracker.snapshot().pendingMode()).isEqualTo(GameMode.AC);

        tracker.observe("<2024-05-01T19:00:00.000Z> [Notice] <SystemQuit> CSystem::Quit invoked");
        Thread.sleep(400);

        assertThat(tracker.currentMode()).isEqualTo(GameMode.UNKNOWN);
        assertThat(tracker.snapshot().pendingMode()).isNull();
        assertThat(notified).extracting(SessionEvent::getValue).doesNotContain("AC");
        assertThat(notified).last().satisfies(event -> assertThat(event.getDetail()).isEqualTo("PU"));
    }

    @Test
    void resetCancelsPendingPromotion() throws InterruptedException {
        properties.setModeDebounceMs(150);
        tracker.observeRawMode(GameMode.PU);

        tracker.reset();
        Thread.sleep(400);

        assertThat(tracker.currentMode()).isEqualTo(GameMode.UNKNOWN);
        assertThat(notified).isEmpty();
    }

    @Test
    void explicitModeAppliesImmediately() {
        Optional<SessionEvent> event = tracker.observe("<2024-05-01T18:20:05.000Z> Loading GameModeRecord='SC_Default' for session");

        assertThat(event).map(SessionEvent::getType).contains(SessionEventType.MODE_CHANGED);
        assertThat(tracker.currentMode()).isEqualTo(GameMode.PU);
        assertThat(notified).hasSize(1);
    }

    @Test
    void systemQuitClearsModeAndLocation() {
        tracker.setStableModeImmediately(GameMode.PU);
        tracker.attributeLocation("GrimHex");

        tracker.observe("<2024-05-01T19:00:00.000Z> [Notice] <SystemQuit> CSystem::Quit invoked");

        assertThat(tracker.currentMode()).isEqualTo(GameMode.UNKNOWN);
        assertThat(tracker.snapshot().currentLocation()).isEqualTo(SessionContext.UNKNOWN_LOCATION);
    }

    @Test
    void recordsGameVersion() {
        tracker.observe("<2024-05-01T18:19:00.000Z> Arguments: --system-trace-env-id='pub-sc-alpha-400-9123456'");

        assertThat(tracker.currentGameVersion()).isEqualTo("400-9123456");
    }

    @Test
    void loadoutOfCurrentPlayerSetsVehicle() {
        tracker.observe(LOGIN);

        Optional<SessionEvent> event = tracker.observe("<2024-05-01T18:21:00.000Z> [InstancedInterior] OnEntityLeaveZone - "
                + "InstancedInterior [Hangar_MedFront] [11] -> Entity [AEGS_Gladius_3301] [22] -- m_openDoors[0], m_ownerGEID[Kelvin]");

        assertThat(event).map(SessionEvent::getType).contains(SessionEventType.PLAYER_SHIP);
        assertThat(tracker.currentVehicle()).isEqualTo("AEGS_Gladius");
    }

    @Test
    void loadoutOfAnotherPlayerIsIgnored() {
        tracker.observe(LOGIN);

        tracker.observe("<2024-05-01T18:21:00.000Z> [InstancedInterior] OnEntityLeaveZone - "
                + "InstancedInterior [Hangar_MedFront] [11] -> Entity [AEGS_Gladius_3301] [22] -- m_ownerGEID[Someone]");

        assertThat(tracker.currentVehicle()).isNull();
    }

    @Test
    void attributesLocationWithFallbacks() {
        assertThat(tracker.attributeLocation(null)).isEqualTo(new LocationAttribution(SessionContext.UNKNOWN_LOCATION, true));

        assertThat(tracker.attributeLocation("GrimHex_001")).isEqualTo(new LocationAttribution("GrimHex", false));
        assertThat(tracker.attributeLocation(" ")).isEqualTo(new LocationAttribution("GrimHex", true));
        assertThat(tracker.snapshot().locationHistory()).containsExactly("GrimHex");
    }

    @Test
    void resetReloadsLastKnownPlayer() {
        tracker.observe(LOGIN);
        tracker.attributeLocation("GrimHex");

        tracker.reset();

        assertThat(tracker.currentPlayer()).isEqualTo("Kelvin");
        assertThat(tracker.snapshot().currentLocation()).isNull();
        assertThat(tracker.snapshot().locationHistory()).isEmpty();
    }

    @Test
    void nonSessionLineIsIgnored() {
        assertThat(tracker.observe("<2024-05-01T18:21:00.000Z> [Notice] <Something Else> nothing to see")).isEmpty();
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                throw new AssertionError("condition not met within 3s");
            }
            Thread.sleep(20);
        }
    }
}
