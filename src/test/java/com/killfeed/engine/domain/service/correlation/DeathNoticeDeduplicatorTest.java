package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathNoticeFormat;
import com.killfeed.engine.domain.service.correlation.DeathNoticeDeduplicator.Decision;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeathNoticeDeduplicatorTest {

    private static final long T0 = 1_714_587_723_000L;

    private SimpleMeterRegistry meterRegistry;
    private DeathNoticeDeduplicator deduplicator;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        deduplicator = new DeathNoticeDeduplicator(new CorrelationProperties(), meterRegistry);
    }

    @Test
    void sameFormatTwiceIsSuppressed() {
        assertThat(deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0)).isEqualTo(Decision.ACCEPTED);
        assertThat(deduplicator.evaluate("kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0 + 1_000)).isEqualTo(Decision.SUPPRESSED);

        assertThat(deduplicator.getDuplicatesPrevented()).isEqualTo(1);
        assertThat(meterRegistry.get("killfeed.death.duplicates_prevented").counter().count()).isEqualTo(1.0);
    }

    @Test
    void higherPriorityFormatUpgradesWithoutNewAcceptance() {
        deduplicator.evaluate("Kelvin", DeathNoticeFormat.LOCAL_DEATH_STATE, T0);

        assertThat(deduplicator.evaluate("Kelvin", DeathNoticeFormat.ACTOR_STATE_DEAD, T0 + 500)).isEqualTo(Decision.UPGRADED);
        assertThat(deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0 + 900)).isEqualTo(Decision.SUPPRESSED);
        assertThat(deduplicator.getDuplicatesPrevented()).isEqualTo(2);
    }

    @Test
    void reportsOutsideCoincidenceWindowAreSeparateDeaths() {
        deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0);

        assertThat(deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0 + 6_000)).isEqualTo(Decision.ACCEPTED);
    }

    @Test
    void deathStraddlingMinuteBoundaryIsStillRecognized() {
        long endOfMinute = 1_714_587_779_000L;
        deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, endOfMinute);

        assertThat(deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, endOfMinute + 2_000))
                .isEqualTo(Decision.SUPPRESSED);
    }

    @Test
    void differentPlayersDoNotCollide() {
        deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0);

        assertThat(deduplicator.evaluate("TestPilot", DeathNoticeFormat.LEGACY_CORPSE, T0)).isEqualTo(Decision.ACCEPTED);
    }

    @Test
    void resetForgetsRecordedDeaths() {
        deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0);

        deduplicator.reset();

        assertThat(deduplicator.evaluate("Kelvin", DeathNoticeFormat.LEGACY_CORPSE, T0 + 100)).isEqualTo(Decision.ACCEPTED);
    }
}
