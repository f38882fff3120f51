package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class DeathTypeClassifierTest {

    private CorrelationProperties properties;
    private DeathTypeClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new CorrelationProperties();
        classifier = new DeathTypeClassifier(properties);
    }

    @ParameterizedTest
    @CsvSource({
            "2, Collision, Kelvin, Kelvin, CRASH",
            "2, Crash, unknown, Kelvin, CRASH",
            "2, Collision, Other, Kelvin, COLLISION",
            "0, BleedOut, Environment, Kelvin, BLEED_OUT",
            "0, SuffocationDamage, Environment, Kelvin, SUFFOCATION",
            "0, Suffocation, Environment, Kelvin, SUFFOCATION",
            "2, Combat, Other, Kelvin, HARD",
            "1, Combat, Other, Kelvin, SOFT",
            "0, Bullet, Environment, Kelvin, UNKNOWN",
            "0, Bullet, Other, Kelvin, COMBAT"
    })
    void classifiesByDamageLevelAndCauser(int level, String damage, String causer, String driver, DeathType expected) {
        assertThat(classifier.classify(level, damage, causer, driver)).isEqualTo(expected);
    }

    @Test
    void damageTypeOutranksDestructionLevel() {
        assertThat(classifier.classify(2, "BleedOut", "Other", "Kelvin")).isEqualTo(DeathType.BLEED_OUT);
    }

    @Test
    void selfInflictedFollowsPolicy() {
        assertThat(classifier.classify(0, "Bullet", "Kelvin", "Kelvin")).isEqualTo(DeathType.UNKNOWN);

        properties.setSelfInflictedPolicy(SelfInflictedPolicy.CRASH);
        assertThat(classifier.classify(0, "Bullet", "Kelvin", "Kelvin")).isEqualTo(DeathType.CRASH);
    }

    @Test
    void missingCauserCountsAsSelfInflicted() {
        assertThat(DeathTypeClassifier.isSelfInflicted(null, "Kelvin")).isTrue();
        assertThat(DeathTypeClassifier.isSelfInflicted("", "Kelvin")).isTrue();
        assertThat(DeathTypeClassifier.isSelfInflicted("UNKNOWN", "Kelvin")).isTrue();
        assertThat(DeathTypeClassifier.isSelfInflicted("kelvin", "Kelvin")).isTrue();
        assertThat(DeathTypeClassifier.isSelfInflicted("Other", "Kelvin")).isFalse();
    }
}
