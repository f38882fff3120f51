package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.DeathType;
import com.killfeed.engine.domain.service.entity.DefinitionsEntityNameResolver;
import com.killfeed.engine.domain.service.entity.EntityDefinitions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EventDescriptionFormatterTest {

    private DefinitionsEntityNameResolver entityNameResolver;
    private EventDescriptionFormatter formatter;

    @BeforeEach
    void setUp() {
        entityNameResolver = new DefinitionsEntityNameResolver();
        formatter = new EventDescriptionFormatter(entityNameResolver);
    }

    @Test
    void placeholderVictimIsDescribedByShip() {
        String text = formatter.format(List.of("Kelvin"), List.of("AEGS_Avenger"), "AEGS_Avenger", DeathType.HARD);

        assertThat(text).isEqualTo("Kelvin destroyed Avenger");
    }

    @Test
    void namedVictimOwnsTheShip() {
        String text = formatter.format(List.of("Kelvin"), List.of("TestPilot"), "AEGS_Avenger", DeathType.HARD);

        assertThat(text).isEqualTo("Kelvin destroyed TestPilot's Avenger");
    }

    @Test
    void softDeathDisables() {
        assertThat(formatter.format(List.of("Kelvin"), List.of("TestPilot"), "AEGS_Avenger", DeathType.SOFT))
                .isEqualTo("Kelvin disabled TestPilot's Avenger");
        assertThat(formatter.format(List.of("Kelvin"), List.of("AEGS_Avenger"), "AEGS_Avenger", DeathType.SOFT))
                .isEqualTo("Kelvin disabled Avenger");
    }

    @Test
    void environmentalDeaths() {
        assertThat(formatter.format(List.of("Environment"), List.of("Kelvin"), "Player", DeathType.SUFFOCATION))
                .isEqualTo("Kelvin suffocated");
        assertThat(formatter.format(List.of("Environment"), List.of("Kelvin"), "Player", DeathType.BLEED_OUT))
                .isEqualTo("Kelvin bled out");
        assertThat(formatter.format(List.of("Environment"), List.of("Kelvin"), "Player", DeathType.UNKNOWN))
                .isEqualTo("Kelvin succumbed to environmental factors");
    }

    @Test
    void crashAndCollision() {
        assertThat(formatter.format(List.of(), List.of("Kelvin"), "AEGS_Avenger", DeathType.CRASH))
                .isEqualTo("Kelvin (Avenger) crashed");
        assertThat(formatter.format(List.of("unknown"), List.of("Kelvin"), "DRAK_Cutlass_Black", DeathType.COLLISION))
                .isEqualTo("A collision occurred involving Kelvin (Cutlass Black)");
        assertThat(formatter.format(List.of("Other"), List.of("Kelvin"), "DRAK_Cutlass_Black", DeathType.COLLISION))
                .isEqualTo("Other collided with Kelvin (Cutlass Black)");
        assertThat(formatter.format(List.of("Other"), List.of("DRAK_Cutlass_Black"), "DRAK_Cutlass_Black", DeathType.COLLISION))
                .isEqualTo("Other's vessel collided with Cutlass Black");
    }

    @Test
    void onFootKillHasNoCraft() {
        assertThat(formatter.format(List.of("Kelvin"), List.of("TestPilot"), "Player", DeathType.COMBAT))
                .isEqualTo("Kelvin destroyed TestPilot");
        assertThat(formatter.format(List.of("Kelvin"), List.of("TestPilot"), "Player", DeathType.UNKNOWN))
                .isEqualTo("Kelvin defeated TestPilot");
    }

    @Test
    void missingParticipantsAreUnknown() {
        assertThat(formatter.format(List.of(), List.of(), "Player", DeathType.COMBAT))
                .isEqualTo("Unknown destroyed Unknown");
    }

    @Test
    void definedEntitiesUseDisplayNamesButPlayersStayRaw() {
        EntityDefinitions definitions = new EntityDefinitions();
        definitions.setVersion("test");
        definitions.setShips(Map.of("AEGS_Avenger", "Avenger Titan"));
        definitions.setNpcNamePatterns(List.of(new EntityDefinitions.NamePattern("^PU_Human_Enemy_", "Outlaw")));
        entityNameResolver.applyDefinitions(definitions);

        assertThat(formatter.format(List.of("PU_Human_Enemy_GroundCombat_01"), List.of("Kelvin_2"), "AEGS_Avenger",
                DeathType.HARD))
                .isEqualTo("Outlaw destroyed Kelvin_2's Avenger Titan");
    }

    @Test
    void detectsPlaceholderVictim() {
        assertThat(EventDescriptionFormatter.isPlaceholderVictim(List.of("AEGS_Avenger"), "AEGS_Avenger")).isTrue();
        assertThat(EventDescriptionFormatter.isPlaceholderVictim(List.of("TestPilot"), "AEGS_Avenger")).isFalse();
        assertThat(EventDescriptionFormatter.isPlaceholderVictim(List.of("A", "B"), "A")).isFalse();
    }
}
