package com.killfeed.engine.domain.service.zone;

import com.killfeed.engine.domain.model.MatchMethod;
import com.killfeed.engine.domain.model.PrimaryZone;
import com.killfeed.engine.domain.model.SecondaryZone;
import com.killfeed.engine.domain.model.SecondaryZoneType;
import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.Zone;
import com.killfeed.engine.domain.model.ZoneClassification;
import com.killfeed.engine.domain.model.ZoneKnowledgeSource;
import com.killfeed.engine.domain.model.ZoneResolution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZoneResolverTest {

    private ZoneResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ZoneResolver(new ZoneClassifier(), new ZoneProperties());
    }

    @Test
    void resolvesSeededZoneExactly() {
        ZoneResolution resolution = resolver.resolveZone("GrimHex_042");

        assertThat(resolution.matchMethod()).isEqualTo(MatchMethod.EXACT);
        assertThat(resolution.confidence()).isEqualTo(1.0);
        assertThat(resolution.zone().getDisplayName()).isEqualTo("GrimHEX");
        assertThat(((SecondaryZone) resolution.zone()).getPrimaryZoneId()).isEqualTo("OOC_Stanton_2c");
    }

    @Test
    void blankTokenDegradesToFallback() {
        for (String token : new String[]{null, "", "   "}) {
            ZoneResolution resolution = resolver.resolveZone(token);
            assertThat(resolution.fallbackUsed()).isTrue();
            assertThat(resolution.confidence()).isZero();
            assertThat(resolution.zone().getDisplayName()).isEqualTo(ZoneResolver.FALLBACK_ZONE_NAME);
        }
    }

    @Test
    void buildsPrimaryFromPatternAndCachesIt() {
        ZoneResolution first = resolver.resolveZone("OOC_Stanton_3a");

        assertThat(first.matchMethod()).isEqualTo(MatchMethod.PATTERN);
        assertThat(first.zone()).isInstanceOf(PrimaryZone.class);
        PrimaryZone moon = (PrimaryZone) first.zone();
        assertThat(moon.getDisplayName()).isEqualTo("Lyria");
        assertThat(moon.getParentId()).isEqualTo("OOC_Stanton_3");
        assertThat(moon.getJurisdiction()).isEqualTo("ArcCorp");
        assertThat(moon.getSystem()).isEqualTo(StarSystem.STANTON);

        assertThat(resolver.resolveZone("OOC_Stanton_3a").matchMethod()).isEqualTo(MatchMethod.EXACT);
    }

    @Test
    void buildsSecondaryWithOrbitingBodyAndPurpose() {
        ZoneResolution resolution = resolver.resolveZone("OOC_Stanton_1b_Aberdeen_Mining");

        SecondaryZone zone = (SecondaryZone) resolution.zone();
        assertThat(zone.getType()).isEqualTo(SecondaryZoneType.OUTPOST);
        assertThat(zone.getPrimaryZoneId()).isEqualTo("OOC_Stanton_1b");
        assertThat(zone.getOrbitingBody()).isEqualTo("Aberdeen");
        assertThat(zone.getPurpose()).isEqualTo("Mining Operations");
        assertThat(resolution.confidence()).isEqualTo(0.6);
    }

    @Test
    void rejectsMissingZoneList() {
        assertThatThrownBy(() -> resolver.updateKnowledgeBase(null, "2.0", ZoneKnowledgeSource.SERVER, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replacesAndRestoresKnowledgeBase() {
        Zone custom = SecondaryZone.builder()
                .id("Custom_Base")
                .displayName("Custom Base")
                .system(StarSystem.PYRO)
                .confidence(1.0)
                .build();

        resolver.updateKnowledgeBase(List.of(custom), "2.0", ZoneKnowledgeSource.SERVER, true);

        ZoneDatabaseStats stats = resolver.getDatabaseStats();
        assertThat(stats.totalZones()).isEqualTo(1);
        assertThat(stats.version()).isEqualTo("2.0");
        assertThat(stats.source()).isEqualTo(ZoneKnowledgeSource.SERVER);
        assertThat(resolver.resolveZone("Custom_Base").matchMethod()).isEqualTo(MatchMethod.EXACT);
        assertThat(resolver.resolveZone("PortOlisar").matchMethod()).isEqualTo(MatchMethod.PATTERN);

        resolver.resetToSeed();
        assertThat(resolver.getDatabaseStats().source()).isEqualTo(ZoneKnowledgeSource.LOCAL);
        assertThat(resolver.resolveZone("Custom_Base").matchMethod()).isEqualTo(MatchMethod.PATTERN);
    }

    @Test
    void mergeKeepsExistingZones() {
        Zone custom = SecondaryZone.builder().id("Custom_Base").displayName("Custom Base").confidence(1.0).build();

        resolver.updateKnowledgeBase(List.of(custom), null, ZoneKnowledgeSource.SERVER, false);

        assertThat(resolver.resolveZone("GrimHex").matchMethod()).isEqualTo(MatchMethod.EXACT);
        assertThat(resolver.resolveZone("Custom_Base").matchMethod()).isEqualTo(MatchMethod.EXACT);
        assertThat(resolver.getDatabaseStats().version()).isEqualTo("1.0.0");
    }

    @Test
    void searchesAndListsByClassification() {
        assertThat(resolver.searchZones("olisar")).extracting(Zone::getId).containsExactly("PortOlisar");
        assertThat(resolver.searchZones(" ")).isEmpty();

        assertThat(resolver.getZonesByClassification(ZoneClassification.SECONDARY, StarSystem.STANTON))
                .extracting(Zone::getId)
                .containsExactlyInAnyOrder("PortOlisar", "GrimHex", "Lorville", "Area18");
        assertThat(resolver.getZonesByClassification(ZoneClassification.PRIMARY, StarSystem.PYRO)).isEmpty();
    }
}
