package com.killfeed.engine.domain.service.zone;

import com.killfeed.engine.domain.model.PrimaryZoneType;
import com.killfeed.engine.domain.model.SecondaryZoneType;
import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.ZoneClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
public class ZoneClassifier {

    private static final List<Pattern> PRIMARY_PATTERNS = List.of(
            ci("^OOC_Stanton$"),
            ci("^OOC_Stanton_(\\d+)$"),
            ci("^OOC_Stanton_(\\d+)([a-z])$"),
            ci("^OOC_Pyro$"),
            ci("^OOC_Pyro_(\\d+)$"),
            ci("^OOC_Pyro_(\\d+)([a-z])$"),
            ci("^JP_"),
            ci("^Quantum_"),
            ci("^(Hurston|Crusader|ArcCorp|microTech)$")
    );

    private static final List<Pattern> SECONDARY_PATTERNS = List.of(
            ci("^OOC_Stanton_\\d+[a-z]?_(.+)$"),
            ci("^OOC_Pyro_\\d+[a-z]?_(.+)$"),
            ci("^(GrimHex|PortOlisar|PortTressler|Orison|NewBabbage|Area18|Lorville)$"),
            ci("^(.+)_(Outpost|Station|Mining|Research|Security|Medical)$"),
            ci("^(CRU-L[1-5]|HUR-L[1-5]|ARC-L[1-5]|MIC-L[1-5])$"),
            ci("^(Everus_Harbor|Baijini_Point|Tressler|Seraphim|Sentinel)$"),
            ci("^(.+)_(Admin|Industrial|Residential|Commercial)$"),
            ci("^R&R_"),
            ci("^SPK$"),
            ci("^(Kareah|Covalex|Comm_Array)$")
    );

    private static final Map<StarSystem, List<Pattern>> SYSTEM_PATTERNS = new LinkedHashMap<>();

    static {
        SYSTEM_PATTERNS.put(StarSystem.STANTON, List.of(
                ci("stanton"), ci("hurston"), ci("crusader"), ci("arccorp"), ci("microtech"),
                ci("orison"), ci("lorville"), ci("area18"), ci("newbabbage"),
                ci("grimhex"), ci("portolisar"), ci("porttressler"), ci("everus_harbor"), ci("baijini_point"),
                ci("^(CRU|HUR|ARC|MIC)-L\\d")));
        SYSTEM_PATTERNS.put(StarSystem.PYRO, List.of(ci("pyro"), ci("ruin_station")));
    }

    private static final Pattern BODY_INDEX = Pattern.compile("^OOC_[A-Za-z]+_\\d+$");
    private static final Pattern INSTANCE_SUFFIX = Pattern.compile("_\\d+$");
    private static final Pattern STANTON_MOON = ci("^OOC_Stanton_(\\d+)([a-z])$");
    private static final Pattern BODY_LOCATION = ci("^(OOC_(?:Stanton|Pyro)_\\d+[a-z]?)_");
    private static final Pattern WORD_START = Pattern.compile("\\b\\w");
    private static final Pattern PLANET = ci("^OOC_(Stanton|Pyro)_\\d+$");
    private static final Pattern MOON = ci("^OOC_(Stanton|Pyro)_\\d+[a-z]$");

    private static final List<TypeRule<PrimaryZoneType>> PRIMARY_TYPE_RULES = List.of(
            new TypeRule<>(ci("^OOC_(Stanton|Pyro)$"), PrimaryZoneType.SYSTEM),
            new TypeRule<>(ci("^JP_"), PrimaryZoneType.JUMP_POINT),
            new TypeRule<>(PLANET, PrimaryZoneType.PLANET),
            new TypeRule<>(ci("^(Hurston|Crusader|ArcCorp|microTech)$"), PrimaryZoneType.PLANET),
            new TypeRule<>(MOON, PrimaryZoneType.MOON),
            new TypeRule<>(ci("asteroid"), PrimaryZoneType.ASTEROID_FIELD)
    );

    private static final List<TypeRule<SecondaryZoneType>> SECONDARY_TYPE_RULES = List.of(
            new TypeRule<>(ci("^(GrimHex|PortOlisar|PortTressler|CRU-L\\d|HUR-L\\d|ARC-L\\d|MIC-L\\d|Everus_Harbor|Baijini_Point)$"),
                    SecondaryZoneType.STATION),
            new TypeRule<>(ci("^(Orison|NewBabbage|Area18|Lorville)$"), SecondaryZoneType.LANDING_ZONE),
            new TypeRule<>(ci("outpost|mining|research|security|medical"), SecondaryZoneType.OUTPOST),
            new TypeRule<>(ci("^R&R_"), SecondaryZoneType.STATION),
            new TypeRule<>(ci("derelict|wreck|abandoned"), SecondaryZoneType.DERELICT),
            new TypeRule<>(ci("asteroid"), SecondaryZoneType.ASTEROID),
            new TypeRule<>(ci("ship|vessel|craft"), SecondaryZoneType.SHIP)
    );

    private static final Map<String, String> STANTON_PLANETS = Map.of(
            "OOC_Stanton_1", "Hurston",
            "OOC_Stanton_2", "Crusader",
            "OOC_Stanton_3", "ArcCorp",
            "OOC_Stanton_4", "microTech"
    );

    private static final Map<String, String> STANTON_MOONS = Map.ofEntries(
            Map.entry("1a", "Arial"),
            Map.entry("1b", "Aberdeen"),
            Map.entry("1c", "Magda"),
            Map.entry("1d", "Ita"),
            Map.entry("2a", "Cellin"),
            Map.entry("2b", "Daymar"),
            Map.entry("2c", "Yela"),
            Map.entry("3a", "Lyria"),
            Map.entry("3b", "Wala"),
            Map.entry("4a", "Calliope"),
            Map.entry("4b", "Clio"),
            Map.entry("4c", "Euterpe")
    );

    private static final Map<String, String> KNOWN_LOCATIONS = Map.of(
            "GrimHex", "GrimHEX",
            "PortOlisar", "Port Olisar",
            "PortTressler", "Port Tressler",
            "Orison", "Orison Landing Zone",
            "NewBabbage", "New Babbage",
            "Area18", "Area18",
            "Lorville", "Lorville",
            "SPK", "Security Post Kareah"
    );

    private static final Map<String, String> STATION_ASSOCIATIONS = Map.of(
            "PortOlisar", "OOC_Stanton_2",
            "PortTressler", "OOC_Stanton_4",
            "Everus_Harbor", "OOC_Stanton_1",
            "Baijini_Point", "OOC_Stanton_3",
            "GrimHex", "OOC_Stanton_2c",
            "Lorville", "OOC_Stanton_1",
            "Orison", "OOC_Stanton_2",
            "Area18", "OOC_Stanton_3",
            "NewBabbage", "OOC_Stanton_4"
    );

    public ZoneClassification classify(String token) {
        String cleanId = cleanZoneId(token);

        for (Pattern pattern : PRIMARY_PATTERNS) {
            if (pattern.matcher(cleanId).find()) {
                log.debug("[Zone] '{}' → PRIMARY", cleanId);
                return ZoneClassification.PRIMARY;
            }
        }
        for (Pattern pattern : SECONDARY_PATTERNS) {
            if (pattern.matcher(cleanId).find()) {
                log.debug("[Zone] '{}' → SECONDARY", cleanId);
                return ZoneClassification.SECONDARY;
            }
        }
        log.debug("[Zone] '{}' 패턴 미일치 → SECONDARY 기본값", cleanId);
        return ZoneClassification.SECONDARY;
    }

    public StarSystem determineSystem(String token) {
        String cleanId = cleanZoneId(token);
        for (Map.Entry<StarSystem, List<Pattern>> entry : SYSTEM_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(cleanId).find()) {
                    return entry.getKey();
                }
            }
        }
        return StarSystem.UNKNOWN;
    }

    public PrimaryZoneType determinePrimaryType(String token) {
        String cleanId = cleanZoneId(token);
        for (TypeRule<PrimaryZoneType> rule : PRIMARY_TYPE_RULES) {
            if (rule.pattern().matcher(cleanId).find()) return rule.type();
        }
        return PrimaryZoneType.SYSTEM;
    }

    public SecondaryZoneType determineSecondaryType(String token) {
        String cleanId = cleanZoneId(token);
        for (TypeRule<SecondaryZoneType> rule : SECONDARY_TYPE_RULES) {
            if (rule.pattern().matcher(cleanId).find()) return rule.type();
        }
        return SecondaryZoneType.POI;
    }

    public String generateDisplayName(String token) {
        String cleanId = cleanZoneId(token);
        if (cleanId.isEmpty()) return "Unknown";

        String planet = STANTON_PLANETS.get(cleanId);
        if (planet != null) return planet;

        Matcher moon = STANTON_MOON.matcher(cleanId);
        if (moon.matches()) {
            String planetNumber = moon.group(1);
            String letter = moon.group(2).toLowerCase();
            String moonName = STANTON_MOONS.get(planetNumber + letter);
            if (moonName != null) return moonName;
            String parent = STANTON_PLANETS.getOrDefault("OOC_Stanton_" + planetNumber, "Planet " + planetNumber);
            return parent + " " + letter.toUpperCase();
        }

        if ("OOC_Stanton".equalsIgnoreCase(cleanId)) return "Stanton System";
        if ("OOC_Pyro".equalsIgnoreCase(cleanId)) return "Pyro System";

        String known = KNOWN_LOCATIONS.get(cleanId);
        if (known != null) return known;

        String spaced = cleanId.replaceFirst("^OOC_", "").replace('_', ' ').trim();
        if (spaced.isEmpty()) return "Unknown";
        return WORD_START.matcher(spaced).replaceAll(m -> m.group().toUpperCase());
    }

    public Optional<String> derivePrimaryZoneId(String secondaryToken) {
        String cleanId = cleanZoneId(secondaryToken);

        Matcher body = BODY_LOCATION.matcher(cleanId);
        if (body.find()) {
            return Optional.of(body.group(1));
        }
        return Optional.ofNullable(STATION_ASSOCIATIONS.get(cleanId));
    }

    public Optional<String> deriveParentZoneId(String primaryToken) {
        String cleanId = cleanZoneId(primaryToken);
        if (MOON.matcher(cleanId).matches()) {
            return Optional.of(cleanId.substring(0, cleanId.length() - 1));
        }
        if (PLANET.matcher(cleanId).matches()) {
            return Optional.of(cleanId.substring(0, cleanId.lastIndexOf('_')));
        }
        return Optional.empty();
    }

    public String cleanZoneId(String token) {
        if (token == null) return "";
        String trimmed = token.trim();
        if (BODY_INDEX.matcher(trimmed).matches()) return trimmed;
        return INSTANCE_SUFFIX.matcher(trimmed).replaceFirst("");
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private record TypeRule<T>(Pattern pattern, T type) {
    }
}
