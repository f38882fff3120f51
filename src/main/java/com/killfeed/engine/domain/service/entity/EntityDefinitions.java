package com.killfeed.engine.domain.service.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EntityDefinitions {

    private String version;
    private Map<String, String> ships = new LinkedHashMap<>();
    private Map<String, String> weapons = new LinkedHashMap<>();
    private Map<String, String> objects = new LinkedHashMap<>();
    private Map<String, String> npcs = new LinkedHashMap<>();
    private List<NamePattern> npcNamePatterns = List.of();
    private List<NamePattern> objectPatterns = List.of();
    private NpcIgnoreList npcIgnoreList;

    public record NamePattern(String regex, String template) {
    }

    public record NpcIgnoreList(List<String> exactMatches, List<String> regexPatterns) {
    }

    public static NpcIgnoreList defaultNpcIgnoreList() {
        return new NpcIgnoreList(
                List.of("Security", "SecurityGuard", "Civilian", "UEESecurity", "Pirate",
                        "NineTails", "Security Backup", "Stanton Security", "Crusader Security",
                        "Microtech Security", "Hurston Security", "Arccorp Security", "Bounty Hunter"),
                List.of("^PU_Human", "^NPC_", "_NPC$", "^Security_.*", "^Guard_.*",
                        "^Civilian_.*", "^Pirate_.*", "^BountyTarget_.*", "^[A-Za-z]+Security$",
                        "^[A-Za-z]+Guard$", "^[A-Za-z]+Police$", "^PU_Pilots", "^AIModule_",
                        "^Kopion_", "^vlk_juvenile_sentry_", "^Orbital_Sentry_", "_PU_AI_"));
    }
}
