package com.killfeed.engine.domain.service.entity;

import com.killfeed.engine.domain.model.MatchMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Slf4j
@Component
public class DefinitionsEntityNameResolver implements EntityNameResolver {

    private static final Set<String> MANUFACTURER_PREFIXES = Set.of(
            "ORIG", "CRUS", "RSI", "AEGS", "VNCL", "DRAK", "ANVL", "BANU", "MISC",
            "CNOU", "XIAN", "GAMA", "TMBL", "ESPR", "KRIG", "GRIN", "XNAA", "MRAI");

    private static final Pattern INSTANCE_SUFFIX = Pattern.compile("^(.+?)_\\d+$");
    private static final Pattern LITERAL_CHARS = Pattern.compile("[a-zA-Z0-9_]");
    private static final Pattern WILDCARD_CHARS = Pattern.compile("[.*+?]");

    private volatile Definitions current;

    public DefinitionsEntityNameResolver() {
        this.current = compile(new EntityDefinitions());
    }

    @Override
    public ResolvedEntity resolve(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            return new ResolvedEntity(entityId, "Unknown", false, EntityCategory.UNKNOWN, MatchMethod.FALLBACK);
        }
        Definitions defs = current;
        boolean npc = defs.isNpc(entityId);

        Map.Entry<String, EntityCategory> exact = defs.exact.get(entityId);
        if (exact != null) {
            return new ResolvedEntity(entityId, exact.getKey(), npc || exact.getValue() == EntityCategory.NPC,
                    exact.getValue(), MatchMethod.EXACT);
        }

        for (CompiledPattern pattern : defs.npcNamePatterns) {
            if (pattern.regex().matcher(entityId).find()) {
                return new ResolvedEntity(entityId, pattern.template(), true, EntityCategory.NPC, MatchMethod.PATTERN);
            }
        }
        for (CompiledPattern pattern : defs.objectPatterns) {
            if (pattern.regex().matcher(entityId).find()) {
                return new ResolvedEntity(entityId, pattern.template(), npc, EntityCategory.OBJECT, MatchMethod.PATTERN);
            }
        }

        return new ResolvedEntity(entityId, cleanEntityName(entityId), npc,
                npc ? EntityCategory.NPC : EntityCategory.UNKNOWN, MatchMethod.FALLBACK);
    }

    @Override
    public boolean isNpc(String entityId) {
        return entityId != null && current.isNpc(entityId);
    }

    @Override
    public void applyDefinitions(EntityDefinitions definitions) {
        if (definitions == null) return;
        Definitions compiled = compile(definitions);
        current = compiled;
        log.info("[Entity] 정의 적용: version={}, exact={}, npcPatterns={}, objectPatterns={}, ignoreRegex={}",
                definitions.getVersion(), compiled.exact.size(), compiled.npcNamePatterns.size(),
                compiled.objectPatterns.size(), compiled.ignorePatterns.size());
    }

    @Override
    public String definitionsVersion() {
        return current.version;
    }

    static String cleanEntityName(String entityId) {
        Matcher suffix = INSTANCE_SUFFIX.matcher(entityId);
        String cleaned = suffix.matches() ? suffix.group(1) : entityId;

        String[] parts = cleaned.split("_");
        if (parts.length > 1 && MANUFACTURER_PREFIXES.contains(parts[0])) {
            cleaned = String.join(" ", List.of(parts).subList(1, parts.length));
        }
        return cleaned.replace('_', ' ');
    }

    private Definitions compile(EntityDefinitions definitions) {
        Map<String, Map.Entry<String, EntityCategory>> exact = new HashMap<>();
        putAll(exact, definitions.getShips(), EntityCategory.SHIP);
        putAll(exact, definitions.getWeapons(), EntityCategory.WEAPON);
        putAll(exact, definitions.getObjects(), EntityCategory.OBJECT);
        putAll(exact, definitions.getNpcs(), EntityCategory.NPC);

        EntityDefinitions.NpcIgnoreList ignoreList = definitions.getNpcIgnoreList() != null
                ? definitions.getNpcIgnoreList()
                : EntityDefinitions.defaultNpcIgnoreList();

        List<Pattern> ignorePatterns = new ArrayList<>();
        for (String regex : nullSafe(ignoreList.regexPatterns())) {
            compileRegex(regex, "npc-ignore").ifPresent(ignorePatterns::add);
        }

        return new Definitions(
                definitions.getVersion(),
                exact,
                compilePatterns(definitions.getNpcNamePatterns(), "npc"),
                compilePatterns(definitions.getObjectPatterns(), "object"),
                Set.copyOf(nullSafe(ignoreList.exactMatches())),
                ignorePatterns);
    }

    private List<CompiledPattern> compilePatterns(List<EntityDefinitions.NamePattern> patterns, String category) {
        List<CompiledPattern> compiled = new ArrayList<>();
        for (EntityDefinitions.NamePattern pattern : nullSafe(patterns)) {
            compileRegex(pattern.regex(), category).ifPresent(regex ->
                    compiled.add(new CompiledPattern(regex, pattern.template(), specificity(pattern.regex()))));
        }
        compiled.sort(Comparator.comparingInt(CompiledPattern::specificity).reversed());
        return List.copyOf(compiled);
    }

    private Optional<Pattern> compileRegex(String regex, String category) {
        if (regex == null || regex.isBlank()) return Optional.empty();
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            log.warn("[Entity] 잘못된 {} 패턴 무시: {}", category, regex);
            return Optional.empty();
        }
    }

    private static int specificity(String regex) {
        int score = (int) LITERAL_CHARS.matcher(regex).results().count();
        score -= (int) WILDCARD_CHARS.matcher(regex).results().count() * 2;
        if (regex.startsWith("^")) score += 5;
        if (regex.endsWith("$")) score += 5;
        return score;
    }

    private static void putAll(Map<String, Map.Entry<String, EntityCategory>> target,
                               Map<String, String> names, EntityCategory category) {
        if (names == null) return;
        names.forEach((id, name) -> {
            if (name != null && !name.isBlank()) {
                target.putIfAbsent(id, Map.entry(name, category));
            }
        });
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    private record CompiledPattern(Pattern regex, String template, int specificity) {
    }

    private record Definitions(
            String version,
            Map<String, Map.Entry<String, EntityCategory>> exact,
            List<CompiledPattern> npcNamePatterns,
            List<CompiledPattern> objectPatterns,
            Set<String> ignoreExact,
            List<Pattern> ignorePatterns
    ) {
        boolean isNpc(String entityId) {
            if (ignoreExact.contains(entityId)) return true;
            for (Pattern pattern : ignorePatterns) {
                if (pattern.matcher(entityId).find()) return true;
            }
            return false;
        }
    }
}
