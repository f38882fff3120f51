package com.killfeed.engine.api;

import com.killfeed.engine.domain.model.StarSystem;
import com.killfeed.engine.domain.model.ZoneClassification;
import com.killfeed.engine.domain.model.ZoneKnowledgeSource;
import com.killfeed.engine.domain.model.ZoneKnowledgeUpdate;
import com.killfeed.engine.domain.service.zone.HistoryFilter;
import com.killfeed.engine.domain.service.zone.ZoneHistoryManager;
import com.killfeed.engine.domain.service.zone.ZoneResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/zones")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class ZoneController {

    private final ZoneResolver zoneResolver;
    private final ZoneHistoryManager zoneHistoryManager;

    @GetMapping("/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@RequestParam String token) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "resolution", zoneResolver.resolveZone(token)
        ));
    }

    @GetMapping("/history")
    public ResponseEntity<Map<String, Object>> history(
            @RequestParam(required = false) String classification,
            @RequestParam(required = false) String system,
            @RequestParam(required = false) Long since,
            @RequestParam(required = false) Integer limit
    ) {
        HistoryFilter filter = new HistoryFilter(
                parseEnum(ZoneClassification.class, classification),
                parseEnum(StarSystem.class, system),
                since,
                limit);

        Map<String, Object> body = new HashMap<>();
        body.put("success", true);
        body.put("history", zoneHistoryManager.getHistory(filter));
        body.put("currentSystem", zoneHistoryManager.getCurrentSystem());
        body.put("currentZone", zoneHistoryManager.getCurrentZone().orElse(null));
        return ResponseEntity.ok(body);
    }

    @GetMapping("/statistics")
    public ResponseEntity<Map<String, Object>> statistics() {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "statistics", zoneHistoryManager.getZoneStatistics()
        ));
    }

    @GetMapping("/search")
    public ResponseEntity<Map<String, Object>> search(@RequestParam String q) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "zones", zoneResolver.searchZones(q)
        ));
    }

    @GetMapping("/type/{classification}")
    public ResponseEntity<Map<String, Object>> byClassification(
            @PathVariable String classification,
            @RequestParam(required = false) String system
    ) {
        ZoneClassification parsed = parseEnum(ZoneClassification.class, classification);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "zones", zoneResolver.getZonesByClassification(parsed, parseEnum(StarSystem.class, system))
        ));
    }

    @GetMapping("/knowledge-base")
    public ResponseEntity<Map<String, Object>> knowledgeBase() {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "stats", zoneResolver.getDatabaseStats()
        ));
    }

    @PutMapping("/knowledge-base")
    public ResponseEntity<Map<String, Object>> updateKnowledgeBase(@RequestBody ZoneKnowledgeUpdate update) {
        zoneResolver.updateKnowledgeBase(update.zones(), update.version(), ZoneKnowledgeSource.SERVER, update.replace());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "knowledge base updated",
                "stats", zoneResolver.getDatabaseStats()
        ));
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName() + ": " + value, e);
        }
    }
}
