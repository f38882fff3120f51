package com.killfeed.engine.api;

import com.killfeed.engine.domain.model.EventPage;
import com.killfeed.engine.domain.model.EventQuery;
import com.killfeed.engine.domain.model.EventSource;
import com.killfeed.engine.domain.model.KillEvent;
import com.killfeed.engine.domain.service.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

@Slf4j
@RestController
@RequestMapping("/api/events")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class EventController {

    private final EventStore eventStore;

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "false") boolean playerOnly,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) Long from,
            @RequestParam(required = false) Long to
    ) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (from != null && to != null && from > to) {
            throw new IllegalArgumentException("from must not be after to");
        }

        EventQuery.EventQueryBuilder builder = EventQuery.builder()
                .offset(offset)
                .playerOnly(playerOnly)
                .searchQuery(q)
                .source(parseSource(source))
                .fromEpochMs(from)
                .toEpochMs(to);
        if (limit != null) {
            builder.limit(limit);
        }

        EventPage page = eventStore.query(builder.build());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "events", page.events(),
                "total", page.total(),
                "hasMore", page.hasMore()
        ));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String id) {
        KillEvent event = eventStore.findById(id)
                .orElseThrow(() -> new NoSuchElementException("event not found: " + id));
        return ResponseEntity.ok(Map.of(
                "success", true,
                "event", event
        ));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "stats", eventStore.getStats()
        ));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        if (!eventStore.deleteEvent(id)) {
            throw new NoSuchElementException("event not found: " + id);
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "event deleted",
                "id", id
        ));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clear() {
        eventStore.clearAllEvents();
        log.info("[API] 전체 이벤트 삭제 요청 처리");
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "all events cleared"
        ));
    }

    static EventSource parseSource(String source) {
        if (source == null || source.isBlank()) return null;
        try {
            return EventSource.valueOf(source.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown source: " + source, e);
        }
    }
}
