package com.killfeed.engine.api;

import com.killfeed.engine.domain.service.scan.LogScanner;
import com.killfeed.engine.domain.service.session.SessionContextTracker;
import com.killfeed.engine.infra.disruptor.publish.IngestPublisher;
import com.killfeed.engine.infra.logfile.LogFileTailer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/session")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class SessionController {

    private static final int MAX_INGEST_CHARS = 1_000_000;

    private final SessionContextTracker sessionTracker;
    private final LogScanner logScanner;
    private final IngestPublisher ingestPublisher;
    private final LogFileTailer logFileTailer;

    @GetMapping
    public ResponseEntity<Map<String, Object>> snapshot() {
        Map<String, Object> tailer = new HashMap<>();
        tailer.put("active", logFileTailer.isActive());
        tailer.put("path", logFileTailer.getPath());
        tailer.put("offset", logFileTailer.getPosition());

        return ResponseEntity.ok(Map.of(
                "success", true,
                "session", sessionTracker.snapshot(),
                "duplicatesPrevented", logScanner.getDuplicatesPrevented(),
                "ingestUtilization", ingestPublisher.getRingBufferUtilization(),
                "tailer", tailer
        ));
    }

    @PostMapping("/rescan")
    public ResponseEntity<Map<String, Object>> rescan() {
        boolean fromFile = logFileTailer.rescan();
        if (!fromFile) {
            ingestPublisher.publishReset("api");
        }
        log.info("[API] 재스캔 요청: fromFile={}", fromFile);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", fromFile ? "rescan scheduled from start of log" : "session reset scheduled",
                "fromFile", fromFile
        ));
    }

    @PostMapping("/ingest")
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody IngestRequest req) {
        String text = req.text() == null ? "" : req.text();
        if (text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        if (text.length() > MAX_INGEST_CHARS) {
            throw new IllegalArgumentException("text exceeds " + MAX_INGEST_CHARS + " characters");
        }

        int lastNewline = text.lastIndexOf('\n');
        if (lastNewline < 0) {
            throw new IllegalArgumentException("text must contain at least one complete line");
        }
        String chunk = text.substring(0, lastNewline + 1);

        if (!ingestPublisher.publishChunk(chunk, "api")) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "success", false,
                    "code", "BACKPRESSURE",
                    "message", "ingest buffer is near capacity, retry later"
            ));
        }

        return ResponseEntity.accepted().body(Map.of(
                "success", true,
                "message", "chunk queued",
                "chars", chunk.length()
        ));
    }

    public record IngestRequest(String text) {
    }
}
