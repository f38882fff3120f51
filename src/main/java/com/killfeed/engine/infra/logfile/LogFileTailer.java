package com.killfeed.engine.infra.logfile;

import com.killfeed.engine.infra.disruptor.publish.IngestPublisher;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

@Slf4j
@Component
public class LogFileTailer {

    private static final byte NEWLINE = '\n';

    private final LogFileProperties properties;
    private final IngestPublisher ingestPublisher;

    private final ByteArrayOutputStream remainder = new ByteArrayOutputStream();
    private long position;
    private boolean started;
    private boolean skippingOversizedLine;

    public LogFileTailer(LogFileProperties properties, IngestPublisher ingestPublisher) {
        this.properties = properties;
        this.ingestPublisher = ingestPublisher;
    }

    @PostConstruct
    public synchronized void start() {
        if (!properties.isConfigured()) {
            log.info("[Tailer] 로그 파일 경로 미설정 - 수동 ingest 전용 모드");
            return;
        }
        Path path = logPath();
        position = 0L;
        if (!properties.isReadFromStart() && Files.exists(path)) {
            try {
                position = Files.size(path);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read size of " + path, e);
            }
        }
        started = true;
        log.info("[Tailer] 로그 추적 시작: path={}, offset={}, readFromStart={}",
                path, position, properties.isReadFromStart());
    }

    @Scheduled(fixedDelayString = "${killfeed.logfile.poll-interval-ms:1000}")
    public void scheduledPoll() {
        try {
            poll();
        } catch (UncheckedIOException e) {
            log.warn("[Tailer] 로그 파일 읽기 실패: path={}, cause={}", properties.getPath(), e.getCause().getMessage());
        }
    }

    public synchronized int poll() {
        if (!started) return 0;

        Path path = logPath();
        if (!Files.exists(path)) return 0;

        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size < position) {
                log.info("[Tailer] 로그 파일 축소 감지 (size={}, offset={}) - 처음부터 다시 읽음", size, position);
                rewind("truncated");
            }
            if (size == position) return 0;

            int toRead = (int) Math.min(size - position, properties.getMaxChunkBytes());
            ByteBuffer buffer = ByteBuffer.allocate(toRead);
            int read = 0;
            while (read < toRead) {
                int n = channel.read(buffer, position + read);
                if (n < 0) break;
                read += n;
            }
            return consume(buffer.array(), read);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    public synchronized boolean rescan() {
        if (!started) return false;
        rewind("rescan");
        log.info("[Tailer] 재스캔 요청: path={}", properties.getPath());
        return true;
    }

    public synchronized long getPosition() {
        return position;
    }

    public boolean isActive() {
        return started;
    }

    public String getPath() {
        return properties.getPath();
    }

    private int consume(byte[] bytes, int length) {
        int lastNewline = -1;
        for (int i = length - 1; i >= 0; i--) {
            if (bytes[i] == NEWLINE) {
                lastNewline = i;
                break;
            }
        }

        if (lastNewline < 0) {
            if (!skippingOversizedLine && remainder.size() + length > properties.getMaxChunkBytes()) {
                log.warn("[Tailer] 개행 없는 라인이 {}바이트 초과 - 다음 개행까지 폐기 (offset={})",
                        properties.getMaxChunkBytes(), position);
                remainder.reset();
                skippingOversizedLine = true;
            }
            if (!skippingOversizedLine) {
                remainder.write(bytes, 0, length);
            }
            position += length;
            return length;
        }

        int start = 0;
        if (skippingOversizedLine) {
            while (bytes[start] != NEWLINE) {
                start++;
            }
            start++;
        }

        if (start <= lastNewline) {
            ByteArrayOutputStream lines = new ByteArrayOutputStream(remainder.size() + lastNewline + 1 - start);
            lines.write(remainder.toByteArray(), 0, remainder.size());
            lines.write(bytes, start, lastNewline + 1 - start);
            if (!ingestPublisher.publishChunk(lines.toString(StandardCharsets.UTF_8), properties.getPath())) {
                return 0;
            }
        }

        skippingOversizedLine = false;
        remainder.reset();
        remainder.write(bytes, lastNewline + 1, length - lastNewline - 1);
        position += length;
        return length;
    }

    private void rewind(String reason) {
        position = 0L;
        remainder.reset();
        skippingOversizedLine = false;
        ingestPublisher.publishReset(reason);
    }

    private Path logPath() {
        return Path.of(properties.getPath());
    }
}
