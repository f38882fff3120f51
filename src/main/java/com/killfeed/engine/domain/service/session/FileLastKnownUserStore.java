package com.killfeed.engine.domain.service.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Slf4j
@Component
public class FileLastKnownUserStore implements LastKnownUserStore {

    private final Path file;

    public FileLastKnownUserStore(SessionProperties properties) {
        this.file = Path.of(properties.getLastUserFile());
    }

    @Override
    public Optional<String> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String name = Files.readString(file, StandardCharsets.UTF_8).trim();
            return name.isEmpty() ? Optional.empty() : Optional.of(name);
        } catch (IOException e) {
            log.warn("[Session] 마지막 사용자 파일 읽기 실패: {}", file, e);
            return Optional.empty();
        }
    }

    @Override
    public void save(String playerName) {
        if (playerName == null || playerName.isBlank()) return;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, playerName, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[Session] 마지막 사용자 저장 실패: player={}, file={}", playerName, file, e);
        }
    }
}
