package com.killfeed.engine.infra.logfile;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.logfile")
public class LogFileProperties {

    private String path;

    private long pollIntervalMs = 1000;

    private boolean readFromStart = true;

    private int maxChunkBytes = 256 * 1024;

    public boolean isConfigured() {
        return path != null && !path.isBlank();
    }
}
