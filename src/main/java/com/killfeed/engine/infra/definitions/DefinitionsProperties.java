package com.killfeed.engine.infra.definitions;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.definitions")
public class DefinitionsProperties {

    private String baseUrl;

    private long syncIntervalMs = 3_600_000;

    private String zonesPath = "/api/definitions/zones";

    private String entitiesPath = "/api/definitions/entities";

    private long connectTimeoutMs = 10_000;

    private long callTimeoutMs = 30_000;

    public boolean isEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
