package com.killfeed.engine.domain.service.enrichment;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.enrichment")
public class EnrichmentProperties {

    private boolean enabled = false;

    private long timeoutMs = 5000;

    private int threads = 2;
}
