package com.killfeed.engine.domain.service.store;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.store")
public class EventStoreProperties {

    private int maxEvents = 1000;

    private int mirrorSize = 50;

    private long fingerprintWindowMs = 10_000;

    private int defaultPageSize = 25;

    private int maxPageSize = 200;

    private int writeRetries = 1;
}
