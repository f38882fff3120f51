package com.killfeed.engine.domain.service.zone;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.zone")
public class ZoneProperties {

    private int historySize = 10;
    private double confidenceThreshold = 0.6;
    private double proximityRadius = 100_000;
}
