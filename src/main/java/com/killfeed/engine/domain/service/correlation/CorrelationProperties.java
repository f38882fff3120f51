package com.killfeed.engine.domain.service.correlation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.correlation")
public class CorrelationProperties {

    private long destructionDeathWindowMs = 15_000;

    private long recentDeathRetentionMs = 60_000;

    private long deathCoincidenceWindowMs = 5_000;

    private SelfInflictedPolicy selfInflictedPolicy = SelfInflictedPolicy.UNKNOWN;

    private boolean reverseOrderEnabled = true;
}
