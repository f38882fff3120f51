package com.killfeed.engine.infra.disruptor.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.pipeline")
public class PipelineProperties {

    private int ingestBufferSize = 4096;

    private int outputBufferSize = 4096;

    private String waitStrategy;

    private long shutdownTimeoutMs = 5000;
}
