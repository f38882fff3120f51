package com.killfeed.engine.infra.definitions;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class DefinitionsHttpConfig {

    @Bean
    public OkHttpClient definitionsHttpClient(DefinitionsProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .callTimeout(Duration.ofMillis(properties.getCallTimeoutMs()))
                .followRedirects(true)
                .retryOnConnectionFailure(true)
                .build();
    }
}
