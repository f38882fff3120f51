package com.killfeed.engine.infra.definitions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.killfeed.engine.domain.model.ZoneKnowledgeUpdate;
import com.killfeed.engine.domain.service.entity.EntityDefinitions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class DefinitionsClient {

    private final OkHttpClient definitionsHttpClient;
    private final DefinitionsProperties properties;
    private final ObjectMapper objectMapper;

    public Optional<ZoneKnowledgeUpdate> fetchZones() {
        return fetch(properties.getZonesPath(), ZoneKnowledgeUpdate.class);
    }

    public Optional<EntityDefinitions> fetchEntities() {
        return fetch(properties.getEntitiesPath(), EntityDefinitions.class);
    }

    private <T> Optional<T> fetch(String path, Class<T> type) {
        if (!properties.isEnabled()) return Optional.empty();

        String url = stripTrailingSlash(properties.getBaseUrl()) + path;
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = definitionsHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[Definitions] 요청 실패: url={}, code={}", url, response.code());
                return Optional.empty();
            }

            ResponseBody body = response.body();
            if (body == null) return Optional.empty();

            T payload = objectMapper.readValue(body.string(), type);
            log.debug("[Definitions] 수신: url={}, type={}", url, type.getSimpleName());
            return Optional.ofNullable(payload);

        } catch (IOException e) {
            log.error("[Definitions] 요청 예외: url={}", url, e);
            return Optional.empty();
        }
    }

    private static String stripTrailingSlash(String baseUrl) {
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }
}
