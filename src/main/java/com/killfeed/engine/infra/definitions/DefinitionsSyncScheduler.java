package com.killfeed.engine.infra.definitions;

import com.killfeed.engine.domain.model.ZoneKnowledgeSource;
import com.killfeed.engine.domain.service.entity.EntityNameResolver;
import com.killfeed.engine.domain.service.zone.ZoneResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DefinitionsSyncScheduler {

    private final DefinitionsClient definitionsClient;
    private final DefinitionsProperties properties;
    private final ZoneResolver zoneResolver;
    private final EntityNameResolver entityNameResolver;

    @Scheduled(initialDelay = 5_000, fixedDelayString = "${killfeed.definitions.sync-interval-ms:3600000}")
    public void sync() {
        if (!properties.isEnabled()) return;

        definitionsClient.fetchZones().ifPresent(update -> {
            if (update.zones() == null || update.zones().isEmpty()) {
                log.warn("[Definitions] 빈 구역 목록 수신 - 적용 안 함 (version={})", update.version());
                return;
            }
            zoneResolver.updateKnowledgeBase(update.zones(), update.version(), ZoneKnowledgeSource.SERVER, update.replace());
        });

        definitionsClient.fetchEntities().ifPresent(definitions -> {
            entityNameResolver.applyDefinitions(definitions);
            log.info("[Definitions] 엔티티 정의 적용: version={}", entityNameResolver.definitionsVersion());
        });
    }
}
