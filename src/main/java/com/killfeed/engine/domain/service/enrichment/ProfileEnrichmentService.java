package com.killfeed.engine.domain.service.enrichment;

import com.killfeed.engine.domain.model.KillEvent;
import com.killfeed.engine.domain.model.ProfileData;
import com.killfeed.engine.domain.service.store.EventStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Component
public class ProfileEnrichmentService {

    private final ProfileLookup profileLookup;
    private final EventStore eventStore;
    private final EnrichmentProperties properties;
    private final ExecutorService executor;

    public ProfileEnrichmentService(ProfileLookup profileLookup, EventStore eventStore,
                                    EnrichmentProperties properties) {
        this.profileLookup = profileLookup;
        this.eventStore = eventStore;
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger(0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getThreads()), runnable -> {
            Thread thread = new Thread(runnable, "profile-enrichment-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public CompletableFuture<Void> enrich(KillEvent event) {
        if (!properties.isEnabled() || event == null) {
            return CompletableFuture.completedFuture(null);
        }
        Set<String> names = new LinkedHashSet<>();
        event.getKillers().stream().filter(ProfileEnrichmentService::isLookupCandidate).forEach(names::add);
        event.getVictims().stream().filter(ProfileEnrichmentService::isLookupCandidate).forEach(names::add);
        if (names.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        String eventId = event.getId();
        return CompletableFuture
                .supplyAsync(() -> profileLookup.lookup(names), executor)
                .orTimeout(properties.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .handle((profiles, ex) -> {
                    if (ex != null) {
                        logFailure(eventId, ex);
                    } else if (profiles != null && !profiles.isEmpty()) {
                        apply(eventId, profiles);
                    }
                    return null;
                });
    }

    static boolean isLookupCandidate(String name) {
        return name != null && !name.isBlank()
                && !name.contains("_")
                && !"Environment".equalsIgnoreCase(name)
                && !"unknown".equalsIgnoreCase(name);
    }

    private void apply(String eventId, Map<String, ProfileData> profiles) {
        eventStore.patchProfiles(eventId, profiles).ifPresentOrElse(
                patched -> log.debug("[Enrichment] 프로필 반영: id={}, names={}", eventId, profiles.keySet()),
                () -> log.debug("[Enrichment] 대상 이벤트 없음: id={}", eventId));
    }

    private void logFailure(String eventId, Throwable ex) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            log.warn("[Enrichment] 프로필 조회 시간 초과: id={}, timeout={}ms", eventId, properties.getTimeoutMs());
        } else {
            log.warn("[Enrichment] 프로필 조회 실패: id={}", eventId, cause);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
