package com.killfeed.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Getter
@Builder(toBuilder = true)
public class EventQuery {

    @Builder.Default
    private final int limit = 25;
    private final int offset;
    private final boolean playerOnly;
    private final String searchQuery;
    private final EventSource source;
    private final Long fromEpochMs;
    private final Long toEpochMs;

    public boolean isUnfiltered() {
        return !playerOnly && (searchQuery == null || searchQuery.isBlank())
                && source == null && fromEpochMs == null && toEpochMs == null;
    }

    public List<String> searchTerms() {
        if (searchQuery == null || searchQuery.isBlank()) return List.of();
        String cleaned = searchQuery.replaceAll("[:\"*%_]", " ").toLowerCase(Locale.ROOT).trim();
        if (cleaned.isEmpty()) return List.of();
        return Arrays.stream(cleaned.split("\\s+"))
                .filter(term -> !term.isBlank())
                .distinct()
                .toList();
    }
}
