package com.killfeed.engine.domain.model;

import java.util.List;

public record EventPage(List<KillEvent> events, long total, boolean hasMore) {
}
