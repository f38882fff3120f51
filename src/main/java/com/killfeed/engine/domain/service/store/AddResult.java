package com.killfeed.engine.domain.service.store;

import com.killfeed.engine.domain.model.KillEvent;

public record AddResult(boolean isNew, KillEvent event, boolean persisted) {
}
