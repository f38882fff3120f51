package com.killfeed.engine.domain.service.session;

import com.killfeed.engine.domain.model.GameMode;

import java.util.List;

public record SessionSnapshot(
        String playerName,
        String vehicleName,
        GameMode stableMode,
        GameMode rawMode,
        GameMode pendingMode,
        String gameVersion,
        String currentLocation,
        List<String> locationHistory,
        long sessionStartEpochMs
) {
}
