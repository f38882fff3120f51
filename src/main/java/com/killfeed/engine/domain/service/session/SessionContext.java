package com.killfeed.engine.domain.service.session;

import com.killfeed.engine.domain.model.GameMode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class SessionContext {

    public static final String UNKNOWN_LOCATION = "Unknown";

    private final int locationHistorySize;

    private String playerName;
    private String vehicleName;
    private GameMode stableMode = GameMode.UNKNOWN;
    private GameMode rawMode = GameMode.UNKNOWN;
    private GameMode pendingMode;
    private String gameVersion;
    private String currentLocation;
    private final Deque<String> locationHistory = new ArrayDeque<>();
    private long sessionStartEpochMs;

    public SessionContext(int locationHistorySize) {
        this.locationHistorySize = locationHistorySize;
    }

    void reset(String reloadedPlayer) {
        playerName = reloadedPlayer;
        vehicleName = null;
        stableMode = GameMode.UNKNOWN;
        rawMode = GameMode.UNKNOWN;
        pendingMode = null;
        gameVersion = null;
        currentLocation = null;
        locationHistory.clear();
        sessionStartEpochMs = 0L;
    }

    void recordLocation(String location) {
        currentLocation = location;
        if (location.equals(locationHistory.peekLast())) return;
        locationHistory.addLast(location);
        while (locationHistory.size() > locationHistorySize) {
            locationHistory.pollFirst();
        }
    }

    public String getPlayerName() {
        return playerName;
    }

    void setPlayerName(String playerName) {
        this.playerName = playerName;
    }

    public String getVehicleName() {
        return vehicleName;
    }

    void setVehicleName(String vehicleName) {
        this.vehicleName = vehicleName;
    }

    public GameMode getStableMode() {
        return stableMode;
    }

    void setStableMode(GameMode stableMode) {
        this.stableMode = stableMode;
    }

    public GameMode getRawMode() {
        return rawMode;
    }

    void setRawMode(GameMode rawMode) {
        this.rawMode = rawMode;
    }

    public GameMode getPendingMode() {
        return pendingMode;
    }

    void setPendingMode(GameMode pendingMode) {
        this.pendingMode = pendingMode;
    }

    public String getGameVersion() {
        return gameVersion;
    }

    void setGameVersion(String gameVersion) {
        this.gameVersion = gameVersion;
    }

    public String getCurrentLocation() {
        return currentLocation;
    }

    void setCurrentLocation(String currentLocation) {
        this.currentLocation = currentLocation;
    }

    public List<String> getLocationHistory() {
        return new ArrayList<>(locationHistory);
    }

    public long getSessionStartEpochMs() {
        return sessionStartEpochMs;
    }

    void setSessionStartEpochMs(long sessionStartEpochMs) {
        this.sessionStartEpochMs = sessionStartEpochMs;
    }
}
