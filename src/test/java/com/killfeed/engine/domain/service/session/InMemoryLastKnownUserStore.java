package com.killfeed.engine.domain.service.session;

import java.util.Optional;

public class InMemoryLastKnownUserStore implements LastKnownUserStore {

    private String playerName;

    public InMemoryLastKnownUserStore() {
    }

    public InMemoryLastKnownUserStore(String playerName) {
        this.playerName = playerName;
    }

    @Override
    public Optional<String> load() {
        return Optional.ofNullable(playerName);
    }

    @Override
    public void save(String playerName) {
        this.playerName = playerName;
    }
}
