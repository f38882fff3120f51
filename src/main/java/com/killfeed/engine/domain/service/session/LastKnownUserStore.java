package com.killfeed.engine.domain.service.session;

import java.util.Optional;

public interface LastKnownUserStore {

    Optional<String> load();

    void save(String playerName);
}
