package com.killfeed.engine.domain.service.enrichment;

import com.killfeed.engine.domain.model.ProfileData;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

@Component
public class NoopProfileLookup implements ProfileLookup {

    @Override
    public Map<String, ProfileData> lookup(Collection<String> playerNames) {
        return Map.of();
    }
}
