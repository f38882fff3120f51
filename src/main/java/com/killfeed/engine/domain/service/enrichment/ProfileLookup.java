package com.killfeed.engine.domain.service.enrichment;

import com.killfeed.engine.domain.model.ProfileData;

import java.util.Collection;
import java.util.Map;

public interface ProfileLookup {

    Map<String, ProfileData> lookup(Collection<String> playerNames);
}
