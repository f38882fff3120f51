package com.killfeed.engine.domain.service.correlation;

import com.killfeed.engine.domain.model.RawIncidentSignal;

public interface IncidentSignalListener {

    void onSignal(RawIncidentSignal signal);

    default void onSessionReset() {
    }
}
