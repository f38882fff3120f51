package com.killfeed.engine.domain.service.scan;

import com.killfeed.engine.domain.model.RawIncidentSignal;
import com.killfeed.engine.domain.model.SessionEvent;

import java.util.List;

public record ScanResult(
        List<RawIncidentSignal> signals,
        List<SessionEvent> sessionEvents,
        int linesScanned,
        int linesFailed
) {

    public static final ScanResult EMPTY = new ScanResult(List.of(), List.of(), 0, 0);
}
