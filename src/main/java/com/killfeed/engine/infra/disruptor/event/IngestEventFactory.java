package com.killfeed.engine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class IngestEventFactory implements EventFactory<IngestEvent> {

    @Override
    public IngestEvent newInstance() {
        return new IngestEvent();
    }
}
