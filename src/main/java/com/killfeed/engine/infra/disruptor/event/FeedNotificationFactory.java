package com.killfeed.engine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class FeedNotificationFactory implements EventFactory<FeedNotification> {

    @Override
    public FeedNotification newInstance() {
        return new FeedNotification();
    }
}
