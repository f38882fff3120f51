package com.killfeed.engine.infra.disruptor.event;

import com.killfeed.engine.domain.model.SessionEvent;
import com.killfeed.engine.domain.service.store.EventChange;

public class FeedNotification {

    private FeedNotificationType type;
    private EventChange change;
    private SessionEvent sessionEvent;
    private long publishNanoTime;

    public void clear() {
        type = null;
        change = null;
        sessionEvent = null;
        publishNanoTime = 0L;
    }

    public FeedNotificationType getType() {
        return type;
    }

    public void setType(FeedNotificationType type) {
        this.type = type;
    }

    public EventChange getChange() {
        return change;
    }

    public void setChange(EventChange change) {
        this.change = change;
    }

    public SessionEvent getSessionEvent() {
        return sessionEvent;
    }

    public void setSessionEvent(SessionEvent sessionEvent) {
        this.sessionEvent = sessionEvent;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "FeedNotification{type=" + type
                + ", change=" + (change == null ? null : change.type() + ":" + change.eventId())
                + ", session=" + sessionEvent + "}";
    }
}
