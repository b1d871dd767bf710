package com.telesync.notify;

import java.util.UUID;

public final class Subscription implements AutoCloseable {

    private final String id = UUID.randomUUID().toString();
    private final String userId;
    private final EventSink sink;
    private final NotificationHub hub;

    Subscription(String userId, EventSink sink, NotificationHub hub) {
        this.userId = userId;
        this.sink = sink;
        this.hub = hub;
    }

    public String id() {
        return id;
    }

    public String userId() {
        return userId;
    }

    EventSink sink() {
        return sink;
    }

    @Override
    public void close() {
        hub.unsubscribe(this);
    }
}
