package com.telesync.notify;

import com.telesync.shared.model.HubEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** Pull-style subscription: events queue up until the consumer takes them. */
public class EventStream implements EventSink, AutoCloseable {

    private final BlockingQueue<HubEvent> queue = new LinkedBlockingQueue<>();
    private volatile Subscription subscription;

    void attach(Subscription subscription) {
        this.subscription = subscription;
    }

    @Override
    public void accept(HubEvent event) {
        queue.add(event);
    }

    /** Next event, or null after waiting {@code timeout}. */
    public HubEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public List<HubEvent> drain() {
        var out = new ArrayList<HubEvent>();
        queue.drainTo(out);
        return out;
    }

    @Override
    public void close() {
        if (subscription != null) subscription.close();
    }
}
