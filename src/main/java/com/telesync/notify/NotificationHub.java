package com.telesync.notify;

import com.telesync.shared.model.HubEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Per-user publish/subscribe. Each user is a separate topic: an event is only ever handed to
 * subscribers registered under the user it belongs to. Late subscribers see only later events.
 */
public class NotificationHub {

    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    // userId -> subscribers
    private final Map<String, Set<Subscription>> topics = new ConcurrentHashMap<>();

    public Subscription subscribe(String userId, EventSink sink) {
        var sub = new Subscription(userId, sink, this);
        topics.compute(userId, (k, subs) -> {
            var set = subs != null ? subs : new CopyOnWriteArraySet<Subscription>();
            set.add(sub);
            return set;
        });
        log.debug("Subscriber {} joined topic {}", sub.id(), userId);
        return sub;
    }

    public EventStream subscribe(String userId) {
        var stream = new EventStream();
        stream.attach(subscribe(userId, stream));
        return stream;
    }

    void unsubscribe(Subscription sub) {
        topics.computeIfPresent(sub.userId(), (k, subs) -> {
            subs.remove(sub);
            return subs.isEmpty() ? null : subs;
        });
    }

    public void publish(String userId, HubEvent event) {
        if (!userId.equals(event.userId())) {
            throw new IllegalArgumentException("Event for user " + event.userId()
                    + " published on topic " + userId);
        }
        var subs = topics.get(userId);
        if (subs == null) return;
        for (var sub : subs) {
            try {
                sub.sink().accept(event);
            } catch (Exception e) {
                log.warn("Dropping {} for subscriber {}: {}", event.type(), sub.id(), e.getMessage());
            }
        }
    }

    public int subscriberCount(String userId) {
        var subs = topics.get(userId);
        return subs == null ? 0 : subs.size();
    }
}
