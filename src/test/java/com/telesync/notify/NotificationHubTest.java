package com.telesync.notify;

import com.telesync.shared.model.HubEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NotificationHubTest {

    private static HubEvent event(String userId, String taskId) {
        return new HubEvent(HubEvent.DOWNLOAD_STARTED, userId, Map.of("taskId", taskId));
    }

    @Test
    void subscribersOnlySeeTheirOwnUser() {
        var hub = new NotificationHub();
        try (var a = hub.subscribe("A"); var b = hub.subscribe("B")) {
            hub.publish("A", event("A", "t1"));
            hub.publish("B", event("B", "t2"));

            var forA = a.drain();
            var forB = b.drain();
            assertEquals(1, forA.size());
            assertEquals("A", forA.get(0).userId());
            assertEquals(1, forB.size());
            assertEquals("t2", forB.get(0).taskId());
        }
    }

    @Test
    void eventForAnotherUserIsRefused() {
        var hub = new NotificationHub();
        assertThrows(IllegalArgumentException.class, () -> hub.publish("A", event("B", "t1")));
    }

    @Test
    void lateSubscriberMissesEarlierEvents() {
        var hub = new NotificationHub();
        hub.publish("A", event("A", "early"));
        try (var late = hub.subscribe("A")) {
            hub.publish("A", event("A", "later"));
            var got = late.drain();
            assertEquals(1, got.size());
            assertEquals("later", got.get(0).taskId());
        }
    }

    @Test
    void failingSinkDoesNotStopDelivery() {
        var hub = new NotificationHub();
        hub.subscribe("A", e -> { throw new IllegalStateException("socket closed"); });
        try (var healthy = hub.subscribe("A")) {
            hub.publish("A", event("A", "t1"));
            assertEquals(1, healthy.drain().size());
        }
    }

    @Test
    void closedSubscriptionReceivesNothing() {
        var hub = new NotificationHub();
        var stream = hub.subscribe("A");
        stream.close();
        hub.publish("A", event("A", "t1"));
        assertTrue(stream.drain().isEmpty());
        assertEquals(0, hub.subscriberCount("A"));
    }

    @Test
    void churnDoesNotLoseOrDuplicateEvents() throws Exception {
        var hub = new NotificationHub();
        var received = Collections.synchronizedList(new ArrayList<String>());
        var steady = hub.subscribe("A", e -> received.add(e.taskId()));
        int events = 500;
        var start = new CountDownLatch(1);
        var pool = Executors.newFixedThreadPool(4);
        pool.submit(() -> {
            start.await();
            for (int i = 0; i < events; i++) hub.publish("A", event("A", "t" + i));
            return null;
        });
        for (int t = 0; t < 3; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 200; i++) hub.subscribe("A", e -> { }).close();
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        steady.close();

        assertEquals(events, received.size());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < events; i++) expected.add("t" + i);
        assertEquals(expected, received);
        assertEquals(0, hub.subscriberCount("A"));
    }
}
