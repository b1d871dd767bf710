package com.telesync.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MetricsConfigTest {

    @Test
    void countersShareOneRegistry() {
        var registry = new SimpleMeterRegistry();
        var metrics = new MetricsConfig(registry);

        metrics.detections().increment();
        metrics.detections().increment();
        metrics.downloadsFailed().increment();
        metrics.bytesStored().increment(2048);
        metrics.downloadLatency().record(Duration.ofMillis(30));

        assertEquals(2.0, registry.counter("telesync.monitor.detections").count());
        assertEquals(1.0, registry.counter("telesync.downloads.failed").count());
        assertEquals(2048.0, registry.get("telesync.downloads.bytes").counter().count());
        assertEquals(1, registry.get("telesync.downloads.latency").timer().count());
    }
}
