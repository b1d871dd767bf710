package com.telesync.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig() {
        this(new SimpleMeterRegistry());
    }

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter detections() {
        return Counter.builder("telesync.monitor.detections").register(registry);
    }

    public Counter upstreamErrors() {
        return Counter.builder("telesync.monitor.upstream.errors").register(registry);
    }

    public Counter downloadsCompleted() {
        return Counter.builder("telesync.downloads.completed").register(registry);
    }

    public Counter downloadsFailed() {
        return Counter.builder("telesync.downloads.failed").register(registry);
    }

    public Counter bytesStored() {
        return Counter.builder("telesync.downloads.bytes").baseUnit("bytes").register(registry);
    }

    public Timer downloadLatency() {
        return Timer.builder("telesync.downloads.latency").register(registry);
    }
}
