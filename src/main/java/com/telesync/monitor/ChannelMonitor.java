package com.telesync.monitor;

import com.telesync.channels.ChannelRegistry;
import com.telesync.downloads.DownloadPipeline;
import com.telesync.observability.MetricsConfig;
import com.telesync.shared.model.Channel;
import com.telesync.shared.model.Credentials;
import com.telesync.upstream.MediaFilter;
import com.telesync.upstream.UpstreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polling loop for one connected user. Each tick scans the user's active channels in order;
 * a channel whose upstream query fails is logged and skipped, the rest of the tick goes on.
 * The loop owns a dedicated thread, released by {@link #stop()}.
 */
public class ChannelMonitor {

    private static final Logger log = LoggerFactory.getLogger(ChannelMonitor.class);
    private static final long STOP_WAIT_SECONDS = 10;

    private final String userId;
    private final Credentials credentials;
    private final ChannelRegistry registry;
    private final UpstreamClient upstream;
    private final DownloadPipeline pipeline;
    private final MediaFilter mediaFilter;
    private final MetricsConfig metrics;
    private final Duration interval;
    private final Clock clock;
    private ScheduledExecutorService scheduler;
    private volatile boolean stopped;

    public record TickResult(int scanned, int detected, List<String> failedChannels) {}

    public ChannelMonitor(String userId, Credentials credentials, ChannelRegistry registry,
                          UpstreamClient upstream, DownloadPipeline pipeline, MediaFilter mediaFilter,
                          MetricsConfig metrics, Duration interval, Clock clock) {
        this.userId = userId;
        this.credentials = credentials;
        this.registry = registry;
        this.upstream = upstream;
        this.pipeline = pipeline;
        this.mediaFilter = mediaFilter;
        this.metrics = metrics;
        this.interval = interval;
        this.clock = clock;
    }

    public String userId() {
        return userId;
    }

    public synchronized void start() {
        if (scheduler != null || stopped) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "monitor-" + userId);
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::safeTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Monitor started for user {} (every {}s)", userId, interval.toSeconds());
    }

    /**
     * Cancels the loop. The tick thread is never interrupted: an enqueue waiting for a download
     * slot completes, and the tick ends before its next enqueue. Downloads already queued keep going.
     */
    public void stop() {
        ScheduledExecutorService s;
        synchronized (this) {
            stopped = true;
            s = scheduler;
        }
        if (s == null) return;
        s.shutdown();
        try {
            if (!s.awaitTermination(STOP_WAIT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Monitor for user {} still finishing a tick after {}s", userId, STOP_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Monitor stopped for user {}", userId);
    }

    public boolean isRunning() {
        var s = scheduler;
        return !stopped && s != null && !s.isShutdown();
    }

    public TickResult tick() {
        int scanned = 0;
        int detected = 0;
        var failed = new ArrayList<String>();
        for (var channel : registry.activeChannels(userId)) {
            if (stopped) break;
            scanned++;
            try {
                detected += scan(channel);
            } catch (RuntimeException e) {
                metrics.upstreamErrors().increment();
                failed.add(channel.channelId());
                log.warn("Scan of {} ({}) failed for user {}: {}",
                        channel.displayName(), channel.sourceRef(), userId, e.getMessage());
            }
        }
        if (detected > 0) log.info("User {}: {} new item(s) across {} channel(s)", userId, detected, scanned);
        return new TickResult(scanned, detected, List.copyOf(failed));
    }

    private int scan(Channel channel) {
        var scanStart = clock.instant();
        var items = upstream.fetchNewItems(credentials, channel.sourceRef(), channel.lastCheckedAt());
        int found = 0;
        for (var item : items) {
            if (stopped) {
                // partial scan: keep lastCheckedAt so the rest is fetched on the next login
                registry.addDetected(userId, channel.channelId(), found);
                return found;
            }
            if (!mediaFilter.isMedia(item)) continue;
            if (pipeline.enqueue(userId, channel, item).isPresent()) {
                found++;
                metrics.detections().increment();
            }
        }
        registry.markChecked(userId, channel.channelId(), scanStart, found);
        return found;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Monitor tick failed for user {}", userId, e);
        }
    }
}
