package com.telesync.channels;

import com.telesync.shared.error.ChannelNotFoundException;
import com.telesync.shared.error.DuplicateChannelException;
import com.telesync.shared.model.Channel;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Monitored channels, sliced per user. Each slice has its own lock, so mutations for one user
 * never wait on another user's. The listener is called under that lock, so a user's snapshots
 * arrive in mutation order.
 */
public class ChannelRegistry {

    private final Map<String, UserChannels> slices = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile ChannelListener listener = (userId, channels) -> {};

    private static final class UserChannels {
        private final Map<String, Channel> byId = new LinkedHashMap<>();
    }

    public ChannelRegistry() {
        this(Clock.systemUTC());
    }

    public ChannelRegistry(Clock clock) {
        this.clock = clock;
    }

    public void setListener(ChannelListener listener) {
        this.listener = listener;
    }

    /** Allowed whether or not the user is connected; the channel is picked up once a monitor runs. */
    public Channel addChannel(String userId, String sourceRef, String displayName) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new IllegalArgumentException("sourceRef is required");
        }
        var ref = sourceRef.trim();
        var slice = slice(userId);
        synchronized (slice) {
            for (var c : slice.byId.values()) {
                if (c.sourceRef().equalsIgnoreCase(ref)) throw new DuplicateChannelException(userId, ref);
            }
            var name = displayName == null || displayName.isBlank() ? ref : displayName.trim();
            var created = new Channel("ch_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16),
                    userId, name, ref, true, null, 0, clock.instant());
            slice.byId.put(created.channelId(), created);
            changed(userId, slice);
            return created;
        }
    }

    public Channel toggle(String userId, String channelId, boolean active) {
        var slice = slice(userId);
        synchronized (slice) {
            var current = slice.byId.get(channelId);
            if (current == null) throw new ChannelNotFoundException(userId, channelId);
            var updated = current.withActive(active);
            slice.byId.put(channelId, updated);
            changed(userId, slice);
            return updated;
        }
    }

    public void remove(String userId, String channelId) {
        var slice = slice(userId);
        synchronized (slice) {
            if (slice.byId.remove(channelId) == null) throw new ChannelNotFoundException(userId, channelId);
            changed(userId, slice);
        }
    }

    public List<Channel> list(String userId) {
        var slice = slices.get(userId);
        if (slice == null) return List.of();
        synchronized (slice) {
            return List.copyOf(slice.byId.values());
        }
    }

    public Channel get(String userId, String channelId) {
        return find(userId, channelId).orElseThrow(() -> new ChannelNotFoundException(userId, channelId));
    }

    public Optional<Channel> find(String userId, String channelId) {
        var slice = slices.get(userId);
        if (slice == null) return Optional.empty();
        synchronized (slice) {
            return Optional.ofNullable(slice.byId.get(channelId));
        }
    }

    public List<Channel> activeChannels(String userId) {
        var active = new ArrayList<Channel>();
        for (var c : list(userId)) {
            if (c.active()) active.add(c);
        }
        return active;
    }

    /**
     * Advances {@code lastCheckedAt} and adds to {@code totalDetected}. Returns empty when the
     * channel was removed while it was being scanned.
     */
    public Optional<Channel> markChecked(String userId, String channelId, Instant checkedAt, long newlyDetected) {
        return update(userId, channelId, newlyDetected, c -> c.checkedAt(checkedAt, newlyDetected));
    }

    /** Adds to {@code totalDetected} without moving {@code lastCheckedAt}. */
    public Optional<Channel> addDetected(String userId, String channelId, long newlyDetected) {
        return update(userId, channelId, newlyDetected, c -> c.checkedAt(c.lastCheckedAt(), newlyDetected));
    }

    private Optional<Channel> update(String userId, String channelId, long newlyDetected,
                                     UnaryOperator<Channel> change) {
        var slice = slices.get(userId);
        if (slice == null) return Optional.empty();
        synchronized (slice) {
            var current = slice.byId.get(channelId);
            if (current == null) return Optional.empty();
            var updated = change.apply(current);
            slice.byId.put(channelId, updated);
            if (newlyDetected > 0) changed(userId, slice);
            return Optional.of(updated);
        }
    }

    private void changed(String userId, UserChannels slice) {
        listener.channelsChanged(userId, List.copyOf(slice.byId.values()));
    }

    private UserChannels slice(String userId) {
        return slices.computeIfAbsent(userId, k -> new UserChannels());
    }
}
