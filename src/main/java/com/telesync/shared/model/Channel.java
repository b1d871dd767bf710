package com.telesync.shared.model;

import java.time.Instant;

public record Channel(
    String channelId,
    String userId,
    String displayName,
    String sourceRef,
    boolean active,
    Instant lastCheckedAt,
    long totalDetected,
    Instant createdAt
) {
    public Channel withActive(boolean value) {
        return new Channel(channelId, userId, displayName, sourceRef, value, lastCheckedAt, totalDetected, createdAt);
    }

    public Channel checkedAt(Instant at, long newlyDetected) {
        return new Channel(channelId, userId, displayName, sourceRef, active, at,
                totalDetected + newlyDetected, createdAt);
    }
}
