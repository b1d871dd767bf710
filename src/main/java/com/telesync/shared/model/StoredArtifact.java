package com.telesync.shared.model;

import java.time.Instant;

public record StoredArtifact(
    String storagePath,
    String userId,
    String channelId,
    String filename,
    long byteSize,
    String contentType,
    Instant createdAt
) {}
