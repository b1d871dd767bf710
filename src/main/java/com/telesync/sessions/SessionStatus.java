package com.telesync.sessions;

import java.time.Instant;

public record SessionStatus(
    String userId,
    boolean hasCredentials,
    boolean connected,
    String phone,
    Instant lastConnectedAt,
    String monitorStatus
) {}
