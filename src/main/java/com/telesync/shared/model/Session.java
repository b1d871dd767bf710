package com.telesync.shared.model;

import java.time.Instant;

/**
 * A user's link to the upstream platform. {@code connected} only becomes true after the
 * login challenge has been confirmed.
 */
public record Session(
    String userId,
    String accountIdentifier,
    String appCredentialRef,
    boolean connected,
    Instant lastConnectedAt
) {
    public Session connectedAt(Instant at) {
        return new Session(userId, accountIdentifier, appCredentialRef, true, at);
    }

    public Session disconnectedAt(Instant at) {
        return new Session(userId, accountIdentifier, appCredentialRef, false, at);
    }

    public String maskedAccount() {
        return Credentials.mask(accountIdentifier);
    }
}
