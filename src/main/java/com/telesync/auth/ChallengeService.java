package com.telesync.auth;

import com.telesync.shared.error.ChallengeException;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the one pending login challenge per user. Issuing a new challenge replaces the old one;
 * a challenge dies on success, on expiry, or after too many wrong codes.
 */
public class ChallengeService {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    private static final int MAX_ATTEMPTS = 5;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final Duration ttl;
    // userId -> pending challenge
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private record Pending(String challengeId, Instant expiresAt, int failures) {}

    public ChallengeService() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    public ChallengeService(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public String issue(String userId) {
        var bytes = new byte[12];
        random.nextBytes(bytes);
        var id = HexFormat.of().formatHex(bytes);
        pending.put(userId, new Pending(id, clock.instant().plus(ttl), 0));
        return id;
    }

    public Duration ttl() {
        return ttl;
    }

    /** Throws unless {@code challengeId} is the user's live challenge. */
    public void verify(String userId, String challengeId) {
        var p = pending.get(userId);
        if (p == null || !p.challengeId().equals(challengeId)) {
            throw new ChallengeException("Unknown challenge, request a new code");
        }
        if (clock.instant().isAfter(p.expiresAt())) {
            pending.remove(userId, p);
            throw new ChallengeException("Challenge expired, request a new code");
        }
    }

    /** Records a rejected code; the challenge is dropped once the attempt budget is spent. */
    public void recordFailure(String userId, String challengeId) {
        pending.computeIfPresent(userId, (k, p) -> {
            if (!p.challengeId().equals(challengeId)) return p;
            int failures = p.failures() + 1;
            return failures >= MAX_ATTEMPTS ? null : new Pending(p.challengeId(), p.expiresAt(), failures);
        });
    }

    /** Consumes the challenge. Returns true when it was still pending. */
    public boolean complete(String userId, String challengeId) {
        var p = pending.get(userId);
        return p != null && p.challengeId().equals(challengeId) && pending.remove(userId, p);
    }

    public void discard(String userId) {
        pending.remove(userId);
    }
}
