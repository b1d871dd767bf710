package com.telesync.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived tickets that bind one real-time connection to one user. A ticket is spent by the
 * connection that presents it; a second connection needs a fresh one. Expired tickets are swept
 * whenever a new one is issued.
 */
public class TokenService {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;
    private final Duration ttl;
    // token -> ticket
    private final Map<String, Ticket> tickets = new ConcurrentHashMap<>();

    private record Ticket(String userId, Instant expiresAt) {}

    public TokenService() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    public TokenService(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public String generate(String userId) {
        var now = clock.instant();
        tickets.values().removeIf(t -> now.isAfter(t.expiresAt()));
        var bytes = new byte[32];
        random.nextBytes(bytes);
        var token = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        tickets.put(token, new Ticket(userId, now.plus(ttl)));
        return token;
    }

    public Duration ttl() {
        return ttl;
    }

    /** Spends the token. Returns its userId, or null when it is unknown, already used or expired. */
    public String consume(String token) {
        if (token == null) return null;
        var ticket = tickets.remove(token);
        if (ticket == null || clock.instant().isAfter(ticket.expiresAt())) return null;
        return ticket.userId();
    }

    int outstanding() {
        return tickets.size();
    }
}
