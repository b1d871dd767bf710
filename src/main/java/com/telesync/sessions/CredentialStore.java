package com.telesync.sessions;

import com.telesync.shared.error.CredentialException;
import com.telesync.shared.model.Credentials;
import com.telesync.shared.model.Session;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Upstream credentials and the derived session per user. All writes for a user go through
 * {@link ConcurrentHashMap#compute}, which serializes them on that user's key only.
 */
public class CredentialStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    private record Entry(Credentials credentials, Session session) {}

    public CredentialStore() {
        this(Clock.systemUTC());
    }

    public CredentialStore(Clock clock) {
        this.clock = clock;
    }

    /** Stores credentials and resets the session to disconnected. */
    public Session save(String userId, Credentials credentials) {
        var checked = validated(userId, credentials);
        return entries.compute(userId, (k, prev) -> {
            var lastConnected = prev != null ? prev.session().lastConnectedAt() : null;
            return new Entry(checked, new Session(userId, checked.normalizedPhone(), checked.apiId(), false, lastConnected));
        }).session();
    }

    /**
     * Swaps credentials. A connected session stays connected only when the new credentials name
     * the same account (API id and phone); any other swap leaves the user disconnected until
     * the new account signs in.
     */
    public Session replace(String userId, Credentials credentials) {
        var checked = validated(userId, credentials);
        return entries.compute(userId, (k, prev) -> {
            var lastConnected = prev != null ? prev.session().lastConnectedAt() : null;
            boolean connected = prev != null && prev.session().connected() && sameAccount(prev.credentials(), checked);
            return new Entry(checked, new Session(userId, checked.normalizedPhone(), checked.apiId(), connected, lastConnected));
        }).session();
    }

    private static boolean sameAccount(Credentials a, Credentials b) {
        return a.apiId().equals(b.apiId()) && a.normalizedPhone().equals(b.normalizedPhone());
    }

    public Session markConnected(String userId) {
        var entry = entries.computeIfPresent(userId,
                (k, e) -> new Entry(e.credentials(), e.session().connectedAt(clock.instant())));
        if (entry == null) throw new CredentialException("No API credentials found for user " + userId);
        return entry.session();
    }

    public Optional<Session> markDisconnected(String userId) {
        var entry = entries.computeIfPresent(userId,
                (k, e) -> new Entry(e.credentials(), e.session().disconnectedAt(clock.instant())));
        return entry == null ? Optional.empty() : Optional.of(entry.session());
    }

    public Optional<Credentials> credentials(String userId) {
        var e = entries.get(userId);
        return e == null ? Optional.empty() : Optional.of(e.credentials());
    }

    public Optional<Session> session(String userId) {
        var e = entries.get(userId);
        return e == null ? Optional.empty() : Optional.of(e.session());
    }

    public boolean isConnected(String userId) {
        return session(userId).map(Session::connected).orElse(false);
    }

    private static Credentials validated(String userId, Credentials credentials) {
        if (userId == null || userId.isBlank()) throw new CredentialException("userId is required");
        if (credentials == null) throw new CredentialException("credentials are required");
        var problem = credentials.shapeProblem();
        if (problem != null) throw new CredentialException(problem);
        return new Credentials(credentials.apiId().trim(), credentials.apiHash().trim(),
                credentials.normalizedPhone(), credentials.savedAt());
    }
}
