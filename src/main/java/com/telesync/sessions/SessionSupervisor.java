package com.telesync.sessions;

import com.telesync.auth.ChallengeService;
import com.telesync.monitor.ChannelMonitor;
import com.telesync.shared.error.ChallengeException;
import com.telesync.shared.error.CredentialException;
import com.telesync.shared.model.Credentials;
import com.telesync.shared.model.Session;
import com.telesync.upstream.UpstreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Owns the login handshake and the per-user monitor lifecycle.
 *
 * <p>Operations for one user are serialized on that user's lock; different users never wait on
 * each other. At most one {@link ChannelMonitor} exists per user, and a replacement is only
 * started after the previous one has stopped.
 */
public class SessionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(SessionSupervisor.class);
    private static final Pattern CODE = Pattern.compile("\\d{5,6}");

    private final CredentialStore store;
    private final ChallengeService challenges;
    private final UpstreamClient upstream;
    private final MonitorFactory monitorFactory;
    private final Map<String, ChannelMonitor> monitors = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public record Challenge(String challengeId, long expiresInSeconds) {}

    public SessionSupervisor(CredentialStore store, ChallengeService challenges,
                             UpstreamClient upstream, MonitorFactory monitorFactory) {
        this.store = store;
        this.challenges = challenges;
        this.upstream = upstream;
        this.monitorFactory = monitorFactory;
    }

    /**
     * Stores well-formed credentials. Nothing is sent upstream; the session stays disconnected
     * until a challenge is confirmed. Re-sending the credentials of a connected session is a no-op.
     */
    public Session connect(String userId, Credentials credentials) {
        synchronized (lockFor(userId)) {
            var current = store.session(userId);
            var stored = store.credentials(userId);
            if (current.isPresent() && current.get().connected() && stored.isPresent()
                    && sameAccount(stored.get(), credentials)) {
                return current.get();
            }
            stopMonitor(userId);
            challenges.discard(userId);
            var session = store.save(userId, credentials);
            log.info("Credentials saved for user {} ({})", userId, session.maskedAccount());
            return session;
        }
    }

    /** Asks the upstream platform to send a login code and opens a challenge for it. */
    public Challenge issueChallenge(String userId) {
        synchronized (lockFor(userId)) {
            var creds = requireCredentials(userId);
            upstream.requestCode(creds);
            var id = challenges.issue(userId);
            log.info("Login code requested for user {}", userId);
            return new Challenge(id, challenges.ttl().toSeconds());
        }
    }

    /** Completes the login and starts monitoring. Wrong codes count against the challenge. */
    public Session confirmChallenge(String userId, String challengeId, String code) {
        synchronized (lockFor(userId)) {
            var creds = requireCredentials(userId);
            challenges.verify(userId, challengeId);
            if (code == null || !CODE.matcher(code.trim()).matches()) {
                challenges.recordFailure(userId, challengeId);
                throw new ChallengeException("Verification code must be 5 or 6 digits");
            }
            try {
                upstream.signIn(creds, code.trim());
            } catch (ChallengeException e) {
                challenges.recordFailure(userId, challengeId);
                log.warn("Login code rejected for user {}", userId);
                throw e;
            }
            if (!challenges.complete(userId, challengeId)) {
                throw new ChallengeException("Challenge is no longer pending, request a new code");
            }
            var session = store.markConnected(userId);
            startMonitor(userId, creds);
            log.info("User {} connected as {}", userId, session.maskedAccount());
            return session;
        }
    }

    /** Stops monitoring. Downloads already queued or running are left to finish. */
    public void disconnect(String userId) {
        synchronized (lockFor(userId)) {
            stopMonitor(userId);
            challenges.discard(userId);
            store.markDisconnected(userId);
            log.info("User {} disconnected", userId);
        }
    }

    /**
     * Replaces the credentials. The old monitor is stopped first. A connected user whose new
     * credentials name the same account gets a replacement monitor bound to them; switching to
     * another account leaves the user disconnected until that account completes a challenge.
     */
    public Session rotate(String userId, Credentials credentials) {
        synchronized (lockFor(userId)) {
            stopMonitor(userId);
            challenges.discard(userId);
            var session = store.replace(userId, credentials);
            if (session.connected()) {
                startMonitor(userId, store.credentials(userId).orElseThrow());
            }
            log.info("Credentials rotated for user {} (connected={})", userId, session.connected());
            return session;
        }
    }

    public SessionStatus getStatus(String userId) {
        var session = store.session(userId);
        return new SessionStatus(userId,
                session.isPresent(),
                session.map(Session::connected).orElse(false),
                session.map(Session::maskedAccount).orElse(null),
                session.map(Session::lastConnectedAt).orElse(null),
                isMonitoring(userId) ? "running" : "stopped");
    }

    /** Credential summary without the app secret. */
    public Map<String, Object> credentialsView(String userId) {
        var view = new LinkedHashMap<String, Object>();
        var creds = store.credentials(userId);
        view.put("hasCredentials", creds.isPresent());
        creds.ifPresent(c -> {
            view.put("apiId", c.apiId());
            view.put("phone", Credentials.mask(c.phone()));
            view.put("savedAt", c.savedAt());
        });
        view.put("monitorStatus", isMonitoring(userId) ? "running" : "stopped");
        return view;
    }

    public boolean isMonitoring(String userId) {
        var m = monitors.get(userId);
        return m != null && m.isRunning();
    }

    public Optional<ChannelMonitor> monitor(String userId) {
        return Optional.ofNullable(monitors.get(userId));
    }

    public int activeMonitors() {
        return (int) monitors.values().stream().filter(ChannelMonitor::isRunning).count();
    }

    public void stopAll() {
        for (var userId : monitors.keySet()) {
            stopMonitor(userId);
        }
    }

    private void startMonitor(String userId, Credentials creds) {
        monitors.compute(userId, (k, existing) -> {
            if (existing != null && existing.isRunning()) return existing;
            var monitor = monitorFactory.create(userId, creds);
            monitor.start();
            return monitor;
        });
    }

    private void stopMonitor(String userId) {
        var monitor = monitors.remove(userId);
        if (monitor != null) monitor.stop();
    }

    private Credentials requireCredentials(String userId) {
        return store.credentials(userId).orElseThrow(() ->
                new CredentialException("No API credentials found. Save your API credentials first."));
    }

    private Object lockFor(String userId) {
        if (userId == null || userId.isBlank()) throw new CredentialException("userId is required");
        return locks.computeIfAbsent(userId, k -> new Object());
    }

    private static boolean sameAccount(Credentials a, Credentials b) {
        return b != null && a.apiId().equals(b.apiId() == null ? null : b.apiId().trim())
                && a.apiHash().equals(b.apiHash() == null ? null : b.apiHash().trim())
                && a.phone().equals(b.normalizedPhone());
    }
}
