package com.telesync.upstream;

import com.telesync.shared.error.CredentialException;
import com.telesync.shared.error.UpstreamFetchException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientCallTest {

    @Test
    void successOnFirstAttempt() {
        var result = ResilientCall.execute(() -> "ok");
        assertEquals("ok", result);
    }

    @Test
    void retriesOnFailureThenSucceeds() {
        var attempts = new AtomicInteger(0);
        var result = ResilientCall.execute(() -> {
            if (attempts.incrementAndGet() < 3) throw new UpstreamFetchException("busy", 503, 0);
            return "recovered";
        }, 2, 10);
        assertEquals("recovered", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void exhaustsRetriesAndThrows() {
        var attempts = new AtomicInteger(0);
        var ex = assertThrows(UpstreamFetchException.class, () ->
            ResilientCall.execute(() -> {
                attempts.incrementAndGet();
                throw new IllegalStateException("always fail");
            }, 2, 10)
        );
        assertEquals(3, attempts.get());
        assertTrue(ex.getMessage().contains("All retries exhausted"));
    }

    @Test
    void doesNotRetryClientErrors() {
        var attempts = new AtomicInteger(0);
        var ex = assertThrows(UpstreamFetchException.class, () ->
            ResilientCall.execute(() -> {
                attempts.incrementAndGet();
                throw new UpstreamFetchException("not found", 404, 0);
            }, 2, 10)
        );
        assertEquals(1, attempts.get());
        assertEquals(404, ex.statusCode());
    }

    @Test
    void doesNotRetryCredentialRejection() {
        var attempts = new AtomicInteger(0);
        assertThrows(CredentialException.class, () ->
            ResilientCall.execute(() -> {
                attempts.incrementAndGet();
                throw new CredentialException("bad hash");
            }, 2, 10)
        );
        assertEquals(1, attempts.get());
    }

    @Test
    void waitsForRetryAfterOnRateLimit() {
        var attempts = new AtomicInteger(0);
        long start = System.currentTimeMillis();
        ResilientCall.execute(() -> {
            if (attempts.incrementAndGet() == 1) throw new UpstreamFetchException("slow down", 429, 300);
            return "ok";
        }, 2, 10);
        long elapsed = System.currentTimeMillis() - start;
        assertTrue(elapsed >= 280, "Expected >= 280ms wait, got " + elapsed + "ms");
    }
}
