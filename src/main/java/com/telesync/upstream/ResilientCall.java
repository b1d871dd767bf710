package com.telesync.upstream;

import com.telesync.shared.error.TeleSyncException;
import com.telesync.shared.error.UpstreamFetchException;

import java.util.concurrent.Callable;

public class ResilientCall {

    private static final int MAX_RETRIES = 2;
    private static final long INITIAL_DELAY_MS = 500;
    private static final long MAX_BACKOFF_MS = 10_000;
    private static final long RETRY_AFTER_CAP_MS = 30_000;

    public static <T> T execute(Callable<T> action) {
        return execute(action, MAX_RETRIES, INITIAL_DELAY_MS);
    }

    public static <T> T execute(Callable<T> action, int maxRetries, long baseDelayMs) {
        Exception last = null;
        long delay = baseDelayMs;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                return action.call();
            } catch (Exception e) {
                last = e;
                if (isNonRetryable(e)) break;
                if (attempt < maxRetries) {
                    long wait = isRateLimited(e)
                            ? Math.max(delay, Math.min(retryAfterMs(e), RETRY_AFTER_CAP_MS))
                            : delay;
                    sleep(wait);
                    delay = Math.min(delay * 2, MAX_BACKOFF_MS);
                }
            }
        }
        if (last instanceof TeleSyncException tse) throw tse;
        throw new UpstreamFetchException("All retries exhausted", last);
    }

    static boolean isNonRetryable(Exception e) {
        if (e instanceof UpstreamFetchException ufe) return !ufe.isRetryable();
        // credential and challenge rejections never get better by asking again
        return e instanceof TeleSyncException;
    }

    static boolean isRateLimited(Exception e) {
        return e instanceof UpstreamFetchException ufe && ufe.statusCode() == 429;
    }

    private static long retryAfterMs(Exception e) {
        return e instanceof UpstreamFetchException ufe ? ufe.retryAfterMs() : 0;
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Interrupted during retry", ie);
        }
    }
}
