package com.telesync.shared.error;

public class UpstreamFetchException extends TeleSyncException {

    private final int statusCode;
    private final long retryAfterMs;

    public UpstreamFetchException(String message, int statusCode, long retryAfterMs) {
        super("upstream_error", message);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super("upstream_error", message, cause);
        this.statusCode = 0;
        this.retryAfterMs = 0;
    }

    /** HTTP status of the failed call, 0 when the call never got a response. */
    public int statusCode() {
        return statusCode;
    }

    public long retryAfterMs() {
        return retryAfterMs;
    }

    public boolean isRetryable() {
        return statusCode == 0 || statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
