package com.telesync.shared.error;

/** Base for every error the core surfaces to callers; {@link #code()} is stable across releases. */
public class TeleSyncException extends RuntimeException {

    private final String code;

    public TeleSyncException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TeleSyncException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
