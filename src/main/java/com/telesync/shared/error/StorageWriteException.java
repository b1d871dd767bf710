package com.telesync.shared.error;

public class StorageWriteException extends TeleSyncException {
    public StorageWriteException(String message) {
        super("storage_error", message);
    }

    public StorageWriteException(String message, Throwable cause) {
        super("storage_error", message, cause);
    }
}
