package com.telesync.shared.error;

public class CredentialException extends TeleSyncException {
    public CredentialException(String message) {
        super("credential_error", message);
    }

    public CredentialException(String message, Throwable cause) {
        super("credential_error", message, cause);
    }
}
