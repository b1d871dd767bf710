package com.telesync.shared.error;

public class ChallengeException extends TeleSyncException {
    public ChallengeException(String message) {
        super("challenge_error", message);
    }
}
