package com.telesync.shared.error;

public class DuplicateChannelException extends TeleSyncException {
    public DuplicateChannelException(String userId, String sourceRef) {
        super("duplicate_channel", "Channel already exists for user " + userId + ": " + sourceRef);
    }
}
