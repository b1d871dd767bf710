package com.telesync.shared.error;

public class ChannelNotFoundException extends TeleSyncException {
    public ChannelNotFoundException(String userId, String channelId) {
        super("channel_not_found", "Channel not found for user " + userId + ": " + channelId);
    }
}
