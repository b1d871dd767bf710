package com.telesync.channels;

import com.telesync.shared.model.Channel;

import java.util.List;

@FunctionalInterface
public interface ChannelListener {
    void channelsChanged(String userId, List<Channel> channels);
}
