package com.telesync.sessions;

import com.telesync.monitor.ChannelMonitor;
import com.telesync.shared.model.Credentials;

@FunctionalInterface
public interface MonitorFactory {

    /** Builds a not-yet-started monitor bound to one credential set. */
    ChannelMonitor create(String userId, Credentials credentials);
}
