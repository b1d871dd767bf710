package com.telesync.notify;

import com.telesync.shared.model.HubEvent;

@FunctionalInterface
public interface EventSink {
    void accept(HubEvent event) throws Exception;
}
