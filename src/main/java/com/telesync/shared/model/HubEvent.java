package com.telesync.shared.model;

import java.time.Instant;
import java.util.Map;

public record HubEvent(
    String type,
    String userId,
    Map<String, Object> data,
    Instant timestamp
) {
    public static final String CHANNELS_UPDATE = "channels_update";
    public static final String DOWNLOADS_UPDATE = "downloads_update";
    public static final String DOWNLOAD_STARTED = "download_started";
    public static final String DOWNLOAD_PROGRESS = "download_progress";
    public static final String DOWNLOAD_COMPLETED = "download_completed";
    public static final String DOWNLOAD_FAILED = "download_failed";

    public HubEvent(String type, String userId, Map<String, Object> data) {
        this(type, userId, data, Instant.now());
    }

    public String taskId() {
        var id = data.get("taskId");
        return id != null ? id.toString() : null;
    }
}
