package com.telesync.shared.model;

import com.telesync.shared.error.IllegalTransitionException;

import java.time.Instant;

/**
 * One fetch-and-store unit of work. Instances are immutable snapshots; every state change goes
 * through a transition method that rejects moves the state machine does not allow.
 */
public record DownloadTask(
    String taskId,
    String userId,
    String channelId,
    String channelName,
    String sourceItemRef,
    String title,
    String filename,
    long byteSize,
    String contentType,
    DownloadStatus status,
    int progressPct,
    Instant createdAt,
    Instant completedAt,
    String storagePath,
    String errorReason
) {
    public static DownloadTask queued(String taskId, String userId, Channel channel, UpstreamItem item,
                                      String filename, Instant now) {
        return new DownloadTask(taskId, userId, channel.channelId(), channel.displayName(),
                item.sourceItemRef(), item.title(), filename, item.byteSize(), item.contentType(),
                DownloadStatus.QUEUED, 0, now, null, null, null);
    }

    public DownloadTask startDownloading() {
        require(DownloadStatus.DOWNLOADING);
        return copy(DownloadStatus.DOWNLOADING, 0, null, storagePath, errorReason);
    }

    /** Progress never moves backwards; a lower value keeps the current percentage. */
    public DownloadTask withProgress(int pct) {
        require(DownloadStatus.DOWNLOADING);
        int clamped = Math.max(progressPct, Math.min(100, Math.max(0, pct)));
        return copy(DownloadStatus.DOWNLOADING, clamped, null, storagePath, errorReason);
    }

    public DownloadTask complete(String path, long size, Instant at) {
        require(DownloadStatus.COMPLETED);
        return new DownloadTask(taskId, userId, channelId, channelName, sourceItemRef, title, filename,
                size, contentType, DownloadStatus.COMPLETED, 100, createdAt, at, path, null);
    }

    public DownloadTask fail(String reason, Instant at) {
        require(DownloadStatus.FAILED);
        return copy(DownloadStatus.FAILED, progressPct, at, null, reason);
    }

    public DownloadTask requeue() {
        require(DownloadStatus.QUEUED);
        return copy(DownloadStatus.QUEUED, 0, null, null, null);
    }

    public String dedupKey() {
        return dedupKey(channelId, sourceItemRef);
    }

    public static String dedupKey(String channelId, String sourceItemRef) {
        return channelId + "\u0000" + sourceItemRef;
    }

    private void require(DownloadStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTransitionException(taskId, status, next);
        }
    }

    private DownloadTask copy(DownloadStatus s, int pct, Instant done, String path, String error) {
        return new DownloadTask(taskId, userId, channelId, channelName, sourceItemRef, title, filename,
                byteSize, contentType, s, pct, createdAt, done, path, error);
    }
}
