package com.telesync.downloads;

import com.telesync.shared.model.DownloadStatus;
import com.telesync.shared.model.DownloadTask;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

public record DownloadStats(
    int totalDownloads,
    int successfulDownloads,
    int failedDownloads,
    long totalSize,
    String totalSizeFormatted,
    int downloadsToday,
    int downloadsThisWeek,
    int downloadsThisMonth
) {
    public static DownloadStats of(List<DownloadTask> tasks, Instant now, ZoneId zone) {
        var today = now.atZone(zone).toLocalDate();
        var weekAgo = now.minus(Duration.ofDays(7));
        var monthAgo = now.minus(Duration.ofDays(30));
        int ok = 0, failed = 0, day = 0, week = 0, month = 0;
        long bytes = 0;
        for (var t : tasks) {
            if (t.status() == DownloadStatus.COMPLETED) {
                ok++;
                bytes += t.byteSize();
            } else if (t.status() == DownloadStatus.FAILED) {
                failed++;
            }
            if (t.createdAt().atZone(zone).toLocalDate().equals(today)) day++;
            if (t.createdAt().isAfter(weekAgo)) week++;
            if (t.createdAt().isAfter(monthAgo)) month++;
        }
        return new DownloadStats(tasks.size(), ok, failed, bytes, FileNames.formatSize(bytes), day, week, month);
    }
}
