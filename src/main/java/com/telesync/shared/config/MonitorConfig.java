package com.telesync.shared.config;

public record MonitorConfig(
    long pollIntervalSeconds,
    int workerThreads,
    int queueCapacity,
    int maxRetries,
    long retryBaseDelayMs,
    long maxDownloadBytes
) {
    public static final long DEFAULT_MAX_DOWNLOAD_BYTES = 1024L * 1024L * 1024L;

    public MonitorConfig(long pollIntervalSeconds, int workerThreads, int queueCapacity,
                         int maxRetries, long retryBaseDelayMs) {
        this(pollIntervalSeconds, workerThreads, queueCapacity, maxRetries, retryBaseDelayMs,
                DEFAULT_MAX_DOWNLOAD_BYTES);
    }

    public static MonitorConfig defaults() {
        return new MonitorConfig(30, 4, 64, 2, 500, DEFAULT_MAX_DOWNLOAD_BYTES);
    }
}
