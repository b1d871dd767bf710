package com.telesync.shared.config;

public record TeleSyncConfig(
    StorageConfig storage,
    UpstreamConfig upstream,
    MonitorConfig monitor,
    String publicUrl,
    String workerSecret
) {
    public static TeleSyncConfig defaults() {
        return new TeleSyncConfig(
            StorageConfig.defaults(),
            UpstreamConfig.defaults(),
            MonitorConfig.defaults(),
            "http://localhost:3001",
            ""
        );
    }
}
