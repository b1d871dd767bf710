package com.telesync.shared.config;

/**
 * Where the upstream bridge lives and the platform app credentials used when a user has not
 * saved their own.
 */
public record UpstreamConfig(
    String baseUrl,
    String apiId,
    String apiHash,
    int timeoutSeconds
) {
    public static UpstreamConfig defaults() {
        return new UpstreamConfig("http://localhost:8081", "", "", 30);
    }
}
