package com.telesync.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final long MB = 1024L * 1024L;

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".telesync", "config.yaml"
    );

    public static TeleSyncConfig load() {
        var override = System.getenv("TELESYNC_CONFIG");
        return load(override != null ? Path.of(override) : DEFAULT_PATH, System.getenv());
    }

    public static TeleSyncConfig load(Path path) {
        return load(path, Map.of());
    }

    public static TeleSyncConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var storage = section(raw, "storage");
        var upstream = section(raw, "upstream");
        var monitor = section(raw, "monitor");
        var server = section(raw, "server");
        var defaults = TeleSyncConfig.defaults();

        return new TeleSyncConfig(
            parseStorageConfig(storage, env),
            parseUpstreamConfig(upstream, env),
            parseMonitorConfig(monitor, env),
            envOrDefault(env, "TELESYNC_PUBLIC_URL",
                str(server, "public-url", defaults.publicUrl())),
            envOrDefault(env, "TELESYNC_WORKER_SECRET",
                str(server, "worker-secret", defaults.workerSecret()))
        );
    }

    private static StorageConfig parseStorageConfig(Map<String, Object> storage, Map<String, String> env) {
        var defaults = StorageConfig.defaults();
        var s3 = section(storage, "s3");
        var supabase = section(storage, "supabase");
        var s3Def = defaults.s3();
        var sbDef = defaults.supabase();

        return new StorageConfig(
            envOrDefault(env, "TELESYNC_STORAGE_BACKEND",
                str(storage, "backend", defaults.backend())),
            envOrDefault(env, "TELESYNC_STORAGE_ROOT",
                str(storage, "local-root", defaults.localRoot())),
            new StorageConfig.S3(
                envOrDefault(env, "AWS_ACCESS_KEY_ID", str(s3, "access-key", s3Def.accessKey())),
                envOrDefault(env, "AWS_SECRET_ACCESS_KEY", str(s3, "secret-key", s3Def.secretKey())),
                envOrDefault(env, "S3_BUCKET", str(s3, "bucket", s3Def.bucket())),
                envOrDefault(env, "S3_REGION", str(s3, "region", s3Def.region())),
                envOrDefault(env, "S3_ENDPOINT", str(s3, "endpoint", s3Def.endpoint()))
            ),
            new StorageConfig.Supabase(
                envOrDefault(env, "SUPABASE_URL", str(supabase, "url", sbDef.url())),
                envOrDefault(env, "SUPABASE_KEY", str(supabase, "key", sbDef.key())),
                envOrDefault(env, "SUPABASE_BUCKET", str(supabase, "bucket", sbDef.bucket()))
            )
        );
    }

    private static UpstreamConfig parseUpstreamConfig(Map<String, Object> upstream, Map<String, String> env) {
        var defaults = UpstreamConfig.defaults();
        return new UpstreamConfig(
            envOrDefault(env, "TELESYNC_UPSTREAM_URL",
                str(upstream, "base-url", defaults.baseUrl())),
            envOrDefault(env, "TELESYNC_API_ID",
                str(upstream, "api-id", defaults.apiId())),
            envOrDefault(env, "TELESYNC_API_HASH",
                str(upstream, "api-hash", defaults.apiHash())),
            Integer.parseInt(str(upstream, "timeout", defaults.timeoutSeconds()))
        );
    }

    private static MonitorConfig parseMonitorConfig(Map<String, Object> monitor, Map<String, String> env) {
        var defaults = MonitorConfig.defaults();
        return new MonitorConfig(
            Long.parseLong(envOrDefault(env, "TELESYNC_POLL_INTERVAL",
                str(monitor, "poll-interval", defaults.pollIntervalSeconds()))),
            Integer.parseInt(str(monitor, "worker-threads", defaults.workerThreads())),
            Integer.parseInt(str(monitor, "queue-capacity", defaults.queueCapacity())),
            Integer.parseInt(str(monitor, "max-retries", defaults.maxRetries())),
            Long.parseLong(str(monitor, "retry-base-delay-ms", defaults.retryBaseDelayMs())),
            Long.parseLong(str(monitor, "max-download-mb", defaults.maxDownloadBytes() / MB)) * MB
        );
    }

    // an empty YAML value ("key:") loads as null and means "not set"
    private static String str(Map<String, Object> map, String key, Object fallback) {
        var value = map.get(key);
        if (value == null) value = fallback;
        return value == null ? "" : String.valueOf(value).trim();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        var value = map.get(key);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new IllegalStateException("Config section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String envOrDefault(Map<String, String> env, String key, String fallback) {
        var val = env.get(key);
        return val != null ? val : fallback;
    }
}
