package com.telesync.storage;

import com.telesync.shared.config.StorageConfig;
import com.telesync.shared.error.StorageWriteException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Object storage through the Supabase storage REST API. */
public class SupabaseStorage extends AbstractStorageAdapter {

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String key;
    private final String bucket;

    public SupabaseStorage(StorageConfig.Supabase cfg, MetadataIndex index) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), cfg, index);
    }

    public SupabaseStorage(HttpClient httpClient, StorageConfig.Supabase cfg, MetadataIndex index) {
        super(index);
        this.httpClient = httpClient;
        this.baseUrl = cfg.url().replaceAll("/+$", "");
        this.key = cfg.key();
        this.bucket = cfg.bucket();
    }

    @Override
    public String backend() {
        return "supabase";
    }

    @Override
    protected void writeObject(String storagePath, byte[] bytes, String contentType) throws Exception {
        var req = request(storagePath)
                .header("Content-Type", contentType != null ? contentType : "application/octet-stream")
                .header("x-upsert", "true")
                .timeout(Duration.ofMinutes(5))
                .POST(HttpRequest.BodyPublishers.ofByteArray(bytes))
                .build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() != 200) {
            throw new StorageWriteException("Supabase upload failed " + resp.statusCode() + ": " + resp.body());
        }
    }

    @Override
    protected byte[] readObject(String storagePath) throws Exception {
        var req = request(storagePath).timeout(Duration.ofMinutes(5)).GET().build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() != 200) {
            throw new StorageWriteException("Supabase download failed " + resp.statusCode() + " for " + storagePath);
        }
        return resp.body();
    }

    @Override
    protected void deleteObject(String storagePath) throws Exception {
        var req = request(storagePath).timeout(Duration.ofSeconds(30)).DELETE().build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.discarding());
        if (resp.statusCode() != 200 && resp.statusCode() != 404) {
            throw new StorageWriteException("Supabase delete failed " + resp.statusCode() + " for " + storagePath);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/storage/v1/bucket/" + encodeSegment(bucket)))
                    .header("Authorization", "Bearer " + key)
                    .timeout(Duration.ofSeconds(5))
                    .GET().build();
            return httpClient.send(req, HttpResponse.BodyHandlers.discarding()).statusCode() == 200;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            return false;
        }
    }

    private HttpRequest.Builder request(String storagePath) {
        return HttpRequest.newBuilder()
                .uri(objectUri(storagePath))
                .header("Authorization", "Bearer " + key);
    }

    /** Each path segment is percent-encoded; {@code #}, {@code %} and {@code ?} stay part of the object key. */
    URI objectUri(String storagePath) {
        var encoded = Arrays.stream(storagePath.split("/", -1))
                .map(SupabaseStorage::encodeSegment)
                .collect(Collectors.joining("/"));
        return URI.create(baseUrl + "/storage/v1/object/" + encodeSegment(bucket) + "/" + encoded);
    }

    private static String encodeSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
