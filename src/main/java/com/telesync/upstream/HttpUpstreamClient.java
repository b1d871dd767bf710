package com.telesync.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telesync.shared.config.MonitorConfig;
import com.telesync.shared.config.UpstreamConfig;
import com.telesync.shared.error.ChallengeException;
import com.telesync.shared.error.CredentialException;
import com.telesync.shared.error.UpstreamFetchException;
import com.telesync.shared.model.Credentials;
import com.telesync.shared.model.UpstreamItem;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Talks JSON over HTTP to the upstream bridge that holds the platform SDK sessions.
 * Listing calls are retried through {@link ResilientCall}; login calls are not.
 */
public class HttpUpstreamClient implements UpstreamClient {

    private static final int CHUNK_SIZE = 64 * 1024;

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration timeout;
    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxContentBytes;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpUpstreamClient(UpstreamConfig config, int maxRetries, long baseDelayMs, long maxContentBytes) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                config, maxRetries, baseDelayMs, maxContentBytes);
    }

    public HttpUpstreamClient(HttpClient httpClient, UpstreamConfig config, int maxRetries, long baseDelayMs) {
        this(httpClient, config, maxRetries, baseDelayMs, MonitorConfig.DEFAULT_MAX_DOWNLOAD_BYTES);
    }

    public HttpUpstreamClient(HttpClient httpClient, UpstreamConfig config, int maxRetries, long baseDelayMs,
                              long maxContentBytes) {
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.httpClient = httpClient;
        this.timeout = Duration.ofSeconds(config.timeoutSeconds());
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelayMs;
        this.maxContentBytes = maxContentBytes;
    }

    @Override
    public void requestCode(Credentials credentials) {
        var resp = post("/auth/send-code", credentials, null);
        if (resp.statusCode() == 400 || resp.statusCode() == 401 || resp.statusCode() == 403) {
            throw new CredentialException("Upstream rejected credentials: " + errorText(resp));
        }
        ensureOk(resp, "send-code");
    }

    @Override
    public void signIn(Credentials credentials, String code) {
        var resp = post("/auth/sign-in", credentials, code);
        if (resp.statusCode() == 401) {
            throw new ChallengeException("Invalid authentication code");
        }
        if (resp.statusCode() == 400 || resp.statusCode() == 403) {
            throw new CredentialException("Upstream rejected credentials: " + errorText(resp));
        }
        ensureOk(resp, "sign-in");
    }

    @Override
    public List<UpstreamItem> fetchNewItems(Credentials credentials, String sourceRef, Instant since) {
        var query = "?source=" + encode(sourceRef) + (since != null ? "&since=" + encode(since.toString()) : "");
        return ResilientCall.execute(() -> {
            var req = authorized(credentials, "/channels/items" + query).GET().build();
            var resp = send(req, HttpResponse.BodyHandlers.ofString());
            ensureOk(resp, "items");
            return parseItems(mapper.readTree(resp.body()));
        }, maxRetries, baseDelayMs);
    }

    @Override
    public FetchedContent download(Credentials credentials, String sourceRef, UpstreamItem item, ProgressListener listener) {
        var path = "/channels/items/" + encode(item.sourceItemRef()) + "/content?source=" + encode(sourceRef);
        var req = authorized(credentials, path).timeout(Duration.ofMinutes(30)).GET().build();
        var resp = send(req, HttpResponse.BodyHandlers.ofInputStream());
        try (var in = resp.body()) {
            if (resp.statusCode() != 200) {
                throw new UpstreamFetchException("Upstream download failed " + resp.statusCode()
                        + " for " + item.sourceItemRef(), resp.statusCode(), retryAfter(resp));
            }
            long total = resp.headers().firstValueAsLong("Content-Length").orElse(item.byteSize());
            var contentType = resp.headers().firstValue("Content-Type").orElse(item.contentType());
            if (total > maxContentBytes) {
                throw new UpstreamFetchException("Item " + item.sourceItemRef() + " is " + total
                        + " bytes, over the " + maxContentBytes + " byte limit", 0, 0);
            }
            return new FetchedContent(readFully(in, total, listener, maxContentBytes), contentType);
        } catch (IOException e) {
            throw new UpstreamFetchException("Upstream download interrupted for " + item.sourceItemRef(), e);
        }
    }

    @Override
    public boolean isReachable() {
        try {
            var req = HttpRequest.newBuilder().uri(URI.create(baseUrl + "/health"))
                    .timeout(Duration.ofSeconds(5)).GET().build();
            return httpClient.send(req, HttpResponse.BodyHandlers.discarding()).statusCode() < 500;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException e) {
            return false;
        }
    }

    /** Buffers the stream; more than {@code limit} bytes fails before they are held in memory. */
    static byte[] readFully(InputStream in, long total, ProgressListener listener, long limit) throws IOException {
        var out = new ByteArrayOutputStream(total > 0 && total <= limit && total < Integer.MAX_VALUE ? (int) total : CHUNK_SIZE);
        var buf = new byte[CHUNK_SIZE];
        long received = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            if (received + n > limit) {
                throw new UpstreamFetchException("Content exceeds the " + limit + " byte limit", 0, 0);
            }
            out.write(buf, 0, n);
            received += n;
            listener.onProgress(received, total);
        }
        return out.toByteArray();
    }

    private HttpResponse<String> post(String path, Credentials credentials, String code) {
        var body = new LinkedHashMap<String, Object>();
        body.put("apiId", credentials.apiId());
        body.put("apiHash", credentials.apiHash());
        body.put("phone", credentials.normalizedPhone());
        if (code != null) body.put("code", code);
        try {
            var req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            return send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new UpstreamFetchException("Failed to encode upstream request", e);
        }
    }

    private HttpRequest.Builder authorized(Credentials credentials, String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("X-Api-Id", credentials.apiId())
                .header("X-Api-Hash", credentials.apiHash())
                .header("X-Account", credentials.normalizedPhone())
                .timeout(timeout);
    }

    private <T> HttpResponse<T> send(HttpRequest req, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(req, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamFetchException("Interrupted calling " + req.uri().getPath(), e);
        } catch (IOException e) {
            throw new UpstreamFetchException("Upstream unreachable: " + req.uri().getPath(), e);
        }
    }

    private static void ensureOk(HttpResponse<String> resp, String what) {
        if (resp.statusCode() != 200) {
            throw new UpstreamFetchException("Upstream " + what + " error " + resp.statusCode() + ": "
                    + errorText(resp), resp.statusCode(), retryAfter(resp));
        }
    }

    private static long retryAfter(HttpResponse<?> resp) {
        return resp.headers().firstValue("Retry-After").map(v -> {
            try {
                double secs = Double.parseDouble(v.trim());
                return Double.isFinite(secs) && secs >= 0 ? (long) (secs * 1000) : 0L;
            } catch (NumberFormatException e) {
                return 0L;
            }
        }).orElse(0L);
    }

    private static String errorText(HttpResponse<String> resp) {
        var body = resp.body();
        return body == null || body.isBlank() ? "HTTP " + resp.statusCode() : body;
    }

    /** Reads items from a bare array or from a {@code data} array. */
    public static List<UpstreamItem> parseItems(JsonNode root) {
        var items = new ArrayList<UpstreamItem>();
        var array = root.isArray() ? root : root.path("data");
        for (var node : array) {
            var posted = node.path("postedAt").asText(null);
            items.add(new UpstreamItem(
                    node.path("id").asText(),
                    node.path("title").asText(null),
                    node.path("filename").asText(null),
                    node.path("size").asLong(0),
                    node.path("contentType").asText(null),
                    node.path("text").asText(null),
                    posted != null ? Instant.parse(posted) : null));
        }
        return items;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
