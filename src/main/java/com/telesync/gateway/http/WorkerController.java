package com.telesync.gateway.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.telesync.channels.ChannelRegistry;
import com.telesync.downloads.DownloadPipeline;
import com.telesync.sessions.CredentialStore;
import com.telesync.shared.config.TeleSyncConfig;
import com.telesync.upstream.HttpUpstreamClient;
import com.telesync.upstream.MediaFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;

/**
 * Callback for a separately deployed detection process. Items pushed here take the same
 * dedup and enqueue path as the in-process monitor. Pushes for a paused channel or a user
 * without a live session are acknowledged and dropped. A push never moves the channel's
 * {@code lastCheckedAt}; only a full scan by the in-process monitor does.
 */
@RestController
public class WorkerController {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final ChannelRegistry registry;
    private final DownloadPipeline pipeline;
    private final CredentialStore sessions;
    private final MediaFilter mediaFilter;
    private final String secret;

    public WorkerController(ChannelRegistry registry, DownloadPipeline pipeline, CredentialStore sessions,
                            MediaFilter mediaFilter, TeleSyncConfig config) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.sessions = sessions;
        this.mediaFilter = mediaFilter;
        this.secret = config.workerSecret();
    }

    @PostMapping("/api/worker/detections")
    public ResponseEntity<ApiResponse> detections(@RequestHeader(value = "X-Worker-Secret", required = false) String given,
                                                  @RequestBody JsonNode body) {
        if (secret == null || secret.isBlank() || given == null
                || !MessageDigest.isEqual(secret.getBytes(StandardCharsets.UTF_8), given.getBytes(StandardCharsets.UTF_8))) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ApiResponse.error("Invalid worker secret", "forbidden"));
        }
        var userId = body.path("userId").asText("");
        var channelId = body.path("channelId").asText("");
        if (userId.isBlank() || channelId.isBlank()) throw new IllegalArgumentException("userId and channelId are required");
        var channel = registry.get(userId, channelId);
        var items = HttpUpstreamClient.parseItems(body.path("items"));

        String dropped = null;
        if (!channel.active()) dropped = "channel_inactive";
        else if (!sessions.isConnected(userId)) dropped = "not_connected";
        if (dropped != null) {
            log.info("Dropped {} pushed item(s) for channel {} of user {}: {}", items.size(), channelId, userId, dropped);
            var out = new LinkedHashMap<String, Object>();
            out.put("queued", 0);
            out.put("skipped", items.size());
            out.put("reason", dropped);
            return ResponseEntity.ok(ApiResponse.ok(out));
        }

        int queued = 0;
        int skipped = 0;
        for (var item : items) {
            if (mediaFilter.isMedia(item) && pipeline.enqueue(userId, channel, item).isPresent()) {
                queued++;
            } else {
                skipped++;
            }
        }
        if (queued > 0) {
            registry.addDetected(userId, channelId, queued);
        }
        log.info("Worker pushed {} item(s) for channel {} of user {} ({} skipped)", queued + skipped, channelId, userId, skipped);
        var out = new LinkedHashMap<String, Object>();
        out.put("queued", queued);
        out.put("skipped", skipped);
        return ResponseEntity.ok(ApiResponse.ok(out));
    }
}
