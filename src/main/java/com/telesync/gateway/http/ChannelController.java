package com.telesync.gateway.http;

import com.telesync.channels.ChannelRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/telegram/channels/{userId}")
public class ChannelController {

    private final ChannelRegistry registry;

    public ChannelController(ChannelRegistry registry) {
        this.registry = registry;
    }

    public record AddChannelRequest(String sourceRef, String displayName) {}

    public record ToggleRequest(Boolean active) {}

    @GetMapping
    public ApiResponse list(@PathVariable String userId) {
        return ApiResponse.ok(registry.list(userId));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse add(@PathVariable String userId, @RequestBody AddChannelRequest req) {
        return ApiResponse.ok(registry.addChannel(userId, req.sourceRef(), req.displayName()));
    }

    @PatchMapping("/{channelId}")
    public ApiResponse toggle(@PathVariable String userId, @PathVariable String channelId,
                              @RequestBody ToggleRequest req) {
        if (req.active() == null) throw new IllegalArgumentException("active is required");
        return ApiResponse.ok(registry.toggle(userId, channelId, req.active()));
    }

    @DeleteMapping("/{channelId}")
    public ApiResponse remove(@PathVariable String userId, @PathVariable String channelId) {
        registry.remove(userId, channelId);
        return ApiResponse.ok(Map.of("channelId", channelId, "removed", true));
    }
}
