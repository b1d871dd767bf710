package com.telesync.gateway.http;

import com.telesync.auth.TokenService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class RealtimeController {

    private final TokenService tokens;

    @Value("${telesync.ws.path:/ws}")
    private String wsPath = "/ws";

    public RealtimeController(TokenService tokens) {
        this.tokens = tokens;
    }

    public record TokenRequest(String userId) {}

    /** Issues a single-use token that binds one WebSocket connection to one user. */
    @PostMapping("/api/realtime/token")
    public ApiResponse token(@RequestBody TokenRequest req) {
        if (req.userId() == null || req.userId().isBlank()) throw new IllegalArgumentException("userId is required");
        return ApiResponse.ok(Map.of("token", tokens.generate(req.userId()), "path", wsPath,
                "expiresInSeconds", tokens.ttl().toSeconds()));
    }
}
