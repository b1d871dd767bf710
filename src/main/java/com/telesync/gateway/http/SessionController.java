package com.telesync.gateway.http;

import com.telesync.sessions.SessionSupervisor;
import com.telesync.shared.config.TeleSyncConfig;
import com.telesync.shared.config.UpstreamConfig;
import com.telesync.shared.model.Credentials;
import com.telesync.shared.model.Session;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/telegram")
public class SessionController {

    private final SessionSupervisor supervisor;
    private final UpstreamConfig upstream;

    public SessionController(SessionSupervisor supervisor, TeleSyncConfig config) {
        this.supervisor = supervisor;
        this.upstream = config.upstream();
    }

    public record CredentialsRequest(String userId, String apiId, String apiHash, String phone) {
        // app id and hash fall back to the deployment-wide ones
        Credentials toCredentials(UpstreamConfig defaults) {
            return new Credentials(blank(apiId) ? defaults.apiId() : apiId,
                    blank(apiHash) ? defaults.apiHash() : apiHash, phone);
        }

        private static boolean blank(String s) {
            return s == null || s.isBlank();
        }
    }

    public record UserRequest(String userId) {}

    public record ConfirmRequest(String userId, String challengeId, String code) {}

    @PostMapping("/credentials")
    public ApiResponse connect(@RequestBody CredentialsRequest req) {
        return ApiResponse.ok(view(supervisor.connect(req.userId(), req.toCredentials(upstream))));
    }

    @PutMapping("/credentials")
    public ApiResponse rotate(@RequestBody CredentialsRequest req) {
        return ApiResponse.ok(view(supervisor.rotate(req.userId(), req.toCredentials(upstream))));
    }

    @GetMapping("/credentials/{userId}")
    public ApiResponse credentials(@PathVariable String userId) {
        return ApiResponse.ok(supervisor.credentialsView(userId));
    }

    @PostMapping("/challenge")
    public ApiResponse issueChallenge(@RequestBody UserRequest req) {
        return ApiResponse.ok(supervisor.issueChallenge(req.userId()));
    }

    @PostMapping("/challenge/confirm")
    public ApiResponse confirmChallenge(@RequestBody ConfirmRequest req) {
        return ApiResponse.ok(view(supervisor.confirmChallenge(req.userId(), req.challengeId(), req.code())));
    }

    @PostMapping("/disconnect")
    public ApiResponse disconnect(@RequestBody UserRequest req) {
        supervisor.disconnect(req.userId());
        return ApiResponse.ok(supervisor.getStatus(req.userId()));
    }

    @GetMapping("/status/{userId}")
    public ApiResponse status(@PathVariable String userId) {
        return ApiResponse.ok(supervisor.getStatus(userId));
    }

    private static Map<String, Object> view(Session session) {
        var out = new LinkedHashMap<String, Object>();
        out.put("userId", session.userId());
        out.put("connected", session.connected());
        out.put("phone", session.maskedAccount());
        out.put("lastConnectedAt", session.lastConnectedAt());
        return out;
    }
}
