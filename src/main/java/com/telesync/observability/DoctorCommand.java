package com.telesync.observability;

import com.telesync.sessions.SessionSupervisor;
import com.telesync.shared.config.TeleSyncConfig;
import com.telesync.storage.StorageAdapter;
import com.telesync.upstream.UpstreamClient;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DoctorCommand {

    static final String WORKER_CALLBACK_PATH = "/api/worker/detections";

    private final StorageAdapter storage;
    private final UpstreamClient upstream;
    private final SessionSupervisor supervisor;
    private final String publicUrl;

    public DoctorCommand(StorageAdapter storage, UpstreamClient upstream, SessionSupervisor supervisor,
                         TeleSyncConfig config) {
        this.storage = storage;
        this.upstream = upstream;
        this.supervisor = supervisor;
        this.publicUrl = config.publicUrl();
    }

    public List<String> checks() {
        var results = new ArrayList<String>();
        results.add(checkStorage());
        results.add(checkUpstream());
        results.add("[OK] Active monitors: " + supervisor.activeMonitors());
        results.add(checkPublicUrl());
        results.add(checkJavaVersion());
        return results;
    }

    public String run() {
        return String.join("\n", checks());
    }

    public Map<String, Object> report() {
        var checks = checks();
        var report = new LinkedHashMap<String, Object>();
        report.put("healthy", checks.stream().noneMatch(c -> c.startsWith("[FAIL]")));
        report.put("storageBackend", storage.backend());
        report.put("activeMonitors", supervisor.activeMonitors());
        report.put("publicUrl", publicUrl);
        report.put("workerCallback", workerCallback());
        report.put("checks", checks);
        return report;
    }

    private String checkStorage() {
        try {
            return storage.isReachable()
                    ? "[OK] Storage backend " + storage.backend()
                    : "[FAIL] Storage backend " + storage.backend() + " unreachable";
        } catch (Exception e) {
            return "[FAIL] Storage backend " + storage.backend() + ": " + e.getMessage();
        }
    }

    private String checkUpstream() {
        try {
            return upstream.isReachable()
                    ? "[OK] Upstream bridge reachable"
                    : "[WARN] Upstream bridge unreachable";
        } catch (Exception e) {
            return "[WARN] Upstream bridge: " + e.getMessage();
        }
    }

    /** Where a separately deployed detection worker should post its findings. */
    public String workerCallback() {
        var base = publicUrl.endsWith("/") ? publicUrl.substring(0, publicUrl.length() - 1) : publicUrl;
        return base + WORKER_CALLBACK_PATH;
    }

    private String checkPublicUrl() {
        try {
            var uri = URI.create(publicUrl);
            if (uri.getHost() != null && ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))) {
                return "[OK] Worker callback " + workerCallback();
            }
        } catch (IllegalArgumentException e) {
            return "[WARN] Public URL '" + publicUrl + "': " + e.getMessage();
        }
        return "[WARN] Public URL '" + publicUrl + "' is not an absolute http(s) URL";
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
