package com.telesync.gateway.http;

import com.telesync.downloads.DownloadPipeline;
import com.telesync.shared.error.TaskNotFoundException;
import com.telesync.shared.model.DownloadTask;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/telegram/downloads/{userId}")
public class DownloadController {

    private static final int MAX_LIMIT = 200;

    private final DownloadPipeline pipeline;

    public DownloadController(DownloadPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @GetMapping
    public ApiResponse list(@PathVariable String userId,
                            @RequestParam(defaultValue = "50") int limit,
                            @RequestParam(defaultValue = "0") int offset) {
        if (limit < 1 || offset < 0) throw new IllegalArgumentException("limit must be positive and offset non-negative");
        int capped = Math.min(limit, MAX_LIMIT);
        var out = new LinkedHashMap<String, Object>();
        out.put("downloads", pipeline.list(userId, capped, offset));
        out.put("total", pipeline.count(userId));
        out.put("limit", capped);
        out.put("offset", offset);
        return ApiResponse.ok(out);
    }

    @GetMapping("/stats")
    public ApiResponse stats(@PathVariable String userId) {
        return ApiResponse.ok(pipeline.stats(userId));
    }

    @GetMapping("/{taskId}")
    public ApiResponse get(@PathVariable String userId, @PathVariable String taskId) {
        return ApiResponse.ok(owned(userId, taskId));
    }

    @PostMapping("/{taskId}/retry")
    public ApiResponse retry(@PathVariable String userId, @PathVariable String taskId) {
        owned(userId, taskId);
        return ApiResponse.ok(pipeline.retry(taskId));
    }

    @DeleteMapping("/{taskId}")
    public ApiResponse delete(@PathVariable String userId, @PathVariable String taskId) {
        owned(userId, taskId);
        pipeline.delete(taskId);
        return ApiResponse.ok(Map.of("taskId", taskId, "deleted", true));
    }

    // tasks of other users are reported as missing
    private DownloadTask owned(String userId, String taskId) {
        var task = pipeline.get(taskId);
        if (!task.userId().equals(userId)) throw new TaskNotFoundException(taskId);
        return task;
    }
}
