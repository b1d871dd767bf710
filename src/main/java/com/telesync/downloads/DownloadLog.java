package com.telesync.downloads;

import com.telesync.shared.error.TaskNotFoundException;
import com.telesync.shared.model.DownloadTask;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Per-user record of download tasks. Updates to one user's tasks are serialized on that
 * user's slice; different users never share a lock.
 */
public class DownloadLog {

    private final Map<String, Map<String, DownloadTask>> byUser = new ConcurrentHashMap<>();
    // taskId -> userId
    private final Map<String, String> owners = new ConcurrentHashMap<>();

    public void insert(DownloadTask task) {
        var slice = byUser.computeIfAbsent(task.userId(), k -> new LinkedHashMap<>());
        synchronized (slice) {
            slice.put(task.taskId(), task);
        }
        owners.put(task.taskId(), task.userId());
    }

    public Optional<DownloadTask> find(String taskId) {
        var slice = sliceOf(taskId);
        if (slice == null) return Optional.empty();
        synchronized (slice) {
            return Optional.ofNullable(slice.get(taskId));
        }
    }

    public DownloadTask get(String taskId) {
        return find(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /** Applies {@code change} atomically. Returns empty if the task no longer exists. */
    public Optional<DownloadTask> update(String taskId, UnaryOperator<DownloadTask> change) {
        var slice = sliceOf(taskId);
        if (slice == null) return Optional.empty();
        synchronized (slice) {
            var current = slice.get(taskId);
            if (current == null) return Optional.empty();
            var next = change.apply(current);
            slice.put(taskId, next);
            return Optional.of(next);
        }
    }

    public Optional<DownloadTask> remove(String taskId) {
        var slice = sliceOf(taskId);
        if (slice == null) return Optional.empty();
        DownloadTask removed;
        synchronized (slice) {
            removed = slice.remove(taskId);
        }
        owners.remove(taskId);
        return Optional.ofNullable(removed);
    }

    /** Newest first. */
    public List<DownloadTask> list(String userId, int limit, int offset) {
        var all = all(userId);
        int from = Math.min(Math.max(offset, 0), all.size());
        int to = limit < 0 ? all.size() : Math.min(all.size(), from + limit);
        return List.copyOf(all.subList(from, to));
    }

    public List<DownloadTask> all(String userId) {
        var slice = byUser.get(userId);
        if (slice == null) return List.of();
        List<DownloadTask> out;
        synchronized (slice) {
            out = new ArrayList<>(slice.values());
        }
        Collections.reverse(out);
        return out;
    }

    public int count(String userId) {
        var slice = byUser.get(userId);
        if (slice == null) return 0;
        synchronized (slice) {
            return slice.size();
        }
    }

    private Map<String, DownloadTask> sliceOf(String taskId) {
        var userId = owners.get(taskId);
        return userId == null ? null : byUser.get(userId);
    }
}
