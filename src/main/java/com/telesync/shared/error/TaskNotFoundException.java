package com.telesync.shared.error;

public class TaskNotFoundException extends TeleSyncException {
    public TaskNotFoundException(String taskId) {
        super("task_not_found", "Download not found: " + taskId);
    }
}
