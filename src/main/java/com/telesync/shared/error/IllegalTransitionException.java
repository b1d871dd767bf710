package com.telesync.shared.error;

import com.telesync.shared.model.DownloadStatus;

public class IllegalTransitionException extends TeleSyncException {
    public IllegalTransitionException(String taskId, DownloadStatus from, DownloadStatus to) {
        super("illegal_transition", "Download " + taskId + " cannot move from "
                + from.wireName() + " to " + to.wireName());
    }
}
