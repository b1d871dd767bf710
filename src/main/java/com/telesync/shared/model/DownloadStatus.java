package com.telesync.shared.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DownloadStatus {
    QUEUED,
    DOWNLOADING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == DOWNLOADING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(DownloadStatus next) {
        return switch (this) {
            case QUEUED -> next == DOWNLOADING || next == FAILED;
            case DOWNLOADING -> next == DOWNLOADING || next == COMPLETED || next == FAILED;
            case FAILED -> next == QUEUED;
            case COMPLETED -> false;
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
