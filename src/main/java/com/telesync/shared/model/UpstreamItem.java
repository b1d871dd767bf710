package com.telesync.shared.model;

import java.time.Instant;

/** An item the upstream platform reports for a channel. */
public record UpstreamItem(
    String sourceItemRef,
    String title,
    String filename,
    long byteSize,
    String contentType,
    String text,
    Instant postedAt
) {}
