package com.telesync.upstream;

@FunctionalInterface
public interface ProgressListener {
    void onProgress(long bytesReceived, long totalBytes);
}
