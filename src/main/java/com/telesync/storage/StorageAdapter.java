package com.telesync.storage;

import com.telesync.shared.model.StoredArtifact;

import java.util.List;

/**
 * Uniform put/get/list over the configured backend. {@link #put} either returns a path that
 * {@link #get} resolves immediately, or throws and leaves no metadata behind.
 */
public interface StorageAdapter {
    String backend();
    String put(String userId, String channelId, String filename, byte[] bytes, String contentType);
    byte[] get(String storagePath);
    List<StoredArtifact> list(String userId);
    void delete(String storagePath);
    boolean isReachable();
}
