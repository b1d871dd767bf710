package com.telesync.storage;

import com.telesync.downloads.FileNames;
import com.telesync.shared.error.StorageWriteException;
import com.telesync.shared.model.StoredArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared put/get/list logic: path layout {@code userId/channelId/filename}, collision-free path
 * claiming, and rollback of the written object when the metadata record cannot be written.
 * Subclasses only move bytes.
 */
public abstract class AbstractStorageAdapter implements StorageAdapter {

    private static final Logger log = LoggerFactory.getLogger(AbstractStorageAdapter.class);

    private final MetadataIndex index;
    private final Set<String> claims = ConcurrentHashMap.newKeySet();

    protected AbstractStorageAdapter(MetadataIndex index) {
        this.index = index;
    }

    protected abstract void writeObject(String storagePath, byte[] bytes, String contentType) throws Exception;

    protected abstract byte[] readObject(String storagePath) throws Exception;

    protected abstract void deleteObject(String storagePath) throws Exception;

    @Override
    public String put(String userId, String channelId, String filename, byte[] bytes, String contentType) {
        if (bytes == null) throw new StorageWriteException("No content for " + filename);
        var path = claimPath(userId, channelId, filename);
        try {
            try {
                writeObject(path, bytes, contentType);
            } catch (StorageWriteException e) {
                throw e;
            } catch (Exception e) {
                throw new StorageWriteException("Failed to write " + path + " to " + backend(), e);
            }
            try {
                index.record(new StoredArtifact(path, userId, channelId, lastSegment(path),
                        bytes.length, contentType, Instant.now()));
            } catch (RuntimeException e) {
                discard(path);
                throw e;
            }
            log.debug("Stored {} ({} bytes) on {}", path, bytes.length, backend());
            return path;
        } finally {
            claims.remove(path);
        }
    }

    @Override
    public byte[] get(String storagePath) {
        if (!index.contains(storagePath)) {
            throw new StorageWriteException("Unknown storage path: " + storagePath);
        }
        try {
            return readObject(storagePath);
        } catch (StorageWriteException e) {
            throw e;
        } catch (Exception e) {
            throw new StorageWriteException("Failed to read " + storagePath + " from " + backend(), e);
        }
    }

    @Override
    public List<StoredArtifact> list(String userId) {
        return index.forUser(userId);
    }

    @Override
    public void delete(String storagePath) {
        try {
            deleteObject(storagePath);
        } catch (Exception e) {
            throw new StorageWriteException("Failed to delete " + storagePath + " from " + backend(), e);
        }
        index.remove(storagePath);
    }

    private String claimPath(String userId, String channelId, String filename) {
        var dir = FileNames.sanitize(userId) + "/" + FileNames.sanitize(channelId) + "/";
        var name = FileNames.sanitize(filename);
        var candidate = dir + name;
        for (int n = 1; ; n++) {
            // claim first, then check the index: a finished put records before releasing its claim
            if (claims.add(candidate)) {
                if (!index.contains(candidate)) return candidate;
                claims.remove(candidate);
            }
            candidate = dir + FileNames.withSuffix(name, n);
        }
    }

    private void discard(String path) {
        try {
            deleteObject(path);
        } catch (Exception e) {
            log.error("Failed to remove orphaned object {} on {}", path, backend(), e);
        }
    }

    private static String lastSegment(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
