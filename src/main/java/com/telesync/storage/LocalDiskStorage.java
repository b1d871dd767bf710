package com.telesync.storage;

import com.telesync.shared.error.StorageWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/** Artifacts under {@code root/userId/channelId/filename}, index in {@code root/metadata.json}. */
public class LocalDiskStorage extends AbstractStorageAdapter {

    private final Path root;

    public LocalDiskStorage(Path root) {
        this(root, new MetadataIndex(root.resolve("metadata.json")));
    }

    public LocalDiskStorage(Path root, MetadataIndex index) {
        super(index);
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public String backend() {
        return "local";
    }

    @Override
    protected void writeObject(String storagePath, byte[] bytes, String contentType) throws IOException {
        var target = resolve(storagePath);
        Files.createDirectories(target.getParent());
        var tmp = Files.createTempFile(target.getParent(), ".upload-", ".part");
        try {
            Files.write(tmp, bytes);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    protected byte[] readObject(String storagePath) throws IOException {
        return Files.readAllBytes(resolve(storagePath));
    }

    @Override
    protected void deleteObject(String storagePath) throws IOException {
        Files.deleteIfExists(resolve(storagePath));
    }

    @Override
    public boolean isReachable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            return false;
        }
    }

    private Path resolve(String storagePath) {
        var resolved = root.resolve(storagePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new StorageWriteException("Path escapes storage root: " + storagePath);
        }
        return resolved;
    }
}
