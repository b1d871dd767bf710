package com.telesync.storage;

import com.telesync.shared.model.StoredArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MetadataIndexTest {

    @TempDir
    Path tempDir;

    private StoredArtifact artifact(String path, String user, Instant at) {
        return new StoredArtifact(path, user, "ch", "a.mp4", 10, "video/mp4", at);
    }

    @Test
    void survivesReload() {
        var file = tempDir.resolve("metadata.json");
        var index = new MetadataIndex(file);
        index.record(artifact("u1/ch/a.mp4", "u1", Instant.parse("2024-01-01T00:00:00Z")));

        var reloaded = new MetadataIndex(file);
        assertTrue(reloaded.contains("u1/ch/a.mp4"));
        assertEquals("video/mp4", reloaded.find("u1/ch/a.mp4").orElseThrow().contentType());
    }

    @Test
    void listsOneUserNewestFirst() {
        var index = new MetadataIndex(tempDir.resolve("metadata.json"));
        index.record(artifact("u1/ch/old.mp4", "u1", Instant.parse("2024-01-01T00:00:00Z")));
        index.record(artifact("u1/ch/new.mp4", "u1", Instant.parse("2024-02-01T00:00:00Z")));
        index.record(artifact("u2/ch/x.mp4", "u2", Instant.parse("2024-03-01T00:00:00Z")));

        var list = index.forUser("u1");
        assertEquals(2, list.size());
        assertEquals("u1/ch/new.mp4", list.get(0).storagePath());
    }

    @Test
    void removeDropsEntry() {
        var index = new MetadataIndex(tempDir.resolve("metadata.json"));
        index.record(artifact("u1/ch/a.mp4", "u1", Instant.now()));
        index.remove("u1/ch/a.mp4");
        assertFalse(index.contains("u1/ch/a.mp4"));
        assertFalse(new MetadataIndex(tempDir.resolve("metadata.json")).contains("u1/ch/a.mp4"));
    }

    @Test
    void corruptIndexFailsLoudly() throws Exception {
        var file = tempDir.resolve("metadata.json");
        Files.writeString(file, "{not json");
        assertThrows(IllegalStateException.class, () -> new MetadataIndex(file));
    }
}
