package com.telesync.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.telesync.shared.error.StorageWriteException;
import com.telesync.shared.model.StoredArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JSON file mapping storagePath to its {@link StoredArtifact}. The file is rewritten through a
 * temp file and an atomic move, so readers never see a half-written index.
 */
public class MetadataIndex {

    private static final Logger log = LoggerFactory.getLogger(MetadataIndex.class);
    private static final TypeReference<List<StoredArtifact>> LIST_TYPE = new TypeReference<>() {};

    private final Path indexFile;
    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Map<String, StoredArtifact> entries = new LinkedHashMap<>();

    public MetadataIndex(Path indexFile) {
        this.indexFile = indexFile;
        load();
    }

    public synchronized void record(StoredArtifact artifact) {
        var previous = entries.put(artifact.storagePath(), artifact);
        try {
            persist();
        } catch (IOException e) {
            if (previous != null) entries.put(artifact.storagePath(), previous);
            else entries.remove(artifact.storagePath());
            throw new StorageWriteException("Failed to write metadata index " + indexFile, e);
        }
    }

    public synchronized void remove(String storagePath) {
        if (entries.remove(storagePath) == null) return;
        try {
            persist();
        } catch (IOException e) {
            throw new StorageWriteException("Failed to write metadata index " + indexFile, e);
        }
    }

    public synchronized boolean contains(String storagePath) {
        return entries.containsKey(storagePath);
    }

    public synchronized Optional<StoredArtifact> find(String storagePath) {
        return Optional.ofNullable(entries.get(storagePath));
    }

    public synchronized List<StoredArtifact> forUser(String userId) {
        var result = new ArrayList<StoredArtifact>();
        for (var a : entries.values()) {
            if (a.userId().equals(userId)) result.add(a);
        }
        result.sort(Comparator.comparing(StoredArtifact::createdAt).reversed());
        return result;
    }

    private void persist() throws IOException {
        Files.createDirectories(indexFile.toAbsolutePath().getParent());
        var tmp = indexFile.resolveSibling(indexFile.getFileName() + ".tmp");
        mapper.writeValue(tmp.toFile(), new ArrayList<>(entries.values()));
        Files.move(tmp, indexFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private void load() {
        if (!Files.exists(indexFile)) return;
        try {
            List<StoredArtifact> loaded = mapper.readValue(indexFile.toFile(), LIST_TYPE);
            for (var a : loaded) entries.put(a.storagePath(), a);
            log.info("Loaded {} artifact records from {}", entries.size(), indexFile);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt metadata index: " + indexFile, e);
        }
    }
}
