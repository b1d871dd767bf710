package com.telesync.storage;

import com.telesync.shared.config.StorageConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Builds the single active backend. Misconfiguration throws here, at startup, never on the
 * first request.
 */
public class StorageFactory {

    private static final Logger log = LoggerFactory.getLogger(StorageFactory.class);

    public static StorageAdapter create(StorageConfig cfg) {
        var backend = cfg.backend() == null ? "" : cfg.backend().trim().toLowerCase(Locale.ROOT);
        var root = Path.of(cfg.localRoot());
        var index = new MetadataIndex(root.resolve("metadata.json"));
        StorageAdapter adapter = switch (backend) {
            case "local" -> new LocalDiskStorage(root, index);
            case "s3" -> {
                requireSet("s3", "access-key", cfg.s3().accessKey(), "secret-key", cfg.s3().secretKey(),
                        "bucket", cfg.s3().bucket(), "region", cfg.s3().region());
                yield new S3Storage(S3Storage.buildClient(cfg.s3()), cfg.s3().bucket(), index);
            }
            case "supabase" -> {
                requireSet("supabase", "url", cfg.supabase().url(), "key", cfg.supabase().key(),
                        "bucket", cfg.supabase().bucket());
                yield new SupabaseStorage(cfg.supabase(), index);
            }
            default -> throw new IllegalStateException("Unknown storage backend: '" + cfg.backend()
                    + "' (expected local, s3 or supabase)");
        };
        log.info("Storage backend: {} (index at {})", adapter.backend(), root.resolve("metadata.json"));
        return adapter;
    }

    private static void requireSet(String backend, String... namesAndValues) {
        var missing = new ArrayList<String>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            var value = namesAndValues[i + 1];
            if (value == null || value.isBlank()) missing.add(namesAndValues[i]);
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Storage backend '" + backend + "' is missing required settings: "
                    + String.join(", ", missing));
        }
    }
}
