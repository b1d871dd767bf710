package com.telesync.gateway.http;

import com.telesync.storage.StorageAdapter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/telegram/artifacts/{userId}")
public class ArtifactController {

    private final StorageAdapter storage;

    public ArtifactController(StorageAdapter storage) {
        this.storage = storage;
    }

    @GetMapping
    public ApiResponse list(@PathVariable String userId) {
        return ApiResponse.ok(storage.list(userId));
    }

    @GetMapping("/content")
    public ResponseEntity<?> content(@PathVariable String userId, @RequestParam String path) {
        var artifact = storage.list(userId).stream()
                .filter(a -> a.storagePath().equals(path))
                .findFirst();
        if (artifact.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.error("No artifact at " + path, "artifact_not_found"));
        }
        var a = artifact.get();
        var type = a.contentType() != null ? MediaType.parseMediaType(a.contentType()) : MediaType.APPLICATION_OCTET_STREAM;
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + a.filename() + "\"")
                .body(storage.get(path));
    }
}
