package com.telesync.storage;

import com.telesync.shared.config.StorageConfig;
import com.telesync.shared.error.StorageWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SupabaseStorageTest {

    @TempDir
    Path tempDir;

    private final StorageConfig.Supabase cfg = new StorageConfig.Supabase("https://proj.supabase.co/", "service-key", "media");

    @SuppressWarnings("unchecked")
    private HttpClient clientReturning(int status, Object body) throws Exception {
        var http = mock(HttpClient.class);
        HttpResponse<Object> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(status);
        when(resp.body()).thenReturn(body);
        doReturn(resp).when(http).send(any(HttpRequest.class), any());
        return http;
    }

    @Test
    void uploadsToObjectEndpointWithBearerKey() throws Exception {
        var http = clientReturning(200, "{}");
        var storage = new SupabaseStorage(http, cfg, new MetadataIndex(tempDir.resolve("metadata.json")));

        var path = storage.put("u1", "ch_1", "clip.mp4", new byte[]{1, 2}, "video/mp4");

        var req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(req.capture(), any());
        assertEquals("https://proj.supabase.co/storage/v1/object/media/u1/ch_1/clip.mp4", req.getValue().uri().toString());
        assertEquals("POST", req.getValue().method());
        assertEquals("Bearer service-key", req.getValue().headers().firstValue("Authorization").orElseThrow());
        assertEquals("video/mp4", req.getValue().headers().firstValue("Content-Type").orElseThrow());
        assertEquals("u1/ch_1/clip.mp4", path);
        assertEquals(1, storage.list("u1").size());
    }

    @Test
    void rejectedUploadLeavesNoMetadata() throws Exception {
        var http = clientReturning(500, "bucket not found");
        var storage = new SupabaseStorage(http, cfg, new MetadataIndex(tempDir.resolve("metadata.json")));

        var e = assertThrows(StorageWriteException.class,
                () -> storage.put("u1", "ch_1", "clip.mp4", new byte[]{1}, "video/mp4"));
        assertTrue(e.getMessage().contains("500"));
        assertTrue(storage.list("u1").isEmpty());
    }

    @Test
    void reservedCharactersStayInTheObjectKey() throws Exception {
        var http = clientReturning(200, "{}");
        var storage = new SupabaseStorage(http, cfg, new MetadataIndex(tempDir.resolve("metadata.json")));

        var first = storage.put("u1", "ch", "Ep #1.mp4", new byte[]{1}, "video/mp4");
        var second = storage.put("u1", "ch", "Ep #2.mp4", new byte[]{2}, "video/mp4");
        var third = storage.put("u1", "ch", "100%.mp4", new byte[]{3}, "video/mp4");

        var req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http, times(3)).send(req.capture(), any());
        var uris = req.getAllValues().stream().map(HttpRequest::uri).toList();
        assertEquals("/storage/v1/object/media/u1/ch/Ep_%231.mp4", uris.get(0).getRawPath());
        assertEquals("/storage/v1/object/media/u1/ch/Ep_%232.mp4", uris.get(1).getRawPath());
        assertEquals("/storage/v1/object/media/u1/ch/100%25.mp4", uris.get(2).getRawPath());
        assertNull(uris.get(0).getFragment());
        assertNotEquals(uris.get(0), uris.get(1));
        assertEquals("u1/ch/Ep_#1.mp4", first);
        assertEquals("u1/ch/Ep_#2.mp4", second);
        assertEquals("u1/ch/100%.mp4", third);
    }
}
