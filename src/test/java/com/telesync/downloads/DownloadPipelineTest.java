package com.telesync.downloads;

import com.telesync.notify.NotificationHub;
import com.telesync.observability.MetricsConfig;
import com.telesync.shared.config.MonitorConfig;
import com.telesync.shared.error.IllegalTransitionException;
import com.telesync.shared.error.StorageWriteException;
import com.telesync.shared.error.TaskNotFoundException;
import com.telesync.shared.model.Channel;
import com.telesync.shared.model.DownloadStatus;
import com.telesync.shared.model.HubEvent;
import com.telesync.storage.LocalDiskStorage;
import com.telesync.storage.StorageAdapter;
import com.telesync.upstream.FakeUpstreamClient;
import com.telesync.upstream.UpstreamClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.telesync.downloads.PipelineFixture.awaitStatus;
import static com.telesync.upstream.FakeUpstreamClient.video;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DownloadPipelineTest {

    @TempDir
    Path tempDir;

    private final Channel channel = new Channel("ch_demo", "u1", "Demo", "@demo", true, null, 0, Instant.now());
    private final FakeUpstreamClient upstream = new FakeUpstreamClient();
    private final NotificationHub hub = new NotificationHub();
    private LocalDiskStorage storage;
    private DownloadPipeline pipeline;

    @BeforeEach
    void setUp() {
        storage = new LocalDiskStorage(tempDir);
        pipeline = PipelineFixture.pipeline(storage, upstream, hub, new DownloadLog());
    }

    @AfterEach
    void tearDown() {
        upstream.releaseDownloads();
        pipeline.shutdown(5, TimeUnit.SECONDS);
    }

    @Test
    void secondDetectionOfSameItemIsNoOp() {
        var first = pipeline.enqueue("u1", channel, video("item-1", 1000));
        var second = pipeline.enqueue("u1", channel, video("item-1", 1000));

        assertTrue(first.isPresent());
        assertEquals(DownloadStatus.QUEUED, first.get().status());
        assertTrue(second.isEmpty());
        assertEquals(1, pipeline.count("u1"));
    }

    @Test
    void sameItemRefInDifferentChannelsIsTwoTasks() {
        var other = new Channel("ch_other", "u1", "Other", "@other", true, null, 0, Instant.now());
        pipeline.enqueue("u1", channel, video("item-1", 100));
        pipeline.enqueue("u1", other, video("item-1", 100));
        assertEquals(2, pipeline.count("u1"));
    }

    @Test
    void concurrentDetectionCreatesOneTask() throws Exception {
        upstream.holdDownloads();
        int threads = 8;
        var ready = new CountDownLatch(threads);
        var go = new CountDownLatch(1);
        var created = new AtomicInteger();
        var pool = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                ready.countDown();
                go.await();
                if (pipeline.enqueue("u1", channel, video("item-7", 500)).isPresent()) created.incrementAndGet();
                return null;
            });
        }
        ready.await();
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(1, created.get());
        assertEquals(1, pipeline.count("u1"));
    }

    @Test
    void completedTaskHasResolvableArtifact() throws Exception {
        var task = pipeline.enqueue("u1", channel, video("item-42", 4096)).orElseThrow();

        var done = awaitStatus(pipeline, task.taskId(), DownloadStatus.COMPLETED);

        assertEquals(100, done.progressPct());
        assertNotNull(done.completedAt());
        assertEquals("u1/ch_demo/item-42.mp4", done.storagePath());
        assertArrayEquals(FakeUpstreamClient.contentFor("item-42", 4096), storage.get(done.storagePath()));
        var artifacts = storage.list("u1");
        assertEquals(1, artifacts.size());
        assertEquals(4096, artifacts.get(0).byteSize());
    }

    @Test
    void eventsFollowStateMachineOrder() throws Exception {
        try (var stream = hub.subscribe("u1")) {
            var task = pipeline.enqueue("u1", channel, video("item-9", 2048)).orElseThrow();
            awaitStatus(pipeline, task.taskId(), DownloadStatus.COMPLETED);

            var events = new ArrayList<HubEvent>();
            HubEvent e;
            while ((e = stream.poll(Duration.ofMillis(200))) != null) events.add(e);

            var types = events.stream().map(HubEvent::type).toList();
            assertEquals(HubEvent.DOWNLOAD_STARTED, types.get(0));
            assertEquals(HubEvent.DOWNLOAD_COMPLETED, types.get(types.size() - 1));
            int last = -1;
            for (var ev : events) {
                if (!ev.type().equals(HubEvent.DOWNLOAD_PROGRESS)) continue;
                int pct = (Integer) ev.data().get("progressPct");
                assertTrue(pct >= last, "progress went backwards");
                last = pct;
            }
            assertTrue(last > 0);
            assertEquals("Title item-9", events.get(0).data().get("title"));
            assertEquals("Demo", events.get(0).data().get("channel"));
            assertEquals(2048L, events.get(types.size() - 1).data().get("byteSize"));
        }
    }

    @Test
    void sizeMismatchFailsWithoutArtifact() throws Exception {
        upstream.overrideContent("item-5", new byte[10]);
        var task = pipeline.enqueue("u1", channel, video("item-5", 1000)).orElseThrow();

        var failed = awaitStatus(pipeline, task.taskId(), DownloadStatus.FAILED);

        assertTrue(failed.errorReason().contains("Size mismatch"));
        assertNull(failed.storagePath());
        assertTrue(storage.list("u1").isEmpty());
    }

    @Test
    void storageFailureFailsTask() throws Exception {
        var broken = mock(StorageAdapter.class);
        when(broken.put(anyString(), anyString(), anyString(), any(), any()))
                .thenThrow(new StorageWriteException("disk full"));
        var p = PipelineFixture.pipeline(broken, upstream, hub, new DownloadLog());
        try {
            var task = p.enqueue("u1", channel, video("item-3", 100)).orElseThrow();
            var failed = awaitStatus(p, task.taskId(), DownloadStatus.FAILED);
            assertEquals("disk full", failed.errorReason());
        } finally {
            p.shutdown(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void retryRequeuesFailedTaskAndCompletes() throws Exception {
        upstream.failDownloadsOf("item-8");
        var task = pipeline.enqueue("u1", channel, video("item-8", 300)).orElseThrow();
        var failed = awaitStatus(pipeline, task.taskId(), DownloadStatus.FAILED);
        assertEquals("Connection reset", failed.errorReason());

        upstream.healDownloadsOf("item-8");
        var requeued = pipeline.retry(task.taskId());
        assertEquals(DownloadStatus.QUEUED, requeued.status());
        assertEquals(0, requeued.progressPct());
        assertNull(requeued.errorReason());

        var done = awaitStatus(pipeline, task.taskId(), DownloadStatus.COMPLETED);
        assertNotNull(done.storagePath());
        assertEquals(1, pipeline.count("u1"));
    }

    @Test
    void retryOfCompletedTaskIsRejected() throws Exception {
        var task = pipeline.enqueue("u1", channel, video("item-2", 100)).orElseThrow();
        awaitStatus(pipeline, task.taskId(), DownloadStatus.COMPLETED);

        assertThrows(IllegalTransitionException.class, () -> pipeline.retry(task.taskId()));
    }

    @Test
    void deleteRemovesTaskAndArtifactAndItemStaysKnown() throws Exception {
        var task = pipeline.enqueue("u1", channel, video("item-4", 100)).orElseThrow();
        awaitStatus(pipeline, task.taskId(), DownloadStatus.COMPLETED);

        pipeline.delete(task.taskId());

        assertThrows(TaskNotFoundException.class, () -> pipeline.get(task.taskId()));
        assertTrue(storage.list("u1").isEmpty());
        assertTrue(pipeline.enqueue("u1", channel, video("item-4", 100)).isEmpty());
    }

    @Test
    void unknownTaskIsReported() {
        assertThrows(TaskNotFoundException.class, () -> pipeline.retry("nope"));
        assertThrows(TaskNotFoundException.class, () -> pipeline.delete("nope"));
    }

    @Test
    void missingCredentialsFailTheTask() throws Exception {
        var p = new DownloadPipeline(storage, upstream, userId -> Optional.empty(), hub, new DownloadLog(),
                new MetricsConfig(), MonitorConfig.defaults());
        try {
            var task = p.enqueue("u1", channel, video("item-6", 100)).orElseThrow();
            var failed = awaitStatus(p, task.taskId(), DownloadStatus.FAILED);
            assertTrue(failed.errorReason().contains("credentials"));
        } finally {
            p.shutdown(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void listIsNewestFirstAndPaged() throws Exception {
        upstream.holdDownloads();
        var ids = new ArrayList<String>();
        for (int i = 0; i < 5; i++) {
            ids.add(pipeline.enqueue("u1", channel, video("item-" + i, 10)).orElseThrow().taskId());
        }
        List<String> page = pipeline.list("u1", 2, 1).stream().map(t -> t.taskId()).toList();
        assertEquals(List.of(ids.get(3), ids.get(2)), page);
        assertEquals(5, pipeline.count("u1"));
        assertTrue(pipeline.list("u2", 10, 0).isEmpty());
    }

    @Test
    void statsCountOutcomes() throws Exception {
        upstream.failDownloadsOf("bad");
        var ok = pipeline.enqueue("u1", channel, video("good", 2048)).orElseThrow();
        var bad = pipeline.enqueue("u1", channel, video("bad", 10)).orElseThrow();
        awaitStatus(pipeline, ok.taskId(), DownloadStatus.COMPLETED);
        awaitStatus(pipeline, bad.taskId(), DownloadStatus.FAILED);

        var stats = pipeline.stats("u1");
        assertEquals(2, stats.totalDownloads());
        assertEquals(1, stats.successfulDownloads());
        assertEquals(1, stats.failedDownloads());
        assertEquals(2048, stats.totalSize());
        assertEquals("2.0 KB", stats.totalSizeFormatted());
        assertEquals(2, stats.downloadsThisWeek());
    }

    @Test
    void saturatedPoolMakesEnqueueWait() throws Exception {
        var p = PipelineFixture.pipeline(storage, upstream, hub, new DownloadLog(), new MonitorConfig(30, 1, 1, 0, 1));
        try {
            upstream.holdDownloads();
            var running = p.enqueue("u1", channel, video("item-a", 10)).orElseThrow();
            assertTrue(upstream.awaitDownloadStarted(5_000));
            var waiting = p.enqueue("u1", channel, video("item-b", 10)).orElseThrow();

            var third = CompletableFuture.supplyAsync(() -> p.enqueue("u1", channel, video("item-c", 10)));
            Thread.sleep(200);
            assertFalse(third.isDone(), "enqueue should wait for a free slot");

            upstream.releaseDownloads();
            var last = third.get(5, TimeUnit.SECONDS).orElseThrow();

            for (var id : List.of(running.taskId(), waiting.taskId(), last.taskId())) {
                awaitStatus(p, id, DownloadStatus.COMPLETED);
            }
            assertEquals(3, storage.list("u1").size());
        } finally {
            p.shutdown(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void oversizedItemFailsWithoutFetching() throws Exception {
        var p = PipelineFixture.pipeline(storage, upstream, hub, new DownloadLog(),
                new MonitorConfig(30, 1, 4, 0, 1, 1_000));
        try {
            var task = p.enqueue("u1", channel, video("item-big", 2_000)).orElseThrow();

            var failed = awaitStatus(p, task.taskId(), DownloadStatus.FAILED);

            assertTrue(failed.errorReason().contains("download limit"));
            assertFalse(upstream.awaitDownloadStarted(0));
            assertTrue(storage.list("u1").isEmpty());
        } finally {
            p.shutdown(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void errorDuringDownloadStillEndsTheTask() throws Exception {
        var crashing = mock(UpstreamClient.class);
        when(crashing.download(any(), anyString(), any(), any())).thenThrow(new OutOfMemoryError("Java heap space"));
        var p = PipelineFixture.pipeline(storage, crashing, hub, new DownloadLog());
        try {
            var task = p.enqueue("u1", channel, video("item-oom", 100)).orElseThrow();

            var failed = awaitStatus(p, task.taskId(), DownloadStatus.FAILED);

            assertTrue(failed.errorReason().contains("OutOfMemoryError"));
        } finally {
            p.shutdown(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void jobsAreReleasedOnceNoLongerNeeded() throws Exception {
        var p = PipelineFixture.pipeline(storage, upstream, hub, new DownloadLog(), new MonitorConfig(30, 1, 4, 0, 1));
        try {
            upstream.failDownloadsOf("item-bad");
            var bad = p.enqueue("u1", channel, video("item-bad", 10)).orElseThrow();
            awaitStatus(p, bad.taskId(), DownloadStatus.FAILED);
            assertEquals(1, p.trackedJobs(), "a failed task keeps its job for retry");

            upstream.holdDownloads();
            var running = p.enqueue("u1", channel, video("item-run", 10)).orElseThrow();
            var queued = p.enqueue("u1", channel, video("item-queued", 10)).orElseThrow();
            p.delete(queued.taskId());
            upstream.releaseDownloads();
            awaitStatus(p, running.taskId(), DownloadStatus.COMPLETED);

            long deadline = System.currentTimeMillis() + 5_000;
            while (p.trackedJobs() > 1 && System.currentTimeMillis() < deadline) Thread.sleep(10);
            assertEquals(1, p.trackedJobs());

            p.delete(bad.taskId());
            assertEquals(0, p.trackedJobs());
        } finally {
            p.shutdown(5, TimeUnit.SECONDS);
        }
    }
}
