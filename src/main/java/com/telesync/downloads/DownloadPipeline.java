package com.telesync.downloads;

import com.telesync.notify.NotificationHub;
import com.telesync.observability.MetricsConfig;
import com.telesync.shared.config.MonitorConfig;
import com.telesync.shared.error.TaskNotFoundException;
import com.telesync.shared.error.TeleSyncException;
import com.telesync.shared.error.UpstreamFetchException;
import com.telesync.shared.model.Channel;
import com.telesync.shared.model.Credentials;
import com.telesync.shared.model.DownloadStatus;
import com.telesync.shared.model.DownloadTask;
import com.telesync.shared.model.HubEvent;
import com.telesync.shared.model.UpstreamItem;
import com.telesync.storage.StorageAdapter;
import com.telesync.upstream.FetchedContent;
import com.telesync.upstream.ProgressListener;
import com.telesync.upstream.UpstreamClient;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Drives each task through {@code queued -> downloading -> completed | failed}.
 *
 * <p>Every {@code (channelId, sourceItemRef)} pair maps to at most one task for the lifetime of
 * the pipeline; a repeated detection is a no-op and only {@link #retry} runs an item again.
 * Fetch and store happen on a bounded worker pool; when the pool and its queue are full,
 * {@link #enqueue} blocks the caller until a slot frees up.
 *
 * <p>Tasks already handed to the pool run to a terminal state even after their user
 * disconnects; only monitoring stops.
 */
public class DownloadPipeline {

    private static final Logger log = LoggerFactory.getLogger(DownloadPipeline.class);

    private final StorageAdapter storage;
    private final UpstreamClient upstream;
    private final Function<String, Optional<Credentials>> credentials;
    private final NotificationHub hub;
    private final DownloadLog downloadLog;
    private final MetricsConfig metrics;
    private final Clock clock;
    private final ThreadPoolExecutor workers;
    private final long maxDownloadBytes;
    // dedupKey -> taskId; entries outlive deleted tasks so a deleted item is not fetched again
    private final Map<String, String> detected = new ConcurrentHashMap<>();
    // taskId -> what to fetch; kept while the task can still run or be retried
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    private record Job(UpstreamItem item, String sourceRef) {}

    public DownloadPipeline(StorageAdapter storage, UpstreamClient upstream,
                            Function<String, Optional<Credentials>> credentials, NotificationHub hub,
                            DownloadLog downloadLog, MetricsConfig metrics, MonitorConfig config) {
        this(storage, upstream, credentials, hub, downloadLog, metrics, config, Clock.systemUTC());
    }

    public DownloadPipeline(StorageAdapter storage, UpstreamClient upstream,
                            Function<String, Optional<Credentials>> credentials, NotificationHub hub,
                            DownloadLog downloadLog, MetricsConfig metrics, MonitorConfig config, Clock clock) {
        this.storage = storage;
        this.upstream = upstream;
        this.credentials = credentials;
        this.hub = hub;
        this.downloadLog = downloadLog;
        this.metrics = metrics;
        this.clock = clock;
        this.maxDownloadBytes = config.maxDownloadBytes();
        var threads = Math.max(1, config.workerThreads());
        var counter = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, config.queueCapacity())),
                r -> {
                    var t = new Thread(r, "download-worker-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                (r, executor) -> {
                    if (executor.isShutdown()) throw new RejectedExecutionException("Download pool is shut down");
                    try {
                        executor.getQueue().put(r);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted waiting for a download slot", e);
                    }
                });
    }

    /**
     * Registers a detected item. Returns the new queued task, or empty when the item was already
     * seen for this channel.
     */
    public Optional<DownloadTask> enqueue(String userId, Channel channel, UpstreamItem item) {
        var key = DownloadTask.dedupKey(channel.channelId(), item.sourceItemRef());
        var taskId = UUID.randomUUID().toString();
        if (detected.putIfAbsent(key, taskId) != null) {
            log.debug("Item {} in channel {} already tracked", item.sourceItemRef(), channel.channelId());
            return Optional.empty();
        }
        var filename = item.filename() != null && !item.filename().isBlank()
                ? FileNames.sanitize(item.filename())
                : FileNames.fallbackName(item.sourceItemRef(), item.contentType());
        var task = DownloadTask.queued(taskId, userId, channel, item, filename, clock.instant());
        jobs.put(taskId, new Job(item, channel.sourceRef()));
        downloadLog.insert(task);
        submit(task);
        return Optional.of(task);
    }

    /** Moves a failed task back to {@code queued} and runs it again. */
    public DownloadTask retry(String taskId) {
        var task = downloadLog.update(taskId, DownloadTask::requeue)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        log.info("Retrying download {} ({})", taskId, task.filename());
        publishList(task.userId());
        submit(task);
        return task;
    }

    /** Removes a task; a completed task takes its stored artifact with it. */
    public void delete(String taskId) {
        var task = downloadLog.remove(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.storagePath() != null) {
            storage.delete(task.storagePath());
        }
        if (!task.status().isActive()) jobs.remove(taskId);
        publishList(task.userId());
    }

    public DownloadTask get(String taskId) {
        return downloadLog.get(taskId);
    }

    public List<DownloadTask> list(String userId, int limit, int offset) {
        return downloadLog.list(userId, limit, offset);
    }

    public int count(String userId) {
        return downloadLog.count(userId);
    }

    public DownloadStats stats(String userId) {
        return DownloadStats.of(downloadLog.all(userId), clock.instant(), ZoneId.systemDefault());
    }

    int trackedJobs() {
        return jobs.size();
    }

    public int pendingWork() {
        return workers.getQueue().size() + workers.getActiveCount();
    }

    public void shutdown(long timeout, TimeUnit unit) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeout, unit)) {
                log.warn("Download pool did not drain in {} {}", timeout, unit);
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void submit(DownloadTask task) {
        try {
            workers.execute(() -> run(task.taskId()));
        } catch (RejectedExecutionException e) {
            log.error("Could not schedule download {}", task.taskId(), e);
            downloadLog.update(task.taskId(), t -> t.fail("Not scheduled: " + e.getMessage(), clock.instant()))
                    .ifPresent(this::publishFailed);
        }
    }

    void run(String taskId) {
        var job = jobs.get(taskId);
        var started = downloadLog.update(taskId, DownloadTask::startDownloading);
        if (started.isEmpty() || job == null) {
            jobs.remove(taskId);
            log.debug("Download {} vanished before it started", taskId);
            return;
        }
        var task = started.get();
        publish(task, HubEvent.DOWNLOAD_STARTED, startedData(task));
        var sample = Timer.start(metrics.registry());
        try {
            if (task.byteSize() > maxDownloadBytes) {
                throw new UpstreamFetchException("Item is " + FileNames.formatSize(task.byteSize())
                        + ", over the " + FileNames.formatSize(maxDownloadBytes) + " download limit", 0, 0);
            }
            var creds = credentials.apply(task.userId())
                    .orElseThrow(() -> new UpstreamFetchException("No upstream credentials for user", 401, 0));
            var content = upstream.download(creds, job.sourceRef(), job.item(), progressReporter(task));
            validate(task, content);
            finish(task, content);
        } catch (TeleSyncException e) {
            fail(task, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in download {}", taskId, e);
            fail(task, "Unexpected error: " + e.getMessage());
        } catch (Error e) {
            fail(task, "Fatal error: " + e);
            throw e;
        } finally {
            sample.stop(metrics.downloadLatency());
            var after = downloadLog.find(taskId);
            if (after.isEmpty() || after.get().status() == DownloadStatus.COMPLETED) jobs.remove(taskId);
        }
    }

    private ProgressListener progressReporter(DownloadTask task) {
        var last = new AtomicInteger(0);
        return (received, total) -> {
            if (total <= 0) return;
            int pct = (int) Math.min(100, received * 100 / total);
            if (pct <= last.get()) return;
            last.set(pct);
            downloadLog.update(task.taskId(), t -> t.withProgress(pct)).ifPresent(t -> {
                var data = new LinkedHashMap<String, Object>();
                data.put("taskId", t.taskId());
                data.put("progressPct", t.progressPct());
                data.put("bytesReceived", received);
                publish(t, HubEvent.DOWNLOAD_PROGRESS, data);
            });
        };
    }

    private void validate(DownloadTask task, FetchedContent content) {
        var bytes = content.bytes();
        if (bytes == null) {
            throw new UpstreamFetchException("Upstream returned no content", 0, 0);
        }
        if (task.byteSize() > 0 && bytes.length != task.byteSize()) {
            throw new UpstreamFetchException("Size mismatch: expected " + task.byteSize()
                    + " bytes, got " + bytes.length, 0, 0);
        }
        if (task.contentType() != null && content.contentType() != null
                && !baseType(task.contentType()).equals(baseType(content.contentType()))) {
            throw new UpstreamFetchException("Content type mismatch: expected " + task.contentType()
                    + ", got " + content.contentType(), 0, 0);
        }
    }

    private void finish(DownloadTask task, FetchedContent content) {
        var contentType = task.contentType() != null ? task.contentType() : content.contentType();
        var path = storage.put(task.userId(), task.channelId(), task.filename(), content.bytes(), contentType);
        Optional<DownloadTask> completed;
        try {
            completed = downloadLog.update(task.taskId(),
                    t -> t.complete(path, content.bytes().length, clock.instant()));
        } catch (RuntimeException e) {
            storage.delete(path);
            throw e;
        }
        if (completed.isEmpty()) {
            log.info("Download {} was deleted while running, discarding {}", task.taskId(), path);
            storage.delete(path);
            return;
        }
        var done = completed.get();
        metrics.downloadsCompleted().increment();
        metrics.bytesStored().increment(done.byteSize());
        log.info("Download {} completed: {} ({})", done.taskId(), path, FileNames.formatSize(done.byteSize()));
        var data = new LinkedHashMap<String, Object>();
        data.put("taskId", done.taskId());
        data.put("storagePath", path);
        data.put("byteSize", done.byteSize());
        data.put("sizeFormatted", FileNames.formatSize(done.byteSize()));
        data.put("filename", done.filename());
        data.put("channel", done.channelName());
        publish(done, HubEvent.DOWNLOAD_COMPLETED, data);
    }

    private void fail(DownloadTask task, String reason) {
        metrics.downloadsFailed().increment();
        log.warn("Download {} failed: {}", task.taskId(), reason);
        downloadLog.update(task.taskId(), t -> t.fail(reason, clock.instant())).ifPresent(this::publishFailed);
    }

    private void publishFailed(DownloadTask t) {
        var data = new LinkedHashMap<String, Object>();
        data.put("taskId", t.taskId());
        data.put("errorReason", t.errorReason());
        data.put("channel", t.channelName());
        publish(t, HubEvent.DOWNLOAD_FAILED, data);
    }

    private Map<String, Object> startedData(DownloadTask task) {
        var data = new LinkedHashMap<String, Object>();
        data.put("taskId", task.taskId());
        data.put("title", task.title() != null ? task.title() : task.filename());
        data.put("channel", task.channelName());
        data.put("channelId", task.channelId());
        data.put("filename", task.filename());
        return data;
    }

    private void publishList(String userId) {
        var data = new LinkedHashMap<String, Object>();
        data.put("downloads", downloadLog.list(userId, 50, 0));
        data.put("total", downloadLog.count(userId));
        hub.publish(userId, new HubEvent(HubEvent.DOWNLOADS_UPDATE, userId, data, clock.instant()));
    }

    private void publish(DownloadTask task, String type, Map<String, Object> data) {
        hub.publish(task.userId(), new HubEvent(type, task.userId(), data, clock.instant()));
    }

    private static String baseType(String contentType) {
        int semi = contentType.indexOf(';');
        var base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
