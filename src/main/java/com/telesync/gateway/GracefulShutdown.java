package com.telesync.gateway;

import com.telesync.downloads.DownloadPipeline;
import com.telesync.sessions.SessionSupervisor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/** Stops every monitor, then lets the download pool drain. */
@Component
public class GracefulShutdown {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdown.class);

    private final SessionSupervisor supervisor;
    private final DownloadPipeline pipeline;

    public GracefulShutdown(SessionSupervisor supervisor, DownloadPipeline pipeline) {
        this.supervisor = supervisor;
        this.pipeline = pipeline;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down: {} monitor(s), {} pending download(s)",
                supervisor.activeMonitors(), pipeline.pendingWork());
        supervisor.stopAll();
        pipeline.shutdown(30, TimeUnit.SECONDS);
    }
}
