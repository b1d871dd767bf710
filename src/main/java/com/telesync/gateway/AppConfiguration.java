package com.telesync.gateway;

import com.telesync.auth.ChallengeService;
import com.telesync.auth.TokenService;
import com.telesync.channels.ChannelRegistry;
import com.telesync.downloads.DownloadLog;
import com.telesync.downloads.DownloadPipeline;
import com.telesync.monitor.ChannelMonitor;
import com.telesync.notify.NotificationHub;
import com.telesync.observability.DoctorCommand;
import com.telesync.observability.MetricsConfig;
import com.telesync.sessions.CredentialStore;
import com.telesync.sessions.SessionSupervisor;
import com.telesync.shared.config.ConfigLoader;
import com.telesync.shared.config.TeleSyncConfig;
import com.telesync.shared.model.HubEvent;
import com.telesync.storage.StorageAdapter;
import com.telesync.storage.StorageFactory;
import com.telesync.upstream.HttpUpstreamClient;
import com.telesync.upstream.MediaFilter;
import com.telesync.upstream.UpstreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

@Configuration
public class AppConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AppConfiguration.class);

    @Bean
    public TeleSyncConfig teleSyncConfig() {
        var config = ConfigLoader.load();
        if (config.workerSecret().isBlank()) {
            log.info("Worker callback disabled (no worker-secret configured)");
        }
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    // Fails application start when the selected backend is misconfigured
    @Bean
    public StorageAdapter storageAdapter(TeleSyncConfig config) {
        return StorageFactory.create(config.storage());
    }

    @Bean
    public UpstreamClient upstreamClient(TeleSyncConfig config) {
        var monitor = config.monitor();
        return new HttpUpstreamClient(config.upstream(), monitor.maxRetries(), monitor.retryBaseDelayMs(),
                monitor.maxDownloadBytes());
    }

    @Bean
    public NotificationHub notificationHub() {
        return new NotificationHub();
    }

    @Bean
    public ChannelRegistry channelRegistry(Clock clock, NotificationHub hub) {
        var registry = new ChannelRegistry(clock);
        registry.setListener((userId, channels) -> hub.publish(userId,
                new HubEvent(HubEvent.CHANNELS_UPDATE, userId, Map.of("channels", channels), clock.instant())));
        return registry;
    }

    @Bean
    public CredentialStore credentialStore(Clock clock) {
        return new CredentialStore(clock);
    }

    @Bean
    public DownloadLog downloadLog() {
        return new DownloadLog();
    }

    @Bean
    public DownloadPipeline downloadPipeline(StorageAdapter storage, UpstreamClient upstream,
                                             CredentialStore credentials, NotificationHub hub,
                                             DownloadLog downloadLog, MetricsConfig metrics,
                                             TeleSyncConfig config, Clock clock) {
        return new DownloadPipeline(storage, upstream, credentials::credentials, hub, downloadLog,
                metrics, config.monitor(), clock);
    }

    @Bean
    public MediaFilter mediaFilter() {
        return new MediaFilter();
    }

    @Bean
    public ChallengeService challengeService(Clock clock) {
        return new ChallengeService(clock, ChallengeService.DEFAULT_TTL);
    }

    @Bean
    public TokenService tokenService(Clock clock) {
        return new TokenService(clock, TokenService.DEFAULT_TTL);
    }

    @Bean
    public SessionSupervisor sessionSupervisor(CredentialStore store, ChallengeService challenges,
                                               UpstreamClient upstream, ChannelRegistry registry,
                                               DownloadPipeline pipeline, MediaFilter mediaFilter,
                                               MetricsConfig metrics, TeleSyncConfig config, Clock clock) {
        var interval = Duration.ofSeconds(Math.max(1, config.monitor().pollIntervalSeconds()));
        return new SessionSupervisor(store, challenges, upstream, (userId, creds) ->
                new ChannelMonitor(userId, creds, registry, upstream, pipeline, mediaFilter, metrics, interval, clock));
    }

    @Bean
    public DoctorCommand doctorCommand(StorageAdapter storage, UpstreamClient upstream,
                                       SessionSupervisor supervisor, TeleSyncConfig config) {
        return new DoctorCommand(storage, upstream, supervisor, config);
    }
}
