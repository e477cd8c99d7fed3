package io.github.drompincen.fieldsync.gateway.config;

import io.github.drompincen.fieldsync.runtime.config.Pauser;
import io.github.drompincen.fieldsync.runtime.config.PollPolicy;
import io.github.drompincen.fieldsync.runtime.config.RemoteEndpoints;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.config.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/** Binds the {@code fieldsync.*} keys into the engine's immutable settings. */
@Configuration
public class SyncSettingsConfig {

    private static final Logger log = LoggerFactory.getLogger(SyncSettingsConfig.class);

    @Bean
    SyncSettings syncSettings(
            @Value("${fieldsync.upload.batch-poll-interval-ms:3000}") long batchPollIntervalMs,
            @Value("${fieldsync.upload.batch-poll-attempts:15}") int batchPollAttempts,
            @Value("${fieldsync.upload.single-poll-interval-ms:2000}") long singlePollIntervalMs,
            @Value("${fieldsync.upload.single-poll-attempts:30}") int singlePollAttempts,
            @Value("${fieldsync.upload.retry-attempts:5}") int retryAttempts,
            @Value("${fieldsync.upload.retry-delay-ms:3000}") long retryDelayMs,
            @Value("${fieldsync.upload.per-package-ticket-fallback:false}") boolean perPackageTicketFallback,
            @Value("${fieldsync.cleanup.scratch-retention-days:3}") int scratchRetentionDays) {
        SyncSettings settings = new SyncSettings(
                new PollPolicy(Duration.ofMillis(batchPollIntervalMs), batchPollAttempts),
                new PollPolicy(Duration.ofMillis(singlePollIntervalMs), singlePollAttempts),
                retryAttempts,
                Duration.ofMillis(retryDelayMs),
                perPackageTicketFallback,
                scratchRetentionDays);
        log.info("Sync settings: {}", settings);
        return settings;
    }

    @Bean
    StorageLayout storageLayout(@Value("${fieldsync.storage.root:./fieldsync-data}") String root) {
        StorageLayout layout = new StorageLayout(Path.of(root));
        log.info("Local storage root: {}", layout.root());
        return layout;
    }

    @Bean
    RemoteEndpoints remoteEndpoints(
            @Value("${fieldsync.remote.project-list-path:/app/project/project_list}") String projectListPath,
            @Value("${fieldsync.remote.project-detail-path:/app/project/project}") String projectDetailPath,
            @Value("${fieldsync.remote.download-url-path:/storage/download/url}") String downloadUrlPath,
            @Value("${fieldsync.remote.upload-ticket-path:/storage/upload/ticket}") String uploadTicketPath,
            @Value("${fieldsync.remote.create-upload-path:/app/event/create_event_upload}") String createUploadPath,
            @Value("${fieldsync.remote.upload-status-path:/app/event/notice_event_upload_success}") String uploadStatusPath) {
        return new RemoteEndpoints(projectListPath, projectDetailPath, downloadUrlPath,
                uploadTicketPath, createUploadPath, uploadStatusPath);
    }

    @Bean
    Pauser pauser() {
        return Pauser.sleeping();
    }
}
