package io.github.drompincen.fieldsync.runtime.sync;

import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "fieldsync.scheduler.periodic-sync-enabled", havingValue = "true")
public class PeriodicSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(PeriodicSyncScheduler.class);

    private final ProjectSyncCoordinator coordinator;
    private final SyncStatusHolder syncStatus;

    public PeriodicSyncScheduler(ProjectSyncCoordinator coordinator, SyncStatusHolder syncStatus) {
        this.coordinator = coordinator;
        this.syncStatus = syncStatus;
    }

    @Scheduled(fixedDelayString = "${fieldsync.scheduler.periodic-sync-interval-ms:21600000}",
            initialDelayString = "${fieldsync.scheduler.periodic-sync-interval-ms:21600000}")
    public void syncProjects() {
        if (syncStatus.isRunning()) {
            log.debug("Periodic sync skipped, a sync is already running");
            return;
        }
        try {
            SyncResult result = coordinator.syncAllProjects();
            log.info("Periodic sync finished: success={}, {}", result.success(), result.message());
        } catch (Exception e) {
            log.error("Periodic sync failed", e);
        }
    }
}
