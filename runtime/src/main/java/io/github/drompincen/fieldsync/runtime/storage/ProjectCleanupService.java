package io.github.drompincen.fieldsync.runtime.storage;

import io.github.drompincen.fieldsync.persistence.repository.ProjectDetailRepository;
import io.github.drompincen.fieldsync.persistence.repository.ProjectRepository;
import io.github.drompincen.fieldsync.persistence.store.ProjectHashStore;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.asset.AssetReferenceTracker;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.support.FileTrees;
import io.github.drompincen.fieldsync.runtime.sync.SyncStatusHolder;
import io.github.drompincen.fieldsync.runtime.upload.EventRecordService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Removes everything cached for a project: its ownership of shared assets (evicting assets no other
 * project holds), its stored hash, detail, record, defect pictures and local events.
 */
@Service
public class ProjectCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ProjectCleanupService.class);

    private final AssetReferenceTracker referenceTracker;
    private final ProjectHashStore hashStore;
    private final ProjectRepository projectRepository;
    private final ProjectDetailRepository projectDetailRepository;
    private final EventRecordService eventRecordService;
    private final StorageLayout storageLayout;
    private final SyncStatusHolder syncStatus;

    public ProjectCleanupService(AssetReferenceTracker referenceTracker,
                                 ProjectHashStore hashStore,
                                 ProjectRepository projectRepository,
                                 ProjectDetailRepository projectDetailRepository,
                                 EventRecordService eventRecordService,
                                 StorageLayout storageLayout,
                                 SyncStatusHolder syncStatus) {
        this.referenceTracker = referenceTracker;
        this.hashStore = hashStore;
        this.projectRepository = projectRepository;
        this.projectDetailRepository = projectDetailRepository;
        this.eventRecordService = eventRecordService;
        this.storageLayout = storageLayout;
        this.syncStatus = syncStatus;
    }

    public SyncResult deleteProjects(List<String> projectUids) {
        if (projectUids == null || projectUids.isEmpty()) {
            return SyncResult.failure("no projects to delete");
        }
        if (syncStatus.isRunning()) {
            return SyncResult.failure("cannot delete projects while a sync is running");
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>(projectUids);
        List<String> details = new ArrayList<>();
        int failed = 0;
        for (String projectUid : unique) {
            try {
                details.add(deleteProject(projectUid));
            } catch (RuntimeException e) {
                failed++;
                log.warn("Cleanup of project {} failed", projectUid, e);
                details.add(projectUid + ": cleanup failed - " + e.getMessage());
            }
        }
        String message = String.format("Deleted %d project(s), %d failed", unique.size() - failed, failed);
        return failed == 0 ? SyncResult.success(message, details) : SyncResult.failure(message, details);
    }

    private String deleteProject(String projectUid) {
        AssetReferenceTracker.PruneResult released = referenceTracker.releaseAll(projectUid);
        hashStore.delete(projectUid);
        projectDetailRepository.deleteById(projectUid);
        projectRepository.deleteById(projectUid);
        FileTrees.deleteTree(storageLayout.projectDefectsDir(projectUid));
        List<String> events = eventRecordService.deleteProjectEvents(projectUid);
        log.info("Deleted project {}: {} asset reference(s) released, {} evicted, {} event(s) removed",
                projectUid, released.unlinked(), released.evicted(), events.size());
        return String.format("%s: %d asset(s) released, %d evicted, %d event(s) removed",
                projectUid, released.unlinked(), released.evicted(), events.size());
    }
}
