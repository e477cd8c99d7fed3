package io.github.drompincen.fieldsync.runtime.sync;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.fieldsync.persistence.document.ProjectDetailDocument;
import io.github.drompincen.fieldsync.persistence.document.ProjectDocument;
import io.github.drompincen.fieldsync.persistence.repository.ProjectDetailRepository;
import io.github.drompincen.fieldsync.persistence.repository.ProjectRepository;
import io.github.drompincen.fieldsync.persistence.store.ProjectHashStore;
import io.github.drompincen.fieldsync.protocol.api.RemoteProject;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.asset.AssetSyncReport;
import io.github.drompincen.fieldsync.runtime.asset.AssetTreeResolver;
import io.github.drompincen.fieldsync.runtime.asset.DefectImageCache;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Hash-diff project sync. Only projects whose remote content hash differs from the local one (or
 * that were never synced) have their detail, assets and defect pictures fetched again; the rest
 * only get their counters refreshed.
 */
@Service
public class ProjectSyncCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ProjectSyncCoordinator.class);

    public static final String ALREADY_RUNNING = "sync already running";

    private final FieldServerClient client;
    private final ProjectHashStore projectHashStore;
    private final ProjectRepository projectRepository;
    private final ProjectDetailRepository projectDetailRepository;
    private final AssetTreeResolver assetTreeResolver;
    private final DefectImageCache defectImageCache;
    private final SyncStatusHolder syncStatus;

    public ProjectSyncCoordinator(FieldServerClient client,
                                  ProjectHashStore projectHashStore,
                                  ProjectRepository projectRepository,
                                  ProjectDetailRepository projectDetailRepository,
                                  AssetTreeResolver assetTreeResolver,
                                  DefectImageCache defectImageCache,
                                  SyncStatusHolder syncStatus) {
        this.client = client;
        this.projectHashStore = projectHashStore;
        this.projectRepository = projectRepository;
        this.projectDetailRepository = projectDetailRepository;
        this.assetTreeResolver = assetTreeResolver;
        this.defectImageCache = defectImageCache;
        this.syncStatus = syncStatus;
    }

    public SyncResult syncAllProjects() {
        if (!syncStatus.tryStart()) {
            return SyncResult.failure(ALREADY_RUNNING);
        }
        try {
            List<RemoteProject> remote = client.listProjects();
            log.info("Project list returned {} project(s)", remote.size());
            return apply(remote);
        } catch (RemoteCallException e) {
            log.warn("Project sync aborted: {}", e.getMessage());
            return SyncResult.failure("project list failed: " + e.getMessage());
        } finally {
            syncStatus.finish();
        }
    }

    public SyncResult syncProject(String projectUid) {
        if (!syncStatus.tryStart()) {
            return SyncResult.failure(ALREADY_RUNNING);
        }
        try {
            List<RemoteProject> matches = client.listProjects().stream()
                    .filter(p -> p.projectUid().equals(projectUid))
                    .toList();
            if (matches.isEmpty()) {
                return SyncResult.failure("project " + projectUid + " not found on server");
            }
            return apply(matches.subList(0, 1));
        } catch (RemoteCallException e) {
            log.warn("Sync of project {} aborted: {}", projectUid, e.getMessage());
            return SyncResult.failure("project list failed: " + e.getMessage());
        } finally {
            syncStatus.finish();
        }
    }

    /** A blank remote hash cannot prove the project unchanged, so it always fetches. */
    static boolean needsDetailFetch(String localHash, String remoteHash) {
        if (remoteHash == null || remoteHash.isBlank()) {
            return true;
        }
        return localHash == null || !localHash.equals(remoteHash);
    }

    private SyncResult apply(List<RemoteProject> remoteProjects) {
        Map<String, String> localHashes = projectHashStore.hashesByProject();
        int fetched = 0;
        int unchanged = 0;
        int failed = 0;
        List<String> details = new ArrayList<>();

        for (RemoteProject project : remoteProjects) {
            String uid = project.projectUid();
            if (!needsDetailFetch(localHashes.get(uid), project.contentHash())) {
                updateCounters(project);
                unchanged++;
                continue;
            }
            String line = fullUpdate(project);
            if (line == null) {
                failed++;
                details.add(uid + ": detail fetch failed, will retry next sync");
            } else {
                fetched++;
                details.add(line);
            }
        }

        String message = String.format("Synced %d project(s): %d fetched, %d unchanged, %d failed",
                remoteProjects.size(), fetched, unchanged, failed);
        log.info(message);
        return failed == 0 ? SyncResult.success(message, details) : SyncResult.failure(message, details);
    }

    /** @return a detail line, or null when the detail fetch failed and the old hash is kept */
    private String fullUpdate(RemoteProject project) {
        String uid = project.projectUid();
        ProjectDocument doc = projectRepository.findById(uid).orElseGet(() -> newProject(uid));
        doc.setName(project.name());
        doc.setStatus(project.status());
        doc.setEndDate(project.lastUpdatedAt());
        doc.setDefectCount(project.defectCount());
        doc.setEventCount(project.eventCount());
        doc.setUpdatedAt(Instant.now());
        projectRepository.save(doc);

        JsonNode detail;
        try {
            detail = client.getProjectDetail(uid);
        } catch (RemoteCallException e) {
            log.warn("Detail fetch for project {} failed: {}", uid, e.getMessage());
            return null;
        }

        ProjectDetailDocument cached = new ProjectDetailDocument();
        cached.setProjectUid(uid);
        cached.setRawJson(detail.toString());
        cached.setLastFetchedAt(Instant.now());
        projectDetailRepository.save(cached);

        AssetSyncReport assets = assetTreeResolver.resolve(uid, detail);
        int pictures = defectImageCache.cache(uid, detail);
        projectHashStore.record(uid, project.contentHash());
        log.debug("Project {} refreshed to hash {}", uid, project.contentHash());

        StringBuilder line = new StringBuilder(uid).append(": ").append(assets.summary());
        if (pictures > 0) {
            line.append(", ").append(pictures).append(" defect picture(s)");
        }
        for (String failure : assets.failures()) {
            line.append(System.lineSeparator()).append("  ").append(failure);
        }
        return line.toString();
    }

    private void updateCounters(RemoteProject project) {
        ProjectDocument doc = projectRepository.findById(project.projectUid())
                .orElseGet(() -> {
                    ProjectDocument fresh = newProject(project.projectUid());
                    fresh.setName(project.name());
                    fresh.setStatus(project.status());
                    fresh.setEndDate(project.lastUpdatedAt());
                    return fresh;
                });
        boolean unchanged = doc.getUpdatedAt() != null
                && doc.getDefectCount() == project.defectCount()
                && doc.getEventCount() == project.eventCount();
        if (unchanged) {
            return;
        }
        doc.setDefectCount(project.defectCount());
        doc.setEventCount(project.eventCount());
        doc.setUpdatedAt(Instant.now());
        projectRepository.save(doc);
    }

    private static ProjectDocument newProject(String uid) {
        ProjectDocument doc = new ProjectDocument();
        doc.setProjectUid(uid);
        doc.setCreatedAt(Instant.now());
        return doc;
    }
}
