package io.github.drompincen.fieldsync.persistence.store;

import io.github.drompincen.fieldsync.persistence.document.ProjectSyncDocument;
import io.github.drompincen.fieldsync.persistence.repository.ProjectSyncRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Repository
public class MongoProjectHashStore implements ProjectHashStore {

    private final ProjectSyncRepository projectSyncRepository;

    public MongoProjectHashStore(ProjectSyncRepository projectSyncRepository) {
        this.projectSyncRepository = projectSyncRepository;
    }

    @Override
    public Optional<ProjectSyncDocument> find(String projectUid) {
        return projectSyncRepository.findById(projectUid);
    }

    @Override
    public Map<String, String> hashesByProject() {
        Map<String, String> hashes = new HashMap<>();
        for (ProjectSyncDocument doc : projectSyncRepository.findAll()) {
            if (doc.getContentHash() != null) {
                hashes.put(doc.getProjectUid(), doc.getContentHash());
            }
        }
        return hashes;
    }

    @Override
    public ProjectSyncDocument record(String projectUid, String contentHash) {
        ProjectSyncDocument doc = projectSyncRepository.findById(projectUid).orElseGet(() -> {
            ProjectSyncDocument fresh = new ProjectSyncDocument();
            fresh.setProjectUid(projectUid);
            return fresh;
        });
        Instant now = Instant.now();
        doc.setContentHash(contentHash);
        doc.setLocalRevisionTimestamp(now.toEpochMilli());
        doc.setUpdatedAt(now);
        return projectSyncRepository.save(doc);
    }

    @Override
    public void delete(String projectUid) {
        projectSyncRepository.deleteById(projectUid);
    }
}
