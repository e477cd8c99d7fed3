package io.github.drompincen.fieldsync.runtime.support;

import io.github.drompincen.fieldsync.persistence.document.ProjectSyncDocument;
import io.github.drompincen.fieldsync.persistence.store.ProjectHashStore;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryProjectHashStore implements ProjectHashStore {

    private final Map<String, ProjectSyncDocument> records = new LinkedHashMap<>();

    @Override
    public synchronized Optional<ProjectSyncDocument> find(String projectUid) {
        return Optional.ofNullable(records.get(projectUid));
    }

    @Override
    public synchronized Map<String, String> hashesByProject() {
        Map<String, String> hashes = new LinkedHashMap<>();
        records.forEach((uid, doc) -> hashes.put(uid, doc.getContentHash()));
        return hashes;
    }

    @Override
    public synchronized ProjectSyncDocument record(String projectUid, String contentHash) {
        ProjectSyncDocument doc = new ProjectSyncDocument();
        doc.setProjectUid(projectUid);
        doc.setContentHash(contentHash);
        doc.setLocalRevisionTimestamp(System.currentTimeMillis());
        doc.setUpdatedAt(Instant.now());
        records.put(projectUid, doc);
        return doc;
    }

    @Override
    public synchronized void delete(String projectUid) {
        records.remove(projectUid);
    }
}
