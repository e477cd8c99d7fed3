package io.github.drompincen.fieldsync.persistence.store;

import io.github.drompincen.fieldsync.persistence.document.ProjectSyncDocument;

import java.util.Map;
import java.util.Optional;

/**
 * Last content hash known locally per project. A project with no record is treated as never synced.
 */
public interface ProjectHashStore {

    Optional<ProjectSyncDocument> find(String projectUid);

    Map<String, String> hashesByProject();

    /** Upserts the hash and stamps a fresh local revision timestamp. */
    ProjectSyncDocument record(String projectUid, String contentHash);

    void delete(String projectUid);
}
