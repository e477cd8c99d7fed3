package io.github.drompincen.fieldsync.persistence.repository;

import io.github.drompincen.fieldsync.persistence.document.ProjectSyncDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProjectSyncRepository extends MongoRepository<ProjectSyncDocument, String> {
}
