package io.github.drompincen.fieldsync.persistence.repository;

import io.github.drompincen.fieldsync.persistence.document.ProjectDetailDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ProjectDetailRepository extends MongoRepository<ProjectDetailDocument, String> {
}
