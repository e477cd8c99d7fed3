package io.github.drompincen.fieldsync.persistence.repository;

import io.github.drompincen.fieldsync.persistence.document.ProjectDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ProjectRepository extends MongoRepository<ProjectDocument, String> {
    List<ProjectDocument> findAllByOrderByNameAsc();
}
