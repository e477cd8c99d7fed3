package io.github.drompincen.fieldsync.persistence.repository;

import io.github.drompincen.fieldsync.persistence.document.EventRecordDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface EventRecordRepository extends MongoRepository<EventRecordDocument, String> {
    List<EventRecordDocument> findBySyncedFalse();
    List<EventRecordDocument> findByProjectUidAndSyncedFalse(String projectUid);
    List<EventRecordDocument> findByProjectUid(String projectUid);
    void deleteByProjectUid(String projectUid);
}
