package io.github.drompincen.fieldsync.persistence.repository;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import io.github.drompincen.fieldsync.protocol.api.AssetKind;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface AssetNodeRepository extends MongoRepository<AssetNodeDocument, String> {
    Optional<AssetNodeDocument> findByRemoteId(String remoteId);
    List<AssetNodeDocument> findByOwningProjectUidsContaining(String projectUid);
    List<AssetNodeDocument> findByOwningProjectUidsContainingAndDownloadStatus(String projectUid, AssetDownloadStatus status);
    List<AssetNodeDocument> findByOwningProjectUidsContainingAndKind(String projectUid, AssetKind kind);
    long countByOwningProjectUidsContainingAndDownloadStatus(String projectUid, AssetDownloadStatus status);
}
