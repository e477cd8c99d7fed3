package io.github.drompincen.fieldsync.persistence.store;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;

import java.util.List;
import java.util.Optional;

/**
 * Shared asset-node records. Ownership changes are single-record atomic so two projects syncing the
 * same remote file cannot lose each other's reference.
 *
 * <p>{@link #insert} throws {@link org.springframework.dao.DuplicateKeyException} when another node
 * already holds the same {@code remoteId}.
 */
public interface AssetNodeStore {

    Optional<AssetNodeDocument> findById(String nodeId);

    Optional<AssetNodeDocument> findByRemoteId(String remoteId);

    List<AssetNodeDocument> findByOwner(String projectUid);

    List<AssetNodeDocument> findByOwnerAndStatus(String projectUid, AssetDownloadStatus status);

    AssetNodeDocument insert(AssetNodeDocument node);

    Optional<AssetNodeDocument> addOwner(String nodeId, String projectUid);

    Optional<AssetNodeDocument> removeOwner(String nodeId, String projectUid);

    /** Overwrites only the non-null arguments. */
    Optional<AssetNodeDocument> refreshMetadata(String nodeId, String name, Long sizeBytes, String fileType);

    void updateStatus(String nodeId, AssetDownloadStatus status, String localPath);

    void updateDownloadUrl(String nodeId, String downloadUrl, String fileType);

    /** Deletes the node only if its owner set is empty at the moment of the delete. */
    boolean deleteIfOrphaned(String nodeId);
}
