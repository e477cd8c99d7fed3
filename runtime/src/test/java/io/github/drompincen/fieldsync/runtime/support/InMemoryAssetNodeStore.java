package io.github.drompincen.fieldsync.runtime.support;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.persistence.store.AssetNodeStore;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Map-backed store that hands out copies, like a database round trip would. */
public class InMemoryAssetNodeStore implements AssetNodeStore {

    private final Map<String, AssetNodeDocument> nodes = new LinkedHashMap<>();
    private int inserts;

    @Override
    public synchronized Optional<AssetNodeDocument> findById(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId)).map(InMemoryAssetNodeStore::copy);
    }

    @Override
    public synchronized Optional<AssetNodeDocument> findByRemoteId(String remoteId) {
        if (remoteId == null) {
            return Optional.empty();
        }
        return nodes.values().stream()
                .filter(n -> remoteId.equals(n.getRemoteId()))
                .findFirst()
                .map(InMemoryAssetNodeStore::copy);
    }

    @Override
    public synchronized List<AssetNodeDocument> findByOwner(String projectUid) {
        return nodes.values().stream()
                .filter(n -> n.getOwningProjectUids().contains(projectUid))
                .map(InMemoryAssetNodeStore::copy)
                .toList();
    }

    @Override
    public synchronized List<AssetNodeDocument> findByOwnerAndStatus(String projectUid, AssetDownloadStatus status) {
        return findByOwner(projectUid).stream()
                .filter(n -> n.getDownloadStatus() == status)
                .toList();
    }

    @Override
    public synchronized AssetNodeDocument insert(AssetNodeDocument node) {
        if (nodes.containsKey(node.getNodeId())) {
            throw new DuplicateKeyException("duplicate node id " + node.getNodeId());
        }
        if (node.getRemoteId() != null && findByRemoteId(node.getRemoteId()).isPresent()) {
            throw new DuplicateKeyException("duplicate remote id " + node.getRemoteId());
        }
        AssetNodeDocument stored = copy(node);
        stored.setCreatedAt(Instant.now());
        stored.setUpdatedAt(stored.getCreatedAt());
        nodes.put(stored.getNodeId(), stored);
        inserts++;
        return copy(stored);
    }

    @Override
    public synchronized Optional<AssetNodeDocument> addOwner(String nodeId, String projectUid) {
        AssetNodeDocument node = nodes.get(nodeId);
        if (node == null) {
            return Optional.empty();
        }
        node.getOwningProjectUids().add(projectUid);
        return Optional.of(copy(node));
    }

    @Override
    public synchronized Optional<AssetNodeDocument> removeOwner(String nodeId, String projectUid) {
        AssetNodeDocument node = nodes.get(nodeId);
        if (node == null) {
            return Optional.empty();
        }
        node.getOwningProjectUids().remove(projectUid);
        return Optional.of(copy(node));
    }

    @Override
    public synchronized Optional<AssetNodeDocument> refreshMetadata(String nodeId, String name, Long sizeBytes, String fileType) {
        AssetNodeDocument node = nodes.get(nodeId);
        if (node == null) {
            return Optional.empty();
        }
        if (name != null) node.setName(name);
        if (sizeBytes != null) node.setSizeBytes(sizeBytes);
        if (fileType != null) node.setFileType(fileType);
        return Optional.of(copy(node));
    }

    @Override
    public synchronized void updateStatus(String nodeId, AssetDownloadStatus status, String localPath) {
        AssetNodeDocument node = nodes.get(nodeId);
        if (node != null) {
            node.setDownloadStatus(status);
            node.setLocalPath(localPath);
        }
    }

    @Override
    public synchronized void updateDownloadUrl(String nodeId, String downloadUrl, String fileType) {
        AssetNodeDocument node = nodes.get(nodeId);
        if (node != null) {
            node.setDownloadUrl(downloadUrl);
            if (fileType != null) node.setFileType(fileType);
        }
    }

    @Override
    public synchronized boolean deleteIfOrphaned(String nodeId) {
        AssetNodeDocument node = nodes.get(nodeId);
        if (node == null || !node.getOwningProjectUids().isEmpty()) {
            return false;
        }
        nodes.remove(nodeId);
        return true;
    }

    public synchronized int size() {
        return nodes.size();
    }

    public synchronized int insertCount() {
        return inserts;
    }

    private static AssetNodeDocument copy(AssetNodeDocument source) {
        AssetNodeDocument doc = new AssetNodeDocument();
        doc.setNodeId(source.getNodeId());
        doc.setParentId(source.getParentId());
        doc.setName(source.getName());
        doc.setKind(source.getKind());
        doc.setRemoteId(source.getRemoteId());
        doc.setSizeBytes(source.getSizeBytes());
        doc.setFileType(source.getFileType());
        doc.setDownloadStatus(source.getDownloadStatus());
        doc.setLocalPath(source.getLocalPath());
        doc.setDownloadUrl(source.getDownloadUrl());
        doc.setOwningProjectUids(new LinkedHashSet<>(source.getOwningProjectUids()));
        doc.setCreatedAt(source.getCreatedAt());
        doc.setUpdatedAt(source.getUpdatedAt());
        return doc;
    }
}
