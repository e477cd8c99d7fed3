package io.github.drompincen.fieldsync.runtime.asset;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.persistence.store.AssetNodeStore;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps each shared asset node's set of owning projects and evicts a node, with its cached file,
 * once no project owns it.
 */
@Component
public class AssetReferenceTracker {

    private static final Logger log = LoggerFactory.getLogger(AssetReferenceTracker.class);

    private final AssetNodeStore assetNodeStore;

    public AssetReferenceTracker(AssetNodeStore assetNodeStore) {
        this.assetNodeStore = assetNodeStore;
    }

    /** Nodes the project owns right now. Take this before {@link #materialize} when pruning afterwards. */
    public List<AssetNodeDocument> snapshotOwned(String projectUid) {
        return List.copyOf(assetNodeStore.findByOwner(projectUid));
    }

    /**
     * Creates or merges every parsed node under {@code projectUid}. A file whose {@code remoteId}
     * is already known, from this or any other project, is merged and never duplicated.
     *
     * @return the file nodes of the tree in their merged state, one per stored node even when the
     *         tree lists the same file more than once
     */
    public List<AssetNodeDocument> materialize(String projectUid, List<ParsedAssetNode> nodes) {
        Map<String, AssetNodeDocument> files = new LinkedHashMap<>();
        for (ParsedAssetNode node : nodes) {
            AssetNodeDocument merged = node.isFile()
                    ? materializeFile(projectUid, node)
                    : materializeFolder(projectUid, node);
            if (node.isFile() && merged != null) {
                files.put(merged.getNodeId(), merged);
            }
        }
        return new ArrayList<>(files.values());
    }

    /**
     * Unlinks the project from previously owned file nodes whose remote id is not in the current tree.
     * Folder placeholders are left alone.
     */
    public PruneResult prune(String projectUid, Collection<AssetNodeDocument> previouslyOwned, Set<String> currentRemoteIds) {
        int unlinked = 0;
        int evicted = 0;
        for (AssetNodeDocument node : previouslyOwned) {
            if (node.isFolderPlaceholder() || currentRemoteIds.contains(node.getRemoteId())) {
                continue;
            }
            unlinked++;
            if (release(projectUid, node)) {
                evicted++;
            }
        }
        if (unlinked > 0) {
            log.info("Pruned project {} from {} asset(s), {} evicted", projectUid, unlinked, evicted);
        }
        return new PruneResult(unlinked, evicted);
    }

    /** Drops the project from every node it owns, folders included. */
    public PruneResult releaseAll(String projectUid) {
        int evicted = 0;
        List<AssetNodeDocument> owned = snapshotOwned(projectUid);
        for (AssetNodeDocument node : owned) {
            if (release(projectUid, node)) {
                evicted++;
            }
        }
        return new PruneResult(owned.size(), evicted);
    }

    private boolean release(String projectUid, AssetNodeDocument node) {
        Optional<AssetNodeDocument> updated = assetNodeStore.removeOwner(node.getNodeId(), projectUid);
        if (updated.isEmpty()) {
            return false;
        }
        Set<String> remaining = updated.get().getOwningProjectUids();
        if (remaining != null && !remaining.isEmpty()) {
            log.debug("Asset {} unlinked from {}, still owned by {}", node.getNodeId(), projectUid, remaining);
            return false;
        }
        if (!assetNodeStore.deleteIfOrphaned(node.getNodeId())) {
            return false;
        }
        deleteCachedFile(updated.get().getLocalPath());
        log.debug("Evicted orphan asset {} (remoteId={})", node.getNodeId(), node.getRemoteId());
        return true;
    }

    private AssetNodeDocument materializeFile(String projectUid, ParsedAssetNode node) {
        Optional<AssetNodeDocument> existing = assetNodeStore.findByRemoteId(node.remoteId());
        if (existing.isPresent()) {
            return merge(projectUid, existing.get(), node);
        }
        String nodeId = node.nodeId();
        Optional<AssetNodeDocument> idClash = assetNodeStore.findById(nodeId);
        if (idClash.isPresent() && !node.remoteId().equals(idClash.get().getRemoteId())) {
            nodeId = "file_" + node.remoteId();
        }
        try {
            AssetNodeDocument created = assetNodeStore.insert(newDocument(projectUid, node, nodeId, AssetDownloadStatus.PENDING));
            log.debug("New asset node {} (remoteId={}) for project {}", created.getNodeId(), node.remoteId(), projectUid);
            return created;
        } catch (DuplicateKeyException e) {
            // another sync created it between the lookup and the insert
            return assetNodeStore.findByRemoteId(node.remoteId())
                    .map(raced -> merge(projectUid, raced, node))
                    .orElseThrow(() -> e);
        }
    }

    private AssetNodeDocument materializeFolder(String projectUid, ParsedAssetNode node) {
        Optional<AssetNodeDocument> existing = assetNodeStore.findById(node.nodeId());
        if (existing.isPresent()) {
            assetNodeStore.addOwner(node.nodeId(), projectUid);
            return assetNodeStore.refreshMetadata(node.nodeId(), node.name(), null, null).orElse(existing.get());
        }
        try {
            return assetNodeStore.insert(newDocument(projectUid, node, node.nodeId(), null));
        } catch (DuplicateKeyException e) {
            return assetNodeStore.addOwner(node.nodeId(), projectUid).orElseThrow(() -> e);
        }
    }

    private AssetNodeDocument merge(String projectUid, AssetNodeDocument existing, ParsedAssetNode node) {
        assetNodeStore.addOwner(existing.getNodeId(), projectUid);
        return assetNodeStore.refreshMetadata(existing.getNodeId(), node.name(), node.sizeBytes(), null)
                .orElse(existing);
    }

    private static AssetNodeDocument newDocument(String projectUid, ParsedAssetNode node, String nodeId,
                                                 AssetDownloadStatus status) {
        AssetNodeDocument doc = new AssetNodeDocument();
        doc.setNodeId(nodeId);
        doc.setParentId(node.parentId());
        doc.setName(node.name());
        doc.setKind(node.kind());
        doc.setRemoteId(node.remoteId());
        doc.setSizeBytes(node.sizeBytes());
        doc.setFileType(node.fileType());
        doc.setDownloadStatus(status);
        doc.setOwningProjectUids(new LinkedHashSet<>(Set.of(projectUid)));
        return doc;
    }

    private static void deleteCachedFile(String localPath) {
        if (localPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(Path.of(localPath));
        } catch (IOException e) {
            log.warn("Could not delete cached file {}", localPath, e);
        }
    }

    public record PruneResult(int unlinked, int evicted) {}
}
