package io.github.drompincen.fieldsync.runtime.asset;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.persistence.store.AssetNodeStore;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import io.github.drompincen.fieldsync.protocol.api.AssetNodeDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Read access to cached assets. */
@Service
public class AssetCacheService {

    private static final Logger log = LoggerFactory.getLogger(AssetCacheService.class);

    private final AssetNodeStore assetNodeStore;

    public AssetCacheService(AssetNodeStore assetNodeStore) {
        this.assetNodeStore = assetNodeStore;
    }

    /**
     * The cached file for {@code remoteId}, if it is really there. A COMPLETED node whose file has
     * gone missing is flipped to FAILED so the next retry or sync downloads it again.
     */
    public Optional<Path> localFile(String remoteId) {
        Optional<AssetNodeDocument> node = assetNodeStore.findByRemoteId(remoteId);
        if (node.isEmpty() || node.get().getDownloadStatus() != AssetDownloadStatus.COMPLETED) {
            return Optional.empty();
        }
        if (AssetDownloader.isCached(node.get())) {
            return Optional.of(Path.of(node.get().getLocalPath()));
        }
        log.warn("Cached file for asset {} is missing at {}, marking FAILED", remoteId, node.get().getLocalPath());
        assetNodeStore.updateStatus(node.get().getNodeId(), AssetDownloadStatus.FAILED, null);
        return Optional.empty();
    }

    public List<AssetNodeDto> assetsOf(String projectUid) {
        return assetNodeStore.findByOwner(projectUid).stream()
                .sorted(Comparator.comparing(AssetNodeDocument::getNodeId))
                .map(AssetCacheService::toDto)
                .toList();
    }

    private static AssetNodeDto toDto(AssetNodeDocument doc) {
        return new AssetNodeDto(doc.getNodeId(), doc.getParentId(), doc.getName(), doc.getKind(),
                doc.getRemoteId(), doc.getSizeBytes(), doc.getFileType(), doc.getDownloadStatus(),
                doc.getLocalPath(),
                doc.getOwningProjectUids() == null ? Set.of() : Set.copyOf(doc.getOwningProjectUids()),
                doc.getUpdatedAt());
    }
}
