package io.github.drompincen.fieldsync.runtime.asset;

import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.persistence.store.AssetNodeStore;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import io.github.drompincen.fieldsync.protocol.api.ResolvedDownload;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves short-lived URLs for file nodes and streams them into {@code digital_assets/}.
 * Each node fails on its own; a failed node is marked FAILED and the rest carry on.
 */
@Component
public class AssetDownloader {

    private static final Logger log = LoggerFactory.getLogger(AssetDownloader.class);
    private static final Pattern EXTENSION = Pattern.compile("[A-Za-z0-9]{1,10}");

    private final FieldServerClient client;
    private final AssetNodeStore assetNodeStore;
    private final StorageLayout storageLayout;

    public AssetDownloader(FieldServerClient client, AssetNodeStore assetNodeStore, StorageLayout storageLayout) {
        this.client = client;
        this.assetNodeStore = assetNodeStore;
        this.storageLayout = storageLayout;
    }

    /** True when the node is COMPLETED and its file is still on disk. */
    public static boolean isCached(AssetNodeDocument node) {
        return node.getDownloadStatus() == AssetDownloadStatus.COMPLETED
                && node.getLocalPath() != null
                && Files.exists(Path.of(node.getLocalPath()));
    }

    public List<DownloadOutcome> downloadAll(List<AssetNodeDocument> fileNodes) {
        List<DownloadOutcome> outcomes = new ArrayList<>();
        List<AssetNodeDocument> pending = new ArrayList<>();
        for (AssetNodeDocument node : fileNodes) {
            if (node.isFolderPlaceholder()) {
                continue;
            }
            if (isCached(node)) {
                outcomes.add(DownloadOutcome.cached(node.getNodeId(), node.getRemoteId(), node.getLocalPath()));
            } else {
                pending.add(node);
            }
        }
        if (pending.isEmpty()) {
            return outcomes;
        }

        Map<String, ResolvedDownload> resolved = resolveBatch(pending);
        for (AssetNodeDocument node : pending) {
            outcomes.add(download(node, resolved.get(node.getRemoteId())));
        }
        return outcomes;
    }

    private Map<String, ResolvedDownload> resolveBatch(List<AssetNodeDocument> nodes) {
        List<String> ids = nodes.stream().map(AssetNodeDocument::getRemoteId).distinct().toList();
        Map<String, ResolvedDownload> byId = new HashMap<>();
        try {
            for (ResolvedDownload download : client.resolveDownloadUrls(ids)) {
                if (download.remoteId() != null) {
                    byId.putIfAbsent(download.remoteId(), download);
                }
            }
        } catch (RemoteCallException e) {
            log.warn("Batch URL resolution for {} asset(s) failed, resolving one by one: {}", ids.size(), e.getMessage());
        }
        return byId;
    }

    private DownloadOutcome download(AssetNodeDocument node, ResolvedDownload resolved) {
        String nodeId = node.getNodeId();
        String remoteId = node.getRemoteId();
        assetNodeStore.updateStatus(nodeId, AssetDownloadStatus.DOWNLOADING, null);

        if (resolved == null) {
            try {
                resolved = client.resolveDownloadUrls(List.of(remoteId)).stream()
                        .filter(d -> remoteId.equals(d.remoteId()))
                        .findFirst()
                        .orElse(null);
            } catch (RemoteCallException e) {
                return fail(node, "url resolution failed: " + e.getMessage());
            }
        }
        if (resolved == null) {
            return fail(node, "no download url for " + remoteId);
        }
        assetNodeStore.updateDownloadUrl(nodeId, resolved.url(), resolved.fileType());

        String fileType = resolved.fileType() != null ? resolved.fileType() : node.getFileType();
        Path directory;
        try {
            directory = storageLayout.ensureDirectory(storageLayout.digitalAssetsDir());
        } catch (UncheckedIOException e) {
            return fail(node, e.getMessage());
        }
        Path target = directory.resolve(fileName(remoteId, fileType));
        Path partial = directory.resolve(target.getFileName() + ".part");
        try {
            client.download(resolved.url(), partial);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (RemoteCallException | IOException e) {
            deletePartial(partial);
            return fail(node, "download failed: " + e.getMessage());
        }

        String localPath = target.toString();
        assetNodeStore.updateStatus(nodeId, AssetDownloadStatus.COMPLETED, localPath);
        log.debug("Downloaded asset {} to {}", remoteId, localPath);
        return DownloadOutcome.downloaded(nodeId, remoteId, localPath);
    }

    private DownloadOutcome fail(AssetNodeDocument node, String reason) {
        assetNodeStore.updateStatus(node.getNodeId(), AssetDownloadStatus.FAILED, null);
        log.warn("Asset {} (remoteId={}) failed: {}", node.getNodeId(), node.getRemoteId(), reason);
        return DownloadOutcome.failed(node.getNodeId(), node.getRemoteId(), reason);
    }

    static String fileName(String remoteId, String fileType) {
        String base = StorageLayout.sanitize(remoteId);
        if (fileType == null) {
            return base;
        }
        String extension = fileType.startsWith(".") ? fileType.substring(1) : fileType;
        return EXTENSION.matcher(extension).matches() ? base + "." + extension.toLowerCase(Locale.ROOT) : base;
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not delete partial download {}", partial, e);
        }
    }
}
