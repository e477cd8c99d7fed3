package io.github.drompincen.fieldsync.runtime.asset;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.persistence.store.AssetNodeStore;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class AssetTreeResolver {

    private static final Logger log = LoggerFactory.getLogger(AssetTreeResolver.class);

    private final AssetTreeParser parser;
    private final AssetReferenceTracker referenceTracker;
    private final AssetDownloader downloader;
    private final AssetNodeStore assetNodeStore;

    public AssetTreeResolver(AssetTreeParser parser, AssetReferenceTracker referenceTracker,
                             AssetDownloader downloader, AssetNodeStore assetNodeStore) {
        this.parser = parser;
        this.referenceTracker = referenceTracker;
        this.downloader = downloader;
        this.assetNodeStore = assetNodeStore;
    }

    /**
     * Materializes the project's tree, downloads what is not cached yet, then unlinks the project
     * from files its tree no longer references.
     */
    public AssetSyncReport resolve(String projectUid, JsonNode projectDetail) {
        List<ParsedAssetNode> parsed = parser.parse(projectDetail);
        // ownership must be read before this tree's nodes are merged in
        List<AssetNodeDocument> previouslyOwned = referenceTracker.snapshotOwned(projectUid);

        List<AssetNodeDocument> files = referenceTracker.materialize(projectUid, parsed);
        List<DownloadOutcome> outcomes = downloader.downloadAll(files);

        Set<String> currentRemoteIds = parsed.stream()
                .filter(ParsedAssetNode::isFile)
                .map(ParsedAssetNode::remoteId)
                .collect(Collectors.toSet());
        AssetReferenceTracker.PruneResult pruned = referenceTracker.prune(projectUid, previouslyOwned, currentRemoteIds);

        AssetSyncReport report = toReport(projectUid, outcomes, pruned);
        log.info("Asset tree for project {}: {} node(s), {}", projectUid, parsed.size(), report.summary());
        return report;
    }

    /** Re-drives every FAILED file node the project owns. */
    public AssetSyncReport retryFailedDownloads(String projectUid) {
        List<AssetNodeDocument> failed = assetNodeStore.findByOwnerAndStatus(projectUid, AssetDownloadStatus.FAILED)
                .stream()
                .filter(node -> !node.isFolderPlaceholder())
                .toList();
        if (failed.isEmpty()) {
            return AssetSyncReport.empty(projectUid);
        }
        log.info("Retrying {} failed asset download(s) for project {}", failed.size(), projectUid);
        return toReport(projectUid, downloader.downloadAll(failed), new AssetReferenceTracker.PruneResult(0, 0));
    }

    private static AssetSyncReport toReport(String projectUid, List<DownloadOutcome> outcomes,
                                            AssetReferenceTracker.PruneResult pruned) {
        int success = 0;
        List<String> failures = new ArrayList<>();
        for (DownloadOutcome outcome : outcomes) {
            if (outcome.success()) {
                success++;
            } else {
                failures.add(outcome.remoteId() + ": " + outcome.reason());
            }
        }
        return new AssetSyncReport(projectUid, success, outcomes.size(), pruned.unlinked(), pruned.evicted(), failures);
    }
}
