package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.AssetNodeDto;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.asset.AssetCacheService;
import io.github.drompincen.fieldsync.runtime.asset.AssetSyncReport;
import io.github.drompincen.fieldsync.runtime.asset.AssetTreeResolver;
import io.github.drompincen.fieldsync.runtime.storage.ProjectCleanupService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/projects/{projectUid}")
public class ProjectAssetController {

    private final AssetCacheService assetCacheService;
    private final AssetTreeResolver assetTreeResolver;
    private final ProjectCleanupService cleanupService;

    public ProjectAssetController(AssetCacheService assetCacheService,
                                  AssetTreeResolver assetTreeResolver,
                                  ProjectCleanupService cleanupService) {
        this.assetCacheService = assetCacheService;
        this.assetTreeResolver = assetTreeResolver;
        this.cleanupService = cleanupService;
    }

    @GetMapping("/assets")
    public List<AssetNodeDto> assets(@PathVariable String projectUid) {
        return assetCacheService.assetsOf(projectUid);
    }

    @PostMapping("/assets/retry")
    public ResponseEntity<SyncResult> retryFailed(@PathVariable String projectUid) {
        AssetSyncReport report = assetTreeResolver.retryFailedDownloads(projectUid);
        SyncResult result = report.complete()
                ? SyncResult.success(report.summary(), report.failures())
                : SyncResult.failure(report.summary(), report.failures());
        return SyncResponses.of(result);
    }

    @DeleteMapping
    public ResponseEntity<SyncResult> delete(@PathVariable String projectUid) {
        return SyncResponses.of(cleanupService.deleteProjects(List.of(projectUid)));
    }
}
