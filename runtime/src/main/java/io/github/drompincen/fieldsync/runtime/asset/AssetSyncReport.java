package io.github.drompincen.fieldsync.runtime.asset;

import java.util.List;

/** Outcome of resolving one project's asset tree: {@code successCount / totalFiles} plus pruning counts. */
public record AssetSyncReport(
        String projectUid,
        int successCount,
        int totalFiles,
        int unlinked,
        int evicted,
        List<String> failures
) {
    public AssetSyncReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static AssetSyncReport empty(String projectUid) {
        return new AssetSyncReport(projectUid, 0, 0, 0, 0, List.of());
    }

    public boolean complete() {
        return successCount == totalFiles;
    }

    public String summary() {
        return successCount + "/" + totalFiles + " assets cached";
    }
}
