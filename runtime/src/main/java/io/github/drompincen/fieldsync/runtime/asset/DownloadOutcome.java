package io.github.drompincen.fieldsync.runtime.asset;

/** Result of bringing one file node into the local cache. {@code reason} is set on failure. */
public record DownloadOutcome(
        String nodeId,
        String remoteId,
        boolean success,
        boolean alreadyCached,
        String localPath,
        String reason
) {
    public static DownloadOutcome downloaded(String nodeId, String remoteId, String localPath) {
        return new DownloadOutcome(nodeId, remoteId, true, false, localPath, null);
    }

    public static DownloadOutcome cached(String nodeId, String remoteId, String localPath) {
        return new DownloadOutcome(nodeId, remoteId, true, true, localPath, null);
    }

    public static DownloadOutcome failed(String nodeId, String remoteId, String reason) {
        return new DownloadOutcome(nodeId, remoteId, false, false, null, reason);
    }
}
