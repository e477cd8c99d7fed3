package io.github.drompincen.fieldsync.runtime.asset;

import io.github.drompincen.fieldsync.protocol.api.AssetKind;

/** A node read from one project's asset tree, before it is merged into the shared node table. */
public record ParsedAssetNode(
        String nodeId,
        String parentId,
        String name,
        AssetKind kind,
        String remoteId,
        Long sizeBytes,
        String fileType,
        String path
) {
    public boolean isFile() {
        return remoteId != null;
    }
}
