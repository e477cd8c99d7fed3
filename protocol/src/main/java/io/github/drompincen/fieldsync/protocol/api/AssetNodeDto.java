package io.github.drompincen.fieldsync.protocol.api;

import java.time.Instant;
import java.util.Set;

public record AssetNodeDto(
        String nodeId,
        String parentId,
        String name,
        AssetKind kind,
        String remoteId,
        Long sizeBytes,
        String fileType,
        AssetDownloadStatus downloadStatus,
        String localPath,
        Set<String> owningProjectUids,
        Instant updatedAt
) {}
