package io.github.drompincen.fieldsync.protocol.api;

public record ResolvedDownload(
        String remoteId,
        String url,
        String fileType,
        String fileName
) {}
