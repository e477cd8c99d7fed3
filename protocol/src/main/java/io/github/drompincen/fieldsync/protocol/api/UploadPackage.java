package io.github.drompincen.fieldsync.protocol.api;

public record UploadPackage(
        String eventUid,
        String packageDigest,
        String archiveName
) {}
