package io.github.drompincen.fieldsync.protocol.api;

/**
 * One entry of the server's project list. {@code contentHash} fingerprints the project detail payload.
 */
public record RemoteProject(
        String projectUid,
        String contentHash,
        String name,
        String status,
        int defectCount,
        int eventCount,
        Long lastUpdatedAt
) {}
