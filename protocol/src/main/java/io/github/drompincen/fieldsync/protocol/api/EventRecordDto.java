package io.github.drompincen.fieldsync.protocol.api;

import java.time.Instant;

public record EventRecordDto(
        String eventUid,
        String projectUid,
        boolean synced,
        Instant syncedAt,
        Instant createdAt
) {}
