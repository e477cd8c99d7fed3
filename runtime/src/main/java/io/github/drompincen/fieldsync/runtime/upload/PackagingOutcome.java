package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.UploadPackage;

import java.nio.file.Path;

/**
 * Result of packaging one event. A failure with {@code retryable = false} is a local precondition
 * error and is not attempted again by the upload retry.
 */
public record PackagingOutcome(
        String eventUid,
        boolean success,
        UploadPackage uploadPackage,
        Path archive,
        String reason,
        boolean retryable
) {
    public static final String EVENT_NOT_FOUND = "event not found locally";

    public static PackagingOutcome packaged(UploadPackage uploadPackage, Path archive) {
        return new PackagingOutcome(uploadPackage.eventUid(), true, uploadPackage, archive, null, false);
    }

    public static PackagingOutcome notFound(String eventUid) {
        return new PackagingOutcome(eventUid, false, null, null, EVENT_NOT_FOUND, false);
    }

    public static PackagingOutcome failed(String eventUid, String reason) {
        return new PackagingOutcome(eventUid, false, null, null, reason, true);
    }
}
