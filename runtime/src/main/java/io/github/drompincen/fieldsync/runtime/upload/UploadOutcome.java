package io.github.drompincen.fieldsync.runtime.upload;

public record UploadOutcome(
        String eventUid,
        String packageDigest,
        boolean success,
        String reason
) {
    public static UploadOutcome uploaded(String eventUid, String packageDigest) {
        return new UploadOutcome(eventUid, packageDigest, true, "upload successful");
    }

    public static UploadOutcome failed(String eventUid, String packageDigest, String reason) {
        return new UploadOutcome(eventUid, packageDigest, false, reason);
    }
}
