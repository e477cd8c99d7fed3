package io.github.drompincen.fieldsync.protocol.api;

/**
 * One-time direct-upload destination issued by the server. The fields are opaque and are
 * submitted verbatim to {@code host}.
 */
public record UploadTicket(
        String host,
        String directory,
        String objectId,
        String policy,
        String signature,
        String accessId,
        String expire
) {
    public String objectKey() {
        return (directory == null ? "" : directory) + objectId;
    }

    public String uploadUrl() {
        return host.startsWith("http") ? host : "https://" + host;
    }
}
