package io.github.drompincen.fieldsync.protocol.api;

/**
 * One entry of the create-upload-task response. Correlated to its package by {@code packageDigest}.
 */
public record TicketGrant(
        String eventUid,
        String packageDigest,
        String archiveName,
        UploadTicket ticket
) {}
