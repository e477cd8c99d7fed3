package io.github.drompincen.fieldsync.protocol.api;

public record TaskStatus(
        boolean complete,
        int code,
        String message
) {}
