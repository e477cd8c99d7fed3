package io.github.drompincen.fieldsync.protocol.api;

import java.util.List;

public record UploadEventsRequest(
        List<String> eventUids,
        String targetProjectUid
) {}
