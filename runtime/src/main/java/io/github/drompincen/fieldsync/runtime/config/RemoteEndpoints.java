package io.github.drompincen.fieldsync.runtime.config;

/** Paths of the field server operations, relative to the client's base URL. */
public record RemoteEndpoints(
        String projectListPath,
        String projectDetailPath,
        String downloadUrlPath,
        String uploadTicketPath,
        String createUploadPath,
        String uploadStatusPath) {

    public static RemoteEndpoints defaults() {
        return new RemoteEndpoints(
                "/app/project/project_list",
                "/app/project/project",
                "/storage/download/url",
                "/storage/upload/ticket",
                "/app/event/create_event_upload",
                "/app/event/notice_event_upload_success");
    }
}
