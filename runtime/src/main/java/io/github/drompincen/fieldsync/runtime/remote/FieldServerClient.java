package io.github.drompincen.fieldsync.runtime.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.fieldsync.protocol.api.RemoteProject;
import io.github.drompincen.fieldsync.protocol.api.ResolvedDownload;
import io.github.drompincen.fieldsync.protocol.api.TaskStatus;
import io.github.drompincen.fieldsync.protocol.api.TicketGrant;
import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;

import java.nio.file.Path;
import java.util.List;

/**
 * Outbound operations against the field server and its object storage.
 * Every method throws {@link RemoteCallException} on failure.
 */
public interface FieldServerClient {

    List<RemoteProject> listProjects();

    JsonNode getProjectDetail(String projectUid);

    /**
     * Entries the server returned without a file id carry a null {@code remoteId}, unless exactly one id
     * was requested.
     */
    List<ResolvedDownload> resolveDownloadUrls(List<String> remoteIds);

    /** Streams the content at {@code url} into {@code target}, replacing it. */
    void download(String url, Path target);

    UploadTicket requestUploadTicket(String fileName, String digest);

    List<TicketGrant> createUploadTask(String taskUid, String targetProjectUid, List<UploadPackage> packages);

    /** Direct multipart form write of {@code archive} to the ticket's host. */
    void uploadToStorage(UploadTicket ticket, Path archive);

    TaskStatus pollTaskStatus(String taskUid);
}
