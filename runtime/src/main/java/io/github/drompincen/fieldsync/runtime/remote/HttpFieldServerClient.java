package io.github.drompincen.fieldsync.runtime.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.fieldsync.protocol.api.RemoteProject;
import io.github.drompincen.fieldsync.protocol.api.ResolvedDownload;
import io.github.drompincen.fieldsync.protocol.api.TaskStatus;
import io.github.drompincen.fieldsync.protocol.api.TicketGrant;
import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;
import io.github.drompincen.fieldsync.runtime.config.RemoteEndpoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link FieldServerClient} over Spring's {@link RestClient}. Field server calls carry the configured
 * identity headers; presigned downloads and direct storage uploads go out without them.
 */
public class HttpFieldServerClient implements FieldServerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpFieldServerClient.class);

    private final RestClient restClient;
    private final RemoteEndpoints endpoints;
    private final ObjectMapper objectMapper;
    private final Map<String, String> identityHeaders;

    public HttpFieldServerClient(RestClient restClient, RemoteEndpoints endpoints,
                                 ObjectMapper objectMapper, Map<String, String> identityHeaders) {
        this.restClient = restClient;
        this.endpoints = endpoints;
        this.objectMapper = objectMapper;
        this.identityHeaders = Map.copyOf(identityHeaders);
    }

    @Override
    public List<RemoteProject> listProjects() {
        JsonNode body = call("listProjects", () -> restClient.get()
                .uri(endpoints.projectListPath())
                .headers(this::identify)
                .retrieve()
                .body(String.class));
        rejectUnsuccessful("listProjects", body);

        List<RemoteProject> projects = new ArrayList<>();
        for (JsonNode entry : ProjectListShape.extract(body)) {
            RemoteProject project = toRemoteProject(entry);
            if (project == null) {
                log.warn("Skipping project list entry without uid: {}", entry);
                continue;
            }
            projects.add(project);
        }
        return projects;
    }

    @Override
    public JsonNode getProjectDetail(String projectUid) {
        JsonNode body = call("getProjectDetail", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path(endpoints.projectDetailPath())
                        .queryParam("project_uid", projectUid)
                        .build())
                .headers(this::identify)
                .retrieve()
                .body(String.class));
        rejectUnsuccessful("getProjectDetail", body);
        if (body.isMissingNode() || body.isNull()) {
            throw new RemoteCallException("getProjectDetail returned an empty body for " + projectUid);
        }
        return body;
    }

    @Override
    public List<ResolvedDownload> resolveDownloadUrls(List<String> remoteIds) {
        if (remoteIds.isEmpty()) {
            return List.of();
        }
        String payload = toJson(remoteIds);
        JsonNode body = call("resolveDownloadUrl", () -> restClient.post()
                .uri(endpoints.downloadUrlPath())
                .headers(this::identify)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(String.class));

        List<ResolvedDownload> resolved = new ArrayList<>();
        for (JsonNode entry : DownloadUrlShape.extract(body)) {
            String url = entry.isTextual() ? entry.asText().trim()
                    : JsonFields.text(entry, "url", "download_url");
            if (url == null || url.isBlank()) {
                continue;
            }
            String remoteId = entry.isObject() ? JsonFields.text(entry, "file_id", "fileId", "id") : null;
            if (remoteId == null && remoteIds.size() == 1) {
                remoteId = remoteIds.get(0);
            }
            resolved.add(new ResolvedDownload(remoteId, url,
                    JsonFields.text(entry, "file_type", "fileType", "type"),
                    JsonFields.text(entry, "file_name", "fileName", "name")));
        }
        return resolved;
    }

    @Override
    public void download(String url, Path target) {
        try {
            restClient.get()
                    .uri(URI.create(url))
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isError()) {
                            throw new RemoteCallException("download failed: HTTP " + response.getStatusCode().value(),
                                    response.getStatusCode().value(), null);
                        }
                        try (InputStream in = response.getBody()) {
                            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                        }
                        return null;
                    });
        } catch (RestClientException | IllegalArgumentException e) {
            throw new RemoteCallException("download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public UploadTicket requestUploadTicket(String fileName, String digest) {
        JsonNode body = call("requestUploadTicket", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path(endpoints.uploadTicketPath())
                        .queryParam("file_name", fileName)
                        .queryParam("type", "ZIP")
                        .queryParam("remark", digest)
                        .build())
                .headers(this::identify)
                .retrieve()
                .body(String.class));
        rejectUnsuccessful("requestUploadTicket", body);

        JsonNode node = body.path("data").isObject() ? body.path("data") : body;
        if (node.path("ticket").isObject()) {
            node = node.path("ticket");
        }
        UploadTicket ticket = toTicket(node);
        if (ticket == null) {
            throw new RemoteCallException("requestUploadTicket returned no usable ticket for " + fileName);
        }
        return ticket;
    }

    @Override
    public List<TicketGrant> createUploadTask(String taskUid, String targetProjectUid, List<UploadPackage> packages) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("task_uid", taskUid);
        request.put("target_project_uid", targetProjectUid);
        ArrayNode uploadList = request.putArray("upload_list");
        for (UploadPackage pkg : packages) {
            uploadList.addObject()
                    .put("event_uid", pkg.eventUid())
                    .put("event_package_hash", pkg.packageDigest())
                    .put("event_package_name", pkg.archiveName());
        }
        String payload = toJson(request);

        JsonNode body = call("createUploadTask", () -> restClient.post()
                .uri(endpoints.createUploadPath())
                .headers(this::identify)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(String.class));
        rejectUnsuccessful("createUploadTask", body);

        List<TicketGrant> grants = new ArrayList<>();
        for (JsonNode entry : body.path("data")) {
            UploadTicket ticket = toTicket(entry.path("ticket"));
            if (ticket == null) {
                log.warn("Upload task {} entry without a usable ticket: {}", taskUid, entry);
                continue;
            }
            grants.add(new TicketGrant(
                    JsonFields.text(entry, "event_uid"),
                    JsonFields.text(entry, "event_package_hash"),
                    JsonFields.text(entry, "event_package_name"),
                    ticket));
        }
        return grants;
    }

    @Override
    public void uploadToStorage(UploadTicket ticket, Path archive) {
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("key", ticket.objectKey());
        form.add("policy", ticket.policy());
        form.add("OSSAccessKeyId", ticket.accessId());
        form.add("signature", ticket.signature());
        form.add("success_action_status", "200");
        form.add("file", new FileSystemResource(archive));
        try {
            restClient.post()
                    .uri(URI.create(ticket.uploadUrl()))
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(form)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            String detail = e.getResponseBodyAsString();
            throw new RemoteCallException(detail.isBlank() ? "http " + e.getStatusCode().value() : detail,
                    e.getStatusCode().value(), e);
        } catch (RestClientException | IllegalArgumentException e) {
            throw new RemoteCallException("upload error: " + e.getMessage(), e);
        }
    }

    @Override
    public TaskStatus pollTaskStatus(String taskUid) {
        JsonNode body = call("pollTaskStatus", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path(endpoints.uploadStatusPath())
                        .queryParam("task_uid", taskUid)
                        .build())
                .headers(this::identify)
                .retrieve()
                .body(String.class));
        return new TaskStatus(body.path("success").asBoolean(false),
                body.path("code").asInt(0),
                JsonFields.text(body, "message"));
    }

    private void identify(HttpHeaders headers) {
        identityHeaders.forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                headers.set(name, value);
            }
        });
    }

    private JsonNode call(String operation, Supplier<String> exchange) {
        String raw;
        try {
            raw = exchange.get();
        } catch (RestClientResponseException e) {
            throw new RemoteCallException(operation + " failed: HTTP " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new RemoteCallException(operation + " failed: " + e.getMessage(), e);
        }
        if (raw == null || raw.isBlank()) {
            return objectMapper.missingNode();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("http")) {
            return objectMapper.getNodeFactory().textNode(trimmed.replace("\"", ""));
        }
        try {
            return objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            throw new RemoteCallException(operation + " returned malformed JSON", e);
        }
    }

    private static void rejectUnsuccessful(String operation, JsonNode body) {
        JsonNode success = body.get("success");
        if (body.isObject() && success != null && success.isBoolean() && !success.asBoolean()) {
            String message = JsonFields.text(body, "message", "msg");
            throw new RemoteCallException(operation + " rejected: " + (message == null ? "no message" : message),
                    body.path("code").isNumber() ? body.path("code").asInt() : null, null);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize request body", e);
        }
    }

    private static RemoteProject toRemoteProject(JsonNode entry) {
        String uid = JsonFields.text(entry, "project_uid", "projectUid", "uid", "projectUID");
        if (uid == null) {
            return null;
        }
        Long lastUpdated = JsonFields.number(entry,
                "project_last_update_at", "projectLastUpdateAt", "last_update_at", "lastUpdateAt",
                "updated_at", "updatedAt");
        if (lastUpdated == null) {
            lastUpdated = JsonFields.number(entry, "endDate", "end_date");
        }
        String name = JsonFields.text(entry, "name", "projectName", "project_name");
        String status = JsonFields.text(entry, "status", "project_status");
        String hash = JsonFields.text(entry, "project_hash", "projectHash", "hash", "project_hash_value");
        return new RemoteProject(uid,
                hash == null ? "" : hash,
                name == null ? "Unnamed Project" : name,
                status == null ? "ACTIVE" : status,
                JsonFields.intOrZero(entry, "defectCount", "defect_count"),
                JsonFields.intOrZero(entry, "eventCount", "event_count"),
                lastUpdated);
    }

    private static UploadTicket toTicket(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String host = JsonFields.text(node, "host");
        String objectId = JsonFields.text(node, "file_id", "fileId");
        if (host == null || objectId == null) {
            return null;
        }
        return new UploadTicket(host,
                JsonFields.text(node, "dir", "directory"),
                objectId,
                JsonFields.text(node, "policy"),
                JsonFields.text(node, "signature"),
                JsonFields.text(node, "accessid", "accessId", "OSSAccessKeyId"),
                JsonFields.text(node, "expire"));
    }
}
