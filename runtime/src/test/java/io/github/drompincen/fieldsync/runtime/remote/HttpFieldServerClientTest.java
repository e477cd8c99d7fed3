package io.github.drompincen.fieldsync.runtime.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.fieldsync.protocol.api.RemoteProject;
import io.github.drompincen.fieldsync.protocol.api.ResolvedDownload;
import io.github.drompincen.fieldsync.protocol.api.TaskStatus;
import io.github.drompincen.fieldsync.protocol.api.TicketGrant;
import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;
import io.github.drompincen.fieldsync.runtime.config.RemoteEndpoints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpFieldServerClientTest {

    private static final String BASE = "https://field.example.com";

    @TempDir
    Path dir;

    private MockRestServiceServer server;
    private HttpFieldServerClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE);
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpFieldServerClient(builder.build(), RemoteEndpoints.defaults(), new ObjectMapper(),
                Map.of("X-USERNAME", "inspector", "Authorization", "Bearer t0k"));
    }

    @Test
    void listProjectsReadsWrappedListWithAliases() {
        server.expect(requestTo(BASE + "/app/project/project_list"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-USERNAME", "inspector"))
                .andExpect(header("Authorization", "Bearer t0k"))
                .andRespond(withSuccess("""
                        {"success": true, "data": {"list": [
                          {"project_uid": "P1", "project_hash": "h1", "project_name": "Bridge",
                           "defect_count": "4", "eventCount": 2, "endDate": 1700000000000},
                          {"projectUid": "P2"},
                          {"name": "no uid"}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        List<RemoteProject> projects = client.listProjects();

        assertThat(projects).containsExactly(
                new RemoteProject("P1", "h1", "Bridge", "ACTIVE", 4, 2, 1700000000000L),
                new RemoteProject("P2", "", "Unnamed Project", "ACTIVE", 0, 0, null));
        server.verify();
    }

    @Test
    void unsuccessfulEnvelopeIsRejected() {
        server.expect(requestTo(BASE + "/app/project/project_list"))
                .andRespond(withSuccess("{\"success\": false, \"code\": 401, \"message\": \"token expired\"}",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.listProjects())
                .isInstanceOf(RemoteCallException.class)
                .hasMessageContaining("token expired")
                .extracting("httpStatus").isEqualTo(401);
    }

    @Test
    void httpErrorCarriesStatus() {
        server.expect(requestTo(BASE + "/app/project/project?project_uid=P1"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.getProjectDetail("P1"))
                .isInstanceOf(RemoteCallException.class)
                .extracting("httpStatus").isEqualTo(503);
    }

    @Test
    void resolveDownloadUrlsPostsIdsAndReadsEntries() {
        server.expect(requestTo(BASE + "/storage/download/url"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("[\"F1\",\"F2\"]"))
                .andRespond(withSuccess("""
                        {"data": [
                          {"file_id": "F2", "url": "https://cdn.example.com/F2", "file_type": "png"},
                          {"file_id": "F1", "url": "https://cdn.example.com/F1"},
                          {"url": "https://cdn.example.com/anon"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<ResolvedDownload> resolved = client.resolveDownloadUrls(List.of("F1", "F2"));

        assertThat(resolved).extracting(ResolvedDownload::remoteId).containsExactly("F2", "F1", null);
        assertThat(resolved.get(0).fileType()).isEqualTo("png");
    }

    @Test
    void bareUrlBodyResolvesTheSingleRequestedId() {
        server.expect(requestTo(BASE + "/storage/download/url"))
                .andRespond(withSuccess("\"https://cdn.example.com/F1?sig=abc\"", MediaType.TEXT_PLAIN));

        List<ResolvedDownload> resolved = client.resolveDownloadUrls(List.of("F1"));

        assertThat(resolved).singleElement()
                .isEqualTo(new ResolvedDownload("F1", "https://cdn.example.com/F1?sig=abc", null, null));
    }

    @Test
    void downloadStreamsBodyWithoutIdentityHeaders() throws Exception {
        server.expect(requestTo("https://cdn.example.com/F1"))
                .andExpect(headerDoesNotExist("X-USERNAME"))
                .andExpect(headerDoesNotExist("Authorization"))
                .andRespond(withSuccess("payload".getBytes(StandardCharsets.UTF_8), MediaType.APPLICATION_OCTET_STREAM));

        Path target = dir.resolve("F1.bin");
        client.download("https://cdn.example.com/F1", target);

        assertThat(target).hasContent("payload");
    }

    @Test
    void createUploadTaskSendsPackagesAndParsesTickets() {
        server.expect(requestTo(BASE + "/app/event/create_event_upload"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.task_uid").value("t1"))
                .andExpect(jsonPath("$.target_project_uid").value("P1"))
                .andExpect(jsonPath("$.upload_list[0].event_package_hash").value("d1"))
                .andRespond(withSuccess("""
                        {"success": true, "data": [
                          {"event_uid": "e1", "event_package_hash": "d1", "event_package_name": "e1.zip",
                           "ticket": {"host": "https://bucket.oss.example.com", "dir": "events/", "file_id": "o1",
                                      "policy": "pol", "signature": "sig", "accessid": "ak", "expire": "123"}},
                          {"event_uid": "e2", "event_package_hash": "d2", "ticket": {}}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<TicketGrant> grants = client.createUploadTask("t1", "P1", List.of(
                new UploadPackage("e1", "d1", "e1.zip"), new UploadPackage("e2", "d2", "e2.zip")));

        assertThat(grants).hasSize(1);
        assertThat(grants.get(0).ticket().objectKey()).isEqualTo("events/o1");
        assertThat(grants.get(0).packageDigest()).isEqualTo("d1");
    }

    @Test
    void uploadToStoragePostsMultipartFormWithoutIdentity() throws Exception {
        Path archive = Files.writeString(dir.resolve("e1.zip"), "zip");
        UploadTicket ticket = new UploadTicket("bucket.oss.example.com", "events/", "o1", "pol", "sig", "ak", "1");
        server.expect(requestTo("https://bucket.oss.example.com"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(headerDoesNotExist("X-USERNAME"))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andRespond(withSuccess());

        client.uploadToStorage(ticket, archive);

        server.verify();
    }

    @Test
    void storageRejectionSurfacesResponseBody() throws Exception {
        Path archive = Files.writeString(dir.resolve("e1.zip"), "zip");
        UploadTicket ticket = new UploadTicket("https://bucket.oss.example.com", null, "o1", "pol", "sig", "ak", "1");
        server.expect(requestTo("https://bucket.oss.example.com"))
                .andRespond(withStatus(HttpStatus.FORBIDDEN).body("<Error>SignatureDoesNotMatch</Error>"));

        assertThatThrownBy(() -> client.uploadToStorage(ticket, archive))
                .isInstanceOf(RemoteCallException.class)
                .hasMessageContaining("SignatureDoesNotMatch");
    }

    @Test
    void pollTaskStatusMapsSuccessFlag() {
        server.expect(requestTo(BASE + "/app/event/notice_event_upload_success?task_uid=t1"))
                .andRespond(withSuccess("{\"success\": false, \"code\": 202, \"message\": \"processing\"}",
                        MediaType.APPLICATION_JSON));

        assertThat(client.pollTaskStatus("t1")).isEqualTo(new TaskStatus(false, 202, "processing"));
    }
}
