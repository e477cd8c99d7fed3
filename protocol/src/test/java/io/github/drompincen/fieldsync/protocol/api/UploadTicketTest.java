package io.github.drompincen.fieldsync.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UploadTicketTest {

    @Test
    void objectKeyConcatenatesDirectoryAndObjectId() {
        UploadTicket ticket = new UploadTicket("bucket.example.com", "events/2024/", "abc123",
                "policy", "sig", "access", null);

        assertThat(ticket.objectKey()).isEqualTo("events/2024/abc123");
    }

    @Test
    void objectKeyWithoutDirectory() {
        UploadTicket ticket = new UploadTicket("bucket.example.com", null, "abc123",
                "policy", "sig", "access", null);

        assertThat(ticket.objectKey()).isEqualTo("abc123");
    }

    @Test
    void uploadUrlAddsHttpsWhenSchemeMissing() {
        UploadTicket bare = new UploadTicket("bucket.example.com", "", "x", "p", "s", "a", null);
        UploadTicket explicit = new UploadTicket("http://localhost:9000", "", "x", "p", "s", "a", null);

        assertThat(bare.uploadUrl()).isEqualTo("https://bucket.example.com");
        assertThat(explicit.uploadUrl()).isEqualTo("http://localhost:9000");
    }
}
