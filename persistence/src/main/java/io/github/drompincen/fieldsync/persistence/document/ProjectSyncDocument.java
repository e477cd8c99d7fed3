package io.github.drompincen.fieldsync.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "project_sync")
public class ProjectSyncDocument {

    @Id
    private String projectUid;
    private String contentHash;
    private long localRevisionTimestamp;
    private Instant updatedAt;

    public ProjectSyncDocument() {}

    public String getProjectUid() { return projectUid; }
    public void setProjectUid(String projectUid) { this.projectUid = projectUid; }

    public String getContentHash() { return contentHash; }
    public void setContentHash(String contentHash) { this.contentHash = contentHash; }

    public long getLocalRevisionTimestamp() { return localRevisionTimestamp; }
    public void setLocalRevisionTimestamp(long localRevisionTimestamp) { this.localRevisionTimestamp = localRevisionTimestamp; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
