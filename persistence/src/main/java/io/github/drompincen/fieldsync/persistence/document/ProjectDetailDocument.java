package io.github.drompincen.fieldsync.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "project_details")
public class ProjectDetailDocument {

    @Id
    private String projectUid;
    private String rawJson;
    private Instant lastFetchedAt;

    public ProjectDetailDocument() {}

    public String getProjectUid() { return projectUid; }
    public void setProjectUid(String projectUid) { this.projectUid = projectUid; }

    public String getRawJson() { return rawJson; }
    public void setRawJson(String rawJson) { this.rawJson = rawJson; }

    public Instant getLastFetchedAt() { return lastFetchedAt; }
    public void setLastFetchedAt(Instant lastFetchedAt) { this.lastFetchedAt = lastFetchedAt; }
}
