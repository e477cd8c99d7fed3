package io.github.drompincen.fieldsync.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "events")
@CompoundIndex(name = "project_synced", def = "{'projectUid': 1, 'synced': 1}")
public class EventRecordDocument {

    @Id
    private String eventUid;
    @Indexed
    private String projectUid;
    private boolean synced;
    private Instant syncedAt;
    private Instant createdAt;

    public EventRecordDocument() {}

    public String getEventUid() { return eventUid; }
    public void setEventUid(String eventUid) { this.eventUid = eventUid; }

    public String getProjectUid() { return projectUid; }
    public void setProjectUid(String projectUid) { this.projectUid = projectUid; }

    public boolean isSynced() { return synced; }
    public void setSynced(boolean synced) { this.synced = synced; }

    public Instant getSyncedAt() { return syncedAt; }
    public void setSyncedAt(Instant syncedAt) { this.syncedAt = syncedAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
