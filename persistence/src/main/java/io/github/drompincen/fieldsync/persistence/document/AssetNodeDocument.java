package io.github.drompincen.fieldsync.persistence.document;

import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import io.github.drompincen.fieldsync.protocol.api.AssetKind;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One cached node of a digital-asset tree. Shared by every project whose tree references the same
 * {@code remoteId}; the node is evicted once {@code owningProjectUids} is empty. Folder placeholders
 * have no {@code remoteId} and no download status.
 */
@Document(collection = "asset_nodes")
public class AssetNodeDocument {

    @Id
    private String nodeId;
    private String parentId;
    private String name;
    private AssetKind kind;
    @Indexed(unique = true, sparse = true)
    private String remoteId;
    private Long sizeBytes;
    private String fileType;
    private AssetDownloadStatus downloadStatus;
    private String localPath;
    private String downloadUrl;
    @Indexed
    private Set<String> owningProjectUids = new LinkedHashSet<>();
    private Instant createdAt;
    private Instant updatedAt;

    public AssetNodeDocument() {}

    /** Folder placeholders carry no remote content and are never downloaded. */
    public boolean isFolderPlaceholder() {
        return remoteId == null;
    }

    public String getNodeId() { return nodeId; }
    public void setNodeId(String nodeId) { this.nodeId = nodeId; }

    public String getParentId() { return parentId; }
    public void setParentId(String parentId) { this.parentId = parentId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public AssetKind getKind() { return kind; }
    public void setKind(AssetKind kind) { this.kind = kind; }

    public String getRemoteId() { return remoteId; }
    public void setRemoteId(String remoteId) { this.remoteId = remoteId; }

    public Long getSizeBytes() { return sizeBytes; }
    public void setSizeBytes(Long sizeBytes) { this.sizeBytes = sizeBytes; }

    public String getFileType() { return fileType; }
    public void setFileType(String fileType) { this.fileType = fileType; }

    public AssetDownloadStatus getDownloadStatus() { return downloadStatus; }
    public void setDownloadStatus(AssetDownloadStatus downloadStatus) { this.downloadStatus = downloadStatus; }

    public String getLocalPath() { return localPath; }
    public void setLocalPath(String localPath) { this.localPath = localPath; }

    public String getDownloadUrl() { return downloadUrl; }
    public void setDownloadUrl(String downloadUrl) { this.downloadUrl = downloadUrl; }

    public Set<String> getOwningProjectUids() { return owningProjectUids; }
    public void setOwningProjectUids(Set<String> owningProjectUids) { this.owningProjectUids = owningProjectUids; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
