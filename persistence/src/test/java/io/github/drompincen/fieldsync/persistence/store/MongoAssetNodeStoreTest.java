package io.github.drompincen.fieldsync.persistence.store;

import io.github.drompincen.fieldsync.persistence.AbstractMongoIntegrationTest;
import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import io.github.drompincen.fieldsync.protocol.api.AssetKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Import(MongoAssetNodeStore.class)
class MongoAssetNodeStoreTest extends AbstractMongoIntegrationTest {

    @Autowired
    private AssetNodeStore assetNodeStore;

    @Test
    void insertRejectsSecondNodeForSameRemoteId() {
        assetNodeStore.insert(fileNode("n1", "F1", "p1"));

        assertThatThrownBy(() -> assetNodeStore.insert(fileNode("n2", "F1", "p2")))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    void foldersWithoutRemoteIdDoNotCollide() {
        assetNodeStore.insert(folderNode("folder_a", "p1"));
        assetNodeStore.insert(folderNode("folder_b", "p1"));

        assertThat(assetNodeStore.findByOwner("p1")).hasSize(2);
    }

    @Test
    void addOwnerIsIdempotent() {
        assetNodeStore.insert(fileNode("n1", "F1", "p1"));

        assetNodeStore.addOwner("n1", "p2");
        AssetNodeDocument updated = assetNodeStore.addOwner("n1", "p2").orElseThrow();

        assertThat(updated.getOwningProjectUids()).containsExactlyInAnyOrder("p1", "p2");
    }

    @Test
    void removeOwnerThenDeleteIfOrphaned() {
        assetNodeStore.insert(fileNode("n1", "F1", "p1"));
        assetNodeStore.addOwner("n1", "p2");

        assetNodeStore.removeOwner("n1", "p1");
        assertThat(assetNodeStore.deleteIfOrphaned("n1")).isFalse();

        AssetNodeDocument remaining = assetNodeStore.removeOwner("n1", "p2").orElseThrow();
        assertThat(remaining.getOwningProjectUids()).isEmpty();
        assertThat(assetNodeStore.deleteIfOrphaned("n1")).isTrue();
        assertThat(assetNodeStore.findById("n1")).isEmpty();
    }

    @Test
    void refreshMetadataKeepsFieldsForNullArguments() {
        assetNodeStore.insert(fileNode("n1", "F1", "p1"));

        AssetNodeDocument updated = assetNodeStore.refreshMetadata("n1", "renamed.pdf", null, null).orElseThrow();

        assertThat(updated.getName()).isEqualTo("renamed.pdf");
        assertThat(updated.getSizeBytes()).isEqualTo(1024L);
        assertThat(updated.getFileType()).isEqualTo("pdf");
    }

    @Test
    void updateStatusSetsAndClearsLocalPath() {
        assetNodeStore.insert(fileNode("n1", "F1", "p1"));

        assetNodeStore.updateStatus("n1", AssetDownloadStatus.COMPLETED, "/data/F1.pdf");
        assertThat(assetNodeStore.findById("n1").orElseThrow().getLocalPath()).isEqualTo("/data/F1.pdf");

        assetNodeStore.updateStatus("n1", AssetDownloadStatus.FAILED, null);
        AssetNodeDocument failed = assetNodeStore.findById("n1").orElseThrow();
        assertThat(failed.getDownloadStatus()).isEqualTo(AssetDownloadStatus.FAILED);
        assertThat(failed.getLocalPath()).isNull();
    }

    @Test
    void findByOwnerAndStatus() {
        assetNodeStore.insert(fileNode("n1", "F1", "p1"));
        assetNodeStore.insert(fileNode("n2", "F2", "p1"));
        assetNodeStore.updateStatus("n2", AssetDownloadStatus.FAILED, null);

        List<AssetNodeDocument> failed = assetNodeStore.findByOwnerAndStatus("p1", AssetDownloadStatus.FAILED);
        assertThat(failed).extracting(AssetNodeDocument::getNodeId).containsExactly("n2");
    }

    private AssetNodeDocument fileNode(String nodeId, String remoteId, String owner) {
        AssetNodeDocument doc = new AssetNodeDocument();
        doc.setNodeId(nodeId);
        doc.setRemoteId(remoteId);
        doc.setName(remoteId + ".pdf");
        doc.setKind(AssetKind.FILE);
        doc.setSizeBytes(1024L);
        doc.setFileType("pdf");
        doc.setDownloadStatus(AssetDownloadStatus.PENDING);
        doc.setOwningProjectUids(new LinkedHashSet<>(Set.of(owner)));
        return doc;
    }

    private AssetNodeDocument folderNode(String nodeId, String owner) {
        AssetNodeDocument doc = new AssetNodeDocument();
        doc.setNodeId(nodeId);
        doc.setName(nodeId);
        doc.setKind(AssetKind.FOLDER);
        doc.setOwningProjectUids(new LinkedHashSet<>(Set.of(owner)));
        return doc;
    }
}
