package io.github.drompincen.fieldsync.runtime.asset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.fieldsync.persistence.document.AssetNodeDocument;
import io.github.drompincen.fieldsync.protocol.api.AssetDownloadStatus;
import io.github.drompincen.fieldsync.protocol.api.ResolvedDownload;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.RemoteCallException;
import io.github.drompincen.fieldsync.runtime.support.InMemoryAssetNodeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AssetTreeResolverTest {

    @Mock
    private FieldServerClient client;

    @TempDir
    Path storageRoot;

    private final ObjectMapper mapper = new ObjectMapper();
    private InMemoryAssetNodeStore store;
    private AssetTreeResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryAssetNodeStore();
        StorageLayout layout = new StorageLayout(storageRoot);
        resolver = new AssetTreeResolver(new AssetTreeParser(), new AssetReferenceTracker(store),
                new AssetDownloader(client, store, layout), store);

        when(client.resolveDownloadUrls(anyList())).thenAnswer(inv -> {
            List<String> ids = inv.getArgument(0);
            return ids.stream()
                    .map(id -> new ResolvedDownload(id, "https://cdn.example.com/" + id, "jpg", id + ".jpg"))
                    .toList();
        });
        doAnswer(inv -> {
            Path target = inv.getArgument(1);
            Files.writeString(target, "bytes of " + inv.getArgument(0));
            return null;
        }).when(client).download(anyString(), any(Path.class));
    }

    private JsonNode tree(String... remoteIds) {
        StringBuilder children = new StringBuilder();
        for (String id : remoteIds) {
            if (children.length() > 0) children.append(',');
            children.append("{\"file_id\":\"").append(id).append("\",\"name\":\"").append(id).append(".jpg\"}");
        }
        try {
            return mapper.readTree("{\"project_digital_asset_tree\":[" + children + "]}");
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void sharedFileIsDownloadedOnceAndOwnedByBothProjects() {
        AssetSyncReport a = resolver.resolve("A", tree("F1", "F2"));
        AssetSyncReport b = resolver.resolve("B", tree("F2", "F3"));

        assertThat(a.successCount()).isEqualTo(2);
        assertThat(b.successCount()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(3);
        verify(client, times(1)).download(eq("https://cdn.example.com/F2"), any(Path.class));

        AssetNodeDocument shared = store.findByRemoteId("F2").orElseThrow();
        assertThat(shared.getOwningProjectUids()).containsExactlyInAnyOrder("A", "B");
        assertThat(shared.getDownloadStatus()).isEqualTo(AssetDownloadStatus.COMPLETED);
        assertThat(Path.of(shared.getLocalPath())).exists().hasFileName("F2.jpg");
    }

    @Test
    void prunedFileStaysWhileAnotherProjectOwnsIt() {
        resolver.resolve("A", tree("F1", "F2"));
        resolver.resolve("B", tree("F2"));

        AssetSyncReport report = resolver.resolve("A", tree("F1"));

        assertThat(report.unlinked()).isEqualTo(1);
        assertThat(report.evicted()).isZero();
        AssetNodeDocument shared = store.findByRemoteId("F2").orElseThrow();
        assertThat(shared.getOwningProjectUids()).containsExactly("B");
        assertThat(Path.of(shared.getLocalPath())).exists();
    }

    @Test
    void orphanedFileIsEvictedWithItsCachedFile() {
        resolver.resolve("A", tree("F1", "F2"));
        Path cached = Path.of(store.findByRemoteId("F2").orElseThrow().getLocalPath());

        AssetSyncReport report = resolver.resolve("A", tree("F1"));

        assertThat(report.evicted()).isEqualTo(1);
        assertThat(store.findByRemoteId("F2")).isEmpty();
        assertThat(cached).doesNotExist();
    }

    @Test
    void resyncOfUnchangedTreeDownloadsNothing() {
        resolver.resolve("A", tree("F1"));

        AssetSyncReport again = resolver.resolve("A", tree("F1"));

        assertThat(again.successCount()).isEqualTo(1);
        verify(client, times(1)).download(anyString(), any(Path.class));
        assertThat(store.insertCount()).isEqualTo(1);
    }

    @Test
    void failedDownloadIsMarkedAndRetried() {
        doThrow(new RemoteCallException("connection reset"))
                .doAnswer(inv -> {
                    Files.writeString(inv.<Path>getArgument(1), "ok");
                    return null;
                })
                .when(client).download(eq("https://cdn.example.com/F1"), any(Path.class));

        AssetSyncReport first = resolver.resolve("A", tree("F1"));

        assertThat(first.successCount()).isZero();
        assertThat(first.failures()).hasSize(1);
        assertThat(first.failures().get(0)).contains("connection reset");
        assertThat(store.findByRemoteId("F1").orElseThrow().getDownloadStatus()).isEqualTo(AssetDownloadStatus.FAILED);

        AssetSyncReport retried = resolver.retryFailedDownloads("A");

        assertThat(retried.successCount()).isEqualTo(1);
        assertThat(store.findByRemoteId("F1").orElseThrow().getDownloadStatus()).isEqualTo(AssetDownloadStatus.COMPLETED);
    }

    @Test
    void batchResolutionFailureFallsBackToSingleLookups() {
        when(client.resolveDownloadUrls(anyList()))
                .thenThrow(new RemoteCallException("batch rejected"))
                .thenAnswer(inv -> {
                    String id = inv.<List<String>>getArgument(0).get(0);
                    return List.of(new ResolvedDownload(id, "https://cdn.example.com/" + id, null, null));
                });

        AssetSyncReport report = resolver.resolve("A", tree("F1", "F2"));

        assertThat(report.successCount()).isEqualTo(2);
        verify(client, times(3)).resolveDownloadUrls(anyList());
    }

    @Test
    void fileListedTwiceInOneTreeIsStoredAndDownloadedOnce() throws Exception {
        JsonNode twice = mapper.readTree("{\"project_digital_asset_tree\":["
                + "{\"id\":\"n1\",\"file_id\":\"X\",\"name\":\"plan.jpg\"},"
                + "{\"id\":\"n2\",\"file_id\":\"X\",\"name\":\"plan copy.jpg\"}]}");

        AssetSyncReport report = resolver.resolve("A", twice);

        assertThat(store.size()).isEqualTo(1);
        assertThat(report.successCount()).isEqualTo(1);
        assertThat(report.totalFiles()).isEqualTo(1);
        verify(client, times(1)).download(eq("https://cdn.example.com/X"), any(Path.class));
    }

    @Test
    void completedAssetWhoseFileVanishedIsDownloadedAgain() throws Exception {
        resolver.resolve("A", tree("F1"));
        Path cached = Path.of(store.findByRemoteId("F1").orElseThrow().getLocalPath());
        Files.delete(cached);

        AssetSyncReport again = resolver.resolve("A", tree("F1"));

        assertThat(again.successCount()).isEqualTo(1);
        verify(client, times(2)).download(eq("https://cdn.example.com/F1"), any(Path.class));
        AssetNodeDocument node = store.findByRemoteId("F1").orElseThrow();
        assertThat(node.getDownloadStatus()).isEqualTo(AssetDownloadStatus.COMPLETED);
        assertThat(Path.of(node.getLocalPath())).exists();
        assertThat(store.insertCount()).isEqualTo(1);
    }
}
