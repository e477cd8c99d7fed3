package io.github.drompincen.fieldsync.runtime.upload;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.fieldsync.persistence.document.EventRecordDocument;
import io.github.drompincen.fieldsync.persistence.repository.EventRecordRepository;
import io.github.drompincen.fieldsync.protocol.api.EventRecordDto;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EventRecordServiceTest {

    @Mock
    private EventRecordRepository repository;

    @TempDir
    Path storageRoot;

    private StorageLayout layout;
    private EventRecordService service;

    @BeforeEach
    void setUp() {
        layout = new StorageLayout(storageRoot);
        service = new EventRecordService(repository, layout, new EventMetaNormalizer(new ObjectMapper()));
        when(repository.findById(anyString())).thenReturn(Optional.empty());
        when(repository.existsById(anyString())).thenReturn(false);
    }

    private void eventOnDisk(String uid, String projectUid) throws Exception {
        Path dir = Files.createDirectories(layout.eventDir(uid));
        Files.writeString(dir.resolve("meta.json"), "{\"project_uid\":\"" + projectUid + "\"}");
    }

    private static EventRecordDocument record(String uid, String projectUid) {
        EventRecordDocument doc = new EventRecordDocument();
        doc.setEventUid(uid);
        doc.setProjectUid(projectUid);
        return doc;
    }

    @Test
    void markSyncedUpsertsEveryEvent() {
        EventRecordDocument existing = record("e1", "old");
        when(repository.findById("e1")).thenReturn(Optional.of(existing));

        service.markSynced(List.of("e1", "e2"), "P");

        ArgumentCaptor<EventRecordDocument> saved = ArgumentCaptor.forClass(EventRecordDocument.class);
        verify(repository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).allMatch(EventRecordDocument::isSynced)
                .allMatch(doc -> doc.getSyncedAt() != null)
                .allMatch(doc -> "P".equals(doc.getProjectUid()));
        assertThat(saved.getAllValues().get(1).getCreatedAt()).isNotNull();
    }

    @Test
    void unsyncedIncludesUntrackedDirectories() throws Exception {
        when(repository.findByProjectUidAndSyncedFalse("P")).thenReturn(List.of(record("e2", "P")));
        eventOnDisk("e1", "P");
        eventOnDisk("e3", "Q");

        List<EventRecordDto> unsynced = service.unsynced("P");

        assertThat(unsynced).extracting(EventRecordDto::eventUid).containsExactly("e1", "e2");
    }

    @Test
    void trackedDirectoriesAreNotDoubleCounted() throws Exception {
        when(repository.findBySyncedFalse()).thenReturn(List.of());
        when(repository.existsById("e1")).thenReturn(true);
        eventOnDisk("e1", "P");

        assertThat(service.unsynced(null)).isEmpty();
    }

    @Test
    void deleteProjectEventsRemovesDirectoriesAndRecords() throws Exception {
        when(repository.findByProjectUid("P")).thenReturn(List.of(record("e1", "P")));
        eventOnDisk("e1", "P");
        eventOnDisk("e2", "P");
        eventOnDisk("e3", "Q");

        List<String> removed = service.deleteProjectEvents("P");

        assertThat(removed).containsExactlyInAnyOrder("e1", "e2");
        assertThat(layout.eventDir("e1")).doesNotExist();
        assertThat(layout.eventDir("e2")).doesNotExist();
        assertThat(layout.eventDir("e3")).exists();
        verify(repository).deleteByProjectUid("P");
        verify(repository, never()).save(any());
    }
}
