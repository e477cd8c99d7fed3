package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.persistence.document.EventRecordDocument;
import io.github.drompincen.fieldsync.persistence.repository.EventRecordRepository;
import io.github.drompincen.fieldsync.protocol.api.EventRecordDto;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.support.FileTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/** Local event records: the synced flag, and directories not yet tracked by a record. */
@Service
public class EventRecordService {

    private static final Logger log = LoggerFactory.getLogger(EventRecordService.class);

    private final EventRecordRepository eventRecordRepository;
    private final StorageLayout storageLayout;
    private final EventMetaNormalizer metaNormalizer;

    public EventRecordService(EventRecordRepository eventRecordRepository, StorageLayout storageLayout,
                              EventMetaNormalizer metaNormalizer) {
        this.eventRecordRepository = eventRecordRepository;
        this.storageLayout = storageLayout;
        this.metaNormalizer = metaNormalizer;
    }

    public void markSynced(Collection<String> eventUids, String targetProjectUid) {
        Instant now = Instant.now();
        for (String eventUid : eventUids) {
            EventRecordDocument doc = eventRecordRepository.findById(eventUid).orElseGet(() -> {
                EventRecordDocument fresh = new EventRecordDocument();
                fresh.setEventUid(eventUid);
                fresh.setCreatedAt(now);
                return fresh;
            });
            doc.setProjectUid(targetProjectUid);
            doc.setSynced(true);
            doc.setSyncedAt(now);
            eventRecordRepository.save(doc);
        }
        log.info("Marked {} event(s) synced", eventUids.size());
    }

    /**
     * Unsynced events, optionally limited to one project. Event directories with no record count as
     * unsynced, attributed to the {@code project_uid} in their metadata.
     */
    public List<EventRecordDto> unsynced(String projectUid) {
        Map<String, EventRecordDto> result = new HashMap<>();
        List<EventRecordDocument> records = projectUid == null
                ? eventRecordRepository.findBySyncedFalse()
                : eventRecordRepository.findByProjectUidAndSyncedFalse(projectUid);
        for (EventRecordDocument doc : records) {
            result.put(doc.getEventUid(), toDto(doc));
        }

        for (Path eventDir : eventDirectories()) {
            String eventUid = eventDir.getFileName().toString();
            if (result.containsKey(eventUid) || eventRecordRepository.existsById(eventUid)) {
                continue;
            }
            String owner = metaNormalizer.projectUidOf(eventDir);
            if (projectUid == null || projectUid.equals(owner)) {
                result.put(eventUid, new EventRecordDto(eventUid, owner, false, null, null));
            }
        }
        List<EventRecordDto> sorted = new ArrayList<>(result.values());
        sorted.sort(Comparator.comparing(EventRecordDto::eventUid));
        return sorted;
    }

    /** @return uids of the project's events whose records were removed */
    public List<String> deleteProjectEvents(String projectUid) {
        List<String> removed = new ArrayList<>();
        for (EventRecordDocument doc : eventRecordRepository.findByProjectUid(projectUid)) {
            removed.add(doc.getEventUid());
        }
        for (Path eventDir : eventDirectories()) {
            String eventUid = eventDir.getFileName().toString();
            if (!removed.contains(eventUid) && projectUid.equals(metaNormalizer.projectUidOf(eventDir))) {
                removed.add(eventUid);
            }
        }
        for (String eventUid : removed) {
            FileTrees.deleteTree(storageLayout.eventDir(eventUid));
        }
        eventRecordRepository.deleteByProjectUid(projectUid);
        return removed;
    }

    private List<Path> eventDirectories() {
        Path eventsDir = storageLayout.eventsDir();
        if (!Files.isDirectory(eventsDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(eventsDir)) {
            return children.filter(Files::isDirectory).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + eventsDir, e);
        }
    }

    private static EventRecordDto toDto(EventRecordDocument doc) {
        return new EventRecordDto(doc.getEventUid(), doc.getProjectUid(), doc.isSynced(),
                doc.getSyncedAt(), doc.getCreatedAt());
    }
}
