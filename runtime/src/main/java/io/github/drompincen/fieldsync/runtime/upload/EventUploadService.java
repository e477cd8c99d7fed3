package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.BatchState;
import io.github.drompincen.fieldsync.protocol.api.EventRecordDto;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.config.PollPolicy;
import io.github.drompincen.fieldsync.runtime.config.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for outbound event sync. Wraps {@link UploadOrchestrator} in the retry policy: every
 * attempt re-runs only the events that are neither confirmed nor abandoned.
 */
@Service
public class EventUploadService {

    private static final Logger log = LoggerFactory.getLogger(EventUploadService.class);

    public static final String ALREADY_RUNNING = "upload already running";

    private final UploadOrchestrator orchestrator;
    private final RetryExecutor retryExecutor;
    private final SyncProgressTracker progress;
    private final EventRecordService eventRecordService;
    private final SyncSettings settings;
    private final AtomicBoolean running = new AtomicBoolean();

    public EventUploadService(UploadOrchestrator orchestrator,
                              RetryExecutor retryExecutor,
                              SyncProgressTracker progress,
                              EventRecordService eventRecordService,
                              SyncSettings settings) {
        this.orchestrator = orchestrator;
        this.retryExecutor = retryExecutor;
        this.progress = progress;
        this.eventRecordService = eventRecordService;
        this.settings = settings;
    }

    public SyncResult uploadEvents(List<String> eventUids, String targetProjectUid) {
        return upload(eventUids, targetProjectUid, settings.batchPoll());
    }

    public SyncResult uploadEvent(String eventUid, String targetProjectUid) {
        if (eventUid == null || eventUid.isBlank()) {
            return SyncResult.failure("event uid is required");
        }
        return upload(List.of(eventUid), targetProjectUid, settings.singlePoll());
    }

    public List<EventRecordDto> unsyncedEvents(String projectUid) {
        return eventRecordService.unsynced(projectUid);
    }

    private SyncResult upload(List<String> eventUids, String targetProjectUid, PollPolicy pollPolicy) {
        if (eventUids == null || eventUids.isEmpty()) {
            return SyncResult.failure("no events to upload");
        }
        if (targetProjectUid == null || targetProjectUid.isBlank()) {
            return SyncResult.failure("target project uid is required");
        }
        if (!running.compareAndSet(false, true)) {
            return SyncResult.failure(ALREADY_RUNNING);
        }
        try {
            return runWithRetry(new ArrayList<>(new LinkedHashSet<>(eventUids)), targetProjectUid, pollPolicy);
        } finally {
            progress.finish();
            running.set(false);
        }
    }

    private SyncResult runWithRetry(List<String> eventUids, String targetProjectUid, PollPolicy pollPolicy) {
        Set<String> confirmed = new LinkedHashSet<>();
        Set<String> abandoned = new LinkedHashSet<>();
        List<String> details = new ArrayList<>();
        AtomicReference<List<String>> remaining = new AtomicReference<>(List.copyOf(eventUids));

        UploadReport last = retryExecutor.execute(
                settings.retryAttempts(),
                settings.retryDelay(),
                attempt -> progress.reset(remaining.get().size()),
                attempt -> {
                    UploadReport report = orchestrator.runBatch(remaining.get(), targetProjectUid, pollPolicy);
                    confirmed.addAll(report.confirmedEventUids());
                    abandoned.addAll(report.abandonedEventUids());
                    report.lines().forEach(line -> details.add("attempt " + attempt + ": " + line));
                    remaining.set(eventUids.stream()
                            .filter(uid -> !confirmed.contains(uid) && !abandoned.contains(uid))
                            .toList());
                    return report;
                },
                report -> remaining.get().isEmpty());

        if (confirmed.size() == eventUids.size()) {
            log.info("Uploaded {} event(s) to project {}", confirmed.size(), targetProjectUid);
            return SyncResult.success("Uploaded " + confirmed.size() + " event(s)", details);
        }
        if (last != null && last.state() == BatchState.TIMED_OUT) {
            return SyncResult.failure(UploadOrchestrator.TIMEOUT, details);
        }
        String message = String.format("Uploaded %d of %d event(s); %d abandoned, %d not uploaded",
                confirmed.size(), eventUids.size(), abandoned.size(), remaining.get().size());
        log.warn("Upload to project {} incomplete: {}", targetProjectUid, message);
        return SyncResult.failure(message, details);
    }
}
