package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.BatchState;
import io.github.drompincen.fieldsync.protocol.api.TaskStatus;
import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;
import io.github.drompincen.fieldsync.runtime.config.Pauser;
import io.github.drompincen.fieldsync.runtime.config.PollPolicy;
import io.github.drompincen.fieldsync.runtime.config.SyncSettings;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one batch attempt: {@code CREATED -> PACKAGING -> TICKETING -> UPLOADING -> POLLING}, ending in
 * SUCCEEDED, TIMED_OUT or FAILED. Item failures are isolated and reported line by line. Archives are
 * removed from the scratch area whatever the outcome.
 */
@Service
public class UploadOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(UploadOrchestrator.class);

    public static final String TIMEOUT = "timeout";
    static final String TIMEOUT_NOTICE = "Sync timeout - please check sync status later";

    private final EventPackager packager;
    private final UploadTicketClient ticketClient;
    private final FieldServerClient client;
    private final EventRecordService eventRecordService;
    private final SyncProgressTracker progress;
    private final Pauser pauser;
    private final SyncSettings settings;

    public UploadOrchestrator(EventPackager packager,
                              UploadTicketClient ticketClient,
                              FieldServerClient client,
                              EventRecordService eventRecordService,
                              SyncProgressTracker progress,
                              Pauser pauser,
                              SyncSettings settings) {
        this.packager = packager;
        this.ticketClient = ticketClient;
        this.client = client;
        this.eventRecordService = eventRecordService;
        this.progress = progress;
        this.pauser = pauser;
        this.settings = settings;
    }

    public UploadReport runBatch(List<String> eventUids, String targetProjectUid, PollPolicy pollPolicy) {
        UploadTask task = new UploadTask(targetProjectUid);
        List<String> lines = new ArrayList<>();
        Set<String> abandoned = new LinkedHashSet<>();
        Map<String, Path> archives = new LinkedHashMap<>();
        log.info("Task {}: uploading {} event(s) to project {}", task.getTaskUid(), eventUids.size(), targetProjectUid);

        try {
            task.moveTo(BatchState.PACKAGING);
            for (String eventUid : eventUids) {
                PackagingOutcome outcome = packager.pack(eventUid, targetProjectUid);
                if (outcome.success()) {
                    task.addPackage(outcome.uploadPackage());
                    archives.put(eventUid, outcome.archive());
                    lines.add(eventUid + ": packaged");
                } else {
                    lines.add(eventUid + ": " + outcome.reason());
                    if (!outcome.retryable()) {
                        abandoned.add(eventUid);
                    }
                }
            }
            if (task.getPackages().isEmpty()) {
                return end(task, BatchState.FAILED, "no event could be packaged", Set.of(), abandoned, lines);
            }

            task.moveTo(BatchState.TICKETING);
            List<UploadPackage> ticketed = assignTickets(task, lines);
            if (ticketed.isEmpty()) {
                return end(task, BatchState.FAILED, "no upload ticket was issued", Set.of(), abandoned, lines);
            }

            task.moveTo(BatchState.UPLOADING);
            List<String> uploaded = new ArrayList<>();
            for (UploadPackage pkg : ticketed) {
                UploadTicket ticket = task.getTicketsByDigest().get(pkg.packageDigest());
                UploadOutcome outcome = ticketClient.upload(pkg, archives.get(pkg.eventUid()), ticket);
                if (outcome.success()) {
                    task.markUploaded(pkg.packageDigest());
                    uploaded.add(pkg.eventUid());
                    progress.increment();
                    lines.add(pkg.eventUid() + ": uploaded");
                } else {
                    lines.add(pkg.eventUid() + ": upload failed - " + outcome.reason());
                }
            }
            if (uploaded.isEmpty()) {
                return end(task, BatchState.FAILED, "no package was uploaded", Set.of(), abandoned, lines);
            }

            task.moveTo(BatchState.POLLING);
            Optional<BatchState> polled = pollForCompletion(task.getTaskUid(), pollPolicy);
            if (polled.isEmpty()) {
                return end(task, BatchState.FAILED, "interrupted while polling", Set.of(), abandoned, lines);
            }
            if (polled.get() == BatchState.TIMED_OUT) {
                lines.add(TIMEOUT_NOTICE);
                return end(task, BatchState.TIMED_OUT, TIMEOUT, Set.of(), abandoned, lines);
            }

            eventRecordService.markSynced(uploaded, targetProjectUid);
            String message = "Uploaded " + uploaded.size() + " of " + eventUids.size() + " event(s)";
            return end(task, BatchState.SUCCEEDED, message, new LinkedHashSet<>(uploaded), abandoned, lines);
        } finally {
            archives.values().forEach(EventPackager::deleteIfPresent);
        }
    }

    /** @return packages holding a ticket, in batch order */
    private List<UploadPackage> assignTickets(UploadTask task, List<String> lines) {
        TicketAssignment assignment;
        try {
            assignment = ticketClient.requestTickets(task.getTaskUid(), task.getTargetProjectUid(), task.getPackages());
        } catch (RemoteCallException e) {
            log.warn("Task {}: ticket request failed: {}", task.getTaskUid(), e.getMessage());
            lines.add("ticket request failed - " + e.getMessage());
            return List.of();
        }
        assignment.ticketsByDigest().forEach(task::assignTicket);

        for (UploadPackage pkg : assignment.unmatched()) {
            if (!settings.perPackageTicketFallback()) {
                lines.add(pkg.eventUid() + ": no ticket returned for digest " + pkg.packageDigest());
                continue;
            }
            try {
                task.assignTicket(pkg.packageDigest(), ticketClient.requestTicket(pkg));
            } catch (RemoteCallException e) {
                lines.add(pkg.eventUid() + ": ticket request failed - " + e.getMessage());
            }
        }

        List<UploadPackage> ticketed = new ArrayList<>();
        for (UploadPackage pkg : task.getPackages()) {
            if (task.getTicketsByDigest().containsKey(pkg.packageDigest())) {
                ticketed.add(pkg);
            }
        }
        return ticketed;
    }

    /** @return SUCCEEDED or TIMED_OUT; empty if interrupted */
    private Optional<BatchState> pollForCompletion(String taskUid, PollPolicy policy) {
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                pauser.pause(policy.interval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            try {
                TaskStatus status = client.pollTaskStatus(taskUid);
                if (status.complete()) {
                    log.info("Task {} confirmed after {} poll(s)", taskUid, attempt);
                    return Optional.of(BatchState.SUCCEEDED);
                }
                log.debug("Task {} poll {}/{}: not complete (code={})", taskUid, attempt, policy.maxAttempts(), status.code());
            } catch (RemoteCallException e) {
                log.debug("Task {} poll {}/{} failed, treating as incomplete: {}", taskUid, attempt,
                        policy.maxAttempts(), e.getMessage());
            }
        }
        log.warn("Task {} not confirmed after {} poll(s)", taskUid, policy.maxAttempts());
        return Optional.of(BatchState.TIMED_OUT);
    }

    private static UploadReport end(UploadTask task, BatchState state, String message, Set<String> confirmed,
                                    Set<String> abandoned, List<String> lines) {
        task.moveTo(state);
        log.info("Task {} ended {}: {}", task.getTaskUid(), state, message);
        return new UploadReport(task.getTaskUid(), state, message, confirmed, abandoned, lines);
    }
}
