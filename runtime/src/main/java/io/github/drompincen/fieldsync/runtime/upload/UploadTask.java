package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.BatchState;
import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.protocol.api.UploadTicket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * One batch upload attempt. Lives only for the attempt; a retry creates a new task with a new uid.
 */
public class UploadTask {

    private static final Logger log = LoggerFactory.getLogger(UploadTask.class);

    private final String taskUid;
    private final String targetProjectUid;
    private final List<UploadPackage> packages = new ArrayList<>();
    private final Map<String, UploadTicket> ticketsByDigest = new LinkedHashMap<>();
    private final Set<String> completedDigests = new LinkedHashSet<>();
    private BatchState state = BatchState.CREATED;

    public UploadTask(String targetProjectUid) {
        this("task_" + System.currentTimeMillis() + "_" + UUID.randomUUID().toString().substring(0, 8), targetProjectUid);
    }

    UploadTask(String taskUid, String targetProjectUid) {
        this.taskUid = taskUid;
        this.targetProjectUid = targetProjectUid;
    }

    public void moveTo(BatchState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Task " + taskUid + " already ended in " + state);
        }
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Task " + taskUid + " cannot move from " + state + " to " + next);
        }
        log.debug("Task {}: {} -> {}", taskUid, state, next);
        state = next;
    }

    public void addPackage(UploadPackage uploadPackage) {
        packages.add(uploadPackage);
    }

    public void assignTicket(String digest, UploadTicket ticket) {
        ticketsByDigest.put(digest, ticket);
    }

    public void markUploaded(String digest) {
        completedDigests.add(digest);
    }

    public String getTaskUid() { return taskUid; }

    public String getTargetProjectUid() { return targetProjectUid; }

    public BatchState getState() { return state; }

    public List<UploadPackage> getPackages() { return Collections.unmodifiableList(packages); }

    public Map<String, UploadTicket> getTicketsByDigest() { return Collections.unmodifiableMap(ticketsByDigest); }

    public Set<String> getCompletedDigests() { return Collections.unmodifiableSet(completedDigests); }
}
