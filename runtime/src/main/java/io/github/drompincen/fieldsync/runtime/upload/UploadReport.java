package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.BatchState;

import java.util.List;
import java.util.Set;

/**
 * Terminal state of one batch attempt.
 *
 * @param confirmedEventUids events whose upload the server confirmed; only these are marked synced
 * @param abandonedEventUids events that failed a local precondition and must not be retried
 * @param lines              one human-readable line per item outcome
 */
public record UploadReport(
        String taskUid,
        BatchState state,
        String message,
        Set<String> confirmedEventUids,
        Set<String> abandonedEventUids,
        List<String> lines
) {
    public UploadReport {
        confirmedEventUids = Set.copyOf(confirmedEventUids);
        abandonedEventUids = Set.copyOf(abandonedEventUids);
        lines = List.copyOf(lines);
    }
}
