package io.github.drompincen.fieldsync.protocol.api;

import java.util.List;

/**
 * Outcome of an inbound sync or upload operation. {@code message} is the headline,
 * {@code details} carries one line per project, node or event.
 */
public record SyncResult(
        boolean success,
        String message,
        List<String> details
) {
    public SyncResult {
        details = details == null ? List.of() : List.copyOf(details);
    }

    public static SyncResult success(String message) {
        return new SyncResult(true, message, List.of());
    }

    public static SyncResult success(String message, List<String> details) {
        return new SyncResult(true, message, details);
    }

    public static SyncResult failure(String message) {
        return new SyncResult(false, message, List.of());
    }

    public static SyncResult failure(String message, List<String> details) {
        return new SyncResult(false, message, details);
    }

    public String report() {
        if (details.isEmpty()) return message;
        return message + "\n" + String.join("\n", details);
    }
}
