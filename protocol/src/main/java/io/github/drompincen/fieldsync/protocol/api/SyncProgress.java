package io.github.drompincen.fieldsync.protocol.api;

public record SyncProgress(
        int completed,
        int total,
        boolean running
) {
    public static SyncProgress idle() {
        return new SyncProgress(0, 0, false);
    }

    public static SyncProgress started(int total) {
        return new SyncProgress(0, total, true);
    }

    public SyncProgress increment() {
        return new SyncProgress(completed + 1, total, running);
    }

    public SyncProgress finished() {
        return new SyncProgress(completed, total, false);
    }
}
