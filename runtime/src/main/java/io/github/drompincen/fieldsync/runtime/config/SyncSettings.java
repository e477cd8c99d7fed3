package io.github.drompincen.fieldsync.runtime.config;

import java.time.Duration;

public record SyncSettings(
        PollPolicy batchPoll,
        PollPolicy singlePoll,
        int retryAttempts,
        Duration retryDelay,
        boolean perPackageTicketFallback,
        int scratchRetentionDays) {

    public SyncSettings {
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1");
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(PollPolicy.batchDefault(), PollPolicy.singleDefault(),
                5, Duration.ofSeconds(3), false, 3);
    }
}
