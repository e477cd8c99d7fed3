package io.github.drompincen.fieldsync.runtime.config;

import java.time.Duration;

/** Fixed-interval polling budget for task-completion checks. */
public record PollPolicy(Duration interval, int maxAttempts) {

    public PollPolicy {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static PollPolicy batchDefault() {
        return new PollPolicy(Duration.ofSeconds(3), 15);
    }

    public static PollPolicy singleDefault() {
        return new PollPolicy(Duration.ofSeconds(2), 30);
    }
}
