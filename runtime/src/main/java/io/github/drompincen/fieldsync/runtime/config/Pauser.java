package io.github.drompincen.fieldsync.runtime.config;

import java.time.Duration;

/** Waits between poll and retry attempts. Tests substitute a non-blocking implementation. */
@FunctionalInterface
public interface Pauser {

    void pause(Duration duration) throws InterruptedException;

    static Pauser sleeping() {
        return duration -> {
            if (!duration.isZero()) {
                Thread.sleep(duration.toMillis());
            }
        };
    }
}
