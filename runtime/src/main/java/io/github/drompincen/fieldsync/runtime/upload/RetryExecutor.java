package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.runtime.config.Pauser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.IntConsumer;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Re-runs an attempt until it is accepted or the attempt budget is spent, pausing a fixed delay
 * between attempts. The attempt owns its side effects; {@code beforeAttempt} runs ahead of every
 * attempt so callers can reset per-attempt state.
 */
@Component
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Pauser pauser;

    public RetryExecutor(Pauser pauser) {
        this.pauser = pauser;
    }

    public <T> T execute(int maxAttempts, Duration delay, IntConsumer beforeAttempt,
                         IntFunction<T> attempt, Predicate<T> accepted) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        T result = null;
        for (int n = 1; n <= maxAttempts; n++) {
            beforeAttempt.accept(n);
            result = attempt.apply(n);
            if (accepted.test(result)) {
                return result;
            }
            if (n == maxAttempts) {
                break;
            }
            log.info("Attempt {}/{} not accepted, retrying in {} ms", n, maxAttempts, delay.toMillis());
            try {
                pauser.pause(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Retry interrupted after attempt {}", n);
                break;
            }
        }
        return result;
    }
}
