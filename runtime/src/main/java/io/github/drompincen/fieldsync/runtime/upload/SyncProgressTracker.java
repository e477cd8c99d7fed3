package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.SyncProgress;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Live upload counters, published as a stream that replays the latest value to new subscribers. */
@Component
public class SyncProgressTracker {

    private final Sinks.Many<SyncProgress> sink = Sinks.many().replay().latest();
    private SyncProgress current = SyncProgress.idle();

    public SyncProgressTracker() {
        sink.tryEmitNext(current);
    }

    public synchronized void reset(int total) {
        publish(SyncProgress.started(total));
    }

    public synchronized void increment() {
        publish(current.increment());
    }

    public synchronized void finish() {
        publish(current.finished());
    }

    public synchronized SyncProgress current() {
        return current;
    }

    public Flux<SyncProgress> updates() {
        return sink.asFlux();
    }

    private void publish(SyncProgress next) {
        current = next;
        Sinks.EmitResult result = sink.tryEmitNext(next);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            throw new IllegalStateException("Progress update rejected: " + result);
        }
    }
}
