package io.github.drompincen.fieldsync.runtime.sync;

import io.github.drompincen.fieldsync.protocol.api.SyncPhase;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-writer project sync phase: {@code IDLE -> RUNNING -> IDLE}. Only the caller that won
 * {@link #tryStart()} may call {@link #finish()}.
 */
@Component
public class SyncStatusHolder {

    private final AtomicReference<SyncPhase> phase = new AtomicReference<>(SyncPhase.IDLE);
    private final Sinks.Many<SyncPhase> sink = Sinks.many().replay().latest();

    public SyncStatusHolder() {
        sink.tryEmitNext(SyncPhase.IDLE);
    }

    public boolean tryStart() {
        if (!phase.compareAndSet(SyncPhase.IDLE, SyncPhase.RUNNING)) {
            return false;
        }
        emit(SyncPhase.RUNNING);
        return true;
    }

    public void finish() {
        phase.set(SyncPhase.IDLE);
        emit(SyncPhase.IDLE);
    }

    public SyncPhase current() {
        return phase.get();
    }

    public boolean isRunning() {
        return phase.get() == SyncPhase.RUNNING;
    }

    public Flux<SyncPhase> phases() {
        return sink.asFlux();
    }

    private void emit(SyncPhase value) {
        sink.emitNext(value, Sinks.EmitFailureHandler.busyLooping(Duration.ofMillis(100)));
    }
}
