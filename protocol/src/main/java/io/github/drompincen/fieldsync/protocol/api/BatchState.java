package io.github.drompincen.fieldsync.protocol.api;

/**
 * Lifecycle of one upload batch: {@code CREATED -> PACKAGING -> TICKETING -> UPLOADING -> POLLING},
 * ending in {@link #SUCCEEDED}, {@link #TIMED_OUT} or {@link #FAILED}. Any running stage may fail;
 * only polling may succeed or time out.
 */
public enum BatchState {
    CREATED, PACKAGING, TICKETING, UPLOADING, POLLING, SUCCEEDED, TIMED_OUT, FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == TIMED_OUT || this == FAILED;
    }

    public boolean canMoveTo(BatchState next) {
        switch (this) {
            case CREATED:
                return next == PACKAGING || next == FAILED;
            case PACKAGING:
                return next == TICKETING || next == FAILED;
            case TICKETING:
                return next == UPLOADING || next == FAILED;
            case UPLOADING:
                return next == POLLING || next == FAILED;
            case POLLING:
                return next == SUCCEEDED || next == TIMED_OUT || next == FAILED;
            default:
                return false;
        }
    }
}
