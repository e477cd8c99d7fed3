package io.github.drompincen.fieldsync.protocol.api;

public enum SyncPhase {
    IDLE, RUNNING
}
