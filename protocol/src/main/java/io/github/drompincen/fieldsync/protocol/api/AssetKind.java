package io.github.drompincen.fieldsync.protocol.api;

public enum AssetKind {
    FOLDER, FILE
}
