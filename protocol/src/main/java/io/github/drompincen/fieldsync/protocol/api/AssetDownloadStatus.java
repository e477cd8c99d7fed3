package io.github.drompincen.fieldsync.protocol.api;

public enum AssetDownloadStatus {
    PENDING, DOWNLOADING, COMPLETED, FAILED
}
