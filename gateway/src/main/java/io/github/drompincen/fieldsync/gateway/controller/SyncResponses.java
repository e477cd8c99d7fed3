package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.sync.ProjectSyncCoordinator;
import io.github.drompincen.fieldsync.runtime.upload.EventUploadService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/** 200 on success, 409 when another run holds the guard, 422 for any other failure or a timeout. */
final class SyncResponses {

    private SyncResponses() {
    }

    static ResponseEntity<SyncResult> of(SyncResult result) {
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        if (ProjectSyncCoordinator.ALREADY_RUNNING.equals(result.message())
                || EventUploadService.ALREADY_RUNNING.equals(result.message())) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        }
        return ResponseEntity.unprocessableEntity().body(result);
    }
}
