package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.SyncPhase;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.sync.ProjectSyncCoordinator;
import io.github.drompincen.fieldsync.runtime.sync.SyncStatusHolder;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final ProjectSyncCoordinator coordinator;
    private final SyncStatusHolder syncStatus;

    public SyncController(ProjectSyncCoordinator coordinator, SyncStatusHolder syncStatus) {
        this.coordinator = coordinator;
        this.syncStatus = syncStatus;
    }

    @PostMapping("/projects")
    public ResponseEntity<SyncResult> syncAll() {
        return SyncResponses.of(coordinator.syncAllProjects());
    }

    @PostMapping("/projects/{projectUid}")
    public ResponseEntity<SyncResult> syncOne(@PathVariable String projectUid) {
        return SyncResponses.of(coordinator.syncProject(projectUid));
    }

    @GetMapping("/status")
    public Map<String, SyncPhase> status() {
        return Map.of("phase", syncStatus.current());
    }
}
