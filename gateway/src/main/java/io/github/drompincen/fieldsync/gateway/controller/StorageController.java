package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.runtime.storage.ScratchCleanupService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/storage")
public class StorageController {

    private final ScratchCleanupService scratchCleanupService;

    public StorageController(ScratchCleanupService scratchCleanupService) {
        this.scratchCleanupService = scratchCleanupService;
    }

    @PostMapping("/cleanup")
    public SyncResult cleanup() {
        int removed = scratchCleanupService.sweep();
        return SyncResult.success("Removed " + removed + " scratch file(s)");
    }
}
