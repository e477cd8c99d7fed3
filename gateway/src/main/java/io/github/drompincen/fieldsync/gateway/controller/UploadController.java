package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.SyncProgress;
import io.github.drompincen.fieldsync.protocol.api.SyncResult;
import io.github.drompincen.fieldsync.protocol.api.UploadEventsRequest;
import io.github.drompincen.fieldsync.runtime.upload.EventUploadService;
import io.github.drompincen.fieldsync.runtime.upload.SyncProgressTracker;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/api/uploads")
public class UploadController {

    private final EventUploadService uploadService;
    private final SyncProgressTracker progress;

    public UploadController(EventUploadService uploadService, SyncProgressTracker progress) {
        this.uploadService = uploadService;
        this.progress = progress;
    }

    @PostMapping
    public ResponseEntity<SyncResult> uploadEvents(@RequestBody UploadEventsRequest request) {
        return SyncResponses.of(uploadService.uploadEvents(request.eventUids(), request.targetProjectUid()));
    }

    @PostMapping("/{eventUid}")
    public ResponseEntity<SyncResult> uploadEvent(@PathVariable String eventUid,
                                                  @RequestParam String targetProjectUid) {
        return SyncResponses.of(uploadService.uploadEvent(eventUid, targetProjectUid));
    }

    @GetMapping("/progress")
    public SyncProgress progress() {
        return progress.current();
    }

    @GetMapping(value = "/progress/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SyncProgress>> progressStream() {
        return progress.updates()
                .map(update -> ServerSentEvent.builder(update).event("progress").build());
    }
}
