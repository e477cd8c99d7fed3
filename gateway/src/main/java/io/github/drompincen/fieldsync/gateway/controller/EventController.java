package io.github.drompincen.fieldsync.gateway.controller;

import io.github.drompincen.fieldsync.protocol.api.EventRecordDto;
import io.github.drompincen.fieldsync.runtime.upload.EventUploadService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventUploadService uploadService;

    public EventController(EventUploadService uploadService) {
        this.uploadService = uploadService;
    }

    @GetMapping("/unsynced")
    public List<EventRecordDto> unsynced(@RequestParam(required = false) String projectUid) {
        return uploadService.unsyncedEvents(projectUid);
    }
}
