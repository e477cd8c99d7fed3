package io.github.drompincen.fieldsync.runtime.storage;

import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.config.SyncSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

/** Sweeps the packaging scratch area of interrupted writes and archives past their retention. */
@Service
public class ScratchCleanupService {

    private static final Logger log = LoggerFactory.getLogger(ScratchCleanupService.class);

    private final StorageLayout storageLayout;
    private final SyncSettings settings;
    private final Clock clock;

    public ScratchCleanupService(StorageLayout storageLayout, SyncSettings settings) {
        this(storageLayout, settings, Clock.systemUTC());
    }

    ScratchCleanupService(StorageLayout storageLayout, SyncSettings settings, Clock clock) {
        this.storageLayout = storageLayout;
        this.settings = settings;
        this.clock = clock;
    }

    @Scheduled(cron = "${fieldsync.scheduler.scratch-cleanup-cron:0 30 3 * * *}")
    public void scheduledSweep() {
        try {
            int removed = sweep();
            log.info("Scratch sweep removed {} file(s)", removed);
        } catch (UncheckedIOException e) {
            log.error("Scratch sweep failed", e);
        }
    }

    /** @return number of files removed */
    public int sweep() {
        Path scratch = storageLayout.scratchDir();
        if (!Files.isDirectory(scratch)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(settings.scratchRetentionDays()));
        List<Path> files;
        try (Stream<Path> list = Files.list(scratch)) {
            files = list.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + scratch, e);
        }
        int removed = 0;
        for (Path file : files) {
            try {
                if (file.getFileName().toString().endsWith(".tmp")
                        || Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Cannot remove scratch file {}: {}", file, e.getMessage());
            }
        }
        return removed;
    }
}
