package io.github.drompincen.fieldsync.runtime.upload;

import io.github.drompincen.fieldsync.protocol.api.UploadPackage;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.support.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zips {@code events/<eventUid>/} into the scratch area as {@code <eventUid>.zip} and digests the
 * archive with SHA-256. Entry names are paths relative to the event directory.
 */
@Component
public class EventPackager {

    private static final Logger log = LoggerFactory.getLogger(EventPackager.class);

    static final String EMPTY_ENTRY = "empty.txt";

    private final StorageLayout storageLayout;
    private final EventMetaNormalizer metaNormalizer;

    public EventPackager(StorageLayout storageLayout, EventMetaNormalizer metaNormalizer) {
        this.storageLayout = storageLayout;
        this.metaNormalizer = metaNormalizer;
    }

    public PackagingOutcome pack(String eventUid, String targetProjectUid) {
        Path eventDir = storageLayout.eventDir(eventUid);
        if (!Files.isDirectory(eventDir)) {
            log.warn("Event {} has no directory at {}", eventUid, eventDir);
            return PackagingOutcome.notFound(eventUid);
        }

        try {
            metaNormalizer.normalizeLegacyAudioNames(eventDir);
            metaNormalizer.stampTargetProject(eventDir, targetProjectUid);
        } catch (IOException e) {
            // the archive is still worth sending with the metadata as it is
            log.warn("Could not update metadata of event {}: {}", eventUid, e.getMessage());
        }

        String archiveName = StorageLayout.sanitize(eventUid) + ".zip";
        Path archive;
        Path partial;
        try {
            Path scratch = storageLayout.ensureDirectory(storageLayout.scratchDir());
            archive = scratch.resolve(archiveName);
            partial = scratch.resolve(archiveName + ".tmp");
        } catch (UncheckedIOException e) {
            return PackagingOutcome.failed(eventUid, "zip error: " + e.getMessage());
        }

        try {
            zipDirectory(eventDir, partial);
            Files.move(partial, archive, StandardCopyOption.REPLACE_EXISTING);
            String digest = Digests.sha256Hex(archive);
            log.debug("Packaged event {} into {} ({} bytes, sha256={})", eventUid, archive, Files.size(archive), digest);
            return PackagingOutcome.packaged(new UploadPackage(eventUid, digest, archiveName), archive);
        } catch (IOException | UncheckedIOException e) {
            deleteIfPresent(partial);
            log.warn("Packaging event {} failed", eventUid, e);
            return PackagingOutcome.failed(eventUid, "zip error: " + e.getMessage());
        }
    }

    private static void zipDirectory(Path sourceDir, Path zipFile) throws IOException {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            files = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        try (OutputStream out = Files.newOutputStream(zipFile);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            if (files.isEmpty()) {
                zip.putNextEntry(new ZipEntry(EMPTY_ENTRY));
                zip.write("This directory was empty during compression.".getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
                return;
            }
            for (Path file : files) {
                String entryName = sourceDir.relativize(file).toString().replace('\\', '/');
                zip.putNextEntry(new ZipEntry(entryName));
                Files.copy(file, zip);
                zip.closeEntry();
            }
        }
    }

    static void deleteIfPresent(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}", file, e);
        }
    }
}
