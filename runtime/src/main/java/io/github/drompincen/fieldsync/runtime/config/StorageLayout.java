package io.github.drompincen.fieldsync.runtime.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Local directory layout under one storage root:
 * {@code events/<eventUid>/}, {@code digital_assets/}, {@code history_defects/<projectUid>/<defectNo>/}
 * and the {@code sync_zip/} scratch area for upload archives.
 */
public class StorageLayout {

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");

    private final Path root;

    public StorageLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    public Path eventsDir() { return root.resolve("events"); }

    public Path eventDir(String eventUid) { return eventsDir().resolve(sanitize(eventUid)); }

    public Path digitalAssetsDir() { return root.resolve("digital_assets"); }

    public Path historyDefectsDir() { return root.resolve("history_defects"); }

    public Path projectDefectsDir(String projectUid) { return historyDefectsDir().resolve(sanitize(projectUid)); }

    public Path defectImagesDir(String projectUid, String defectNo) {
        return projectDefectsDir(projectUid).resolve(sanitize(defectNo));
    }

    public Path scratchDir() { return root.resolve("sync_zip"); }

    public Path ensureDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }

    public static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "_";
        }
        String safe = UNSAFE_CHARS.matcher(name).replaceAll("_");
        return safe.equals(".") || safe.equals("..") ? "_" : safe;
    }
}
