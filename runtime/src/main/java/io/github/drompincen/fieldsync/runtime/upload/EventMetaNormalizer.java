package io.github.drompincen.fieldsync.runtime.upload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Edits an event's {@code meta.json} before it is archived.
 *
 * <p>Early recorder builds saved audio as {@code <name>.$ext}; those files are renamed to
 * {@code .m4a} (or {@code <name>_<n>.m4a} when that name is taken) and the {@code audios}
 * entries rewritten to match.
 */
@Component
public class EventMetaNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventMetaNormalizer.class);

    static final String META_FILE = "meta.json";
    static final String PLACEHOLDER_SUFFIX = ".$ext";
    private static final String AUDIO_EXTENSION = ".m4a";

    private final ObjectMapper objectMapper;

    public EventMetaNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** @return how many audio entries were renamed */
    public int normalizeLegacyAudioNames(Path eventDir) throws IOException {
        ObjectNode meta = readMeta(eventDir);
        if (meta == null || !meta.path("audios").isArray()) {
            return 0;
        }
        ArrayNode audios = (ArrayNode) meta.get("audios");
        int renamed = 0;
        for (int i = 0; i < audios.size(); i++) {
            JsonNode entry = audios.get(i);
            if (!entry.isTextual() || !entry.asText().endsWith(PLACEHOLDER_SUFFIX)) {
                continue;
            }
            String name = entry.asText();
            String base = name.substring(0, name.length() - PLACEHOLDER_SUFFIX.length());
            String fixedName = base + AUDIO_EXTENSION;
            for (int attempt = 1; Files.exists(eventDir.resolve(fixedName)); attempt++) {
                fixedName = base + "_" + attempt + AUDIO_EXTENSION;
            }
            Path legacyFile = eventDir.resolve(name);
            if (Files.exists(legacyFile)) {
                Files.move(legacyFile, eventDir.resolve(fixedName));
            }
            audios.set(i, audios.textNode(fixedName));
            renamed++;
            log.debug("Renamed legacy audio {} to {} in {}", name, fixedName, eventDir.getFileName());
        }
        if (renamed > 0) {
            writeMeta(eventDir, meta);
        }
        return renamed;
    }

    /** Records the project the event is being uploaded to as {@code project_uid}. */
    public boolean stampTargetProject(Path eventDir, String targetProjectUid) throws IOException {
        ObjectNode meta = readMeta(eventDir);
        if (meta == null || targetProjectUid == null) {
            return false;
        }
        if (targetProjectUid.equals(meta.path("project_uid").asText(null))) {
            return false;
        }
        meta.put("project_uid", targetProjectUid);
        writeMeta(eventDir, meta);
        return true;
    }

    /** The {@code project_uid} recorded in the event's metadata, if any. */
    public String projectUidOf(Path eventDir) {
        try {
            ObjectNode meta = readMeta(eventDir);
            return meta == null ? null : meta.path("project_uid").asText(null);
        } catch (IOException e) {
            log.warn("Unreadable {} in {}: {}", META_FILE, eventDir, e.getMessage());
            return null;
        }
    }

    private ObjectNode readMeta(Path eventDir) throws IOException {
        Path metaFile = eventDir.resolve(META_FILE);
        if (!Files.isRegularFile(metaFile)) {
            return null;
        }
        JsonNode node = objectMapper.readTree(metaFile.toFile());
        return node instanceof ObjectNode object ? object : null;
    }

    private void writeMeta(Path eventDir, ObjectNode meta) throws IOException {
        objectMapper.writeValue(eventDir.resolve(META_FILE).toFile(), meta);
    }
}
