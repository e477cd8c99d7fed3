package io.github.drompincen.fieldsync.runtime.asset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.github.drompincen.fieldsync.protocol.api.ResolvedDownload;
import io.github.drompincen.fieldsync.runtime.config.StorageLayout;
import io.github.drompincen.fieldsync.runtime.remote.FieldServerClient;
import io.github.drompincen.fieldsync.runtime.remote.JsonFields;
import io.github.drompincen.fieldsync.runtime.remote.RemoteCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Downloads the pictures attached to a project's historical defects into
 * {@code history_defects/<projectUid>/<defectNo>/}. Failures are per picture.
 */
@Component
public class DefectImageCache {

    private static final Logger log = LoggerFactory.getLogger(DefectImageCache.class);
    private static final List<String> WRAPPERS = List.of("data", "item", "result");

    private final FieldServerClient client;
    private final StorageLayout storageLayout;

    public DefectImageCache(FieldServerClient client, StorageLayout storageLayout) {
        this.client = client;
        this.storageLayout = storageLayout;
    }

    /** @return number of pictures written */
    public int cache(String projectUid, JsonNode projectDetail) {
        JsonNode defects = locateDefectList(projectDetail);
        if (!defects.isArray()) {
            return 0;
        }
        int stored = 0;
        for (JsonNode defect : defects) {
            String defectNo = JsonFields.text(defect, "no");
            if (defectNo == null) {
                continue;
            }
            List<String> pictureIds = pictureIds(defect.get("defect_pics"));
            if (pictureIds.isEmpty()) {
                continue;
            }
            List<ResolvedDownload> urls;
            try {
                urls = client.resolveDownloadUrls(pictureIds);
            } catch (RemoteCallException e) {
                log.warn("Resolving pictures of defect {} in project {} failed: {}", defectNo, projectUid, e.getMessage());
                continue;
            }
            if (urls.isEmpty()) {
                continue;
            }
            Path directory;
            try {
                directory = storageLayout.ensureDirectory(storageLayout.defectImagesDir(projectUid, defectNo));
            } catch (UncheckedIOException e) {
                log.warn("Cannot create picture directory for defect {}: {}", defectNo, e.getMessage());
                continue;
            }
            for (int i = 0; i < urls.size(); i++) {
                String url = urls.get(i).url();
                Path target = directory.resolve(StorageLayout.sanitize(imageName(url, i)));
                Path partial = directory.resolve(target.getFileName() + ".part");
                try {
                    client.download(url, partial);
                    Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
                    stored++;
                } catch (RemoteCallException | IOException e) {
                    log.warn("Picture {} of defect {} not cached: {}", url, defectNo, e.getMessage());
                    deleteQuietly(partial);
                }
            }
        }
        if (stored > 0) {
            log.info("Cached {} defect picture(s) for project {}", stored, projectUid);
        }
        return stored;
    }

    private static JsonNode locateDefectList(JsonNode detail) {
        if (detail == null) {
            return MissingNode.getInstance();
        }
        JsonNode root = detail.isArray() ? detail.path(0) : detail;
        if (root.has("history_defect_list")) {
            return root.get("history_defect_list");
        }
        for (String wrapper : WRAPPERS) {
            JsonNode inner = root.path(wrapper);
            if (inner.isObject() && inner.has("history_defect_list")) {
                return inner.get("history_defect_list");
            }
        }
        return root.path("history_defect_list");
    }

    /** {@code defect_pics} is a comma separated string, an array of ids, or an array of {@code {id}} objects. */
    static List<String> pictureIds(JsonNode pics) {
        Set<String> ids = new LinkedHashSet<>();
        if (pics == null || pics.isNull()) {
            return List.of();
        }
        if (pics.isTextual()) {
            for (String part : pics.asText().split(",")) {
                if (!part.isBlank()) {
                    ids.add(part.trim());
                }
            }
        } else if (pics.isArray()) {
            for (JsonNode element : pics) {
                String id = element.isTextual() ? element.asText().trim() : JsonFields.text(element, "id");
                if (id != null && !id.isBlank()) {
                    ids.add(id);
                }
            }
        } else if (pics.isObject()) {
            String id = JsonFields.text(pics, "id");
            if (id != null) {
                ids.add(id);
            }
        }
        return new ArrayList<>(ids);
    }

    static String imageName(String url, int index) {
        try {
            String path = URI.create(url).getPath();
            if (path != null) {
                String name = path.substring(path.lastIndexOf('/') + 1);
                if (!name.isBlank()) {
                    return name;
                }
            }
        } catch (IllegalArgumentException e) {
            log.debug("Unparseable picture url {}", url);
        }
        return "img_" + index + ".jpg";
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}", path, e);
        }
    }
}
