package io.github.drompincen.fieldsync.runtime.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Response layouts of the download-URL resolution endpoint, in priority order. Each yields the
 * entry objects (or bare URL strings) it found; the first non-empty result wins.
 */
enum DownloadUrlShape {

    DATA_ARRAY {
        @Override
        Optional<List<JsonNode>> entries(JsonNode body) {
            return arrayEntries(body.path("data"));
        }
    },
    DATA_URLS {
        @Override
        Optional<List<JsonNode>> entries(JsonNode body) {
            return arrayEntries(body.path("data").path("urls"));
        }
    },
    URLS {
        @Override
        Optional<List<JsonNode>> entries(JsonNode body) {
            return arrayEntries(body.path("urls"));
        }
    },
    SINGLE_URL {
        @Override
        Optional<List<JsonNode>> entries(JsonNode body) {
            JsonNode data = body.path("data");
            if (data.isObject() && JsonFields.text(data, "url", "download_url") != null) {
                return Optional.of(List.of(data));
            }
            if (JsonFields.text(body, "url", "download_url") != null) {
                return Optional.of(List.of(body));
            }
            if (data.isTextual() && !data.asText().isBlank()) {
                return Optional.of(List.of(data));
            }
            return Optional.empty();
        }
    };

    abstract Optional<List<JsonNode>> entries(JsonNode body);

    static List<JsonNode> extract(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return List.of();
        }
        if (body.isTextual()) {
            return List.of(body);
        }
        for (DownloadUrlShape shape : values()) {
            Optional<List<JsonNode>> entries = shape.entries(body);
            if (entries.isPresent()) {
                return entries.get();
            }
        }
        return List.of();
    }

    private static Optional<List<JsonNode>> arrayEntries(JsonNode array) {
        if (!array.isArray() || array.isEmpty()) {
            return Optional.empty();
        }
        List<JsonNode> entries = new ArrayList<>();
        array.forEach(entries::add);
        return Optional.of(entries);
    }
}
