package io.github.drompincen.fieldsync.runtime.remote;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Wrappers the project list endpoint has been seen to use, tried in declaration order.
 */
enum ProjectListShape {

    BARE_ARRAY {
        @Override
        Optional<JsonNode> locate(JsonNode body) {
            return body.isArray() ? Optional.of(body) : Optional.empty();
        }
    },
    WRAPPED {
        @Override
        Optional<JsonNode> locate(JsonNode body) {
            return firstArray(body);
        }
    },
    DOUBLE_WRAPPED {
        @Override
        Optional<JsonNode> locate(JsonNode body) {
            for (String key : WRAPPER_KEYS) {
                JsonNode inner = body.path(key);
                if (inner.isObject()) {
                    Optional<JsonNode> found = firstArray(inner);
                    if (found.isPresent()) {
                        return found;
                    }
                }
            }
            return Optional.empty();
        }
    };

    private static final String[] WRAPPER_KEYS = {"data", "items", "list"};

    abstract Optional<JsonNode> locate(JsonNode body);

    static List<JsonNode> extract(JsonNode body) {
        List<JsonNode> entries = new ArrayList<>();
        if (body == null) {
            return entries;
        }
        for (ProjectListShape shape : values()) {
            Optional<JsonNode> array = shape.locate(body);
            if (array.isPresent()) {
                array.get().forEach(entries::add);
                return entries;
            }
        }
        return entries;
    }

    private static Optional<JsonNode> firstArray(JsonNode node) {
        for (String key : WRAPPER_KEYS) {
            JsonNode candidate = node.path(key);
            if (candidate.isArray()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
