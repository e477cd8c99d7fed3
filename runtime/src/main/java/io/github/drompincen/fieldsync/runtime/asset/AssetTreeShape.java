package io.github.drompincen.fieldsync.runtime.asset;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Where a project detail payload may carry its asset tree. Tried in declaration order; the first
 * shape that finds a tree wins.
 */
enum AssetTreeShape {

    ROOT_OBJECT {
        @Override
        Optional<JsonNode> locate(JsonNode detail) {
            return objectAt(detail);
        }
    },
    ROOT_ARRAY {
        @Override
        Optional<JsonNode> locate(JsonNode detail) {
            return arrayAt(detail);
        }
    },
    DATA_OBJECT {
        @Override
        Optional<JsonNode> locate(JsonNode detail) {
            return objectAt(detail.path("data"));
        }
    },
    DATA_ARRAY {
        @Override
        Optional<JsonNode> locate(JsonNode detail) {
            return arrayAt(detail.path("data"));
        }
    };

    static final String TREE_FIELD = "project_digital_asset_tree";

    abstract Optional<JsonNode> locate(JsonNode detail);

    private static Optional<JsonNode> objectAt(JsonNode container) {
        JsonNode tree = container.path(TREE_FIELD);
        return tree.isObject() ? Optional.of(tree) : Optional.empty();
    }

    private static Optional<JsonNode> arrayAt(JsonNode container) {
        JsonNode tree = container.path(TREE_FIELD);
        return tree.isArray() ? Optional.of(tree) : Optional.empty();
    }
}
