package io.github.drompincen.fieldsync.runtime.asset;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.fieldsync.protocol.api.AssetKind;
import io.github.drompincen.fieldsync.runtime.remote.JsonFields;
import io.github.drompincen.fieldsync.runtime.support.Digests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Flattens a project's digital-asset tree into {@link ParsedAssetNode}s.
 *
 * <p>Any object carrying a {@code file_id} is a file. Objects typed {@code Folder}, or holding
 * child collections, become folder placeholders when they have an id or a name. Paths are
 * {@code root/children[0]/items[2]} style and seed the ids of folders the server left unnamed,
 * so the same tree always yields the same ids.
 */
@Component
public class AssetTreeParser {

    private static final Logger log = LoggerFactory.getLogger(AssetTreeParser.class);

    static final List<String> CHILD_FIELDS = List.of("children", "items", "nodes", "files", "assets", "content");
    private static final Set<String> SCALAR_FIELDS = Set.of("file_id", "name", "title", "file_size", "size", "type");
    private static final String ROOT_PATH = "root";

    public List<ParsedAssetNode> parse(JsonNode detail) {
        if (detail == null || detail.isMissingNode() || detail.isNull()) {
            return List.of();
        }
        JsonNode body = detail.isArray() ? detail.path(0) : detail;

        Optional<JsonNode> tree = Optional.empty();
        for (AssetTreeShape shape : AssetTreeShape.values()) {
            tree = shape.locate(body);
            if (tree.isPresent()) {
                log.debug("Asset tree located with shape {}", shape);
                break;
            }
        }
        if (tree.isEmpty()) {
            log.debug("No {} in project detail", AssetTreeShape.TREE_FIELD);
            return List.of();
        }

        Map<String, ParsedAssetNode> nodes = new LinkedHashMap<>();
        JsonNode root = tree.get();
        if (root.isArray()) {
            visitArray(root, ROOT_PATH + "/children", null, nodes);
        } else {
            visit(root, ROOT_PATH, null, nodes);
        }
        return new ArrayList<>(nodes.values());
    }

    private void visit(JsonNode node, String path, String inheritedParentId, Map<String, ParsedAssetNode> nodes) {
        if (node.isArray()) {
            visitArray(node, path, inheritedParentId, nodes);
            return;
        }
        if (!node.isObject()) {
            return;
        }

        ParsedAssetNode parsed = toNode(node, path, inheritedParentId);
        String childParentId = inheritedParentId;
        if (parsed != null) {
            nodes.putIfAbsent(parsed.nodeId(), parsed);
            childParentId = parsed.nodeId();
        }

        for (String field : CHILD_FIELDS) {
            JsonNode child = node.get(field);
            if (child == null) {
                continue;
            }
            if (child.isArray()) {
                visitArray(child, path + "/" + field, childParentId, nodes);
            } else if (child.isObject()) {
                visit(child, path + "/" + field, childParentId, nodes);
            }
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (CHILD_FIELDS.contains(key) || SCALAR_FIELDS.contains(key)) {
                continue;
            }
            JsonNode value = field.getValue();
            if (value.isArray()) {
                visitArray(value, path + "/" + key, childParentId, nodes);
            } else if (value.isObject()) {
                visit(value, path + "/" + key, childParentId, nodes);
            }
        }
    }

    private void visitArray(JsonNode array, String path, String parentId, Map<String, ParsedAssetNode> nodes) {
        for (int i = 0; i < array.size(); i++) {
            visit(array.get(i), path + "[" + i + "]", parentId, nodes);
        }
    }

    private ParsedAssetNode toNode(JsonNode node, String path, String inheritedParentId) {
        boolean folderTyped = "Folder".equalsIgnoreCase(JsonFields.text(node, "tree_node_type"));
        String remoteId = JsonFields.text(node, "file_id");
        if ("null".equals(remoteId)) {
            remoteId = null;
        }
        String explicitId = JsonFields.text(node, "id");
        if ("null".equals(explicitId)) {
            explicitId = null;
        }
        String parentId = Optional.ofNullable(JsonFields.text(node, "p_id"))
                .filter(id -> !"null".equals(id))
                .orElse(inheritedParentId);
        String name = JsonFields.text(node, "node_name", "name", "title");

        if (remoteId != null && !folderTyped) {
            return new ParsedAssetNode(
                    explicitId != null ? explicitId : remoteId,
                    parentId,
                    name,
                    AssetKind.FILE,
                    remoteId,
                    positiveSize(node),
                    fileType(node),
                    path);
        }

        if ((folderTyped || hasChildren(node)) && (explicitId != null || name != null)) {
            String nodeId = explicitId != null ? explicitId : folderId(path);
            return new ParsedAssetNode(nodeId, parentId, name, AssetKind.FOLDER, null, null, null, path);
        }
        return null;
    }

    static String folderId(String path) {
        return "folder_" + Digests.sha256Hex(path).substring(0, 16);
    }

    private static boolean hasChildren(JsonNode node) {
        for (String field : CHILD_FIELDS) {
            JsonNode child = node.get(field);
            if (child != null && (child.isArray() || child.isObject())) {
                return true;
            }
        }
        return false;
    }

    private static Long positiveSize(JsonNode node) {
        for (String field : List.of("file_size", "size")) {
            Long size = JsonFields.number(node, field);
            if (size != null && size > 0) {
                return size;
            }
        }
        return null;
    }

    private static String fileType(JsonNode node) {
        String type = JsonFields.text(node, "file_type", "type", "extension", "format", "mime_type");
        if (type != null) {
            return type.toLowerCase(Locale.ROOT);
        }
        String fileName = JsonFields.text(node, "name", "title", "file_name");
        if (fileName != null) {
            int dot = fileName.lastIndexOf('.');
            if (dot > 0 && dot < fileName.length() - 1) {
                return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }
}
