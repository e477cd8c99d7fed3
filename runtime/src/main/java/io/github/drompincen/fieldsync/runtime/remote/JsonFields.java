package io.github.drompincen.fieldsync.runtime.remote;

import com.fasterxml.jackson.databind.JsonNode;

/** Lookups over the loosely typed field server payloads, where one value may appear under several keys. */
public final class JsonFields {

    private JsonFields() {
    }

    public static String text(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = value.asText();
                if (!text.isBlank()) {
                    return text;
                }
            }
        }
        return null;
    }

    public static Long number(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isNumber()) {
                return value.asLong();
            }
            if (value.isTextual()) {
                try {
                    return Long.parseLong(value.asText().trim());
                } catch (NumberFormatException ignored) {
                    // try the next alias
                }
            }
        }
        return null;
    }

    public static int intOrZero(JsonNode node, String... names) {
        Long value = number(node, names);
        return value == null ? 0 : value.intValue();
    }
}
