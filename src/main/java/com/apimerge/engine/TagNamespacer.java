package com.apimerge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Prefixes tag names with the owning service, for grouped merges.
 */
public final class TagNamespacer {

    static final String SEPARATOR = " | ";

    private TagNamespacer() {
    }

    /**
     * Rewrites every document-level tag name and every operation tag to
     * {@code "<service> | <original>"}. Tags that are not strings, and tag objects without a
     * string {@code name}, are left untouched.
     *
     * @param document    The document to modify in place.
     * @param serviceName The prefix to apply.
     */
    public static void namespace(ObjectNode document, String serviceName) {
        JsonNode tags = document.path("tags");
        if (tags.isArray()) {
            for (JsonNode tag : tags) {
                if (tag.isObject() && tag.path("name").isTextual()) {
                    ((ObjectNode) tag).put("name", prefixed(serviceName, tag.get("name").asText()));
                }
            }
        }

        OperationWalker.forEachOperation(document, operation -> {
            JsonNode operationTags = operation.path("tags");
            if (!operationTags.isArray()) {
                return;
            }
            ArrayNode array = (ArrayNode) operationTags;
            for (int i = 0; i < array.size(); i++) {
                if (array.get(i).isTextual()) {
                    array.set(i, prefixed(serviceName, array.get(i).asText()));
                }
            }
        });
    }

    static String prefixed(String serviceName, String tag) {
        return serviceName + SEPARATOR + tag;
    }
}
