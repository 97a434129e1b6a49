package com.apimerge.engine;

import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.DocumentInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Writes the final {@code info} block and format version into a merged document.
 */
public final class MetadataUpdater {

    public static final String OPENAPI_VERSION = "3.0.3";
    private static final Set<String> REPLACED_KEYS = Set.of("openapi", "swagger", "info");

    private MetadataUpdater() {
    }

    /**
     * Returns a copy of {@code document} with {@code openapi} set to {@value #OPENAPI_VERSION},
     * any {@code swagger} marker removed, and {@code info.title}, {@code info.description} and
     * {@code info.version} replaced by the given values. Other {@code info} fields are kept.
     * The input is not modified.
     *
     * @throws ApiMergeException if {@code document} is not an object.
     */
    public static ObjectNode apply(JsonNode document, DocumentInfo info) {
        if (document == null || !document.isObject()) {
            throw new ApiMergeException("Cannot update metadata: document is not an object");
        }
        ObjectNode updated = JsonNodeFactory.instance.objectNode();
        updated.put("openapi", OPENAPI_VERSION);

        ObjectNode infoNode = document.path("info").isObject()
                ? ((ObjectNode) document.get("info")).deepCopy()
                : JsonNodeFactory.instance.objectNode();
        infoNode.put("title", info.title());
        infoNode.put("description", info.description());
        infoNode.put("version", info.version());
        updated.set("info", infoNode);

        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!REPLACED_KEYS.contains(field.getKey())) {
                updated.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return updated;
    }
}
