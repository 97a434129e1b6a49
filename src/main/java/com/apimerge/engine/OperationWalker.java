package com.apimerge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.function.Consumer;

/**
 * Visits every operation object under {@code paths.*.*}. Entries that are not objects at
 * either level are skipped.
 */
final class OperationWalker {

    private OperationWalker() {
    }

    static void forEachOperation(JsonNode document, Consumer<ObjectNode> visitor) {
        JsonNode paths = document.path("paths");
        if (!paths.isObject()) {
            return;
        }
        for (JsonNode pathItem : paths) {
            if (!pathItem.isObject()) {
                continue;
            }
            Iterator<JsonNode> operations = pathItem.elements();
            while (operations.hasNext()) {
                JsonNode operation = operations.next();
                if (operation.isObject()) {
                    visitor.accept((ObjectNode) operation);
                }
            }
        }
    }
}
