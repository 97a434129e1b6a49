package com.apimerge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/**
 * Minimal structural check applied to a document before it may take part in a merge.
 * This is not OpenAPI validation: references and schema contents are never inspected.
 */
public final class DocumentValidator {

    private DocumentValidator() {
    }

    public static boolean isValid(JsonNode document) {
        return describeProblem(document).isEmpty();
    }

    /**
     * Returns the first structural problem found, or an empty optional for a well-formed document.
     * Required: a top-level object with {@code openapi} or {@code swagger}, an {@code info} object
     * holding {@code title} and {@code version}, and a {@code paths} object (which may be empty).
     */
    public static Optional<String> describeProblem(JsonNode document) {
        if (document == null || !document.isObject()) {
            return Optional.of("document is not an object");
        }
        if (!document.has("openapi") && !document.has("swagger")) {
            return Optional.of("missing 'openapi' or 'swagger' version marker");
        }
        JsonNode info = document.path("info");
        if (!info.isObject()) {
            return Optional.of("missing 'info' object");
        }
        if (!info.has("title") || !info.has("version")) {
            return Optional.of("'info' must contain 'title' and 'version'");
        }
        if (!document.path("paths").isObject()) {
            return Optional.of("missing 'paths' object");
        }
        return Optional.empty();
    }
}
