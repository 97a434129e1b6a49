package com.apimerge.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A source paired with its decoded document. The document is {@code null} when nothing
 * could be obtained for the source.
 */
public record SourceDocument(Source source, JsonNode document) {
}
