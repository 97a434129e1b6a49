package com.apimerge.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The result of fetching one source's document: either a document or an error message.
 */
public record RetrievalOutcome(Source source, JsonNode document, String error) {

    public static RetrievalOutcome success(Source source, JsonNode document) {
        return new RetrievalOutcome(source, document, null);
    }

    public static RetrievalOutcome failure(Source source, String error) {
        return new RetrievalOutcome(source, null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
