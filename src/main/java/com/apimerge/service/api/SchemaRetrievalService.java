package com.apimerge.service.api;

import com.apimerge.model.RetrievalOutcome;
import com.apimerge.model.Source;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Fetches and decodes the OpenAPI documents of configured services.
 */
public interface SchemaRetrievalService {

    /**
     * Fetches a single document and decodes it from JSON or YAML.
     *
     * @param location An {@code http(s)://} URL or a local file path.
     * @return The decoded document.
     * @throws com.apimerge.exception.ApiMergeException if the document cannot be read or decoded,
     *                                                   or is empty.
     */
    JsonNode fetch(String location);

    /**
     * Fetches the documents of all given sources concurrently. A failure or timeout for one
     * source is recorded in its outcome and does not affect the others.
     *
     * @param sources The sources to fetch, in merge order.
     * @return One outcome per source, in the same order as {@code sources}.
     */
    List<RetrievalOutcome> fetchAll(List<Source> sources);
}
