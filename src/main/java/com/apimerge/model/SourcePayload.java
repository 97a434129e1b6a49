package com.apimerge.model;

/**
 * A source paired with the raw text of its document, before decoding.
 *
 * @param source      The contributing source.
 * @param payload     Document text in JSON or YAML.
 * @param contentType Content type hint for decoding, may be {@code null}.
 */
public record SourcePayload(Source source, String payload, String contentType) {
}
