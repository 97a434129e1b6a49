package com.apimerge.engine;

import com.apimerge.exception.ApiMergeException;
import com.apimerge.model.OutputFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts document text to and from {@link JsonNode} trees.
 * <p>
 * Decoding follows the content type when it is specific: {@code yaml}/{@code yml} types are
 * read as YAML only. OpenAPI types ({@code vnd.oai.openapi}), JSON types and anything unknown
 * are read as JSON first, then as YAML if that fails.
 */
@Slf4j
public class DocumentCodec {

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    private final ObjectMapper yamlMapper = new YAMLMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));

    /**
     * Decodes {@code payload} into a tree.
     *
     * @param payload     The document text.
     * @param contentType The content type hint, may be {@code null}.
     * @return The decoded tree. A blank payload decodes to a missing node.
     * @throws ApiMergeException if the payload cannot be parsed.
     */
    public JsonNode decode(String payload, String contentType) {
        if (payload == null) {
            throw new ApiMergeException("Cannot decode document: payload is null");
        }
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        try {
            if (!type.contains("vnd.oai.openapi") && !type.contains("json")
                    && (type.contains("yaml") || type.contains("yml"))) {
                return yamlMapper.readTree(payload);
            }
            try {
                return jsonMapper.readTree(payload);
            } catch (JsonProcessingException jsonError) {
                log.debug("Payload is not JSON ({}), trying YAML", jsonError.getOriginalMessage());
                return yamlMapper.readTree(payload);
            }
        } catch (JsonProcessingException e) {
            throw new ApiMergeException("Cannot decode document: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes {@code document} in the given format, pretty-printed for JSON.
     *
     * @throws ApiMergeException if serialization fails.
     */
    public String encode(JsonNode document, OutputFormat format) {
        try {
            return format == OutputFormat.YAML
                    ? yamlMapper.writeValueAsString(document)
                    : jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ApiMergeException("Failed to serialize document as " + format, e);
        }
    }
}
