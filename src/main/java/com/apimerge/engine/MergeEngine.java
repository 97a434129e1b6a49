package com.apimerge.engine;

import com.apimerge.model.DiagnosticType;
import com.apimerge.model.DocumentInfo;
import com.apimerge.model.MergeDiagnostic;
import com.apimerge.model.MergeResult;
import com.apimerge.model.Source;
import com.apimerge.model.SourceDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Folds the documents of several sources into one document.
 * <p>
 * Sources are processed in the given order. For each one the document is copied, its
 * operations get the source's server entry, and in grouped mode its tags are prefixed with the
 * source name. Paths, {@code components.schemas} and every other component kind are then
 * collected into separate name maps using the same rule: the first source to use a key keeps
 * it, later sources get {@code <key>_<sourceName>}. If that suffixed key is already taken too,
 * the later entry replaces the earlier one and a {@link DiagnosticType#KEY_OVERWRITTEN}
 * warning is recorded.
 * <p>
 * The engine does no I/O and never resolves {@code $ref}s.
 */
@Slf4j
public class MergeEngine {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String SCHEMAS = "schemas";

    /**
     * Merges the documents of {@code sources}.
     *
     * @param sources   Sources with their documents, already filtered and validated.
     * @param grouping  Whether to prefix tags with source names and emit a top-level {@code tags} list.
     * @param proxyMode Whether injected servers point at the proxy path instead of the service URL.
     * @return The merged document, or the empty sentinel when {@code sources} is empty.
     */
    public MergeResult merge(List<SourceDocument> sources, boolean grouping, boolean proxyMode) {
        List<MergeDiagnostic> diagnostics = new ArrayList<>();
        if (sources.isEmpty()) {
            log.info("No sources to merge");
            return MergeResult.emptyResult(diagnostics);
        }

        ObjectNode paths = NODES.objectNode();
        ObjectNode schemas = NODES.objectNode();
        Map<String, ObjectNode> otherComponents = new LinkedHashMap<>();
        ArrayNode tags = NODES.arrayNode();

        for (SourceDocument sourceDocument : sources) {
            Source source = sourceDocument.source();
            String name = source.name();
            JsonNode original = sourceDocument.document();

            if (original == null || original.isNull() || original.isMissingNode()) {
                log.warn("Skipping {}: document is empty", name);
                diagnostics.add(new MergeDiagnostic(DiagnosticType.SKIPPED_SOURCE, name, null, "document is empty"));
                continue;
            }
            if (!original.isObject()) {
                log.warn("Skipping {}: document is not an object", name);
                diagnostics.add(new MergeDiagnostic(DiagnosticType.INVALID_DOCUMENT, name, null, "document is not an object"));
                continue;
            }

            log.info("=== {} ===", name);
            ObjectNode document = ((ObjectNode) original).deepCopy();
            ServerInjector.inject(document, source.url(), name, proxyMode);

            if (grouping) {
                TagNamespacer.namespace(document, name);
                JsonNode documentTags = document.path("tags");
                if (documentTags.isArray()) {
                    tags.addAll((ArrayNode) documentTags);
                }
            }

            JsonNode sourcePaths = document.path("paths");
            if (sourcePaths.isObject()) {
                collect(paths, (ObjectNode) sourcePaths, name, "Path", diagnostics);
            }

            JsonNode components = document.path("components");
            if (!components.isObject()) {
                continue;
            }
            Iterator<Map.Entry<String, JsonNode>> kinds = components.fields();
            while (kinds.hasNext()) {
                Map.Entry<String, JsonNode> kind = kinds.next();
                ObjectNode target = SCHEMAS.equals(kind.getKey())
                        ? schemas
                        : otherComponents.computeIfAbsent(kind.getKey(), k -> NODES.objectNode());
                if (kind.getValue().isObject()) {
                    String scope = SCHEMAS.equals(kind.getKey()) ? "Schema" : "Component " + kind.getKey();
                    collect(target, (ObjectNode) kind.getValue(), name, scope, diagnostics);
                }
            }
        }

        ObjectNode merged = NODES.objectNode();
        ObjectNode info = merged.putObject("info");
        info.put("title", DocumentInfo.DEFAULT.title());
        info.put("description", DocumentInfo.DEFAULT.description());
        info.put("version", DocumentInfo.DEFAULT.version());
        merged.set("paths", paths);
        ObjectNode mergedComponents = merged.putObject("components");
        mergedComponents.set(SCHEMAS, schemas);
        otherComponents.forEach(mergedComponents::set);
        if (grouping) {
            merged.set("tags", tags);
        }

        log.info("Merged {} sources: {} paths, {} schemas, {} other component kinds",
                sources.size(), paths.size(), schemas.size(), otherComponents.size());
        return MergeResult.of(merged, diagnostics);
    }

    private void collect(ObjectNode target, ObjectNode entries, String sourceName, String scope,
                         List<MergeDiagnostic> diagnostics) {
        Iterator<Map.Entry<String, JsonNode>> fields = entries.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            String targetKey = target.has(key) ? key + "_" + sourceName : key;
            if (!targetKey.equals(key)) {
                log.info("{} {} conflicts, renaming to {}", scope, key, targetKey);
                diagnostics.add(new MergeDiagnostic(DiagnosticType.KEY_RENAMED, sourceName, key,
                        scope + " renamed to " + targetKey));
            }
            if (target.has(targetKey)) {
                log.warn("{} conflict: {} -> {} already taken, replacing earlier entry", scope, key, targetKey);
                diagnostics.add(new MergeDiagnostic(DiagnosticType.KEY_OVERWRITTEN, sourceName, key,
                        scope + " " + targetKey + " already taken, earlier entry replaced"));
            }
            target.set(targetKey, entry.getValue());
        }
    }
}
