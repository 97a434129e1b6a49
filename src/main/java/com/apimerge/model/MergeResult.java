package com.apimerge.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * The merged document together with the diagnostics collected while building it.
 * <p>
 * A result built from zero sources is the empty sentinel: its document has no keys at all
 * and {@link #empty()} is {@code true}. Callers must check for it instead of treating it as
 * a document with empty {@code paths}.
 *
 * @param document    The merged document.
 * @param diagnostics Non-fatal events in the order they occurred.
 * @param empty       Whether this is the empty sentinel.
 */
public record MergeResult(ObjectNode document, List<MergeDiagnostic> diagnostics, boolean empty) {

    public MergeResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public static MergeResult of(ObjectNode document, List<MergeDiagnostic> diagnostics) {
        return new MergeResult(document, diagnostics, false);
    }

    public static MergeResult emptyResult(List<MergeDiagnostic> diagnostics) {
        return new MergeResult(JsonNodeFactory.instance.objectNode(), diagnostics, true);
    }

    public MergeResult withDocument(ObjectNode replacement) {
        return new MergeResult(replacement, diagnostics, empty);
    }

    public MergeResult withDiagnostics(List<MergeDiagnostic> leading) {
        List<MergeDiagnostic> combined = new ArrayList<>(leading);
        combined.addAll(diagnostics);
        return new MergeResult(document, combined, empty);
    }
}
