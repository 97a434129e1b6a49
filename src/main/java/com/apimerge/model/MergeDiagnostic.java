package com.apimerge.model;

/**
 * A structured report of something the merge absorbed instead of failing on.
 *
 * @param type       What happened.
 * @param sourceName The source the event belongs to.
 * @param key        The affected key (path, component name), or {@code null} for source-level events.
 * @param message    Human-readable detail.
 */
public record MergeDiagnostic(DiagnosticType type, String sourceName, String key, String message) {

    public boolean isWarning() {
        return type != DiagnosticType.KEY_RENAMED;
    }

    @Override
    public String toString() {
        return "[" + type + "] " + sourceName + (key != null ? " " + key : "") + ": " + message;
    }
}
