package com.apimerge.model;

/**
 * Kinds of non-fatal events reported alongside a merge result.
 */
public enum DiagnosticType {
    /** The source's document could not be fetched or decoded. */
    RETRIEVAL_FAILED,
    /** The document failed structural validation and was left out. */
    INVALID_DOCUMENT,
    /** The source had no document and was skipped. */
    SKIPPED_SOURCE,
    /** A key was already taken and the source's entry was stored under a suffixed key. */
    KEY_RENAMED,
    /** The suffixed key was taken as well; the earlier entry was replaced. */
    KEY_OVERWRITTEN
}
