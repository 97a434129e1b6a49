package com.apimerge.model;

import java.util.Locale;

/**
 * Serialization format of a written document.
 */
public enum OutputFormat {
    JSON,
    YAML;

    /**
     * Picks YAML for {@code .yaml} and {@code .yml} files, JSON otherwise.
     */
    public static OutputFormat fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") ? YAML : JSON;
    }
}
