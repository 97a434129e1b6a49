package com.apimerge.model;

import java.util.UUID;

/**
 * One upstream service contributing a document to a merge.
 * <p>
 * The {@code name} doubles as the disambiguation suffix for colliding keys and as the
 * tag prefix in grouped mode, so it is never blank: {@link #of} substitutes a generated
 * name when none is configured.
 *
 * @param name           Service name, used as collision suffix and tag prefix.
 * @param url            Origin base URL of the service, injected as an operation server.
 * @param schemaLocation URL or file path the service's document is fetched from.
 * @param enabled        Whether the source takes part in a merge.
 */
public record Source(String name, String url, String schemaLocation, boolean enabled) {

    public static final String DEFAULT_URL = "http://localhost";
    private static final int GENERATED_NAME_LENGTH = 10;

    /**
     * Creates a source, filling in a generated name and the default URL where missing.
     */
    public static Source of(String name, String url, String schemaLocation, boolean enabled) {
        String resolvedName = name == null || name.isBlank() ? generateName() : name;
        String resolvedUrl = url == null || url.isBlank() ? DEFAULT_URL : url;
        return new Source(resolvedName, resolvedUrl, schemaLocation, enabled);
    }

    /**
     * Returns the first ten characters of a random UUID.
     */
    public static String generateName() {
        return UUID.randomUUID().toString().substring(0, GENERATED_NAME_LENGTH);
    }
}
