package com.apimerge.engine;

import com.apimerge.model.Source;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns arbitrary service names into tokens that are safe inside a URL path segment.
 */
public final class NameSanitizer {

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final Pattern UNDERSCORE_RUNS = Pattern.compile("_+");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private NameSanitizer() {
    }

    /**
     * Replaces every character outside {@code [a-zA-Z0-9_-]} with {@code _}, collapses runs of
     * {@code _}, trims them from both ends and lower-cases the result.
     * <p>
     * {@code "My Service! 2.0"} becomes {@code "my_service_2_0"}. An input with no safe
     * characters yields an empty string.
     *
     * @param name The name to sanitize; {@code null} is treated as empty.
     * @return The sanitized token, possibly empty.
     */
    public static String safeName(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }
        String replaced = UNSAFE_CHARS.matcher(name).replaceAll("_");
        String collapsed = UNDERSCORE_RUNS.matcher(replaced).replaceAll("_");
        return EDGE_UNDERSCORES.matcher(collapsed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    /**
     * Like {@link #safeName(String)}, but returns a generated identifier when nothing safe is left.
     */
    public static String safeNameOrGenerated(String name) {
        String safe = safeName(name);
        return safe.isEmpty() ? Source.generateName() : safe;
    }
}
