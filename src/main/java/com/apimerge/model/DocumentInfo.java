package com.apimerge.model;

/**
 * Values written into the merged document's {@code info} block.
 */
public record DocumentInfo(String title, String description, String version) {

    public static final DocumentInfo DEFAULT = new DocumentInfo("Merged API", "", "1.0.0");
}
