package com.vidnyan.depindex.application.render;

import java.util.Locale;

/**
 * Output formats for query results.
 */
public enum OutputFormat {
    TEXT,           // labeled sections for humans
    STRUCTURED,     // full JSON dump
    DIAGRAM;        // Mermaid graph fragment

    /**
     * Parse a user supplied format name; {@code json} and {@code mermaid} are accepted aliases.
     */
    public static OutputFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "structured", "json" -> STRUCTURED;
            case "diagram", "mermaid" -> DIAGRAM;
            default -> throw new IllegalArgumentException(
                    "Unknown format '" + value + "' (expected text, structured or diagram)");
        };
    }
}
