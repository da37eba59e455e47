package com.mimecast.enquiry.body;

import java.util.Locale;

/**
 * Body presentation mode.
 */
public enum BodyMode {

    /**
     * Short truncated plain text preview.
     */
    SNIPPET,

    /**
     * Full plain text with rebuilt paragraphs.
     */
    PLAIN,

    /**
     * Display HTML.
     */
    FULL;

    /**
     * Gets mode by name, case-insensitive.
     * <p>Unknown or missing names fall back to the given default.
     *
     * @param name         Mode name.
     * @param defaultValue Default mode.
     * @return BodyMode.
     */
    public static BodyMode fromName(String name, BodyMode defaultValue) {
        if (name == null) {
            return defaultValue;
        }

        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
