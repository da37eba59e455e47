package com.mimecast.enquiry.validation;

import java.util.Locale;

/**
 * Upload and parse error categories.
 */
public enum ErrorType {
    MISSING_FILE,
    INVALID_EXTENSION,
    VALIDATION,
    NOT_IMPLEMENTED,
    PARSING_ERROR,
    PROCESSING;

    /**
     * Gets the wire name.
     *
     * @return Lower case name.
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
