package com.mimecast.enquiry.config;

import java.util.List;
import java.util.Map;

/**
 * Email upload validation configuration.
 */
public class UploadConfig extends ConfigFoundation {

    /**
     * Constructs a new UploadConfig instance.
     *
     * @param map Configuration map.
     */
    public UploadConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets maximum email file size in megabytes.
     *
     * @return Megabytes.
     */
    public double getMaxEmailSizeMb() {
        return getDoubleProperty("maxEmailSizeMb", 50D);
    }

    /**
     * Gets accepted email file extensions.
     *
     * @return List of String.
     */
    public List<String> getExtensions() {
        return getStringListProperty("extensions", List.of(".msg", ".eml"));
    }
}
