package com.mimecast.enquiry.config;

import java.util.List;
import java.util.Map;

/**
 * Image attachment configuration.
 *
 * <p>Resize thresholds and the extensions treated as images.
 */
public class ImageConfig extends ConfigFoundation {

    /**
     * Default image extensions.
     */
    public static final List<String> DEFAULT_EXTENSIONS = List.of(
            ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp", ".tiff", ".tif");

    /**
     * Constructs a new ImageConfig instance.
     *
     * @param map Configuration map.
     */
    public ImageConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets size in megabytes above which images get resized.
     *
     * @return Megabytes.
     */
    public double getMaxSizeMb() {
        return getDoubleProperty("maxSizeMb", 2D);
    }

    /**
     * Gets size in bytes above which images get resized.
     *
     * @return Bytes.
     */
    public long getMaxSizeBytes() {
        return (long) (getMaxSizeMb() * 1024 * 1024);
    }

    /**
     * Gets maximum width or height in pixels.
     *
     * @return Pixels.
     */
    public int getMaxDimension() {
        return Math.toIntExact(getLongProperty("maxDimension", 2048L));
    }

    /**
     * Gets JPEG quality (1-100).
     *
     * @return Quality.
     */
    public int getQuality() {
        return Math.toIntExact(getLongProperty("quality", 85L));
    }

    /**
     * Gets image extensions, lower case with leading dot.
     *
     * @return List of String.
     */
    public List<String> getExtensions() {
        return getStringListProperty("extensions", DEFAULT_EXTENSIONS);
    }
}
