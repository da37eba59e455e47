package com.mimecast.enquiry.config;

import java.util.Map;

/**
 * Attachment storage configuration.
 *
 * <p>This class provides type safe access to the storage root, public URL prefix and category directories.
 */
public class StorageConfig extends ConfigFoundation {

    /**
     * Constructs a new StorageConfig instance.
     *
     * @param map Configuration map.
     */
    public StorageConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets storage root path.
     *
     * @return Path string.
     */
    public String getRoot() {
        return getStringProperty("root", "media");
    }

    /**
     * Gets URL prefix prepended to relative file paths.
     *
     * @return URL prefix.
     */
    public String getUrlPrefix() {
        return getStringProperty("urlPrefix", "/media/");
    }

    /**
     * Gets image category directory relative to root.
     *
     * @return Directory.
     */
    public String getImageDir() {
        return getStringProperty("imageDir", "enquiry_photos");
    }

    /**
     * Gets document category directory relative to root.
     *
     * @return Directory.
     */
    public String getDocumentDir() {
        return getStringProperty("documentDir", "enquiry_attachments/documents");
    }
}
