package com.mimecast.enquiry.config;

import java.io.IOException;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Parser configuration.
 *
 * <p>This class provides type safe access to the parser configuration.
 * <p>It also maps storage, image and upload sections to corresponding objects.
 *
 * @see StorageConfig
 * @see ImageConfig
 * @see UploadConfig
 */
public class ParserConfig extends ConfigFoundation {

    /**
     * Constructs a new ParserConfig instance with defaults.
     */
    public ParserConfig() {
        super();
    }

    /**
     * Constructs a new ParserConfig instance.
     *
     * @param map Configuration map.
     */
    public ParserConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ParserConfig instance from file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ParserConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets the monitored inbox address used for direction detection.
     *
     * @return Email address.
     */
    public String getInboxAddress() {
        return getStringProperty("inboxAddress", "memberenquiries@redcar-cleveland.gov.uk");
    }

    /**
     * Gets the timezone naive container timestamps are assumed to be in.
     *
     * @return ZoneId.
     */
    public ZoneId getLocalTimezone() {
        return ZoneId.of(getStringProperty("localTimezone", "Europe/London"));
    }

    /**
     * Gets the timezone used for the display date string.
     *
     * @return ZoneId.
     */
    public ZoneId getDisplayTimezone() {
        return ZoneId.of(getStringProperty("displayTimezone", "Europe/London"));
    }

    /**
     * Gets document extensions.
     *
     * @return List of String.
     */
    public List<String> getDocumentExtensions() {
        return getStringListProperty("documentExtensions", List.of(".pdf", ".doc", ".docx"));
    }

    /**
     * Gets storage config.
     *
     * @return StorageConfig instance.
     */
    public StorageConfig getStorage() {
        return new StorageConfig(getMapProperty("storage"));
    }

    /**
     * Gets image config.
     *
     * @return ImageConfig instance.
     */
    public ImageConfig getImage() {
        return new ImageConfig(getMapProperty("image"));
    }

    /**
     * Gets upload config.
     *
     * @return UploadConfig instance.
     */
    public UploadConfig getUpload() {
        return new UploadConfig(getMapProperty("upload"));
    }
}
