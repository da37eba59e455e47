package com.mimecast.enquiry.container;

/**
 * Attachment as stored in the container.
 */
public class RawAttachment {

    /**
     * Long filename.
     */
    private final String longFilename;

    /**
     * Short 8.3 filename.
     */
    private final String shortFilename;

    /**
     * Content bytes.
     */
    private final byte[] data;

    /**
     * Constructs a new RawAttachment instance.
     *
     * @param longFilename  Long filename, may be null.
     * @param shortFilename Short filename, may be null.
     * @param data          Content bytes, may be null.
     */
    public RawAttachment(String longFilename, String shortFilename, byte[] data) {
        this.longFilename = longFilename;
        this.shortFilename = shortFilename;
        this.data = data;
    }

    public String getLongFilename() {
        return longFilename;
    }

    public String getShortFilename() {
        return shortFilename;
    }

    /**
     * Gets best filename.
     * <p>Prefers the long form and falls back to the short form, then to <i>unknown</i>.
     *
     * @return Filename.
     */
    public String getFilename() {
        if (longFilename != null && !longFilename.isBlank()) {
            return longFilename;
        }
        if (shortFilename != null && !shortFilename.isBlank()) {
            return shortFilename;
        }

        return "unknown";
    }

    /**
     * Gets content bytes.
     *
     * @return Byte array or null.
     */
    public byte[] getData() {
        return data;
    }
}
