package com.mimecast.enquiry.attachments;

import java.util.Locale;

/**
 * Attachment categories kept by the extractor.
 */
public enum AttachmentType {
    IMAGE,
    DOCUMENT;

    /**
     * Gets the stored type name.
     *
     * @return Lower case name.
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
