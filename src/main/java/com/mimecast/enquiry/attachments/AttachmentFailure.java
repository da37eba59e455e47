package com.mimecast.enquiry.attachments;

/**
 * Attachment skipped because of an error.
 */
public class AttachmentFailure {

    private final String filename;
    private final String error;

    /**
     * Constructs a new AttachmentFailure instance.
     *
     * @param filename Attachment filename.
     * @param error    Error message.
     */
    public AttachmentFailure(String filename, String error) {
        this.filename = filename;
        this.error = error;
    }

    public String getFilename() {
        return filename;
    }

    public String getError() {
        return error;
    }
}
