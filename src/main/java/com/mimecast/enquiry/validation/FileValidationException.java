package com.mimecast.enquiry.validation;

/**
 * Uploaded file failed a security or sanity check.
 */
public class FileValidationException extends Exception {

    /**
     * Constructs a new FileValidationException instance.
     *
     * @param message Reason shown to the user.
     */
    public FileValidationException(String message) {
        super(message);
    }
}
