package com.mimecast.enquiry.validation;

/**
 * Email file validation outcome.
 */
public class ValidationResult {

    private final boolean success;
    private final String error;
    private final ErrorType errorType;
    private final String extension;
    private final long size;

    private ValidationResult(boolean success, String error, ErrorType errorType, String extension, long size) {
        this.success = success;
        this.error = error;
        this.errorType = errorType;
        this.extension = extension;
        this.size = size;
    }

    /**
     * Valid file.
     *
     * @param extension Lower case extension with dot.
     * @param size      Size in bytes.
     * @return ValidationResult instance.
     */
    public static ValidationResult valid(String extension, long size) {
        return new ValidationResult(true, null, null, extension, size);
    }

    /**
     * Invalid file.
     *
     * @param error     Error message.
     * @param errorType ErrorType.
     * @return ValidationResult instance.
     */
    public static ValidationResult invalid(String error, ErrorType errorType) {
        return new ValidationResult(false, error, errorType, null, 0L);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getExtension() {
        return extension;
    }

    public long getSize() {
        return size;
    }
}
