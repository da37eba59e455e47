package com.mimecast.enquiry;

import com.mimecast.enquiry.body.BodyMode;
import com.mimecast.enquiry.validation.ErrorType;

import java.util.Optional;

/**
 * Outcome of validating and parsing an uploaded email file.
 */
public class EmailFileResult {

    private final ParsedEmail email;
    private final BodyMode mode;
    private final String error;
    private final ErrorType errorType;

    private EmailFileResult(ParsedEmail email, BodyMode mode, String error, ErrorType errorType) {
        this.email = email;
        this.mode = mode;
        this.error = error;
        this.errorType = errorType;
    }

    /**
     * Successful result.
     *
     * @param email ParsedEmail instance.
     * @param mode  Body mode used.
     * @return EmailFileResult instance.
     */
    public static EmailFileResult success(ParsedEmail email, BodyMode mode) {
        return new EmailFileResult(email, mode, null, null);
    }

    /**
     * Failed result.
     *
     * @param error     Error message.
     * @param errorType ErrorType.
     * @return EmailFileResult instance.
     */
    public static EmailFileResult error(String error, ErrorType errorType) {
        return new EmailFileResult(null, null, error, errorType);
    }

    public boolean isSuccess() {
        return email != null;
    }

    public Optional<ParsedEmail> getEmail() {
        return Optional.ofNullable(email);
    }

    public BodyMode getMode() {
        return mode;
    }

    public String getError() {
        return error;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
