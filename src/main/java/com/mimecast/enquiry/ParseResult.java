package com.mimecast.enquiry;

import java.util.Optional;

/**
 * Parse outcome holding either a complete {@link ParsedEmail} or an error message, never both.
 */
public class ParseResult {

    private final ParsedEmail email;
    private final String error;

    private ParseResult(ParsedEmail email, String error) {
        this.email = email;
        this.error = error;
    }

    /**
     * Successful result.
     *
     * @param email ParsedEmail instance.
     * @return ParseResult instance.
     */
    public static ParseResult success(ParsedEmail email) {
        return new ParseResult(email, null);
    }

    /**
     * Failed result.
     *
     * @param error Error message.
     * @return ParseResult instance.
     */
    public static ParseResult error(String error) {
        return new ParseResult(null, error);
    }

    public boolean isSuccess() {
        return email != null;
    }

    public Optional<ParsedEmail> getEmail() {
        return Optional.ofNullable(email);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
}
