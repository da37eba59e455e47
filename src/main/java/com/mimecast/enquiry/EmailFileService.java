package com.mimecast.enquiry;

import com.mimecast.enquiry.body.BodyMode;
import com.mimecast.enquiry.validation.EmailFileValidator;
import com.mimecast.enquiry.validation.ErrorType;
import com.mimecast.enquiry.validation.ValidationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Uploaded email file handling.
 *
 * <p>Validates the file then parses it with the requested mode.
 * <br>Only <i>.msg</i> is parsed. <i>.eml</i> passes validation but is reported as not implemented.
 */
public class EmailFileService {
    private static final Logger log = LogManager.getLogger(EmailFileService.class);

    /**
     * Error for files that pass validation but have no parser.
     */
    public static final String EML_NOT_IMPLEMENTED = "EML file parsing not yet implemented. Please use .msg files.";

    private final EmailFileValidator validator;
    private final MsgParser parser;

    /**
     * Constructs a new EmailFileService instance.
     *
     * @param validator EmailFileValidator instance.
     * @param parser    MsgParser instance.
     */
    public EmailFileService(EmailFileValidator validator, MsgParser parser) {
        this.validator = validator;
        this.parser = parser;
    }

    /**
     * Validates file.
     *
     * @param path File path.
     * @return ValidationResult instance.
     */
    public ValidationResult validate(Path path) {
        return validator.validate(path);
    }

    /**
     * Validates and parses file.
     * <p>Unknown mode names fall back to snippet.
     *
     * @param path            File path.
     * @param modeName        Body mode name.
     * @param skipAttachments Skip attachment extraction.
     * @return EmailFileResult instance.
     */
    public EmailFileResult parse(Path path, String modeName, boolean skipAttachments) {
        ValidationResult validation = validate(path);
        if (!validation.isSuccess()) {
            return EmailFileResult.error(validation.getError(), validation.getErrorType());
        }

        BodyMode mode = BodyMode.fromName(modeName, BodyMode.SNIPPET);
        if (!".msg".equals(validation.getExtension())) {
            if (".eml".equals(validation.getExtension())) {
                return EmailFileResult.error(EML_NOT_IMPLEMENTED, ErrorType.NOT_IMPLEMENTED);
            }
            return EmailFileResult.error("Unsupported file type", ErrorType.INVALID_EXTENSION);
        }

        try {
            ParseResult result = parser.parse(path, mode, skipAttachments);
            if (result.getError().isPresent()) {
                return EmailFileResult.error("Error parsing email: " + result.getError().get(), ErrorType.PARSING_ERROR);
            }

            return EmailFileResult.success(result.getEmail().orElseThrow(), mode);
        } catch (RuntimeException e) {
            log.error("Error processing email file {}: {}", path, e.getMessage(), e);
            return EmailFileResult.error("Error processing email file: " + e.getMessage(), ErrorType.PROCESSING);
        }
    }
}
