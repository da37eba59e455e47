package com.mimecast.enquiry.validation;

import com.mimecast.enquiry.config.UploadConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Uploaded email file checks.
 *
 * <p>Rejects missing files, unsupported or dangerous extensions, bad filenames, empty and oversize files.
 * <br>Content without a known email signature is only logged.
 */
public class EmailFileValidator {
    private static final Logger log = LogManager.getLogger(EmailFileValidator.class);

    /**
     * Compound document signature used by <i>.msg</i> files.
     */
    static final byte[] OLE2_SIGNATURE = {
            (byte) 0xD0, (byte) 0xCF, (byte) 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, (byte) 0x1A, (byte) 0xE1
    };

    /**
     * Header markers found near the start of <i>.eml</i> files.
     */
    static final List<String> EML_MARKERS = List.of("received:", "from:", "to:", "subject:", "date:", "message-id:");

    /**
     * Executable or script extensions never accepted.
     */
    static final Set<String> DANGEROUS_EXTENSIONS = Set.of(
            ".exe", ".bat", ".cmd", ".com", ".scr", ".pif", ".vbs", ".js",
            ".jar", ".php", ".asp", ".aspx", ".jsp", ".sh", ".py", ".pl");

    private static final int MAX_FILENAME_LENGTH = 255;
    private static final int HEADER_LENGTH = 1024;

    private final List<String> extensions;
    private final long maxSize;
    private final double maxSizeMb;

    /**
     * Constructs a new EmailFileValidator instance.
     *
     * @param config UploadConfig instance.
     */
    public EmailFileValidator(UploadConfig config) {
        this.extensions = config.getExtensions();
        this.maxSizeMb = config.getMaxEmailSizeMb();
        this.maxSize = (long) (maxSizeMb * 1024 * 1024);
    }

    /**
     * Validates file.
     *
     * @param path File path, may be null.
     * @return ValidationResult instance.
     */
    public ValidationResult validate(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return ValidationResult.invalid("No file provided", ErrorType.MISSING_FILE);
        }

        String filename = path.getFileName().toString();
        String extension = extension(filename);
        if (!extensions.contains(extension)) {
            return ValidationResult.invalid("Unsupported file type. Please upload " + String.join(", ", extensions) + " files only.",
                    ErrorType.INVALID_EXTENSION);
        }

        try {
            validateFilename(filename);
            long size = Files.size(path);
            validateSize(size);
            checkContent(path, filename);

            return ValidationResult.valid(extension, size);
        } catch (FileValidationException e) {
            log.warn("Email file validation failed for {}: {}", filename, e.getMessage());
            return ValidationResult.invalid(e.getMessage(), ErrorType.VALIDATION);
        } catch (IOException e) {
            log.error("Unexpected error validating email file {}: {}", filename, e.getMessage());
            return ValidationResult.invalid("File validation failed: " + e.getMessage(), ErrorType.PROCESSING);
        }
    }

    /**
     * Validates filename.
     *
     * @param filename Base filename.
     * @throws FileValidationException Filename rejected.
     */
    void validateFilename(String filename) throws FileValidationException {
        if (filename.isEmpty()) {
            throw new FileValidationException("Filename cannot be empty");
        }
        for (String part : filename.split("[/\\\\]")) {
            if (part.equals("..")) {
                throw new FileValidationException("Invalid characters in filename: contains path traversal '..'");
            }
        }
        if (filename.indexOf('\0') >= 0) {
            throw new FileValidationException("Null bytes not allowed in filename");
        }
        if (filename.length() > MAX_FILENAME_LENGTH) {
            throw new FileValidationException("Filename too long");
        }

        String extension = extension(filename);
        if (extension.isEmpty()) {
            throw new FileValidationException("File must have an extension");
        }
        if (DANGEROUS_EXTENSIONS.contains(extension)) {
            throw new FileValidationException("File type not allowed: " + extension);
        }
    }

    /**
     * Validates size.
     *
     * @param size Size in bytes.
     * @throws FileValidationException Size rejected.
     */
    void validateSize(long size) throws FileValidationException {
        if (size <= 0) {
            throw new FileValidationException("File appears to be empty");
        }
        if (size > maxSize) {
            throw new FileValidationException(String.format(Locale.ROOT,
                    "File too large. Maximum size for email files is %.1fMB", maxSizeMb));
        }
    }

    /**
     * Looks for a known email signature, logging when none is found.
     *
     * @param path     File path.
     * @param filename Base filename.
     * @throws IOException Unable to read.
     */
    void checkContent(Path path, String filename) throws IOException {
        byte[] header;
        try (InputStream stream = Files.newInputStream(path)) {
            header = stream.readNBytes(HEADER_LENGTH);
        }

        if (header.length >= OLE2_SIGNATURE.length
                && Arrays.equals(Arrays.copyOf(header, OLE2_SIGNATURE.length), OLE2_SIGNATURE)) {
            log.debug("Compound document signature detected in {}", filename);
            return;
        }

        String text = new String(header, StandardCharsets.ISO_8859_1).toLowerCase(Locale.ROOT);
        for (String marker : EML_MARKERS) {
            if (text.contains(marker)) {
                log.debug("Message header markers detected in {}", filename);
                return;
            }
        }

        log.warn("Email file validation: could not identify valid email signatures in {}", filename);
    }

    /**
     * Gets lower case extension with dot.
     *
     * @param filename Filename.
     * @return Extension or empty string.
     */
    static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
