package com.mimecast.enquiry.attachments;

import com.mimecast.enquiry.config.ParserConfig;
import com.mimecast.enquiry.container.RawAttachment;
import com.mimecast.enquiry.logging.FileOperationsLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Writes image and document attachments to date bucketed storage.
 *
 * <p>Images go through {@link ImageResizer} first and get a <i>.jpg</i> extension when re-encoded.
 * <br>Documents are stored as is. Other types are skipped.
 * <p>A failing attachment is logged and recorded as a failure while the rest carry on.
 */
public class AttachmentExtractor {
    private static final Logger log = LogManager.getLogger(AttachmentExtractor.class);

    /**
     * Extension forced on re-encoded images.
     */
    public static final String JPEG_EXTENSION = ".jpg";

    private final List<String> imageExtensions;
    private final List<String> documentExtensions;
    private final ImageResizer resizer;
    private final StorageLayout layout;
    private final FileOperationsLog fileLog;
    private final Clock clock;

    /**
     * Constructs a new AttachmentExtractor instance.
     *
     * @param config  ParserConfig instance.
     * @param fileLog FileOperationsLog instance.
     * @param clock   Clock for the storage date.
     */
    public AttachmentExtractor(ParserConfig config, FileOperationsLog fileLog, Clock clock) {
        this(config, new ImageResizer(config.getImage()), fileLog, clock);
    }

    /**
     * Constructs a new AttachmentExtractor instance.
     *
     * @param config  ParserConfig instance.
     * @param resizer ImageResizer instance.
     * @param fileLog FileOperationsLog instance.
     * @param clock   Clock for the storage date.
     */
    public AttachmentExtractor(ParserConfig config, ImageResizer resizer, FileOperationsLog fileLog, Clock clock) {
        this.imageExtensions = config.getImage().getExtensions();
        this.documentExtensions = config.getDocumentExtensions();
        this.resizer = resizer;
        this.layout = new StorageLayout(config.getStorage());
        this.fileLog = fileLog;
        this.clock = clock;
    }

    /**
     * Extracts attachments.
     *
     * @param attachments Container attachments in order.
     * @return ExtractionResult instance.
     */
    public ExtractionResult extract(List<RawAttachment> attachments) {
        ExtractionResult result = new ExtractionResult();
        LocalDate date = LocalDate.now(clock);

        for (RawAttachment attachment : attachments) {
            String filename = attachment.getFilename();
            try {
                process(attachment, date).ifPresent(result::addRecord);
            } catch (IOException | RuntimeException e) {
                log.error("Error processing attachment {}: {}", filename, e.getMessage());
                fileLog.logError("EXTRACT_ATTACHMENT", filename, e.getMessage());
                result.addFailure(new AttachmentFailure(filename, e.getMessage()));
            }
        }

        log.info("Extracted {} attachments with {} failures", result.getRecords().size(), result.getFailures().size());
        return result;
    }

    /**
     * Processes one attachment.
     *
     * @param attachment RawAttachment instance.
     * @param date       Storage date.
     * @return Optional of AttachmentRecord, empty if skipped.
     * @throws IOException Unable to write.
     */
    Optional<AttachmentRecord> process(RawAttachment attachment, LocalDate date) throws IOException {
        String filename = attachment.getFilename();
        byte[] data = attachment.getData();
        if (data == null || data.length == 0) {
            log.debug("Skipping empty attachment {}", filename);
            return Optional.empty();
        }

        String extension = extension(filename);
        Optional<AttachmentType> type = classify(extension);
        if (type.isEmpty()) {
            log.debug("Skipping attachment {} of unsupported type", filename);
            return Optional.empty();
        }

        byte[] content = data;
        ResizeResult resized = null;
        if (type.get() == AttachmentType.IMAGE) {
            resized = resizer.resize(data);
            content = resized.getData();
            if (resized.isResized() && !extension.equals(".jpg") && !extension.equals(".jpeg")) {
                extension = JPEG_EXTENSION;
            }
        }

        String savedFilename = layout.newFilename(extension);
        String relativePath = layout.relativePath(type.get(), date, savedFilename);
        Path target = layout.resolve(relativePath);

        Files.createDirectories(target.getParent());
        Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        long fileSize = Files.size(target);

        boolean wasResized = resized != null && resized.isResized();
        if (wasResized) {
            fileLog.logResize(relativePath, resized.getOriginalDimensions(), resized.getNewDimensions());
        }
        log.info("Saved {} {} as {} ({} bytes)", type.get().getName(), filename, relativePath, fileSize);

        boolean image = type.get() == AttachmentType.IMAGE;
        return Optional.of(new AttachmentRecord(filename, savedFilename, relativePath, fileSize,
                layout.url(relativePath), type.get(), image ? wasResized : null, image ? (long) data.length : null));
    }

    /**
     * Classifies by extension.
     *
     * @param extension Lower case extension with dot.
     * @return Optional of AttachmentType, empty if ignored.
     */
    Optional<AttachmentType> classify(String extension) {
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        if (imageExtensions.contains(extension)) {
            return Optional.of(AttachmentType.IMAGE);
        }
        if (documentExtensions.contains(extension)) {
            return Optional.of(AttachmentType.DOCUMENT);
        }

        return Optional.empty();
    }

    /**
     * Gets lower case extension with leading dot.
     *
     * @param filename Filename.
     * @return Extension or empty string.
     */
    static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }

        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
