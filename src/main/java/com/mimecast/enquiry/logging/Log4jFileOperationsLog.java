package com.mimecast.enquiry.logging;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * File operations log backed by the dedicated <i>file_operations</i> Log4j2 logger.
 *
 * <p>Entries use the <i>OP | path | details</i> form, e.g.:
 * <pre>RESIZE | enquiry_photos/2024/06/15/x.jpg | 3000x2000 → 1920x1280</pre>
 * <p>Appender and file location come from <i>log4j2.xml</i>.
 */
public class Log4jFileOperationsLog implements FileOperationsLog {

    /**
     * Logger name.
     */
    public static final String LOGGER_NAME = "file_operations";

    private final Logger log;

    /**
     * Constructs a new Log4jFileOperationsLog instance using the default logger.
     */
    public Log4jFileOperationsLog() {
        this(LogManager.getLogger(LOGGER_NAME));
    }

    /**
     * Constructs a new Log4jFileOperationsLog instance.
     *
     * @param log Logger instance.
     */
    public Log4jFileOperationsLog(Logger log) {
        this.log = log;
    }

    @Override
    public void logDeletion(String filePath, String reason, String context) {
        if (context != null && !context.isEmpty()) {
            log.info("DELETION | {} | Reason: {} | Context: {}", filePath, reason, context);
        } else {
            log.info("DELETION | {} | Reason: {}", filePath, reason);
        }
    }

    @Override
    public void logResize(String filePath, String originalDimensions, String newDimensions) {
        log.info("RESIZE | {} | {} → {}", filePath, originalDimensions, newDimensions);
    }

    @Override
    public void logMove(String sourcePath, String destinationPath, String reason) {
        log.info("MOVE | {} → {} | Reason: {}", sourcePath, destinationPath, reason);
    }

    @Override
    public void logError(String operation, String filePath, String error) {
        log.error("ERROR | {} | {} | {}", operation, filePath, error);
    }
}
