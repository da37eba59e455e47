package com.mimecast.enquiry.logging;

/**
 * Audit sink for file operations.
 *
 * <p>Records storage side effects such as attachment writes, resizes and failures.
 * <br>Setup of the underlying sink is the caller's concern.
 */
public interface FileOperationsLog {

    /**
     * Sink that drops everything.
     */
    FileOperationsLog NOOP = new FileOperationsLog() {
        @Override
        public void logDeletion(String filePath, String reason, String context) {
        }

        @Override
        public void logResize(String filePath, String originalDimensions, String newDimensions) {
        }

        @Override
        public void logMove(String sourcePath, String destinationPath, String reason) {
        }

        @Override
        public void logError(String operation, String filePath, String error) {
        }
    };

    /**
     * Logs a file deletion.
     *
     * @param filePath Path.
     * @param reason   Reason.
     * @param context  Context, may be null.
     */
    void logDeletion(String filePath, String reason, String context);

    /**
     * Logs an image resize.
     *
     * @param filePath           Path.
     * @param originalDimensions Dimensions before, e.g. 3000x2000.
     * @param newDimensions      Dimensions after.
     */
    void logResize(String filePath, String originalDimensions, String newDimensions);

    /**
     * Logs a move.
     *
     * @param sourcePath      Source.
     * @param destinationPath Destination.
     * @param reason          Reason.
     */
    void logMove(String sourcePath, String destinationPath, String reason);

    /**
     * Logs a failed operation.
     *
     * @param operation Operation name.
     * @param filePath  Path.
     * @param error     Error message.
     */
    void logError(String operation, String filePath, String error);
}
