package com.mimecast.enquiry.attachments;

/**
 * Stored attachment metadata.
 */
public class AttachmentRecord {

    /**
     * Upload type of all extracted attachments.
     */
    public static final String UPLOAD_TYPE = "extracted";

    private final String originalFilename;
    private final String savedFilename;
    private final String filePath;
    private final long fileSize;
    private final String fileUrl;
    private final String fileType;
    private final String uploadType = UPLOAD_TYPE;
    private final Boolean wasResized;
    private final Long originalSize;

    /**
     * Constructs a new AttachmentRecord instance.
     *
     * @param originalFilename Name in the container.
     * @param savedFilename    Generated name.
     * @param filePath         Path relative to the storage root.
     * @param fileSize         Bytes written.
     * @param fileUrl          Public URL.
     * @param type             AttachmentType.
     * @param wasResized       Whether the image was resized, null for documents.
     * @param originalSize     Image bytes before processing, null for documents.
     */
    public AttachmentRecord(String originalFilename, String savedFilename, String filePath, long fileSize,
                            String fileUrl, AttachmentType type, Boolean wasResized, Long originalSize) {
        this.originalFilename = originalFilename;
        this.savedFilename = savedFilename;
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.fileUrl = fileUrl;
        this.fileType = type.getName();
        this.wasResized = wasResized;
        this.originalSize = originalSize;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public String getSavedFilename() {
        return savedFilename;
    }

    public String getFilePath() {
        return filePath;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getFileUrl() {
        return fileUrl;
    }

    public String getFileType() {
        return fileType;
    }

    public String getUploadType() {
        return uploadType;
    }

    /**
     * Gets whether the image was resized.
     *
     * @return Boolean or null for documents.
     */
    public Boolean getWasResized() {
        return wasResized;
    }

    /**
     * Gets image size before processing.
     *
     * @return Long or null for documents.
     */
    public Long getOriginalSize() {
        return originalSize;
    }

    @Override
    public String toString() {
        return "AttachmentRecord{" + fileType + " " + originalFilename + " -> " + filePath + " (" + fileSize + " bytes)}";
    }
}
