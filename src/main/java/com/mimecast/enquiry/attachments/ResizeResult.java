package com.mimecast.enquiry.attachments;

/**
 * Image resize outcome.
 *
 * <p>Dimensions are only known when the image was decoded.
 */
public class ResizeResult {

    /**
     * Output bytes.
     */
    private final byte[] data;

    /**
     * Whether the bytes were re-encoded.
     */
    private final boolean resized;

    /**
     * Dimensions before, e.g. 3000x2000.
     */
    private final String originalDimensions;

    /**
     * Dimensions after.
     */
    private final String newDimensions;

    /**
     * Constructs a new ResizeResult instance.
     *
     * @param data               Output bytes.
     * @param resized            Whether the bytes were re-encoded.
     * @param originalDimensions Dimensions before, may be null.
     * @param newDimensions      Dimensions after, may be null.
     */
    public ResizeResult(byte[] data, boolean resized, String originalDimensions, String newDimensions) {
        this.data = data;
        this.resized = resized;
        this.originalDimensions = originalDimensions;
        this.newDimensions = newDimensions;
    }

    /**
     * Unchanged result.
     *
     * @param data Original bytes.
     * @return ResizeResult instance.
     */
    public static ResizeResult unchanged(byte[] data) {
        return new ResizeResult(data, false, null, null);
    }

    public byte[] getData() {
        return data;
    }

    public boolean isResized() {
        return resized;
    }

    /**
     * Gets output size.
     *
     * @return Bytes.
     */
    public int getSize() {
        return data != null ? data.length : 0;
    }

    public String getOriginalDimensions() {
        return originalDimensions;
    }

    public String getNewDimensions() {
        return newDimensions;
    }
}
