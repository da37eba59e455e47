package com.mimecast.enquiry.attachments;

import com.mimecast.enquiry.config.ImageConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounds image attachments in size and dimensions.
 *
 * <p>Images at or under the size threshold are returned untouched.
 * <br>Larger images are flattened onto white, scaled to fit the maximum dimension and re-encoded as JPEG.
 * <p>Never throws. On any failure the input bytes are returned with the resized flag unset.
 */
public class ImageResizer {
    private static final Logger log = LogManager.getLogger(ImageResizer.class);

    /**
     * Output format.
     */
    public static final String FORMAT = "jpeg";

    /**
     * Codec missing warning latch.
     */
    private static final AtomicBoolean codecWarned = new AtomicBoolean(false);

    private final long maxSizeBytes;
    private final int maxDimension;
    private final float quality;

    /**
     * Constructs a new ImageResizer instance.
     *
     * @param config ImageConfig instance.
     */
    public ImageResizer(ImageConfig config) {
        this(config.getMaxSizeBytes(), config.getMaxDimension(), config.getQuality());
    }

    /**
     * Constructs a new ImageResizer instance.
     *
     * @param maxSizeBytes Size threshold in bytes.
     * @param maxDimension Maximum width or height in pixels.
     * @param quality      JPEG quality 1-100.
     */
    public ImageResizer(long maxSizeBytes, int maxDimension, int quality) {
        this.maxSizeBytes = maxSizeBytes;
        this.maxDimension = maxDimension;
        this.quality = Math.max(1, Math.min(100, quality)) / 100f;
    }

    /**
     * Resizes image if needed.
     *
     * @param data Image bytes.
     * @return ResizeResult instance.
     */
    public ResizeResult resize(byte[] data) {
        if (data == null || data.length <= maxSizeBytes) {
            return ResizeResult.unchanged(data);
        }

        if (!isCodecAvailable()) {
            if (codecWarned.compareAndSet(false, true)) {
                log.warn("No {} writer available, images will not be resized", FORMAT);
            }
            return ResizeResult.unchanged(data);
        }

        try {
            BufferedImage source = ImageIO.read(new ByteArrayInputStream(data));
            if (source == null) {
                log.warn("Unable to decode image of {} bytes, keeping original", data.length);
                return ResizeResult.unchanged(data);
            }

            int width = source.getWidth();
            int height = source.getHeight();
            double scale = Math.min(1D, (double) maxDimension / Math.max(width, height));
            int newWidth = Math.max(1, (int) Math.round(width * scale));
            int newHeight = Math.max(1, (int) Math.round(height * scale));

            byte[] output = encode(flatten(source, newWidth, newHeight));
            log.info("Resized image {}x{} → {}x{}, {} → {} bytes", width, height, newWidth, newHeight, data.length, output.length);

            return new ResizeResult(output, true, width + "x" + height, newWidth + "x" + newHeight);
        } catch (Exception e) {
            log.warn("Image resize failed, keeping original: {}", e.getMessage());
            return ResizeResult.unchanged(data);
        }
    }

    /**
     * Checks whether a writer for the output format is registered.
     *
     * @return Boolean.
     */
    static boolean isCodecAvailable() {
        return ImageIO.getImageWritersByFormatName(FORMAT).hasNext();
    }

    /**
     * Draws the source scaled onto an opaque white canvas.
     *
     * @param source    Decoded image.
     * @param newWidth  Target width.
     * @param newHeight Target height.
     * @return RGB image.
     */
    private static BufferedImage flatten(BufferedImage source, int newWidth, int newHeight) {
        BufferedImage target = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.setColor(Color.WHITE);
            graphics.fillRect(0, 0, newWidth, newHeight);
            graphics.drawImage(source, 0, 0, newWidth, newHeight, null);
        } finally {
            graphics.dispose();
        }

        return target;
    }

    /**
     * Encodes as JPEG at the configured quality.
     *
     * @param image RGB image.
     * @return JPEG bytes.
     * @throws IOException Unable to encode.
     */
    private byte[] encode(BufferedImage image) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT);
        if (!writers.hasNext()) {
            throw new IOException("No " + FORMAT + " writer");
        }

        ImageWriter writer = writers.next();
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(stream)) {
            writer.setOutput(output);

            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);

            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }

        return stream.toByteArray();
    }
}
