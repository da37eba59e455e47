package com.mimecast.enquiry.attachments;

import com.mimecast.enquiry.config.ImageConfig;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ImageResizerTest {

    static byte[] noise(int width, int height, String format) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] pixels = new int[width * height];
        Random random = new Random(42);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = random.nextInt(0xFFFFFF);
        }
        image.setRGB(0, 0, width, height, pixels, 0, width);

        return encode(image, format);
    }

    static byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream stream = new ByteArrayOutputStream();
        assertTrue(ImageIO.write(image, format, stream), "No writer for " + format);
        return stream.toByteArray();
    }

    static BufferedImage decode(byte[] data) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        assertNotNull(image);
        return image;
    }

    @Test
    void underThresholdIsUnchanged() throws IOException {
        byte[] data = noise(40, 30, "png");
        ImageResizer resizer = new ImageResizer(new ImageConfig(Map.of()));

        ResizeResult result = resizer.resize(data);
        assertFalse(result.isResized());
        assertSame(data, result.getData());
        assertEquals(data.length, result.getSize());
        assertNull(result.getOriginalDimensions());
    }

    @Test
    void largePhotoIsBoundedToMaxDimension() throws IOException {
        byte[] data = noise(3000, 2000, "jpeg");
        ImageResizer resizer = new ImageResizer(data.length / 2, 1920, 85);

        ResizeResult result = resizer.resize(data);
        assertTrue(result.isResized());
        assertEquals("3000x2000", result.getOriginalDimensions());
        assertEquals("1920x1280", result.getNewDimensions());

        BufferedImage output = decode(result.getData());
        assertTrue(output.getWidth() <= 1920);
        assertTrue(output.getHeight() <= 1920);
        assertEquals(result.getData().length, result.getSize());
    }

    @Test
    void portraitIsBoundedOnHeight() throws IOException {
        byte[] data = noise(300, 600, "png");
        ImageResizer resizer = new ImageResizer(0, 200, 85);

        BufferedImage output = decode(resizer.resize(data).getData());
        assertEquals(100, output.getWidth());
        assertEquals(200, output.getHeight());
    }

    @Test
    void smallDimensionsAreKeptWhenReencoding() throws IOException {
        byte[] data = noise(120, 80, "png");
        ImageResizer resizer = new ImageResizer(0, 2048, 85);

        ResizeResult result = resizer.resize(data);
        assertTrue(result.isResized());

        BufferedImage output = decode(result.getData());
        assertEquals(120, output.getWidth());
        assertEquals(80, output.getHeight());
    }

    @Test
    void transparencyIsFlattenedOntoWhite() throws IOException {
        BufferedImage image = new BufferedImage(64, 32, BufferedImage.TYPE_INT_ARGB);
        byte[] data = encode(image, "png");

        ResizeResult result = new ImageResizer(0, 2048, 90).resize(data);
        assertTrue(result.isResized());

        Color pixel = new Color(decode(result.getData()).getRGB(10, 10));
        assertTrue(pixel.getRed() > 240 && pixel.getGreen() > 240 && pixel.getBlue() > 240, pixel.toString());
    }

    @Test
    void undecodableIsUnchanged() {
        byte[] data = new byte[256];
        new Random(7).nextBytes(data);

        ResizeResult result = new ImageResizer(10, 2048, 85).resize(data);
        assertFalse(result.isResized());
        assertSame(data, result.getData());
    }

    @Test
    void nullIsUnchanged() {
        ResizeResult result = new ImageResizer(0, 2048, 85).resize(null);

        assertFalse(result.isResized());
        assertNull(result.getData());
        assertEquals(0, result.getSize());
    }
}
