package com.mimecast.enquiry.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParserConfigTest {

    @Test
    void defaults() {
        ParserConfig config = new ParserConfig();

        assertEquals("memberenquiries@redcar-cleveland.gov.uk", config.getInboxAddress());
        assertEquals(ZoneId.of("Europe/London"), config.getLocalTimezone());
        assertEquals(ZoneId.of("Europe/London"), config.getDisplayTimezone());
        assertEquals(List.of(".pdf", ".doc", ".docx"), config.getDocumentExtensions());

        assertEquals("media", config.getStorage().getRoot());
        assertEquals("/media/", config.getStorage().getUrlPrefix());
        assertEquals("enquiry_photos", config.getStorage().getImageDir());
        assertEquals("enquiry_attachments/documents", config.getStorage().getDocumentDir());

        assertEquals(2D, config.getImage().getMaxSizeMb());
        assertEquals(2L * 1024 * 1024, config.getImage().getMaxSizeBytes());
        assertEquals(2048, config.getImage().getMaxDimension());
        assertEquals(85, config.getImage().getQuality());
        assertEquals(ImageConfig.DEFAULT_EXTENSIONS, config.getImage().getExtensions());

        assertEquals(50D, config.getUpload().getMaxEmailSizeMb());
        assertEquals(List.of(".msg", ".eml"), config.getUpload().getExtensions());
    }

    @Test
    void fromFile() throws IOException {
        ParserConfig config = new ParserConfig("src/test/resources/cfg/parser.json5");

        assertEquals("enquiries@example.gov.uk", config.getInboxAddress());
        assertEquals("target/media", config.getStorage().getRoot());
        assertEquals("/files", config.getStorage().getUrlPrefix());
        assertEquals("enquiry_photos", config.getStorage().getImageDir());
        assertEquals(0.5D, config.getImage().getMaxSizeMb());
        assertEquals(1920, config.getImage().getMaxDimension());
        assertEquals(80, config.getImage().getQuality());
        assertTrue(config.getDocumentExtensions().contains(".txt"));
        assertEquals(1D, config.getUpload().getMaxEmailSizeMb());
    }

    @Test
    void fromMap() {
        Map<String, Object> image = new HashMap<>();
        image.put("maxDimension", 1024.0);
        image.put("quality", "70");

        Map<String, Object> map = new HashMap<>();
        map.put("inboxAddress", "inbox@example.com");
        map.put("displayTimezone", "UTC");
        map.put("image", image);

        ParserConfig config = new ParserConfig(map);
        assertEquals("inbox@example.com", config.getInboxAddress());
        assertEquals(ZoneId.of("UTC"), config.getDisplayTimezone());
        assertEquals(ZoneId.of("Europe/London"), config.getLocalTimezone());
        assertEquals(1024, config.getImage().getMaxDimension());
        assertEquals(70, config.getImage().getQuality());
    }

    @Test
    void invalidFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.json5");
        Files.writeString(file, "{ inboxAddress: [ }");

        assertThrows(IOException.class, () -> new ParserConfig(file.toString()));
    }

    @Test
    void missingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> new ParserConfig(dir.resolve("missing.json5").toString()));
    }
}
