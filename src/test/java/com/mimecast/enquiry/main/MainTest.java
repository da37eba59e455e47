package com.mimecast.enquiry.main;

import com.mimecast.enquiry.attachments.AttachmentRecord;
import com.mimecast.enquiry.attachments.AttachmentType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream baos = new ByteArrayOutputStream();

    private boolean run(String... args) {
        return new Main(new PrintStream(baos, true, StandardCharsets.UTF_8)).run(args);
    }

    private String output() {
        return baos.toString(StandardCharsets.UTF_8);
    }

    @Test
    void usageWithoutFile() {
        assertFalse(run());
        assertTrue(output().contains("Mail container parser"));
        assertTrue(output().contains("--file"));
    }

    @Test
    void missingFile() {
        assertFalse(run("--file", dir.resolve("absent.msg").toString()));
        assertTrue(output().contains("\"success\": false"));
        assertTrue(output().contains("\"error\": \"No file provided\""));
        assertTrue(output().contains("\"error_type\": \"missing_file\""));
    }

    @Test
    void emlNotImplemented() throws IOException {
        Path eml = Files.write(dir.resolve("enquiry.eml"),
                "Subject: Bins\r\nFrom: jane@example.com\r\n\r\nBody".getBytes(StandardCharsets.US_ASCII));

        assertFalse(run("-f", eml.toString(), "-m", "full"));
        assertTrue(output().contains("\"error_type\": \"not_implemented\""));
    }

    @Test
    void brokenConfig() {
        assertFalse(run("--file", "enquiry.msg", "--config", dir.resolve("missing.json5").toString()));
        assertTrue(output().contains("Unable to load config"));
    }

    @Test
    void options() {
        assertTrue(Main.options().hasOption("skip-attachments"));
        assertTrue(Main.options().hasOption("H"));
    }

    @Test
    void imageOnlyFieldsOmittedForDocuments() {
        String document = Main.GSON.toJson(new AttachmentRecord("report.pdf", "a.pdf",
                "enquiry_attachments/documents/2024/06/15/a.pdf", 8L, "/media/enquiry_attachments/documents/2024/06/15/a.pdf",
                AttachmentType.DOCUMENT, null, null));
        assertTrue(document.contains("\"file_type\": \"document\""));
        assertFalse(document.contains("was_resized"));
        assertFalse(document.contains("original_size"));

        String image = Main.GSON.toJson(new AttachmentRecord("scan.png", "b.jpg",
                "enquiry_photos/2024/06/15/b.jpg", 512L, "/media/enquiry_photos/2024/06/15/b.jpg",
                AttachmentType.IMAGE, true, 4096L));
        assertTrue(image.contains("\"was_resized\": true"));
        assertTrue(image.contains("\"original_size\": 4096"));
    }
}
