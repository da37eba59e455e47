package com.mimecast.enquiry;

import com.mimecast.enquiry.body.BodyMode;
import com.mimecast.enquiry.config.UploadConfig;
import com.mimecast.enquiry.validation.EmailFileValidator;
import com.mimecast.enquiry.validation.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

class EmailFileServiceTest {

    private static final byte[] OLE2 = {
            (byte) 0xD0, (byte) 0xCF, (byte) 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, (byte) 0x1A, (byte) 0xE1
    };

    @TempDir
    Path dir;

    private MsgParser parser;
    private EmailFileService service;
    private Path msg;

    @BeforeEach
    void setUp() throws IOException {
        parser = mock(MsgParser.class);
        service = new EmailFileService(new EmailFileValidator(new UploadConfig(Map.of())), parser);
        msg = Files.write(dir.resolve("enquiry.msg"), OLE2);
    }

    @Test
    void success() {
        ParsedEmail email = ParsedEmail.builder().setSubject("Bins").build();
        when(parser.parse(msg, BodyMode.FULL, true)).thenReturn(ParseResult.success(email));

        EmailFileResult result = service.parse(msg, "full", true);

        assertTrue(result.isSuccess());
        assertSame(email, result.getEmail().orElseThrow());
        assertEquals(BodyMode.FULL, result.getMode());
    }

    @Test
    void unknownModeFallsBackToSnippet() {
        when(parser.parse(msg, BodyMode.SNIPPET, false)).thenReturn(ParseResult.success(ParsedEmail.builder().build()));

        EmailFileResult result = service.parse(msg, "fancy", false);

        assertEquals(BodyMode.SNIPPET, result.getMode());
        verify(parser).parse(msg, BodyMode.SNIPPET, false);
    }

    @Test
    void parseError() {
        when(parser.parse(msg, BodyMode.SNIPPET, false))
                .thenReturn(ParseResult.error("Failed to open/parse container: bad header"));

        EmailFileResult result = service.parse(msg, "snippet", false);

        assertFalse(result.isSuccess());
        assertEquals("Error parsing email: Failed to open/parse container: bad header", result.getError());
        assertEquals(ErrorType.PARSING_ERROR, result.getErrorType());
    }

    @Test
    void unexpectedFailure() {
        when(parser.parse(any(Path.class), any(BodyMode.class), anyBoolean())).thenThrow(new IllegalStateException("boom"));

        EmailFileResult result = service.parse(msg, "plain", false);

        assertEquals("Error processing email file: boom", result.getError());
        assertEquals(ErrorType.PROCESSING, result.getErrorType());
    }

    @Test
    void emlNotImplemented() throws IOException {
        Path eml = Files.write(dir.resolve("enquiry.eml"),
                "Subject: Bins\r\nFrom: jane@example.com\r\n\r\nBody".getBytes(StandardCharsets.US_ASCII));

        EmailFileResult result = service.parse(eml, "snippet", false);

        assertEquals(EmailFileService.EML_NOT_IMPLEMENTED, result.getError());
        assertEquals(ErrorType.NOT_IMPLEMENTED, result.getErrorType());
        verifyNoInteractions(parser);
    }

    @Test
    void validationFailureSkipsParser() {
        EmailFileResult result = service.parse(dir.resolve("absent.msg"), "snippet", false);

        assertEquals(ErrorType.MISSING_FILE, result.getErrorType());
        verifyNoInteractions(parser);
    }
}
