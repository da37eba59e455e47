package com.mimecast.enquiry.logging;

import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.mockito.Mockito.*;

class Log4jFileOperationsLogTest {

    private Logger logger;
    private FileOperationsLog fileLog;

    @BeforeEach
    void setUp() {
        logger = mock(Logger.class);
        fileLog = new Log4jFileOperationsLog(logger);
    }

    @Test
    void resize() {
        fileLog.logResize("enquiry_photos/2024/06/15/x.jpg", "3000x2000", "1920x1280");

        verify(logger).info("RESIZE | {} | {} → {}", "enquiry_photos/2024/06/15/x.jpg", "3000x2000", "1920x1280");
    }

    @Test
    void error() {
        fileLog.logError("EXTRACT_ATTACHMENT", "photo.png", "disk full");

        verify(logger).error("ERROR | {} | {} | {}", "EXTRACT_ATTACHMENT", "photo.png", "disk full");
    }

    @Test
    void deletionWithAndWithoutContext() {
        fileLog.logDeletion("a.jpg", "orphan", "cleanup run");
        fileLog.logDeletion("b.jpg", "orphan", null);

        verify(logger).info("DELETION | {} | Reason: {} | Context: {}", "a.jpg", "orphan", "cleanup run");
        verify(logger).info("DELETION | {} | Reason: {}", "b.jpg", "orphan");
    }

    @Test
    void move() {
        fileLog.logMove("a.jpg", "b.jpg", "rename");

        verify(logger).info("MOVE | {} → {} | Reason: {}", "a.jpg", "b.jpg", "rename");
    }

    @Test
    void noopAcceptsEverything() {
        FileOperationsLog.NOOP.logResize("a", "1x1", "1x1");
        FileOperationsLog.NOOP.logError("OP", "a", null);

        verifyNoInteractions(logger);
    }
}
