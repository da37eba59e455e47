package com.mimecast.enquiry.container.msg;

import com.mimecast.enquiry.container.ContainerOpenException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PoiMsgContainerReaderTest {

    @TempDir
    Path dir;

    private final PoiMsgContainerReader reader = new PoiMsgContainerReader();

    @Test
    void plainTextIsNotAContainer() throws IOException {
        Path path = Files.write(dir.resolve("fake.msg"), "Subject: hello\r\n\r\nbody".getBytes(StandardCharsets.US_ASCII));

        ContainerOpenException e = assertThrows(ContainerOpenException.class, () -> reader.open(path));
        assertNotNull(e.getCause());
    }

    @Test
    void emptyFile() throws IOException {
        Path path = Files.write(dir.resolve("empty.msg"), new byte[0]);

        assertThrows(ContainerOpenException.class, () -> reader.open(path));
    }

    @Test
    void missingFile() {
        assertThrows(ContainerOpenException.class, () -> reader.open(dir.resolve("absent.msg")));
    }
}
