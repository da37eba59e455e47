package com.mimecast.enquiry.container.msg;

import com.mimecast.enquiry.container.ContainerOpenException;
import com.mimecast.enquiry.container.ContainerReader;
import com.mimecast.enquiry.container.MailContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.hsmf.MAPIMessage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Outlook <i>.msg</i> container reader backed by Apache POI HSMF.
 */
public class PoiMsgContainerReader implements ContainerReader {
    private static final Logger log = LogManager.getLogger(PoiMsgContainerReader.class);

    @Override
    public MailContainer open(Path path) throws ContainerOpenException {
        MAPIMessage message;
        try {
            message = new MAPIMessage(path.toFile());
        } catch (IOException | RuntimeException e) {
            throw new ContainerOpenException(String.valueOf(e.getMessage()), e);
        }

        try {
            message.setReturnNullOnMissingChunk(true);
            return new PoiMsgContainer(message);
        } catch (RuntimeException e) {
            try {
                message.close();
            } catch (IOException ce) {
                log.warn("Unable to close container {}: {}", path, ce.getMessage());
            }
            throw new ContainerOpenException(String.valueOf(e.getMessage()), e);
        }
    }
}
