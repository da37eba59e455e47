package com.mimecast.enquiry.container;

import java.nio.file.Path;

/**
 * Opens container files.
 */
@FunctionalInterface
public interface ContainerReader {

    /**
     * Opens and decodes the container at the given path.
     *
     * @param path Container file path.
     * @return MailContainer instance, to be closed by the caller.
     * @throws ContainerOpenException Unable to open or decode.
     */
    MailContainer open(Path path) throws ContainerOpenException;
}
