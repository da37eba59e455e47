package com.mimecast.enquiry.container;

import java.io.IOException;

/**
 * Thrown when a container file cannot be opened or decoded.
 */
public class ContainerOpenException extends IOException {

    /**
     * Constructs a new ContainerOpenException instance.
     *
     * @param message Message.
     * @param cause   Cause.
     */
    public ContainerOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
