package com.mimecast.enquiry.headers;

import com.mimecast.enquiry.container.MailContainer;
import com.mimecast.enquiry.container.TimestampCandidate;

import java.util.Optional;

/**
 * Single timestamp source in the date resolution chain.
 */
@FunctionalInterface
public interface DateSource {

    /**
     * Delivery time, what the recipient saw in their client.
     */
    DateSource RECEIVED = MailContainer::getReceivedTime;

    /**
     * Client submit time.
     */
    DateSource SENT = MailContainer::getSentTime;

    /**
     * Reads a candidate timestamp.
     *
     * @param container MailContainer instance.
     * @return Optional of TimestampCandidate, empty when the source has nothing usable.
     */
    Optional<TimestampCandidate> read(MailContainer container);
}
