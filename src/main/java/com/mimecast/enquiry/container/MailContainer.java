package com.mimecast.enquiry.container;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Decoded mail container.
 *
 * <p>Capability view over a single legacy message file.
 * <br>Every field is optional since real world containers routinely miss some of them.
 * <br>Instances are opened by a {@link ContainerReader} and must be closed by the caller.
 */
public interface MailContainer extends Closeable {

    /**
     * Gets the raw sender field, typically <i>Name &lt;email&gt;</i>.
     *
     * @return Optional of String.
     */
    Optional<String> getSender();

    /**
     * Gets the pre-split sender display name.
     *
     * @return Optional of String.
     */
    Optional<String> getSenderName();

    /**
     * Gets the pre-split sender email address.
     *
     * @return Optional of String.
     */
    Optional<String> getSenderEmail();

    /**
     * Gets the semicolon separated To recipients.
     *
     * @return Optional of String.
     */
    Optional<String> getTo();

    /**
     * Gets the semicolon separated Cc recipients.
     *
     * @return Optional of String.
     */
    Optional<String> getCc();

    /**
     * Gets the semicolon separated Bcc recipients.
     *
     * @return Optional of String.
     */
    Optional<String> getBcc();

    /**
     * Gets the subject.
     *
     * @return Optional of String.
     */
    Optional<String> getSubject();

    /**
     * Gets the plain text body.
     *
     * @return Optional of String.
     */
    Optional<String> getPlainBody();

    /**
     * Gets the native HTML body.
     *
     * @return Optional of String.
     */
    Optional<String> getHtmlBody();

    /**
     * Gets the time the message was delivered to the mailbox.
     *
     * @return Optional of TimestampCandidate.
     */
    Optional<TimestampCandidate> getReceivedTime();

    /**
     * Gets the time the message was submitted by the sender.
     *
     * @return Optional of TimestampCandidate.
     */
    Optional<TimestampCandidate> getSentTime();

    /**
     * Gets attachments in container order.
     *
     * @return List of RawAttachment, never null.
     */
    List<RawAttachment> getAttachments();
}
