package com.mimecast.enquiry.headers;

import com.mimecast.enquiry.body.BannerStripper;
import com.mimecast.enquiry.container.MailContainer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Labels a message as incoming to or outgoing from the monitored inbox.
 *
 * <p>Address matching on to, cc and bcc comes first.
 * <br>When inconclusive the first part of the plain body is scanned for external mail banners.
 * <p>This is a heuristic. Forwarded mail and internal senders can be misclassified.
 */
public class DirectionClassifier {
    private static final Logger log = LogManager.getLogger(DirectionClassifier.class);

    /**
     * Number of leading body characters scanned for banners.
     */
    public static final int BANNER_SCAN_LENGTH = 400;

    /**
     * Monitored inbox address, lower case.
     */
    private final String inboxAddress;

    /**
     * Constructs a new DirectionClassifier instance.
     *
     * @param inboxAddress Monitored inbox address.
     */
    public DirectionClassifier(String inboxAddress) {
        this.inboxAddress = inboxAddress.toLowerCase(Locale.ROOT);
    }

    /**
     * Classifies a container.
     *
     * @param container MailContainer instance.
     * @return Direction.
     */
    public Direction classify(MailContainer container) {
        return classify(container.getTo().orElse(""),
                container.getCc().orElse(""),
                container.getBcc().orElse(""),
                () -> container.getPlainBody().orElse(""));
    }

    /**
     * Classifies from recipient fields and a lazily read body.
     * <p>The body is only read if no recipient field matches.
     *
     * @param to   To field.
     * @param cc   Cc field.
     * @param bcc  Bcc field.
     * @param body Plain body supplier.
     * @return Direction.
     */
    public Direction classify(String to, String cc, String bcc, Supplier<String> body) {
        if (matchesInbox(to)) {
            log.debug("Incoming by to address");
            return Direction.INCOMING;
        }
        if (matchesInbox(cc)) {
            log.debug("Incoming by cc address");
            return Direction.INCOMING;
        }
        if (matchesInbox(bcc)) {
            log.debug("Incoming by bcc address");
            return Direction.INCOMING;
        }

        if (hasBanner(body.get())) {
            log.debug("Incoming by external banner");
            return Direction.INCOMING;
        }

        return Direction.OUTGOING;
    }

    /**
     * Checks a recipient field for the inbox address.
     *
     * @param recipients Raw recipient field.
     * @return Boolean.
     */
    boolean matchesInbox(String recipients) {
        if (recipients == null || recipients.isEmpty()) {
            return false;
        }

        return RecipientFormatter.format(recipients).toLowerCase(Locale.ROOT).contains(inboxAddress)
                || recipients.toLowerCase(Locale.ROOT).contains(inboxAddress);
    }

    /**
     * Checks the start of the body for a banner.
     *
     * @param body Plain body.
     * @return Boolean.
     */
    static boolean hasBanner(String body) {
        if (body == null || body.isEmpty()) {
            return false;
        }

        String head = body.length() > BANNER_SCAN_LENGTH ? body.substring(0, BANNER_SCAN_LENGTH) : body;
        return head.contains(BannerStripper.EXTERNAL_WARNING) || BannerStripper.INFREQUENT_SENDER.matcher(head).find();
    }
}
