package com.mimecast.enquiry.headers;

import com.mimecast.enquiry.container.MailContainer;

/**
 * Builds the canonical <i>Name &lt;email&gt;</i> sender from fragmentary container fields.
 *
 * <p>Explicit name and email fields win over values parsed from the raw sender.
 */
public class SenderResolver {

    /**
     * Fallback when no sender information exists.
     */
    public static final String UNKNOWN_SENDER = "Unknown Sender";

    /**
     * Resolves sender from container.
     *
     * @param container MailContainer instance.
     * @return ResolvedSender instance.
     */
    public ResolvedSender resolve(MailContainer container) {
        return resolve(container.getSender().orElse(""),
                container.getSenderName().orElse(""),
                container.getSenderEmail().orElse(""));
    }

    /**
     * Resolves sender from fields.
     *
     * @param rawFrom     Raw sender field.
     * @param senderName  Explicit name, may be empty.
     * @param senderEmail Explicit email, may be empty.
     * @return ResolvedSender instance.
     */
    public ResolvedSender resolve(String rawFrom, String senderName, String senderEmail) {
        String raw = rawFrom != null ? rawFrom : "";
        String name = senderName != null ? senderName.trim() : "";
        String email = senderEmail != null ? senderEmail.trim() : "";

        if (email.isEmpty() && !raw.isEmpty()) {
            AddressParser.Parsed parsed = AddressParser.parse(raw);
            email = parsed.getAddress();
            if (name.isEmpty()) {
                name = parsed.getName();
            }
        }

        String emailFrom;
        if (!name.isEmpty() && !email.isEmpty()) {
            emailFrom = name + " <" + email + ">";
        } else if (!email.isEmpty()) {
            emailFrom = email;
        } else {
            emailFrom = !raw.isEmpty() ? raw : UNKNOWN_SENDER;
        }

        return new ResolvedSender(emailFrom, raw);
    }
}
