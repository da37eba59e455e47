package com.mimecast.enquiry.headers;

/**
 * Sender resolution result.
 */
public class ResolvedSender {

    /**
     * Canonical display form.
     */
    private final String emailFrom;

    /**
     * Unmodified raw sender field.
     */
    private final String rawFrom;

    /**
     * Constructs a new ResolvedSender instance.
     *
     * @param emailFrom Canonical form.
     * @param rawFrom   Raw sender.
     */
    public ResolvedSender(String emailFrom, String rawFrom) {
        this.emailFrom = emailFrom;
        this.rawFrom = rawFrom;
    }

    public String getEmailFrom() {
        return emailFrom;
    }

    public String getRawFrom() {
        return rawFrom;
    }
}
