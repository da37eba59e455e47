package com.mimecast.enquiry;

import com.mimecast.enquiry.attachments.AttachmentRecord;
import com.mimecast.enquiry.headers.Direction;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalized message record produced by {@link MsgParser}.
 *
 * <p>Text fields are never null. Missing values carry their display fallback.
 */
public class ParsedEmail {

    /**
     * Fallback when there are no to recipients.
     */
    public static final String UNKNOWN_RECIPIENTS = "Unknown Recipient(s)";

    /**
     * Fallback subject.
     */
    public static final String NO_SUBJECT = "(No Subject)";

    /**
     * Fallback body.
     */
    public static final String NO_BODY = "(No body content)";

    private final String rawFrom;
    private final String emailFrom;
    private final String emailTo;
    private final String emailCc;
    private final String subject;
    private final ZonedDateTime emailDate;
    private final String emailDateStr;
    private final String bodyContent;
    private final Direction direction;
    private final boolean hasAttachments;
    private final boolean isHtml;
    private final List<AttachmentRecord> imageAttachments;

    private ParsedEmail(Builder builder) {
        this.rawFrom = builder.rawFrom != null ? builder.rawFrom : "";
        this.emailFrom = builder.emailFrom;
        this.emailTo = isEmpty(builder.emailTo) ? UNKNOWN_RECIPIENTS : builder.emailTo;
        this.emailCc = builder.emailCc != null ? builder.emailCc : "";
        this.subject = isEmpty(builder.subject) ? NO_SUBJECT : builder.subject;
        this.emailDate = builder.emailDate;
        this.emailDateStr = builder.emailDateStr;
        this.bodyContent = isEmpty(builder.bodyContent) ? NO_BODY : builder.bodyContent;
        this.direction = builder.direction;
        this.hasAttachments = builder.hasAttachments;
        this.isHtml = builder.isHtml;
        this.imageAttachments = Collections.unmodifiableList(new ArrayList<>(builder.imageAttachments));
    }

    public String getRawFrom() {
        return rawFrom;
    }

    public String getEmailFrom() {
        return emailFrom;
    }

    public String getEmailTo() {
        return emailTo;
    }

    public String getEmailCc() {
        return emailCc;
    }

    public String getSubject() {
        return subject;
    }

    /**
     * Gets message date in UTC.
     *
     * @return ZonedDateTime instance.
     */
    public ZonedDateTime getEmailDate() {
        return emailDate;
    }

    /**
     * Gets message date for display, e.g. <i>Jun 15, 2024 10:00 BST</i>.
     *
     * @return String.
     */
    public String getEmailDateStr() {
        return emailDateStr;
    }

    public String getBodyContent() {
        return bodyContent;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Whether the container had any attachment, extracted or not.
     *
     * @return Boolean.
     */
    public boolean hasAttachments() {
        return hasAttachments;
    }

    public boolean isHtml() {
        return isHtml;
    }

    public List<AttachmentRecord> getImageAttachments() {
        return imageAttachments;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Gets builder.
     *
     * @return Builder instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * ParsedEmail builder.
     */
    public static class Builder {
        private String rawFrom;
        private String emailFrom;
        private String emailTo;
        private String emailCc;
        private String subject;
        private ZonedDateTime emailDate;
        private String emailDateStr;
        private String bodyContent;
        private Direction direction = Direction.OUTGOING;
        private boolean hasAttachments;
        private boolean isHtml;
        private List<AttachmentRecord> imageAttachments = Collections.emptyList();

        public Builder setRawFrom(String rawFrom) {
            this.rawFrom = rawFrom;
            return this;
        }

        public Builder setEmailFrom(String emailFrom) {
            this.emailFrom = emailFrom;
            return this;
        }

        public Builder setEmailTo(String emailTo) {
            this.emailTo = emailTo;
            return this;
        }

        public Builder setEmailCc(String emailCc) {
            this.emailCc = emailCc;
            return this;
        }

        public Builder setSubject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder setEmailDate(ZonedDateTime emailDate) {
            this.emailDate = emailDate;
            return this;
        }

        public Builder setEmailDateStr(String emailDateStr) {
            this.emailDateStr = emailDateStr;
            return this;
        }

        public Builder setBodyContent(String bodyContent) {
            this.bodyContent = bodyContent;
            return this;
        }

        public Builder setDirection(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder setHasAttachments(boolean hasAttachments) {
            this.hasAttachments = hasAttachments;
            return this;
        }

        public Builder setHtml(boolean html) {
            this.isHtml = html;
            return this;
        }

        public Builder setImageAttachments(List<AttachmentRecord> imageAttachments) {
            this.imageAttachments = imageAttachments != null ? imageAttachments : Collections.emptyList();
            return this;
        }

        /**
         * Builds ParsedEmail.
         *
         * @return ParsedEmail instance.
         */
        public ParsedEmail build() {
            return new ParsedEmail(this);
        }
    }
}
