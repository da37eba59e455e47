package com.mimecast.enquiry.enquiry;

import com.mimecast.enquiry.ParsedEmail;
import com.mimecast.enquiry.body.ConversationExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Turns a parsed email into a history entry.
 *
 * <p>The body keeps only the latest message while the full thread is kept as plain text.
 */
public class HistoryEntryBuilder {
    private static final Logger log = LogManager.getLogger(HistoryEntryBuilder.class);

    private final ConversationExtractor extractor;

    /**
     * Constructs a new HistoryEntryBuilder instance.
     */
    public HistoryEntryBuilder() {
        this(new ConversationExtractor());
    }

    /**
     * Constructs a new HistoryEntryBuilder instance.
     *
     * @param extractor ConversationExtractor instance.
     */
    public HistoryEntryBuilder(ConversationExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Builds entry.
     *
     * @param email ParsedEmail instance.
     * @return HistoryEntry instance.
     */
    public HistoryEntry build(ParsedEmail email) {
        String body = email.getBodyContent();
        log.debug("Building history entry from body of {} chars", body.length());

        return new HistoryEntry(
                email.getSubject(),
                email.getEmailFrom(),
                email.getEmailTo(),
                email.getEmailCc(),
                email.getEmailDateStr(),
                extractor.extractLatest(body),
                email.getDirection(),
                extractor.cleanHtmlForDisplay(body));
    }
}
