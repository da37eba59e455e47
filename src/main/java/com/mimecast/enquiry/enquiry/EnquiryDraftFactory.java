package com.mimecast.enquiry.enquiry;

import com.mimecast.enquiry.ParsedEmail;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Builds a new enquiry from a parsed email sent by a member.
 *
 * <p>The sender address must belong to an active member.
 * <br>Lookup problems are reported in the {@link DraftResult}, never thrown.
 */
public class EnquiryDraftFactory {
    private static final Logger log = LogManager.getLogger(EnquiryDraftFactory.class);

    /**
     * Title length limit.
     */
    public static final int MAX_TITLE_LENGTH = 255;

    private final MemberDirectory directory;

    /**
     * Constructs a new EnquiryDraftFactory instance.
     *
     * @param directory MemberDirectory instance.
     */
    public EnquiryDraftFactory(MemberDirectory directory) {
        this.directory = directory;
    }

    /**
     * Creates draft.
     *
     * @param email     ParsedEmail instance.
     * @param createdBy Creating user.
     * @return DraftResult instance.
     */
    public DraftResult create(ParsedEmail email, String createdBy) {
        Optional<String> sender = SenderEmailExtractor.extract(email);
        if (sender.isEmpty()) {
            return DraftResult.error("Could not extract sender email address from email");
        }

        try {
            List<Member> members = directory.findActiveByEmail(sender.get());
            if (members.isEmpty()) {
                return DraftResult.error("No active member found with email address: " + sender.get());
            }
            if (members.size() > 1) {
                log.warn("Multiple members found for email {}, using first active", sender.get());
            }

            EnquiryDraft draft = new EnquiryDraft(
                    StringUtils.left(email.getSubject(), MAX_TITLE_LENGTH),
                    email.getBodyContent(),
                    members.get(0),
                    "Enquiry created from email sent on " + email.getEmailDateStr(),
                    createdBy);

            log.info("Enquiry draft created for member {} from {}", members.get(0).getId(), sender.get());
            return DraftResult.success(draft);
        } catch (RuntimeException e) {
            log.error("Error creating enquiry from email: {}", e.getMessage(), e);
            return DraftResult.error("Error creating enquiry: " + e.getMessage());
        }
    }
}
