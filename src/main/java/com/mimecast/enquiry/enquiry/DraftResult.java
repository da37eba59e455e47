package com.mimecast.enquiry.enquiry;

import java.util.Optional;

/**
 * Enquiry draft outcome, a draft or an error.
 */
public class DraftResult {

    private final EnquiryDraft draft;
    private final String error;

    private DraftResult(EnquiryDraft draft, String error) {
        this.draft = draft;
        this.error = error;
    }

    static DraftResult success(EnquiryDraft draft) {
        return new DraftResult(draft, null);
    }

    static DraftResult error(String error) {
        return new DraftResult(null, error);
    }

    public boolean isSuccess() {
        return draft != null;
    }

    public Optional<EnquiryDraft> getDraft() {
        return Optional.ofNullable(draft);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }
}
