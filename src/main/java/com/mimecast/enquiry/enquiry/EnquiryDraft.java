package com.mimecast.enquiry.enquiry;

/**
 * New enquiry built from an email, ready to be persisted by the caller.
 */
public class EnquiryDraft {

    /**
     * Status of new enquiries.
     */
    public static final String STATUS_NEW = "new";

    private final String title;
    private final String description;
    private final Member member;
    private final String historyNote;
    private final String createdBy;

    /**
     * Constructs a new EnquiryDraft instance.
     *
     * @param title       Title.
     * @param description Description.
     * @param member      Member instance.
     * @param historyNote Initial history note.
     * @param createdBy   Creating user.
     */
    public EnquiryDraft(String title, String description, Member member, String historyNote, String createdBy) {
        this.title = title;
        this.description = description;
        this.member = member;
        this.historyNote = historyNote;
        this.createdBy = createdBy;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public Member getMember() {
        return member;
    }

    public String getStatus() {
        return STATUS_NEW;
    }

    public String getHistoryNote() {
        return historyNote;
    }

    public String getCreatedBy() {
        return createdBy;
    }
}
