package com.mimecast.enquiry.enquiry;

import com.mimecast.enquiry.headers.Direction;

/**
 * Email content prepared for an enquiry history note.
 */
public class HistoryEntry {

    private final String subject;
    private final String from;
    private final String to;
    private final String cc;
    private final String date;
    private final String body;
    private final Direction direction;
    private final String fullConversation;

    /**
     * Constructs a new HistoryEntry instance.
     *
     * @param subject          Subject.
     * @param from             Sender.
     * @param to               To recipients.
     * @param cc               Cc recipients.
     * @param date             Display date.
     * @param body             Latest message of the thread.
     * @param direction        Direction.
     * @param fullConversation Whole thread as plain text.
     */
    public HistoryEntry(String subject, String from, String to, String cc, String date,
                        String body, Direction direction, String fullConversation) {
        this.subject = subject;
        this.from = from;
        this.to = to;
        this.cc = cc;
        this.date = date;
        this.body = body;
        this.direction = direction;
        this.fullConversation = fullConversation;
    }

    public String getSubject() {
        return subject;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    public String getCc() {
        return cc;
    }

    public String getDate() {
        return date;
    }

    public String getBody() {
        return body;
    }

    public Direction getDirection() {
        return direction;
    }

    public String getFullConversation() {
        return fullConversation;
    }
}
