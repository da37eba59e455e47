package com.mimecast.enquiry.container;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * In-memory MailContainer for tests.
 */
public class FakeMailContainer implements MailContainer {

    private String sender;
    private String senderName;
    private String senderEmail;
    private String to;
    private String cc;
    private String bcc;
    private String subject;
    private String plainBody;
    private String htmlBody;
    private TimestampCandidate receivedTime;
    private TimestampCandidate sentTime;
    private final List<RawAttachment> attachments = new ArrayList<>();
    private boolean closed;

    public FakeMailContainer setSender(String sender) {
        this.sender = sender;
        return this;
    }

    public FakeMailContainer setSenderName(String senderName) {
        this.senderName = senderName;
        return this;
    }

    public FakeMailContainer setSenderEmail(String senderEmail) {
        this.senderEmail = senderEmail;
        return this;
    }

    public FakeMailContainer setTo(String to) {
        this.to = to;
        return this;
    }

    public FakeMailContainer setCc(String cc) {
        this.cc = cc;
        return this;
    }

    public FakeMailContainer setBcc(String bcc) {
        this.bcc = bcc;
        return this;
    }

    public FakeMailContainer setSubject(String subject) {
        this.subject = subject;
        return this;
    }

    public FakeMailContainer setPlainBody(String plainBody) {
        this.plainBody = plainBody;
        return this;
    }

    public FakeMailContainer setHtmlBody(String htmlBody) {
        this.htmlBody = htmlBody;
        return this;
    }

    public FakeMailContainer setReceivedTime(TimestampCandidate receivedTime) {
        this.receivedTime = receivedTime;
        return this;
    }

    public FakeMailContainer setSentTime(TimestampCandidate sentTime) {
        this.sentTime = sentTime;
        return this;
    }

    public FakeMailContainer addAttachment(RawAttachment attachment) {
        attachments.add(attachment);
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public Optional<String> getSender() {
        return Optional.ofNullable(sender);
    }

    @Override
    public Optional<String> getSenderName() {
        return Optional.ofNullable(senderName);
    }

    @Override
    public Optional<String> getSenderEmail() {
        return Optional.ofNullable(senderEmail);
    }

    @Override
    public Optional<String> getTo() {
        return Optional.ofNullable(to);
    }

    @Override
    public Optional<String> getCc() {
        return Optional.ofNullable(cc);
    }

    @Override
    public Optional<String> getBcc() {
        return Optional.ofNullable(bcc);
    }

    @Override
    public Optional<String> getSubject() {
        return Optional.ofNullable(subject);
    }

    @Override
    public Optional<String> getPlainBody() {
        return Optional.ofNullable(plainBody);
    }

    @Override
    public Optional<String> getHtmlBody() {
        return Optional.ofNullable(htmlBody);
    }

    @Override
    public Optional<TimestampCandidate> getReceivedTime() {
        return Optional.ofNullable(receivedTime);
    }

    @Override
    public Optional<TimestampCandidate> getSentTime() {
        return Optional.ofNullable(sentTime);
    }

    @Override
    public List<RawAttachment> getAttachments() {
        return attachments;
    }

    @Override
    public void close() {
        closed = true;
    }
}
