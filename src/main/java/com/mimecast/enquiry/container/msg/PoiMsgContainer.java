package com.mimecast.enquiry.container.msg;

import com.mimecast.enquiry.container.MailContainer;
import com.mimecast.enquiry.container.RawAttachment;
import com.mimecast.enquiry.container.TimestampCandidate;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.hsmf.MAPIMessage;
import org.apache.poi.hsmf.datatypes.AttachmentChunks;
import org.apache.poi.hsmf.datatypes.MAPIProperty;
import org.apache.poi.hsmf.datatypes.PropertyValue;
import org.apache.poi.hsmf.datatypes.StringChunk;
import org.apache.poi.hsmf.exceptions.ChunkNotFoundException;

import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * MailContainer view over a POI {@link MAPIMessage}.
 *
 * <p>Transport headers are preferred for addressing fields as they carry both names and addresses.
 * <br>The MAPI display fields, which only hold names, are used when headers are missing.
 */
class PoiMsgContainer implements MailContainer {
    private static final Logger log = LogManager.getLogger(PoiMsgContainer.class);

    /**
     * Underlying message.
     */
    private final MAPIMessage message;

    /**
     * Unfolded transport headers keyed by lower case name, first occurrence wins.
     */
    private final Map<String, String> headers;

    /**
     * Constructs a new PoiMsgContainer instance.
     *
     * @param message MAPIMessage instance.
     */
    PoiMsgContainer(MAPIMessage message) {
        this.message = message;
        this.headers = readHeaders();
    }

    @Override
    public Optional<String> getSender() {
        Optional<String> header = header("from");
        return header.isPresent() ? header : chunk(message::getDisplayFrom);
    }

    @Override
    public Optional<String> getSenderName() {
        return chunk(message::getDisplayFrom);
    }

    @Override
    public Optional<String> getSenderEmail() {
        StringChunk emailFrom = message.getMainChunks().getEmailFromChunk();
        if (emailFrom == null) {
            return Optional.empty();
        }

        // Exchange senders carry X.500 paths here rather than SMTP addresses.
        String value = emailFrom.getValue();
        return value != null && value.contains("@") ? Optional.of(value.trim()) : Optional.empty();
    }

    @Override
    public Optional<String> getTo() {
        Optional<String> header = header("to");
        return header.isPresent() ? header : chunk(message::getDisplayTo);
    }

    @Override
    public Optional<String> getCc() {
        Optional<String> header = header("cc");
        return header.isPresent() ? header : chunk(message::getDisplayCC);
    }

    @Override
    public Optional<String> getBcc() {
        Optional<String> header = header("bcc");
        return header.isPresent() ? header : chunk(message::getDisplayBCC);
    }

    @Override
    public Optional<String> getSubject() {
        return chunk(message::getSubject);
    }

    @Override
    public Optional<String> getPlainBody() {
        return chunk(message::getTextBody);
    }

    @Override
    public Optional<String> getHtmlBody() {
        return chunk(message::getHtmlBody);
    }

    @Override
    public Optional<TimestampCandidate> getReceivedTime() {
        List<PropertyValue> values = message.getMainChunks().getProperties().get(MAPIProperty.MESSAGE_DELIVERY_TIME);
        if (values == null || values.isEmpty() || !(values.get(0) instanceof PropertyValue.TimePropertyValue)) {
            return Optional.empty();
        }

        Calendar calendar = ((PropertyValue.TimePropertyValue) values.get(0)).getValue();
        return Optional.ofNullable(calendar).map(PoiMsgContainer::toCandidate);
    }

    @Override
    public Optional<TimestampCandidate> getSentTime() {
        return chunk(message::getMessageDate).map(PoiMsgContainer::toCandidate);
    }

    @Override
    public List<RawAttachment> getAttachments() {
        AttachmentChunks[] chunks = message.getAttachmentFiles();
        if (chunks == null || chunks.length == 0) {
            return Collections.emptyList();
        }

        List<RawAttachment> attachments = new ArrayList<>(chunks.length);
        for (AttachmentChunks chunk : chunks) {
            attachments.add(new RawAttachment(
                    chunk.getAttachLongFileName() != null ? chunk.getAttachLongFileName().getValue() : null,
                    chunk.getAttachFileName() != null ? chunk.getAttachFileName().getValue() : null,
                    chunk.getAttachData() != null ? chunk.getAttachData().getValue() : null
            ));
        }

        return attachments;
    }

    @Override
    public void close() throws IOException {
        message.close();
    }

    /**
     * Reads and unfolds transport headers.
     *
     * @return Map of lower case name to value.
     */
    private Map<String, String> readHeaders() {
        Map<String, String> map = new LinkedHashMap<>();
        Optional<String[]> lines = chunk(message::getHeaders);
        if (lines.isEmpty()) {
            return map;
        }

        String name = null;
        StringBuilder value = new StringBuilder();
        for (String line : lines.get()) {
            if (line == null || line.isEmpty()) {
                continue;
            }

            if (Character.isWhitespace(line.charAt(0)) && name != null) {
                value.append(' ').append(line.trim());
                continue;
            }

            putHeader(map, name, value);
            int colon = line.indexOf(':');
            if (colon > 0) {
                name = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
                value = new StringBuilder(line.substring(colon + 1).trim());
            } else {
                name = null;
                value = new StringBuilder();
            }
        }
        putHeader(map, name, value);

        return map;
    }

    private static void putHeader(Map<String, String> map, String name, StringBuilder value) {
        if (name != null && !map.containsKey(name)) {
            map.put(name, value.toString());
        }
    }

    private Optional<String> header(String name) {
        String value = headers.get(name);
        return StringUtils.isNotBlank(value) ? Optional.of(value) : Optional.empty();
    }

    private static TimestampCandidate toCandidate(Calendar calendar) {
        return TimestampCandidate.aware(ZonedDateTime.ofInstant(calendar.toInstant(), calendar.getTimeZone().toZoneId()));
    }

    /**
     * Reads a chunk treating missing chunks as absent.
     *
     * @param reader Chunk accessor.
     * @param <T>    Value type.
     * @return Optional value.
     */
    private static <T> Optional<T> chunk(ChunkReader<T> reader) {
        try {
            T value = reader.read();
            if (value instanceof String && ((String) value).isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(value);
        } catch (ChunkNotFoundException e) {
            return Optional.empty();
        } catch (RuntimeException e) {
            log.debug("Unreadable chunk: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Chunk accessor throwing POI's checked missing chunk exception.
     *
     * @param <T> Value type.
     */
    @FunctionalInterface
    private interface ChunkReader<T> {
        T read() throws ChunkNotFoundException;
    }
}
