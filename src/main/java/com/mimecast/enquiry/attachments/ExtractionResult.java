package com.mimecast.enquiry.attachments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Extraction outcome split into stored records and per attachment failures.
 *
 * <p>Records keep container order.
 */
public class ExtractionResult {

    private final List<AttachmentRecord> records = new ArrayList<>();
    private final List<AttachmentFailure> failures = new ArrayList<>();

    /**
     * Adds record.
     *
     * @param record AttachmentRecord instance.
     * @return Self.
     */
    ExtractionResult addRecord(AttachmentRecord record) {
        records.add(record);
        return this;
    }

    /**
     * Adds failure.
     *
     * @param failure AttachmentFailure instance.
     * @return Self.
     */
    ExtractionResult addFailure(AttachmentFailure failure) {
        failures.add(failure);
        return this;
    }

    public List<AttachmentRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public List<AttachmentFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }
}
