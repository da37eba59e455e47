/**
 * Attachment extraction.
 *
 * <p>Attachments are classified by extension into images and documents, everything else is ignored.
 * <br>Images over the size threshold are resized before storage.
 *
 * <p>Storage layout under the configured root:
 * <pre>
 *     enquiry_photos/2024/06/15/3f1c...9a.jpg
 *     enquiry_attachments/documents/2024/06/15/77b2...e0.pdf
 * </pre>
 * <p>The date is the processing date, not the message date.
 */
package com.mimecast.enquiry.attachments;
