/**
 * Enquiry creation from parsed emails.
 *
 * <p>{@link com.mimecast.enquiry.enquiry.EnquiryDraftFactory} matches the sender to an active member
 * through a {@link com.mimecast.enquiry.enquiry.MemberDirectory} supplied by the caller.
 * <br>{@link com.mimecast.enquiry.enquiry.HistoryEntryBuilder} prepares follow up emails for the enquiry history.
 */
package com.mimecast.enquiry.enquiry;
