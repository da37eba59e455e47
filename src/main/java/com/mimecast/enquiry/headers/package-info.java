/**
 * Header level resolution of sender, recipients, date and direction.
 *
 * <p>Each resolver works on a {@link com.mimecast.enquiry.container.MailContainer} or its raw field values.
 * <br>None of them throws on malformed input.
 *
 * <h2>Sender</h2>
 * <pre>
 *     new SenderResolver().resolve("John Smith &lt;john@example.com&gt;", "", "").getEmailFrom();
 *     // John Smith &lt;john@example.com&gt;
 * </pre>
 *
 * <h2>Date</h2>
 * <p>Received time wins over sent time.
 * <br>Without either the current time is used and a warning is logged.
 *
 * <h2>Direction</h2>
 * <p>Incoming when the monitored inbox is a recipient or when the body opens with an external mail banner.
 */
package com.mimecast.enquiry.headers;
