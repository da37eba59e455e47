/**
 * Legacy mail container conversion for the members enquiry system.
 *
 * <p>{@link com.mimecast.enquiry.MsgParser} turns one <i>.msg</i> file into a {@link com.mimecast.enquiry.ParsedEmail}
 * with resolved sender, recipients, date, direction, rendered body and stored attachments.
 *
 * <h2>Usage</h2>
 * <pre>
 *     MsgParser parser = new MsgParser(new ParserConfig("cfg/parser.json5"), new Log4jFileOperationsLog());
 *     ParseResult result = parser.parse(Paths.get("message.msg"), BodyMode.FULL, false);
 *     result.getEmail().ifPresent(email -&gt; System.out.println(email.getEmailFrom()));
 * </pre>
 *
 * <p>Uploads go through {@link com.mimecast.enquiry.EmailFileService} which validates before parsing.
 * <p>Parsing is stateless and safe to run concurrently. Attachment names are random UUIDs.
 */
package com.mimecast.enquiry;
