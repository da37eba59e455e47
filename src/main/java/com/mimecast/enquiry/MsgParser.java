package com.mimecast.enquiry;

import com.mimecast.enquiry.attachments.AttachmentExtractor;
import com.mimecast.enquiry.attachments.ExtractionResult;
import com.mimecast.enquiry.body.BodyMode;
import com.mimecast.enquiry.body.BodyRenderer;
import com.mimecast.enquiry.body.RenderedBody;
import com.mimecast.enquiry.config.ParserConfig;
import com.mimecast.enquiry.container.ContainerOpenException;
import com.mimecast.enquiry.container.ContainerReader;
import com.mimecast.enquiry.container.MailContainer;
import com.mimecast.enquiry.container.msg.PoiMsgContainerReader;
import com.mimecast.enquiry.headers.DateResolver;
import com.mimecast.enquiry.headers.DateSource;
import com.mimecast.enquiry.headers.Direction;
import com.mimecast.enquiry.headers.DirectionClassifier;
import com.mimecast.enquiry.headers.RecipientFormatter;
import com.mimecast.enquiry.headers.ResolvedDate;
import com.mimecast.enquiry.headers.ResolvedSender;
import com.mimecast.enquiry.headers.SenderResolver;
import com.mimecast.enquiry.logging.FileOperationsLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.List;

/**
 * Mail container parser.
 *
 * <p>Opens a container and turns it into a {@link ParsedEmail}:
 * <ol>
 *     <li>Sender and recipients.</li>
 *     <li>Message date.</li>
 *     <li>Direction, reading the body only when addresses are inconclusive.</li>
 *     <li>Body in the requested {@link BodyMode}.</li>
 *     <li>Image and document attachments unless skipped.</li>
 * </ol>
 * <p>The container is closed on every path.
 * <br>Failures come back as a {@link ParseResult} error, nothing is thrown to the caller.
 */
public class MsgParser {
    private static final Logger log = LogManager.getLogger(MsgParser.class);

    private final ContainerReader reader;
    private final SenderResolver senderResolver = new SenderResolver();
    private final DateResolver dateResolver;
    private final DirectionClassifier directionClassifier;
    private final BodyRenderer bodyRenderer = new BodyRenderer();
    private final AttachmentExtractor attachmentExtractor;

    /**
     * Constructs a new MsgParser instance for <i>.msg</i> files.
     *
     * @param config  ParserConfig instance.
     * @param fileLog FileOperationsLog instance.
     */
    public MsgParser(ParserConfig config, FileOperationsLog fileLog) {
        this(new PoiMsgContainerReader(), config, fileLog, Clock.systemUTC());
    }

    /**
     * Constructs a new MsgParser instance.
     *
     * @param reader  ContainerReader instance.
     * @param config  ParserConfig instance.
     * @param fileLog FileOperationsLog instance.
     * @param clock   Clock for date fallback and storage buckets.
     */
    public MsgParser(ContainerReader reader, ParserConfig config, FileOperationsLog fileLog, Clock clock) {
        this.reader = reader;
        this.dateResolver = new DateResolver(List.of(DateSource.RECEIVED, DateSource.SENT),
                config.getLocalTimezone(), config.getDisplayTimezone(), clock);
        this.directionClassifier = new DirectionClassifier(config.getInboxAddress());
        this.attachmentExtractor = new AttachmentExtractor(config, fileLog, clock);
    }

    /**
     * Parses container file.
     *
     * @param path            Container path.
     * @param mode            Body mode.
     * @param skipAttachments Skip attachment extraction.
     * @return ParseResult instance.
     */
    public ParseResult parse(Path path, BodyMode mode, boolean skipAttachments) {
        log.info("Parsing {} mode={} skipAttachments={}", path, mode, skipAttachments);

        MailContainer container;
        try {
            container = reader.open(path);
        } catch (ContainerOpenException e) {
            log.error("Failed to open container {}: {}", path, e.getMessage());
            return ParseResult.error("Failed to open/parse container: " + e.getMessage());
        }

        try (MailContainer open = container) {
            return ParseResult.success(parse(open, mode, skipAttachments));
        } catch (IOException | RuntimeException e) {
            log.error("Error processing container {}: {}", path, e.getMessage(), e);
            return ParseResult.error("General error processing container: " + e.getMessage());
        }
    }

    /**
     * Parses an open container.
     *
     * @param container       MailContainer instance.
     * @param mode            Body mode.
     * @param skipAttachments Skip attachment extraction.
     * @return ParsedEmail instance.
     */
    ParsedEmail parse(MailContainer container, BodyMode mode, boolean skipAttachments) {
        ResolvedSender sender = senderResolver.resolve(container);
        ResolvedDate date = dateResolver.resolve(container);
        Direction direction = directionClassifier.classify(container);

        String plainBody = container.getPlainBody().orElse("");
        RenderedBody body = bodyRenderer.render(mode, plainBody, container.getHtmlBody().orElse(null));

        boolean hasAttachments = !container.getAttachments().isEmpty();
        ExtractionResult extraction = null;
        if (skipAttachments) {
            log.info("Skipping attachment processing as requested");
        } else if (hasAttachments) {
            extraction = attachmentExtractor.extract(container.getAttachments());
        }

        ParsedEmail email = ParsedEmail.builder()
                .setRawFrom(sender.getRawFrom())
                .setEmailFrom(sender.getEmailFrom())
                .setEmailTo(RecipientFormatter.format(container.getTo().orElse("")))
                .setEmailCc(RecipientFormatter.format(container.getCc().orElse("")))
                .setSubject(container.getSubject().orElse(""))
                .setEmailDate(date.getUtc())
                .setEmailDateStr(date.getDisplay())
                .setBodyContent(body.getContent())
                .setDirection(direction)
                .setHasAttachments(hasAttachments)
                .setHtml(body.isHtml())
                .setImageAttachments(extraction != null ? extraction.getRecords() : Collections.emptyList())
                .build();

        log.info("Parsed email from={} direction={} date={} attachments={}",
                email.getEmailFrom(), email.getDirection(), email.getEmailDateStr(), email.getImageAttachments().size());
        return email;
    }
}
