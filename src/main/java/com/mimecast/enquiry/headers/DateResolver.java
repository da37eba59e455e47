package com.mimecast.enquiry.headers;

import com.mimecast.enquiry.container.MailContainer;
import com.mimecast.enquiry.container.TimestampCandidate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the authoritative message timestamp.
 *
 * <p>Sources are tried in order and the first one yielding a value wins.
 * <br>Naive values are taken to be in the configured local zone.
 * <br>The result is stored in UTC and displayed in the display zone, e.g. <i>Jun 15, 2024 10:00 BST</i>.
 * <p>Resolution never throws: with no usable source, or on any error, the current time is used.
 */
public class DateResolver {
    private static final Logger log = LogManager.getLogger(DateResolver.class);

    /**
     * Date and time part of the display string.
     */
    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("MMM dd, yyyy HH:mm", Locale.ENGLISH);

    /**
     * Zone abbreviation part of the display string, UK locale for GMT/BST.
     */
    private static final DateTimeFormatter ZONE_FORMAT = DateTimeFormatter.ofPattern("zzz", Locale.UK);

    private final List<DateSource> sources;
    private final ZoneId localZone;
    private final ZoneId displayZone;
    private final Clock clock;

    /**
     * Constructs a new DateResolver instance with the default source order.
     *
     * @param localZone   Zone for naive values.
     * @param displayZone Zone for display string.
     */
    public DateResolver(ZoneId localZone, ZoneId displayZone) {
        this(List.of(DateSource.RECEIVED, DateSource.SENT), localZone, displayZone, Clock.systemUTC());
    }

    /**
     * Constructs a new DateResolver instance.
     *
     * @param sources     Sources in priority order.
     * @param localZone   Zone for naive values.
     * @param displayZone Zone for display string.
     * @param clock       Clock for the fallback.
     */
    public DateResolver(List<DateSource> sources, ZoneId localZone, ZoneId displayZone, Clock clock) {
        this.sources = List.copyOf(sources);
        this.localZone = localZone;
        this.displayZone = displayZone;
        this.clock = clock;
    }

    /**
     * Resolves the message date.
     *
     * @param container MailContainer instance.
     * @return ResolvedDate instance.
     */
    public ResolvedDate resolve(MailContainer container) {
        try {
            for (DateSource source : sources) {
                Optional<TimestampCandidate> candidate = source.read(container);
                if (candidate.isPresent()) {
                    ZonedDateTime utc = candidate.get().resolve(localZone).withZoneSameInstant(ZoneOffset.UTC);
                    return new ResolvedDate(utc, format(utc), false);
                }
            }
            log.warn("Could not parse date from container: no valid date property found");
        } catch (RuntimeException e) {
            log.warn("Could not parse date from container: {}", e.getMessage());
        }

        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(ZoneOffset.UTC);
        return new ResolvedDate(now, format(now), true);
    }

    /**
     * Formats an instant for display in the display zone.
     *
     * @param utc Date time.
     * @return Display string.
     */
    public String format(ZonedDateTime utc) {
        ZonedDateTime local = utc.withZoneSameInstant(displayZone);
        return DISPLAY_FORMAT.format(local) + " " + ZONE_FORMAT.format(local);
    }
}
