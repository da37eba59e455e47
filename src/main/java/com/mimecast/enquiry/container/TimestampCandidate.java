package com.mimecast.enquiry.container;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Timestamp read from a container.
 *
 * <p>Containers store some times with a zone and others as bare wall clock values.
 * <br>Bare values are localized against the deployment zone when resolved.
 */
public final class TimestampCandidate {

    /**
     * Wall clock value when naive.
     */
    private final LocalDateTime naive;

    /**
     * Zoned value when aware.
     */
    private final ZonedDateTime aware;

    private TimestampCandidate(LocalDateTime naive, ZonedDateTime aware) {
        this.naive = naive;
        this.aware = aware;
    }

    /**
     * Creates a timezone-less candidate.
     *
     * @param value Wall clock value.
     * @return TimestampCandidate.
     */
    public static TimestampCandidate naive(LocalDateTime value) {
        return new TimestampCandidate(Objects.requireNonNull(value, "value"), null);
    }

    /**
     * Creates a timezone-aware candidate.
     *
     * @param value Zoned value.
     * @return TimestampCandidate.
     */
    public static TimestampCandidate aware(ZonedDateTime value) {
        return new TimestampCandidate(null, Objects.requireNonNull(value, "value"));
    }

    /**
     * Is timezone-aware.
     *
     * @return Boolean.
     */
    public boolean isAware() {
        return aware != null;
    }

    /**
     * Resolves to a zoned value.
     * <p>Aware values are returned as-is, naive ones are placed in the given zone.
     *
     * @param localZone Zone assumed for naive values.
     * @return ZonedDateTime.
     */
    public ZonedDateTime resolve(ZoneId localZone) {
        return aware != null ? aware : naive.atZone(localZone);
    }

    @Override
    public String toString() {
        return aware != null ? aware.toString() : naive.toString();
    }
}
