package com.mimecast.enquiry.headers;

import java.time.ZonedDateTime;

/**
 * Date resolution result.
 */
public class ResolvedDate {

    /**
     * UTC instant.
     */
    private final ZonedDateTime utc;

    /**
     * Display string in the display zone.
     */
    private final String display;

    /**
     * True when no container source was usable and the current time was taken.
     */
    private final boolean fallback;

    /**
     * Constructs a new ResolvedDate instance.
     *
     * @param utc      UTC date time.
     * @param display  Display string.
     * @param fallback Fallback flag.
     */
    public ResolvedDate(ZonedDateTime utc, String display, boolean fallback) {
        this.utc = utc;
        this.display = display;
        this.fallback = fallback;
    }

    public ZonedDateTime getUtc() {
        return utc;
    }

    public String getDisplay() {
        return display;
    }

    public boolean isFallback() {
        return fallback;
    }
}
