package com.mimecast.enquiry.body;

import java.util.regex.Pattern;

/**
 * Removes auto-linked URLs of the form <i>&lt;https://...&gt;</i>.
 *
 * <p>Bracketed email addresses are left alone.
 */
public class LinkStripper {

    private static final Pattern ANGLE_LINK = Pattern.compile("<https?://[^>]+>");

    /**
     * Protected constructor.
     */
    private LinkStripper() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Strips angle bracket links.
     *
     * @param text Text, may be null.
     * @return Text without links.
     */
    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        return ANGLE_LINK.matcher(text).replaceAll("");
    }
}
