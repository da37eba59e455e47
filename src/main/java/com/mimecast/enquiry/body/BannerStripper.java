package com.mimecast.enquiry.body;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Removes external mail warning banners injected by mail infrastructure.
 *
 * <p>Works line by line. Matching lines are dropped, every other line is kept verbatim.
 */
public class BannerStripper {

    /**
     * Opening sentence of the external mail warning, matched case-insensitively when stripping.
     */
    public static final String EXTERNAL_WARNING_LINE = "WARNING: This email came from outside of the organisation.";

    /**
     * Complete external mail warning, matched verbatim when detecting direction.
     */
    public static final String EXTERNAL_WARNING = EXTERNAL_WARNING_LINE
            + " Do not provide login or password details."
            + " Always be cautious opening links and attachments wherever the email appears to come from."
            + " If you have any doubts about this email, contact ICT.";

    /**
     * Start of the infrequent sender notice.
     */
    public static final String INFREQUENT_SENDER_START = "You don't often get email from";

    /**
     * End of the infrequent sender notice.
     */
    public static final String INFREQUENT_SENDER_END = "Learn why this is important";

    /**
     * Infrequent sender notice as a whole.
     */
    public static final Pattern INFREQUENT_SENDER = Pattern.compile(
            "You don't often get email from [\\s\\S]+?\\. Learn why this is important\\.",
            Pattern.CASE_INSENSITIVE);

    private static final String WARNING_LOWER = EXTERNAL_WARNING_LINE.toLowerCase(Locale.ROOT);
    private static final String START_LOWER = INFREQUENT_SENDER_START.toLowerCase(Locale.ROOT);
    private static final String END_LOWER = INFREQUENT_SENDER_END.toLowerCase(Locale.ROOT);

    /**
     * Protected constructor.
     */
    private BannerStripper() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Strips banner lines.
     *
     * @param text Text, may be null.
     * @return Text without banner lines, lines joined with a newline.
     */
    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains(WARNING_LOWER)) {
                continue;
            }
            if (lower.contains(START_LOWER) && lower.contains(END_LOWER)) {
                continue;
            }
            lines.add(line);
        }

        return String.join("\n", lines);
    }
}
