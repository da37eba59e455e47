package com.mimecast.enquiry.body;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Wraps quoted reply blocks in escaped, break joined HTML.
 *
 * <p>A block is a maximal run of consecutive lines starting with <i>&amp;gt;</i>.
 * <br>One quote marker is removed from each line and the block is placed in a quote container.
 */
public class QuoteWrapper {

    /**
     * Escaped quote marker.
     */
    public static final String MARKER = "&gt;";

    /**
     * Line separator in the HTML being wrapped.
     */
    public static final String BREAK = "<br>";

    /**
     * Quote container opening tag.
     */
    public static final String OPEN = "<div class=\"email-quote\">";

    /**
     * Quote container closing tag.
     */
    public static final String CLOSE = "</div>";

    private static final Pattern BREAK_SPLIT = Pattern.compile(Pattern.quote(BREAK));

    /**
     * Protected constructor.
     */
    private QuoteWrapper() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Wraps quote blocks.
     *
     * @param html Escaped HTML joined with breaks.
     * @return HTML with quote containers.
     */
    public static String wrap(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }

        String[] lines = BREAK_SPLIT.split(html, -1);
        List<String> output = new ArrayList<>();
        List<String> block = new ArrayList<>();

        for (String line : lines) {
            if (line.startsWith(MARKER)) {
                block.add(unquote(line));
                continue;
            }

            flush(block, output);
            output.add(line);
        }
        flush(block, output);

        return String.join(BREAK, output);
    }

    private static void flush(List<String> block, List<String> output) {
        if (!block.isEmpty()) {
            output.add(OPEN + String.join(BREAK, block) + CLOSE);
            block.clear();
        }
    }

    private static String unquote(String line) {
        if (line.startsWith(MARKER + " ")) {
            return line.substring(MARKER.length() + 1);
        }
        return line.substring(MARKER.length());
    }
}
