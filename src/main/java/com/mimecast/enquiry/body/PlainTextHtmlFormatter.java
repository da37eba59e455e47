package com.mimecast.enquiry.body;

import org.jsoup.nodes.Entities;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts plain mail text into display HTML.
 *
 * <p>Paragraphs are rebuilt, content is escaped, earlier messages in the thread are separated by a rule
 * and quoted blocks are wrapped.
 */
public class PlainTextHtmlFormatter {

    /**
     * Reply and forward header lines, optionally quoted.
     */
    private static final Pattern REPLY_HEADER = Pattern.compile(
            "^\\s*(&gt;\\s*)*(From|Sent|To|Subject|Date|Original Message|Forwarded message):",
            Pattern.CASE_INSENSITIVE);

    /**
     * Dash or underscore separator lines.
     */
    private static final Pattern SEPARATOR_LINE = Pattern.compile("^\\s*(-{5,}|_{5,})\\s*$");

    /**
     * Separators are ignored within the first lines of the message.
     */
    private static final int SEPARATOR_MIN_INDEX = 3;

    /**
     * Protected constructor.
     */
    private PlainTextHtmlFormatter() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Formats plain text as HTML.
     *
     * @param text Plain text, banners and links already removed.
     * @return HTML string, empty if no text.
     */
    public static String format(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        List<String> escaped = new ArrayList<>();
        for (String line : ParagraphReconstructor.reconstruct(text)) {
            escaped.add(Entities.escape(line));
        }

        return QuoteWrapper.wrap(buildParagraphs(insertReplySeparators(escaped)));
    }

    /**
     * Inserts a rule before reply headers or separator lines that start a new paragraph.
     *
     * @param lines Escaped lines with paragraph markers.
     * @return Lines with rules.
     */
    static List<String> insertReplySeparators(List<String> lines) {
        List<String> html = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean boundary = REPLY_HEADER.matcher(line).find() || SEPARATOR_LINE.matcher(line).matches();
            if (i >= SEPARATOR_MIN_INDEX && boundary && !html.isEmpty() && html.get(html.size() - 1).isBlank()) {
                html.add("<hr>");
            }
            html.add(line);
        }

        return html;
    }

    /**
     * Joins lines with breaks, paragraphs with double breaks.
     *
     * @param lines Lines with paragraph markers.
     * @return HTML string.
     */
    static String buildParagraphs(List<String> lines) {
        List<String> paragraphs = new ArrayList<>();
        List<String> current = new ArrayList<>();

        for (String line : lines) {
            if (line.isEmpty()) {
                if (!current.isEmpty()) {
                    paragraphs.add(String.join(QuoteWrapper.BREAK, current));
                    current.clear();
                }
            } else {
                current.add(line);
            }
        }

        if (!current.isEmpty()) {
            paragraphs.add(String.join(QuoteWrapper.BREAK, current));
        }

        return String.join(QuoteWrapper.BREAK + QuoteWrapper.BREAK, paragraphs);
    }
}
