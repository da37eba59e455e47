package com.mimecast.enquiry.body;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.parser.Parser;
import org.jsoup.safety.Safelist;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Conversation thread helpers for history notes.
 *
 * <p>Extracts the most recent message from a reply chain and turns rendered HTML back into readable text.
 */
public class ConversationExtractor {
    private static final Logger log = LogManager.getLogger(ConversationExtractor.class);

    /**
     * Lines marking the start of an earlier message.
     */
    private static final List<Pattern> SEPARATORS = List.of(
            Pattern.compile("From:\\s+\\w+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Sent:\\s+.+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("To:\\s+.+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Subject:\\s+.+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("On\\s+.+wrote:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("On\\s+.+said:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("_{10,}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("-{5,}Original Message-{5,}", Pattern.CASE_INSENSITIVE),
            Pattern.compile("-{3,}\\s*Original Message\\s*-{3,}", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Plain split markers used when line scanning yields too little.
     */
    private static final List<String> FALLBACK_SEPARATORS = List.of("From:", "Sent:", "-----Original", "--- Original");

    private static final Pattern MULTI_BREAK = Pattern.compile("(<br\\s*/?>\\s*){2,}", Pattern.CASE_INSENSITIVE);
    private static final Pattern SINGLE_BREAK = Pattern.compile("<br\\s*/?>", Pattern.CASE_INSENSITIVE);
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n\\s*\n\\s*\n+");
    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \t]+");
    private static final Pattern LEFTOVER_ENTITY = Pattern.compile("&[a-zA-Z0-9#]+;");

    /**
     * Extracts the most recent message of a thread.
     *
     * @param body Rendered body, plain or HTML.
     * @return Latest message, or the whole body when extraction yields too little.
     */
    public String extractLatest(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }

        String text = body;
        if (text.contains("<") && text.contains(">")) {
            text = htmlToText(text);
        }

        List<String> latest = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            if (latest.isEmpty() && stripped.isEmpty()) {
                continue;
            }

            if (isSeparator(stripped)) {
                log.debug("Conversation separator found: {}", stripped);
                break;
            }
            if (stripped.startsWith(">")) {
                log.debug("Quoted text found: {}", stripped);
                break;
            }

            latest.add(line);
        }

        String result = EXCESS_BLANK_LINES.matcher(String.join("\n", latest).strip()).replaceAll("\n\n");
        List<String> trimmed = new ArrayList<>();
        for (String line : result.split("\n", -1)) {
            trimmed.add(line.stripTrailing());
        }
        result = LEFTOVER_ENTITY.matcher(String.join("\n", trimmed)).replaceAll("").strip();

        if (result.length() < 50 && text.length() > 100) {
            for (String separator : FALLBACK_SEPARATORS) {
                int index = text.indexOf(separator);
                if (index >= 0) {
                    String head = text.substring(0, index).strip();
                    if (head.length() > 50) {
                        result = head;
                        break;
                    }
                }
            }
        }

        return result.length() > 10 ? result : text;
    }

    /**
     * Converts rendered HTML to readable plain text.
     *
     * @param html HTML content.
     * @return Plain text.
     */
    public String cleanHtmlForDisplay(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }

        String text = htmlToText(html);
        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
        text = HORIZONTAL_SPACE.matcher(text).replaceAll(" ");

        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.strip());
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }

        return String.join("\n", lines);
    }

    /**
     * Turns breaks into newlines then drops all markup keeping text.
     *
     * @param html HTML.
     * @return Text.
     */
    private static String htmlToText(String html) {
        String text = MULTI_BREAK.matcher(html).replaceAll("\n\n");
        text = SINGLE_BREAK.matcher(text).replaceAll("\n");

        String clean = Jsoup.clean(text, "", Safelist.none(), new Document.OutputSettings().prettyPrint(false));
        return Parser.unescapeEntities(clean, false);
    }

    private static boolean isSeparator(String line) {
        for (Pattern pattern : SEPARATORS) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }
}
