package com.mimecast.enquiry.body;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rebuilds paragraph structure from flat mail client text.
 *
 * <p>Line pairs are classified by heuristics tuned against real mailbox content.
 * <br>They are known to misfire occasionally and are kept exactly as tuned.
 * <p>Output is a list of trimmed non-empty lines where an empty string marks a paragraph break.
 */
public class ParagraphReconstructor {

    /**
     * Lines shorter than this are candidates for ending a paragraph.
     */
    public static final int SHORT_LINE_LENGTH = 15;

    /**
     * Line endings that close a short paragraph.
     */
    public static final String TERMINAL_PUNCTUATION = ".!?:;";

    /**
     * Whole line closing words.
     */
    public static final Set<String> CLOSING_WORDS = Set.of("thanks", "Thanks", "regards", "Regards");

    /**
     * Words marking the start of a signature block.
     */
    public static final List<String> SIGNATURE_KEYWORDS = List.of("Team", "Department", "Officer");

    /**
     * Two word capitalised full name.
     */
    private static final Pattern FULL_NAME = Pattern.compile("^[A-Z][a-z]+ [A-Z][a-z]+$");

    /**
     * Forwarded or replied message header.
     */
    private static final Pattern FROM_HEADER = Pattern.compile("^From:", Pattern.CASE_INSENSITIVE);

    private static final Pattern LINE_ENDINGS = Pattern.compile("\r\n|\r");
    private static final Pattern BLANK_LINE = Pattern.compile("\n[ \t]+\n");

    /**
     * Protected constructor.
     */
    private ParagraphReconstructor() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Normalises line endings to a newline and collapses whitespace only lines.
     *
     * @param text Text.
     * @return Normalised text.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }

        String normalized = LINE_ENDINGS.matcher(text).replaceAll("\n");
        return BLANK_LINE.matcher(normalized).replaceAll("\n");
    }

    /**
     * Normalises and reconstructs text.
     *
     * @param text Text.
     * @return Lines with empty string paragraph markers.
     */
    public static List<String> reconstruct(String text) {
        return reconstruct(List.of(normalize(text).split("\n", -1)));
    }

    /**
     * Reconstructs paragraph markers between lines.
     *
     * @param lines Raw lines.
     * @return Lines with empty string paragraph markers.
     */
    public static List<String> reconstruct(List<String> lines) {
        List<String> processed = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) {
                i++;
                continue;
            }

            processed.add(line);

            int next = nextContentIndex(lines, i + 1);
            if (next < lines.size()) {
                String nextLine = lines.get(next).strip();
                if (needsParagraphBreak(line, nextLine)) {
                    processed.add("");
                }
                if (isHeaderLine(nextLine)) {
                    processed.add("");
                }
            }

            i = next;
        }

        return processed;
    }

    /**
     * Decides if a paragraph break goes between two adjacent content lines.
     *
     * @param line     Current line, trimmed.
     * @param nextLine Next content line, trimmed.
     * @return Boolean.
     */
    static boolean needsParagraphBreak(String line, String nextLine) {
        if (CLOSING_WORDS.contains(line)) {
            return true;
        }

        if (line.length() >= SHORT_LINE_LENGTH) {
            return false;
        }

        if (!line.isEmpty() && TERMINAL_PUNCTUATION.indexOf(line.charAt(line.length() - 1)) >= 0) {
            return true;
        }

        return isSignatureStart(nextLine);
    }

    /**
     * Signature start heuristic.
     *
     * @param line Line.
     * @return Boolean.
     */
    static boolean isSignatureStart(String line) {
        if (FULL_NAME.matcher(line).matches()) {
            return true;
        }

        for (String keyword : SIGNATURE_KEYWORDS) {
            if (line.contains(keyword)) {
                return true;
            }
        }

        return false;
    }

    /**
     * Is email header boundary.
     *
     * @param line Line.
     * @return Boolean.
     */
    static boolean isHeaderLine(String line) {
        return FROM_HEADER.matcher(line).find();
    }

    private static int nextContentIndex(List<String> lines, int start) {
        int j = start;
        while (j < lines.size() && lines.get(j).isBlank()) {
            j++;
        }
        return j;
    }
}
