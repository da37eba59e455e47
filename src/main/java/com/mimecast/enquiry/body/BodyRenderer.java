package com.mimecast.enquiry.body;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.regex.Pattern;

/**
 * Renders message bodies in one of the three presentation modes.
 *
 * <ul>
 *     <li>{@link BodyMode#SNIPPET} Banner free plain text cut to {@value #SNIPPET_LIMIT} characters.</li>
 *     <li>{@link BodyMode#PLAIN} Banner free plain text with rebuilt paragraphs.</li>
 *     <li>{@link BodyMode#FULL} Native HTML when present, otherwise plain text converted to HTML.</li>
 * </ul>
 */
public class BodyRenderer {
    private static final Logger log = LogManager.getLogger(BodyRenderer.class);

    /**
     * Snippet maximum length including ellipsis.
     */
    public static final int SNIPPET_LIMIT = 250;

    /**
     * Snippet ellipsis.
     */
    public static final String ELLIPSIS = "...";

    private static final Pattern EXCESS_BREAKS = Pattern.compile("\n{3,}");

    /**
     * Renders body.
     *
     * @param mode      Presentation mode.
     * @param plainBody Plain text body, may be null.
     * @param htmlBody  Native HTML body, may be null.
     * @return RenderedBody instance.
     */
    public RenderedBody render(BodyMode mode, String plainBody, String htmlBody) {
        String plain = plainBody != null ? plainBody : "";
        RenderedBody body;
        switch (mode) {
            case SNIPPET:
                body = new RenderedBody(snippet(plain), false);
                break;
            case PLAIN:
                body = new RenderedBody(plain(plain), false);
                break;
            case FULL:
            default:
                body = new RenderedBody(full(plain, htmlBody), true);
                break;
        }

        log.debug("Rendered {} body: length={} html={}", mode, body.getContent().length(), body.isHtml());
        return body;
    }

    /**
     * Snippet rendering.
     *
     * @param plain Plain text.
     * @return Snippet.
     */
    String snippet(String plain) {
        String text = collapseBreaks(ParagraphReconstructor.normalize(BannerStripper.strip(plain)));
        // Limits count code points so surrogate pairs are never split.
        if (text.codePointCount(0, text.length()) > SNIPPET_LIMIT) {
            text = text.substring(0, text.offsetByCodePoints(0, SNIPPET_LIMIT - ELLIPSIS.length())) + ELLIPSIS;
        }

        return StringUtils.stripStart(text, null);
    }

    /**
     * Plain rendering.
     *
     * @param plain Plain text.
     * @return Plain text with paragraphs.
     */
    String plain(String plain) {
        String joined = String.join("\n", ParagraphReconstructor.reconstruct(BannerStripper.strip(plain)));
        return collapseBreaks(joined.strip());
    }

    /**
     * Full rendering.
     *
     * @param plain Plain text.
     * @param html  Native HTML, may be null.
     * @return HTML.
     */
    String full(String plain, String html) {
        if (StringUtils.isNotEmpty(html)) {
            log.debug("Using native HTML body");
            return BannerStripper.strip(html);
        }

        return PlainTextHtmlFormatter.format(LinkStripper.strip(BannerStripper.strip(plain)));
    }

    private static String collapseBreaks(String text) {
        return EXCESS_BREAKS.matcher(text).replaceAll("\n\n");
    }
}
