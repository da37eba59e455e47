package com.mimecast.enquiry.body;

/**
 * Rendered body content.
 */
public class RenderedBody {
    private final String content;
    private final boolean html;

    /**
     * Constructs a new RenderedBody instance.
     *
     * @param content Content.
     * @param html    True when content is HTML.
     */
    public RenderedBody(String content, boolean html) {
        this.content = content;
        this.html = html;
    }

    public String getContent() {
        return content;
    }

    public boolean isHtml() {
        return html;
    }
}
