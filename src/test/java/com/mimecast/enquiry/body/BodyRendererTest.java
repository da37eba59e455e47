package com.mimecast.enquiry.body;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BodyRendererTest {

    private final BodyRenderer renderer = new BodyRenderer();

    @Test
    void snippetTruncatesLongBody() {
        String body = "Lorem ipsum dolor sit amet. ".repeat(20);

        RenderedBody snippet = renderer.render(BodyMode.SNIPPET, body, null);
        assertFalse(snippet.isHtml());
        assertEquals(BodyRenderer.SNIPPET_LIMIT, snippet.getContent().length());
        assertTrue(snippet.getContent().endsWith(BodyRenderer.ELLIPSIS));
        assertEquals(body.substring(0, 247), snippet.getContent().substring(0, 247));
    }

    @Test
    void snippetKeepsShortBody() {
        String body = "Dear Councillor,\n\nThe bins on Station Road were missed again.";

        assertEquals(body, renderer.render(BodyMode.SNIPPET, body, null).getContent());
        assertEquals(body, renderer.render(BodyMode.SNIPPET, body, "<p>ignored</p>").getContent());
    }

    @Test
    void snippetAtLimitIsNotTruncated() {
        String body = "a".repeat(BodyRenderer.SNIPPET_LIMIT);

        assertEquals(body, renderer.render(BodyMode.SNIPPET, body, null).getContent());
    }

    @Test
    void snippetKeepsSurrogatePairsWhole() {
        String body = "a".repeat(246) + "\uD83D\uDE00" + "b".repeat(20);

        String content = renderer.render(BodyMode.SNIPPET, body, null).getContent();
        assertEquals("a".repeat(246) + "\uD83D\uDE00" + BodyRenderer.ELLIPSIS, content);
        assertEquals(BodyRenderer.SNIPPET_LIMIT, content.codePointCount(0, content.length()));
    }

    @Test
    void snippetCountsCharactersNotCodeUnits() {
        String body = "\uD83D\uDE00".repeat(BodyRenderer.SNIPPET_LIMIT);

        assertEquals(body, renderer.render(BodyMode.SNIPPET, body, null).getContent());
    }

    @Test
    void snippetStripsBannerAndLeadingWhitespace() {
        String body = BannerStripper.EXTERNAL_WARNING + "\r\n\r\n   Hello there\r\nSecond line";

        assertEquals("Hello there\nSecond line", renderer.render(BodyMode.SNIPPET, body, null).getContent());
    }

    @Test
    void snippetCollapsesBreaks() {
        assertEquals("First\n\nSecond", renderer.render(BodyMode.SNIPPET, "First\n\n\n\nSecond", null).getContent());
    }

    @Test
    void plainRebuildsParagraphs() {
        RenderedBody plain = renderer.render(BodyMode.PLAIN,
                BannerStripper.EXTERNAL_WARNING + "\nHello.\nThis is a long line of text here\nThanks\nJohn Smith", null);

        assertFalse(plain.isHtml());
        assertEquals("Hello.\n\nThis is a long line of text here\nThanks\n\nJohn Smith", plain.getContent());
    }

    @Test
    void fullUsesNativeHtml() {
        String html = "<p>" + BannerStripper.EXTERNAL_WARNING + "</p>\n<p>Hello</p>";

        RenderedBody full = renderer.render(BodyMode.FULL, "Hello", html);
        assertTrue(full.isHtml());
        assertEquals("<p>Hello</p>", full.getContent());
    }

    @Test
    void fullWrapsQuotes() {
        RenderedBody full = renderer.render(BodyMode.FULL, "Reply text\n\n> quoted line one\n> quoted line two", null);

        assertTrue(full.isHtml());
        assertTrue(full.getContent().contains(QuoteWrapper.OPEN + "quoted line one<br>quoted line two" + QuoteWrapper.CLOSE),
                full.getContent());
        assertFalse(full.getContent().contains("&gt;"));
    }

    @Test
    void fullEscapesAndStripsLinks() {
        RenderedBody full = renderer.render(BodyMode.FULL,
                "Prices are < 5 & rising fast\nSee the page <https://example.com/page> today", null);

        assertTrue(full.getContent().contains("Prices are &lt; 5 &amp; rising fast"), full.getContent());
        assertFalse(full.getContent().contains("example.com"));
    }

    @Test
    void fullSeparatesReplies() {
        String body = "Hi Bob,\nI have looked into this matter today\nand will reply soon with more detail\n"
                + "Regards\nAlice\nFrom: Bob\nSent: Monday";

        String content = renderer.render(BodyMode.FULL, body, null).getContent();
        assertEquals("Hi Bob,<br>I have looked into this matter today<br>and will reply soon with more detail<br>Regards"
                + "<br><br>Alice<br><br><hr><br>From: Bob<br>Sent: Monday", content);
    }

    @Test
    void fullDoesNotSeparateAtStart() {
        String content = renderer.render(BodyMode.FULL, "From: Bob\nSent: Monday\nSubject: Bins", null).getContent();

        assertFalse(content.contains("<hr>"), content);
    }

    @Test
    void emptyBody() {
        assertEquals("", renderer.render(BodyMode.SNIPPET, null, null).getContent());
        assertEquals("", renderer.render(BodyMode.PLAIN, "", null).getContent());
        assertEquals("", renderer.render(BodyMode.FULL, "", "").getContent());
    }

    @Test
    void modeFromName() {
        assertEquals(BodyMode.FULL, BodyMode.fromName("full", BodyMode.SNIPPET));
        assertEquals(BodyMode.PLAIN, BodyMode.fromName(" Plain ", BodyMode.SNIPPET));
        assertEquals(BodyMode.SNIPPET, BodyMode.fromName("conversation", BodyMode.SNIPPET));
        assertEquals(BodyMode.SNIPPET, BodyMode.fromName(null, BodyMode.SNIPPET));
    }
}
