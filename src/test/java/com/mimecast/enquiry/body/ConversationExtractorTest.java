package com.mimecast.enquiry.body;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConversationExtractorTest {

    private final ConversationExtractor extractor = new ConversationExtractor();

    @Test
    void stopsAtReplyHeader() {
        String body = "Thanks for the update, I will look into this today.\n\nFrom: Bob Smith\nSent: Monday\nOld message";

        assertEquals("Thanks for the update, I will look into this today.", extractor.extractLatest(body));
    }

    @Test
    void stopsAtQuotedText() {
        String body = "\n\nSounds good to me, see you at the meeting.\n> Earlier text\n> More earlier text";

        assertEquals("Sounds good to me, see you at the meeting.", extractor.extractLatest(body));
    }

    @Test
    void stopsAtOriginalMessageMarker() {
        String body = "Please find the answer below for your records.\n-----Original Message-----\nQuestion";

        assertEquals("Please find the answer below for your records.", extractor.extractLatest(body));
    }

    @Test
    void convertsHtmlBreaks() {
        String body = "Hello Councillor,<br><br>Please see attached.<br>On Mon, Bob wrote:<br>&gt; old";

        assertEquals("Hello Councillor,\n\nPlease see attached.", extractor.extractLatest(body));
    }

    @Test
    void tooShortReturnsWholeBody() {
        String body = "Ok\nFrom: Bob\n" + "Earlier message text that is long enough to matter here. ".repeat(3);

        assertEquals(body, extractor.extractLatest(body));
    }

    @Test
    void emptyBody() {
        assertEquals("", extractor.extractLatest(null));
        assertEquals("", extractor.extractLatest(""));
    }

    @Test
    void cleanHtmlForDisplay() {
        String html = "<p>Hello &amp; welcome</p><br><br><br><div>  Second   line </div>";

        assertEquals("Hello & welcome\n\nSecond line", extractor.cleanHtmlForDisplay(html));
    }

    @Test
    void cleanHtmlTrimsBlankEdges() {
        assertEquals("Body", extractor.cleanHtmlForDisplay("<br><br>Body<br><br>"));
        assertEquals("", extractor.cleanHtmlForDisplay(null));
    }
}
