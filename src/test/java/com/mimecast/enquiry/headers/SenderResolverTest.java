package com.mimecast.enquiry.headers;

import com.mimecast.enquiry.container.FakeMailContainer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SenderResolverTest {

    private final SenderResolver resolver = new SenderResolver();

    @ParameterizedTest
    @DisplayName("Sender field combinations")
    @CsvSource(delimiter = '|', value = {
            // Raw only, parsed as a whole
            "John Smith <john@example.com>|                   |                 |John Smith <john@example.com>",
            // Explicit pair wins over raw
            "Someone Else <x@example.com> |Jane Doe           |jane@example.com |Jane Doe <jane@example.com>",
            // Email only
            "                             |                   |jane@example.com |jane@example.com",
            // Explicit name with email parsed from raw
            "<john@example.com>           |John Smith         |                 |John Smith <john@example.com>",
            // Raw without address
            "Mailer Daemon                |                   |                 |Mailer Daemon",
            // Bare raw address
            "john@example.com             |                   |                 |john@example.com",
            // Quoted display name
            "\"Smith, John\" <john@example.com>|              |                 |'Smith, John <john@example.com>'",
    })
    void resolve(String raw, String name, String email, String expected) {
        ResolvedSender sender = resolver.resolve(raw, name, email);

        assertEquals(expected, sender.getEmailFrom());
        assertEquals(raw != null ? raw : "", sender.getRawFrom());
    }

    @Test
    void unknownWhenEmpty() {
        assertEquals(SenderResolver.UNKNOWN_SENDER, resolver.resolve(null, null, null).getEmailFrom());
        assertEquals(SenderResolver.UNKNOWN_SENDER, resolver.resolve("", "", "").getEmailFrom());
    }

    @Test
    void fromContainer() {
        FakeMailContainer container = new FakeMailContainer()
                .setSender("John Smith <john@example.com>");

        ResolvedSender sender = resolver.resolve(container);
        assertEquals("John Smith <john@example.com>", sender.getEmailFrom());
        assertEquals("John Smith <john@example.com>", sender.getRawFrom());
    }

    @Test
    void fromContainerNameOnly() {
        FakeMailContainer container = new FakeMailContainer()
                .setSenderName("John Smith");

        ResolvedSender sender = resolver.resolve(container);
        assertEquals(SenderResolver.UNKNOWN_SENDER, sender.getEmailFrom());
        assertEquals("", sender.getRawFrom());
    }
}
