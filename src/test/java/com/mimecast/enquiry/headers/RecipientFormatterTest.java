package com.mimecast.enquiry.headers;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

class RecipientFormatterTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "John Smith <john@example.com>|John Smith <john@example.com>",
            "john@example.com; jane@example.com|john@example.com; jane@example.com",
            "\"Doe, Jane\" <jane@example.com>;john@example.com;|'Doe, Jane <jane@example.com>; john@example.com'",
            "Councillor Bloggs|Councillor Bloggs",
            " ; ;john@example.com|john@example.com"
    })
    void format(String input, String expected) {
        assertEquals(expected, RecipientFormatter.format(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void empty(String input) {
        assertEquals("", RecipientFormatter.format(input));
    }
}
