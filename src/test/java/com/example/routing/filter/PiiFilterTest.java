package com.example.routing.filter;

import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.junit.jupiter.api.Assertions.*;

class PiiFilterTest {

    private final PiiFilter filter = new PiiFilter();

    static Stream<Arguments> piiCases() {
        return Stream.of(
            // Email
            Arguments.of("Contact john@example.com for help",
                "Contact [EMAIL] for help"),
            Arguments.of("Emails: a@b.co and user.name+tag@domain.org",
                "Emails: [EMAIL] and [EMAIL]"),

            // National id
            Arguments.of("身分證 A123456789 請協助", "身分證 [NATIONAL_ID] 請協助"),

            // Credit card
            Arguments.of("Card: 4111-1111-1111-1111", "Card: [CREDIT_CARD]"),
            Arguments.of("Pay with 4111 1111 1111 1111", "Pay with [CREDIT_CARD]"),
            Arguments.of("Number 4111111111111111 on file", "Number [CREDIT_CARD] on file"),

            // Mobile and landline
            Arguments.of("Call 0912-345-678 now", "Call [MOBILE] now"),
            Arguments.of("Office 02-2345-6789", "Office [PHONE]"),

            // Multiple PII types
            Arguments.of("mail a@b.co, card 4000 0000 0000 0000",
                "mail [EMAIL], card [CREDIT_CARD]")
        );
    }

    @ParameterizedTest
    @MethodSource("piiCases")
    void scrubsDetectedPii(String input, String expected) {
        assertEquals(expected, filter.scrub(input));
    }

    @ParameterizedTest
    @NullAndEmptySource
    void handlesNullAndEmpty(String input) {
        assertEquals(input, filter.scrub(input));
    }

    @Test
    void leavesCleanTextUnchanged() {
        String clean = "Ticket INC0012345 is open, ETL 作業失敗";
        assertEquals(clean, filter.scrub(clean));
    }

    @Test
    void truncatesAfterScrubbing() {
        assertEquals("Contact [EMAIL]…", filter.scrubAndTruncate("Contact john@example.com today", 15));
        assertEquals("short", filter.scrubAndTruncate("short", 15));
        assertNull(filter.scrubAndTruncate(null, 15));
    }

    @Test
    void containsPiiDetection() {
        assertTrue(filter.containsPii("contact user@example.com"));
        assertTrue(filter.containsPii("4111111111111111"));
        assertTrue(filter.containsPii("Call 0912-345-678"));
        assertFalse(filter.containsPii("no pii here"));
        assertFalse(filter.containsPii(null));
    }
}
