package org.dxworks.manuscript.docx;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class CommentDatesTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:15:30.123Z");
    private static final ZoneOffset PLUS_TWO = ZoneOffset.of("+02:00");

    @Test
    void markdownDatesBecomeUtc() {
        assertEquals("2024-01-02T08:00:00Z", CommentDates.toDocx("2024-01-02T10:00+02:00", ZoneOffset.UTC, NOW));
        assertEquals("2024-01-02T08:00:00Z", CommentDates.toDocx("2024-01-02 10:00", PLUS_TWO, NOW));
        assertEquals("2024-01-01T22:00:00Z", CommentDates.toDocx("2024-01-02", PLUS_TWO, NOW));
    }

    @Test
    void unreadableDatesFallBack() {
        assertEquals("2024-03-01T10:15:30Z", CommentDates.toDocx("yesterday", PLUS_TWO, NOW));
        assertEquals("2024-03-01T10:15:30Z", CommentDates.toDocx(null, PLUS_TWO, NOW));
    }

    @Test
    void documentDatesUseManuscriptTimezone() {
        assertEquals("2024-01-02T10:00+02:00", CommentDates.toMarkdown("2024-01-02T08:00:00Z", PLUS_TWO));
        assertEquals("2024-01-02T08:00+00:00", CommentDates.toMarkdown("2024-01-02T08:00:00", ZoneOffset.UTC));
        assertNull(CommentDates.toMarkdown("not a date", ZoneOffset.UTC));
        assertEquals(ZoneOffset.UTC, CommentDates.zone(null));
    }
}
