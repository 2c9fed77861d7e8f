package org.dxworks.manuscript.docx;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Comment and revision timestamps. Documents carry UTC instants; Markdown carries
 * {@code yyyy-MM-ddTHH:mm±HH:MM} in the manuscript's timezone.
 */
public final class CommentDates {

    private static final DateTimeFormatter MARKDOWN = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mmxxx");
    private static final List<DateTimeFormatter> LOCAL_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"));

    private CommentDates() {}

    /** UTC timestamp as written into the document. */
    public static String toDocx(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS).toString();
    }

    /**
     * Interprets a date written in Markdown. Dates without an offset are read in {@code zone}; anything
     * unparseable yields {@code fallback}.
     */
    public static String toDocx(String markdownDate, ZoneOffset zone, Instant fallback) {
        if (markdownDate == null || markdownDate.isBlank()) {
            return toDocx(fallback);
        }
        String value = markdownDate.trim();
        try {
            return toDocx(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException ignored) {
            // not an offset date time, try the local forms
        }
        for (DateTimeFormatter format : LOCAL_FORMATS) {
            try {
                return toDocx(LocalDateTime.parse(value, format).toInstant(zone));
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return toDocx(LocalDate.parse(value).atStartOfDay().toInstant(zone));
        } catch (DateTimeParseException e) {
            return toDocx(fallback);
        }
    }

    /** Markdown form of a document timestamp, or null when the document value is not a timestamp. */
    public static String toMarkdown(String docxDate, ZoneOffset zone) {
        if (docxDate == null || docxDate.isBlank()) {
            return null;
        }
        Instant instant;
        try {
            instant = OffsetDateTime.parse(docxDate.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                instant = LocalDateTime.parse(docxDate.trim()).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException again) {
                return null;
            }
        }
        return MARKDOWN.format(instant.atOffset(zone));
    }

    /** Offset for a validated {@code ±HH:MM} timezone, UTC when absent. */
    public static ZoneOffset zone(String timezone) {
        return timezone == null ? ZoneOffset.UTC : ZoneOffset.of(timezone);
    }
}
