package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.ManuscriptConverter;
import org.dxworks.manuscript.TestUtils;
import org.dxworks.manuscript.model.MarkdownConversion;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.dxworks.manuscript.TestUtils.count;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocxExtractorTest {

    private static final String BIBTEX = "@article{smith2020,\n"
            + "  author = {Smith, John},\n"
            + "  title = {The Deep Learning Survey},\n"
            + "  journal = {Journal of Things},\n"
            + "  year = {2020},\n"
            + "  zotero-uri = {http://zotero.org/users/1/items/ABCD1234}\n"
            + "}\n";

    private final ManuscriptConverter converter = TestUtils.converter();

    private MarkdownConversion roundTrip(String markdown, String bibtex) throws Exception {
        return converter.docxToMarkdown(converter.markdownToDocx(markdown, bibtex, null).docx());
    }

    @Test
    void garbageIsNotADocument() {
        assertThrows(DocxFormatException.class,
                () -> converter.docxToMarkdown("not a zip file".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void commentThreadComesBackAsOneComment() throws Exception {
        String markdown = "Some {==flagged==}{>>Ann (2024-01-02T10:00+02:00): check "
                + "{>>Bob: done<<} {>>Cy: agreed<<}<<} text.";

        String extracted = roundTrip(markdown, null).markdown();

        assertTrue(extracted.contains("{==flagged==}{>>Ann (2024-01-02T08:00+00:00): check"), extracted);
        assertTrue(extracted.contains("{>>Bob (2024-03-01T10:15+00:00): done<<}"), extracted);
        assertEquals(1, count(extracted, "{=="));
        assertEquals(3, count(extracted, "{>>"));
    }

    @Test
    void commentDatesFollowManuscriptTimezone() throws Exception {
        String markdown = "---\ntimezone: +02:00\n---\n{==x==}{>>Ann (2024-01-02T10:00+02:00): note<<}";

        String extracted = roundTrip(markdown, null).markdown();

        assertTrue(extracted.contains("timezone: +02:00") || extracted.contains("timezone: \"+02:00\""), extracted);
        assertTrue(extracted.contains("Ann (2024-01-02T10:00+02:00): note"), extracted);
    }

    @Test
    void trackedChangesComeBackAsCriticMarkup() throws Exception {
        String extracted = roundTrip("Keep {++new++} and {--old--} or {~~a~>b~~}.", null).markdown();

        assertTrue(extracted.contains("{++new++}"), extracted);
        assertTrue(extracted.contains("{--old--}"), extracted);
        assertTrue(extracted.contains("{~~a~>b~~}"), extracted);
    }

    @Test
    void citationsGetKeysAndBibtex() throws Exception {
        MarkdownConversion conversion = roundTrip("See [@smith2020, p. 5].", BIBTEX);

        assertTrue(conversion.markdown().contains("See [@smith2020deep, p. 5]."), conversion.markdown());
        assertFalse(conversion.markdown().contains("Sources"));
        assertTrue(conversion.bibtex().startsWith("@article{smith2020deep,\n"), conversion.bibtex());
        assertTrue(conversion.bibtex().contains("zotero-key = {ABCD1234}"));
    }

    @Test
    void frontmatterAndFormattingSurvive() throws Exception {
        String markdown = "---\ntitle: Paper\nauthor: Ada Lovelace\ncsl: apa\n---\n\n"
                + "# Introduction\n\nHello **bold**, *italic* and `code` with ==marks==.\n";

        String extracted = roundTrip(markdown, null).markdown();

        assertTrue(extracted.startsWith("---\n"), extracted);
        assertTrue(extracted.contains("title: Paper"), extracted);
        assertTrue(extracted.contains("author: Ada Lovelace"), extracted);
        assertTrue(extracted.contains("csl: apa"), extracted);
        assertTrue(extracted.contains("# Introduction\n\nHello **bold**, *italic* and `code` with ==marks==."),
                extracted);
    }

    @Test
    void nothingCitedMeansNoBibtex() throws Exception {
        MarkdownConversion conversion = roundTrip("Plain.", null);

        assertEquals("", conversion.bibtex());
        assertTrue(conversion.media().isEmpty());
    }
}
