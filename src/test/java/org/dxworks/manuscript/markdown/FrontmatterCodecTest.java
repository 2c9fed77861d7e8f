package org.dxworks.manuscript.markdown;

import org.dxworks.manuscript.model.Frontmatter;
import org.dxworks.manuscript.model.NoteType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrontmatterCodecTest {

    @ParameterizedTest
    @CsvSource({
            "in-text, IN_TEXT",
            "0, IN_TEXT",
            "Footnotes, FOOTNOTES",
            "1, FOOTNOTES",
            "endnotes, ENDNOTES",
            "2, ENDNOTES"
    })
    void noteTypeAcceptsNamesAndNumbers(String value, NoteType expected) {
        assertEquals(expected, NoteType.parse(value).orElseThrow());
    }

    @ParameterizedTest
    @CsvSource({"sidenotes", "3", "''"})
    void unknownNoteTypeIsEmpty(String value) {
        assertTrue(NoteType.parse(value).isEmpty());
    }

    @Test
    void splitReadsKnownKeysAndKeepsLineNumbers() {
        String markdown = "---\ntitle: My Paper\nauthor: Ada Lovelace\nnote-type: footnotes\nfont-size: 12\n---\nBody";

        FrontmatterCodec.Split split = FrontmatterCodec.split(markdown);

        assertEquals(List.of("My Paper"), split.frontmatter().titles);
        assertEquals("Ada Lovelace", split.frontmatter().author);
        assertEquals(NoteType.FOOTNOTES, split.frontmatter().noteType);
        assertEquals(12.0, split.frontmatter().fontSize);
        assertEquals("\n".repeat(6) + "Body", split.body());
    }

    @Test
    void invalidValuesAreDropped() {
        Frontmatter frontmatter = FrontmatterCodec.parse(
                "timezone: Europe/Bucharest\nfont-size: -3\ncode-background-color: blue\nlocale: en-GB\n");

        assertNull(frontmatter.timezone);
        assertNull(frontmatter.fontSize);
        assertNull(frontmatter.codeBackgroundColor);
        assertEquals("en-GB", frontmatter.locale);
    }

    @Test
    void brokenYamlNeverFailsTheDocument() {
        FrontmatterCodec.Split split = FrontmatterCodec.split("---\ntitle: \"unterminated\n---\ntext");

        assertTrue(split.frontmatter().titles.isEmpty());
        assertTrue(split.body().endsWith("text"));
    }

    @Test
    void documentWithoutFrontmatterIsUntouched() {
        FrontmatterCodec.Split split = FrontmatterCodec.split("# Heading\n");

        assertTrue(split.frontmatter().isEmpty());
        assertEquals("# Heading\n", split.body());
    }

    @Test
    void serializedFrontmatterReadsBack() {
        Frontmatter frontmatter = new Frontmatter();
        frontmatter.titles.add("Title: with colon");
        frontmatter.csl = "apa";
        frontmatter.timezone = "+02:00";
        frontmatter.codeFontSize = 9.5;

        Frontmatter read = FrontmatterCodec.split(FrontmatterCodec.serialize(frontmatter) + "body").frontmatter();

        assertEquals(frontmatter.titles, read.titles);
        assertEquals("apa", read.csl);
        assertEquals("+02:00", read.timezone);
        assertEquals(9.5, read.codeFontSize);
    }

    @Test
    void applySetsSingleKey() {
        Frontmatter frontmatter = new Frontmatter();

        FrontmatterCodec.apply(frontmatter, "code-font-color", "#FF0000");
        FrontmatterCodec.apply(frontmatter, "unknown-key", "value");

        assertEquals("FF0000", frontmatter.codeFontColor);
    }
}
