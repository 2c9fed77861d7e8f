package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.ManuscriptConverter;
import org.dxworks.manuscript.TestUtils;
import org.dxworks.manuscript.markdown.MarkdownTokenizer;
import org.dxworks.manuscript.markdown.ParsedManuscript;
import org.dxworks.manuscript.model.MarkdownConversion;
import org.dxworks.manuscript.model.Run;
import org.dxworks.manuscript.model.RunType;
import org.dxworks.manuscript.model.TableCell;
import org.dxworks.manuscript.model.Token;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocxRoundTripTest {

    private final ManuscriptConverter converter = TestUtils.converter();
    private final MarkdownTokenizer tokenizer = new MarkdownTokenizer();

    @Test
    void manuscriptKeepsItsStructure() throws Exception {
        String markdown = Files.readString(Paths.get("src/test/resources/fixtures/manuscript.md"),
                StandardCharsets.UTF_8);

        MarkdownConversion conversion = converter.docxToMarkdown(
                converter.markdownToDocx(markdown, null, null).docx());

        ParsedManuscript original = tokenizer.tokenize(markdown);
        ParsedManuscript extracted = tokenizer.tokenize(conversion.markdown());
        assertEquals(signature(original.tokens()), signature(extracted.tokens()), conversion.markdown());
        assertEquals(original.frontmatter().titles, extracted.frontmatter().titles);
        assertEquals(original.frontmatter().author, extracted.frontmatter().author);
        assertEquals(1, extracted.footnotes().size());
        assertTrue(conversion.warnings().isEmpty(), conversion.warnings().toString());
    }

    @Test
    void htmlCommentsSurviveRoundTrip() throws Exception {
        String markdown = "text <!-- keep me --> more\n\n<!-- a block\ncomment -->\n\nAfter";

        String extracted = roundTrip(markdown);

        assertTrue(extracted.startsWith("text <!-- keep me --> more"), extracted);
        assertTrue(extracted.contains("<!-- a block\ncomment -->"), extracted);
        assertTrue(extracted.endsWith("After"), extracted);
        assertFalse(extracted.contains("\\<"), extracted);
    }

    @Test
    void latexCommentSurvivesRoundTrip() throws Exception {
        String extracted = roundTrip("$$\nx + y % why\n$$");

        assertTrue(extracted.startsWith("$$\n"), extracted);
        assertTrue(extracted.contains("% why\n$$"), extracted);
        assertFalse(extracted.contains("\\%"), extracted);
    }

    @Test
    void emptyCriticSpansSurviveRoundTrip() throws Exception {
        assertEquals("a {++++} b {==  ==} c", roundTrip("a {++++} b {==  ==} c"));
    }

    @Test
    void gridTableIsExtractedAsPipeTable() throws Exception {
        String extracted = roundTrip("+---+---+\n| a | b |\n+===+===+\n| 1 | 2 |\n+---+---+");

        assertEquals("| a | b |\n| --- | --- |\n| 1 | 2 |", extracted);
    }

    private String roundTrip(String markdown) throws Exception {
        return converter.docxToMarkdown(converter.markdownToDocx(markdown, null, null).docx()).markdown().strip();
    }

    @Test
    void extractedMarkdownIsStable() throws Exception {
        String markdown = Files.readString(Paths.get("src/test/resources/fixtures/manuscript.md"),
                StandardCharsets.UTF_8);

        String once = converter.docxToMarkdown(converter.markdownToDocx(markdown, null, null).docx()).markdown();
        String twice = converter.docxToMarkdown(converter.markdownToDocx(once, null, null).docx()).markdown();

        assertEquals(once, twice);
    }

    /** Block types and levels with their runs. */
    private static List<String> signature(List<Token> tokens) {
        List<String> lines = new ArrayList<>();
        for (Token token : tokens) {
            StringBuilder sb = new StringBuilder(token.type().name()).append(':').append(token.level());
            if (token.ordered()) {
                sb.append(":ordered");
            }
            if (token.alertType() != null) {
                sb.append(':').append(token.alertType());
            }
            if (token.code() != null) {
                sb.append(':').append(token.language()).append(':').append(token.code());
            }
            sb.append(':').append(text(token.runs()));
            for (List<TableCell> row : token.rows()) {
                sb.append('|');
                for (TableCell cell : row) {
                    sb.append(text(cell.runs())).append('|');
                }
            }
            lines.add(sb.toString());
        }
        return lines;
    }

    /**
     * Runs as {@code TYPE{formatting,highlight,href,newText}:text} pieces. Neighbouring text runs with the same
     * decoration are joined and soft breaks count as spaces, so only the rendering of line breaks may differ.
     */
    private static String text(List<Run> runs) {
        List<String> pieces = new ArrayList<>();
        String previousKey = null;
        StringBuilder current = null;
        for (Run run : runs) {
            Run piece = run.type() == RunType.SOFT_BREAK ? Run.text(" ") : run;
            String key = piece.type() + "{" + piece.formatting() + "," + piece.highlightColor() + ","
                    + piece.href() + "," + piece.newText() + "}";
            if (piece.type() == RunType.TEXT && key.equals(previousKey)) {
                current.append(piece.text());
                continue;
            }
            if (current != null) {
                pieces.add(previousKey + ":" + normalize(current.toString()));
            }
            previousKey = key;
            current = new StringBuilder(piece.type() == RunType.MATH
                    ? piece.text().replace(" ", "") : piece.text());
        }
        if (current != null) {
            pieces.add(previousKey + ":" + normalize(current.toString()));
        }
        return String.join(" ", pieces);
    }

    private static String normalize(String text) {
        return text.replaceAll("\\s+", " ");
    }
}
