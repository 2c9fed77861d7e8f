package org.dxworks.manuscript.markdown;

import org.dxworks.manuscript.model.HighlightColor;
import org.dxworks.manuscript.model.Run;
import org.dxworks.manuscript.model.RunType;
import org.dxworks.manuscript.model.Token;
import org.dxworks.manuscript.model.TokenType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownTokenizerTest {

    private final MarkdownTokenizer tokenizer = new MarkdownTokenizer();

    @Test
    void headingAndFormattedParagraph() {
        List<Token> tokens = tokenizer.tokenize("# Intro\n\nHello **world**.").tokens();

        assertEquals(2, tokens.size());
        assertEquals(TokenType.HEADING, tokens.get(0).type());
        assertEquals(1, tokens.get(0).level());
        assertEquals("Intro", tokens.get(0).runs().get(0).text());

        List<Run> runs = tokens.get(1).runs();
        assertEquals("Hello ", runs.get(0).text());
        assertEquals("world", runs.get(1).text());
        assertTrue(runs.get(1).formatting().bold());
        assertEquals(".", runs.get(2).text());
    }

    @Test
    void criticAdditionSpanningParagraphsStaysOneRun() {
        List<Token> tokens = tokenizer.tokenize("Start {++first\n\nsecond++} end").tokens();

        assertEquals(1, tokens.size());
        Run addition = tokens.get(0).runs().get(1);
        assertEquals(RunType.CRITIC_ADDITION, addition.type());
        assertEquals("first\n\nsecond", addition.text());
    }

    @Test
    void citationGroupWithLocator() {
        List<Run> runs = tokenizer.tokenizeInline("See [@smith2020, p. 5; @doe2019].");

        Run citation = runs.get(1);
        assertEquals(RunType.CITATION, citation.type());
        assertEquals(2, citation.citations().size());
        assertEquals("smith2020", citation.citations().get(0).key());
        assertEquals("p. 5", citation.citations().get(0).locator());
        assertEquals("doe2019", citation.citations().get(1).key());
        assertNull(citation.citations().get(1).locator());
    }

    @Test
    void dollarsInsideCodeAreNotMath() {
        List<Run> runs = tokenizer.tokenizeInline("Use `$x$` and $y$");

        assertEquals(RunType.CODE, runs.get(1).type());
        assertEquals("$x$", runs.get(1).text());
        assertEquals(RunType.MATH, runs.get(3).type());
        assertEquals("y", runs.get(3).text());
        assertFalse(runs.get(3).display());
    }

    @Test
    void taskItemsAndNestedOrderedList() {
        List<Token> tokens = tokenizer.tokenize("- [x] done\n- [ ] todo\n  1. nested\n").tokens();

        assertEquals(3, tokens.size());
        assertEquals(Boolean.TRUE, tokens.get(0).checked());
        assertEquals("done", tokens.get(0).runs().get(0).text());
        assertEquals(Boolean.FALSE, tokens.get(1).checked());
        assertEquals(2, tokens.get(2).level());
        assertTrue(tokens.get(2).ordered());
        assertNull(tokens.get(2).checked());
    }

    @Test
    void alertBoxDropsItsMarkerLine() {
        List<Token> tokens = tokenizer.tokenize("> [!NOTE]\n> Be careful\n").tokens();

        assertEquals(1, tokens.size());
        assertEquals(TokenType.ALERT_BOX, tokens.get(0).type());
        assertEquals("NOTE", tokens.get(0).alertType());
        assertEquals("Be careful", tokens.get(0).runs().get(0).text());
    }

    @Test
    void lowercaseAlertMarkerIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            List<Token> tokens = tokenizer.tokenize("> [!tip]\n> Use it\n").tokens();

            assertEquals(TokenType.ALERT_BOX, tokens.get(0).type());
            assertEquals("TIP", tokens.get(0).alertType());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void nestedQuoteKeepsDepth() {
        List<Token> tokens = tokenizer.tokenize("> outer\n>\n> > inner\n").tokens();

        assertEquals(TokenType.BLOCKQUOTE, tokens.get(0).type());
        assertEquals(1, tokens.get(0).level());
        assertEquals(2, tokens.get(1).level());
        assertEquals("inner", tokens.get(1).runs().get(0).text());
    }

    @Test
    void footnoteDefinitionsAreCollected() {
        ParsedManuscript manuscript = tokenizer.tokenize("Text[^1].\n\n[^1]: The *note*.\n");

        assertEquals(1, manuscript.tokens().size());
        assertEquals(RunType.FOOTNOTE_REFERENCE, manuscript.tokens().get(0).runs().get(1).type());
        List<Run> note = manuscript.footnotes().get("1");
        assertEquals("The ", note.get(0).text());
        assertTrue(note.get(1).formatting().italic());
    }

    @Test
    void tableCellsKeepEscapedPipes() {
        List<Token> tokens = tokenizer.tokenize("| a | b \\| c |\n| --- | --- |\n| 1 | 2 |\n").tokens();

        Token table = tokens.get(0);
        assertEquals(TokenType.TABLE, table.type());
        assertEquals(2, table.rows().size());
        assertEquals("b | c", table.rows().get(0).get(1).runs().get(0).text());
        assertEquals("2", table.rows().get(1).get(1).runs().get(0).text());
    }

    @Test
    void fencedCodeKeepsMarkupLiteral() {
        Token code = tokenizer.tokenize("```python\nx = {++1++}\n```\n").tokens().get(0);

        assertEquals(TokenType.CODE_BLOCK, code.type());
        assertEquals("python", code.language());
        assertEquals("x = {++1++}", code.code());
    }

    @Test
    void idCommentWrapsRange() {
        List<Run> runs = tokenizer.tokenizeInline("{#1}some text{/1}{#1>>Ann: please check<<}");

        assertEquals(RunType.COMMENT_RANGE_START, runs.get(0).type());
        assertEquals("some text", runs.get(1).text());
        assertEquals(RunType.COMMENT_RANGE_END, runs.get(2).type());
        Run comment = runs.get(3);
        assertEquals(RunType.CRITIC_COMMENT, comment.type());
        assertEquals("1", comment.commentId());
        assertEquals("Ann", comment.comment().author);
        assertEquals("please check", comment.comment().text);
    }

    @Test
    void coloredHighlight() {
        List<Run> runs = tokenizer.tokenizeInline("an ==important=={red} point");

        assertEquals(RunType.HIGHLIGHT, runs.get(1).type());
        assertEquals("important", runs.get(1).text());
        assertEquals(HighlightColor.RED, runs.get(1).highlightColor());
        assertEquals(" point", runs.get(2).text());
    }

    @Test
    void frontmatterIsSplitOff() {
        ParsedManuscript manuscript = tokenizer.tokenize("---\ntitle: Paper\n---\n\nBody text\n");

        assertEquals(List.of("Paper"), manuscript.frontmatter().titles);
        assertEquals(1, manuscript.tokens().size());
        assertEquals("Body text", manuscript.tokens().get(0).runs().get(0).text());
    }

    @Test
    void tableRowSplittingIgnoresPipesInCode() {
        assertEquals(List.of(" `a|b` ", " c "), MarkdownTokenizer.splitTableRow("| `a|b` | c |"));
    }

    @Test
    void manyUnclosedOpenersTokenizeInLinearTime() {
        String text = "{>> x ".repeat(40_000) + "{++ y ".repeat(20_000) + "{~~ z ".repeat(20_000) + "end";

        List<Token> tokens = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> tokenizer.tokenize(text).tokens());

        assertEquals(1, tokens.size());
        List<Run> runs = tokens.get(0).runs();
        assertEquals(1, runs.size());
        assertEquals(RunType.TEXT, runs.get(0).type());
        assertEquals(text, runs.get(0).text());
    }

    @Test
    void inlineHtmlCommentIsKeptAsOneRun() {
        List<Run> runs = tokenizer.tokenize("text <!-- keep **me** --> more").tokens().get(0).runs();

        assertEquals(3, runs.size());
        assertEquals("text ", runs.get(0).text());
        assertEquals(RunType.HTML_COMMENT, runs.get(1).type());
        assertEquals("<!-- keep **me** -->", runs.get(1).text());
        assertEquals(" more", runs.get(2).text());
    }

    @Test
    void standaloneHtmlCommentBlockBecomesCommentParagraph() {
        List<Token> tokens = tokenizer.tokenize("<!-- first line\nsecond line -->\n\nAfter").tokens();

        assertEquals(2, tokens.size());
        assertEquals(TokenType.PARAGRAPH, tokens.get(0).type());
        assertEquals(List.of(Run.htmlComment("<!-- first line\nsecond line -->")), tokens.get(0).runs());
        assertEquals("After", tokens.get(1).runs().get(0).text());
    }

    @Test
    void htmlCommentInsideCriticAdditionStaysLiteral() {
        Run addition = tokenizer.tokenize("a {++new <!-- note --> text++} b").tokens().get(0).runs().get(1);

        assertEquals(RunType.CRITIC_ADDITION, addition.type());
        assertEquals("new <!-- note --> text", addition.text());
    }

    @Test
    void gridTableBecomesTable() {
        String markdown = "Intro\n"
                + "+-----+-------+\n"
                + "| a   | b     |\n"
                + "+=====+=======+\n"
                + "| 1   | two   |\n"
                + "|     | lines |\n"
                + "+-----+-------+\n"
                + "After";

        List<Token> tokens = tokenizer.tokenize(markdown).tokens();

        assertEquals(3, tokens.size());
        Token table = tokens.get(1);
        assertEquals(TokenType.TABLE, table.type());
        assertEquals(2, table.rows().size());
        assertEquals("b", table.rows().get(0).get(1).runs().get(0).text());
        assertEquals("two lines", table.rows().get(1).get(1).runs().get(0).text());
        assertEquals("After", tokens.get(2).runs().get(0).text());
    }

    @Test
    void gridTableInsideFenceIsCode() {
        Token code = tokenizer.tokenize("```\n+---+\n| a |\n+---+\n```\n").tokens().get(0);

        assertEquals(TokenType.CODE_BLOCK, code.type());
        assertEquals("+---+\n| a |\n+---+", code.code());
    }
}
