package org.dxworks.manuscript.critic;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CriticMarkupPreprocessorTest {

    @Test
    void blankLinesInsideCommentAreProtected() {
        String text = "Before {>>first paragraph\n\nsecond paragraph<<} after";

        String protectedText = CriticMarkupPreprocessor.preprocess(text);

        assertFalse(protectedText.contains("\n\n"));
        assertTrue(protectedText.contains(CriticMarkupPreprocessor.PARAGRAPH_PLACEHOLDER));
        assertEquals(text, CriticMarkupPreprocessor.restoreParagraphs(protectedText));
    }

    @Test
    void blankLinesInsideAdditionAreProtected() {
        String protectedText = CriticMarkupPreprocessor.preprocess("{++one\n\ntwo++}");

        assertEquals("{++one" + CriticMarkupPreprocessor.PARAGRAPH_PLACEHOLDER + "two++}", protectedText);
    }

    @Test
    void unclosedMarkerIsLeftAlone() {
        String text = "{++orphan\n\nstill text";

        assertEquals(text, CriticMarkupPreprocessor.preprocess(text));
    }

    @Test
    void textWithoutMarkersIsReturnedUnchanged() {
        String text = "plain\n\ntext";

        assertEquals(text, CriticMarkupPreprocessor.preprocess(text));
    }

    @Test
    void matchingCloseSkipsNestedReplies() {
        String text = "{>>root {>>reply<<} tail<<} after";

        int close = CriticMarkupPreprocessor.findMatchingClose(text, 3);

        assertEquals(text.indexOf("<<} after"), close);
    }

    @Test
    void matchingCloseSkipsNestedIdComments() {
        String text = "{>>root {#c1>>inner<<} tail<<}";

        assertEquals(text.length() - 3, CriticMarkupPreprocessor.findMatchingClose(text, 3));
    }

    @Test
    void unterminatedCommentHasNoClose() {
        assertEquals(-1, CriticMarkupPreprocessor.findMatchingClose("{>>never closed {>>inner<<}", 3));
    }

    @Test
    void idOpenerLengthCoversIdAndArrows() {
        assertEquals("{#note-1>>".length(), CriticMarkupPreprocessor.idOpenerLength("x{#note-1>>body<<}", 1));
        assertEquals(0, CriticMarkupPreprocessor.idOpenerLength("{#note-1}", 0));
    }

    @Test
    void manyUnclosedOpenersArePreprocessedInLinearTime() {
        String text = "{>> x ".repeat(40_000) + "{++ y ".repeat(40_000) + "{#c1>> z ".repeat(20_000) + "\n\nend";

        String result = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> CriticMarkupPreprocessor.preprocess(text));

        assertEquals(text, result);
    }

    @Test
    void commentClosesMatchNestedComments() {
        String text = "{>> a {>> b <<} c {#1>> d <<} e";

        Map<Integer, Integer> closes = CriticMarkupPreprocessor.commentCloses(text);

        assertEquals(-1, CriticMarkupPreprocessor.findMatchingClose(text, 3));
        assertNull(closes.get(3));
        int inner = text.indexOf("{>> b") + 3;
        assertEquals(CriticMarkupPreprocessor.findMatchingClose(text, inner), closes.get(inner));
        int id = text.indexOf("{#1>>") + 5;
        assertEquals(CriticMarkupPreprocessor.findMatchingClose(text, id), closes.get(id));
    }
}
