package org.dxworks.manuscript.markdown;

import org.dxworks.manuscript.model.CommentNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class CommentBodyParserTest {

    @Test
    void authorDateAndText() {
        CommentNode node = CommentBodyParser.parse("Jane Doe (2024-01-02T10:00+02:00): Needs a source");

        assertEquals("Jane Doe", node.author);
        assertEquals("2024-01-02T10:00+02:00", node.date);
        assertEquals("Needs a source", node.text);
    }

    @Test
    void plainTextWithoutAuthor() {
        CommentNode node = CommentBodyParser.parse("this is unclear, rephrase");

        assertNull(node.author);
        assertEquals("this is unclear, rephrase", node.text);
    }

    @Test
    void repliesOfRepliesAreFlattened() {
        CommentNode node = CommentBodyParser.parse(
                "Ann: first {>>Bob: second {>>Cy: third<<}<<} {>>Dee: fourth<<}");

        assertEquals("Ann", node.author);
        assertEquals("first", node.text);
        assertEquals(3, node.replies.size());
        assertEquals("Bob", node.replies.get(0).author);
        assertEquals("second", node.replies.get(0).text);
        assertEquals("Cy", node.replies.get(1).author);
        assertEquals("Dee", node.replies.get(2).author);
        assertEquals(0, node.replies.get(0).replies.size());
    }

    @Test
    void unterminatedReplyStaysInText() {
        CommentNode node = CommentBodyParser.parse("Ann: first {>>dangling");

        assertEquals(0, node.replies.size());
        assertEquals("first {>>dangling", node.text);
    }
}
