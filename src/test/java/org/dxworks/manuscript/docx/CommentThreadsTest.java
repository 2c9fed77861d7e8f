package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.model.CommentNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CommentThreadsTest {

    private static CommentNode comment(String id, String paraId) {
        CommentNode node = new CommentNode("Ann", null, "text " + id);
        node.id = id;
        node.paraId = paraId;
        return node;
    }

    @Test
    void repliesOfRepliesAreFlattenedOntoTheRoot() {
        CommentNode root = comment("0", "P0");
        CommentNode reply = comment("1", "P1");
        CommentNode nested = comment("2", "P2");
        CommentNode other = comment("3", "P3");
        List<CommentNode> comments = List.of(root, reply, nested, other);
        Map<String, String> parents = Map.of("P1", "P0", "P2", "P1");

        CommentThreads threads = CommentThreads.group(comments, parents);

        assertEquals(List.of("0", "3"), List.copyOf(threads.roots().keySet()));
        assertEquals(List.of(reply, nested), root.replies);
        assertTrue(threads.isReply("2"));
        assertFalse(threads.isReply("3"));
        assertEquals("0", threads.rootId("2").orElseThrow());
    }

    @Test
    void groupingTwiceGivesTheSameThreads() {
        CommentNode root = comment("0", "P0");
        CommentNode reply = comment("1", "P1");
        List<CommentNode> comments = List.of(root, reply);
        Map<String, String> parents = Map.of("P1", "P0");

        CommentThreads.group(comments, parents);
        CommentThreads threads = CommentThreads.group(comments, parents);

        assertEquals(1, threads.roots().size());
        assertEquals(List.of(reply), root.replies);
    }

    @Test
    void parentCycleLeavesCommentsStandalone() {
        CommentNode first = comment("0", "P0");
        CommentNode second = comment("1", "P1");

        CommentThreads threads = CommentThreads.group(List.of(first, second), Map.of("P0", "P1", "P1", "P0"));

        assertTrue(threads.isRoot("0"));
        assertTrue(threads.isRoot("1"));
    }
}
