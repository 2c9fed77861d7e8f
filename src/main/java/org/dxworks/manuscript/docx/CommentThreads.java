package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.model.CommentNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Native comments grouped into threads. A comment whose paragraph id has a parent in {@code commentsExtended.xml}
 * is a reply; chains of replies to replies are flattened onto the thread root, keeping document order.
 */
public class CommentThreads {

    private final Map<String, CommentNode> roots;
    private final Map<String, String> rootIds;

    private CommentThreads(Map<String, CommentNode> roots, Map<String, String> rootIds) {
        this.roots = Collections.unmodifiableMap(roots);
        this.rootIds = Collections.unmodifiableMap(rootIds);
    }

    /**
     * @param comments       comments in document order, each with its native {@code id} and {@code paraId}
     * @param parentParaIds  parent paragraph id by paragraph id
     */
    public static CommentThreads group(List<CommentNode> comments, Map<String, String> parentParaIds) {
        Map<String, CommentNode> byParaId = new HashMap<>();
        for (CommentNode comment : comments) {
            if (comment.paraId != null) {
                byParaId.putIfAbsent(comment.paraId, comment);
            }
        }

        Map<String, CommentNode> roots = new LinkedHashMap<>();
        Map<String, String> rootIds = new HashMap<>();
        for (CommentNode comment : comments) {
            CommentNode root = rootOf(comment, byParaId, parentParaIds);
            if (root == comment) {
                comment.replies.clear();
                roots.put(comment.id, comment);
            }
            rootIds.put(comment.id, root.id);
        }
        for (CommentNode comment : comments) {
            String rootId = rootIds.get(comment.id);
            if (!rootId.equals(comment.id)) {
                CommentNode root = roots.get(rootId);
                if (root != null) {
                    comment.replies.clear();
                    root.replies.add(comment);
                }
            }
        }
        return new CommentThreads(roots, rootIds);
    }

    private static CommentNode rootOf(CommentNode comment, Map<String, CommentNode> byParaId,
                                      Map<String, String> parentParaIds) {
        CommentNode current = comment;
        Set<String> seen = new HashSet<>();
        while (current.paraId != null && seen.add(current.paraId)) {
            String parentParaId = parentParaIds.get(current.paraId);
            CommentNode parent = parentParaId == null ? null : byParaId.get(parentParaId);
            if (parent == null || parent == current) {
                return current;
            }
            current = parent;
        }
        // a cycle has no natural root, the comment stands alone
        return current.paraId == null ? current : comment;
    }

    /** Thread roots by native id, in document order. */
    public Map<String, CommentNode> roots() {
        return roots;
    }

    public boolean isRoot(String commentId) {
        return roots.containsKey(commentId);
    }

    public boolean isReply(String commentId) {
        String rootId = rootIds.get(commentId);
        return rootId != null && !rootId.equals(commentId);
    }

    /** Root id of the thread a comment belongs to. */
    public Optional<String> rootId(String commentId) {
        return Optional.ofNullable(rootIds.get(commentId));
    }
}
