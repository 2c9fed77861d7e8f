package org.dxworks.manuscript.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A review comment. Thread roots own their replies; a reply never appears in two threads.
 */
public class CommentNode {
    public String id;       // native comment id, null for comments parsed from Markdown
    public String author;
    public String date;     // as written in Markdown or the document, may be null
    public String text;
    public String paraId;   // paragraph id linking replies to their parent
    public List<CommentNode> replies = new ArrayList<>();

    public CommentNode() {
    }

    public CommentNode(String author, String date, String text) {
        this.author = author;
        this.date = date;
        this.text = text;
    }

    public boolean hasReplies() {
        return !replies.isEmpty();
    }
}
