package org.dxworks.manuscript.markdown;

import org.dxworks.manuscript.critic.CriticMarkupPreprocessor;
import org.dxworks.manuscript.model.CommentNode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the inside of a {@code {>>...<<}} comment: {@code Author (date): text} or {@code Author: text},
 * followed by nested {@code {>>...<<}} replies. Replies of replies are attached to the root.
 */
public final class CommentBodyParser {

    private static final Pattern AUTHOR_DATE_TEXT = Pattern.compile("^(.+?)\\s+\\(([^)]+)\\):\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern AUTHOR_TEXT = Pattern.compile("^(\\p{L}[\\p{L} .'-]{0,59}):\\s+(.*)$", Pattern.DOTALL);
    private static final Pattern BARE_AUTHOR = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final String REPLY_OPEN = "{>>";

    private CommentBodyParser() {}

    public static CommentNode parse(String content) {
        String restored = CriticMarkupPreprocessor.restoreParagraphs(content);
        CommentNode root = new CommentNode();

        int replyStart = restored.indexOf(REPLY_OPEN);
        String body = replyStart < 0 ? restored : restored.substring(0, replyStart);
        applyHeader(root, body.strip());

        int cursor = replyStart;
        while (cursor >= 0 && cursor < restored.length()) {
            int contentStart = cursor + REPLY_OPEN.length();
            int close = CriticMarkupPreprocessor.findMatchingClose(restored, contentStart);
            if (close < 0) {
                // unterminated reply stays part of the root text
                root.text = (root.text + " " + restored.substring(cursor).strip()).strip();
                break;
            }
            CommentNode reply = parse(restored.substring(contentStart, close));
            root.replies.add(reply);
            root.replies.addAll(reply.replies);
            reply.replies.clear();
            cursor = restored.indexOf(REPLY_OPEN, close + 3);
        }
        return root;
    }

    private static void applyHeader(CommentNode node, String header) {
        Matcher matcher = AUTHOR_DATE_TEXT.matcher(header);
        if (matcher.matches()) {
            node.author = matcher.group(1).strip();
            node.date = matcher.group(2).strip();
            node.text = matcher.group(3).strip();
            return;
        }
        Matcher authorOnly = AUTHOR_TEXT.matcher(header);
        if (authorOnly.matches()) {
            node.author = authorOnly.group(1).strip();
            node.text = authorOnly.group(2).strip();
        } else if (!header.isEmpty() && BARE_AUTHOR.matcher(header).matches()) {
            node.author = header;
            node.text = "";
        } else {
            node.text = header;
        }
    }
}
