package org.dxworks.manuscript.critic;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Protects CriticMarkup spans from the Markdown block parser.
 * Blank lines inside a closed span would end the paragraph, so they are replaced with
 * {@link #PARAGRAPH_PLACEHOLDER} until the inline tokenizer restores them:
 * - additions, deletions, substitutions and highlights are matched with the first closing marker
 * - comments and ID comment bodies are matched depth-aware, so nested replies do not close the outer comment
 * Unclosed markers are left as they are.
 */
public final class CriticMarkupPreprocessor {

    public static final String PARAGRAPH_PLACEHOLDER = "\uE000PARA\uE000";

    private static final String COMMENT_OPEN = "{>>";
    private static final String COMMENT_CLOSE = "<<}";
    private static final Pattern ID_COMMENT_OPEN = Pattern.compile("\\{#[a-zA-Z0-9_-]+>>");
    private static final List<String> MARKER_PREFIXES = List.of("{++", "{--", "{~~", "{>>", "{==", "{#");

    private static final List<String[]> SIMPLE_MARKERS = List.of(
            new String[]{"{++", "++}"},
            new String[]{"{--", "--}"},
            new String[]{"{~~", "~~}"},
            new String[]{"{==", "==}"}
    );

    private CriticMarkupPreprocessor() {}

    public static String preprocess(String text) {
        if (text == null || !containsMarker(text)) {
            return text;
        }

        String result = text;
        for (String[] marker : SIMPLE_MARKERS) {
            result = protectSimpleSpans(result, marker[0], marker[1]);
        }
        result = protectCommentSpans(result, commentCloses(result));
        result = protectIdCommentSpans(result, commentCloses(result));
        return result;
    }

    public static String restoreParagraphs(String text) {
        if (text == null || !text.contains(PARAGRAPH_PLACEHOLDER)) {
            return text;
        }
        return text.replace(PARAGRAPH_PLACEHOLDER, "\n\n");
    }

    /**
     * Finds the {@code <<}} that closes a comment whose body starts at {@code from}, skipping nested comments.
     *
     * @return index of the closing marker, or -1 when the comment is never closed
     */
    public static int findMatchingClose(String text, int from) {
        int depth = 0;
        int i = from;
        while (i < text.length()) {
            if (text.startsWith(COMMENT_CLOSE, i)) {
                if (depth == 0) {
                    return i;
                }
                depth--;
                i += COMMENT_CLOSE.length();
            } else if (text.startsWith(COMMENT_OPEN, i)) {
                depth++;
                i += COMMENT_OPEN.length();
            } else if (text.charAt(i) == '{' && text.startsWith("{#", i)) {
                int openLength = idOpenerLength(text, i);
                if (openLength > 0) {
                    depth++;
                    i += openLength;
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
        return -1;
    }

    /**
     * Closing marker of every comment and ID comment body in one pass, keyed by the index where the body starts.
     * Bodies that are never closed have no entry. Agrees with {@link #findMatchingClose} for every opener.
     */
    public static Map<Integer, Integer> commentCloses(String text) {
        Map<Integer, Integer> closes = new HashMap<>();
        Deque<Integer> open = new ArrayDeque<>();
        int i = 0;
        while (i < text.length()) {
            if (text.startsWith(COMMENT_CLOSE, i)) {
                if (!open.isEmpty()) {
                    closes.put(open.pop(), i);
                }
                i += COMMENT_CLOSE.length();
            } else if (text.startsWith(COMMENT_OPEN, i)) {
                i += COMMENT_OPEN.length();
                open.push(i);
            } else if (text.charAt(i) == '{' && text.startsWith("{#", i)) {
                int openLength = idOpenerLength(text, i);
                if (openLength > 0) {
                    i += openLength;
                    open.push(i);
                } else {
                    i++;
                }
            } else {
                i++;
            }
        }
        return closes;
    }

    /** Length of an {@code {#id>>} opener at {@code index}, or 0 when there is none. */
    public static int idOpenerLength(String text, int index) {
        Matcher matcher = ID_COMMENT_OPEN.matcher(text);
        matcher.region(index, text.length());
        return matcher.lookingAt() ? matcher.end() - index : 0;
    }

    private static boolean containsMarker(String text) {
        for (String prefix : MARKER_PREFIXES) {
            if (text.contains(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String protectSimpleSpans(String text, String open, String close) {
        StringBuilder sb = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            int start = text.indexOf(open, cursor);
            if (start < 0) {
                break;
            }
            int contentStart = start + open.length();
            int end = text.indexOf(close, contentStart);
            if (end < 0) {
                // no later opener can close either
                break;
            }
            sb.append(text, cursor, contentStart);
            sb.append(protect(text.substring(contentStart, end)));
            sb.append(close);
            cursor = end + close.length();
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }

    private static String protectCommentSpans(String text, Map<Integer, Integer> closes) {
        StringBuilder sb = new StringBuilder(text.length());
        int cursor = 0;
        while (cursor < text.length()) {
            int start = text.indexOf(COMMENT_OPEN, cursor);
            if (start < 0) {
                break;
            }
            int contentStart = start + COMMENT_OPEN.length();
            int end = closes.getOrDefault(contentStart, -1);
            if (end < 0) {
                sb.append(text, cursor, contentStart);
                cursor = contentStart;
                continue;
            }
            sb.append(text, cursor, contentStart);
            sb.append(protect(text.substring(contentStart, end)));
            sb.append(COMMENT_CLOSE);
            cursor = end + COMMENT_CLOSE.length();
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }

    private static String protectIdCommentSpans(String text, Map<Integer, Integer> closes) {
        if (!text.contains("{#")) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        Matcher matcher = ID_COMMENT_OPEN.matcher(text);
        int cursor = 0;
        while (cursor < text.length() && matcher.find(cursor)) {
            int contentStart = matcher.end();
            int end = closes.getOrDefault(contentStart, -1);
            if (end < 0) {
                sb.append(text, cursor, contentStart);
                cursor = contentStart;
                continue;
            }
            sb.append(text, cursor, contentStart);
            sb.append(protect(text.substring(contentStart, end)));
            sb.append(COMMENT_CLOSE);
            cursor = end + COMMENT_CLOSE.length();
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }

    private static String protect(String content) {
        return content.replace("\n\n", PARAGRAPH_PLACEHOLDER);
    }
}
