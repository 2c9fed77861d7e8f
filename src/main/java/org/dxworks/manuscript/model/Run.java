package org.dxworks.manuscript.model;

import java.util.List;

/**
 * Inline unit of a {@link Token}. Only the fields relevant to {@link #type()} are set, the rest are null.
 */
public record Run(RunType type,
                  String text,
                  String newText,           // substitution replacement text
                  RunFormatting formatting,
                  String href,              // link target for text runs
                  HighlightColor highlightColor,
                  boolean display,          // display math
                  List<CitationReference> citations,
                  CommentNode comment,
                  String commentId,         // ID-syntax comments and range markers
                  String footnoteId,
                  String imageSource) {

    public Run {
        if (formatting == null) {
            formatting = RunFormatting.NONE;
        }
        if (type == RunType.CRITIC_SUBSTITUTION && (text == null || newText == null)) {
            throw new IllegalArgumentException("Substitution needs both old and new text");
        }
        if (type == RunType.CITATION && (citations == null || citations.isEmpty())) {
            throw new IllegalArgumentException("Citation run needs at least one key");
        }
        if (citations != null) {
            citations = List.copyOf(citations);
        }
    }

    public static Run text(String text) {
        return text(text, RunFormatting.NONE);
    }

    public static Run text(String text, RunFormatting formatting) {
        return new Run(RunType.TEXT, text, null, formatting, null, null, false, null, null, null, null, null);
    }

    public static Run code(String text) {
        return new Run(RunType.CODE, text, null, null, null, null, false, null, null, null, null, null);
    }

    public static Run math(String latex, boolean display) {
        return new Run(RunType.MATH, latex, null, null, null, null, display, null, null, null, null, null);
    }

    public static Run citation(String source, List<CitationReference> citations) {
        return new Run(RunType.CITATION, source, null, null, null, null, false, citations, null, null, null, null);
    }

    public static Run addition(String text) {
        return new Run(RunType.CRITIC_ADDITION, text, null, null, null, null, false, null, null, null, null, null);
    }

    public static Run deletion(String text) {
        return new Run(RunType.CRITIC_DELETION, text, null, null, null, null, false, null, null, null, null, null);
    }

    public static Run substitution(String oldText, String newText) {
        return new Run(RunType.CRITIC_SUBSTITUTION, oldText, newText, null, null, null, false, null, null, null,
                null, null);
    }

    public static Run criticHighlight(String text) {
        return new Run(RunType.CRITIC_HIGHLIGHT, text, null, null, null, null, false, null, null, null, null, null);
    }

    public static Run comment(CommentNode comment, String commentId) {
        return new Run(RunType.CRITIC_COMMENT, comment.text, null, null, null, null, false, null, comment, commentId,
                null, null);
    }

    public static Run commentRangeStart(String commentId) {
        return new Run(RunType.COMMENT_RANGE_START, "", null, null, null, null, false, null, null, commentId, null,
                null);
    }

    public static Run commentRangeEnd(String commentId) {
        return new Run(RunType.COMMENT_RANGE_END, "", null, null, null, null, false, null, null, commentId, null,
                null);
    }

    /** A {@code ==text==} highlight; a null color means the configured default. */
    public static Run highlight(String text, HighlightColor color, RunFormatting formatting) {
        return new Run(RunType.HIGHLIGHT, text, null, formatting, null, color, false, null, null, null, null, null);
    }

    public static Run footnoteReference(String footnoteId) {
        return new Run(RunType.FOOTNOTE_REFERENCE, "[^" + footnoteId + "]", null, null, null, null, false, null, null,
                null, footnoteId, null);
    }

    public static Run image(String altText, String source) {
        return new Run(RunType.IMAGE, altText, null, null, null, null, false, null, null, null, null, source);
    }

    /** An HTML comment, delimiters included; it is kept out of sight and restored as written. */
    public static Run htmlComment(String text) {
        return new Run(RunType.HTML_COMMENT, text, null, null, null, null, false, null, null, null, null, null);
    }

    public static Run softBreak() {
        return new Run(RunType.SOFT_BREAK, "\n", null, null, null, null, false, null, null, null, null, null);
    }

    public Run withFormatting(RunFormatting extra) {
        return new Run(type, text, newText, formatting.merge(extra), href, highlightColor, display, citations,
                comment, commentId, footnoteId, imageSource);
    }

    public Run withHref(String target) {
        return new Run(type, text, newText, formatting, target, highlightColor, display, citations, comment,
                commentId, footnoteId, imageSource);
    }
}
