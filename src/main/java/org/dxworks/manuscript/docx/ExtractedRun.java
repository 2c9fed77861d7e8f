package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.HighlightColor;
import org.dxworks.manuscript.model.RunFormatting;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inline content read from a document body, before it is rendered as Markdown.
 */
class ExtractedRun {

    enum Kind {
        TEXT, CODE, INSERTION, DELETION, SUBSTITUTION, MATH, CITATION, FOOTNOTE, IMAGE, COMMENT_POINT, HTML_COMMENT
    }

    Kind kind;
    String text = "";
    String newText;                 // substitution replacement
    RunFormatting formatting = RunFormatting.NONE;
    String href;
    HighlightColor highlight;
    boolean display;                // display math
    List<CitationMetadata> citations = new ArrayList<>();
    String footnoteLabel;
    String imagePath;
    String commentId;               // point comments
    Set<String> commentIds = new LinkedHashSet<>();   // thread roots whose range covers this run

    ExtractedRun(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    boolean isTextual() {
        return kind == Kind.TEXT || kind == Kind.CODE || kind == Kind.INSERTION || kind == Kind.DELETION;
    }

    /** Same kind and decoration, so the two can be written as one piece. */
    boolean canMerge(ExtractedRun other) {
        return isTextual() && kind == other.kind
                && formatting.equals(other.formatting)
                && Objects.equals(href, other.href)
                && highlight == other.highlight
                && commentIds.equals(other.commentIds);
    }
}
