package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects native comments while the body is written and produces {@code comments.xml} and, when any comment
 * is a reply, {@code commentsExtended.xml}.
 */
public class CommentsWriter {

    private static final int PARA_ID_BASE = 0x10000000;

    record NativeComment(int id, String author, String date, String text, String paraId, String parentParaId) {
    }

    private final List<NativeComment> comments = new ArrayList<>();

    /** Registers a comment and returns its native id. A null {@code parentId} makes it a thread root. */
    public int add(String author, String date, String text, Integer parentId) {
        int id = comments.size();
        String parentParaId = parentId == null ? null : paraId(parentId);
        comments.add(new NativeComment(id, author, date, text == null ? "" : text, paraId(id), parentParaId));
        return id;
    }

    public boolean isEmpty() {
        return comments.isEmpty();
    }

    public boolean hasReplies() {
        return comments.stream().anyMatch(comment -> comment.parentParaId() != null);
    }

    public int size() {
        return comments.size();
    }

    public String writeComments() {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<w:comments").append(Namespaces.DOCUMENT_DECLARATIONS).append('>');
        for (NativeComment comment : comments) {
            sb.append("<w:comment w:id=\"").append(comment.id()).append("\" w:author=\"")
                    .append(Xml.escape(comment.author())).append("\" w:date=\"").append(comment.date())
                    .append("\" w:initials=\"").append(Xml.escape(initials(comment.author()))).append("\">");
            String[] paragraphs = comment.text().split("\n\n", -1);
            for (int i = 0; i < paragraphs.length; i++) {
                boolean last = i == paragraphs.length - 1;
                sb.append("<w:p");
                if (last) {
                    // replies point at the paragraph id of the last paragraph
                    sb.append(" w14:paraId=\"").append(comment.paraId()).append("\" w14:textId=\"77777777\"");
                }
                sb.append("><w:pPr><w:pStyle w:val=\"").append(StylesWriter.COMMENT_TEXT).append("\"/></w:pPr>");
                if (i == 0) {
                    sb.append("<w:r><w:annotationRef/></w:r>");
                }
                String[] lines = paragraphs[i].split("\n", -1);
                for (int l = 0; l < lines.length; l++) {
                    if (l > 0) {
                        sb.append("<w:r><w:br/></w:r>");
                    }
                    if (!lines[l].isEmpty()) {
                        sb.append("<w:r>").append(Xml.textElement("w:t", lines[l])).append("</w:r>");
                    }
                }
                sb.append("</w:p>");
            }
            sb.append("</w:comment>");
        }
        return sb.append("</w:comments>").toString();
    }

    public String writeCommentsExtended() {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<w15:commentsEx").append(Namespaces.DOCUMENT_DECLARATIONS).append('>');
        for (NativeComment comment : comments) {
            sb.append("<w15:commentEx w15:paraId=\"").append(comment.paraId()).append('"');
            if (comment.parentParaId() != null) {
                sb.append(" w15:paraIdParent=\"").append(comment.parentParaId()).append('"');
            }
            sb.append(" w15:done=\"0\"/>");
        }
        return sb.append("</w15:commentsEx>").toString();
    }

    static String paraId(int commentId) {
        return String.format("%08X", PARA_ID_BASE + commentId + 1);
    }

    private static String initials(String author) {
        StringBuilder sb = new StringBuilder();
        for (String part : author.trim().split("\\s+")) {
            if (!part.isEmpty()) {
                sb.append(Character.toUpperCase(part.charAt(0)));
            }
        }
        return sb.toString();
    }
}
