package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;

import java.util.ArrayList;
import java.util.List;

/**
 * Footnotes or endnotes part. Ids -1 and 0 are the separator notes, user notes start at 1.
 */
public class NotesWriter {

    private final boolean endnotes;
    private final List<String> notes = new ArrayList<>();

    public NotesWriter(boolean endnotes) {
        this.endnotes = endnotes;
    }

    public boolean isEndnotes() {
        return endnotes;
    }

    /** Adds a note whose paragraph content is {@code runsXml} and returns its id. */
    public int add(String runsXml) {
        notes.add(runsXml);
        return notes.size();
    }

    public boolean isEmpty() {
        return notes.isEmpty();
    }

    public String partName() {
        return endnotes ? DocxPackage.ENDNOTES : DocxPackage.FOOTNOTES;
    }

    public String relationshipType() {
        return endnotes ? Relationships.ENDNOTES : Relationships.FOOTNOTES;
    }

    public String referenceElement(int id) {
        return "<w:r><w:rPr><w:rStyle w:val=\"" + referenceStyle() + "\"/></w:rPr><w:" + kind()
                + "Reference w:id=\"" + id + "\"/></w:r>";
    }

    public String write() {
        String kind = kind();
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<w:").append(kind).append('s').append(Namespaces.DOCUMENT_DECLARATIONS).append('>');
        sb.append("<w:").append(kind).append(" w:type=\"separator\" w:id=\"-1\"><w:p><w:pPr><w:spacing w:after=\"0\"")
                .append(" w:line=\"240\" w:lineRule=\"auto\"/></w:pPr><w:r><w:separator/></w:r></w:p></w:")
                .append(kind).append('>');
        sb.append("<w:").append(kind).append(" w:type=\"continuationSeparator\" w:id=\"0\"><w:p><w:pPr><w:spacing")
                .append(" w:after=\"0\" w:line=\"240\" w:lineRule=\"auto\"/></w:pPr><w:r><w:continuationSeparator/>")
                .append("</w:r></w:p></w:").append(kind).append('>');
        for (int i = 0; i < notes.size(); i++) {
            sb.append("<w:").append(kind).append(" w:id=\"").append(i + 1).append("\"><w:p><w:pPr><w:pStyle w:val=\"")
                    .append(endnotes ? StylesWriter.ENDNOTE_TEXT : StylesWriter.FOOTNOTE_TEXT)
                    .append("\"/></w:pPr><w:r><w:rPr><w:rStyle w:val=\"").append(referenceStyle())
                    .append("\"/></w:rPr><w:").append(kind).append("Ref/></w:r><w:r><w:t xml:space=\"preserve\"> </w:t></w:r>")
                    .append(notes.get(i)).append("</w:p></w:").append(kind).append('>');
        }
        return sb.append("</w:").append(kind).append("s>").toString();
    }

    private String kind() {
        return endnotes ? "endnote" : "footnote";
    }

    private String referenceStyle() {
        return endnotes ? StylesWriter.ENDNOTE_REFERENCE : StylesWriter.FOOTNOTE_REFERENCE;
    }
}
