package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;

/**
 * List numbering: one bullet definition shared by all bullet lists and a fresh decimal instance per ordered list
 * so every ordered list restarts at 1.
 */
public class NumberingWriter {

    static final int BULLET_ABSTRACT = 0;
    static final int DECIMAL_ABSTRACT = 1;
    public static final int BULLET_NUM_ID = 1;
    private static final String[] BULLETS = {"•", "◦"};
    private static final int LEVELS = 2;

    private int orderedLists = 0;

    /** Numbering instance for a new ordered list. */
    public int nextOrderedList() {
        orderedLists++;
        return BULLET_NUM_ID + orderedLists;
    }

    public String write() {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<w:numbering xmlns:w=\"").append(Namespaces.W).append("\">");
        sb.append("<w:abstractNum w:abstractNumId=\"").append(BULLET_ABSTRACT).append("\">")
                .append("<w:multiLevelType w:val=\"hybridMultilevel\"/>");
        for (int level = 0; level < LEVELS; level++) {
            level(sb, level, "bullet", BULLETS[level]);
        }
        sb.append("</w:abstractNum>");
        sb.append("<w:abstractNum w:abstractNumId=\"").append(DECIMAL_ABSTRACT).append("\">")
                .append("<w:multiLevelType w:val=\"hybridMultilevel\"/>");
        for (int level = 0; level < LEVELS; level++) {
            level(sb, level, "decimal", "%" + (level + 1) + ".");
        }
        sb.append("</w:abstractNum>");
        sb.append("<w:num w:numId=\"").append(BULLET_NUM_ID).append("\"><w:abstractNumId w:val=\"")
                .append(BULLET_ABSTRACT).append("\"/></w:num>");
        for (int i = 1; i <= orderedLists; i++) {
            sb.append("<w:num w:numId=\"").append(BULLET_NUM_ID + i).append("\"><w:abstractNumId w:val=\"")
                    .append(DECIMAL_ABSTRACT).append("\"/><w:lvlOverride w:ilvl=\"0\"><w:startOverride w:val=\"1\"/>")
                    .append("</w:lvlOverride></w:num>");
        }
        return sb.append("</w:numbering>").toString();
    }

    private static void level(StringBuilder sb, int level, String format, String text) {
        int indent = 720 * (level + 1);
        sb.append("<w:lvl w:ilvl=\"").append(level).append("\"><w:start w:val=\"1\"/><w:numFmt w:val=\"")
                .append(format).append("\"/><w:lvlText w:val=\"").append(Xml.escape(text))
                .append("\"/><w:lvlJc w:val=\"left\"/><w:pPr><w:ind w:left=\"").append(indent)
                .append("\" w:hanging=\"360\"/></w:pPr></w:lvl>");
    }
}
