package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes {@code word/styles.xml} for the resolved {@link StyleSettings}.
 */
public final class StylesWriter {

    public static final String TITLE = "Title";
    public static final String HEADING = "Heading";
    public static final String CODE_BLOCK = "CodeBlock";
    public static final String CODE_CHAR = "CodeChar";
    public static final String QUOTE = "Quote";
    public static final String ALERT = "Alert";
    public static final String HYPERLINK = "Hyperlink";
    public static final String HTML_COMMENT = "HtmlComment";
    public static final String LIST_PARAGRAPH = "ListParagraph";
    public static final String TABLE_GRID = "TableGrid";
    public static final String BIBLIOGRAPHY = "Bibliography";
    public static final String COMMENT_TEXT = "CommentText";
    public static final String FOOTNOTE_TEXT = "FootnoteText";
    public static final String FOOTNOTE_REFERENCE = "FootnoteReference";
    public static final String ENDNOTE_TEXT = "EndnoteText";
    public static final String ENDNOTE_REFERENCE = "EndnoteReference";

    private static final String DEFAULT_CODE_BACKGROUND = "F5F5F5";
    public static final List<String> ALERT_TYPES = List.of("NOTE", "TIP", "IMPORTANT", "WARNING", "CAUTION");
    private static final Map<String, String> ALERT_COLORS = Map.of(
            "NOTE", "0969DA", "TIP", "1A7F37", "IMPORTANT", "8250DF", "WARNING", "9A6700", "CAUTION", "CF222E");

    private StylesWriter() {}

    public static String write(StyleSettings settings) {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<w:styles xmlns:w=\"").append(Namespaces.W).append("\">");
        sb.append("<w:docDefaults><w:rPrDefault><w:rPr>").append(fonts(settings.font()))
                .append("<w:sz w:val=\"").append(settings.bodySize()).append("\"/><w:szCs w:val=\"")
                .append(settings.bodySize()).append("\"/><w:lang w:val=\"en-US\"/></w:rPr></w:rPrDefault>")
                .append("<w:pPrDefault><w:pPr><w:spacing w:after=\"160\" w:line=\"259\" w:lineRule=\"auto\"/>")
                .append("</w:pPr></w:pPrDefault></w:docDefaults>");

        sb.append("<w:style w:type=\"paragraph\" w:default=\"1\" w:styleId=\"Normal\"><w:name w:val=\"Normal\"/>")
                .append("<w:qFormat/></w:style>");
        sb.append("<w:style w:type=\"character\" w:default=\"1\" w:styleId=\"DefaultParagraphFont\">")
                .append("<w:name w:val=\"Default Paragraph Font\"/><w:uiPriority w:val=\"1\"/><w:semiHidden/></w:style>");

        paragraphStyle(sb, TITLE, "Title", "<w:spacing w:after=\"80\"/><w:contextualSpacing/>",
                "<w:spacing w:val=\"-10\"/><w:kern w:val=\"28\"/>" + size(settings.titleSize()));
        for (int level = 1; level <= 6; level++) {
            paragraphStyle(sb, HEADING + level, "heading " + level,
                    "<w:keepNext/><w:keepLines/><w:spacing w:before=\"" + (level == 1 ? 360 : 160)
                            + "\" w:after=\"80\"/><w:outlineLvl w:val=\"" + (level - 1) + "\"/>",
                    "<w:b/><w:bCs/>" + (level >= 4 ? "<w:i/><w:iCs/>" : "") + size(settings.headingSize(level)));
        }

        String codeRun = fonts(settings.codeFont()) + color(settings.codeFontColor()) + size(settings.codeSize());
        String background = settings.codeBackgroundColor() == null
                ? DEFAULT_CODE_BACKGROUND : settings.codeBackgroundColor();
        String inset = settings.codeBlockInsetTwips() == null ? ""
                : "<w:ind w:left=\"" + settings.codeBlockInsetTwips() + "\" w:right=\""
                + settings.codeBlockInsetTwips() + "\"/>";
        paragraphStyle(sb, CODE_BLOCK, "Code Block",
                "<w:shd w:val=\"clear\" w:color=\"auto\" w:fill=\"" + background + "\"/>"
                        + "<w:spacing w:after=\"0\" w:line=\"240\" w:lineRule=\"auto\"/>" + inset,
                codeRun);
        sb.append("<w:style w:type=\"character\" w:customStyle=\"1\" w:styleId=\"").append(CODE_CHAR).append("\">")
                .append("<w:name w:val=\"Code Char\"/><w:basedOn w:val=\"DefaultParagraphFont\"/><w:rPr>")
                .append(codeRun).append("<w:shd w:val=\"clear\" w:color=\"auto\" w:fill=\"").append(background)
                .append("\"/></w:rPr></w:style>");

        paragraphStyle(sb, QUOTE, "Quote", "<w:spacing w:before=\"200\"/><w:ind w:left=\"720\" w:right=\"720\"/>",
                "<w:i/><w:iCs/><w:color w:val=\"404040\"/>");
        for (String type : ALERT_TYPES) {
            paragraphStyle(sb, alertStyle(type), "Alert " + type.charAt(0) + type.substring(1).toLowerCase(Locale.ROOT),
                    "<w:pBdr><w:left w:val=\"single\" w:sz=\"24\" w:space=\"8\" w:color=\"" + ALERT_COLORS.get(type)
                            + "\"/></w:pBdr><w:ind w:left=\"360\"/>",
                    "");
        }
        paragraphStyle(sb, LIST_PARAGRAPH, "List Paragraph", "<w:ind w:left=\"720\"/><w:contextualSpacing/>", "");
        paragraphStyle(sb, BIBLIOGRAPHY, "Bibliography", "<w:ind w:left=\"720\" w:hanging=\"720\"/>", "");
        paragraphStyle(sb, COMMENT_TEXT, "annotation text", "<w:spacing w:line=\"240\" w:lineRule=\"auto\"/>",
                size(20));
        paragraphStyle(sb, FOOTNOTE_TEXT, "footnote text", "<w:spacing w:after=\"0\" w:line=\"240\" w:lineRule=\"auto\"/>",
                size(20));
        paragraphStyle(sb, ENDNOTE_TEXT, "endnote text", "<w:spacing w:after=\"0\" w:line=\"240\" w:lineRule=\"auto\"/>",
                size(20));
        characterStyle(sb, FOOTNOTE_REFERENCE, "footnote reference", "<w:vertAlign w:val=\"superscript\"/>");
        characterStyle(sb, ENDNOTE_REFERENCE, "endnote reference", "<w:vertAlign w:val=\"superscript\"/>");
        characterStyle(sb, HYPERLINK, "Hyperlink", "<w:color w:val=\"0563C1\"/><w:u w:val=\"single\"/>");
        characterStyle(sb, HTML_COMMENT, "HTML Comment", "<w:vanish/>");

        sb.append("<w:style w:type=\"table\" w:styleId=\"").append(TABLE_GRID).append("\"><w:name w:val=\"Table Grid\"/>")
                .append("<w:pPr><w:spacing w:after=\"0\" w:line=\"240\" w:lineRule=\"auto\"/></w:pPr><w:tblPr><w:tblBorders>");
        for (String side : new String[]{"top", "left", "bottom", "right", "insideH", "insideV"}) {
            sb.append("<w:").append(side).append(" w:val=\"single\" w:sz=\"4\" w:space=\"0\" w:color=\"auto\"/>");
        }
        sb.append("</w:tblBorders><w:tblCellMar><w:left w:w=\"108\" w:type=\"dxa\"/><w:right w:w=\"108\" w:type=\"dxa\"/>")
                .append("</w:tblCellMar></w:tblPr></w:style>");
        return sb.append("</w:styles>").toString();
    }

    public static String alertStyle(String alertType) {
        String type = alertType.toUpperCase(Locale.ROOT);
        return ALERT + type.charAt(0) + type.substring(1).toLowerCase(Locale.ROOT);
    }

    private static void paragraphStyle(StringBuilder sb, String id, String name, String paragraph, String run) {
        sb.append("<w:style w:type=\"paragraph\" w:styleId=\"").append(id).append("\"><w:name w:val=\"")
                .append(name).append("\"/><w:basedOn w:val=\"Normal\"/><w:next w:val=\"Normal\"/><w:qFormat/>");
        if (!paragraph.isEmpty()) {
            sb.append("<w:pPr>").append(paragraph).append("</w:pPr>");
        }
        if (!run.isEmpty()) {
            sb.append("<w:rPr>").append(run).append("</w:rPr>");
        }
        sb.append("</w:style>");
    }

    private static void characterStyle(StringBuilder sb, String id, String name, String run) {
        sb.append("<w:style w:type=\"character\" w:styleId=\"").append(id).append("\"><w:name w:val=\"").append(name)
                .append("\"/><w:basedOn w:val=\"DefaultParagraphFont\"/><w:rPr>").append(run).append("</w:rPr></w:style>");
    }

    private static String fonts(String font) {
        String escaped = Xml.escape(font);
        return "<w:rFonts w:ascii=\"" + escaped + "\" w:hAnsi=\"" + escaped + "\" w:eastAsia=\"" + escaped
                + "\" w:cs=\"" + escaped + "\"/>";
    }

    private static String size(int halfPoints) {
        return "<w:sz w:val=\"" + halfPoints + "\"/><w:szCs w:val=\"" + halfPoints + "\"/>";
    }

    private static String color(String rgb) {
        return rgb == null ? "" : "<w:color w:val=\"" + rgb + "\"/>";
    }
}
