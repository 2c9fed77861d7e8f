package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;
import org.dxworks.manuscript.model.Frontmatter;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Package-level parts: content types, relationships of the package, document properties and settings.
 */
public final class PackageParts {

    public static final String ZOTERO_PREF = "ZOTERO_PREF_";
    public static final String ZOTERO_STYLE_PREFIX = "http://www.zotero.org/styles/";
    private static final int ZOTERO_PREF_CHUNK = 240;

    private static final String MAIN_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml";

    private PackageParts() {}

    public static String contentTypes(Set<String> partNames, Set<String> imageExtensions) {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<Types xmlns=\"").append(Namespaces.CONTENT_TYPES).append("\">")
                .append("<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>")
                .append("<Default Extension=\"xml\" ContentType=\"application/xml\"/>");
        for (String extension : imageExtensions) {
            sb.append("<Default Extension=\"").append(extension).append("\" ContentType=\"image/")
                    .append(extension.equals("jpg") ? "jpeg" : extension).append("\"/>");
        }
        override(sb, partNames, DocxPackage.DOCUMENT, MAIN_TYPE + ".document.main+xml");
        override(sb, partNames, DocxPackage.STYLES, MAIN_TYPE + ".styles+xml");
        override(sb, partNames, DocxPackage.SETTINGS, MAIN_TYPE + ".settings+xml");
        override(sb, partNames, DocxPackage.NUMBERING, MAIN_TYPE + ".numbering+xml");
        override(sb, partNames, DocxPackage.COMMENTS, MAIN_TYPE + ".comments+xml");
        override(sb, partNames, DocxPackage.COMMENTS_EXTENDED, MAIN_TYPE + ".commentsExtended+xml");
        override(sb, partNames, DocxPackage.FOOTNOTES, MAIN_TYPE + ".footnotes+xml");
        override(sb, partNames, DocxPackage.ENDNOTES, MAIN_TYPE + ".endnotes+xml");
        override(sb, partNames, DocxPackage.CORE_PROPERTIES, "application/vnd.openxmlformats-package.core-properties+xml");
        override(sb, partNames, DocxPackage.CUSTOM_PROPERTIES,
                "application/vnd.openxmlformats-officedocument.custom-properties+xml");
        return sb.append("</Types>").toString();
    }

    public static String packageRelationships(boolean withCustomProperties) {
        Relationships relationships = new Relationships();
        relationships.add(Relationships.OFFICE_DOCUMENT, DocxPackage.DOCUMENT);
        relationships.add(Relationships.CORE_PROPERTIES, DocxPackage.CORE_PROPERTIES);
        if (withCustomProperties) {
            relationships.add(Relationships.CUSTOM_PROPERTIES, DocxPackage.CUSTOM_PROPERTIES);
        }
        return relationships.toXml();
    }

    public static String coreProperties(Frontmatter frontmatter, Instant now) {
        String timestamp = now.truncatedTo(ChronoUnit.SECONDS).toString();
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<cp:coreProperties xmlns:cp=\"").append(Namespaces.CORE_PROPERTIES)
                .append("\" xmlns:dc=\"").append(Namespaces.DC)
                .append("\" xmlns:dcterms=\"").append(Namespaces.DCTERMS)
                .append("\" xmlns:xsi=\"").append(Namespaces.XSI).append("\">");
        if (!frontmatter.titles.isEmpty()) {
            sb.append("<dc:title>").append(Xml.escape(frontmatter.titles.get(0))).append("</dc:title>");
        }
        if (frontmatter.author != null) {
            sb.append("<dc:creator>").append(Xml.escape(frontmatter.author)).append("</dc:creator>");
            sb.append("<cp:lastModifiedBy>").append(Xml.escape(frontmatter.author)).append("</cp:lastModifiedBy>");
        }
        sb.append("<dcterms:created xsi:type=\"dcterms:W3CDTF\">").append(timestamp).append("</dcterms:created>");
        sb.append("<dcterms:modified xsi:type=\"dcterms:W3CDTF\">").append(timestamp).append("</dcterms:modified>");
        return sb.append("</cp:coreProperties>").toString();
    }

    /**
     * Frontmatter settings without a native home, by frontmatter key. The citation style also goes into the
     * document preferences Zotero reads. Null when there is nothing to store.
     */
    public static String customProperties(Frontmatter frontmatter) {
        Map<String, String> properties = new LinkedHashMap<>();
        putIfPresent(properties, "csl", frontmatter.csl);
        putIfPresent(properties, "locale", frontmatter.locale);
        putIfPresent(properties, "note-type", frontmatter.noteType == null ? null : frontmatter.noteType.getId());
        putIfPresent(properties, "timezone", frontmatter.timezone);
        putIfPresent(properties, "bibliography", frontmatter.bibliography);
        putIfPresent(properties, "font", frontmatter.font);
        putIfPresent(properties, "font-size", number(frontmatter.fontSize));
        putIfPresent(properties, "code-font", frontmatter.codeFont);
        putIfPresent(properties, "code-font-size", number(frontmatter.codeFontSize));
        putIfPresent(properties, "code-background-color", frontmatter.codeBackgroundColor);
        putIfPresent(properties, "code-font-color", frontmatter.codeFontColor);
        putIfPresent(properties, "code-block-inset", number(frontmatter.codeBlockInset));
        if (frontmatter.csl != null) {
            String preferences = zoteroPreferences(frontmatter);
            int chunk = 1;
            for (int i = 0; i < preferences.length(); i += ZOTERO_PREF_CHUNK) {
                properties.put(ZOTERO_PREF + chunk++,
                        preferences.substring(i, Math.min(preferences.length(), i + ZOTERO_PREF_CHUNK)));
            }
        }
        if (properties.isEmpty()) {
            return null;
        }

        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<Properties xmlns=\"").append(Namespaces.CUSTOM_PROPERTIES).append("\" xmlns:vt=\"")
                .append(Namespaces.VT).append("\">");
        int pid = 2;
        for (Map.Entry<String, String> property : properties.entrySet()) {
            sb.append("<property fmtid=\"{D5CDD505-2E9C-101B-9397-08002B2CF9AE}\" pid=\"").append(pid++)
                    .append("\" name=\"").append(Xml.escape(property.getKey())).append("\"><vt:lpwstr>")
                    .append(Xml.escape(property.getValue())).append("</vt:lpwstr></property>");
        }
        return sb.append("</Properties>").toString();
    }

    public static String settings(boolean footnotes, boolean endnotes) {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<w:settings xmlns:w=\"").append(Namespaces.W).append("\" xmlns:m=\"").append(Namespaces.M).append("\">")
                .append("<w:zoom w:percent=\"100\"/><w:defaultTabStop w:val=\"720\"/>")
                .append("<w:characterSpacingControl w:val=\"doNotCompress\"/>");
        if (footnotes) {
            sb.append("<w:footnotePr><w:footnote w:id=\"-1\"/><w:footnote w:id=\"0\"/></w:footnotePr>");
        }
        if (endnotes) {
            sb.append("<w:endnotePr><w:endnote w:id=\"-1\"/><w:endnote w:id=\"0\"/></w:endnotePr>");
        }
        sb.append("<w:compat><w:compatSetting w:name=\"compatibilityMode\" w:uri=\"http://schemas.microsoft.com/office/word\"")
                .append(" w:val=\"15\"/></w:compat>")
                .append("<m:mathPr><m:mathFont m:val=\"Cambria Math\"/><m:dispDef/></m:mathPr>");
        return sb.append("</w:settings>").toString();
    }

    private static String zoteroPreferences(Frontmatter frontmatter) {
        String style = frontmatter.csl.startsWith("http") ? frontmatter.csl : ZOTERO_STYLE_PREFIX + frontmatter.csl;
        int noteType = frontmatter.noteType == null ? 0 : frontmatter.noteType.ordinal();
        StringBuilder sb = new StringBuilder("<data data-version=\"3\"><style id=\"").append(Xml.escape(style)).append('"');
        if (frontmatter.locale != null) {
            sb.append(" locale=\"").append(Xml.escape(frontmatter.locale)).append('"');
        }
        sb.append(" hasBibliography=\"1\" bibliographyStyleHasBeenSet=\"1\"/><prefs>")
                .append("<pref name=\"fieldType\" value=\"Field\"/>")
                .append("<pref name=\"noteType\" value=\"").append(noteType).append("\"/>")
                .append("</prefs></data>");
        return sb.toString();
    }

    private static void override(StringBuilder sb, Set<String> partNames, String partName, String contentType) {
        if (partNames.contains(partName)) {
            sb.append("<Override PartName=\"/").append(partName).append("\" ContentType=\"").append(contentType)
                    .append("\"/>");
        }
    }

    private static void putIfPresent(Map<String, String> properties, String name, String value) {
        if (value != null) {
            properties.put(name, value);
        }
    }

    private static String number(Double value) {
        if (value == null) {
            return null;
        }
        return value == Math.rint(value) ? String.valueOf(value.longValue()) : String.valueOf(value);
    }
}
