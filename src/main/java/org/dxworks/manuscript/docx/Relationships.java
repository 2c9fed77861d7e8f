package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;
import org.dxworks.manuscript.docx.xml.XmlElement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relationship part of a package source: allocated while generating, read back while extracting.
 */
public class Relationships {

    public static final String OFFICE = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/";
    public static final String STYLES = OFFICE + "styles";
    public static final String SETTINGS = OFFICE + "settings";
    public static final String NUMBERING = OFFICE + "numbering";
    public static final String COMMENTS = OFFICE + "comments";
    public static final String COMMENTS_EXTENDED = "http://schemas.microsoft.com/office/2011/relationships/commentsExtended";
    public static final String FOOTNOTES = OFFICE + "footnotes";
    public static final String ENDNOTES = OFFICE + "endnotes";
    public static final String HYPERLINK = OFFICE + "hyperlink";
    public static final String IMAGE = OFFICE + "image";
    public static final String OFFICE_DOCUMENT = OFFICE + "officeDocument";
    public static final String CORE_PROPERTIES =
            "http://schemas.openxmlformats.org/package/2006/relationships/metadata/core-properties";
    public static final String CUSTOM_PROPERTIES = OFFICE + "custom-properties";

    public record Relationship(String id, String type, String target, boolean external) {
    }

    private final Map<String, Relationship> byId = new LinkedHashMap<>();

    public String add(String type, String target) {
        return add(type, target, false);
    }

    public String add(String type, String target, boolean external) {
        String id = "rId" + (byId.size() + 1);
        byId.put(id, new Relationship(id, type, target, external));
        return id;
    }

    /** Id of an existing external relationship to {@code target}, or a new one. */
    public String hyperlink(String target) {
        for (Relationship relationship : byId.values()) {
            if (relationship.external() && relationship.type().equals(HYPERLINK) && relationship.target().equals(target)) {
                return relationship.id();
            }
        }
        return add(HYPERLINK, target, true);
    }

    public Optional<Relationship> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public List<Relationship> all() {
        return new ArrayList<>(byId.values());
    }

    public String toXml() {
        StringBuilder sb = new StringBuilder(Xml.DECLARATION);
        sb.append("<Relationships xmlns=\"").append(Namespaces.PACKAGE_RELATIONSHIPS).append("\">");
        for (Relationship relationship : byId.values()) {
            sb.append("<Relationship Id=\"").append(relationship.id())
                    .append("\" Type=\"").append(relationship.type())
                    .append("\" Target=\"").append(Xml.escape(relationship.target())).append('"');
            if (relationship.external()) {
                sb.append(" TargetMode=\"External\"");
            }
            sb.append("/>");
        }
        return sb.append("</Relationships>").toString();
    }

    public static Relationships read(XmlElement root) {
        Relationships relationships = new Relationships();
        for (XmlElement element : root.elements("Relationship")) {
            String id = element.attr("Id");
            if (id != null) {
                relationships.byId.put(id, new Relationship(id, element.attr("Type"), element.attr("Target"),
                        "External".equals(element.attr("TargetMode"))));
            }
        }
        return relationships;
    }
}
