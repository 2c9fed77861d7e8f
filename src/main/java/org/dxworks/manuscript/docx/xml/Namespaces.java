package org.dxworks.manuscript.docx.xml;

import java.util.Map;

/**
 * Namespace URIs used in WordprocessingML packages and the prefixes element names are normalized to.
 */
public final class Namespaces {

    public static final String W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String M = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    public static final String R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String W14 = "http://schemas.microsoft.com/office/word/2010/wordml";
    public static final String W15 = "http://schemas.microsoft.com/office/word/2012/wordml";
    public static final String WP = "http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing";
    public static final String A = "http://schemas.openxmlformats.org/drawingml/2006/main";
    public static final String PIC = "http://schemas.openxmlformats.org/drawingml/2006/picture";
    public static final String MC = "http://schemas.openxmlformats.org/markup-compatibility/2006";
    public static final String PACKAGE_RELATIONSHIPS = "http://schemas.openxmlformats.org/package/2006/relationships";
    public static final String CONTENT_TYPES = "http://schemas.openxmlformats.org/package/2006/content-types";
    public static final String CORE_PROPERTIES = "http://schemas.openxmlformats.org/package/2006/metadata/core-properties";
    public static final String CUSTOM_PROPERTIES = "http://schemas.openxmlformats.org/officeDocument/2006/custom-properties";
    public static final String VT = "http://schemas.openxmlformats.org/officeDocument/2006/docPropsVTypes";
    public static final String DC = "http://purl.org/dc/elements/1.1/";
    public static final String DCTERMS = "http://purl.org/dc/terms/";
    public static final String XSI = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String XML = "http://www.w3.org/XML/1998/namespace";

    private static final Map<String, String> PREFIXES = Map.ofEntries(
            Map.entry(W, "w"),
            Map.entry(M, "m"),
            Map.entry(R, "r"),
            Map.entry(W14, "w14"),
            Map.entry(W15, "w15"),
            Map.entry(WP, "wp"),
            Map.entry(A, "a"),
            Map.entry(PIC, "pic"),
            Map.entry(MC, "mc"),
            Map.entry(PACKAGE_RELATIONSHIPS, ""),
            Map.entry(CONTENT_TYPES, ""),
            Map.entry(CORE_PROPERTIES, "cp"),
            Map.entry(CUSTOM_PROPERTIES, ""),
            Map.entry(VT, "vt"),
            Map.entry(DC, "dc"),
            Map.entry(DCTERMS, "dcterms"),
            Map.entry(XSI, "xsi"),
            Map.entry(XML, "xml")
    );

    /** Declarations for the main document part and the parts that share its vocabulary. */
    public static final String DOCUMENT_DECLARATIONS = " xmlns:w=\"" + W + "\" xmlns:m=\"" + M + "\" xmlns:r=\"" + R
            + "\" xmlns:w14=\"" + W14 + "\" xmlns:w15=\"" + W15 + "\" xmlns:wp=\"" + WP + "\" xmlns:a=\"" + A
            + "\" xmlns:pic=\"" + PIC + "\" xmlns:mc=\"" + MC + "\" mc:Ignorable=\"w14 w15\"";

    private Namespaces() {}

    /** Canonical prefix for a namespace URI, or null when the namespace is not known. */
    public static String prefixFor(String namespaceUri) {
        return namespaceUri == null ? null : PREFIXES.get(namespaceUri);
    }

    public static String qualify(String namespaceUri, String documentPrefix, String localName) {
        String prefix = prefixFor(namespaceUri);
        if (prefix == null) {
            prefix = documentPrefix == null ? "" : documentPrefix;
        }
        return prefix.isEmpty() ? localName : prefix + ":" + localName;
    }
}
