package org.dxworks.manuscript.docx.xml;

/**
 * Parsed XML: either an element or a text leaf.
 */
public sealed interface XmlNode permits XmlElement, XmlText {
}
