package org.dxworks.manuscript.docx.xml;

public record XmlText(String text) implements XmlNode {
}
