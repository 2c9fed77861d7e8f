package org.dxworks.manuscript.docx.xml;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Element with a canonical prefixed name such as {@code w:p}, see {@link Namespaces}.
 */
public record XmlElement(String name, Map<String, String> attributes, List<XmlNode> children) implements XmlNode {

    public XmlElement {
        attributes = Map.copyOf(attributes);
        children = List.copyOf(children);
    }

    public String attr(String attributeName) {
        return attributes.get(attributeName);
    }

    public boolean is(String elementName) {
        return name.equals(elementName);
    }

    public String prefix() {
        int colon = name.indexOf(':');
        return colon < 0 ? "" : name.substring(0, colon);
    }

    public String localName() {
        int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(colon + 1);
    }

    public List<XmlElement> elements() {
        List<XmlElement> result = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement element) {
                result.add(element);
            }
        }
        return result;
    }

    public List<XmlElement> elements(String elementName) {
        List<XmlElement> result = new ArrayList<>();
        for (XmlNode child : children) {
            if (child instanceof XmlElement element && element.is(elementName)) {
                result.add(element);
            }
        }
        return result;
    }

    public Optional<XmlElement> child(String elementName) {
        for (XmlNode child : children) {
            if (child instanceof XmlElement element && element.is(elementName)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }

    /** Value of {@code attributeName} on the first child named {@code elementName}. */
    public Optional<String> childAttr(String elementName, String attributeName) {
        return child(elementName).map(element -> element.attr(attributeName));
    }

    /** Concatenated text of all descendants, down to {@code maxDepth} levels. */
    public String text(int maxDepth) {
        StringBuilder sb = new StringBuilder();
        appendText(this, sb, 0, maxDepth);
        return sb.toString();
    }

    /** All descendants named {@code elementName} in document order, down to {@code maxDepth} levels. */
    public List<XmlElement> findAll(String elementName, int maxDepth) {
        List<XmlElement> result = new ArrayList<>();
        collect(this, elementName, result, 0, maxDepth);
        return result;
    }

    private static void appendText(XmlElement element, StringBuilder sb, int depth, int maxDepth) {
        if (depth > maxDepth) {
            return;
        }
        for (XmlNode child : element.children) {
            if (child instanceof XmlText text) {
                sb.append(text.text());
            } else if (child instanceof XmlElement nested) {
                appendText(nested, sb, depth + 1, maxDepth);
            }
        }
    }

    private static void collect(XmlElement element, String elementName, List<XmlElement> result,
                                int depth, int maxDepth) {
        if (depth > maxDepth) {
            return;
        }
        for (XmlNode child : element.children) {
            if (child instanceof XmlElement nested) {
                if (nested.is(elementName)) {
                    result.add(nested);
                }
                collect(nested, elementName, result, depth + 1, maxDepth);
            }
        }
    }
}
