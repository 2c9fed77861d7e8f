package org.dxworks.manuscript.docx.xml;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads XML into {@link XmlElement} trees with StAX. DTDs and external entities are disabled.
 * Elements nested deeper than the configured limit are dropped with their content.
 */
public class XmlReader {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final String FRAGMENT_ROOT = "fragment";

    private final XMLInputFactory factory;
    private final int maxDepth;

    public XmlReader() {
        this(DEFAULT_MAX_DEPTH);
    }

    public XmlReader(int maxDepth) {
        this.maxDepth = maxDepth;
        this.factory = XMLInputFactory.newInstance();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    public XmlElement parse(byte[] xml) throws XmlParseException {
        try {
            return read(factory.createXMLStreamReader(new ByteArrayInputStream(xml)));
        } catch (XMLStreamException e) {
            throw new XmlParseException("Malformed XML: " + e.getMessage(), e);
        }
    }

    public XmlElement parse(String xml) throws XmlParseException {
        try {
            return read(factory.createXMLStreamReader(new StringReader(xml)));
        } catch (XMLStreamException e) {
            throw new XmlParseException("Malformed XML: " + e.getMessage(), e);
        }
    }

    /**
     * Parses a fragment that uses the document prefixes ({@code w:}, {@code m:}, ...) without declaring them.
     * Returns the first element of the fragment.
     */
    public XmlElement parseFragment(String fragment) throws XmlParseException {
        XmlElement root = parse("<" + FRAGMENT_ROOT + Namespaces.DOCUMENT_DECLARATIONS + ">" + fragment
                + "</" + FRAGMENT_ROOT + ">");
        List<XmlElement> elements = root.elements();
        if (elements.isEmpty()) {
            throw new XmlParseException("Fragment has no element", null);
        }
        return elements.get(0);
    }

    private XmlElement read(XMLStreamReader reader) throws XMLStreamException {
        Deque<Builder> stack = new ArrayDeque<>();
        XmlElement root = null;
        int skipped = 0;
        try {
            while (reader.hasNext()) {
                int event = reader.next();
                switch (event) {
                    case XMLStreamConstants.START_ELEMENT -> {
                        if (skipped > 0 || stack.size() >= maxDepth) {
                            skipped++;
                            continue;
                        }
                        stack.push(new Builder(elementName(reader), attributes(reader)));
                    }
                    case XMLStreamConstants.END_ELEMENT -> {
                        if (skipped > 0) {
                            skipped--;
                            continue;
                        }
                        Builder finished = stack.pop();
                        XmlElement element = new XmlElement(finished.name, finished.attributes, finished.children);
                        if (stack.isEmpty()) {
                            root = element;
                        } else {
                            stack.peek().children.add(element);
                        }
                    }
                    case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA,
                            XMLStreamConstants.SPACE -> {
                        if (skipped == 0 && !stack.isEmpty()) {
                            stack.peek().children.add(new XmlText(reader.getText()));
                        }
                    }
                    default -> {
                        // comments, processing instructions and the document events carry no content
                    }
                }
            }
        } finally {
            reader.close();
        }
        if (root == null) {
            throw new XMLStreamException("Document has no root element");
        }
        return root;
    }

    private static String elementName(XMLStreamReader reader) {
        return Namespaces.qualify(reader.getNamespaceURI(), reader.getPrefix(), reader.getLocalName());
    }

    private static Map<String, String> attributes(XMLStreamReader reader) {
        Map<String, String> attributes = new HashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            String name = Namespaces.qualify(reader.getAttributeNamespace(i), reader.getAttributePrefix(i),
                    reader.getAttributeLocalName(i));
            attributes.put(name, reader.getAttributeValue(i));
        }
        return attributes;
    }

    private static final class Builder {
        private final String name;
        private final Map<String, String> attributes;
        private final List<XmlNode> children = new ArrayList<>();

        Builder(String name, Map<String, String> attributes) {
            this.name = name;
            this.attributes = attributes;
        }
    }
}
