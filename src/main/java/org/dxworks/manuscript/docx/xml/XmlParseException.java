package org.dxworks.manuscript.docx.xml;

import java.io.IOException;

public class XmlParseException extends IOException {

    public XmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
