package org.dxworks.manuscript.docx;

import java.io.IOException;

/**
 * The input is not a readable DOCX package: not a zip archive, no main document part, or a main document
 * that is not well-formed XML.
 */
public class DocxFormatException extends IOException {

    public DocxFormatException(String message) {
        super(message);
    }

    public DocxFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
