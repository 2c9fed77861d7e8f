package org.dxworks.manuscript.model;

import java.util.List;

/**
 * Result of Markdown to DOCX conversion: the package bytes plus non-fatal warnings.
 */
public record DocxConversion(byte[] docx, List<String> warnings) {

    public DocxConversion {
        warnings = List.copyOf(warnings);
    }
}
