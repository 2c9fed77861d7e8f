package org.dxworks.manuscript.model;

import java.util.List;
import java.util.Map;

/**
 * Result of DOCX to Markdown conversion. {@code media} maps relative paths used in the Markdown to image bytes.
 */
public record MarkdownConversion(String markdown, String bibtex, Map<String, byte[]> media, List<String> warnings) {

    public MarkdownConversion {
        media = Map.copyOf(media);
        warnings = List.copyOf(warnings);
    }
}
