package org.dxworks.manuscript.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One cited bibliographic item as recovered from a citation field. Many instances may share an identity.
 */
public class CitationMetadata {
    public List<CslName> authors = new ArrayList<>();
    public String title;
    public String year;
    public String journal;
    public String volume;
    public String pages;
    public String publisher;
    public String doi;
    public String cslType;
    public String zoteroUri;
    public String locator;
    public ObjectNode itemData; // raw CSL item data, may be null

    /**
     * DOI when present, otherwise title and year. Identical identities always map to the same citation key.
     */
    public String identity() {
        if (doi != null && !doi.isBlank()) {
            return "doi:" + doi.trim().toLowerCase(Locale.ROOT);
        }
        String normalizedTitle = title == null ? "" : title.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return normalizedTitle + "::" + (year == null ? "" : year.trim());
    }
}
