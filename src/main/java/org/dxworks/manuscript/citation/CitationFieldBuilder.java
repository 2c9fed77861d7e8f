package org.dxworks.manuscript.citation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.manuscript.bibtex.Bibliography;
import org.dxworks.manuscript.model.BibtexEntry;
import org.dxworks.manuscript.model.CitationReference;
import org.dxworks.manuscript.model.CslName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds Zotero {@code ADDIN ZOTERO_ITEM CSL_CITATION} field instructions for citation groups. One builder serves
 * one generation pass: numeric item ids are assigned in first-seen order and stay stable for the whole document.
 */
public class CitationFieldBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(CitationFieldBuilder.class);

    public static final String CITATION_PREFIX = "ADDIN ZOTERO_ITEM CSL_CITATION";
    public static final String BIBLIOGRAPHY_INSTRUCTION =
            " ADDIN ZOTERO_BIBL {\"uncited\":[],\"omitted\":[],\"custom\":[]} CSL_BIBLIOGRAPHY ";
    private static final String SCHEMA = "https://github.com/citation-style-language/schema/raw/master/csl-citation.json";
    private static final Pattern PAGE_PREFIX = Pattern.compile("^(?:pp?\\.)\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper mapper = new ObjectMapper();
    private final Bibliography bibliography;
    private final Map<String, Integer> numericIds = new LinkedHashMap<>();
    private final Set<String> citedKeys = new LinkedHashSet<>();
    private int citationCounter = 0;

    public CitationFieldBuilder(Bibliography bibliography) {
        this.bibliography = bibliography;
    }

    public CitationField build(List<CitationReference> references, List<String> warnings) {
        List<CitationReference> resolved = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (CitationReference reference : references) {
            if (bibliography.contains(reference.key())) {
                resolved.add(reference);
            } else {
                missing.add("@" + reference.key());
                warnings.add("Citation key not found: " + reference.key());
                LOG.warn("Citation key not found: {}", reference.key());
            }
        }
        String unresolvedText = missing.isEmpty() ? null : "(" + String.join("; ", missing) + ")";
        if (resolved.isEmpty()) {
            return new CitationField(null, null, unresolvedText);
        }

        String display = displayText(resolved);
        ObjectNode payload = mapper.createObjectNode();
        payload.put("citationID", String.format("%08X", ++citationCounter));
        ObjectNode properties = payload.putObject("properties");
        properties.put("formattedCitation", display);
        properties.put("plainCitation", display);
        properties.put("noteIndex", 0);
        ArrayNode items = payload.putArray("citationItems");
        for (CitationReference reference : resolved) {
            items.add(citationItem(reference));
            citedKeys.add(reference.key());
        }
        payload.put("schema", SCHEMA);
        try {
            String instruction = " " + CITATION_PREFIX + " " + mapper.writeValueAsString(payload) + " ";
            return new CitationField(instruction, display, unresolvedText);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize citation payload", e);
        }
    }

    /** Resolved keys in the order they were first cited. */
    public List<String> citedKeys() {
        return List.copyOf(citedKeys);
    }

    /** Plain-text bibliography entries for everything cited so far. */
    public List<String> bibliographyEntries() {
        List<String> entries = new ArrayList<>();
        for (String key : citedKeys) {
            entries.add(BibliographyFormatter.format(bibliography.get(key).orElseThrow()));
        }
        return entries;
    }

    private ObjectNode citationItem(CitationReference reference) {
        BibtexEntry entry = bibliography.get(reference.key()).orElseThrow();
        ObjectNode item = mapper.createObjectNode();
        ObjectNode itemData = CslItems.itemData(entry);
        String uri;
        if (entry.isLinkedToZotero()) {
            int id = numericIds.computeIfAbsent(entry.key, key -> numericIds.size() + 1);
            item.put("id", id);
            itemData.put("id", id);
            uri = entry.getZoteroUri().trim();
        } else {
            item.put("id", entry.key);
            itemData.put("id", entry.key);
            uri = ZoteroUris.embeddedUri(entry.key);
        }
        item.putArray("uris").add(uri);
        item.set("itemData", itemData);
        if (reference.hasLocator()) {
            item.put("locator", stripPagePrefix(reference.locator()));
            item.put("label", "page");
        }
        return item;
    }

    private String displayText(List<CitationReference> references) {
        List<String> parts = new ArrayList<>();
        for (CitationReference reference : references) {
            BibtexEntry entry = bibliography.get(reference.key()).orElseThrow();
            StringBuilder part = new StringBuilder(firstFamilyName(entry));
            String year = entry.field("year");
            if (year != null && !year.isBlank()) {
                part.append(' ').append(year.trim());
            }
            if (reference.hasLocator()) {
                part.append(", ").append(reference.locator().trim());
            }
            parts.add(part.toString());
        }
        return "(" + String.join("; ", parts) + ")";
    }

    private static String firstFamilyName(BibtexEntry entry) {
        String author = entry.field("author");
        if (author != null && !author.isBlank()) {
            List<CslName> names = CslItems.parseAuthors(author);
            if (!names.isEmpty() && !names.get(0).familyOrLiteral().isBlank()) {
                return names.get(0).familyOrLiteral();
            }
        }
        return entry.key;
    }

    static String stripPagePrefix(String locator) {
        String trimmed = locator.trim();
        Matcher matcher = PAGE_PREFIX.matcher(trimmed);
        return matcher.matches() ? matcher.group(1).trim() : trimmed;
    }
}
