package org.dxworks.manuscript.citation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.manuscript.model.BibtexEntry;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CslName;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Conversions between BibTeX entries, CSL-JSON item data and {@link CitationMetadata}.
 */
public final class CslItems {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Map<String, String> CSL_TYPES = Map.of(
            "article", "article-journal",
            "book", "book",
            "inproceedings", "paper-conference",
            "incollection", "chapter",
            "inbook", "chapter",
            "phdthesis", "thesis",
            "mastersthesis", "thesis",
            "techreport", "report");

    private static final Map<String, String> BIBTEX_TYPES = Map.of(
            "article-journal", "article",
            "article", "article",
            "book", "book",
            "paper-conference", "inproceedings",
            "chapter", "incollection",
            "thesis", "phdthesis",
            "report", "techreport");

    private CslItems() {}

    public static String cslType(String bibtexType) {
        return bibtexType == null ? "article" : CSL_TYPES.getOrDefault(bibtexType.toLowerCase(Locale.ROOT), "article");
    }

    /** BibTeX type for a CSL type, {@code misc} when there is no counterpart. */
    public static String bibtexType(String cslType) {
        return cslType == null ? "misc" : BIBTEX_TYPES.getOrDefault(cslType, "misc");
    }

    public static ObjectNode itemData(BibtexEntry entry) {
        ObjectNode item = MAPPER.createObjectNode();
        item.put("type", cslType(entry.type));
        putIfPresent(item, "title", entry.field("title"));
        String author = entry.field("author");
        if (author != null && !author.isBlank()) {
            ArrayNode authors = item.putArray("author");
            for (CslName name : parseAuthors(author)) {
                ObjectNode node = authors.addObject();
                if (name.literal() != null) {
                    node.put("literal", name.literal());
                } else {
                    node.put("family", name.family());
                    if (name.given() != null) {
                        node.put("given", name.given());
                    }
                }
            }
        }
        String year = entry.field("year");
        if (year != null && year.trim().matches("\\d+")) {
            item.putObject("issued").putArray("date-parts").addArray().add(Integer.parseInt(year.trim()));
        }
        putIfPresent(item, "container-title", entry.field("journal"));
        putIfPresent(item, "volume", entry.field("volume"));
        putIfPresent(item, "page", entry.field("pages"));
        putIfPresent(item, "publisher", entry.field("publisher"));
        putIfPresent(item, "DOI", entry.field("doi"));
        return item;
    }

    /**
     * Splits a BibTeX author list. {@code Family, Given} and {@code Given Family} are both understood;
     * a name in braces is kept whole as an institutional author.
     */
    public static List<CslName> parseAuthors(String authors) {
        List<CslName> names = new ArrayList<>();
        for (String raw : authors.split("\\s+and\\s+")) {
            String author = raw.trim();
            if (author.isEmpty()) {
                continue;
            }
            if (author.startsWith("{") && author.endsWith("}")) {
                names.add(new CslName(null, null, author.substring(1, author.length() - 1).trim()));
                continue;
            }
            int comma = author.indexOf(',');
            if (comma >= 0) {
                String given = author.substring(comma + 1).trim();
                names.add(new CslName(author.substring(0, comma).trim(), given.isEmpty() ? null : given, null));
                continue;
            }
            int space = author.lastIndexOf(' ');
            if (space > 0) {
                names.add(new CslName(author.substring(space + 1), author.substring(0, space).trim(), null));
            } else {
                names.add(new CslName(author, null, null));
            }
        }
        return names;
    }

    /** Metadata of one {@code citationItems} element of a Zotero citation payload. */
    public static CitationMetadata metadata(JsonNode citationItem) {
        CitationMetadata metadata = new CitationMetadata();
        JsonNode data = citationItem.path("itemData");
        if (data.isObject()) {
            metadata.itemData = (ObjectNode) data;
        }
        for (JsonNode author : data.path("author")) {
            metadata.authors.add(new CslName(text(author, "family"), text(author, "given"), text(author, "literal")));
        }
        metadata.title = text(data, "title");
        JsonNode firstDatePart = data.path("issued").path("date-parts").path(0).path(0);
        if (!firstDatePart.isMissingNode() && !firstDatePart.isNull()) {
            metadata.year = firstDatePart.asText();
        } else {
            String raw = text(data.path("issued"), "raw");
            if (raw != null && raw.matches("^\\d{4}.*")) {
                metadata.year = raw.substring(0, 4);
            }
        }
        metadata.journal = text(data, "container-title");
        metadata.volume = text(data, "volume");
        metadata.pages = text(data, "page");
        metadata.publisher = text(data, "publisher");
        metadata.doi = text(data, "DOI");
        metadata.cslType = text(data, "type");

        JsonNode uris = citationItem.has("uris") ? citationItem.get("uris") : citationItem.path("uri");
        JsonNode uri = uris.isArray() ? uris.path(0) : uris;
        if (uri.isTextual() && !uri.asText().isBlank()) {
            metadata.zoteroUri = uri.asText().trim();
        }
        JsonNode locator = citationItem.path("locator");
        if (locator.isValueNode() && !locator.isNull() && !locator.asText().isBlank()) {
            metadata.locator = locator.asText().trim();
        }
        return metadata;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static void putIfPresent(ObjectNode item, String field, String value) {
        if (value != null && !value.isBlank()) {
            item.put(field, value);
        }
    }
}
