package org.dxworks.manuscript.citation;

import org.dxworks.manuscript.model.BibtexEntry;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CslName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns the items recovered from a document into BibTeX entries, one per citation key.
 */
public final class BibtexExporter {

    private BibtexExporter() {}

    public static List<BibtexEntry> export(CitationKeyManager keys) {
        List<BibtexEntry> entries = new ArrayList<>();
        for (Map.Entry<String, CitationMetadata> keyed : keys.itemsByKey().entrySet()) {
            entries.add(toEntry(keyed.getKey(), keyed.getValue()));
        }
        return entries;
    }

    static BibtexEntry toEntry(String key, CitationMetadata item) {
        BibtexEntry entry = new BibtexEntry(entryType(item), key);
        if (!item.authors.isEmpty()) {
            List<String> names = new ArrayList<>();
            for (CslName name : item.authors) {
                names.add(bibtexName(name));
            }
            entry.fields.put("author", String.join(" and ", names));
        }
        put(entry, "title", item.title);
        put(entry, "journal", item.journal);
        put(entry, "volume", item.volume);
        put(entry, "pages", item.pages);
        put(entry, "year", item.year);
        put(entry, "publisher", item.publisher);
        put(entry, "doi", item.doi);
        if (ZoteroUris.isLibraryUri(item.zoteroUri)) {
            ZoteroUris.extractKey(item.zoteroUri).ifPresent(k -> entry.fields.put(BibtexEntry.ZOTERO_KEY_FIELD, k));
            entry.fields.put(BibtexEntry.ZOTERO_URI_FIELD, item.zoteroUri);
        }
        return entry;
    }

    private static String entryType(CitationMetadata item) {
        if (notBlank(item.journal) || notBlank(item.volume)) {
            return "article";
        }
        return CslItems.bibtexType(item.cslType);
    }

    private static String bibtexName(CslName name) {
        if (name.family() == null || name.family().isBlank()) {
            return "{" + name.familyOrLiteral() + "}";
        }
        if (name.given() == null || name.given().isBlank()) {
            return name.family();
        }
        return name.family() + ", " + name.given();
    }

    private static void put(BibtexEntry entry, String field, String value) {
        if (notBlank(value)) {
            entry.fields.put(field, value.trim());
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
