package org.dxworks.manuscript.citation;

import org.dxworks.manuscript.model.CitationKeyFormat;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CslName;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Assigns citation keys to cited items. Items are deduplicated by {@link CitationMetadata#identity()}, so the same
 * work always gets the same key. The mapping is built once, in first-seen order, and is read-only afterwards.
 */
public class CitationKeyManager {

    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z]+\\b");
    private static final Set<String> SKIPPED_TITLE_WORDS = Set.of("the", "a", "an");
    private static final String UNKNOWN = "unknown";

    private final Map<String, String> keysByIdentity;
    private final Map<String, CitationMetadata> itemsByKey;

    private CitationKeyManager(Map<String, String> keysByIdentity, Map<String, CitationMetadata> itemsByKey) {
        this.keysByIdentity = Collections.unmodifiableMap(keysByIdentity);
        this.itemsByKey = Collections.unmodifiableMap(itemsByKey);
    }

    public static CitationKeyManager build(List<List<CitationMetadata>> groups, CitationKeyFormat format) {
        Map<String, String> keysByIdentity = new LinkedHashMap<>();
        Map<String, CitationMetadata> itemsByKey = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        int counter = 0;
        for (List<CitationMetadata> group : groups) {
            for (CitationMetadata item : group) {
                String identity = item.identity();
                if (keysByIdentity.containsKey(identity)) {
                    continue;
                }
                String key;
                if (format == CitationKeyFormat.NUMERIC) {
                    key = String.valueOf(++counter);
                } else {
                    key = unique(baseKey(item, format), used);
                }
                used.add(key);
                keysByIdentity.put(identity, key);
                itemsByKey.put(key, item);
            }
        }
        return new CitationKeyManager(keysByIdentity, itemsByKey);
    }

    public String keyFor(CitationMetadata item) {
        return keysByIdentity.get(item.identity());
    }

    /** Key with the item's locator appended, as written inside a {@code [@...]} citation. */
    public String citedKey(CitationMetadata item) {
        String key = keyFor(item);
        if (key == null) {
            return null;
        }
        String locator = sanitizeLocator(item.locator);
        return locator.isEmpty() ? key : key + ", p. " + locator;
    }

    /** One representative item per key, in key assignment order. */
    public Map<String, CitationMetadata> itemsByKey() {
        return itemsByKey;
    }

    public int size() {
        return keysByIdentity.size();
    }

    static String baseKey(CitationMetadata item, CitationKeyFormat format) {
        String name = clean(surname(item));
        if (name.isEmpty()) {
            name = UNKNOWN;
        }
        String year = item.year == null ? "" : item.year.replaceAll("\\D", "");
        if (format == CitationKeyFormat.AUTHOR_YEAR) {
            return name + year;
        }
        return name + year + titleWord(item.title);
    }

    /** Characters that would break the citation list syntax are removed. */
    public static String sanitizeLocator(String locator) {
        if (locator == null) {
            return "";
        }
        return locator.replaceAll("[\\[\\];@]", "").trim();
    }

    private static String unique(String base, Set<String> used) {
        if (!used.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (used.contains(base + suffix)) {
            suffix++;
        }
        return base + suffix;
    }

    private static String surname(CitationMetadata item) {
        if (!item.authors.isEmpty()) {
            CslName first = item.authors.get(0);
            if (!first.familyOrLiteral().isBlank()) {
                return first.familyOrLiteral();
            }
        }
        if (item.publisher != null && !item.publisher.isBlank()) {
            return item.publisher;
        }
        if (item.journal != null && !item.journal.isBlank()) {
            return item.journal;
        }
        return UNKNOWN;
    }

    private static String titleWord(String title) {
        if (title == null) {
            return UNKNOWN;
        }
        Matcher matcher = WORD.matcher(title);
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (!SKIPPED_TITLE_WORDS.contains(word)) {
                return word;
            }
        }
        return UNKNOWN;
    }

    private static String clean(String value) {
        return value.replaceAll("[^a-zA-Z0-9]", "").toLowerCase(Locale.ROOT);
    }
}
