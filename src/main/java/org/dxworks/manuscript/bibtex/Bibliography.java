package org.dxworks.manuscript.bibtex;

import org.dxworks.manuscript.model.BibtexEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed bibliography keyed by citation key, in file order. A repeated key keeps the first entry.
 */
public class Bibliography {

    private final Map<String, BibtexEntry> entries = new LinkedHashMap<>();

    public void add(BibtexEntry entry) {
        entries.putIfAbsent(entry.key, entry);
    }

    public Optional<BibtexEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Collection<BibtexEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    /** Keys starting with {@code prefix}, sorted, for citation completion. */
    public List<String> keysStartingWith(String prefix) {
        String lower = prefix == null ? "" : prefix.toLowerCase(Locale.ROOT);
        return entries.keySet().stream()
                .filter(key -> key.toLowerCase(Locale.ROOT).startsWith(lower))
                .sorted()
                .toList();
    }
}
