package org.dxworks.manuscript.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class BibtexEntry {
    public static final String ZOTERO_KEY_FIELD = "zotero-key";
    public static final String ZOTERO_URI_FIELD = "zotero-uri";

    public String key;
    public String type;
    public Map<String, String> fields = new LinkedHashMap<>();

    public BibtexEntry() {
    }

    public BibtexEntry(String type, String key) {
        this.type = type;
        this.key = key;
    }

    public String field(String name) {
        return fields.get(name);
    }

    public String getZoteroKey() {
        return fields.get(ZOTERO_KEY_FIELD);
    }

    public String getZoteroUri() {
        return fields.get(ZOTERO_URI_FIELD);
    }

    public boolean isLinkedToZotero() {
        String uri = getZoteroUri();
        return uri != null && !uri.isBlank();
    }
}
