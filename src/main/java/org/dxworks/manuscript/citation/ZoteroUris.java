package org.dxworks.manuscript.citation;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zotero item URIs. Linked items live under a user or group library; items without a library
 * get a synthetic {@code users/local/embedded} URI.
 */
public final class ZoteroUris {

    public static final String EMBEDDED_PREFIX = "http://zotero.org/users/local/embedded/items/";

    private static final Pattern ITEM_KEY = Pattern.compile("/items/([A-Z0-9]{8})$");
    private static final Pattern LIBRARY_ITEM = Pattern.compile(
            "^https?://zotero\\.org/(?:users/local/[A-Za-z0-9]+|users/\\d+|groups/\\d+)/items/[A-Z0-9]{8}$");

    private ZoteroUris() {}

    /** The eight character item key at the end of a Zotero URI. */
    public static Optional<String> extractKey(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        Matcher matcher = ITEM_KEY.matcher(uri.trim());
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /** True for URIs of items in a real Zotero library, false for embedded ones. */
    public static boolean isLibraryUri(String uri) {
        if (uri == null || isEmbedded(uri)) {
            return false;
        }
        return LIBRARY_ITEM.matcher(uri.trim()).matches();
    }

    public static boolean isEmbedded(String uri) {
        return uri != null && uri.trim().startsWith(EMBEDDED_PREFIX);
    }

    public static String embeddedUri(String citationKey) {
        return EMBEDDED_PREFIX + citationKey;
    }
}
