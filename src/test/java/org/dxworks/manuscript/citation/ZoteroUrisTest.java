package org.dxworks.manuscript.citation;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ZoteroUrisTest {

    @Test
    void libraryUris() {
        assertTrue(ZoteroUris.isLibraryUri("http://zotero.org/users/123/items/ABCD2345"));
        assertTrue(ZoteroUris.isLibraryUri("https://zotero.org/groups/77/items/ZZZZ0000"));
        assertFalse(ZoteroUris.isLibraryUri("http://example.org/items/ABCD2345"));
        assertFalse(ZoteroUris.isLibraryUri(null));
        assertEquals(Optional.of("ABCD2345"), ZoteroUris.extractKey("http://zotero.org/users/123/items/ABCD2345"));
    }

    @Test
    void localUserLibraryUris() {
        String uri = "http://zotero.org/users/local/kQ3xYz9W/items/QWER7890";

        assertTrue(ZoteroUris.isLibraryUri(uri));
        assertFalse(ZoteroUris.isEmbedded(uri));
        assertEquals(Optional.of("QWER7890"), ZoteroUris.extractKey(uri));
        assertFalse(ZoteroUris.isLibraryUri("http://zotero.org/users/local/kQ3xYz9W/items/qwer7890"));
    }

    @Test
    void embeddedUrisAreNotLibraryItems() {
        String uri = ZoteroUris.embeddedUri("smith2020");

        assertEquals("http://zotero.org/users/local/embedded/items/smith2020", uri);
        assertTrue(ZoteroUris.isEmbedded(uri));
        assertFalse(ZoteroUris.isLibraryUri(uri));
        assertEquals(Optional.empty(), ZoteroUris.extractKey(uri));
    }
}
