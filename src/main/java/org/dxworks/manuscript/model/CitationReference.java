package org.dxworks.manuscript.model;

/**
 * One cited key inside a citation group, with an optional locator such as a page number.
 */
public record CitationReference(String key, String locator) {

    public CitationReference {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Citation key must not be blank");
        }
    }

    public boolean hasLocator() {
        return locator != null && !locator.isBlank();
    }
}
