package org.dxworks.manuscript.citation;

/**
 * A citation rendered for the document. {@code instruction} is null when none of the keys resolved;
 * {@code unresolvedText} holds the {@code (@key)} text for keys that did not.
 */
public record CitationField(String instruction, String displayText, String unresolvedText) {

    public boolean hasField() {
        return instruction != null;
    }
}
