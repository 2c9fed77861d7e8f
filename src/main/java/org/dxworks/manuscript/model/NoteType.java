package org.dxworks.manuscript.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Where footnotes are placed in the generated document.
 */
public enum NoteType {
    IN_TEXT("in-text"),
    FOOTNOTES("footnotes"),
    ENDNOTES("endnotes");

    private final String id;

    NoteType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /** Accepts the textual ids as well as the numeric forms 0, 1 and 2. */
    public static Optional<NoteType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "in-text", "0" -> Optional.of(IN_TEXT);
            case "footnotes", "1" -> Optional.of(FOOTNOTES);
            case "endnotes", "2" -> Optional.of(ENDNOTES);
            default -> Optional.empty();
        };
    }
}
