package org.dxworks.manuscript.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Highlight colors understood in {@code ==text=={color}} markup, with their WordprocessingML names.
 */
public enum HighlightColor {
    YELLOW("yellow", "yellow"),
    GREEN("green", "green"),
    TURQUOISE("turquoise", "cyan"),
    PINK("pink", "magenta"),
    BLUE("blue", "blue"),
    RED("red", "red"),
    DARK_BLUE("dark-blue", "darkBlue"),
    TEAL("teal", "darkCyan"),
    VIOLET("violet", "darkMagenta"),
    DARK_RED("dark-red", "darkRed"),
    DARK_YELLOW("dark-yellow", "darkYellow"),
    GRAY_50("gray-50", "darkGray"),
    GRAY_25("gray-25", "lightGray"),
    BLACK("black", "black");

    private final String id;
    private final String wordName;

    HighlightColor(String id, String wordName) {
        this.id = id;
        this.wordName = wordName;
    }

    public String getId() {
        return id;
    }

    public String getWordName() {
        return wordName;
    }

    public static Optional<HighlightColor> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (HighlightColor color : values()) {
            if (color.id.equals(normalized)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }

    public static Optional<HighlightColor> fromWordName(String wordName) {
        if (wordName == null) {
            return Optional.empty();
        }
        for (HighlightColor color : values()) {
            if (color.wordName.equalsIgnoreCase(wordName)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }

    /** Unknown or missing ids fall back to yellow. */
    public static HighlightColor resolve(String id) {
        return fromId(id).orElse(YELLOW);
    }
}
