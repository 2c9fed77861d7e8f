package org.dxworks.manuscript.model;

import java.util.Optional;

public enum CitationKeyFormat {
    AUTHOR_YEAR_TITLE("authorYearTitle"),
    AUTHOR_YEAR("authorYear"),
    NUMERIC("numeric");

    private final String id;

    CitationKeyFormat(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<CitationKeyFormat> fromId(String id) {
        for (CitationKeyFormat format : values()) {
            if (format.id.equalsIgnoreCase(id)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
