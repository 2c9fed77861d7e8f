package org.dxworks.manuscript.citation;

import org.dxworks.manuscript.model.BibtexEntry;
import org.dxworks.manuscript.model.CslName;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text author-year bibliography entries, used as the visible result of the bibliography field until the
 * reference manager refreshes it.
 */
public final class BibliographyFormatter {

    private BibliographyFormatter() {}

    public static String format(BibtexEntry entry) {
        StringBuilder sb = new StringBuilder();
        String authors = entry.field("author");
        if (authors != null && !authors.isBlank()) {
            sb.append(names(CslItems.parseAuthors(authors))).append(' ');
        }
        String year = entry.field("year");
        sb.append('(').append(year == null || year.isBlank() ? "n.d." : year.trim()).append("). ");
        String title = entry.field("title");
        if (title != null && !title.isBlank()) {
            sb.append(withPeriod(title.trim())).append(' ');
        }
        List<String> container = new ArrayList<>();
        addIfPresent(container, entry.field("journal"));
        addIfPresent(container, entry.field("volume"));
        addIfPresent(container, entry.field("pages"));
        if (container.isEmpty()) {
            addIfPresent(container, entry.field("publisher"));
        }
        if (!container.isEmpty()) {
            sb.append(withPeriod(String.join(", ", container))).append(' ');
        }
        String doi = entry.field("doi");
        if (doi != null && !doi.isBlank()) {
            sb.append("https://doi.org/").append(doi.trim());
        }
        return sb.toString().trim();
    }

    private static String names(List<CslName> names) {
        List<String> formatted = new ArrayList<>();
        for (CslName name : names) {
            if (name.family() == null) {
                formatted.add(name.familyOrLiteral());
            } else if (name.given() == null || name.given().isBlank()) {
                formatted.add(name.family());
            } else {
                formatted.add(name.family() + ", " + initials(name.given()));
            }
        }
        if (formatted.size() > 1) {
            String last = formatted.remove(formatted.size() - 1);
            return String.join(", ", formatted) + ", & " + last;
        }
        return formatted.isEmpty() ? "" : formatted.get(0);
    }

    private static String initials(String given) {
        StringBuilder sb = new StringBuilder();
        for (String part : given.trim().split("[\\s.]+")) {
            if (!part.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(part.charAt(0)).append('.');
            }
        }
        return sb.toString();
    }

    private static String withPeriod(String text) {
        return text.endsWith(".") || text.endsWith("?") || text.endsWith("!") ? text : text + ".";
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }
}
