package org.dxworks.manuscript.markdown;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls {@code [^id]: text} definitions out of a Markdown body. Definition lines are blanked so the
 * block parser keeps its line numbering; indented lines directly below belong to the definition.
 */
public final class FootnoteDefinitions {

    private static final Pattern DEFINITION = Pattern.compile("^ {0,3}\\[\\^([^\\]\\s]+)]:[ \\t]?(.*)$");

    public record Extracted(String body, Map<String, String> definitions) {
    }

    private FootnoteDefinitions() {}

    public static Extracted extract(String body) {
        if (!body.contains("[^")) {
            return new Extracted(body, Map.of());
        }
        InertZones zones = InertZones.compute(body);
        String[] lines = body.split("\n", -1);
        Map<String, String> definitions = new LinkedHashMap<>();
        int offset = 0;
        int i = 0;
        while (i < lines.length) {
            Matcher matcher = DEFINITION.matcher(lines[i]);
            if (!matcher.matches() || zones.isInert(offset)) {
                offset += lines[i].length() + 1;
                i++;
                continue;
            }
            StringBuilder text = new StringBuilder(matcher.group(2).strip());
            offset += lines[i].length() + 1;
            lines[i] = "";
            i++;
            while (i < lines.length && !lines[i].isBlank() && Character.isWhitespace(lines[i].charAt(0))) {
                text.append('\n').append(lines[i].strip());
                offset += lines[i].length() + 1;
                lines[i] = "";
                i++;
            }
            definitions.putIfAbsent(matcher.group(1), text.toString());
        }
        return new Extracted(String.join("\n", lines), definitions);
    }
}
