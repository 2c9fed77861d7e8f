package org.dxworks.manuscript.bibtex;

import org.dxworks.manuscript.model.BibtexEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses and writes BibTeX.
 * - {@code {{value}}} marks a value protected from case changes and is stored without the extra braces
 * - values are unescaped on read and escaped on write, except for verbatim fields such as doi and url
 * - {@code title} is always written double-braced, every other field single-braced
 */
public final class BibtexCodec {

    private static final Logger LOG = LoggerFactory.getLogger(BibtexCodec.class);

    private static final Pattern ENTRY_HEADER = Pattern.compile("@(\\w+)\\s*\\{\\s*([^,\\s]+)\\s*,");
    private static final Pattern BLOCK_HEADER = Pattern.compile("@(\\w+)\\s*[{(]");
    private static final Set<String> NON_ENTRY_TYPES = Set.of("comment", "string", "preamble");
    private static final Set<String> VERBATIM_FIELDS = Set.of("doi", "url", "isbn", "issn",
            BibtexEntry.ZOTERO_KEY_FIELD, BibtexEntry.ZOTERO_URI_FIELD);
    private static final String ESCAPED_CHARS = "&%$#_";

    private BibtexCodec() {}

    public static Bibliography parse(String text) {
        Bibliography bibliography = new Bibliography();
        if (text == null || text.isEmpty()) {
            return bibliography;
        }

        int cursor = 0;
        while (cursor < text.length()) {
            int at = text.indexOf('@', cursor);
            if (at < 0) {
                break;
            }
            Matcher block = BLOCK_HEADER.matcher(text).region(at, text.length());
            if (!block.lookingAt()) {
                cursor = at + 1;
                continue;
            }
            int open = block.end() - 1;
            int close = findEntryEnd(text, open);
            if (close < 0) {
                LOG.debug("Unterminated BibTeX entry at offset {}", at);
                break;
            }
            String type = block.group(1).toLowerCase(Locale.ROOT);
            if (!NON_ENTRY_TYPES.contains(type)) {
                Matcher header = ENTRY_HEADER.matcher(text).region(at, close);
                if (header.lookingAt()) {
                    BibtexEntry entry = new BibtexEntry(type, header.group(2));
                    parseFields(text.substring(header.end(), close), entry.fields);
                    bibliography.add(entry);
                }
            }
            cursor = close + 1;
        }
        return bibliography;
    }

    public static String serialize(Iterable<BibtexEntry> entries) {
        List<String> blocks = new ArrayList<>();
        for (BibtexEntry entry : entries) {
            blocks.add(serializeEntry(entry));
        }
        return blocks.isEmpty() ? "" : String.join("\n\n", blocks) + "\n";
    }

    public static String serializeEntry(BibtexEntry entry) {
        StringBuilder sb = new StringBuilder();
        sb.append('@').append(entry.type).append('{').append(entry.key).append(",\n");
        for (Map.Entry<String, String> field : entry.fields.entrySet()) {
            String name = field.getKey();
            String value = VERBATIM_FIELDS.contains(name) ? field.getValue() : escape(field.getValue());
            sb.append("  ").append(name).append(" = ");
            if (name.equals("title")) {
                sb.append("{{").append(value).append("}}");
            } else {
                sb.append('{').append(value).append('}');
            }
            sb.append(",\n");
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * Escapes BibTeX special characters. Already escaped characters stay as they are.
     */
    public static String escape(String value) {
        String plain = unescape(value);
        StringBuilder sb = new StringBuilder(plain.length() + 8);
        for (char c : plain.toCharArray()) {
            if (ESCAPED_CHARS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && ESCAPED_CHARS.indexOf(value.charAt(i + 1)) >= 0) {
                sb.append(value.charAt(i + 1));
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Index of the brace closing the entry opened at {@code open}, or -1. */
    static int findEntryEnd(String text, int open) {
        char closing = text.charAt(open) == '(' ? ')' : '}';
        int depth = 0;
        boolean inQuote = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' && depth == 1 && precedingBackslashes(text, i) % 2 == 0) {
                inQuote = !inQuote;
            } else if (inQuote) {
                continue;
            } else if (c == '{' || (c == '(' && i == open)) {
                if (precedingBackslashes(text, i) % 2 == 0) {
                    depth++;
                }
            } else if (c == '}' || (c == closing && depth == 1)) {
                if (precedingBackslashes(text, i) % 2 == 0) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
        }
        return -1;
    }

    private static void parseFields(String body, Map<String, String> fields) {
        int i = 0;
        int length = body.length();
        while (i < length) {
            while (i < length && (Character.isWhitespace(body.charAt(i)) || body.charAt(i) == ',')) {
                i++;
            }
            int nameStart = i;
            while (i < length && body.charAt(i) != '=' && !Character.isWhitespace(body.charAt(i))
                    && body.charAt(i) != ',') {
                i++;
            }
            String name = body.substring(nameStart, i).toLowerCase(Locale.ROOT);
            while (i < length && Character.isWhitespace(body.charAt(i))) {
                i++;
            }
            if (name.isEmpty() || i >= length || body.charAt(i) != '=') {
                // skip garbage up to the next field separator
                while (i < length && body.charAt(i) != ',') {
                    i++;
                }
                continue;
            }
            i++;
            while (i < length && Character.isWhitespace(body.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }

            String value;
            char first = body.charAt(i);
            if (first == '{') {
                int end = matchingBrace(body, i);
                if (end < 0) {
                    end = length - 1;
                }
                value = braceValue(body.substring(i + 1, end));
                i = end + 1;
            } else if (first == '"') {
                int end = closingQuote(body, i + 1);
                value = body.substring(i + 1, end);
                i = Math.min(end + 1, length);
            } else {
                int end = body.indexOf(',', i);
                if (end < 0) {
                    end = length;
                }
                value = body.substring(i, end).strip();
                i = end;
            }
            fields.put(name, VERBATIM_FIELDS.contains(name) ? value : unescape(value));
        }
    }

    private static String braceValue(String inner) {
        if (inner.length() >= 2 && inner.charAt(0) == '{' && matchingBrace(inner, 0) == inner.length() - 1) {
            return inner.substring(1, inner.length() - 1);
        }
        return inner;
    }

    private static int matchingBrace(String text, int open) {
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c == '{' || c == '}') && precedingBackslashes(text, i) % 2 == 1) {
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int closingQuote(String text, int from) {
        int depth = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == '"' && depth <= 0 && precedingBackslashes(text, i) % 2 == 0) {
                return i;
            }
        }
        return text.length();
    }

    private static int precedingBackslashes(String text, int index) {
        int count = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            count++;
        }
        return count;
    }
}
