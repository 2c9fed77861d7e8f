package org.dxworks.manuscript.markdown;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Code, math and HTML comment regions of a Markdown text. Markup inside these regions is never interpreted.
 * Fenced code blocks are found first, then inline code spans outside them, then math outside any code, then
 * HTML comments outside code and math. A code or math zone that starts inside a comment is dropped.
 */
public final class InertZones {

    public enum Kind {
        FENCED_CODE,
        INLINE_CODE,
        DISPLAY_MATH,
        INLINE_MATH,
        HTML_COMMENT
    }

    /**
     * A region {@code [start, end)} whose payload is {@code [contentStart, contentEnd)}.
     */
    public record Zone(Kind kind, int start, int end, int contentStart, int contentEnd) {

        public boolean contains(int index) {
            return index >= start && index < end;
        }

        public boolean isCode() {
            return kind == Kind.FENCED_CODE || kind == Kind.INLINE_CODE;
        }

        public String content(String text) {
            return text.substring(contentStart, contentEnd);
        }
    }

    private static final String COMMENT_OPEN = "<!--";
    private static final String COMMENT_CLOSE = "-->";

    private final List<Zone> zones;
    private final Map<Integer, Zone> byStart = new HashMap<>();

    private InertZones(List<Zone> zones) {
        zones.sort((a, b) -> Integer.compare(a.start(), b.start()));
        this.zones = Collections.unmodifiableList(zones);
        for (Zone zone : zones) {
            byStart.put(zone.start(), zone);
        }
    }

    public static InertZones compute(String text) {
        List<Zone> fenced = findFencedBlocks(text);
        List<Zone> code = new ArrayList<>(fenced);
        code.addAll(findInlineCode(text, fenced));
        code.sort((a, b) -> Integer.compare(a.start(), b.start()));

        List<Zone> all = new ArrayList<>(code);
        all.addAll(findMath(text, code));
        if (!text.contains(COMMENT_OPEN)) {
            return new InertZones(all);
        }
        all.sort((a, b) -> Integer.compare(a.start(), b.start()));
        List<Zone> comments = findHtmlComments(text, all);
        if (comments.isEmpty()) {
            return new InertZones(all);
        }
        all.removeIf(zone -> findContaining(comments, zone.start()).isPresent());
        all.addAll(comments);
        return new InertZones(all);
    }

    public List<Zone> zones() {
        return zones;
    }

    public Optional<Zone> startingAt(int index) {
        return Optional.ofNullable(byStart.get(index));
    }

    public Optional<Zone> containing(int index) {
        return findContaining(zones, index);
    }

    public boolean isInert(int index) {
        return containing(index).isPresent();
    }

    /** True when any character of {@code [start, end)} lies in a zone. */
    public boolean overlaps(int start, int end) {
        for (Zone zone : zones) {
            if (zone.start() >= end) {
                return false;
            }
            if (zone.end() > start) {
                return true;
            }
        }
        return false;
    }

    /**
     * Next occurrence of {@code marker} at or after {@code from} that does not start inside a zone, or -1.
     */
    public int indexOutside(String text, String marker, int from, int limit) {
        int index = text.indexOf(marker, from);
        while (index >= 0 && index + marker.length() <= limit) {
            Optional<Zone> zone = containing(index);
            if (zone.isEmpty()) {
                return index;
            }
            index = text.indexOf(marker, zone.get().end());
        }
        return -1;
    }

    private static Optional<Zone> findContaining(List<Zone> sorted, int index) {
        int low = 0;
        int high = sorted.size() - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            Zone zone = sorted.get(mid);
            if (index < zone.start()) {
                high = mid - 1;
            } else if (index >= zone.end()) {
                low = mid + 1;
            } else {
                return Optional.of(zone);
            }
        }
        return Optional.empty();
    }

    private static List<Zone> findFencedBlocks(String text) {
        List<Zone> result = new ArrayList<>();
        int lineStart = 0;
        Zone open = null;
        char fenceChar = 0;
        int fenceLength = 0;
        int contentStart = 0;

        while (lineStart <= text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            if (lineEnd < 0) {
                lineEnd = text.length();
            }
            String line = text.substring(lineStart, lineEnd);
            int indent = leadingSpaces(line);

            if (open == null) {
                if (indent <= 3 && line.length() >= indent + 3) {
                    char c = line.charAt(indent);
                    int run = runLength(line, indent, c);
                    if ((c == '`' || c == '~') && run >= 3
                            && !(c == '`' && line.indexOf('`', indent + run) >= 0)) {
                        open = new Zone(Kind.FENCED_CODE, lineStart, lineStart, 0, 0);
                        fenceChar = c;
                        fenceLength = run;
                        contentStart = Math.min(lineEnd + 1, text.length());
                    }
                }
            } else if (indent <= 3 && line.length() > indent && line.charAt(indent) == fenceChar
                    && runLength(line, indent, fenceChar) >= fenceLength
                    && line.substring(indent + runLength(line, indent, fenceChar)).isBlank()) {
                int contentEnd = Math.max(contentStart, lineStart - 1);
                result.add(new Zone(Kind.FENCED_CODE, open.start(), lineEnd, contentStart, contentEnd));
                open = null;
            }

            if (lineEnd == text.length()) {
                break;
            }
            lineStart = lineEnd + 1;
        }

        if (open != null) {
            // an unclosed fence runs to the end of the document
            result.add(new Zone(Kind.FENCED_CODE, open.start(), text.length(), contentStart, text.length()));
        }
        return result;
    }

    private static List<Zone> findInlineCode(String text, List<Zone> fenced) {
        List<int[]> runs = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            Optional<Zone> zone = findContaining(fenced, i);
            if (zone.isPresent()) {
                i = zone.get().end();
                continue;
            }
            if (text.charAt(i) == '`') {
                int length = runLength(text, i, '`');
                runs.add(new int[]{i, length});
                i += length;
            } else {
                i++;
            }
        }

        // per run length, the index in `runs` of the next candidate closer
        Map<Integer, Integer> nextCandidate = new HashMap<>();
        List<Zone> result = new ArrayList<>();
        int k = 0;
        while (k < runs.size()) {
            int[] opener = runs.get(k);
            if (opener[0] > 0 && text.charAt(opener[0] - 1) == '\\') {
                k++;
                continue;
            }
            int closer = -1;
            int candidate = Math.max(nextCandidate.getOrDefault(opener[1], k + 1), k + 1);
            while (candidate < runs.size()) {
                if (runs.get(candidate)[1] == opener[1]) {
                    closer = candidate;
                    break;
                }
                candidate++;
            }
            nextCandidate.put(opener[1], candidate);
            if (closer < 0) {
                k++;
                continue;
            }
            int[] close = runs.get(closer);
            result.add(new Zone(Kind.INLINE_CODE, opener[0], close[0] + close[1], opener[0] + opener[1], close[0]));
            k = closer + 1;
        }
        return result;
    }

    private static List<Zone> findMath(String text, List<Zone> code) {
        List<Zone> result = new ArrayList<>();
        int i = 0;
        boolean displaySearchExhausted = false;
        while (i < text.length()) {
            Optional<Zone> zone = findContaining(code, i);
            if (zone.isPresent()) {
                i = zone.get().end();
                continue;
            }
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c != '$') {
                i++;
                continue;
            }
            if (i + 1 < text.length() && text.charAt(i + 1) == '$') {
                int close = displaySearchExhausted ? -1 : indexOutside(text, "$$", i + 2, code);
                if (close < 0) {
                    displaySearchExhausted = true;
                    i += 2;
                    continue;
                }
                result.add(new Zone(Kind.DISPLAY_MATH, i, close + 2, i + 2, close));
                i = close + 2;
                continue;
            }
            int close = findInlineMathClose(text, i, code);
            if (close < 0) {
                i++;
                continue;
            }
            result.add(new Zone(Kind.INLINE_MATH, i, close + 1, i + 1, close));
            i = close + 1;
        }
        return result;
    }

    /** {@code <!-- ... -->} outside the given zones; the first {@code -->} closes, an unclosed opener ends the scan. */
    private static List<Zone> findHtmlComments(String text, List<Zone> skipped) {
        List<Zone> result = new ArrayList<>();
        int i = text.indexOf(COMMENT_OPEN);
        while (i >= 0) {
            Optional<Zone> zone = findContaining(skipped, i);
            if (zone.isPresent()) {
                i = text.indexOf(COMMENT_OPEN, zone.get().end());
                continue;
            }
            int close = text.indexOf(COMMENT_CLOSE, i + COMMENT_OPEN.length());
            if (close < 0) {
                break;
            }
            int end = close + COMMENT_CLOSE.length();
            result.add(new Zone(Kind.HTML_COMMENT, i, end, i + COMMENT_OPEN.length(), close));
            i = text.indexOf(COMMENT_OPEN, end);
        }
        return result;
    }

    private static int indexOutside(String text, String marker, int from, List<Zone> code) {
        int index = text.indexOf(marker, from);
        while (index >= 0) {
            Optional<Zone> zone = findContaining(code, index);
            if (zone.isEmpty()) {
                return index;
            }
            index = text.indexOf(marker, zone.get().end());
        }
        return -1;
    }

    private static int findInlineMathClose(String text, int open, List<Zone> code) {
        if (open > 0 && isWordChar(text.charAt(open - 1))) {
            return -1;
        }
        if (open + 1 >= text.length() || Character.isWhitespace(text.charAt(open + 1))) {
            return -1;
        }
        int i = open + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                return -1;
            }
            if (findContaining(code, i).isPresent()) {
                return -1;
            }
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '$') {
                boolean followedByWord = i + 1 < text.length() && isWordChar(text.charAt(i + 1));
                boolean precededBySpace = Character.isWhitespace(text.charAt(i - 1));
                if (i + 1 < text.length() && text.charAt(i + 1) == '$') {
                    return -1;
                }
                if (!followedByWord && !precededBySpace) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == ' ') {
            count++;
        }
        return count;
    }

    private static int runLength(String text, int start, char c) {
        int end = start;
        while (end < text.length() && text.charAt(end) == c) {
            end++;
        }
        return end - start;
    }
}
