package org.dxworks.manuscript.markdown;

import org.dxworks.manuscript.critic.CriticMarkupPreprocessor;
import org.dxworks.manuscript.model.CitationReference;
import org.dxworks.manuscript.model.CommentNode;
import org.dxworks.manuscript.model.HighlightColor;
import org.dxworks.manuscript.model.Run;
import org.dxworks.manuscript.model.RunFormatting;
import org.dxworks.manuscript.model.RunType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the inline text of one block into runs. Code and math zones are computed first and
 * everything inside them is emitted verbatim.
 */
public class InlineTokenizer {

    private static final Pattern CITATION_PART = Pattern.compile("^-?@([^\\s,;\\]@]+)\\s*(?:,\\s*(.*))?$", Pattern.DOTALL);
    private static final Pattern ID_RANGE_START = Pattern.compile("\\{#([a-zA-Z0-9_-]+)}");
    private static final Pattern ID_RANGE_END = Pattern.compile("\\{/([a-zA-Z0-9_-]+)}");
    private static final Pattern FOOTNOTE_REF = Pattern.compile("\\[\\^([^\\]\\s]+)]");
    private static final String ESCAPABLE = "\\`*_{}[]()#+-.!|~=<>$@^\"'";

    public List<Run> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return new Scan(text).scan(0, text.length());
    }

    private static final class Scan {
        private final String text;
        private final InertZones zones;
        private final Map<String, Integer> exhausted = new HashMap<>();
        private Map<Integer, Integer> commentCloses;

        Scan(String text) {
            this.text = text;
            this.zones = InertZones.compute(text);
        }

        /** Like {@link InertZones#indexOutside}, remembering the earliest start from which a marker was not found. */
        private int indexOutside(String marker, int from, int to) {
            String key = marker + '@' + to;
            Integer failedFrom = exhausted.get(key);
            if (failedFrom != null && from >= failedFrom) {
                return -1;
            }
            int index = zones.indexOutside(text, marker, from, to);
            if (index < 0) {
                exhausted.merge(key, from, Math::min);
            }
            return index;
        }

        private int commentClose(int contentStart) {
            if (commentCloses == null) {
                commentCloses = CriticMarkupPreprocessor.commentCloses(text);
            }
            return commentCloses.getOrDefault(contentStart, -1);
        }

        List<Run> scan(int from, int to) {
            List<Run> runs = new ArrayList<>();
            StringBuilder pending = new StringBuilder();
            int i = from;
            while (i < to) {
                Optional<InertZones.Zone> zone = zones.startingAt(i);
                if (zone.isPresent() && zone.get().end() <= to) {
                    flush(pending, runs);
                    runs.add(zoneRun(zone.get()));
                    i = zone.get().end();
                    continue;
                }

                Match match = matchAt(i, to);
                if (match != null) {
                    flush(pending, runs);
                    runs.addAll(match.runs);
                    i = match.end;
                    continue;
                }

                char c = text.charAt(i);
                if (c == '\\' && i + 1 < to && ESCAPABLE.indexOf(text.charAt(i + 1)) >= 0) {
                    pending.append(text.charAt(i + 1));
                    i += 2;
                } else if (c == '\n') {
                    trimTrailingBlanks(pending);
                    flush(pending, runs);
                    runs.add(Run.softBreak());
                    i++;
                    while (i < to && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
                        i++;
                    }
                } else {
                    pending.append(c);
                    i++;
                }
            }
            flush(pending, runs);
            return runs;
        }

        private Run zoneRun(InertZones.Zone zone) {
            String content = CriticMarkupPreprocessor.restoreParagraphs(zone.content(text));
            return switch (zone.kind()) {
                case INLINE_CODE -> Run.code(stripCodePadding(content));
                case FENCED_CODE -> Run.code(content);
                case DISPLAY_MATH -> Run.math(content.strip(), true);
                case INLINE_MATH -> Run.math(content, false);
                case HTML_COMMENT -> Run.htmlComment(
                        CriticMarkupPreprocessor.restoreParagraphs(text.substring(zone.start(), zone.end())));
            };
        }

        private Match matchAt(int i, int to) {
            char c = text.charAt(i);
            switch (c) {
                case '{':
                    return matchCritic(i, to);
                case '=':
                    return matchHighlight(i, to);
                case '[':
                    return matchBracket(i, to);
                case '!':
                    return text.startsWith("![", i) ? matchImage(i, to) : null;
                case '*':
                case '_':
                    return matchEmphasis(i, to, c);
                case '~':
                    return text.startsWith("~~", i) ? matchDelimited(i, to, "~~", "~~", RunFormatting::withStrikethrough) : null;
                case '<':
                    if (text.startsWith("<u>", i)) {
                        return matchDelimited(i, to, "<u>", "</u>", RunFormatting::withUnderline);
                    }
                    if (text.startsWith("<sup>", i)) {
                        return matchDelimited(i, to, "<sup>", "</sup>", RunFormatting::withSuperscript);
                    }
                    if (text.startsWith("<sub>", i)) {
                        return matchDelimited(i, to, "<sub>", "</sub>", RunFormatting::withSubscript);
                    }
                    return null;
                default:
                    return null;
            }
        }

        private Match matchCritic(int i, int to) {
            if (text.startsWith("{++", i)) {
                return simpleCritic(i, to, "++}", Run::addition);
            }
            if (text.startsWith("{--", i)) {
                return simpleCritic(i, to, "--}", Run::deletion);
            }
            if (text.startsWith("{~~", i)) {
                int close = indexOutside("~~}", i + 3, to);
                if (close < 0) {
                    return null;
                }
                String content = restored(i + 3, close);
                int separator = content.indexOf("~>");
                if (separator < 0) {
                    return null;
                }
                return new Match(List.of(Run.substitution(content.substring(0, separator),
                        content.substring(separator + 2))), close + 3);
            }
            if (text.startsWith("{==", i)) {
                return simpleCritic(i, to, "==}", Run::criticHighlight);
            }
            if (text.startsWith("{>>", i)) {
                int close = commentClose(i + 3);
                if (close < 0 || close + 3 > to || zones.isInert(close)) {
                    return null;
                }
                CommentNode comment = CommentBodyParser.parse(text.substring(i + 3, close));
                return new Match(List.of(Run.comment(comment, null)), close + 3);
            }
            if (text.startsWith("{#", i)) {
                int openLength = CriticMarkupPreprocessor.idOpenerLength(text, i);
                if (openLength > 0) {
                    int close = commentClose(i + openLength);
                    if (close < 0 || close + 3 > to || zones.isInert(close)) {
                        return null;
                    }
                    String id = text.substring(i + 2, i + openLength - 2);
                    CommentNode comment = CommentBodyParser.parse(text.substring(i + openLength, close));
                    return new Match(List.of(Run.comment(comment, id)), close + 3);
                }
                Matcher start = ID_RANGE_START.matcher(text).region(i, to);
                if (start.lookingAt()) {
                    return new Match(List.of(Run.commentRangeStart(start.group(1))), start.end());
                }
                return null;
            }
            if (text.startsWith("{/", i)) {
                Matcher end = ID_RANGE_END.matcher(text).region(i, to);
                if (end.lookingAt()) {
                    return new Match(List.of(Run.commentRangeEnd(end.group(1))), end.end());
                }
            }
            return null;
        }

        private Match simpleCritic(int i, int to, String closeMarker, Function<String, Run> factory) {
            int close = indexOutside(closeMarker, i + 3, to);
            if (close < 0) {
                return null;
            }
            return new Match(List.of(factory.apply(restored(i + 3, close))), close + closeMarker.length());
        }

        private Match matchHighlight(int i, int to) {
            if (!text.startsWith("==", i) || (i > 0 && text.charAt(i - 1) == '{')) {
                return null;
            }
            int close = indexOutside("==", i + 2, to);
            if (close <= i + 2 || (close + 2 < to && text.charAt(close + 2) == '}')
                    || Character.isWhitespace(text.charAt(i + 2)) || Character.isWhitespace(text.charAt(close - 1))) {
                return null;
            }
            int end = close + 2;
            HighlightColor color = null;
            if (end < to && text.charAt(end) == '{') {
                int colorEnd = text.indexOf('}', end + 1);
                if (colorEnd > 0 && colorEnd < to) {
                    Optional<HighlightColor> parsed = HighlightColor.fromId(text.substring(end + 1, colorEnd));
                    if (parsed.isPresent()) {
                        color = parsed.get();
                        end = colorEnd + 1;
                    }
                }
            }
            List<Run> inner = scan(i + 2, close);
            List<Run> runs = new ArrayList<>();
            for (Run run : inner) {
                if (run.type() == RunType.TEXT) {
                    runs.add(Run.highlight(run.text(), color, run.formatting()));
                } else {
                    runs.add(run);
                }
            }
            return new Match(runs, end);
        }

        private Match matchBracket(int i, int to) {
            if (text.startsWith("[@", i) || text.startsWith("[-@", i)) {
                Match citation = matchCitation(i, to);
                if (citation != null) {
                    return citation;
                }
            }
            if (text.startsWith("[^", i)) {
                Matcher footnote = FOOTNOTE_REF.matcher(text).region(i, to);
                if (footnote.lookingAt()) {
                    return new Match(List.of(Run.footnoteReference(footnote.group(1))), footnote.end());
                }
            }
            return matchLink(i, to);
        }

        private Match matchCitation(int i, int to) {
            int close = indexOutside("]", i + 1, to);
            if (close < 0) {
                return null;
            }
            String inside = CriticMarkupPreprocessor.restoreParagraphs(text.substring(i + 1, close));
            List<CitationReference> references = new ArrayList<>();
            for (String part : inside.split(";")) {
                Matcher matcher = CITATION_PART.matcher(part.strip());
                if (!matcher.matches()) {
                    return null;
                }
                String locator = matcher.group(2) == null ? null : matcher.group(2).strip();
                references.add(new CitationReference(matcher.group(1), locator == null || locator.isEmpty() ? null : locator));
            }
            if (references.isEmpty()) {
                return null;
            }
            return new Match(List.of(Run.citation(text.substring(i, close + 1), references)), close + 1);
        }

        private Match matchLink(int i, int to) {
            int labelEnd = findLabelEnd(i, to);
            if (labelEnd < 0 || labelEnd + 1 >= to || text.charAt(labelEnd + 1) != '(') {
                return null;
            }
            int targetEnd = text.indexOf(')', labelEnd + 2);
            if (targetEnd < 0 || targetEnd >= to) {
                return null;
            }
            String target = unwrapTarget(text.substring(labelEnd + 2, targetEnd));
            List<Run> runs = new ArrayList<>();
            for (Run run : scan(i + 1, labelEnd)) {
                runs.add(run.withHref(target));
            }
            return new Match(runs, targetEnd + 1);
        }

        private Match matchImage(int i, int to) {
            int labelEnd = findLabelEnd(i + 1, to);
            if (labelEnd < 0 || labelEnd + 1 >= to || text.charAt(labelEnd + 1) != '(') {
                return null;
            }
            int targetEnd = text.indexOf(')', labelEnd + 2);
            if (targetEnd < 0 || targetEnd >= to) {
                return null;
            }
            String alt = text.substring(i + 2, labelEnd);
            String source = unwrapTarget(text.substring(labelEnd + 2, targetEnd));
            return new Match(List.of(Run.image(alt, source)), targetEnd + 1);
        }

        private int findLabelEnd(int open, int to) {
            int depth = 0;
            for (int k = open; k < to; k++) {
                Optional<InertZones.Zone> zone = zones.startingAt(k);
                if (zone.isPresent()) {
                    k = zone.get().end() - 1;
                    continue;
                }
                char c = text.charAt(k);
                if (c == '\\') {
                    k++;
                } else if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                    if (depth == 0) {
                        return k;
                    }
                }
            }
            return -1;
        }

        private Match matchEmphasis(int i, int to, char delimiter) {
            int run = runLength(i, to, delimiter);
            if (delimiter == '_' && i > 0 && Character.isLetterOrDigit(text.charAt(i - 1))) {
                return null;
            }
            if (run >= 3) {
                Match both = matchDelimited(i, to, repeat(delimiter, 3), repeat(delimiter, 3),
                        f -> f.withBold().withItalic());
                if (both != null) {
                    return both;
                }
            }
            if (run >= 2) {
                Match bold = matchDelimited(i, to, repeat(delimiter, 2), repeat(delimiter, 2), RunFormatting::withBold);
                if (bold != null) {
                    return bold;
                }
            }
            return matchSingleEmphasis(i, to, delimiter);
        }

        private Match matchSingleEmphasis(int i, int to, char delimiter) {
            int contentStart = i + 1;
            if (contentStart >= to || Character.isWhitespace(text.charAt(contentStart))) {
                return null;
            }
            int k = contentStart;
            while (k < to) {
                Optional<InertZones.Zone> zone = zones.startingAt(k);
                if (zone.isPresent()) {
                    k = zone.get().end();
                    continue;
                }
                char c = text.charAt(k);
                if (c == '\\') {
                    k += 2;
                    continue;
                }
                if (c == delimiter) {
                    int run = runLength(k, to, delimiter);
                    if (run == 1 && k > contentStart && !Character.isWhitespace(text.charAt(k - 1))
                            && !(delimiter == '_' && k + 1 < to && Character.isLetterOrDigit(text.charAt(k + 1)))) {
                        return wrap(contentStart, k, k + 1, RunFormatting::withItalic);
                    }
                    k += run;
                    continue;
                }
                k++;
            }
            return null;
        }

        private Match matchDelimited(int i, int to, String open, String close, UnaryOperator<RunFormatting> format) {
            int contentStart = i + open.length();
            if (contentStart >= to || Character.isWhitespace(text.charAt(contentStart))) {
                return null;
            }
            int end = indexOutside(close, contentStart, to);
            if (end <= contentStart || Character.isWhitespace(text.charAt(end - 1))) {
                return null;
            }
            return wrap(contentStart, end, end + close.length(), format);
        }

        private Match wrap(int contentStart, int contentEnd, int matchEnd, UnaryOperator<RunFormatting> format) {
            RunFormatting extra = format.apply(RunFormatting.NONE);
            List<Run> runs = new ArrayList<>();
            for (Run run : scan(contentStart, contentEnd)) {
                runs.add(run.withFormatting(extra));
            }
            return new Match(runs, matchEnd);
        }

        private String restored(int from, int to) {
            return CriticMarkupPreprocessor.restoreParagraphs(text.substring(from, to));
        }

        private int runLength(int i, int to, char c) {
            int end = i;
            while (end < to && text.charAt(end) == c) {
                end++;
            }
            return end - i;
        }

        private static String repeat(char c, int count) {
            return String.valueOf(c).repeat(count);
        }

        private static String unwrapTarget(String raw) {
            String target = raw.strip();
            int space = target.indexOf(' ');
            if (space > 0) {
                // drop an optional "title"
                target = target.substring(0, space);
            }
            if (target.startsWith("<") && target.endsWith(">")) {
                target = target.substring(1, target.length() - 1);
            }
            return target;
        }

        private static String stripCodePadding(String content) {
            if (content.length() >= 2 && content.startsWith(" ") && content.endsWith(" ") && !content.isBlank()) {
                return content.substring(1, content.length() - 1);
            }
            return content;
        }

        private static void trimTrailingBlanks(StringBuilder pending) {
            int length = pending.length();
            while (length > 0 && (pending.charAt(length - 1) == ' ' || pending.charAt(length - 1) == '\t')) {
                length--;
            }
            pending.setLength(length);
        }

        private static void flush(StringBuilder pending, List<Run> runs) {
            if (pending.length() == 0) {
                return;
            }
            String value = CriticMarkupPreprocessor.restoreParagraphs(pending.toString());
            runs.add(Run.text(value));
            pending.setLength(0);
        }
    }

    private record Match(List<Run> runs, int end) {
    }
}
