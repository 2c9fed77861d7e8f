package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.ManuscriptConfig;
import org.dxworks.manuscript.citation.CitationKeyManager;
import org.dxworks.manuscript.markdown.FrontmatterCodec;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CommentNode;
import org.dxworks.manuscript.model.Frontmatter;
import org.dxworks.manuscript.model.RunFormatting;
import org.dxworks.manuscript.model.TokenType;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes extracted blocks as Markdown that tokenizes back into the same blocks.
 * <p>
 * A comment whose range is one plain piece of text is written inline as {@code {==text==}{>>body<<}}; any other range
 * is bracketed with {@code {#n}...{/n}} and its body follows the block as {@code {#n>>body<<}}.
 */
class MarkdownRenderer {

    private static final String ALWAYS_ESCAPED = "\\`*[]{}<$";
    private static final String LINE_START_ESCAPED = "#>+-=";
    private static final Pattern LATEX_COMMENT = Pattern.compile("(?<!\\\\)%");

    private final ManuscriptConfig config;
    private final CitationKeyManager keys;
    private final ZoneOffset zone;
    private final List<String> warnings = new ArrayList<>();

    private CommentThreads threads;
    private final Set<String> inlineComments = new HashSet<>();
    private final Map<ExtractedRun, List<String>> rangeOpens = new IdentityHashMap<>();
    private final Map<ExtractedRun, List<String>> rangeCloses = new IdentityHashMap<>();
    private final Map<String, String> rangeNumbers = new HashMap<>();
    private final Set<String> rendered = new HashSet<>();
    private final List<String> pendingBodies = new ArrayList<>();
    private boolean atLineStart;

    MarkdownRenderer(ManuscriptConfig config, CitationKeyManager keys, ZoneOffset zone) {
        this.config = config;
        this.keys = keys;
        this.zone = zone;
    }

    List<String> warnings() {
        return warnings;
    }

    String render(Frontmatter frontmatter, List<ExtractedBlock> blocks, Map<String, List<ExtractedRun>> footnotes,
                  CommentThreads commentThreads) {
        this.threads = commentThreads;
        List<List<ExtractedRun>> runLists = new ArrayList<>();
        for (ExtractedBlock block : blocks) {
            runLists.addAll(block.runLists());
        }
        runLists.addAll(footnotes.values());
        layoutComments(runLists);

        StringBuilder sb = new StringBuilder(FrontmatterCodec.serialize(frontmatter));
        List<String> parts = new ArrayList<>();
        ListNumbers numbers = new ListNumbers();
        ExtractedBlock previous = null;
        for (int i = 0; i < blocks.size(); i++) {
            ExtractedBlock block = blocks.get(i);
            String markdown = block(block, previous, numbers);
            if (markdown == null) {
                continue;
            }
            if (!parts.isEmpty()) {
                parts.add(previous == null ? "\n\n" : separator(previous, block));
            }
            parts.add(markdown);
            previous = block;

            ExtractedBlock next = i + 1 < blocks.size() ? blocks.get(i + 1) : null;
            if (!pendingBodies.isEmpty() && !continues(block, next)) {
                parts.add("\n\n");
                parts.add(String.join("\n", pendingBodies));
                pendingBodies.clear();
                previous = null;
            }
        }

        List<String> unanchored = new ArrayList<>();
        for (Map.Entry<String, CommentNode> root : threads.roots().entrySet()) {
            if (!rendered.contains(root.getKey())) {
                unanchored.add("{>>" + body(root.getValue()) + "<<}");
                warnings.add("Comment without an anchor moved to the end: " + root.getKey());
            }
        }
        if (!unanchored.isEmpty()) {
            if (!parts.isEmpty()) {
                parts.add("\n\n");
            }
            parts.add(String.join(" ", unanchored));
        }

        if (!footnotes.isEmpty()) {
            List<String> definitions = new ArrayList<>();
            for (Map.Entry<String, List<ExtractedRun>> note : footnotes.entrySet()) {
                String content = runs(note.getValue(), false).strip();
                definitions.add("[^" + note.getKey() + "]: " + content.replace("\n", "\n    "));
            }
            if (!parts.isEmpty()) {
                parts.add("\n\n");
            }
            parts.add(String.join("\n\n", definitions));
            if (!pendingBodies.isEmpty()) {
                parts.add("\n\n");
                parts.add(String.join("\n", pendingBodies));
                pendingBodies.clear();
            }
        }

        for (String part : parts) {
            sb.append(part);
        }
        if (!parts.isEmpty()) {
            sb.append('\n');
        }
        return sb.toString();
    }

    private void layoutComments(List<List<ExtractedRun>> runLists) {
        Map<String, List<ExtractedRun>> covered = new LinkedHashMap<>();
        for (List<ExtractedRun> runs : runLists) {
            for (ExtractedRun run : runs) {
                for (String id : run.commentIds) {
                    covered.computeIfAbsent(id, key -> new ArrayList<>()).add(run);
                }
            }
        }
        for (Map.Entry<String, List<ExtractedRun>> entry : covered.entrySet()) {
            List<ExtractedRun> runs = entry.getValue();
            if (runs.size() == 1 && isInlineCandidate(runs.get(0))) {
                inlineComments.add(entry.getKey());
                continue;
            }
            rangeOpens.computeIfAbsent(runs.get(0), run -> new ArrayList<>()).add(entry.getKey());
            rangeCloses.computeIfAbsent(runs.get(runs.size() - 1), run -> new ArrayList<>()).add(0, entry.getKey());
        }
    }

    private static boolean isInlineCandidate(ExtractedRun run) {
        return run.kind == ExtractedRun.Kind.TEXT && run.commentIds.size() == 1 && run.formatting.isPlain()
                && run.href == null && run.highlight == null && !run.text.isBlank()
                && run.text.chars().noneMatch(c -> c == '\n' || c == '`' || c == '$' || c == '{' || c == '}')
                && !run.text.contains("==");
    }

    private String block(ExtractedBlock block, ExtractedBlock previous, ListNumbers numbers) {
        if (block.type != TokenType.LIST_ITEM) {
            numbers.reset();
        }
        switch (block.type) {
            case PARAGRAPH -> {
                String text = runs(block.runs, false).strip();
                return text.isEmpty() ? null : text;
            }
            case HEADING -> {
                return "#".repeat(Math.max(1, block.level)) + " " + runs(block.runs, true).strip();
            }
            case LIST_ITEM -> {
                return listItem(block, numbers);
            }
            case CODE_BLOCK -> {
                String code = block.code == null ? "" : block.code.toString();
                String fence = "`".repeat(Math.max(3, longestRun(code, '`') + 1));
                return fence + (block.language == null ? "" : block.language) + "\n" + code + "\n" + fence;
            }
            case BLOCKQUOTE -> {
                String prefix = "> ".repeat(Math.max(1, block.level));
                return prefixLines(runs(block.runs, false).strip(), prefix);
            }
            case ALERT_BOX -> {
                String content = prefixLines(runs(block.runs, false).strip(), "> ");
                boolean continued = previous != null && previous.type == TokenType.ALERT_BOX
                        && previous.alertType.equals(block.alertType);
                return continued ? content : "> [!" + block.alertType + "]\n" + content;
            }
            case TABLE -> {
                return table(block);
            }
            case THEMATIC_BREAK -> {
                return "---";
            }
            default -> {
                return null;
            }
        }
    }

    private String separator(ExtractedBlock previous, ExtractedBlock block) {
        if (previous.type == TokenType.LIST_ITEM && block.type == TokenType.LIST_ITEM) {
            return "\n";
        }
        if (previous.type == TokenType.BLOCKQUOTE && block.type == TokenType.BLOCKQUOTE) {
            return "\n" + ("> ".repeat(Math.min(previous.level, block.level))).strip() + "\n";
        }
        if (previous.type == TokenType.ALERT_BOX && block.type == TokenType.ALERT_BOX
                && previous.alertType.equals(block.alertType)) {
            return "\n>\n";
        }
        return "\n\n";
    }

    /** True when the next block belongs to the same list, quote or alert as this one. */
    private static boolean continues(ExtractedBlock block, ExtractedBlock next) {
        if (next == null || next.type != block.type) {
            return false;
        }
        return switch (block.type) {
            case LIST_ITEM, BLOCKQUOTE -> true;
            case ALERT_BOX -> block.alertType.equals(next.alertType);
            default -> false;
        };
    }

    private String listItem(ExtractedBlock block, ListNumbers numbers) {
        String marker = block.ordered ? numbers.next(block.level) + ". " : "- ";
        String indent = "";
        if (block.level > 1) {
            indent = " ".repeat(numbers.parentWidth);
        } else {
            numbers.parentWidth = marker.length();
            numbers.counters[2] = 0;
        }
        String task = block.checked == null ? "" : block.checked ? "[x] " : "[ ] ";
        String content = runs(block.runs, false).strip();
        String continuation = " ".repeat(indent.length() + marker.length());
        return indent + marker + task + content.replace("\n", "\n" + continuation);
    }

    private String table(ExtractedBlock block) {
        if (block.rows.isEmpty()) {
            return null;
        }
        int columns = 1;
        for (List<List<ExtractedRun>> row : block.rows) {
            columns = Math.max(columns, row.size());
        }
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < block.rows.size(); r++) {
            List<List<ExtractedRun>> row = block.rows.get(r);
            sb.append('|');
            for (int c = 0; c < columns; c++) {
                String cell = c < row.size() ? runs(row.get(c), true).strip().replace("|", "\\|") : "";
                sb.append(' ').append(cell).append(" |");
            }
            sb.append('\n');
            if (r == 0) {
                sb.append('|').append(" --- |".repeat(columns)).append('\n');
            }
        }
        return sb.toString().stripTrailing();
    }

    /** Inline Markdown for a run list; {@code singleLine} turns line breaks into spaces. */
    private String runs(List<ExtractedRun> runs, boolean singleLine) {
        StringBuilder sb = new StringBuilder();
        atLineStart = true;
        String openHref = null;
        for (ExtractedRun run : runs) {
            if (run.href == null ? openHref != null : !run.href.equals(openHref)) {
                if (openHref != null) {
                    sb.append("](").append(target(openHref)).append(')');
                }
                if (run.href != null) {
                    sb.append('[');
                    atLineStart = false;
                }
                openHref = run.href;
            }
            for (String id : rangeOpens.getOrDefault(run, List.of())) {
                String number = rangeNumbers.computeIfAbsent(id, key -> String.valueOf(rangeNumbers.size() + 1));
                sb.append("{#").append(number).append('}');
                pendingBodies.add("{#" + number + ">>" + body(threads.roots().get(id)) + "<<}");
                rendered.add(id);
                atLineStart = false;
            }
            run(run, singleLine, sb);
            for (String id : rangeCloses.getOrDefault(run, List.of())) {
                sb.append("{/").append(rangeNumbers.get(id)).append('}');
            }
        }
        if (openHref != null) {
            sb.append("](").append(target(openHref)).append(')');
        }
        return sb.toString();
    }

    private void run(ExtractedRun run, boolean singleLine, StringBuilder sb) {
        String text = singleLine ? run.text.replace('\n', ' ') : run.text;
        switch (run.kind) {
            case TEXT -> {
                String inlineComment = run.commentIds.size() == 1 ? run.commentIds.iterator().next() : null;
                if (inlineComment != null && inlineComments.contains(inlineComment)) {
                    sb.append("{==").append(text).append("==}{>>")
                            .append(body(threads.roots().get(inlineComment))).append("<<}");
                    rendered.add(inlineComment);
                    atLineStart = false;
                } else {
                    formatted(text, run, sb);
                }
            }
            case CODE -> {
                String code = text.replace('\n', ' ');
                String fence = "`".repeat(longestRun(code, '`') + 1);
                boolean pad = code.startsWith("`") || code.endsWith("`");
                sb.append(fence).append(pad ? " " : "").append(code).append(pad ? " " : "").append(fence);
                atLineStart = false;
            }
            case INSERTION -> critic(sb, "{++", text, "++}");
            case DELETION -> critic(sb, "{--", text, "--}");
            case SUBSTITUTION -> critic(sb, "{~~", text + "~>" + (run.newText == null ? "" : run.newText), "~~}");
            case MATH -> math(run, text.strip(), sb);
            case HTML_COMMENT -> critic(sb, "", text, "");
            case CITATION -> citation(run, sb);
            case FOOTNOTE -> critic(sb, "[^", run.footnoteLabel, "]");
            case IMAGE -> critic(sb, "![", text.replaceAll("[\\[\\]]", ""), "](" + target(run.imagePath) + ")");
            case COMMENT_POINT -> {
                CommentNode root = threads.roots().get(run.commentId);
                if (root != null) {
                    critic(sb, "{>>", body(root), "<<}");
                    rendered.add(run.commentId);
                }
            }
            default -> {
                // substitutions and the rest are handled above
            }
        }
    }

    private void critic(StringBuilder sb, String open, String content, String close) {
        sb.append(open).append(content).append(close);
        atLineStart = false;
    }

    /** Display math that spans lines or ends in a LaTeX comment gets its delimiters on lines of their own. */
    private void math(ExtractedRun run, String latex, StringBuilder sb) {
        if (!run.display) {
            critic(sb, "$", latex, "$");
        } else if (latex.indexOf('\n') >= 0 || LATEX_COMMENT.matcher(latex).find()) {
            critic(sb, "$$\n", latex, "\n$$");
        } else {
            critic(sb, "$$", latex, "$$");
        }
    }

    private void citation(ExtractedRun run, StringBuilder sb) {
        List<String> cited = new ArrayList<>();
        for (CitationMetadata item : run.citations) {
            String key = keys.citedKey(item);
            if (key != null) {
                cited.add("@" + key);
            }
        }
        if (cited.isEmpty()) {
            escape(run.text, sb);
            return;
        }
        critic(sb, "[", String.join("; ", cited), "]");
    }

    private void formatted(String text, ExtractedRun run, StringBuilder sb) {
        int start = 0;
        while (start < text.length() && Character.isWhitespace(text.charAt(start)) && text.charAt(start) != '\n') {
            start++;
        }
        int end = text.length();
        while (end > start && Character.isWhitespace(text.charAt(end - 1)) && text.charAt(end - 1) != '\n') {
            end--;
        }
        String core = text.substring(start, end);
        if (core.isEmpty() && run.highlight != null && text.indexOf('\n') < 0) {
            critic(sb, "{==", text, "==}");
            return;
        }
        boolean decorated = !core.isEmpty() && (!run.formatting.isPlain() || run.highlight != null)
                && core.indexOf('\n') < 0;
        if (!decorated) {
            escape(text, sb);
            return;
        }
        escape(text.substring(0, start), sb);
        String open = openMarkers(run.formatting);
        if (run.highlight != null) {
            sb.append("==");
        }
        sb.append(open);
        atLineStart = false;
        escape(core, sb);
        sb.append(closeMarkers(run.formatting));
        if (run.highlight != null) {
            sb.append("==");
            if (run.highlight != config.getDefaultHighlightColor()) {
                sb.append('{').append(run.highlight.getId()).append('}');
            }
        }
        escape(text.substring(end), sb);
    }

    private static String openMarkers(RunFormatting formatting) {
        StringBuilder sb = new StringBuilder();
        if (formatting.bold() && formatting.italic()) {
            sb.append("***");
        } else if (formatting.bold()) {
            sb.append("**");
        } else if (formatting.italic()) {
            sb.append('*');
        }
        if (formatting.strikethrough()) {
            sb.append("~~");
        }
        if (formatting.underline()) {
            sb.append("<u>");
        }
        if (formatting.superscript()) {
            sb.append("<sup>");
        } else if (formatting.subscript()) {
            sb.append("<sub>");
        }
        return sb.toString();
    }

    private static String closeMarkers(RunFormatting formatting) {
        StringBuilder sb = new StringBuilder();
        if (formatting.superscript()) {
            sb.append("</sup>");
        } else if (formatting.subscript()) {
            sb.append("</sub>");
        }
        if (formatting.underline()) {
            sb.append("</u>");
        }
        if (formatting.strikethrough()) {
            sb.append("~~");
        }
        if (formatting.bold() && formatting.italic()) {
            sb.append("***");
        } else if (formatting.bold()) {
            sb.append("**");
        } else if (formatting.italic()) {
            sb.append('*');
        }
        return sb.toString();
    }

    private void escape(String text, StringBuilder sb) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                trimTrailingBlanks(sb);
                sb.append('\n');
                atLineStart = true;
                continue;
            }
            if (atLineStart && (c == ' ' || c == '\t')) {
                continue;
            }
            char previous = i > 0 ? text.charAt(i - 1) : (sb.length() > 0 ? sb.charAt(sb.length() - 1) : ' ');
            char next = i + 1 < text.length() ? text.charAt(i + 1) : ' ';
            boolean escaped = ALWAYS_ESCAPED.indexOf(c) >= 0
                    || (c == '_' && !(Character.isLetterOrDigit(previous) && Character.isLetterOrDigit(next)))
                    || ((c == '~' || c == '=') && (previous == c || next == c))
                    || (atLineStart && LINE_START_ESCAPED.indexOf(c) >= 0);
            if (atLineStart && Character.isDigit(c)) {
                int k = i;
                while (k < text.length() && Character.isDigit(text.charAt(k))) {
                    k++;
                }
                sb.append(text, i, k);
                if (k < text.length() && (text.charAt(k) == '.' || text.charAt(k) == ')')) {
                    sb.append('\\').append(text.charAt(k));
                    k++;
                }
                i = k - 1;
                atLineStart = false;
                continue;
            }
            if (escaped) {
                sb.append('\\');
            }
            sb.append(c);
            atLineStart = false;
        }
    }

    private String body(CommentNode root) {
        StringBuilder sb = new StringBuilder(header(root));
        for (CommentNode reply : root.replies) {
            sb.append(" {>>").append(header(reply)).append("<<}");
        }
        return sb.toString();
    }

    private String header(CommentNode comment) {
        String text = comment.text == null ? "" : comment.text.replace("<<}", "<< }");
        String author = comment.author == null || comment.author.isBlank() ? null : comment.author.strip();
        String date = CommentDates.toMarkdown(comment.date, zone);
        if (author == null) {
            author = date == null ? null : DocxGenerator.DEFAULT_AUTHOR;
        }
        if (author == null) {
            return text;
        }
        return author + (date == null ? "" : " (" + date + ")") + ": " + text;
    }

    private static String target(String href) {
        return href.replace(" ", "%20").replace("(", "%28").replace(")", "%29");
    }

    private static String prefixLines(String text, String prefix) {
        return prefix + text.replace("\n", "\n" + prefix);
    }

    private static int longestRun(String text, char c) {
        int longest = 0;
        int current = 0;
        for (int i = 0; i < text.length(); i++) {
            current = text.charAt(i) == c ? current + 1 : 0;
            longest = Math.max(longest, current);
        }
        return longest;
    }

    private static void trimTrailingBlanks(StringBuilder sb) {
        while (sb.length() > 0 && (sb.charAt(sb.length() - 1) == ' ' || sb.charAt(sb.length() - 1) == '\t')) {
            sb.setLength(sb.length() - 1);
        }
    }

    private static final class ListNumbers {
        private final int[] counters = new int[3];
        private int parentWidth = 2;

        int next(int level) {
            return ++counters[Math.min(Math.max(level, 1), 2)];
        }

        void reset() {
            counters[1] = 0;
            counters[2] = 0;
            parentWidth = 2;
        }
    }
}
