package org.dxworks.manuscript.markdown;

import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.BulletList;
import org.commonmark.node.CustomBlock;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.manuscript.critic.CriticMarkupPreprocessor;
import org.dxworks.manuscript.model.Run;
import org.dxworks.manuscript.model.TableCell;
import org.dxworks.manuscript.model.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes a manuscript into block tokens carrying inline runs.
 * commonmark-java finds the block structure; the raw inline text of every block is cut from the source
 * lines through block source spans and handed to the {@link InlineTokenizer}, which understands the
 * CriticMarkup, citation and math extensions.
 */
public class MarkdownTokenizer {

    private static final Pattern ATX_PREFIX = Pattern.compile("^ {0,3}#{1,6}(?:[ \\t]+|$)");
    private static final Pattern ATX_SUFFIX = Pattern.compile("[ \\t]+#+[ \\t]*$");
    private static final Pattern SETEXT_UNDERLINE = Pattern.compile("^ {0,3}(?:=+|-+)[ \\t]*$");
    private static final Pattern TASK_PREFIX = Pattern.compile("^\\[([ xX])][ \\t]+");
    private static final Pattern ALERT_MARKER = Pattern.compile("^\\[!(NOTE|TIP|IMPORTANT|WARNING|CAUTION)][ \\t]*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_DELIMITER_ROW = Pattern.compile("^\\s*\\|?\\s*:?-+:?\\s*(\\|\\s*:?-+:?\\s*)*\\|?\\s*$");
    private static final int MAX_LIST_LEVEL = 2;

    private final Parser parser;
    private final InlineTokenizer inlineTokenizer = new InlineTokenizer();

    public MarkdownTokenizer() {
        this.parser = Parser.builder()
                .extensions(List.of(TablesExtension.create()))
                .includeSourceSpans(IncludeSourceSpans.BLOCKS)
                .build();
    }

    public ParsedManuscript tokenize(String markdown) {
        String normalized = markdown.replace("\r\n", "\n");
        FrontmatterCodec.Split split = FrontmatterCodec.split(normalized);
        String body = LatexEnvironments.wrapBareEnvironments(GridTables.toPipeTables(split.body()));
        FootnoteDefinitions.Extracted footnotes = FootnoteDefinitions.extract(body);
        String source = CriticMarkupPreprocessor.preprocess(footnotes.body());

        String[] lines = source.split("\n", -1);
        Node document = parser.parse(source);
        BlockVisitor visitor = new BlockVisitor(lines);
        document.accept(visitor);

        Map<String, List<Run>> footnoteRuns = new LinkedHashMap<>();
        footnotes.definitions().forEach((id, text) ->
                footnoteRuns.put(id, inlineTokenizer.tokenize(CriticMarkupPreprocessor.preprocess(text))));
        return new ParsedManuscript(split.frontmatter(), visitor.tokens, footnoteRuns);
    }

    /** Tokenizes a single inline fragment, for example a table cell or a comment. */
    public List<Run> tokenizeInline(String text) {
        return inlineTokenizer.tokenize(CriticMarkupPreprocessor.preprocess(text));
    }

    private class BlockVisitor extends AbstractVisitor {
        private final String[] lines;
        private final List<Token> tokens = new ArrayList<>();
        private int listDepth = 0;
        private int quoteDepth = 0;
        private final List<Boolean> orderedStack = new ArrayList<>();

        BlockVisitor(String[] lines) {
            this.lines = lines;
        }

        @Override
        public void visit(Heading heading) {
            List<String> raw = rawLines(heading);
            if (raw.size() > 1 && SETEXT_UNDERLINE.matcher(raw.get(raw.size() - 1)).matches()) {
                raw = raw.subList(0, raw.size() - 1);
            }
            String text = String.join("\n", raw).strip();
            text = ATX_PREFIX.matcher(text).replaceFirst("");
            text = ATX_SUFFIX.matcher(text).replaceFirst("");
            if (text.matches("^#+$")) {
                text = "";
            }
            tokens.add(Token.heading(heading.getLevel(), inline(text)));
        }

        @Override
        public void visit(Paragraph paragraph) {
            String text = rawText(paragraph);
            Node parent = paragraph.getParent();
            if (parent instanceof ListItem && paragraph.getPrevious() == null) {
                emitListItem(text);
            } else if (quoteDepth > 0) {
                emitQuoteParagraph(paragraph, text);
            } else {
                tokens.add(Token.paragraph(inline(text)));
            }
        }

        @Override
        public void visit(BulletList bulletList) {
            visitList(bulletList, false);
        }

        @Override
        public void visit(OrderedList orderedList) {
            visitList(orderedList, true);
        }

        @Override
        public void visit(ListItem listItem) {
            if (listItem.getFirstChild() == null) {
                emitListItem("");
                return;
            }
            if (!(listItem.getFirstChild() instanceof Paragraph)) {
                emitListItem("");
            }
            visitChildren(listItem);
        }

        @Override
        public void visit(BlockQuote blockQuote) {
            quoteDepth++;
            try {
                visitChildren(blockQuote);
            } finally {
                quoteDepth--;
            }
        }

        @Override
        public void visit(FencedCodeBlock codeBlock) {
            String info = codeBlock.getInfo() == null ? "" : codeBlock.getInfo().trim();
            String language = info.isEmpty() ? null : info.split("\\s+")[0];
            tokens.add(Token.codeBlock(language, codeLiteral(codeBlock.getLiteral())));
        }

        @Override
        public void visit(IndentedCodeBlock codeBlock) {
            tokens.add(Token.codeBlock(null, codeLiteral(codeBlock.getLiteral())));
        }

        @Override
        public void visit(ThematicBreak thematicBreak) {
            tokens.add(Token.thematicBreak());
        }

        @Override
        public void visit(HtmlBlock htmlBlock) {
            String literal = htmlBlock.getLiteral().strip();
            if (literal.startsWith("<!--")) {
                tokens.add(Token.paragraph(inline(literal)));
                return;
            }
            literal = CriticMarkupPreprocessor.restoreParagraphs(literal);
            if (!literal.isEmpty()) {
                tokens.add(Token.paragraph(List.of(Run.text(literal))));
            }
        }

        @Override
        public void visit(CustomBlock customBlock) {
            if (customBlock instanceof TableBlock table) {
                tokens.add(Token.table(tableRows(table)));
                return;
            }
            super.visit(customBlock);
        }

        private void visitList(Node list, boolean ordered) {
            listDepth++;
            orderedStack.add(ordered);
            try {
                visitChildren(list);
            } finally {
                orderedStack.remove(orderedStack.size() - 1);
                listDepth--;
            }
        }

        private void emitListItem(String text) {
            Boolean checked = null;
            Matcher task = TASK_PREFIX.matcher(text);
            if (task.find()) {
                checked = !task.group(1).equals(" ");
                text = text.substring(task.end());
            }
            boolean ordered = !orderedStack.isEmpty() && orderedStack.get(orderedStack.size() - 1);
            int level = Math.min(Math.max(listDepth, 1), MAX_LIST_LEVEL);
            tokens.add(Token.listItem(level, ordered, checked, inline(text)));
        }

        private void emitQuoteParagraph(Paragraph paragraph, String text) {
            if (paragraph.getParent() instanceof BlockQuote quote) {
                String alertType = alertTypeOf(quote);
                if (alertType != null) {
                    if (quote.getFirstChild() == paragraph) {
                        int newline = text.indexOf('\n');
                        text = newline < 0 ? "" : text.substring(newline + 1);
                        if (text.isBlank()) {
                            return;
                        }
                    }
                    tokens.add(Token.alertBox(alertType, inline(text)));
                    return;
                }
            }
            tokens.add(Token.blockquote(quoteDepth, inline(text)));
        }

        private String alertTypeOf(BlockQuote quote) {
            if (!(quote.getFirstChild() instanceof Paragraph first)) {
                return null;
            }
            String firstLine = rawText(first).split("\n", 2)[0].strip();
            Matcher matcher = ALERT_MARKER.matcher(firstLine);
            return matcher.matches() ? matcher.group(1).toUpperCase(Locale.ROOT) : null;
        }

        private List<List<TableCell>> tableRows(TableBlock table) {
            List<List<TableCell>> rows = new ArrayList<>();
            for (String line : rawLines(table)) {
                if (line.isBlank() || TABLE_DELIMITER_ROW.matcher(line).matches()) {
                    continue;
                }
                List<TableCell> cells = new ArrayList<>();
                for (String cell : splitTableRow(line)) {
                    cells.add(new TableCell(inline(cell.strip())));
                }
                rows.add(cells);
            }
            return rows;
        }

        private List<Run> inline(String text) {
            return inlineTokenizer.tokenize(text);
        }

        private String rawText(Node node) {
            List<String> raw = rawLines(node);
            List<String> stripped = new ArrayList<>(raw.size());
            for (String line : raw) {
                stripped.add(line.stripLeading());
            }
            return String.join("\n", stripped).strip();
        }

        private List<String> rawLines(Node node) {
            List<String> result = new ArrayList<>();
            for (SourceSpan span : node.getSourceSpans()) {
                int index = span.getLineIndex();
                if (index < 0 || index >= lines.length) {
                    continue;
                }
                String line = lines[index];
                int start = Math.min(span.getColumnIndex(), line.length());
                int end = Math.min(start + span.getLength(), line.length());
                result.add(line.substring(start, end));
            }
            return result;
        }
    }

    static List<String> splitTableRow(String line) {
        String row = line.strip();
        if (row.startsWith("|")) {
            row = row.substring(1);
        }
        if (row.endsWith("|") && !row.endsWith("\\|")) {
            row = row.substring(0, row.length() - 1);
        }
        InertZones zones = InertZones.compute(row);
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        for (int i = 0; i < row.length(); i++) {
            char c = row.charAt(i);
            if (c == '\\' && i + 1 < row.length() && row.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
            } else if (c == '|' && !zones.isInert(i)) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }

    private static String codeLiteral(String literal) {
        String code = CriticMarkupPreprocessor.restoreParagraphs(literal == null ? "" : literal);
        return code.endsWith("\n") ? code.substring(0, code.length() - 1) : code;
    }
}
