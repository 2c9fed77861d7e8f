package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.ManuscriptConfig;
import org.dxworks.manuscript.bibtex.BibtexCodec;
import org.dxworks.manuscript.citation.BibtexExporter;
import org.dxworks.manuscript.citation.CitationFieldParser;
import org.dxworks.manuscript.citation.CitationKeyManager;
import org.dxworks.manuscript.citation.ZoteroCitation;
import org.dxworks.manuscript.docx.xml.XmlElement;
import org.dxworks.manuscript.docx.xml.XmlNode;
import org.dxworks.manuscript.docx.xml.XmlParseException;
import org.dxworks.manuscript.docx.xml.XmlReader;
import org.dxworks.manuscript.docx.xml.XmlText;
import org.dxworks.manuscript.markdown.FrontmatterCodec;
import org.dxworks.manuscript.math.MathTranslator;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CommentNode;
import org.dxworks.manuscript.model.Frontmatter;
import org.dxworks.manuscript.model.HighlightColor;
import org.dxworks.manuscript.model.MarkdownConversion;
import org.dxworks.manuscript.model.RunFormatting;
import org.dxworks.manuscript.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a DOCX package back into Markdown, a BibTeX file for the cited works and the embedded media.
 * Only an unreadable archive or an unreadable {@code word/document.xml} fails the extraction; damaged optional
 * parts are reported as warnings and treated as absent.
 */
public class DocxExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(DocxExtractor.class);

    private static final Pattern HEADING_STYLE = Pattern.compile("^heading ?([1-9])$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ZOTERO_STYLE = Pattern.compile("<style id=\"([^\"]+)\"");
    private static final Pattern ZOTERO_LOCALE = Pattern.compile("locale=\"([^\"]+)\"");
    private static final Set<String> MONOSPACE_FONTS = Set.of("consolas", "courier new", "courier", "menlo",
            "monaco", "lucida console", "source code pro", "fira code", "jetbrains mono", "dejavu sans mono");
    private static final Set<String> OFF_VALUES = Set.of("0", "false", "off", "none");
    private static final int QUOTE_INDENT = 720;

    private final ManuscriptConfig config;

    public DocxExtractor(ManuscriptConfig config) {
        this.config = config;
    }

    public MarkdownConversion extract(byte[] docx) throws DocxFormatException {
        return new Extraction(DocxPackage.read(docx)).run();
    }

    private enum FieldKind {
        CITATION, BIBLIOGRAPHY, OTHER
    }

    private static final class Field {
        private final StringBuilder instruction = new StringBuilder();
        private final StringBuilder result = new StringBuilder();
        private FieldKind kind;

        FieldKind kind() {
            if (kind == null) {
                String text = instruction.toString();
                kind = CitationFieldParser.isCitation(text) ? FieldKind.CITATION
                        : CitationFieldParser.isBibliography(text) ? FieldKind.BIBLIOGRAPHY
                        : FieldKind.OTHER;
            }
            return kind;
        }
    }

    /** Formatting in effect for the runs below a paragraph child. */
    private record Context(String href, ExtractedRun.Kind revision) {
        static final Context ROOT = new Context(null, null);

        Context withHref(String target) {
            return new Context(target, revision);
        }

        Context withRevision(ExtractedRun.Kind kind) {
            return new Context(href, kind);
        }
    }

    private record RunProperties(RunFormatting formatting, HighlightColor highlight, boolean code,
                                 boolean htmlComment) {
        static final RunProperties PLAIN = new RunProperties(RunFormatting.NONE, null, false, false);
    }

    private class Extraction {
        private final DocxPackage docx;
        private final XmlReader reader = new XmlReader(config.getMaxXmlDepth());
        private final int maxDepth = config.getMaxXmlDepth();
        private final MathTranslator math = new MathTranslator(config.getMaxXmlDepth());
        private final List<String> warnings = new ArrayList<>();

        private Relationships relationships = new Relationships();
        private final Map<String, String> styleNames = new HashMap<>();
        private final Map<String, String> abstractByNum = new HashMap<>();
        private final Map<String, Map<Integer, String>> formatsByAbstract = new HashMap<>();
        private CommentThreads threads = CommentThreads.group(List.of(), Map.of());
        private final Map<String, XmlElement> notes = new HashMap<>();

        private final Frontmatter frontmatter = new Frontmatter();
        private final Map<String, byte[]> media = new LinkedHashMap<>();
        private final Map<String, String> mediaPaths = new HashMap<>();
        private final Map<String, String> noteLabels = new HashMap<>();
        private final Map<String, List<ExtractedRun>> footnotes = new LinkedHashMap<>();
        private final List<List<CitationMetadata>> citationGroups = new ArrayList<>();

        private Set<String> activeComments = new LinkedHashSet<>();
        private final Set<String> rangedComments = new HashSet<>();
        private final Set<String> coveredComments = new HashSet<>();
        private final Set<String> pointComments = new HashSet<>();
        private Deque<Field> fields = new ArrayDeque<>();

        Extraction(DocxPackage docx) {
            this.docx = docx;
        }

        MarkdownConversion run() throws DocxFormatException {
            XmlElement document;
            try {
                document = reader.parse(docx.get(DocxPackage.DOCUMENT).orElseThrow());
            } catch (XmlParseException e) {
                throw new DocxFormatException("Unreadable " + DocxPackage.DOCUMENT + ": " + e.getMessage(), e);
            }
            optionalPart(DocxPackage.DOCUMENT_RELS).ifPresent(root -> relationships = Relationships.read(root));
            optionalPart(DocxPackage.STYLES).ifPresent(this::readStyles);
            optionalPart(DocxPackage.NUMBERING).ifPresent(this::readNumbering);
            readComments();
            readNotes(DocxPackage.FOOTNOTES, "w:footnote", "footnote");
            readNotes(DocxPackage.ENDNOTES, "w:endnote", "endnote");
            readProperties();

            List<ExtractedBlock> blocks = new ArrayList<>();
            document.child("w:body").ifPresent(body -> readBlocks(body, blocks, 1));
            stripSources(blocks);
            for (ExtractedBlock block : blocks) {
                block.runLists().forEach(Extraction::normalize);
            }
            footnotes.values().forEach(Extraction::normalize);

            CitationKeyManager keys = CitationKeyManager.build(citationGroups, config.getCitationKeyFormat());
            MarkdownRenderer renderer = new MarkdownRenderer(config, keys, CommentDates.zone(frontmatter.timezone));
            String markdown = renderer.render(frontmatter, blocks, footnotes, threads);
            warnings.addAll(renderer.warnings());
            String bibtex = keys.size() == 0 ? "" : BibtexCodec.serialize(BibtexExporter.export(keys));

            LOG.debug("Extracted {} blocks, {} comment threads, {} citations", blocks.size(), threads.roots().size(),
                    keys.size());
            return new MarkdownConversion(markdown, bibtex, media, warnings);
        }

        private Optional<XmlElement> optionalPart(String name) {
            Optional<byte[]> bytes = docx.get(name);
            if (bytes.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(reader.parse(bytes.get()));
            } catch (XmlParseException e) {
                warnings.add("Ignoring unreadable part " + name);
                LOG.warn("Ignoring unreadable part {}: {}", name, e.getMessage());
                return Optional.empty();
            }
        }

        private void readStyles(XmlElement styles) {
            for (XmlElement style : styles.elements("w:style")) {
                String id = style.attr("w:styleId");
                if (id != null) {
                    style.childAttr("w:name", "w:val").ifPresent(name -> styleNames.put(id, name));
                }
            }
        }

        private void readNumbering(XmlElement numbering) {
            for (XmlElement abstractNum : numbering.elements("w:abstractNum")) {
                Map<Integer, String> formats = new HashMap<>();
                for (XmlElement level : abstractNum.elements("w:lvl")) {
                    Integer ilvl = integer(level.attr("w:ilvl"));
                    if (ilvl != null) {
                        formats.put(ilvl, level.childAttr("w:numFmt", "w:val").orElse("decimal"));
                    }
                }
                formatsByAbstract.put(abstractNum.attr("w:abstractNumId"), formats);
            }
            for (XmlElement num : numbering.elements("w:num")) {
                num.childAttr("w:abstractNumId", "w:val")
                        .ifPresent(abstractId -> abstractByNum.put(num.attr("w:numId"), abstractId));
            }
        }

        private boolean isBullet(String numId, int ilvl) {
            Map<Integer, String> formats = formatsByAbstract.get(abstractByNum.get(numId));
            if (formats == null) {
                return true;
            }
            String format = formats.getOrDefault(ilvl, "bullet");
            return format.equals("bullet") || format.equals("none");
        }

        private void readComments() {
            Optional<XmlElement> part = optionalPart(DocxPackage.COMMENTS);
            if (part.isEmpty()) {
                return;
            }
            List<CommentNode> comments = new ArrayList<>();
            for (XmlElement element : part.get().elements("w:comment")) {
                CommentNode comment = new CommentNode();
                comment.id = element.attr("w:id");
                comment.author = element.attr("w:author");
                comment.date = element.attr("w:date");
                List<String> paragraphs = new ArrayList<>();
                for (XmlElement paragraph : element.elements("w:p")) {
                    paragraphs.add(plainText(paragraph, 0));
                    String paraId = paragraph.attr("w14:paraId");
                    if (paraId != null) {
                        comment.paraId = paraId;
                    }
                }
                comment.text = String.join("\n\n", paragraphs).strip();
                if (comment.id != null) {
                    comments.add(comment);
                }
            }
            Map<String, String> parents = new HashMap<>();
            optionalPart(DocxPackage.COMMENTS_EXTENDED).ifPresent(extended -> {
                for (XmlElement entry : extended.findAll("w15:commentEx", maxDepth)) {
                    String parent = entry.attr("w15:paraIdParent");
                    if (parent != null) {
                        parents.put(entry.attr("w15:paraId"), parent);
                    }
                }
            });
            threads = CommentThreads.group(comments, parents);
        }

        private void readNotes(String partName, String elementName, String kind) {
            optionalPart(partName).ifPresent(part -> {
                for (XmlElement note : part.elements(elementName)) {
                    String type = note.attr("w:type");
                    if (type == null || type.equals("normal")) {
                        notes.put(kind + ":" + note.attr("w:id"), note);
                    }
                }
            });
        }

        private void readProperties() {
            optionalPart(DocxPackage.CORE_PROPERTIES).ifPresent(core -> core.child("dc:creator")
                    .map(creator -> creator.text(maxDepth).strip())
                    .filter(creator -> !creator.isEmpty())
                    .ifPresent(creator -> frontmatter.author = creator));
            Optional<XmlElement> custom = optionalPart(DocxPackage.CUSTOM_PROPERTIES);
            if (custom.isEmpty()) {
                return;
            }
            Map<Integer, String> preferences = new TreeMap<>();
            for (XmlElement property : custom.get().elements()) {
                String name = property.attr("name");
                if (name == null) {
                    continue;
                }
                String value = property.text(maxDepth);
                if (name.startsWith(PackageParts.ZOTERO_PREF)) {
                    Integer index = integer(name.substring(PackageParts.ZOTERO_PREF.length()));
                    if (index != null) {
                        preferences.put(index, value);
                    }
                } else {
                    FrontmatterCodec.apply(frontmatter, name.toLowerCase(Locale.ROOT), value);
                }
            }
            String zotero = String.join("", preferences.values());
            if (frontmatter.csl == null) {
                Matcher style = ZOTERO_STYLE.matcher(zotero);
                if (style.find()) {
                    String id = style.group(1);
                    frontmatter.csl = id.startsWith(PackageParts.ZOTERO_STYLE_PREFIX)
                            ? id.substring(PackageParts.ZOTERO_STYLE_PREFIX.length()) : id;
                }
            }
            if (frontmatter.locale == null) {
                Matcher locale = ZOTERO_LOCALE.matcher(zotero);
                if (locale.find()) {
                    frontmatter.locale = locale.group(1);
                }
            }
        }

        private void readBlocks(XmlElement container, List<ExtractedBlock> blocks, int depth) {
            if (depth > maxDepth) {
                return;
            }
            for (XmlElement child : container.elements()) {
                switch (child.name()) {
                    case "w:p" -> paragraph(child, blocks, depth + 1);
                    case "w:tbl" -> blocks.add(table(child, depth + 1));
                    case "w:sdt" -> child.child("w:sdtContent").ifPresent(content -> readBlocks(content, blocks, depth + 1));
                    case "w:customXml" -> readBlocks(child, blocks, depth + 1);
                    default -> {
                        // section properties and bookmarks between blocks carry no content
                    }
                }
            }
        }

        private void paragraph(XmlElement paragraph, List<ExtractedBlock> blocks, int depth) {
            Optional<XmlElement> properties = paragraph.child("w:pPr");
            String styleId = properties.flatMap(pPr -> pPr.childAttr("w:pStyle", "w:val")).orElse("");
            String styleName = styleNames.getOrDefault(styleId, styleId).toLowerCase(Locale.ROOT);

            if (styleId.equalsIgnoreCase(StylesWriter.CODE_BLOCK) || styleName.equals("code block")) {
                codeParagraph(paragraph, blocks, depth);
                return;
            }

            List<ExtractedRun> runs = new ArrayList<>();
            readInline(paragraph, runs, Context.ROOT, depth);

            if (styleId.equalsIgnoreCase(StylesWriter.TITLE) || styleName.equals("title")) {
                String title = plainText(runs).strip();
                if (!title.isEmpty()) {
                    frontmatter.titles.add(title);
                }
                return;
            }

            ExtractedBlock block;
            Matcher heading = HEADING_STYLE.matcher(styleName);
            Matcher headingId = HEADING_STYLE.matcher(styleId);
            Optional<XmlElement> numbering = properties.flatMap(pPr -> pPr.child("w:numPr"));
            String numId = numbering.flatMap(numPr -> numPr.childAttr("w:numId", "w:val")).orElse(null);
            if (heading.matches() || headingId.matches()) {
                block = new ExtractedBlock(TokenType.HEADING);
                block.level = Math.min(Integer.parseInt(heading.matches() ? heading.group(1) : headingId.group(1)), 6);
            } else if (numId != null && !numId.equals("0")) {
                int ilvl = numbering.flatMap(numPr -> numPr.childAttr("w:ilvl", "w:val"))
                        .map(Extraction::integer).orElse(0);
                block = new ExtractedBlock(TokenType.LIST_ITEM);
                block.level = Math.min(ilvl + 1, 2);
                block.ordered = !isBullet(numId, ilvl);
                block.checked = taskState(runs);
            } else if (alertType(styleId) != null) {
                block = new ExtractedBlock(TokenType.ALERT_BOX);
                block.alertType = alertType(styleId);
                block.level = 1;
            } else if (styleId.equalsIgnoreCase(StylesWriter.QUOTE) || styleName.equals("quote")
                    || styleName.equals("intense quote")) {
                block = new ExtractedBlock(TokenType.BLOCKQUOTE);
                int indent = properties.flatMap(pPr -> pPr.childAttr("w:ind", "w:left"))
                        .map(Extraction::integer).orElse(QUOTE_INDENT);
                block.level = Math.max(1, Math.round(indent / (float) QUOTE_INDENT));
            } else if (runs.isEmpty() && properties.flatMap(pPr -> pPr.child("w:pBdr"))
                    .flatMap(border -> border.child("w:bottom")).isPresent()) {
                blocks.add(new ExtractedBlock(TokenType.THEMATIC_BREAK));
                return;
            } else {
                block = new ExtractedBlock(TokenType.PARAGRAPH);
                if (isBlank(runs)) {
                    return;
                }
            }
            block.runs = runs;
            blocks.add(block);
        }

        private void codeParagraph(XmlElement paragraph, List<ExtractedBlock> blocks, int depth) {
            String language = null;
            for (XmlElement bookmark : paragraph.findAll("w:bookmarkStart", maxDepth - depth)) {
                String name = bookmark.attr("w:name");
                if (name != null && name.startsWith(DocxGenerator.CODE_LANGUAGE_BOOKMARK)) {
                    language = name.substring(DocxGenerator.CODE_LANGUAGE_BOOKMARK.length());
                }
            }
            String code = plainText(paragraph, depth);
            ExtractedBlock previous = blocks.isEmpty() ? null : blocks.get(blocks.size() - 1);
            if (language == null && previous != null && previous.type == TokenType.CODE_BLOCK) {
                previous.code.append('\n').append(code);
                return;
            }
            ExtractedBlock block = new ExtractedBlock(TokenType.CODE_BLOCK);
            block.language = language;
            block.code = new StringBuilder(code);
            blocks.add(block);
        }

        private ExtractedBlock table(XmlElement table, int depth) {
            ExtractedBlock block = new ExtractedBlock(TokenType.TABLE);
            for (XmlElement row : table.elements("w:tr")) {
                List<List<ExtractedRun>> cells = new ArrayList<>();
                for (XmlElement cell : row.elements("w:tc")) {
                    List<ExtractedRun> runs = new ArrayList<>();
                    for (XmlElement paragraph : cell.findAll("w:p", maxDepth - depth)) {
                        if (!runs.isEmpty()) {
                            runs.add(new ExtractedRun(ExtractedRun.Kind.TEXT, " "));
                        }
                        readInline(paragraph, runs, Context.ROOT, depth + 1);
                    }
                    cells.add(runs);
                }
                block.rows.add(cells);
            }
            return block;
        }

        private void readInline(XmlElement parent, List<ExtractedRun> out, Context context, int depth) {
            if (depth > maxDepth) {
                return;
            }
            for (XmlElement child : parent.elements()) {
                switch (child.name()) {
                    case "w:r" -> readRun(child, out, context, depth + 1);
                    case "w:hyperlink" -> {
                        String target = Optional.ofNullable(child.attr("r:id"))
                                .flatMap(relationships::get)
                                .filter(Relationships.Relationship::external)
                                .map(Relationships.Relationship::target)
                                .orElse(context.href());
                        readInline(child, out, context.withHref(target), depth + 1);
                    }
                    case "w:ins", "w:moveTo" -> readInline(child, out,
                            context.withRevision(ExtractedRun.Kind.INSERTION), depth + 1);
                    case "w:del", "w:moveFrom" -> readInline(child, out,
                            context.withRevision(ExtractedRun.Kind.DELETION), depth + 1);
                    case "w:smartTag", "w:customXml", "w:sdtContent", "w:dir", "w:bdo" ->
                            readInline(child, out, context, depth + 1);
                    case "w:sdt" -> child.child("w:sdtContent")
                            .ifPresent(content -> readInline(content, out, context, depth + 1));
                    case "w:fldSimple" -> simpleField(child, out, context, depth + 1);
                    case "m:oMath" -> math(child, false, out);
                    case "m:oMathPara" -> math(child, true, out);
                    case "w:commentRangeStart" -> startComment(child.attr("w:id"));
                    case "w:commentRangeEnd" -> endComment(child.attr("w:id"), out);
                    default -> {
                        // paragraph properties, proofing marks and bookmark ends
                    }
                }
            }
        }

        private void readRun(XmlElement run, List<ExtractedRun> out, Context context, int depth) {
            RunProperties properties = run.child("w:rPr").map(this::runProperties).orElse(RunProperties.PLAIN);
            for (XmlElement child : run.elements()) {
                switch (child.name()) {
                    case "w:t", "w:delText" -> text(textOf(child), properties, context, out);
                    case "w:tab" -> text("\t", properties, context, out);
                    case "w:br", "w:cr" -> {
                        if (!"page".equals(child.attr("w:type"))) {
                            text("\n", properties, context, out);
                        }
                    }
                    case "w:noBreakHyphen" -> text("-", properties, context, out);
                    case "w:fldChar" -> fieldChar(child.attr("w:fldCharType"), out);
                    case "w:instrText" -> {
                        if (!fields.isEmpty()) {
                            fields.peek().instruction.append(textOf(child));
                        }
                    }
                    case "w:footnoteReference" -> note("footnote", child.attr("w:id"), out);
                    case "w:endnoteReference" -> note("endnote", child.attr("w:id"), out);
                    case "w:commentReference" -> commentReference(child.attr("w:id"), out);
                    case "w:drawing" -> image(child, out, depth + 1);
                    case "m:oMath" -> math(child, false, out);
                    default -> {
                        // run properties, annotation and note reference marks, rendered page breaks
                    }
                }
            }
        }

        private RunProperties runProperties(XmlElement rPr) {
            RunFormatting formatting = RunFormatting.NONE;
            if (isOn(rPr, "w:b")) {
                formatting = formatting.withBold();
            }
            if (isOn(rPr, "w:i")) {
                formatting = formatting.withItalic();
            }
            if (isOn(rPr, "w:u")) {
                formatting = formatting.withUnderline();
            }
            if (isOn(rPr, "w:strike") || isOn(rPr, "w:dstrike")) {
                formatting = formatting.withStrikethrough();
            }
            String vertAlign = rPr.childAttr("w:vertAlign", "w:val").orElse("");
            if (vertAlign.equals("superscript")) {
                formatting = formatting.withSuperscript();
            } else if (vertAlign.equals("subscript")) {
                formatting = formatting.withSubscript();
            }

            HighlightColor highlight = null;
            String highlightName = rPr.childAttr("w:highlight", "w:val").orElse("none");
            String shading = rPr.childAttr("w:shd", "w:fill").orElse("auto");
            if (!highlightName.equals("none")) {
                highlight = HighlightColor.fromWordName(highlightName).orElse(config.getDefaultHighlightColor());
            } else if (!shading.equalsIgnoreCase("auto") && !shading.equalsIgnoreCase("FFFFFF")) {
                highlight = config.getDefaultHighlightColor();
            }

            String characterStyle = rPr.childAttr("w:rStyle", "w:val").orElse("");
            String font = rPr.childAttr("w:rFonts", "w:ascii")
                    .or(() -> rPr.childAttr("w:rFonts", "w:hAnsi"))
                    .orElse("").toLowerCase(Locale.ROOT);
            boolean code = characterStyle.equals(StylesWriter.CODE_CHAR)
                    || styleNames.getOrDefault(characterStyle, "").equalsIgnoreCase("verbatim char")
                    || MONOSPACE_FONTS.contains(font);
            return new RunProperties(formatting, highlight, code, characterStyle.equals(StylesWriter.HTML_COMMENT));
        }

        private void text(String text, RunProperties properties, Context context, List<ExtractedRun> out) {
            // empty text only matters as an empty tracked change or highlight
            if (text.isEmpty() && context.revision() == null && properties.highlight() == null) {
                return;
            }
            if (isSuppressed()) {
                Field top = fields.peek();
                if (top != null && top.kind == FieldKind.CITATION) {
                    top.result.append(text);
                }
                return;
            }
            ExtractedRun.Kind kind = context.revision() != null ? context.revision()
                    : properties.htmlComment() ? ExtractedRun.Kind.HTML_COMMENT
                    : properties.code() ? ExtractedRun.Kind.CODE : ExtractedRun.Kind.TEXT;
            ExtractedRun run = new ExtractedRun(kind, text);
            if (kind == ExtractedRun.Kind.TEXT) {
                run.formatting = properties.formatting();
                run.highlight = properties.highlight();
            }
            if (kind == ExtractedRun.Kind.TEXT || kind == ExtractedRun.Kind.CODE) {
                run.href = context.href();
            }
            add(run, out);
        }

        private void add(ExtractedRun run, List<ExtractedRun> out) {
            run.commentIds.addAll(activeComments);
            coveredComments.addAll(activeComments);
            out.add(run);
        }

        /** Text inside a field instruction, or inside the result of a citation or bibliography field. */
        private boolean isSuppressed() {
            for (Field field : fields) {
                if (field.kind == null || field.kind != FieldKind.OTHER) {
                    return true;
                }
            }
            return false;
        }

        private void fieldChar(String type, List<ExtractedRun> out) {
            if ("begin".equals(type)) {
                fields.push(new Field());
            } else if ("separate".equals(type) && !fields.isEmpty()) {
                fields.peek().kind();
            } else if ("end".equals(type) && !fields.isEmpty()) {
                Field field = fields.pop();
                if (field.kind() == FieldKind.CITATION) {
                    citation(field.instruction.toString(), field.result.toString(), out);
                }
            }
        }

        private void simpleField(XmlElement field, List<ExtractedRun> out, Context context, int depth) {
            String instruction = field.attr("w:instr") == null ? "" : field.attr("w:instr");
            if (CitationFieldParser.isCitation(instruction)) {
                citation(instruction, field.text(maxDepth), out);
            } else if (!CitationFieldParser.isBibliography(instruction)) {
                readInline(field, out, context, depth);
            }
        }

        private void citation(String instruction, String displayText, List<ExtractedRun> out) {
            if (isSuppressed()) {
                return;
            }
            Optional<ZoteroCitation> citation = CitationFieldParser.parse(instruction);
            if (citation.isEmpty()) {
                warnings.add("Unreadable citation kept as text: " + displayText);
                LOG.warn("Unreadable citation kept as text: {}", displayText);
                text(displayText, RunProperties.PLAIN, Context.ROOT, out);
                return;
            }
            ExtractedRun run = new ExtractedRun(ExtractedRun.Kind.CITATION, displayText);
            run.citations = citation.get().items();
            citationGroups.add(run.citations);
            add(run, out);
        }

        private void math(XmlElement element, boolean display, List<ExtractedRun> out) {
            if (isSuppressed()) {
                return;
            }
            String latex = math.ommlToLatex(element);
            if (latex.isBlank()) {
                return;
            }
            ExtractedRun run = new ExtractedRun(ExtractedRun.Kind.MATH, latex);
            run.display = display;
            add(run, out);
        }

        private void note(String kind, String id, List<ExtractedRun> out) {
            if (isSuppressed() || id == null) {
                return;
            }
            String key = kind + ":" + id;
            XmlElement note = notes.get(key);
            if (note == null) {
                warnings.add("Note not found: " + id);
                LOG.warn("{} {} is referenced but missing", kind, id);
                return;
            }
            String label = noteLabels.get(key);
            if (label == null) {
                label = String.valueOf(noteLabels.size() + 1);
                noteLabels.put(key, label);
                footnotes.put(label, noteRuns(note));
            }
            ExtractedRun run = new ExtractedRun(ExtractedRun.Kind.FOOTNOTE, "");
            run.footnoteLabel = label;
            add(run, out);
        }

        /** Reads note content with its own comment and field state, then restores the body's. */
        private List<ExtractedRun> noteRuns(XmlElement note) {
            Set<String> bodyComments = activeComments;
            Deque<Field> bodyFields = fields;
            activeComments = new LinkedHashSet<>();
            fields = new ArrayDeque<>();
            List<ExtractedRun> runs = new ArrayList<>();
            try {
                for (XmlElement paragraph : note.elements("w:p")) {
                    if (!runs.isEmpty()) {
                        runs.add(new ExtractedRun(ExtractedRun.Kind.TEXT, " "));
                    }
                    readInline(paragraph, runs, Context.ROOT, 2);
                }
            } finally {
                activeComments = bodyComments;
                fields = bodyFields;
            }
            if (!runs.isEmpty() && runs.get(0).kind == ExtractedRun.Kind.TEXT) {
                runs.get(0).text = runs.get(0).text.stripLeading();
            }
            return runs;
        }

        private void image(XmlElement drawing, List<ExtractedRun> out, int depth) {
            if (isSuppressed()) {
                return;
            }
            List<XmlElement> blips = drawing.findAll("a:blip", maxDepth - depth);
            Optional<Relationships.Relationship> target = blips.isEmpty() ? Optional.empty()
                    : Optional.ofNullable(blips.get(0).attr("r:embed")).flatMap(relationships::get);
            if (target.isEmpty()) {
                warnings.add("Image without embedded picture skipped");
                return;
            }
            String partName = target.get().target().startsWith("/")
                    ? target.get().target().substring(1)
                    : "word/" + target.get().target();
            Optional<byte[]> bytes = docx.get(partName);
            if (bytes.isEmpty()) {
                warnings.add("Image not found in package: " + partName);
                LOG.warn("Image not found in package: {}", partName);
                return;
            }
            String path = mediaPaths.computeIfAbsent(partName, name -> {
                String fileName = name.substring(name.lastIndexOf('/') + 1);
                String exported = config.getMediaDirectory() + "/" + fileName;
                media.put(exported, bytes.get());
                return exported;
            });
            List<XmlElement> docPr = drawing.findAll("wp:docPr", maxDepth - depth);
            String alt = docPr.isEmpty() || docPr.get(0).attr("descr") == null ? "" : docPr.get(0).attr("descr");
            ExtractedRun run = new ExtractedRun(ExtractedRun.Kind.IMAGE, alt);
            run.imagePath = path;
            add(run, out);
        }

        private void startComment(String id) {
            if (id != null && threads.isRoot(id)) {
                activeComments.add(id);
                rangedComments.add(id);
            }
        }

        private void endComment(String id, List<ExtractedRun> out) {
            if (id == null || !threads.isRoot(id)) {
                return;
            }
            activeComments.remove(id);
            if (!coveredComments.contains(id)) {
                pointComment(id, out);
            }
        }

        private void commentReference(String id, List<ExtractedRun> out) {
            if (id != null && threads.isRoot(id) && !rangedComments.contains(id)) {
                pointComment(id, out);
            }
        }

        private void pointComment(String id, List<ExtractedRun> out) {
            if (!pointComments.add(id)) {
                return;
            }
            ExtractedRun run = new ExtractedRun(ExtractedRun.Kind.COMMENT_POINT, "");
            run.commentId = id;
            out.add(run);
        }

        /** Drops the trailing {@code Sources} section, which is regenerated from the bibliography. */
        private void stripSources(List<ExtractedBlock> blocks) {
            for (int i = blocks.size() - 1; i >= 0; i--) {
                ExtractedBlock block = blocks.get(i);
                if (block.type == TokenType.HEADING
                        && plainText(block.runs).strip().equalsIgnoreCase(DocxGenerator.SOURCES_HEADING)) {
                    int end = i + 1;
                    while (end < blocks.size()
                            && !(blocks.get(end).type == TokenType.HEADING && blocks.get(end).level <= block.level)) {
                        end++;
                    }
                    blocks.subList(i, end).clear();
                    return;
                }
            }
        }

        private static Boolean taskState(List<ExtractedRun> runs) {
            if (runs.isEmpty() || runs.get(0).kind != ExtractedRun.Kind.TEXT) {
                return null;
            }
            ExtractedRun first = runs.get(0);
            Boolean checked = first.text.startsWith(DocxGenerator.CHECKED_BOX) ? Boolean.TRUE
                    : first.text.startsWith(DocxGenerator.UNCHECKED_BOX) ? Boolean.FALSE
                    : null;
            if (checked != null) {
                first.text = first.text.substring(1).stripLeading();
                if (first.text.isEmpty()) {
                    runs.remove(0);
                }
            }
            return checked;
        }

        private static String alertType(String styleId) {
            if (!styleId.startsWith(StylesWriter.ALERT)) {
                return null;
            }
            String type = styleId.substring(StylesWriter.ALERT.length()).toUpperCase(Locale.ROOT);
            return StylesWriter.ALERT_TYPES.contains(type) ? type : null;
        }

        /** Pairs deletions with following insertions and merges neighbours with identical decoration. */
        private static void normalize(List<ExtractedRun> runs) {
            for (int i = 0; i + 1 < runs.size(); i++) {
                ExtractedRun deletion = runs.get(i);
                if (deletion.kind != ExtractedRun.Kind.DELETION) {
                    continue;
                }
                int j = i + 1;
                while (j < runs.size() && runs.get(j).kind == ExtractedRun.Kind.DELETION
                        && runs.get(j).commentIds.equals(deletion.commentIds)) {
                    deletion.text += runs.remove(j).text;
                }
                if (j < runs.size() && runs.get(j).kind == ExtractedRun.Kind.INSERTION
                        && runs.get(j).commentIds.equals(deletion.commentIds)) {
                    StringBuilder inserted = new StringBuilder(runs.remove(j).text);
                    while (j < runs.size() && runs.get(j).kind == ExtractedRun.Kind.INSERTION
                            && runs.get(j).commentIds.equals(deletion.commentIds)) {
                        inserted.append(runs.remove(j).text);
                    }
                    deletion.kind = ExtractedRun.Kind.SUBSTITUTION;
                    deletion.newText = inserted.toString();
                }
            }
            for (int i = 0; i + 1 < runs.size(); ) {
                if (runs.get(i).canMerge(runs.get(i + 1))) {
                    runs.get(i).text += runs.remove(i + 1).text;
                } else {
                    i++;
                }
            }
        }

        private String plainText(XmlElement element, int depth) {
            StringBuilder sb = new StringBuilder();
            for (XmlElement run : element.findAll("w:r", maxDepth - depth)) {
                for (XmlElement child : run.elements()) {
                    switch (child.name()) {
                        case "w:t" -> sb.append(textOf(child));
                        case "w:tab" -> sb.append('\t');
                        case "w:br", "w:cr" -> sb.append('\n');
                        default -> {
                            // everything else has no plain text
                        }
                    }
                }
            }
            return sb.toString();
        }

        private static String plainText(List<ExtractedRun> runs) {
            StringBuilder sb = new StringBuilder();
            for (ExtractedRun run : runs) {
                if (run.kind == ExtractedRun.Kind.TEXT || run.kind == ExtractedRun.Kind.CODE) {
                    sb.append(run.text);
                }
            }
            return sb.toString();
        }

        private static boolean isBlank(List<ExtractedRun> runs) {
            for (ExtractedRun run : runs) {
                if (run.kind != ExtractedRun.Kind.TEXT || !run.text.isBlank()) {
                    return false;
                }
            }
            return true;
        }

        private static boolean isOn(XmlElement rPr, String property) {
            Optional<XmlElement> element = rPr.child(property);
            if (element.isEmpty()) {
                return false;
            }
            String value = element.get().attr("w:val");
            return value == null || !OFF_VALUES.contains(value.toLowerCase(Locale.ROOT));
        }

        private static String textOf(XmlElement element) {
            StringBuilder sb = new StringBuilder();
            for (XmlNode node : element.children()) {
                if (node instanceof XmlText text) {
                    sb.append(text.text());
                }
            }
            return sb.toString();
        }

        private static Integer integer(String value) {
            if (value == null) {
                return null;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
