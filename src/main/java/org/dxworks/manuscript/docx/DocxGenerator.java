package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.ManuscriptConfig;
import org.dxworks.manuscript.bibtex.Bibliography;
import org.dxworks.manuscript.citation.CitationField;
import org.dxworks.manuscript.citation.CitationFieldBuilder;
import org.dxworks.manuscript.docx.xml.Namespaces;
import org.dxworks.manuscript.docx.xml.Xml;
import org.dxworks.manuscript.markdown.ParsedManuscript;
import org.dxworks.manuscript.math.MathSyntaxException;
import org.dxworks.manuscript.math.MathTranslator;
import org.dxworks.manuscript.model.CommentNode;
import org.dxworks.manuscript.model.DocxConversion;
import org.dxworks.manuscript.model.Frontmatter;
import org.dxworks.manuscript.model.HighlightColor;
import org.dxworks.manuscript.model.NoteType;
import org.dxworks.manuscript.model.Run;
import org.dxworks.manuscript.model.RunFormatting;
import org.dxworks.manuscript.model.RunType;
import org.dxworks.manuscript.model.TableCell;
import org.dxworks.manuscript.model.Token;
import org.dxworks.manuscript.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Writes a tokenized manuscript as a DOCX package. Problems that do not make the document unusable, such as
 * unknown citation keys or unsupported images, are reported as warnings next to the package.
 */
public class DocxGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(DocxGenerator.class);

    public static final String DEFAULT_AUTHOR = "Unknown";
    public static final String SOURCES_HEADING = "Sources";
    public static final String CODE_LANGUAGE_BOOKMARK = "_CodeLang_";
    public static final String UNCHECKED_BOX = "☐";
    public static final String CHECKED_BOX = "☒";

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "gif");
    private static final long EMU_PER_PIXEL = 9525;
    private static final long MAX_IMAGE_WIDTH = 5486400;
    private static final int TABLE_WIDTH = 9360;
    private static final int QUOTE_INDENT = 720;
    private static final int MAX_BOOKMARK_NAME = 40;
    private static final String SECTION = "<w:sectPr><w:pgSz w:w=\"12240\" w:h=\"15840\"/><w:pgMar w:top=\"1440\""
            + " w:right=\"1440\" w:bottom=\"1440\" w:left=\"1440\" w:header=\"720\" w:footer=\"720\" w:gutter=\"0\"/>"
            + "</w:sectPr>";

    private final ManuscriptConfig config;
    private final Clock clock;

    public DocxGenerator(ManuscriptConfig config) {
        this(config, Clock.systemUTC());
    }

    public DocxGenerator(ManuscriptConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param bibliography   entries citations are resolved against, may be null
     * @param imageDirectory directory relative image paths are resolved against, may be null
     */
    public DocxConversion generate(ParsedManuscript manuscript, Bibliography bibliography, Path imageDirectory) {
        Generation generation = new Generation(manuscript, bibliography == null ? new Bibliography() : bibliography,
                imageDirectory);
        return generation.run();
    }

    private class Generation {
        private final ParsedManuscript manuscript;
        private final Frontmatter frontmatter;
        private final Path imageDirectory;
        private final List<String> warnings = new ArrayList<>();

        private final DocxPackage docx = new DocxPackage();
        private final Relationships relationships = new Relationships();
        private final CommentsWriter comments = new CommentsWriter();
        private final NotesWriter notes;
        private final NumberingWriter numbering = new NumberingWriter();
        private final CitationFieldBuilder citations;
        private final MathTranslator math;

        private final Map<String, CommentNode> idComments = new HashMap<>();
        private final Set<String> anchoredIds = new HashSet<>();
        private final Map<String, List<Integer>> idThreads = new HashMap<>();
        private final Set<String> notesInProgress = new HashSet<>();
        private final Set<String> imageExtensions = new TreeSet<>();

        private final String author;
        private final Instant now;
        private final ZoneOffset zone;
        private boolean numberingUsed;
        private final Integer[] orderedNumIds = new Integer[2];
        private int annotationIds;
        private int images;

        Generation(ParsedManuscript manuscript, Bibliography bibliography, Path imageDirectory) {
            this.manuscript = manuscript;
            this.frontmatter = manuscript.frontmatter();
            this.imageDirectory = imageDirectory;
            this.notes = new NotesWriter(frontmatter.noteType == NoteType.ENDNOTES);
            this.citations = new CitationFieldBuilder(bibliography);
            this.math = new MathTranslator(config.getMaxXmlDepth());
            this.author = frontmatter.author == null ? DEFAULT_AUTHOR : frontmatter.author;
            this.now = clock.instant();
            this.zone = CommentDates.zone(frontmatter.timezone);
        }

        DocxConversion run() {
            collectIdComments();
            relationships.add(Relationships.STYLES, "styles.xml");
            relationships.add(Relationships.SETTINGS, "settings.xml");

            StringBuilder body = new StringBuilder();
            for (String title : frontmatter.titles) {
                paragraph(body, style(StylesWriter.TITLE), List.of(Run.text(title)));
            }
            for (Token token : manuscript.tokens()) {
                writeToken(token, body);
            }
            if (!citations.citedKeys().isEmpty()) {
                writeBibliography(body);
            }
            body.append(SECTION);

            docx.put(DocxPackage.DOCUMENT, Xml.DECLARATION + "<w:document" + Namespaces.DOCUMENT_DECLARATIONS
                    + "><w:body>" + body + "</w:body></w:document>");
            docx.put(DocxPackage.STYLES, StylesWriter.write(StyleSettings.from(frontmatter)));
            docx.put(DocxPackage.SETTINGS, PackageParts.settings(!notes.isEmpty() && !notes.isEndnotes(),
                    !notes.isEmpty() && notes.isEndnotes()));
            if (numberingUsed) {
                relationships.add(Relationships.NUMBERING, "numbering.xml");
                docx.put(DocxPackage.NUMBERING, numbering.write());
            }
            if (!comments.isEmpty()) {
                relationships.add(Relationships.COMMENTS, "comments.xml");
                docx.put(DocxPackage.COMMENTS, comments.writeComments());
                if (comments.hasReplies()) {
                    relationships.add(Relationships.COMMENTS_EXTENDED, "commentsExtended.xml");
                    docx.put(DocxPackage.COMMENTS_EXTENDED, comments.writeCommentsExtended());
                }
            }
            if (!notes.isEmpty()) {
                relationships.add(notes.relationshipType(), notes.partName().substring("word/".length()));
                docx.put(notes.partName(), notes.write());
            }
            docx.put(DocxPackage.DOCUMENT_RELS, relationships.toXml());
            docx.put(DocxPackage.CORE_PROPERTIES, PackageParts.coreProperties(frontmatter, now));
            String custom = PackageParts.customProperties(frontmatter);
            if (custom != null) {
                docx.put(DocxPackage.CUSTOM_PROPERTIES, custom);
            }
            docx.put(DocxPackage.PACKAGE_RELS, PackageParts.packageRelationships(custom != null));
            docx.put(DocxPackage.CONTENT_TYPES, PackageParts.contentTypes(docx.parts().keySet(), imageExtensions));

            LOG.debug("Generated {} comments and {} images with {} warnings", comments.size(), images,
                    warnings.size());
            return new DocxConversion(docx.toBytes(), warnings);
        }

        private void writeToken(Token token, StringBuilder body) {
            if (token.type() != TokenType.LIST_ITEM) {
                orderedNumIds[0] = null;
                orderedNumIds[1] = null;
            }
            switch (token.type()) {
                case TITLE -> paragraph(body, style(StylesWriter.TITLE), token.runs());
                case PARAGRAPH -> {
                    if (!holdsOnlyAnchoredBodies(token.runs())) {
                        paragraph(body, "", token.runs());
                    }
                }
                case HEADING -> paragraph(body, style(StylesWriter.HEADING + Math.min(Math.max(token.level(), 1), 6)),
                        token.runs());
                case LIST_ITEM -> listItem(token, body);
                case CODE_BLOCK -> codeBlock(token, body);
                case BLOCKQUOTE -> paragraph(body, style(StylesWriter.QUOTE) + "<w:ind w:left=\""
                        + QUOTE_INDENT * Math.max(token.level(), 1) + "\"/>", token.runs());
                case ALERT_BOX -> paragraph(body, style(StylesWriter.alertStyle(token.alertType())), token.runs());
                case TABLE -> table(token.rows(), body);
                case THEMATIC_BREAK -> body.append("<w:p><w:pPr><w:pBdr><w:bottom w:val=\"single\" w:sz=\"6\"")
                        .append(" w:space=\"1\" w:color=\"auto\"/></w:pBdr></w:pPr></w:p>");
            }
        }

        private void listItem(Token token, StringBuilder body) {
            numberingUsed = true;
            int level = Math.min(Math.max(token.level(), 1), 2) - 1;
            if (level == 0) {
                orderedNumIds[1] = null;
            }
            int numId;
            if (token.ordered()) {
                if (orderedNumIds[level] == null) {
                    orderedNumIds[level] = numbering.nextOrderedList();
                }
                numId = orderedNumIds[level];
            } else {
                orderedNumIds[level] = null;
                numId = NumberingWriter.BULLET_NUM_ID;
            }
            List<Run> runs = token.runs();
            if (token.checked() != null) {
                runs = new ArrayList<>(runs);
                runs.add(0, Run.text((token.checked() ? CHECKED_BOX : UNCHECKED_BOX) + " "));
            }
            paragraph(body, style(StylesWriter.LIST_PARAGRAPH) + "<w:numPr><w:ilvl w:val=\"" + level
                    + "\"/><w:numId w:val=\"" + numId + "\"/></w:numPr>", runs);
        }

        private void codeBlock(Token token, StringBuilder body) {
            body.append("<w:p><w:pPr>").append(style(StylesWriter.CODE_BLOCK)).append("</w:pPr>");
            if (token.language() != null && !token.language().isBlank()) {
                int id = ++annotationIds;
                String name = CODE_LANGUAGE_BOOKMARK + token.language().trim().replaceAll("[^A-Za-z0-9_]", "_");
                if (name.length() > MAX_BOOKMARK_NAME) {
                    name = name.substring(0, MAX_BOOKMARK_NAME);
                }
                body.append("<w:bookmarkStart w:id=\"").append(id).append("\" w:name=\"").append(name)
                        .append("\"/><w:bookmarkEnd w:id=\"").append(id).append("\"/>");
            }
            String code = token.code() == null ? "" : token.code();
            body.append("<w:r>").append(runContent(code, "w:t")).append("</w:r></w:p>");
        }

        private void table(List<List<TableCell>> rows, StringBuilder body) {
            int columns = 1;
            for (List<TableCell> row : rows) {
                columns = Math.max(columns, row.size());
            }
            int width = TABLE_WIDTH / columns;
            body.append("<w:tbl><w:tblPr><w:tblStyle w:val=\"").append(StylesWriter.TABLE_GRID)
                    .append("\"/><w:tblW w:w=\"0\" w:type=\"auto\"/><w:tblLook w:val=\"04A0\" w:firstRow=\"1\"")
                    .append(" w:lastRow=\"0\" w:firstColumn=\"1\" w:lastColumn=\"0\" w:noHBand=\"0\" w:noVBand=\"1\"/>")
                    .append("</w:tblPr><w:tblGrid>");
            for (int c = 0; c < columns; c++) {
                body.append("<w:gridCol w:w=\"").append(width).append("\"/>");
            }
            body.append("</w:tblGrid>");
            for (int r = 0; r < rows.size(); r++) {
                body.append("<w:tr>");
                if (r == 0) {
                    body.append("<w:trPr><w:tblHeader/></w:trPr>");
                }
                List<TableCell> row = rows.get(r);
                for (int c = 0; c < columns; c++) {
                    body.append("<w:tc><w:tcPr><w:tcW w:w=\"").append(width).append("\" w:type=\"dxa\"/></w:tcPr>");
                    paragraph(body, "", c < row.size() ? row.get(c).runs() : List.of());
                    body.append("</w:tc>");
                }
                body.append("</w:tr>");
            }
            body.append("</w:tbl>");
        }

        private void writeBibliography(StringBuilder body) {
            paragraph(body, style(StylesWriter.HEADING + 1), List.of(Run.text(SOURCES_HEADING)));
            List<String> entries = citations.bibliographyEntries();
            for (int i = 0; i < entries.size(); i++) {
                body.append("<w:p><w:pPr>").append(style(StylesWriter.BIBLIOGRAPHY)).append("</w:pPr>");
                if (i == 0) {
                    fieldStart(CitationFieldBuilder.BIBLIOGRAPHY_INSTRUCTION, body);
                }
                textRun(entries.get(i), RunFormatting.NONE, null, false, body);
                if (i == entries.size() - 1) {
                    body.append("<w:r><w:fldChar w:fldCharType=\"end\"/></w:r>");
                }
                body.append("</w:p>");
            }
        }

        private void paragraph(StringBuilder out, String properties, List<Run> runs) {
            out.append("<w:p>");
            if (!properties.isEmpty()) {
                out.append("<w:pPr>").append(properties).append("</w:pPr>");
            }
            writeRuns(runs, out);
            out.append("</w:p>");
        }

        private void writeRuns(List<Run> runs, StringBuilder out) {
            String openHref = null;
            for (int i = 0; i < runs.size(); i++) {
                Run run = runs.get(i);
                String href = isLinkable(run) ? run.href() : null;
                if (!Objects.equals(href, openHref)) {
                    if (openHref != null) {
                        out.append("</w:hyperlink>");
                    }
                    if (href != null) {
                        out.append("<w:hyperlink r:id=\"").append(relationships.hyperlink(href))
                                .append("\" w:history=\"1\">");
                    }
                    openHref = href;
                }
                if (run.type() == RunType.CRITIC_HIGHLIGHT && i + 1 < runs.size()
                        && runs.get(i + 1).type() == RunType.CRITIC_COMMENT && runs.get(i + 1).commentId() == null) {
                    annotatedComment(run.text(), runs.get(i + 1).comment(), out);
                    i++;
                    continue;
                }
                writeRun(run, out);
            }
            if (openHref != null) {
                out.append("</w:hyperlink>");
            }
        }

        private void writeRun(Run run, StringBuilder out) {
            switch (run.type()) {
                case TEXT -> textRun(run.text(), run.formatting(), null, run.href() != null, out);
                case CODE -> out.append("<w:r><w:rPr><w:rStyle w:val=\"").append(StylesWriter.CODE_CHAR)
                        .append("\"/></w:rPr>").append(runContent(run.text(), "w:t")).append("</w:r>");
                case HIGHLIGHT -> {
                    HighlightColor color = run.highlightColor() == null
                            ? config.getDefaultHighlightColor() : run.highlightColor();
                    textRun(run.text(), run.formatting(), color.getWordName(), run.href() != null, out);
                }
                case MATH -> math(run, out);
                case CITATION -> citation(run, out);
                case CRITIC_ADDITION -> revision("w:ins", run.text(), out);
                case CRITIC_DELETION -> revision("w:del", run.text(), out);
                case CRITIC_SUBSTITUTION -> {
                    revision("w:del", run.text(), out);
                    revision("w:ins", run.newText(), out);
                }
                case CRITIC_HIGHLIGHT -> criticHighlight(run.text(), out);
                case CRITIC_COMMENT -> {
                    if (run.commentId() == null || !anchoredIds.contains(run.commentId())) {
                        annotatedComment("", run.comment(), out);
                    }
                }
                case COMMENT_RANGE_START -> rangeStart(run.commentId(), out);
                case COMMENT_RANGE_END -> rangeEnd(run.commentId(), out);
                case FOOTNOTE_REFERENCE -> footnote(run, out);
                case IMAGE -> image(run, out);
                case SOFT_BREAK -> textRun(" ", RunFormatting.NONE, null, false, out);
                case HTML_COMMENT -> out.append("<w:r><w:rPr><w:rStyle w:val=\"").append(StylesWriter.HTML_COMMENT)
                        .append("\"/><w:vanish/></w:rPr>").append(Xml.textElement("w:t", run.text())).append("</w:r>");
            }
        }

        /** An empty highlight keeps an empty text element so that it survives extraction. */
        private void criticHighlight(String text, StringBuilder out) {
            String highlight = config.getDefaultHighlightColor().getWordName();
            if (text.isEmpty()) {
                out.append("<w:r>").append(runProperties(RunFormatting.NONE, highlight, false))
                        .append(Xml.textElement("w:t", "")).append("</w:r>");
                return;
            }
            textRun(text, RunFormatting.NONE, highlight, false, out);
        }

        private void textRun(String text, RunFormatting formatting, String highlight, boolean hyperlink,
                             StringBuilder out) {
            if (text == null || text.isEmpty()) {
                return;
            }
            out.append("<w:r>").append(runProperties(formatting, highlight, hyperlink))
                    .append(runContent(text, "w:t")).append("</w:r>");
        }

        private void revision(String element, String text, StringBuilder out) {
            String textElement = element.equals("w:del") ? "w:delText" : "w:t";
            out.append('<').append(element).append(" w:id=\"").append(++annotationIds).append("\" w:author=\"")
                    .append(Xml.escape(author)).append("\" w:date=\"").append(CommentDates.toDocx(now)).append("\">")
                    .append("<w:r>")
                    .append(text.isEmpty() ? Xml.textElement(textElement, "") : runContent(text, textElement))
                    .append("</w:r></").append(element).append('>');
        }

        private void annotatedComment(String text, CommentNode comment, StringBuilder out) {
            List<Integer> ids = registerThread(comment);
            for (int id : ids) {
                out.append("<w:commentRangeStart w:id=\"").append(id).append("\"/>");
            }
            textRun(text, RunFormatting.NONE, null, false, out);
            closeThread(ids, out);
        }

        private void rangeStart(String commentId, StringBuilder out) {
            CommentNode comment = idComments.get(commentId);
            if (comment == null) {
                warnings.add("Comment body not found: " + commentId);
                LOG.warn("Comment body not found: {}", commentId);
                return;
            }
            List<Integer> ids = idThreads.computeIfAbsent(commentId, key -> registerThread(comment));
            for (int id : ids) {
                out.append("<w:commentRangeStart w:id=\"").append(id).append("\"/>");
            }
        }

        private void rangeEnd(String commentId, StringBuilder out) {
            List<Integer> ids = idThreads.get(commentId);
            if (ids != null) {
                closeThread(ids, out);
            }
        }

        /** Every member of a thread shares the root's range and gets its own reference. */
        private void closeThread(List<Integer> ids, StringBuilder out) {
            for (int id : ids) {
                out.append("<w:commentRangeEnd w:id=\"").append(id).append("\"/>");
            }
            for (int id : ids) {
                out.append("<w:r><w:commentReference w:id=\"").append(id).append("\"/></w:r>");
            }
        }

        private List<Integer> registerThread(CommentNode root) {
            List<Integer> ids = new ArrayList<>();
            int rootId = comments.add(commentAuthor(root), commentDate(root), root.text, null);
            ids.add(rootId);
            for (CommentNode reply : root.replies) {
                ids.add(comments.add(commentAuthor(reply), commentDate(reply), reply.text, rootId));
            }
            return ids;
        }

        private String commentAuthor(CommentNode comment) {
            return comment.author == null || comment.author.isBlank() ? author : comment.author;
        }

        private String commentDate(CommentNode comment) {
            return CommentDates.toDocx(comment.date, zone, now);
        }

        private void math(Run run, StringBuilder out) {
            try {
                out.append(math.latexToOmml(run.text(), run.display()));
            } catch (MathSyntaxException e) {
                warnings.add("Math could not be converted: " + run.text());
                LOG.warn("Math could not be converted ({}): {}", e.getMessage(), run.text());
                textRun(run.text(), RunFormatting.NONE, null, false, out);
            }
        }

        private void citation(Run run, StringBuilder out) {
            CitationField field = citations.build(run.citations(), warnings);
            if (field.hasField()) {
                fieldStart(field.instruction(), out);
                out.append("<w:r><w:rPr><w:noProof/></w:rPr>").append(runContent(field.displayText(), "w:t"))
                        .append("</w:r><w:r><w:fldChar w:fldCharType=\"end\"/></w:r>");
            }
            if (field.unresolvedText() != null) {
                textRun((field.hasField() ? " " : "") + field.unresolvedText(), RunFormatting.NONE, null, false, out);
            }
        }

        private void fieldStart(String instruction, StringBuilder out) {
            out.append("<w:r><w:fldChar w:fldCharType=\"begin\"/></w:r><w:r>")
                    .append(Xml.textElement("w:instrText", instruction))
                    .append("</w:r><w:r><w:fldChar w:fldCharType=\"separate\"/></w:r>");
        }

        private void footnote(Run run, StringBuilder out) {
            String id = run.footnoteId();
            List<Run> definition = manuscript.footnotes().get(id);
            if (definition == null || notesInProgress.contains(id)) {
                warnings.add("Footnote definition not found: " + id);
                LOG.warn("Footnote definition not found: {}", id);
                textRun(run.text(), RunFormatting.NONE, null, false, out);
                return;
            }
            notesInProgress.add(id);
            StringBuilder content = new StringBuilder();
            writeRuns(definition, content);
            notesInProgress.remove(id);
            out.append(notes.referenceElement(notes.add(content.toString())));
        }

        private void image(Run run, StringBuilder out) {
            String source = run.imageSource();
            String extension = extension(source);
            if (!IMAGE_EXTENSIONS.contains(extension) || source.contains("://")) {
                unsupportedImage(run, out);
                return;
            }
            Path path = imageDirectory == null ? Paths.get(source) : imageDirectory.resolve(source);
            byte[] bytes;
            BufferedImage image;
            try {
                bytes = Files.readAllBytes(path);
                image = ImageIO.read(new ByteArrayInputStream(bytes));
            } catch (IOException e) {
                LOG.debug("Could not read image {}: {}", path, e.getMessage());
                unsupportedImage(run, out);
                return;
            }
            if (image == null) {
                unsupportedImage(run, out);
                return;
            }

            int number = ++images;
            String name = "image" + number + "." + extension;
            docx.put("word/media/" + name, bytes);
            imageExtensions.add(extension);
            String relationshipId = relationships.add(Relationships.IMAGE, "media/" + name);
            long width = image.getWidth() * EMU_PER_PIXEL;
            long height = image.getHeight() * EMU_PER_PIXEL;
            if (width > MAX_IMAGE_WIDTH) {
                height = height * MAX_IMAGE_WIDTH / width;
                width = MAX_IMAGE_WIDTH;
            }
            String alt = Xml.escape(run.text());
            out.append("<w:r><w:drawing><wp:inline distT=\"0\" distB=\"0\" distL=\"0\" distR=\"0\">")
                    .append("<wp:extent cx=\"").append(width).append("\" cy=\"").append(height).append("\"/>")
                    .append("<wp:docPr id=\"").append(number).append("\" name=\"Picture ").append(number)
                    .append("\" descr=\"").append(alt).append("\"/>")
                    .append("<wp:cNvGraphicFramePr><a:graphicFrameLocks noChangeAspect=\"1\"/></wp:cNvGraphicFramePr>")
                    .append("<a:graphic><a:graphicData uri=\"").append(Namespaces.PIC).append("\"><pic:pic>")
                    .append("<pic:nvPicPr><pic:cNvPr id=\"").append(number).append("\" name=\"").append(name)
                    .append("\"/><pic:cNvPicPr/></pic:nvPicPr><pic:blipFill><a:blip r:embed=\"").append(relationshipId)
                    .append("\"/><a:stretch><a:fillRect/></a:stretch></pic:blipFill><pic:spPr><a:xfrm>")
                    .append("<a:off x=\"0\" y=\"0\"/><a:ext cx=\"").append(width).append("\" cy=\"").append(height)
                    .append("\"/></a:xfrm><a:prstGeom prst=\"rect\"><a:avLst/></a:prstGeom></pic:spPr></pic:pic>")
                    .append("</a:graphicData></a:graphic></wp:inline></w:drawing></w:r>");
        }

        private void unsupportedImage(Run run, StringBuilder out) {
            warnings.add("Unsupported image: " + run.imageSource());
            LOG.warn("Unsupported image: {}", run.imageSource());
            textRun(run.text(), RunFormatting.NONE, null, false, out);
        }

        private void collectIdComments() {
            List<List<Run>> runLists = new ArrayList<>();
            for (Token token : manuscript.tokens()) {
                runLists.add(token.runs());
                for (List<TableCell> row : token.rows()) {
                    for (TableCell cell : row) {
                        runLists.add(cell.runs());
                    }
                }
            }
            runLists.addAll(manuscript.footnotes().values());
            Set<String> rangeIds = new HashSet<>();
            for (List<Run> runs : runLists) {
                for (Run run : runs) {
                    if (run.type() == RunType.CRITIC_COMMENT && run.commentId() != null) {
                        idComments.putIfAbsent(run.commentId(), run.comment());
                    } else if (run.type() == RunType.COMMENT_RANGE_START) {
                        rangeIds.add(run.commentId());
                    }
                }
            }
            for (String id : rangeIds) {
                if (idComments.containsKey(id)) {
                    anchoredIds.add(id);
                }
            }
        }

        /** A paragraph made of nothing but bodies of ID comments whose ranges live elsewhere. */
        private boolean holdsOnlyAnchoredBodies(List<Run> runs) {
            boolean anyBody = false;
            for (Run run : runs) {
                if (run.type() == RunType.CRITIC_COMMENT && run.commentId() != null
                        && anchoredIds.contains(run.commentId())) {
                    anyBody = true;
                } else if (!(run.type() == RunType.SOFT_BREAK
                        || (run.type() == RunType.TEXT && run.text().isBlank()))) {
                    return false;
                }
            }
            return anyBody;
        }
    }

    private static boolean isLinkable(Run run) {
        return run.type() == RunType.TEXT || run.type() == RunType.CODE || run.type() == RunType.HIGHLIGHT;
    }

    private static String style(String styleId) {
        return "<w:pStyle w:val=\"" + styleId + "\"/>";
    }

    static String runProperties(RunFormatting formatting, String highlight, boolean hyperlink) {
        StringBuilder sb = new StringBuilder();
        if (hyperlink) {
            sb.append("<w:rStyle w:val=\"").append(StylesWriter.HYPERLINK).append("\"/>");
        }
        if (formatting.bold()) {
            sb.append("<w:b/><w:bCs/>");
        }
        if (formatting.italic()) {
            sb.append("<w:i/><w:iCs/>");
        }
        if (formatting.strikethrough()) {
            sb.append("<w:strike/>");
        }
        if (highlight != null) {
            sb.append("<w:highlight w:val=\"").append(highlight).append("\"/>");
        }
        if (formatting.underline()) {
            sb.append("<w:u w:val=\"single\"/>");
        }
        if (formatting.superscript()) {
            sb.append("<w:vertAlign w:val=\"superscript\"/>");
        } else if (formatting.subscript()) {
            sb.append("<w:vertAlign w:val=\"subscript\"/>");
        }
        return sb.length() == 0 ? "" : "<w:rPr>" + sb + "</w:rPr>";
    }

    /** Text of one run: line breaks become {@code w:br}, tabs {@code w:tab}. */
    static String runContent(String text, String textElement) {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\n", -1);
        for (int l = 0; l < lines.length; l++) {
            if (l > 0) {
                sb.append("<w:br/>");
            }
            String[] pieces = lines[l].split("\t", -1);
            for (int p = 0; p < pieces.length; p++) {
                if (p > 0) {
                    sb.append("<w:tab/>");
                }
                if (!pieces[p].isEmpty()) {
                    sb.append(Xml.textElement(textElement, pieces[p]));
                }
            }
        }
        return sb.toString();
    }

    private static String extension(String source) {
        int dot = source.lastIndexOf('.');
        return dot < 0 ? "" : source.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
