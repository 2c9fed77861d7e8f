package org.dxworks.manuscript;

import org.dxworks.manuscript.bibtex.Bibliography;
import org.dxworks.manuscript.bibtex.BibtexCodec;
import org.dxworks.manuscript.docx.DocxExtractor;
import org.dxworks.manuscript.docx.DocxFormatException;
import org.dxworks.manuscript.docx.DocxGenerator;
import org.dxworks.manuscript.markdown.MarkdownTokenizer;
import org.dxworks.manuscript.markdown.ParsedManuscript;
import org.dxworks.manuscript.model.DocxConversion;
import org.dxworks.manuscript.model.MarkdownConversion;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Entry point for both conversion directions. Instances hold no per-document state and can be reused.
 */
public class ManuscriptConverter {

    private final ManuscriptConfig config;
    private final Clock clock;
    private final MarkdownTokenizer tokenizer = new MarkdownTokenizer();

    public ManuscriptConverter(ManuscriptConfig config) {
        this(config, Clock.systemUTC());
    }

    public ManuscriptConverter(ManuscriptConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param bibtex         contents of the bibliography file, may be null or empty
     * @param imageDirectory directory relative image paths are resolved against, may be null
     */
    public DocxConversion markdownToDocx(String markdown, String bibtex, Path imageDirectory) {
        ParsedManuscript manuscript = tokenizer.tokenize(markdown == null ? "" : markdown);
        Bibliography bibliography = bibtex == null || bibtex.isBlank() ? new Bibliography() : BibtexCodec.parse(bibtex);
        return new DocxGenerator(config, clock).generate(manuscript, bibliography, imageDirectory);
    }

    public MarkdownConversion docxToMarkdown(byte[] docx) throws DocxFormatException {
        return new DocxExtractor(config).extract(docx);
    }

    public ManuscriptConfig getConfig() {
        return config;
    }
}
