package org.dxworks.manuscript;

import org.dxworks.manuscript.docx.DocxFormatException;
import org.dxworks.manuscript.markdown.FrontmatterCodec;
import org.dxworks.manuscript.model.DocxConversion;
import org.dxworks.manuscript.model.MarkdownConversion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar manuscript-converter.jar <input.md|input.docx> <output>");
            System.err.println("  <input>:  Markdown manuscript or Word document");
            System.err.println("  <output>: Path of the converted document");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[1]);
        if (output.toAbsolutePath().getParent() != null) {
            Files.createDirectories(output.toAbsolutePath().getParent());
        }

        ManuscriptConverter converter = new ManuscriptConverter(ManuscriptConfig.load());
        String name = input.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            List<String> warnings = name.endsWith(".docx")
                    ? toMarkdown(converter, input, output)
                    : toDocx(converter, input, output);
            for (String warning : warnings) {
                LOG.warn(warning);
            }
            LOG.info("Converted {} to {} with {} warnings", input, output.toAbsolutePath(), warnings.size());
        } catch (DocxFormatException e) {
            System.err.println("Error: " + input + " is not a readable Word document: " + e.getMessage());
            System.exit(1);
        }
    }

    static List<String> toDocx(ManuscriptConverter converter, Path input, Path output) throws IOException {
        String markdown = Files.readString(input, StandardCharsets.UTF_8);
        Path baseDirectory = input.toAbsolutePath().getParent();
        String bibtex = readBibliography(markdown, input, baseDirectory);

        DocxConversion conversion = converter.markdownToDocx(markdown, bibtex, baseDirectory);
        Files.write(output, conversion.docx());
        return conversion.warnings();
    }

    static List<String> toMarkdown(ManuscriptConverter converter, Path input, Path output) throws IOException {
        MarkdownConversion conversion = converter.docxToMarkdown(Files.readAllBytes(input));
        Files.writeString(output, conversion.markdown(), StandardCharsets.UTF_8);

        Path directory = output.toAbsolutePath().getParent();
        if (!conversion.bibtex().isEmpty()) {
            Path bibFile = directory.resolve(stem(output) + ".bib");
            Files.writeString(bibFile, conversion.bibtex(), StandardCharsets.UTF_8);
            LOG.info("Bibliography written to {}", bibFile);
        }
        for (Map.Entry<String, byte[]> media : conversion.media().entrySet()) {
            Path target = directory.resolve(media.getKey());
            Files.createDirectories(target.getParent());
            Files.write(target, media.getValue());
        }
        return conversion.warnings();
    }

    /** The frontmatter {@code bibliography} file, or a {@code .bib} file named like the manuscript. */
    private static String readBibliography(String markdown, Path input, Path baseDirectory) throws IOException {
        String declared = FrontmatterCodec.split(markdown).frontmatter().bibliography;
        Path bibFile = declared != null
                ? baseDirectory.resolve(declared)
                : baseDirectory.resolve(stem(input) + ".bib");
        if (!Files.isRegularFile(bibFile)) {
            if (declared != null) {
                LOG.warn("Bibliography file not found: {}", bibFile);
            }
            return null;
        }
        LOG.info("Using bibliography {}", bibFile);
        return Files.readString(bibFile, StandardCharsets.UTF_8);
    }

    private static String stem(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
