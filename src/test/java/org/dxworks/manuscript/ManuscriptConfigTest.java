package org.dxworks.manuscript;

import org.dxworks.manuscript.model.CitationKeyFormat;
import org.dxworks.manuscript.model.HighlightColor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ManuscriptConfigTest {

    @TempDir
    Path directory;

    @Test
    void missingFileGivesDefaults() {
        ManuscriptConfig config = ManuscriptConfig.load(directory.resolve("absent.yml"));

        assertEquals(CitationKeyFormat.AUTHOR_YEAR_TITLE, config.getCitationKeyFormat());
        assertEquals(HighlightColor.YELLOW, config.getDefaultHighlightColor());
        assertEquals(50, config.getMaxXmlDepth());
        assertEquals("media", config.getMediaDirectory());
    }

    @Test
    void readsAllSettings() throws Exception {
        Path file = directory.resolve("manuscript-config.yml");
        Files.writeString(file, "citationKeyFormat: numeric\ndefaultHighlightColor: green\n"
                + "maxXmlDepth: 20\nmediaDirectory: images\n");

        ManuscriptConfig config = ManuscriptConfig.load(file);

        assertEquals(CitationKeyFormat.NUMERIC, config.getCitationKeyFormat());
        assertEquals(HighlightColor.GREEN, config.getDefaultHighlightColor());
        assertEquals(20, config.getMaxXmlDepth());
        assertEquals("images", config.getMediaDirectory());
    }

    @Test
    void invalidValuesFallBackIndividually() throws Exception {
        Path file = directory.resolve("manuscript-config.yml");
        Files.writeString(file, "citationKeyFormat: bogus\ndefaultHighlightColor: plaid\nmaxXmlDepth: -4\n");

        ManuscriptConfig config = ManuscriptConfig.load(file);

        assertEquals(CitationKeyFormat.AUTHOR_YEAR_TITLE, config.getCitationKeyFormat());
        assertEquals(HighlightColor.YELLOW, config.getDefaultHighlightColor());
        assertEquals(50, config.getMaxXmlDepth());
    }

    @Test
    void unreadableFileGivesDefaults() throws Exception {
        Path file = directory.resolve("manuscript-config.yml");
        Files.writeString(file, "citationKeyFormat: [unclosed\n");

        assertEquals(CitationKeyFormat.AUTHOR_YEAR_TITLE, ManuscriptConfig.load(file).getCitationKeyFormat());
    }

    @Test
    void numericKeysShowUpInExtractedCitations() throws Exception {
        ManuscriptConverter converter = new ManuscriptConverter(
                ManuscriptConfig.with(CitationKeyFormat.NUMERIC, null, 0), TestUtils.FIXED_CLOCK);
        String bibtex = "@book{doe2019, author = {Doe, Jane}, title = {A Book}, year = {2019}}";

        byte[] docx = converter.markdownToDocx("See [@doe2019].", bibtex, null).docx();

        assertEquals("See [@1].\n", converter.docxToMarkdown(docx).markdown());
    }
}
