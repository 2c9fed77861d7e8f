package org.dxworks.manuscript.bibtex;

import org.approvaltests.Approvals;
import org.dxworks.manuscript.model.BibtexEntry;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BibtexCodecTest {

    private static String fixture() throws Exception {
        return Files.readString(Paths.get("src/test/resources/fixtures/references.bib"), StandardCharsets.UTF_8);
    }

    @Test
    void serialize_ParsedFixture() throws Exception {
        Approvals.verify(BibtexCodec.serialize(BibtexCodec.parse(fixture()).entries()));
    }

    @Test
    void parseNormalizesFieldsAndKeepsFirstDuplicate() throws Exception {
        Bibliography bibliography = BibtexCodec.parse(fixture());

        assertEquals(2, bibliography.size());
        BibtexEntry smith = bibliography.get("smith2020").orElseThrow();
        assertEquals("article", smith.type);
        assertEquals("Deep Learning for & with Graphs", smith.field("title"));
        assertEquals("Journal of Things", smith.field("journal"));
        assertEquals("2020", smith.field("year"));
        assertEquals("10.1000/x_y", smith.field("doi"));
        assertTrue(smith.isLinkedToZotero());
        assertFalse(bibliography.contains("ignored"));
    }

    @Test
    void titleIsDoubleBracedAndSpecialCharactersEscaped() {
        BibtexEntry entry = new BibtexEntry("article", "k");
        entry.fields.put("title", "Hello");
        entry.fields.put("note", "50% of R&D");
        entry.fields.put("url", "https://example.org/a_b#c");

        assertEquals("@article{k,\n"
                + "  title = {{Hello}},\n"
                + "  note = {50\\% of R\\&D},\n"
                + "  url = {https://example.org/a_b#c},\n"
                + "}", BibtexCodec.serializeEntry(entry));
    }

    @Test
    void escapeDoesNotDoubleEscape() {
        assertEquals("a\\_b \\$5", BibtexCodec.escape("a\\_b $5"));
        assertEquals("a_b $5", BibtexCodec.unescape("a\\_b \\$5"));
    }

    @Test
    void doubleBracedTitleParsesToPlainText() {
        Bibliography bibliography = BibtexCodec.parse("@article{k, title = {{Hello}}}");

        assertEquals("Hello", bibliography.get("k").orElseThrow().field("title"));
    }

    @Test
    void unterminatedEntryIsIgnored() {
        Bibliography bibliography = BibtexCodec.parse("@book{ok, title={Fine}}\n@book{broken, title={Never closed}");

        assertEquals(List.of("ok"), bibliography.keysStartingWith(""));
    }

    @Test
    void emptyInputSerializesToEmptyText() {
        assertEquals("", BibtexCodec.serialize(List.of()));
    }
}
