package org.dxworks.manuscript.citation;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.manuscript.bibtex.Bibliography;
import org.dxworks.manuscript.bibtex.BibtexCodec;
import org.dxworks.manuscript.model.BibtexEntry;
import org.dxworks.manuscript.model.CitationKeyFormat;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CitationReference;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.manuscript.TestUtils.APPROVAL_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CitationFieldTest {

    private static final String LIBRARY = "@article{smith2020,\n"
            + "  author = {Smith, John and Doe, Jane},\n"
            + "  title = {{Deep Learning for \\& with Graphs}},\n"
            + "  journal = {Journal of Things},\n"
            + "  year = {2020},\n"
            + "  doi = {10.1000/x_y},\n"
            + "  zotero-uri = {http://zotero.org/users/1/items/ABCD1234}\n"
            + "}\n"
            + "@book{doe2019,\n"
            + "  author = {Doe, Jane},\n"
            + "  title = {A Book},\n"
            + "  publisher = {Press},\n"
            + "  year = {2019}\n"
            + "}\n";

    private final Bibliography bibliography = BibtexCodec.parse(LIBRARY);

    private static List<CitationReference> references() {
        return List.of(new CitationReference("smith2020", "p. 5"),
                new CitationReference("doe2019", null),
                new CitationReference("missing", null));
    }

    @Test
    void buildsZoteroInstruction() throws Exception {
        List<String> warnings = new ArrayList<>();
        CitationField field = new CitationFieldBuilder(bibliography).build(references(), warnings);

        assertTrue(field.hasField());
        assertEquals("(Smith 2020, p. 5; Doe 2019)", field.displayText());
        assertEquals("(@missing)", field.unresolvedText());
        assertEquals(List.of("Citation key not found: missing"), warnings);
        assertTrue(field.instruction().startsWith(" ADDIN ZOTERO_ITEM CSL_CITATION {"));

        String json = field.instruction().trim().substring(CitationFieldBuilder.CITATION_PREFIX.length()).trim();
        JsonNode payload = APPROVAL_MAPPER.readTree(json);
        assertEquals("00000001", payload.path("citationID").asText());
        JsonNode items = payload.path("citationItems");
        assertEquals(2, items.size());
        assertEquals(1, items.get(0).path("id").asInt());
        assertEquals("5", items.get(0).path("locator").asText());
        assertEquals("page", items.get(0).path("label").asText());
        assertEquals("doe2019", items.get(1).path("id").asText());
        assertEquals(ZoteroUris.embeddedUri("doe2019"), items.get(1).path("uris").get(0).asText());
    }

    @Test
    void onlyUnresolvedKeysGiveNoField() {
        List<String> warnings = new ArrayList<>();
        CitationField field = new CitationFieldBuilder(bibliography)
                .build(List.of(new CitationReference("nobody", null)), warnings);

        assertFalse(field.hasField());
        assertNull(field.instruction());
        assertEquals("(@nobody)", field.unresolvedText());
    }

    @Test
    void parserRecoversWhatTheBuilderWrote() {
        CitationFieldBuilder builder = new CitationFieldBuilder(bibliography);
        String instruction = builder.build(references(), new ArrayList<>()).instruction();

        assertTrue(CitationFieldParser.isCitation(instruction));
        assertFalse(CitationFieldParser.isBibliography(instruction));
        ZoteroCitation citation = CitationFieldParser.parse(instruction).orElseThrow();

        assertEquals("(Smith 2020, p. 5; Doe 2019)", citation.plainCitation());
        CitationMetadata smith = citation.items().get(0);
        assertEquals("Smith", smith.authors.get(0).family());
        assertEquals("John", smith.authors.get(0).given());
        assertEquals("2020", smith.year);
        assertEquals("10.1000/x_y", smith.doi);
        assertEquals("5", smith.locator);
        assertEquals("http://zotero.org/users/1/items/ABCD1234", smith.zoteroUri);

        CitationKeyManager keys = CitationKeyManager.build(List.of(citation.items()), CitationKeyFormat.AUTHOR_YEAR_TITLE);
        assertEquals("smith2020deep, p. 5", keys.citedKey(smith));

        BibtexEntry exported = BibtexExporter.export(keys).get(0);
        assertEquals("article", exported.type);
        assertEquals("Smith, John and Doe, Jane", exported.field("author"));
        assertEquals("ABCD1234", exported.getZoteroKey());
    }

    @Test
    void bibliographyEntriesFollowCitationOrder() {
        CitationFieldBuilder builder = new CitationFieldBuilder(bibliography);
        builder.build(references(), new ArrayList<>());

        assertEquals(List.of("smith2020", "doe2019"), builder.citedKeys());
        assertEquals("Smith, J., & Doe, J. (2020). Deep Learning for & with Graphs. Journal of Things. "
                + "https://doi.org/10.1000/x_y", builder.bibliographyEntries().get(0));
    }

    @Test
    void garbagePayloadIsNotACitation() {
        assertTrue(CitationFieldParser.parse(" ADDIN ZOTERO_ITEM CSL_CITATION {not json} ").isEmpty());
        assertTrue(CitationFieldParser.parse(" ADDIN ZOTERO_ITEM CSL_CITATION ").isEmpty());
    }
}
