package org.dxworks.manuscript.citation;

import org.dxworks.manuscript.model.CitationKeyFormat;
import org.dxworks.manuscript.model.CitationMetadata;
import org.dxworks.manuscript.model.CslName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CitationKeyManagerTest {

    private static CitationMetadata item(String family, String year, String title) {
        CitationMetadata item = new CitationMetadata();
        if (family != null) {
            item.authors.add(new CslName(family, "A.", null));
        }
        item.year = year;
        item.title = title;
        return item;
    }

    @Test
    void authorYearTitleSkipsArticles() {
        CitationMetadata item = item("Smith", "2020", "The Deep Learning Book");

        CitationKeyManager keys = CitationKeyManager.build(List.of(List.of(item)), CitationKeyFormat.AUTHOR_YEAR_TITLE);

        assertEquals("smith2020deep", keys.keyFor(item));
    }

    @Test
    void collidingKeysGetNumericSuffixes() {
        CitationMetadata first = item("Smith", "2020", "Deep nets");
        CitationMetadata second = item("Smith", "2020", "Deep trees");
        CitationMetadata third = item("Smith", "2020", "Deep forests");

        CitationKeyManager keys = CitationKeyManager.build(List.of(List.of(first, second), List.of(third)),
                CitationKeyFormat.AUTHOR_YEAR_TITLE);

        assertEquals("smith2020deep", keys.keyFor(first));
        assertEquals("smith2020deep2", keys.keyFor(second));
        assertEquals("smith2020deep3", keys.keyFor(third));
    }

    @Test
    void sameDoiMeansSameKey() {
        CitationMetadata first = item("Smith", "2020", "Deep nets");
        first.doi = "10.1/ABC";
        CitationMetadata again = item("Smith", "2020", "Deep nets, revised title");
        again.doi = "10.1/abc";

        CitationKeyManager keys = CitationKeyManager.build(List.of(List.of(first), List.of(again)),
                CitationKeyFormat.AUTHOR_YEAR_TITLE);

        assertEquals(1, keys.size());
        assertEquals(keys.keyFor(first), keys.keyFor(again));
    }

    @Test
    void numericAndAuthorYearFormats() {
        CitationMetadata first = item("O'Brien", "c. 2019", "Alpha");
        CitationMetadata second = item("Doe", "2021", "Beta");
        List<List<CitationMetadata>> groups = List.of(List.of(first, second));

        CitationKeyManager numeric = CitationKeyManager.build(groups, CitationKeyFormat.NUMERIC);
        CitationKeyManager authorYear = CitationKeyManager.build(groups, CitationKeyFormat.AUTHOR_YEAR);

        assertEquals("1", numeric.keyFor(first));
        assertEquals("2", numeric.keyFor(second));
        assertEquals("obrien2019", authorYear.keyFor(first));
        assertEquals("doe2021", authorYear.keyFor(second));
    }

    @Test
    void missingAuthorFallsBackToPublisherThenUnknown() {
        CitationMetadata report = item(null, "2018", "Annual report");
        report.publisher = "World Bank";
        CitationMetadata anonymous = item(null, null, null);

        CitationKeyManager keys = CitationKeyManager.build(List.of(List.of(report, anonymous)),
                CitationKeyFormat.AUTHOR_YEAR_TITLE);

        assertEquals("worldbank2018annual", keys.keyFor(report));
        assertEquals("unknownunknown", keys.keyFor(anonymous));
    }

    @Test
    void citedKeyCarriesSanitizedLocator() {
        CitationMetadata item = item("Smith", "2020", "Deep nets");
        item.locator = "[12]; @14";
        CitationKeyManager keys = CitationKeyManager.build(List.of(List.of(item)), CitationKeyFormat.AUTHOR_YEAR);

        assertEquals("smith2020, p. 12 14", keys.citedKey(item));
        assertEquals("", CitationKeyManager.sanitizeLocator(null));
    }
}
