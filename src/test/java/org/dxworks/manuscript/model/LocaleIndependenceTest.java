package org.dxworks.manuscript.model;

import org.dxworks.manuscript.bibtex.Bibliography;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

/** Identifiers are case folded the same way whatever the JVM default locale is. */
public class LocaleIndependenceTest {

    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void highlightColorIdsWithCapitalI() {
        assertEquals(Optional.of(HighlightColor.PINK), HighlightColor.fromId("PINK"));
        assertEquals(Optional.of(HighlightColor.VIOLET), HighlightColor.fromId("Violet"));
    }

    @Test
    void noteTypeIdsWithCapitalI() {
        assertEquals(Optional.of(NoteType.IN_TEXT), NoteType.parse("IN-TEXT"));
    }

    @Test
    void identityFoldsCapitalI() {
        CitationMetadata upper = new CitationMetadata();
        upper.title = "IMAGING IN MEDICINE";
        upper.year = "2020";
        CitationMetadata lower = new CitationMetadata();
        lower.title = "imaging in medicine";
        lower.year = "2020";

        assertEquals(lower.identity(), upper.identity());
        assertEquals("imaging in medicine::2020", upper.identity());
    }

    @Test
    void keyCompletionFoldsCapitalI() {
        Bibliography bibliography = new Bibliography();
        bibliography.add(new BibtexEntry("article", "Ito2021"));
        bibliography.add(new BibtexEntry("article", "Smith2020"));

        assertEquals(List.of("Ito2021"), bibliography.keysStartingWith("it"));
    }
}
