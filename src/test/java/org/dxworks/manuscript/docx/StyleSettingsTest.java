package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.model.Frontmatter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class StyleSettingsTest {

    @Test
    void defaultsWithoutFrontmatter() {
        StyleSettings settings = StyleSettings.from(new Frontmatter());

        assertEquals(StyleSettings.DEFAULT_FONT, settings.font());
        assertEquals(22, settings.bodySize());
        assertEquals(20, settings.codeSize());
        assertEquals(32, settings.headingSize(1));
        assertEquals(56, settings.titleSize());
        assertNull(settings.codeBlockInsetTwips());
    }

    @Test
    void bodyFontSizeScalesHeadingsAndCode() {
        Frontmatter frontmatter = new Frontmatter();
        frontmatter.fontSize = 14.0;

        StyleSettings settings = StyleSettings.from(frontmatter);

        assertEquals(28, settings.bodySize());
        assertEquals(41, settings.headingSize(1));
        assertEquals(28, settings.headingSize(6));
        assertEquals(26, settings.codeSize());
    }

    @Test
    void explicitCodeSettingsWin() {
        Frontmatter frontmatter = new Frontmatter();
        frontmatter.fontSize = 14.0;
        frontmatter.codeFontSize = 9.0;
        frontmatter.codeFont = "Fira Code";
        frontmatter.codeBlockInset = 6.0;

        StyleSettings settings = StyleSettings.from(frontmatter);

        assertEquals(18, settings.codeSize());
        assertEquals("Fira Code", settings.codeFont());
        assertEquals(120, settings.codeBlockInsetTwips());
    }
}
