package org.dxworks.manuscript.markdown;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InertZonesTest {

    @Test
    void inlineCodeHidesMathDelimiters() {
        String text = "price `$5 and $6` here";

        List<InertZones.Zone> zones = InertZones.compute(text).zones();

        assertEquals(1, zones.size());
        assertEquals(InertZones.Kind.INLINE_CODE, zones.get(0).kind());
        assertEquals("$5 and $6", zones.get(0).content(text));
    }

    @Test
    void displayMathIsFoundBeforeInlineMath() {
        String text = "see $$a+b$$ and $c$";

        List<InertZones.Zone> zones = InertZones.compute(text).zones();

        assertEquals(2, zones.size());
        assertEquals(InertZones.Kind.DISPLAY_MATH, zones.get(0).kind());
        assertEquals("a+b", zones.get(0).content(text));
        assertEquals(InertZones.Kind.INLINE_MATH, zones.get(1).kind());
        assertEquals("c", zones.get(1).content(text));
    }

    @Test
    void fencedBlockSwallowsEverythingInside() {
        String text = "```\n{++not markup++} `x`\n```\nafter";

        InertZones zones = InertZones.compute(text);

        assertEquals(1, zones.zones().size());
        assertEquals(InertZones.Kind.FENCED_CODE, zones.zones().get(0).kind());
        assertTrue(zones.isInert(text.indexOf("{++")));
        assertFalse(zones.isInert(text.indexOf("after")));
    }

    @Test
    void escapedDollarIsNotMath() {
        assertTrue(InertZones.compute("costs \\$5 or \\$6").zones().isEmpty());
    }

    @Test
    void markerInsideCodeIsSkipped() {
        String text = "a `==}` b ==}";
        InertZones zones = InertZones.compute(text);

        assertEquals(text.lastIndexOf("==}"), zones.indexOutside(text, "==}", 0, text.length()));
    }

    @Test
    void htmlCommentIsInertOutsideCodeAndMath() {
        String text = "a <!-- {++x++} --> b";

        List<InertZones.Zone> zones = InertZones.compute(text).zones();

        assertEquals(1, zones.size());
        assertEquals(InertZones.Kind.HTML_COMMENT, zones.get(0).kind());
        assertEquals(" {++x++} ", zones.get(0).content(text));
        assertEquals(text.indexOf(" b"), zones.get(0).end());
    }

    @Test
    void commentMarkersInsideCodeOrMathStayLiteral() {
        String text = "`<!-- x -->` and $<!-- y -->$";

        List<InertZones.Zone> zones = InertZones.compute(text).zones();

        assertEquals(2, zones.size());
        assertEquals(InertZones.Kind.INLINE_CODE, zones.get(0).kind());
        assertEquals(InertZones.Kind.INLINE_MATH, zones.get(1).kind());
    }

    @Test
    void mathInsideHtmlCommentIsDropped() {
        String text = "<!-- $x$ --> $y$";

        List<InertZones.Zone> zones = InertZones.compute(text).zones();

        assertEquals(2, zones.size());
        assertEquals(InertZones.Kind.HTML_COMMENT, zones.get(0).kind());
        assertEquals(InertZones.Kind.INLINE_MATH, zones.get(1).kind());
        assertEquals("y", zones.get(1).content(text));
    }

    @Test
    void unclosedHtmlCommentIsNotAZone() {
        assertTrue(InertZones.compute("a <!-- never closed").zones().isEmpty());
    }
}
