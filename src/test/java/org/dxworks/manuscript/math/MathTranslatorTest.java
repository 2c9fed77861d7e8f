package org.dxworks.manuscript.math;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MathTranslatorTest {

    private final MathTranslator translator = new MathTranslator(50);

    private String roundTrip(String latex) throws Exception {
        return translator.ommlToLatex(translator.latexToOmml(latex, false));
    }

    @Test
    void superscriptBecomesScriptElement() throws Exception {
        String omml = translator.latexToOmml("x^2", false);

        assertTrue(omml.startsWith("<m:oMath>"));
        assertTrue(omml.contains("<m:sSup>"));
        assertEquals("x^2", roundTrip("x^2"));
    }

    @Test
    void displayMathIsWrappedInMathParagraph() {
        String omml = translator.latexToOmml("a", true);

        assertTrue(omml.startsWith("<m:oMathPara><m:oMath>"));
        assertTrue(omml.endsWith("</m:oMath></m:oMathPara>"));
    }

    @Test
    void fractionsAndRadicalsSurviveRoundTrip() throws Exception {
        assertTrue(translator.latexToOmml("\\frac{a}{b}", false).contains("<m:f>"));
        assertEquals("\\frac{a}{b}", roundTrip("\\frac{a}{b}"));

        assertTrue(translator.latexToOmml("\\sqrt{x}", false).contains("<m:degHide m:val=\"1\"/>"));
        assertEquals("\\sqrt{x}", roundTrip("\\sqrt{x}"));
    }

    @Test
    void greekLettersMapToCommands() throws Exception {
        assertTrue(translator.latexToOmml("\\alpha", false).contains("α"));
        assertEquals("\\alpha+\\beta", roundTrip("\\alpha + \\beta"));
    }

    @Test
    void readsHandWrittenSubscript() throws Exception {
        String fragment = "<m:oMath><m:sSub><m:e><m:r><m:t>a</m:t></m:r></m:e>"
                + "<m:sub><m:r><m:t>i</m:t></m:r></m:sub></m:sSub></m:oMath>";

        assertEquals("a_i", translator.ommlToLatex(fragment));
    }

    @Test
    void unbalancedBraceIsRejected() {
        assertThrows(MathSyntaxException.class, () -> translator.latexToOmml("x}", false));
    }

    @Test
    void deepNestingIsCutOffQuietly() throws Exception {
        String omml = translator.latexToOmml("\\frac{\\frac{\\frac{a}{b}}{c}}{d}", false);

        String shallow = assertDoesNotThrow(() -> new MathTranslator(2).ommlToLatex(omml));
        assertFalse(shallow.contains("{a}"));
        assertEquals("\\frac{\\frac{\\frac{a}{b}}{c}}{d}", translator.ommlToLatex(omml));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "\\begin{matrix} 1 & 0 \\\\ 0 & 1 \\end{matrix}; <m:m>; \\begin{matrix} 1 & 0 \\\\ 0 & 1 \\end{matrix}",
            "\\begin{pmatrix}a&b\\\\c&d\\end{pmatrix}; <m:begChr m:val=\"(\"/>; \\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}",
            "\\begin{cases} 1 & x>0 \\\\ 0 & x \\le 0 \\end{cases}; <m:eqArr>; \\begin{cases} 1 & x>0 \\\\ 0 & x\\leq0 \\end{cases}",
            "\\begin{aligned} a &= b \\\\ c &= d \\end{aligned}; <m:eqArr>; \\begin{aligned} a & =b \\\\ c & =d \\end{aligned}",
            "\\hat{x}; <m:acc>; \\hat{x}",
            "\\vec{v}; <m:chr m:val=\"\u20D7\"/>; \\vec{v}",
            "\\sin x; <m:func>; \\sin x",
            "\\sin(x); <m:fName>; \\sin(x)",
            "\\lim_{x \\to 0} f; <m:limLow>; \\lim_{x\\to0} f",
            "\\sum_{i=1}^{n} i; <m:limLoc m:val=\"undOvr\"/>; \\sum_{i=1}^n i",
            "\\int_0^1 f; <m:limLoc m:val=\"subSup\"/>; \\int_0^1 f",
            "\\int\\limits_a^b f; <m:limLoc m:val=\"undOvr\"/>; \\int\\limits_a^b f",
            "\\left( x \\right); <m:d>; \\left(x\\right)",
            "\\left. x \\right|; <m:begChr m:val=\"\"/>; \\left.x\\right|",
            "\\foo x; <m:t>\\foo</m:t>; \\foo x"
    })
    void constructsSurviveRoundTrip(String latex, String element, String expected) throws Exception {
        assertTrue(translator.latexToOmml(latex, false).contains(element), element);
        assertEquals(expected, roundTrip(latex));
        assertEquals(expected, roundTrip(expected));
    }

    @Test
    void commentIsHiddenInOmmlAndRestored() throws Exception {
        String omml = translator.latexToOmml("x^2 % superscript", false);

        assertTrue(omml.contains("<w:vanish/>"));
        assertTrue(omml.contains("\u200B % superscript"));
        assertEquals("x^2 % superscript", roundTrip("x^2 % superscript"));
    }

    @Test
    void commentKeepsItsLineBreakBeforeMoreMath() throws Exception {
        assertEquals("x+y%\n+z", roundTrip("x + y%\n+ z"));
        assertEquals("\\begin{aligned} a & =b % first\n \\\\ c & =d \\end{aligned}",
                roundTrip("\\begin{aligned} a &= b % first\n\\\\ c &= d \\end{aligned}"));
    }

    @Test
    void escapedPercentIsLiteral() throws Exception {
        String omml = translator.latexToOmml("50\\% + x", false);

        assertFalse(omml.contains("vanish"));
        assertTrue(omml.contains("<m:t>%</m:t>"));
        assertEquals("50\\%+x", roundTrip("50\\% + x"));
    }

    @Test
    void commentInsideArgumentIsDropped() throws Exception {
        assertEquals("\\frac{a}{b}", roundTrip("\\frac % numerator\n{a}{b}"));
    }
}
