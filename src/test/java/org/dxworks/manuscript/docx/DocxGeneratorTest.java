package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.ManuscriptConverter;
import org.dxworks.manuscript.TestUtils;
import org.dxworks.manuscript.model.DocxConversion;
import org.junit.jupiter.api.Test;

import static org.dxworks.manuscript.TestUtils.count;
import static org.dxworks.manuscript.TestUtils.part;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocxGeneratorTest {

    private static final String BIBTEX = "@article{smith2020,\n"
            + "  author = {Smith, John},\n"
            + "  title = {Deep Learning},\n"
            + "  journal = {Journal of Things},\n"
            + "  year = {2020}\n"
            + "}\n";

    private final ManuscriptConverter converter = TestUtils.converter();

    @Test
    void commentThreadBecomesRootWithReplies() throws Exception {
        String markdown = "Some {==flagged==}{>>Ann (2024-01-02T10:00+02:00): check "
                + "{>>Bob: done<<} {>>Cy: agreed<<}<<} text.";

        byte[] docx = converter.markdownToDocx(markdown, null, null).docx();

        String comments = part(docx, DocxPackage.COMMENTS);
        assertEquals(3, count(comments, "<w:comment "));
        assertTrue(comments.contains("w:author=\"Ann\" w:date=\"2024-01-02T08:00:00Z\""));
        assertTrue(comments.contains("w:author=\"Bob\" w:date=\"2024-03-01T10:15:30Z\""));
        assertEquals(2, count(part(docx, DocxPackage.COMMENTS_EXTENDED), "w15:paraIdParent"));

        String document = part(docx, DocxPackage.DOCUMENT);
        assertEquals(3, count(document, "<w:commentRangeStart "));
        assertEquals(3, count(document, "<w:commentReference "));
        assertTrue(document.contains("<w:t>flagged</w:t>"));
    }

    @Test
    void criticChangesBecomeTrackedRevisions() throws Exception {
        String markdown = "---\nauthor: Ada Lovelace\n---\n{++new++} {--old--} {~~a~>b~~}";

        byte[] docx = converter.markdownToDocx(markdown, null, null).docx();

        String document = part(docx, DocxPackage.DOCUMENT);
        assertEquals(2, count(document, "<w:ins "));
        assertEquals(2, count(document, "<w:del "));
        assertTrue(document.contains("<w:delText>old</w:delText>"));
        assertTrue(document.contains("w:author=\"Ada Lovelace\""));
        assertTrue(part(docx, DocxPackage.CORE_PROPERTIES).contains("<dc:creator>Ada Lovelace</dc:creator>"));
    }

    @Test
    void citationsBecomeZoteroFieldsWithBibliography() throws Exception {
        DocxConversion conversion = converter.markdownToDocx("See [@smith2020, p. 5] and [@nobody].", BIBTEX, null);

        String document = part(conversion.docx(), DocxPackage.DOCUMENT);
        assertTrue(document.contains("ADDIN ZOTERO_ITEM CSL_CITATION"));
        assertTrue(document.contains("(Smith 2020, p. 5)"));
        assertTrue(document.contains("(@nobody)"));
        assertTrue(document.contains("ZOTERO_BIBL"));
        assertTrue(document.contains("<w:t>Sources</w:t>"));
        assertTrue(conversion.warnings().contains("Citation key not found: nobody"));
    }

    @Test
    void nothingCitedMeansNoBibliography() throws Exception {
        byte[] docx = converter.markdownToDocx("Just text.", BIBTEX, null).docx();

        String document = part(docx, DocxPackage.DOCUMENT);
        assertTrue(!document.contains("ZOTERO_BIBL"));
        assertNull(part(docx, DocxPackage.COMMENTS));
        assertNull(part(docx, DocxPackage.NUMBERING));
    }

    @Test
    void footnotesAndEndnotes() throws Exception {
        String markdown = "Text[^1].\n\n[^1]: The note.\n";

        byte[] footnotes = converter.markdownToDocx(markdown, null, null).docx();
        byte[] endnotes = converter.markdownToDocx("---\nnote-type: endnotes\n---\n" + markdown, null, null).docx();

        assertTrue(part(footnotes, DocxPackage.FOOTNOTES).contains("The note."));
        assertNull(part(footnotes, DocxPackage.ENDNOTES));
        assertTrue(part(endnotes, DocxPackage.ENDNOTES).contains("The note."));
        assertTrue(part(endnotes, DocxPackage.DOCUMENT).contains("<w:endnoteReference "));
    }

    @Test
    void invalidMathFallsBackToText() throws Exception {
        DocxConversion conversion = converter.markdownToDocx("Equation $x}$ here, $y^2$ fine.", null, null);

        String document = part(conversion.docx(), DocxPackage.DOCUMENT);
        assertTrue(document.contains("<w:t>x}</w:t>"));
        assertEquals(1, count(document, "<m:oMath>"));
        assertTrue(conversion.warnings().contains("Math could not be converted: x}"));
    }

    @Test
    void listsHeadingsAndCodeUseDocumentStyles() throws Exception {
        String markdown = "## Section\n\n- [x] done\n- item\n  1. nested\n\n```python\nprint(1)\n```\n";

        byte[] docx = converter.markdownToDocx(markdown, null, null).docx();

        String document = part(docx, DocxPackage.DOCUMENT);
        assertTrue(document.contains("<w:pStyle w:val=\"Heading2\"/>"));
        assertTrue(document.contains(DocxGenerator.CHECKED_BOX + " "));
        assertTrue(document.contains("<w:ilvl w:val=\"1\"/>"));
        assertTrue(document.contains("w:name=\"_CodeLang_python\""));
        assertTrue(document.contains("<w:pStyle w:val=\"CodeBlock\"/>"));
        assertNotNull(part(docx, DocxPackage.NUMBERING));
    }

    @Test
    void missingImageKeepsAltText() throws Exception {
        DocxConversion conversion = converter.markdownToDocx("![A chart](missing.png)", null, null);

        assertTrue(part(conversion.docx(), DocxPackage.DOCUMENT).contains("<w:t>A chart</w:t>"));
        assertTrue(conversion.warnings().contains("Unsupported image: missing.png"));
    }
}
