package org.dxworks.manuscript.math;

import org.dxworks.manuscript.docx.xml.XmlElement;
import org.dxworks.manuscript.docx.xml.XmlParseException;
import org.dxworks.manuscript.docx.xml.XmlReader;

import java.util.List;

/**
 * Translates between LaTeX math and Office Math Markup.
 */
public class MathTranslator {

    private final int maxDepth;
    private final OmmlReader ommlReader;

    public MathTranslator(int maxDepth) {
        this.maxDepth = maxDepth;
        this.ommlReader = new OmmlReader(maxDepth);
    }

    /**
     * @throws MathSyntaxException when the LaTeX cannot be turned into a tree
     */
    public String latexToOmml(String latex, boolean display) {
        List<MathNode> nodes = LatexParser.parse(latex);
        return OmmlWriter.write(nodes, display);
    }

    public String ommlToLatex(XmlElement math) {
        return LatexWriter.write(ommlReader.read(math));
    }

    public String ommlToLatex(String fragment) throws XmlParseException {
        return ommlToLatex(new XmlReader(Math.max(maxDepth, XmlReader.DEFAULT_MAX_DEPTH)).parseFragment(fragment));
    }
}
