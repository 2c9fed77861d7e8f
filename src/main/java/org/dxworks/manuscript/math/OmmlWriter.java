package org.dxworks.manuscript.math;

import org.dxworks.manuscript.docx.xml.Xml;

import java.util.List;

/**
 * Writes {@link MathNode} trees as Office Math Markup with the {@code m:} prefix.
 */
public final class OmmlWriter {

    /** Marks a hidden run that carries a LaTeX comment. */
    public static final String COMMENT_MARKER = "\u200B";

    private OmmlWriter() {}

    /** {@code m:oMath}, wrapped in {@code m:oMathPara} for display math. */
    public static String write(List<MathNode> nodes, boolean display) {
        String math = "<m:oMath>" + writeAll(nodes) + "</m:oMath>";
        return display ? "<m:oMathPara>" + math + "</m:oMathPara>" : math;
    }

    static String writeAll(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MathNode node : nodes) {
            write(node, sb);
        }
        return sb.toString();
    }

    private static void write(MathNode node, StringBuilder sb) {
        if (node instanceof MathNode.Run run) {
            writeRun(run, sb);
        } else if (node instanceof MathNode.Comment comment) {
            sb.append("<m:r><w:rPr><w:vanish/></w:rPr><m:t xml:space=\"preserve\">")
                    .append(Xml.escape(COMMENT_MARKER + comment.text()))
                    .append("</m:t></m:r>");
        } else if (node instanceof MathNode.Fraction fraction) {
            sb.append("<m:f>");
            if (fraction.noBar()) {
                sb.append("<m:fPr><m:type m:val=\"noBar\"/></m:fPr>");
            }
            element("m:num", fraction.numerator(), sb);
            element("m:den", fraction.denominator(), sb);
            sb.append("</m:f>");
        } else if (node instanceof MathNode.Script script) {
            writeScript(script, sb);
        } else if (node instanceof MathNode.Nary nary) {
            sb.append("<m:nary><m:naryPr>");
            valueElement("m:chr", nary.operator(), sb);
            valueElement("m:limLoc", nary.underOver() ? "undOvr" : "subSup", sb);
            if (nary.sub() == null) {
                valueElement("m:subHide", "1", sb);
            }
            if (nary.sup() == null) {
                valueElement("m:supHide", "1", sb);
            }
            sb.append("</m:naryPr>");
            element("m:sub", nary.sub() == null ? List.of() : nary.sub(), sb);
            element("m:sup", nary.sup() == null ? List.of() : nary.sup(), sb);
            element("m:e", nary.body(), sb);
            sb.append("</m:nary>");
        } else if (node instanceof MathNode.Radical radical) {
            sb.append("<m:rad>");
            if (radical.degree() == null) {
                sb.append("<m:radPr><m:degHide m:val=\"1\"/></m:radPr><m:deg/>");
            } else {
                element("m:deg", radical.degree(), sb);
            }
            element("m:e", radical.body(), sb);
            sb.append("</m:rad>");
        } else if (node instanceof MathNode.Accent accent) {
            sb.append("<m:acc><m:accPr>");
            valueElement("m:chr", accent.character(), sb);
            sb.append("</m:accPr>");
            element("m:e", accent.body(), sb);
            sb.append("</m:acc>");
        } else if (node instanceof MathNode.Delimiter delimiter) {
            sb.append("<m:d><m:dPr>");
            valueElement("m:begChr", delimiter.begin(), sb);
            valueElement("m:endChr", delimiter.end(), sb);
            sb.append("</m:dPr>");
            element("m:e", delimiter.content(), sb);
            sb.append("</m:d>");
        } else if (node instanceof MathNode.Function function) {
            sb.append("<m:func>");
            element("m:fName", function.name(), sb);
            element("m:e", function.argument(), sb);
            sb.append("</m:func>");
        } else if (node instanceof MathNode.LowerLimit lowerLimit) {
            sb.append("<m:limLow>");
            element("m:e", lowerLimit.base(), sb);
            element("m:lim", lowerLimit.limit(), sb);
            sb.append("</m:limLow>");
        } else if (node instanceof MathNode.Matrix matrix) {
            writeMatrix(matrix, sb);
        } else if (node instanceof MathNode.Environment environment) {
            sb.append("<m:eqArr>");
            for (List<List<MathNode>> row : environment.rows()) {
                sb.append("<m:e>");
                for (int i = 0; i < row.size(); i++) {
                    if (i > 0) {
                        writeRun(new MathNode.Run("&"), sb);
                    }
                    sb.append(writeAll(row.get(i)));
                }
                sb.append("</m:e>");
            }
            sb.append("</m:eqArr>");
        }
    }

    private static void writeRun(MathNode.Run run, StringBuilder sb) {
        sb.append("<m:r>");
        if (run.style() != null) {
            sb.append("<m:rPr><m:sty m:val=\"").append(run.style()).append("\"/></m:rPr>");
        }
        sb.append(Xml.textElement("m:t", run.text()));
        sb.append("</m:r>");
    }

    private static void writeScript(MathNode.Script script, StringBuilder sb) {
        if (script.sub() != null && script.sup() != null) {
            sb.append("<m:sSubSup>");
            element("m:e", script.base(), sb);
            element("m:sub", script.sub(), sb);
            element("m:sup", script.sup(), sb);
            sb.append("</m:sSubSup>");
        } else if (script.sup() != null) {
            sb.append("<m:sSup>");
            element("m:e", script.base(), sb);
            element("m:sup", script.sup(), sb);
            sb.append("</m:sSup>");
        } else {
            sb.append("<m:sSub>");
            element("m:e", script.base(), sb);
            element("m:sub", script.sub() == null ? List.of() : script.sub(), sb);
            sb.append("</m:sSub>");
        }
    }

    private static void writeMatrix(MathNode.Matrix matrix, StringBuilder sb) {
        int columns = Math.max(1, matrix.columns());
        sb.append("<m:m><m:mPr><m:mcs><m:mc><m:mcPr><m:count m:val=\"").append(columns)
                .append("\"/><m:mcJc m:val=\"center\"/></m:mcPr></m:mc></m:mcs></m:mPr>");
        for (List<List<MathNode>> row : matrix.rows()) {
            sb.append("<m:mr>");
            for (int i = 0; i < columns; i++) {
                element("m:e", i < row.size() ? row.get(i) : List.of(), sb);
            }
            sb.append("</m:mr>");
        }
        sb.append("</m:m>");
    }

    private static void element(String name, List<MathNode> content, StringBuilder sb) {
        if (content.isEmpty()) {
            sb.append('<').append(name).append("/>");
            return;
        }
        sb.append('<').append(name).append('>');
        for (MathNode node : content) {
            write(node, sb);
        }
        sb.append("</").append(name).append('>');
    }

    private static void valueElement(String name, String value, StringBuilder sb) {
        sb.append('<').append(name).append(" m:val=\"").append(Xml.escape(value)).append("\"/>");
    }
}
