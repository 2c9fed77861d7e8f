package org.dxworks.manuscript.math;

import org.dxworks.manuscript.docx.xml.XmlElement;
import org.dxworks.manuscript.docx.xml.XmlNode;
import org.dxworks.manuscript.docx.xml.XmlText;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Reads Office Math Markup back into {@link MathNode} trees. Property elements are skipped; elements without a
 * counterpart become a visible {@code [UNSUPPORTED: name]} run so no content is lost silently.
 */
public class OmmlReader {

    private static final Set<String> SKIPPED = Set.of("m:ctrlPr", "w:rPr", "w:bookmarkStart", "w:bookmarkEnd",
            "w:proofErr", "w:ins", "w:del");
    private static final Set<String> TRUE_VALUES = Set.of("1", "on", "true");

    private final int maxDepth;

    public OmmlReader(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /** Reads an {@code m:oMathPara}, an {@code m:oMath} or any element holding math content. */
    public List<MathNode> read(XmlElement math) {
        return readChildren(math, 0);
    }

    private List<MathNode> readChildren(XmlElement container, int depth) {
        List<MathNode> nodes = new ArrayList<>();
        if (depth > maxDepth) {
            return nodes;
        }
        for (XmlElement child : container.elements()) {
            if (isSkipped(child)) {
                continue;
            }
            nodes.addAll(readElement(child, depth + 1));
        }
        return nodes;
    }

    private List<MathNode> readElement(XmlElement element, int depth) {
        if (!element.prefix().equals("m")) {
            return List.of();
        }
        switch (element.localName()) {
            case "oMathPara":
            case "oMath":
                return readChildren(element, depth);
            case "box":
            case "phant":
            case "groupChr":
                return part(element, "m:e", depth);
            case "r":
                return readRun(element);
            case "f":
                return readFraction(element, depth);
            case "sSup":
            case "sSub":
            case "sSubSup":
                return readScript(element, depth);
            case "nary":
                return List.of(readNary(element, depth));
            case "rad":
                return List.of(readRadical(element, depth));
            case "acc":
                return readAccent(element, depth);
            case "bar":
                return List.of(new MathNode.Accent("\u0305", part(element, "m:e", depth)));
            case "d":
                return List.of(readDelimiter(element, depth));
            case "func":
                return List.of(new MathNode.Function(part(element, "m:fName", depth), part(element, "m:e", depth)));
            case "limLow":
                return List.of(new MathNode.LowerLimit(part(element, "m:e", depth), part(element, "m:lim", depth)));
            case "limUpp":
                return List.of(new MathNode.Script(part(element, "m:e", depth), null, part(element, "m:lim", depth)));
            case "m":
                return List.of(readMatrix(element, depth));
            case "eqArr":
                return List.of(readEquationArray(element, depth));
            default:
                return unsupported(element);
        }
    }

    private List<MathNode> readRun(XmlElement run) {
        StringBuilder text = new StringBuilder();
        for (XmlElement t : run.elements("m:t")) {
            for (XmlNode node : t.children()) {
                if (node instanceof XmlText value) {
                    text.append(value.text());
                }
            }
        }
        if (text.length() == 0) {
            return List.of();
        }
        if (text.indexOf(OmmlWriter.COMMENT_MARKER) == 0) {
            return List.of(new MathNode.Comment(text.substring(OmmlWriter.COMMENT_MARKER.length())));
        }
        String style = run.child("m:rPr")
                .flatMap(properties -> properties.childAttr("m:sty", "m:val"))
                .map(OmmlReader::style)
                .orElse(null);
        return List.of(new MathNode.Run(text.toString(), style));
    }

    private static String style(String value) {
        if (value.startsWith("b")) {
            return MathNode.STYLE_BOLD;
        }
        return value.equals("p") ? MathNode.STYLE_PLAIN : null;
    }

    private List<MathNode> readFraction(XmlElement fraction, int depth) {
        if (fraction.child("m:num").isEmpty() && fraction.child("m:den").isEmpty()) {
            return unsupported(fraction);
        }
        boolean noBar = property(fraction, "m:fPr", "m:type").map("noBar"::equals).orElse(false);
        return List.of(new MathNode.Fraction(part(fraction, "m:num", depth), part(fraction, "m:den", depth), noBar));
    }

    private List<MathNode> readScript(XmlElement script, int depth) {
        boolean hasSub = !script.is("m:sSup");
        boolean hasSup = !script.is("m:sSub");
        if (script.child("m:e").isEmpty() || (hasSub && script.child("m:sub").isEmpty())
                || (hasSup && script.child("m:sup").isEmpty())) {
            return unsupported(script);
        }
        return List.of(new MathNode.Script(part(script, "m:e", depth),
                hasSub ? part(script, "m:sub", depth) : null,
                hasSup ? part(script, "m:sup", depth) : null));
    }

    private MathNode readNary(XmlElement nary, int depth) {
        String operator = property(nary, "m:naryPr", "m:chr").orElse("∫");
        boolean underOver = property(nary, "m:naryPr", "m:limLoc").map("undOvr"::equals).orElse(false);
        boolean subHide = flag(nary, "m:naryPr", "m:subHide");
        boolean supHide = flag(nary, "m:naryPr", "m:supHide");
        return new MathNode.Nary(operator, underOver,
                subHide ? null : part(nary, "m:sub", depth),
                supHide ? null : part(nary, "m:sup", depth),
                part(nary, "m:e", depth));
    }

    private MathNode readRadical(XmlElement radical, int depth) {
        boolean degHide = flag(radical, "m:radPr", "m:degHide");
        List<MathNode> degree = degHide ? List.of() : part(radical, "m:deg", depth);
        return new MathNode.Radical(degree.isEmpty() ? null : degree, part(radical, "m:e", depth));
    }

    private List<MathNode> readAccent(XmlElement accent, int depth) {
        String character = property(accent, "m:accPr", "m:chr").orElse("\u0302");
        if (MathSymbols.accentCommand(character).isEmpty()) {
            return unsupported(accent);
        }
        return List.of(new MathNode.Accent(character, part(accent, "m:e", depth)));
    }

    private MathNode readDelimiter(XmlElement delimiter, int depth) {
        String begin = property(delimiter, "m:dPr", "m:begChr").orElse("(");
        String end = property(delimiter, "m:dPr", "m:endChr").orElse(")");
        String separator = property(delimiter, "m:dPr", "m:sepChr").orElse("|");
        List<MathNode> content = new ArrayList<>();
        List<XmlElement> elements = delimiter.elements("m:e");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                content.add(new MathNode.Run(separator));
            }
            content.addAll(readChildren(elements.get(i), depth));
        }
        return new MathNode.Delimiter(begin, end, content);
    }

    private MathNode readMatrix(XmlElement matrix, int depth) {
        List<List<List<MathNode>>> rows = new ArrayList<>();
        for (XmlElement row : matrix.elements("m:mr")) {
            List<List<MathNode>> cells = new ArrayList<>();
            for (XmlElement cell : row.elements("m:e")) {
                cells.add(readChildren(cell, depth + 1));
            }
            rows.add(cells);
        }
        return new MathNode.Matrix(rows);
    }

    private MathNode readEquationArray(XmlElement array, int depth) {
        List<List<List<MathNode>>> rows = new ArrayList<>();
        for (XmlElement row : array.elements("m:e")) {
            rows.add(splitAtAlignment(readChildren(row, depth + 1)));
        }
        MathNode.Environment environment = new MathNode.Environment(MathNode.Environment.ALIGNED, rows);
        return environment.hasAlignment()
                ? environment
                : new MathNode.Environment(MathNode.Environment.GATHERED, rows);
    }

    /** Splits an equation array row into cells at the {@code &} alignment points. */
    private static List<List<MathNode>> splitAtAlignment(List<MathNode> nodes) {
        List<List<MathNode>> cells = new ArrayList<>();
        List<MathNode> cell = new ArrayList<>();
        for (MathNode node : nodes) {
            if (node instanceof MathNode.Run run && run.style() == null && run.text().contains("&")) {
                String[] pieces = run.text().split("&", -1);
                for (int i = 0; i < pieces.length; i++) {
                    if (i > 0) {
                        cells.add(cell);
                        cell = new ArrayList<>();
                    }
                    if (!pieces[i].isEmpty()) {
                        cell.add(new MathNode.Run(pieces[i]));
                    }
                }
            } else {
                cell.add(node);
            }
        }
        cells.add(cell);
        return cells;
    }

    private List<MathNode> part(XmlElement parent, String name, int depth) {
        return parent.child(name).map(child -> readChildren(child, depth)).orElse(List.of());
    }

    private static Optional<String> property(XmlElement element, String propertiesName, String propertyName) {
        return element.child(propertiesName).flatMap(properties -> properties.childAttr(propertyName, "m:val"));
    }

    /** On/off property; present without a value means on. */
    private static boolean flag(XmlElement element, String propertiesName, String propertyName) {
        return element.child(propertiesName)
                .flatMap(properties -> properties.child(propertyName))
                .map(property -> property.attr("m:val") == null || TRUE_VALUES.contains(property.attr("m:val")))
                .orElse(false);
    }

    private List<MathNode> unsupported(XmlElement element) {
        String text = element.text(maxDepth).strip();
        String label = "[UNSUPPORTED: " + element.localName() + "]" + (text.isEmpty() ? "" : " " + text);
        return List.of(new MathNode.Run(label, MathNode.STYLE_PLAIN));
    }

    private static boolean isSkipped(XmlElement element) {
        return SKIPPED.contains(element.name()) || (element.prefix().equals("m") && element.localName().endsWith("Pr"));
    }
}
