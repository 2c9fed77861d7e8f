package org.dxworks.manuscript.math;

import java.util.List;

/**
 * Math expression tree. Both LaTeX and OMML are read into it and written from it.
 */
public sealed interface MathNode {

    String STYLE_PLAIN = "p";
    String STYLE_BOLD = "b";

    /** Literal text; {@code style} is null for ordinary math italic, {@code p} for upright, {@code b} for bold. */
    record Run(String text, String style) implements MathNode {
        public Run(String text) {
            this(text, null);
        }

        public boolean isPlain() {
            return STYLE_PLAIN.equals(style);
        }
    }

    /** LaTeX comment: the whitespace before it, the {@code %}, the rest of the line and its newline if any. */
    record Comment(String text) implements MathNode {}

    record Fraction(List<MathNode> numerator, List<MathNode> denominator, boolean noBar) implements MathNode {
        public Fraction {
            numerator = List.copyOf(numerator);
            denominator = List.copyOf(denominator);
        }
    }

    /** Sub and/or superscript. {@code sub} or {@code sup} is null when absent. */
    record Script(List<MathNode> base, List<MathNode> sub, List<MathNode> sup) implements MathNode {
        public Script {
            base = List.copyOf(base);
            sub = sub == null ? null : List.copyOf(sub);
            sup = sup == null ? null : List.copyOf(sup);
        }
    }

    /** Sum, product or integral sign with optional limits; {@code underOver} puts them above and below. */
    record Nary(String operator, boolean underOver, List<MathNode> sub, List<MathNode> sup,
                List<MathNode> body) implements MathNode {
        public Nary {
            sub = sub == null ? null : List.copyOf(sub);
            sup = sup == null ? null : List.copyOf(sup);
            body = List.copyOf(body);
        }
    }

    /** Root; {@code degree} is null for a square root. */
    record Radical(List<MathNode> degree, List<MathNode> body) implements MathNode {
        public Radical {
            degree = degree == null ? null : List.copyOf(degree);
            body = List.copyOf(body);
        }
    }

    record Accent(String character, List<MathNode> body) implements MathNode {
        public Accent {
            body = List.copyOf(body);
        }
    }

    /** Bracketed content; an empty {@code begin} or {@code end} is an invisible delimiter. */
    record Delimiter(String begin, String end, List<MathNode> content) implements MathNode {
        public Delimiter {
            content = List.copyOf(content);
        }
    }

    record Function(List<MathNode> name, List<MathNode> argument) implements MathNode {
        public Function {
            name = List.copyOf(name);
            argument = List.copyOf(argument);
        }
    }

    /** {@code base} with {@code limit} set below it, as in {@code underset} or a limit function name. */
    record LowerLimit(List<MathNode> base, List<MathNode> limit) implements MathNode {
        public LowerLimit {
            base = List.copyOf(base);
            limit = List.copyOf(limit);
        }
    }

    /** Rows of cells. */
    record Matrix(List<List<List<MathNode>>> rows) implements MathNode {
        public Matrix {
            rows = rows.stream().map(row -> row.stream().map(List::copyOf).toList()).toList();
        }

        public int columns() {
            return rows.stream().mapToInt(List::size).max().orElse(0);
        }
    }

    /**
     * Equation array: {@code aligned}, {@code gathered} or {@code cases}. Cells of a row are separated by
     * alignment points.
     */
    record Environment(String name, List<List<List<MathNode>>> rows) implements MathNode {
        public static final String ALIGNED = "aligned";
        public static final String GATHERED = "gathered";
        public static final String CASES = "cases";

        public Environment {
            rows = rows.stream().map(row -> row.stream().map(List::copyOf).toList()).toList();
        }

        public boolean hasAlignment() {
            return rows.stream().anyMatch(row -> row.size() > 1);
        }
    }
}
