package org.dxworks.manuscript.math;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Writes {@link MathNode} trees as LaTeX with as few braces as the parser needs to read the same tree back.
 */
public final class LatexWriter {

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern COMMAND_LITERAL = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Map<String, String> MATRIX_ENVIRONMENTS = Map.of(
            "()", "pmatrix", "[]", "bmatrix", "{}", "Bmatrix", "||", "vmatrix", "‖‖", "Vmatrix");

    private LatexWriter() {}

    public static String write(List<MathNode> nodes) {
        return writeAll(nodes).strip();
    }

    private static String writeAll(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MathNode node : nodes) {
            append(sb, write(node));
        }
        return sb.toString();
    }

    private static String write(MathNode node) {
        if (node instanceof MathNode.Run run) {
            return writeRun(run);
        }
        if (node instanceof MathNode.Comment comment) {
            // the line break ends the comment; a trailing one is stripped with the rest of the output
            return comment.text().endsWith("\n") ? comment.text() : comment.text() + "\n";
        }
        if (node instanceof MathNode.Fraction fraction) {
            return "\\frac" + group(fraction.numerator()) + group(fraction.denominator());
        }
        if (node instanceof MathNode.Script script) {
            return base(script.base()) + scripts(script.sub(), script.sup());
        }
        if (node instanceof MathNode.Nary nary) {
            return writeNary(nary);
        }
        if (node instanceof MathNode.Radical radical) {
            String degree = radical.degree() == null ? "" : "[" + writeAll(radical.degree()) + "]";
            return "\\sqrt" + degree + group(radical.body());
        }
        if (node instanceof MathNode.Accent accent) {
            String command = MathSymbols.accentCommand(accent.character()).orElse("\\hat");
            return command + group(accent.body());
        }
        if (node instanceof MathNode.Delimiter delimiter) {
            return writeDelimiter(delimiter);
        }
        if (node instanceof MathNode.Function function) {
            return writeFunction(function);
        }
        if (node instanceof MathNode.LowerLimit lowerLimit) {
            return "\\underset" + group(lowerLimit.limit()) + group(lowerLimit.base());
        }
        if (node instanceof MathNode.Matrix matrix) {
            return environment("matrix", matrix.rows());
        }
        if (node instanceof MathNode.Environment environment) {
            String name = environment.name().equals(MathNode.Environment.CASES)
                    ? MathNode.Environment.CASES
                    : environment.hasAlignment() ? MathNode.Environment.ALIGNED : MathNode.Environment.GATHERED;
            return environment(name, environment.rows());
        }
        return "";
    }

    private static String writeRun(MathNode.Run run) {
        String text = run.text();
        if (MathNode.STYLE_BOLD.equals(run.style())) {
            return "\\mathbf{" + escapeText(text) + "}";
        }
        if (run.isPlain()) {
            return (text.contains(" ") ? "\\text{" : "\\mathrm{") + escapeText(text) + "}";
        }
        if (COMMAND_LITERAL.matcher(text).matches()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        text.codePoints().forEach(cp -> append(sb, writeCharacter(new String(Character.toChars(cp)))));
        return sb.toString();
    }

    private static String writeCharacter(String character) {
        Optional<String> command = MathSymbols.symbolCommand(character)
                .or(() -> MathSymbols.spacingCommand(character))
                .or(() -> MathSymbols.naryCommand(character));
        if (command.isPresent()) {
            return command.get();
        }
        Optional<String> doubleStruck = MathSymbols.doubleStruckLetter(character);
        if (doubleStruck.isPresent()) {
            return "\\mathbb{" + doubleStruck.get() + "}";
        }
        if (MathSymbols.ESCAPED_CHARACTERS.contains(character)) {
            return "\\" + character;
        }
        return character;
    }

    private static String writeNary(MathNode.Nary nary) {
        StringBuilder sb = new StringBuilder(MathSymbols.naryCommand(nary.operator()).orElse(nary.operator()));
        if (nary.underOver() != MathSymbols.limitsAboveByDefault(nary.operator())) {
            sb.append(nary.underOver() ? "\\limits" : "\\nolimits");
        }
        sb.append(scripts(nary.sub(), nary.sup()));
        sb.append(operand(nary.body()));
        return sb.toString();
    }

    private static String writeFunction(MathNode.Function function) {
        String name = functionName(function.name());
        List<MathNode> argument = function.argument();
        if (argument.size() == 1 && argument.get(0) instanceof MathNode.Delimiter delimiter
                && delimiter.begin().equals("(") && delimiter.end().equals(")")) {
            return name + "(" + writeAll(delimiter.content()) + ")";
        }
        return name + operand(argument);
    }

    private static String functionName(List<MathNode> name) {
        if (name.size() != 1) {
            return writeAll(name);
        }
        MathNode node = name.get(0);
        if (node instanceof MathNode.Run run) {
            return functionCommand(run);
        }
        if (node instanceof MathNode.Script script && script.base().size() == 1
                && script.base().get(0) instanceof MathNode.Run run) {
            return functionCommand(run) + scripts(script.sub(), script.sup());
        }
        if (node instanceof MathNode.LowerLimit lowerLimit && lowerLimit.base().size() == 1
                && lowerLimit.base().get(0) instanceof MathNode.Run run) {
            return functionCommand(run) + "_" + argument(lowerLimit.limit());
        }
        return write(node);
    }

    private static String functionCommand(MathNode.Run run) {
        String text = run.text().strip();
        if (MathSymbols.FUNCTIONS.contains(text)) {
            return "\\" + text;
        }
        return "\\operatorname{" + escapeText(text) + "}";
    }

    private static String writeDelimiter(MathNode.Delimiter delimiter) {
        List<MathNode> content = delimiter.content();
        if (content.size() == 1) {
            MathNode only = content.get(0);
            String environment = MATRIX_ENVIRONMENTS.get(delimiter.begin() + delimiter.end());
            if (only instanceof MathNode.Matrix matrix && environment != null) {
                return environment(environment, matrix.rows());
            }
            if (only instanceof MathNode.Environment cases && delimiter.begin().equals("{")
                    && delimiter.end().isEmpty()) {
                return environment(MathNode.Environment.CASES, cases.rows());
            }
            if (only instanceof MathNode.Fraction fraction && fraction.noBar()
                    && delimiter.begin().equals("(") && delimiter.end().equals(")")) {
                return "\\binom" + group(fraction.numerator()) + group(fraction.denominator());
            }
        }
        StringBuilder sb = new StringBuilder("\\left");
        append(sb, MathSymbols.delimiterSource(delimiter.begin()));
        append(sb, writeAll(content));
        append(sb, "\\right");
        append(sb, MathSymbols.delimiterSource(delimiter.end()));
        return sb.toString();
    }

    private static String environment(String name, List<List<List<MathNode>>> rows) {
        StringBuilder sb = new StringBuilder("\\begin{").append(name).append('}');
        for (int r = 0; r < rows.size(); r++) {
            if (r > 0) {
                sb.append(" \\\\");
            }
            List<List<MathNode>> row = rows.get(r);
            for (int c = 0; c < row.size(); c++) {
                if (c > 0) {
                    sb.append(" &");
                }
                String cell = writeAll(row.get(c));
                if (!cell.isEmpty()) {
                    sb.append(' ').append(cell);
                }
            }
        }
        return sb.append(" \\end{").append(name).append('}').toString();
    }

    /** Base of a script, braced unless it is a single atom. */
    private static String base(List<MathNode> base) {
        if (base.size() == 1 && isAtomic(base.get(0))
                && !(base.get(0) instanceof MathNode.Run run && run.style() == null && run.text().length() > 1)
                && !(base.get(0) instanceof MathNode.Script)
                && !(base.get(0) instanceof MathNode.Nary)
                && !(base.get(0) instanceof MathNode.Function)) {
            return write(base.get(0));
        }
        return group(base);
    }

    private static String scripts(List<MathNode> sub, List<MathNode> sup) {
        StringBuilder sb = new StringBuilder();
        if (sub != null) {
            sb.append('_').append(argument(sub));
        }
        if (sup != null) {
            sb.append('^').append(argument(sup));
        }
        return sb.toString();
    }

    /** Script argument: a single letter or digit stays bare, anything else is braced. */
    private static String argument(List<MathNode> nodes) {
        if (nodes.size() == 1 && nodes.get(0) instanceof MathNode.Run run && run.style() == null
                && run.text().codePointCount(0, run.text().length()) == 1
                && Character.isLetterOrDigit(run.text().codePointAt(0))
                && MathSymbols.symbolCommand(run.text()).isEmpty()
                && MathSymbols.doubleStruckLetter(run.text()).isEmpty()) {
            return run.text();
        }
        return group(nodes);
    }

    /** Body of an n-ary operator or argument of a function. */
    private static String operand(List<MathNode> nodes) {
        if (nodes.isEmpty()) {
            return "{}";
        }
        if (nodes.size() == 1 && isAtomic(nodes.get(0))) {
            return " " + write(nodes.get(0));
        }
        return group(nodes);
    }

    /** True when the parser reads the written node back as one element. */
    private static boolean isAtomic(MathNode node) {
        if (node instanceof MathNode.Comment) {
            return false;
        }
        if (node instanceof MathNode.Run run) {
            String text = run.text();
            return run.style() != null
                    || COMMAND_LITERAL.matcher(text).matches()
                    || NUMBER.matcher(text).matches()
                    || text.codePointCount(0, text.length()) == 1;
        }
        return true;
    }

    private static String group(List<MathNode> nodes) {
        return "{" + writeAll(nodes) + "}";
    }

    private static String escapeText(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (MathSymbols.ESCAPED_CHARACTERS.indexOf(c) >= 0) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /** Appends {@code piece}, separating a trailing command name from a following letter. */
    private static void append(StringBuilder sb, String piece) {
        if (piece.isEmpty()) {
            return;
        }
        if (endsWithCommandName(sb) && Character.isLetter(piece.charAt(0))) {
            sb.append(' ');
        }
        sb.append(piece);
    }

    private static boolean endsWithCommandName(CharSequence text) {
        int i = text.length() - 1;
        while (i >= 0 && isAsciiLetter(text.charAt(i))) {
            i--;
        }
        return i < text.length() - 1 && i >= 0 && text.charAt(i) == '\\';
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
