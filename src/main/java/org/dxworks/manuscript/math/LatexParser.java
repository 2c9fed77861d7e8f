package org.dxworks.manuscript.math;

import org.dxworks.manuscript.math.LatexToken.Kind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive descent parser from LaTeX math tokens to {@link MathNode} trees.
 * - a script operator binds to the nearest atom, so {@code ab^2} raises only {@code b}
 * - a multi-character text token yields its first character (or number) and the rest is pushed back
 * - unknown commands become literal runs of the command text
 */
public class LatexParser {

    private static final Pattern NUMBER = Pattern.compile("^\\d+(?:\\.\\d+)?");

    private static final Map<String, String[]> MATRIX_DELIMITERS = Map.of(
            "matrix", new String[]{null, null},
            "smallmatrix", new String[]{null, null},
            "pmatrix", new String[]{"(", ")"},
            "bmatrix", new String[]{"[", "]"},
            "Bmatrix", new String[]{"{", "}"},
            "vmatrix", new String[]{"|", "|"},
            "Vmatrix", new String[]{"‖", "‖"});

    private static final Map<String, String> ARRAY_ENVIRONMENTS = Map.ofEntries(
            Map.entry("aligned", MathNode.Environment.ALIGNED),
            Map.entry("align", MathNode.Environment.ALIGNED),
            Map.entry("align*", MathNode.Environment.ALIGNED),
            Map.entry("alignat", MathNode.Environment.ALIGNED),
            Map.entry("alignat*", MathNode.Environment.ALIGNED),
            Map.entry("eqnarray", MathNode.Environment.ALIGNED),
            Map.entry("eqnarray*", MathNode.Environment.ALIGNED),
            Map.entry("split", MathNode.Environment.ALIGNED),
            Map.entry("gathered", MathNode.Environment.GATHERED),
            Map.entry("gather", MathNode.Environment.GATHERED),
            Map.entry("gather*", MathNode.Environment.GATHERED),
            Map.entry("multline", MathNode.Environment.GATHERED),
            Map.entry("multline*", MathNode.Environment.GATHERED));

    private final List<LatexToken> tokens;
    private int pos;

    private LatexParser(List<LatexToken> tokens) {
        this.tokens = new ArrayList<>(tokens);
    }

    public static List<MathNode> parse(String latex) {
        LatexParser parser = new LatexParser(LatexTokenizer.tokenize(latex));
        List<MathNode> nodes = parser.parseSequence(token -> false);
        if (parser.peek() != null) {
            throw new MathSyntaxException("Unexpected '" + parser.peek().value() + "'");
        }
        return nodes;
    }

    private List<MathNode> parseSequence(Predicate<LatexToken> stop) {
        List<MathNode> nodes = new ArrayList<>();
        while (true) {
            skipWhitespace();
            LatexToken token = peek();
            if (token == null || stop.test(token)) {
                return nodes;
            }
            if (token.kind() == Kind.RBRACE) {
                throw new MathSyntaxException("Unbalanced '}'");
            }
            if (token.kind() == Kind.COMMENT) {
                consume();
                nodes.add(new MathNode.Comment(token.value()));
                continue;
            }
            nodes.addAll(parseElement());
        }
    }

    /** One atom together with the scripts attached to it. */
    private List<MathNode> parseElement() {
        LatexToken token = peek();
        List<MathNode> atom;
        if (token.kind() == Kind.CARET || token.kind() == Kind.UNDERSCORE) {
            atom = List.of();
        } else {
            consume();
            atom = parseAtom(token);
        }
        return attachScripts(atom, token.kind() == Kind.TEXT);
    }

    private List<MathNode> parseAtom(LatexToken token) {
        switch (token.kind()) {
            case TEXT:
                return List.of(new MathNode.Run(splitText(token.value())));
            case LBRACE:
                return parseGroupBody();
            case AMPERSAND:
                return List.of(new MathNode.Run("&"));
            case COMMAND:
                return parseCommand(token.value());
            default:
                return List.of();
        }
    }

    private List<MathNode> attachScripts(List<MathNode> atom, boolean fromText) {
        skipWhitespace();
        LatexToken first = peek();
        if (first == null || (first.kind() != Kind.CARET && first.kind() != Kind.UNDERSCORE)) {
            return atom;
        }
        List<MathNode> sub = null;
        List<MathNode> sup = null;
        while (true) {
            skipWhitespace();
            LatexToken operator = peek();
            if (operator == null) {
                break;
            }
            if (operator.kind() == Kind.CARET && sup == null) {
                consume();
                sup = parseArgument();
            } else if (operator.kind() == Kind.UNDERSCORE && sub == null) {
                consume();
                sub = parseArgument();
            } else {
                break;
            }
        }

        List<MathNode> result = new ArrayList<>();
        List<MathNode> base = atom;
        if (fromText && atom.size() == 1 && atom.get(0) instanceof MathNode.Run run
                && run.text().length() > 1 && NUMBER.matcher(run.text()).matches()) {
            // scripts on a number apply to its last digit
            String text = run.text();
            result.add(new MathNode.Run(text.substring(0, text.length() - 1)));
            base = List.of(new MathNode.Run(text.substring(text.length() - 1)));
        }
        result.add(new MathNode.Script(base, sub, sup));
        return result;
    }

    /** A braced group, or a single atom, as the argument of a command or script. */
    private List<MathNode> parseArgument() {
        // comments between a command and its argument are dropped
        while (true) {
            skipWhitespace();
            LatexToken next = peek();
            if (next == null || next.kind() != Kind.COMMENT) {
                break;
            }
            consume();
        }
        LatexToken token = peek();
        if (token == null || isTerminator(token)) {
            return List.of();
        }
        consume();
        if (token.kind() == Kind.TEXT) {
            String value = token.value();
            int length = Character.charCount(value.codePointAt(0));
            pushBack(value.substring(length));
            return List.of(new MathNode.Run(value.substring(0, length)));
        }
        if (token.kind() == Kind.CARET || token.kind() == Kind.UNDERSCORE) {
            return List.of(new MathNode.Run(token.value()));
        }
        return parseAtom(token);
    }

    private List<MathNode> parseGroupBody() {
        List<MathNode> content = parseSequence(token -> token.kind() == Kind.RBRACE);
        if (peek() == null) {
            throw new MathSyntaxException("Missing '}'");
        }
        consume();
        return content;
    }

    private List<MathNode> parseCommand(String command) {
        Optional<String> symbol = MathSymbols.symbol(command);
        if (symbol.isPresent()) {
            return List.of(new MathNode.Run(symbol.get()));
        }
        if (command.equals("\\qquad")) {
            String quad = MathSymbols.spacing("\\quad").orElseThrow();
            return List.of(new MathNode.Run(quad), new MathNode.Run(quad));
        }
        Optional<String> space = MathSymbols.spacing(command);
        if (space.isPresent()) {
            return List.of(new MathNode.Run(space.get()));
        }
        if (command.length() == 2 && MathSymbols.ESCAPED_CHARACTERS.indexOf(command.charAt(1)) >= 0) {
            return List.of(new MathNode.Run(command.substring(1)));
        }
        Optional<String> nary = MathSymbols.nary(command);
        if (nary.isPresent()) {
            return List.of(parseNary(nary.get()));
        }
        Optional<String> accent = MathSymbols.accent(command);
        if (accent.isPresent()) {
            return List.of(new MathNode.Accent(accent.get(), parseArgument()));
        }
        String name = command.substring(1);
        if (MathSymbols.FUNCTIONS.contains(name)) {
            return List.of(parseFunction(name));
        }
        if (MathSymbols.IGNORED_COMMANDS.contains(command)) {
            return List.of();
        }

        switch (command) {
            case "\\frac":
            case "\\dfrac":
            case "\\tfrac":
            case "\\cfrac": {
                List<MathNode> numerator = parseArgument();
                return List.of(new MathNode.Fraction(numerator, parseArgument(), false));
            }
            case "\\binom":
            case "\\dbinom":
            case "\\tbinom": {
                List<MathNode> top = parseArgument();
                MathNode.Fraction stack = new MathNode.Fraction(top, parseArgument(), true);
                return List.of(new MathNode.Delimiter("(", ")", List.of(stack)));
            }
            case "\\sqrt":
                return List.of(parseRadical());
            case "\\left":
                return parseDelimiter();
            case "\\begin":
                return parseEnvironment();
            case "\\end":
                throw new MathSyntaxException("Unexpected \\end");
            case "\\operatorname":
                return List.of(parseFunction(rawGroupText()));
            case "\\mathrm":
            case "\\text":
            case "\\textrm":
            case "\\textnormal":
            case "\\mbox":
            case "\\mathsf":
            case "\\mathtt":
                return List.of(new MathNode.Run(rawGroupText(), MathNode.STYLE_PLAIN));
            case "\\mathbf":
            case "\\textbf":
            case "\\boldsymbol":
            case "\\bm":
                return List.of(new MathNode.Run(rawGroupText(), MathNode.STYLE_BOLD));
            case "\\mathit":
            case "\\textit":
                return italicRuns(rawGroupText());
            case "\\mathbb":
                return doubleStruck(rawGroupText());
            case "\\underset": {
                List<MathNode> limit = parseArgument();
                return List.of(new MathNode.LowerLimit(parseArgument(), limit));
            }
            default:
                return List.of(new MathNode.Run(command));
        }
    }

    private MathNode parseNary(String operator) {
        boolean underOver = MathSymbols.limitsAboveByDefault(operator);
        List<MathNode> sub = null;
        List<MathNode> sup = null;
        while (true) {
            skipWhitespace();
            LatexToken token = peek();
            if (token == null) {
                break;
            }
            if (token.isCommand("\\limits")) {
                consume();
                underOver = true;
            } else if (token.isCommand("\\nolimits")) {
                consume();
                underOver = false;
            } else if (token.kind() == Kind.UNDERSCORE && sub == null) {
                consume();
                sub = parseArgument();
            } else if (token.kind() == Kind.CARET && sup == null) {
                consume();
                sup = parseArgument();
            } else {
                break;
            }
        }
        return new MathNode.Nary(operator, underOver, sub, sup, parseBody());
    }

    private MathNode parseFunction(String name) {
        MathNode.Run nameRun = new MathNode.Run(name, MathNode.STYLE_PLAIN);
        List<MathNode> sub = null;
        List<MathNode> sup = null;
        while (true) {
            skipWhitespace();
            LatexToken token = peek();
            if (token == null) {
                break;
            }
            if (token.isCommand("\\limits") || token.isCommand("\\nolimits")) {
                consume();
            } else if (token.kind() == Kind.UNDERSCORE && sub == null) {
                consume();
                sub = parseArgument();
            } else if (token.kind() == Kind.CARET && sup == null) {
                consume();
                sup = parseArgument();
            } else {
                break;
            }
        }

        MathNode functionName;
        if (sub != null && sup == null && MathSymbols.LIMIT_FUNCTIONS.contains(name)) {
            functionName = new MathNode.LowerLimit(List.of(nameRun), sub);
        } else if (sub != null || sup != null) {
            functionName = new MathNode.Script(List.of(nameRun), sub, sup);
        } else {
            functionName = nameRun;
        }
        return new MathNode.Function(List.of(functionName), parseFunctionArgument());
    }

    private List<MathNode> parseFunctionArgument() {
        skipWhitespace();
        LatexToken token = peek();
        if (token != null && token.kind() == Kind.TEXT && token.value().startsWith("(")) {
            consume();
            pushBack(token.value().substring(1));
            List<MathNode> content = parseSequence(t -> isTerminator(t)
                    || (t.kind() == Kind.TEXT && t.value().startsWith(")")));
            LatexToken close = peek();
            if (close == null || close.kind() != Kind.TEXT) {
                List<MathNode> literal = new ArrayList<>();
                literal.add(new MathNode.Run("("));
                literal.addAll(content);
                return literal;
            }
            consume();
            pushBack(close.value().substring(1));
            return attachScripts(List.of(new MathNode.Delimiter("(", ")", content)), false);
        }
        return parseBody();
    }

    /** Operand of an n-ary operator or function: the next element, or nothing at the end of a group. */
    private List<MathNode> parseBody() {
        skipWhitespace();
        LatexToken token = peek();
        if (token == null || isTerminator(token)) {
            return List.of();
        }
        return parseElement();
    }

    private MathNode parseRadical() {
        skipWhitespace();
        LatexToken token = peek();
        List<MathNode> degree = null;
        if (token != null && token.kind() == Kind.TEXT && token.value().startsWith("[")) {
            consume();
            pushBack(token.value().substring(1));
            degree = parseSequence(t -> t.kind() == Kind.RBRACE
                    || (t.kind() == Kind.TEXT && t.value().startsWith("]")));
            LatexToken close = peek();
            if (close == null || close.kind() != Kind.TEXT) {
                throw new MathSyntaxException("Missing ']' in \\sqrt");
            }
            consume();
            pushBack(close.value().substring(1));
        }
        return new MathNode.Radical(degree, parseArgument());
    }

    private List<MathNode> parseDelimiter() {
        String begin = readDelimiter();
        if (begin == null) {
            return List.of(new MathNode.Run("\\left"));
        }
        List<MathNode> content = parseSequence(t -> t.isCommand("\\right") || t.kind() == Kind.RBRACE);
        LatexToken right = peek();
        if (right == null || !right.isCommand("\\right")) {
            List<MathNode> literal = new ArrayList<>();
            literal.add(new MathNode.Run(begin));
            literal.addAll(content);
            return literal;
        }
        consume();
        String end = readDelimiter();
        if (end == null) {
            List<MathNode> literal = new ArrayList<>();
            literal.add(new MathNode.Run(begin));
            literal.addAll(content);
            return literal;
        }
        return attachScripts(List.of(new MathNode.Delimiter(begin, end, content)), false);
    }

    /** Reads the delimiter after {@code \left} or {@code \right}; text after the first character is pushed back. */
    private String readDelimiter() {
        skipWhitespace();
        LatexToken token = peek();
        if (token == null) {
            return null;
        }
        if (token.kind() == Kind.TEXT) {
            consume();
            String value = token.value();
            String first = value.substring(0, Character.charCount(value.codePointAt(0)));
            pushBack(value.substring(first.length()));
            return MathSymbols.delimiter(first).orElse(first);
        }
        if (token.kind() == Kind.COMMAND) {
            Optional<String> delimiter = MathSymbols.delimiter(token.value());
            if (delimiter.isPresent()) {
                consume();
                return delimiter.get();
            }
        }
        return null;
    }

    private List<MathNode> parseEnvironment() {
        String name = rawGroupText();
        skipOptionalArgument();
        List<List<List<MathNode>>> rows = parseRows(name);

        String[] matrixDelimiters = MATRIX_DELIMITERS.get(name);
        if (matrixDelimiters != null) {
            MathNode matrix = new MathNode.Matrix(rows);
            if (matrixDelimiters[0] == null) {
                return List.of(matrix);
            }
            return List.of(new MathNode.Delimiter(matrixDelimiters[0], matrixDelimiters[1], List.of(matrix)));
        }
        if (name.equals("cases")) {
            MathNode cases = new MathNode.Environment(MathNode.Environment.CASES, rows);
            return List.of(new MathNode.Delimiter("{", "", List.of(cases)));
        }
        if (name.equals("equation") || name.equals("equation*")) {
            List<MathNode> content = new ArrayList<>();
            rows.forEach(row -> row.forEach(content::addAll));
            return content;
        }
        String environment = ARRAY_ENVIRONMENTS.get(name);
        if (environment != null) {
            return List.of(new MathNode.Environment(environment, rows));
        }
        throw new MathSyntaxException("Unsupported environment: " + name);
    }

    private List<List<List<MathNode>>> parseRows(String name) {
        List<List<List<MathNode>>> rows = new ArrayList<>();
        List<List<MathNode>> row = new ArrayList<>();
        while (true) {
            List<MathNode> cell = parseSequence(t -> t.kind() == Kind.AMPERSAND || t.kind() == Kind.RBRACE
                    || t.isCommand("\\\\") || t.isCommand("\\end"));
            row.add(cell);
            LatexToken token = peek();
            if (token == null || token.kind() == Kind.RBRACE) {
                throw new MathSyntaxException("Missing \\end{" + name + "}");
            }
            consume();
            if (token.kind() == Kind.AMPERSAND) {
                continue;
            }
            rows.add(row);
            row = new ArrayList<>();
            if (token.isCommand("\\end")) {
                String closing = rawGroupText();
                if (!closing.equals(name)) {
                    throw new MathSyntaxException("\\begin{" + name + "} closed by \\end{" + closing + "}");
                }
                break;
            }
        }
        // a trailing \\ leaves an empty last row
        if (rows.size() > 1) {
            List<List<MathNode>> last = rows.get(rows.size() - 1);
            if (last.size() == 1 && last.get(0).isEmpty()) {
                rows.remove(rows.size() - 1);
            }
        }
        return rows;
    }

    private void skipOptionalArgument() {
        LatexToken token = peek();
        if (token != null && token.kind() == Kind.TEXT && token.value().startsWith("[")) {
            int close = token.value().indexOf(']');
            if (close >= 0) {
                consume();
                pushBack(token.value().substring(close + 1));
            }
        }
    }

    /** Text of a braced group with escapes and symbols resolved, used for names and text commands. */
    private String rawGroupText() {
        skipWhitespace();
        LatexToken token = peek();
        if (token == null) {
            return "";
        }
        if (token.kind() != Kind.LBRACE) {
            consume();
            return token.kind() == Kind.COMMAND ? commandText(token.value()) : token.value();
        }
        consume();
        StringBuilder sb = new StringBuilder();
        int depth = 1;
        while (true) {
            LatexToken next = consume();
            if (next == null) {
                throw new MathSyntaxException("Missing '}'");
            }
            if (next.kind() == Kind.LBRACE) {
                depth++;
            } else if (next.kind() == Kind.RBRACE) {
                depth--;
                if (depth == 0) {
                    return sb.toString();
                }
            } else if (next.kind() == Kind.COMMAND) {
                sb.append(commandText(next.value()));
            } else {
                sb.append(next.value());
            }
        }
    }

    private static String commandText(String command) {
        if (command.length() == 2 && MathSymbols.ESCAPED_CHARACTERS.indexOf(command.charAt(1)) >= 0) {
            return command.substring(1);
        }
        return MathSymbols.symbol(command)
                .or(() -> MathSymbols.spacing(command))
                .orElse(command);
    }

    private static List<MathNode> italicRuns(String text) {
        List<MathNode> runs = new ArrayList<>();
        text.codePoints().forEach(cp -> runs.add(new MathNode.Run(new String(Character.toChars(cp)))));
        return runs;
    }

    private static List<MathNode> doubleStruck(String text) {
        List<MathNode> runs = new ArrayList<>();
        text.codePoints().forEach(cp -> {
            String letter = new String(Character.toChars(cp));
            runs.add(new MathNode.Run(MathSymbols.doubleStruck(letter).orElse(letter)));
        });
        return runs;
    }

    /** First character, or the leading number, of a text token; the remainder is pushed back. */
    private String splitText(String value) {
        Matcher number = NUMBER.matcher(value);
        String head = number.find()
                ? number.group()
                : value.substring(0, Character.charCount(value.codePointAt(0)));
        pushBack(value.substring(head.length()));
        return head;
    }

    private static boolean isTerminator(LatexToken token) {
        return token.kind() == Kind.RBRACE || token.kind() == Kind.AMPERSAND
                || token.isCommand("\\right") || token.isCommand("\\\\") || token.isCommand("\\end");
    }

    private void skipWhitespace() {
        while (pos < tokens.size() && tokens.get(pos).kind() == Kind.WHITESPACE) {
            pos++;
        }
    }

    private LatexToken peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private LatexToken consume() {
        return pos < tokens.size() ? tokens.get(pos++) : null;
    }

    private void pushBack(String text) {
        if (!text.isEmpty()) {
            tokens.add(pos, new LatexToken(Kind.TEXT, text));
        }
    }
}
