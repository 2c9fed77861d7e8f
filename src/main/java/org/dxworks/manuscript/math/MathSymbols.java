package org.dxworks.manuscript.math;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup tables shared by both translation directions. Where several commands share a character, the first
 * one registered is the one written back.
 */
public final class MathSymbols {

    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();
    private static final Map<String, String> SYMBOL_COMMANDS = new LinkedHashMap<>();
    private static final Map<String, String> ACCENTS = new LinkedHashMap<>();
    private static final Map<String, String> ACCENT_COMMANDS = new LinkedHashMap<>();
    private static final Map<String, String> NARY = new LinkedHashMap<>();
    private static final Map<String, String> NARY_COMMANDS = new LinkedHashMap<>();
    private static final Map<String, String> SPACING = new LinkedHashMap<>();
    private static final Map<String, String> SPACING_COMMANDS = new LinkedHashMap<>();
    private static final Map<String, String> DELIMITERS = new LinkedHashMap<>();
    private static final Map<String, String> DELIMITER_COMMANDS = new LinkedHashMap<>();
    private static final Map<String, String> DOUBLE_STRUCK = new LinkedHashMap<>();

    /** Characters written with a backslash escape in LaTeX. */
    public static final String ESCAPED_CHARACTERS = "{}%&#$_";

    public static final Set<String> FUNCTIONS = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "lim", "max", "min",
            "sup", "inf", "det", "dim", "gcd", "deg", "arg", "hom", "ker", "Pr");

    /** Functions whose subscript is set below the name. */
    public static final Set<String> LIMIT_FUNCTIONS = Set.of("lim", "max", "min", "sup", "inf", "det", "gcd", "Pr");

    /** Commands that only change the rendering size or style and have no OMML counterpart. */
    public static final Set<String> IGNORED_COMMANDS = Set.of(
            "\\displaystyle", "\\textstyle", "\\scriptstyle", "\\scriptscriptstyle",
            "\\big", "\\Big", "\\bigg", "\\Bigg", "\\bigl", "\\bigr", "\\Bigl", "\\Bigr",
            "\\biggl", "\\biggr", "\\Biggl", "\\Biggr", "\\middle", "\\limits", "\\nolimits",
            "\\!", "\\nonumber", "\\notag", "\\\\");

    static {
        symbol("\\alpha", "α");
        symbol("\\beta", "β");
        symbol("\\gamma", "γ");
        symbol("\\delta", "δ");
        symbol("\\epsilon", "ε");
        symbol("\\varepsilon", "ϵ");
        symbol("\\zeta", "ζ");
        symbol("\\eta", "η");
        symbol("\\theta", "θ");
        symbol("\\vartheta", "ϑ");
        symbol("\\iota", "ι");
        symbol("\\kappa", "κ");
        symbol("\\lambda", "λ");
        symbol("\\mu", "μ");
        symbol("\\nu", "ν");
        symbol("\\xi", "ξ");
        symbol("\\pi", "π");
        symbol("\\varpi", "ϖ");
        symbol("\\rho", "ρ");
        symbol("\\varrho", "ϱ");
        symbol("\\sigma", "σ");
        symbol("\\varsigma", "ς");
        symbol("\\tau", "τ");
        symbol("\\upsilon", "υ");
        symbol("\\phi", "φ");
        symbol("\\varphi", "ϕ");
        symbol("\\chi", "χ");
        symbol("\\psi", "ψ");
        symbol("\\omega", "ω");
        symbol("\\Gamma", "Γ");
        symbol("\\Delta", "Δ");
        symbol("\\Theta", "Θ");
        symbol("\\Lambda", "Λ");
        symbol("\\Xi", "Ξ");
        symbol("\\Pi", "Π");
        symbol("\\Sigma", "Σ");
        symbol("\\Upsilon", "Υ");
        symbol("\\Phi", "Φ");
        symbol("\\Psi", "Ψ");
        symbol("\\Omega", "Ω");

        symbol("\\times", "×");
        symbol("\\div", "÷");
        symbol("\\pm", "±");
        symbol("\\mp", "∓");
        symbol("\\leq", "≤");
        symbol("\\le", "≤");
        symbol("\\geq", "≥");
        symbol("\\ge", "≥");
        symbol("\\neq", "≠");
        symbol("\\ne", "≠");
        symbol("\\approx", "≈");
        symbol("\\equiv", "≡");
        symbol("\\sim", "∼");
        symbol("\\simeq", "≃");
        symbol("\\cong", "≅");
        symbol("\\propto", "∝");
        symbol("\\ll", "≪");
        symbol("\\gg", "≫");
        symbol("\\infty", "∞");
        symbol("\\partial", "∂");
        symbol("\\nabla", "∇");
        symbol("\\in", "∈");
        symbol("\\notin", "∉");
        symbol("\\ni", "∋");
        symbol("\\subset", "⊂");
        symbol("\\supset", "⊃");
        symbol("\\subseteq", "⊆");
        symbol("\\supseteq", "⊇");
        symbol("\\cup", "∪");
        symbol("\\cap", "∩");
        symbol("\\setminus", "∖");
        symbol("\\emptyset", "∅");
        symbol("\\varnothing", "∅");
        symbol("\\to", "→");
        symbol("\\rightarrow", "→");
        symbol("\\leftarrow", "←");
        symbol("\\gets", "←");
        symbol("\\uparrow", "↑");
        symbol("\\downarrow", "↓");
        symbol("\\leftrightarrow", "↔");
        symbol("\\Rightarrow", "⇒");
        symbol("\\Leftarrow", "⇐");
        symbol("\\Leftrightarrow", "⇔");
        symbol("\\implies", "⟹");
        symbol("\\iff", "⟺");
        symbol("\\mapsto", "↦");
        symbol("\\forall", "∀");
        symbol("\\exists", "∃");
        symbol("\\neg", "¬");
        symbol("\\lnot", "¬");
        symbol("\\land", "∧");
        symbol("\\wedge", "∧");
        symbol("\\lor", "∨");
        symbol("\\vee", "∨");
        symbol("\\oplus", "⊕");
        symbol("\\otimes", "⊗");
        symbol("\\cdot", "·");
        symbol("\\circ", "∘");
        symbol("\\bullet", "∙");
        symbol("\\star", "⋆");
        symbol("\\ast", "∗");
        symbol("\\ldots", "…");
        symbol("\\dots", "…");
        symbol("\\cdots", "⋯");
        symbol("\\vdots", "⋮");
        symbol("\\ddots", "⋱");
        symbol("\\prime", "′");
        symbol("\\angle", "∠");
        symbol("\\perp", "⊥");
        symbol("\\parallel", "∥");
        symbol("\\mid", "∣");
        symbol("\\hbar", "ℏ");
        symbol("\\ell", "ℓ");
        symbol("\\Re", "ℜ");
        symbol("\\Im", "ℑ");
        symbol("\\aleph", "ℵ");
        symbol("\\langle", "⟨");
        symbol("\\rangle", "⟩");
        symbol("\\lfloor", "⌊");
        symbol("\\rfloor", "⌋");
        symbol("\\lceil", "⌈");
        symbol("\\rceil", "⌉");

        accent("\\hat", "\u0302");
        accent("\\widehat", "\u0302");
        accent("\\bar", "\u0305");
        accent("\\overline", "\u0305");
        accent("\\dot", "\u0307");
        accent("\\ddot", "\u0308");
        accent("\\check", "\u030C");
        accent("\\tilde", "\u0303");
        accent("\\widetilde", "\u0303");
        accent("\\vec", "\u20D7");
        // spacing accents used by older documents
        ACCENT_COMMANDS.putIfAbsent("ˆ", "\\hat");
        ACCENT_COMMANDS.putIfAbsent("^", "\\hat");
        ACCENT_COMMANDS.putIfAbsent("¯", "\\bar");
        ACCENT_COMMANDS.putIfAbsent("˙", "\\dot");
        ACCENT_COMMANDS.putIfAbsent("¨", "\\ddot");
        ACCENT_COMMANDS.putIfAbsent("ˇ", "\\check");
        ACCENT_COMMANDS.putIfAbsent("~", "\\tilde");
        ACCENT_COMMANDS.putIfAbsent("˜", "\\tilde");
        ACCENT_COMMANDS.putIfAbsent("→", "\\vec");

        nary("\\sum", "∑");
        nary("\\prod", "∏");
        nary("\\coprod", "∐");
        nary("\\int", "∫");
        nary("\\iint", "∬");
        nary("\\iiint", "∭");
        nary("\\oint", "∮");
        nary("\\bigcup", "⋃");
        nary("\\bigcap", "⋂");

        spacing("\\,", "\u2009");
        spacing("\\:", "\u205F");
        spacing("\\>", "\u205F");
        spacing("\\;", "\u2004");
        spacing("\\quad", "\u2003");
        spacing("\\ ", "\u00A0");

        delimiter("(", "(");
        delimiter(")", ")");
        delimiter("[", "[");
        delimiter("]", "]");
        delimiter("|", "|");
        delimiter(".", "");
        delimiter("\\{", "{");
        delimiter("\\}", "}");
        delimiter("\\lbrace", "{");
        delimiter("\\rbrace", "}");
        delimiter("\\|", "‖");
        delimiter("\\Vert", "‖");
        delimiter("\\lVert", "‖");
        delimiter("\\rVert", "‖");
        delimiter("\\vert", "|");
        delimiter("\\lvert", "|");
        delimiter("\\rvert", "|");
        delimiter("\\langle", "⟨");
        delimiter("\\rangle", "⟩");
        delimiter("\\lfloor", "⌊");
        delimiter("\\rfloor", "⌋");
        delimiter("\\lceil", "⌈");
        delimiter("\\rceil", "⌉");
        delimiter("\\lbrack", "[");
        delimiter("\\rbrack", "]");

        DOUBLE_STRUCK.put("R", "ℝ");
        DOUBLE_STRUCK.put("N", "ℕ");
        DOUBLE_STRUCK.put("Z", "ℤ");
        DOUBLE_STRUCK.put("Q", "ℚ");
        DOUBLE_STRUCK.put("C", "ℂ");
        DOUBLE_STRUCK.put("P", "ℙ");
        DOUBLE_STRUCK.put("H", "ℍ");
    }

    private MathSymbols() {}

    private static void symbol(String command, String character) {
        SYMBOLS.put(command, character);
        SYMBOL_COMMANDS.putIfAbsent(character, command);
    }

    private static void accent(String command, String character) {
        ACCENTS.put(command, character);
        ACCENT_COMMANDS.putIfAbsent(character, command);
    }

    private static void nary(String command, String character) {
        NARY.put(command, character);
        NARY_COMMANDS.putIfAbsent(character, command);
    }

    private static void spacing(String command, String character) {
        SPACING.put(command, character);
        SPACING_COMMANDS.putIfAbsent(character, command);
    }

    private static void delimiter(String source, String character) {
        DELIMITERS.put(source, character);
        DELIMITER_COMMANDS.putIfAbsent(character, source);
    }

    public static Optional<String> symbol(String command) {
        return Optional.ofNullable(SYMBOLS.get(command));
    }

    public static Optional<String> symbolCommand(String character) {
        return Optional.ofNullable(SYMBOL_COMMANDS.get(character));
    }

    public static Optional<String> accent(String command) {
        return Optional.ofNullable(ACCENTS.get(command));
    }

    public static Optional<String> accentCommand(String character) {
        return Optional.ofNullable(ACCENT_COMMANDS.get(character));
    }

    public static Optional<String> nary(String command) {
        return Optional.ofNullable(NARY.get(command));
    }

    public static Optional<String> naryCommand(String character) {
        return Optional.ofNullable(NARY_COMMANDS.get(character));
    }

    /** Integrals put their limits beside the sign, every other n-ary operator above and below. */
    public static boolean limitsAboveByDefault(String character) {
        return !"∫∬∭∮".contains(character);
    }

    public static Optional<String> spacing(String command) {
        return Optional.ofNullable(SPACING.get(command));
    }

    public static Optional<String> spacingCommand(String character) {
        return Optional.ofNullable(SPACING_COMMANDS.get(character));
    }

    /** Delimiter character for a {@code \left}/{@code \right} argument; {@code .} is the empty delimiter. */
    public static Optional<String> delimiter(String source) {
        return Optional.ofNullable(DELIMITERS.get(source));
    }

    public static String delimiterSource(String character) {
        String source = DELIMITER_COMMANDS.get(character);
        if (source != null) {
            return source;
        }
        return character.isEmpty() ? "." : character;
    }

    public static Optional<String> doubleStruck(String letter) {
        return Optional.ofNullable(DOUBLE_STRUCK.get(letter));
    }

    public static Optional<String> doubleStruckLetter(String character) {
        for (Map.Entry<String, String> entry : DOUBLE_STRUCK.entrySet()) {
            if (entry.getValue().equals(character)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }
}
