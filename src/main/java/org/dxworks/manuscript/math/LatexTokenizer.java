package org.dxworks.manuscript.math;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits LaTeX math into commands, braces, script operators, alignment separators, whitespace and text.
 * A command is a backslash followed by letters, or by exactly one other character. An unescaped {@code %} starts a
 * comment that runs to the end of the line; it takes along the spaces before it on the same line.
 */
public final class LatexTokenizer {

    private LatexTokenizer() {}

    public static List<LatexToken> tokenize(String latex) {
        List<LatexToken> tokens = new ArrayList<>();
        int i = 0;
        int length = latex.length();
        while (i < length) {
            char c = latex.charAt(i);
            if (c == '\\') {
                if (i + 1 >= length) {
                    tokens.add(new LatexToken(LatexToken.Kind.TEXT, "\\"));
                    i++;
                } else if (isLetter(latex.charAt(i + 1))) {
                    int j = i + 1;
                    while (j < length && isLetter(latex.charAt(j))) {
                        j++;
                    }
                    tokens.add(new LatexToken(LatexToken.Kind.COMMAND, latex.substring(i, j)));
                    i = j;
                } else {
                    tokens.add(new LatexToken(LatexToken.Kind.COMMAND, latex.substring(i, i + 2)));
                    i += 2;
                }
            } else if (c == '{') {
                tokens.add(new LatexToken(LatexToken.Kind.LBRACE, "{"));
                i++;
            } else if (c == '}') {
                tokens.add(new LatexToken(LatexToken.Kind.RBRACE, "}"));
                i++;
            } else if (c == '^') {
                tokens.add(new LatexToken(LatexToken.Kind.CARET, "^"));
                i++;
            } else if (c == '_') {
                tokens.add(new LatexToken(LatexToken.Kind.UNDERSCORE, "_"));
                i++;
            } else if (c == '&') {
                tokens.add(new LatexToken(LatexToken.Kind.AMPERSAND, "&"));
                i++;
            } else if (c == '%') {
                int end = latex.indexOf('\n', i);
                end = end < 0 ? length : end + 1;
                tokens.add(new LatexToken(LatexToken.Kind.COMMENT, leadingSpaces(tokens) + latex.substring(i, end)));
                i = end;
            } else if (Character.isWhitespace(c)) {
                int j = i;
                while (j < length && Character.isWhitespace(latex.charAt(j))) {
                    j++;
                }
                tokens.add(new LatexToken(LatexToken.Kind.WHITESPACE, latex.substring(i, j)));
                i = j;
            } else {
                int j = i;
                while (j < length && !isSpecial(latex.charAt(j))) {
                    j++;
                }
                tokens.add(new LatexToken(LatexToken.Kind.TEXT, latex.substring(i, j)));
                i = j;
            }
        }
        return tokens;
    }

    /** Removes the same-line whitespace that ends the token list and returns it. */
    private static String leadingSpaces(List<LatexToken> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != LatexToken.Kind.WHITESPACE) {
            return "";
        }
        String whitespace = tokens.remove(tokens.size() - 1).value();
        int lineStart = whitespace.lastIndexOf('\n') + 1;
        if (lineStart > 0) {
            tokens.add(new LatexToken(LatexToken.Kind.WHITESPACE, whitespace.substring(0, lineStart)));
        }
        return whitespace.substring(lineStart);
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isSpecial(char c) {
        return c == '\\' || c == '{' || c == '}' || c == '^' || c == '_' || c == '&' || c == '%'
                || Character.isWhitespace(c);
    }
}
