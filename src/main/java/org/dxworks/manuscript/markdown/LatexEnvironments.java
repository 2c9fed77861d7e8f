package org.dxworks.manuscript.markdown;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wraps bare display environments such as {@code \begin{aligned} ... \end{aligned}} written outside
 * of {@code $$} delimiters, so they are picked up as display math.
 */
public final class LatexEnvironments {

    public static final Set<String> DISPLAY_ENVIRONMENTS = Set.of(
            "equation", "equation*", "align", "align*", "aligned", "gather", "gather*", "gathered",
            "split", "multline", "multline*", "flalign", "flalign*", "alignat", "alignat*", "cases",
            "matrix", "smallmatrix", "pmatrix", "bmatrix", "Bmatrix", "vmatrix", "Vmatrix", "subequations");

    private static final Pattern BEGIN = Pattern.compile("(?m)^[ \\t]*\\\\begin\\{([a-zA-Z]+\\*?)}");

    private LatexEnvironments() {}

    public static String wrapBareEnvironments(String text) {
        if (!text.contains("\\begin{")) {
            return text;
        }
        InertZones zones = InertZones.compute(text);
        Matcher matcher = BEGIN.matcher(text);
        StringBuilder sb = new StringBuilder(text.length() + 16);
        int cursor = 0;
        while (matcher.find(cursor)) {
            String environment = matcher.group(1);
            int start = matcher.start();
            String endMarker = "\\end{" + environment + "}";
            int end = text.indexOf(endMarker, matcher.end());
            if (!DISPLAY_ENVIRONMENTS.contains(environment) || end < 0 || zones.isInert(matcher.start(1))) {
                sb.append(text, cursor, matcher.end());
                cursor = matcher.end();
                continue;
            }
            int blockEnd = end + endMarker.length();
            sb.append(text, cursor, start);
            sb.append("$$\n").append(text, start, blockEnd).append("\n$$");
            cursor = blockEnd;
        }
        sb.append(text, cursor, text.length());
        return sb.toString();
    }
}
