package org.dxworks.manuscript.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites grid tables ({@code +---+---+} borders) as pipe tables before block parsing.
 * Lines of one row are joined with a space per cell. The first row becomes the pipe table header whether or not
 * a {@code +===+} separator follows it; further header rows above such a separator stay as body rows.
 */
public final class GridTables {

    private static final Pattern SEPARATOR = Pattern.compile("^\\+[-=]+(?:\\+[-=]+)*\\+$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}([`~]{3,})");
    private static final Pattern CELL_PREFIX = Pattern.compile("^\\s*\\|?\\s*");

    private GridTables() {}

    public static String toPipeTables(String text) {
        if (!text.contains("+-") && !text.contains("+=")) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        List<String> result = new ArrayList<>(lines.length);
        char fenceChar = 0;
        int fenceLength = 0;
        int i = 0;
        while (i < lines.length) {
            Matcher fence = FENCE.matcher(lines[i]);
            if (fence.find()) {
                String run = fence.group(1);
                if (fenceChar == 0) {
                    fenceChar = run.charAt(0);
                    fenceLength = run.length();
                } else if (run.charAt(0) == fenceChar && run.length() >= fenceLength) {
                    fenceChar = 0;
                }
                result.add(lines[i++]);
                continue;
            }
            if (fenceChar != 0 || !isSeparator(lines[i])) {
                result.add(lines[i++]);
                continue;
            }

            int start = i;
            while (i < lines.length && (isSeparator(lines[i]) || isContentLine(lines[i]))) {
                i++;
            }
            List<String> table = List.of(lines).subList(start, i);
            List<List<String>> rows = table.size() >= 3 && isSeparator(table.get(table.size() - 1))
                    ? parse(table) : null;
            if (rows == null || rows.isEmpty()) {
                result.addAll(table);
                continue;
            }
            if (!result.isEmpty() && !result.get(result.size() - 1).isBlank()) {
                result.add("");
            }
            appendPipeTable(rows, result);
            if (i < lines.length && !lines[i].isBlank()) {
                result.add("");
            }
        }
        return String.join("\n", result);
    }

    /** Cell texts per row, or null when the lines do not form a grid. */
    private static List<List<String>> parse(List<String> lines) {
        String first = lines.get(0);
        int indent = first.length() - first.stripLeading().length();
        String border = first.strip();
        List<Integer> boundaries = new ArrayList<>();
        for (int c = 0; c < border.length(); c++) {
            if (border.charAt(c) == '+') {
                boundaries.add(c + indent);
            }
        }
        if (boundaries.size() < 2) {
            return null;
        }

        List<List<String>> rows = new ArrayList<>();
        List<String> content = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            if (isSeparator(line)) {
                if (!content.isEmpty()) {
                    rows.add(cells(content, boundaries));
                    content.clear();
                }
            } else if (isContentLine(line)) {
                content.add(line);
            } else {
                return null;
            }
        }
        return rows;
    }

    private static List<String> cells(List<String> content, List<Integer> boundaries) {
        List<String> cells = new ArrayList<>();
        for (int column = 0; column + 1 < boundaries.size(); column++) {
            int left = boundaries.get(column) + 1;
            int right = boundaries.get(column + 1);
            List<String> pieces = new ArrayList<>();
            for (String line : content) {
                String raw = left >= line.length() ? ""
                        : line.substring(left, Math.min(right, line.length()));
                String piece = CELL_PREFIX.matcher(raw).replaceFirst("").stripTrailing();
                if (!piece.isEmpty()) {
                    pieces.add(piece);
                }
            }
            cells.add(String.join(" ", pieces));
        }
        return cells;
    }

    private static void appendPipeTable(List<List<String>> rows, List<String> out) {
        int columns = rows.get(0).size();
        out.add(pipeRow(rows.get(0)));
        out.add("|" + " --- |".repeat(columns));
        for (List<String> row : rows.subList(1, rows.size())) {
            out.add(pipeRow(row));
        }
    }

    private static String pipeRow(List<String> cells) {
        StringBuilder sb = new StringBuilder("|");
        for (String cell : cells) {
            sb.append(' ').append(escapePipes(cell)).append(" |");
        }
        return sb.toString();
    }

    private static String escapePipes(String cell) {
        StringBuilder sb = new StringBuilder(cell.length());
        for (int i = 0; i < cell.length(); i++) {
            char c = cell.charAt(i);
            if (c == '|' && (i == 0 || cell.charAt(i - 1) != '\\')) {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static boolean isSeparator(String line) {
        return SEPARATOR.matcher(line.strip()).matches();
    }

    private static boolean isContentLine(String line) {
        String trimmed = line.strip();
        return trimmed.startsWith("|") && trimmed.endsWith("|");
    }
}
