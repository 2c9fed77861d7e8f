package org.dxworks.manuscript.model;

import java.util.List;

/**
 * Block-level unit produced by the Markdown tokenizer. Immutable once created.
 */
public record Token(TokenType type,
                    int level,            // heading level, list nesting level or quote depth
                    boolean ordered,
                    Boolean checked,      // null unless the list item is a task item
                    String language,      // code block info string
                    String alertType,     // NOTE, TIP, IMPORTANT, WARNING, CAUTION
                    String code,          // literal code block text
                    List<List<TableCell>> rows,
                    List<Run> runs) {

    public Token {
        runs = runs == null ? List.of() : List.copyOf(runs);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static Token paragraph(List<Run> runs) {
        return new Token(TokenType.PARAGRAPH, 0, false, null, null, null, null, null, runs);
    }

    public static Token title(List<Run> runs) {
        return new Token(TokenType.TITLE, 0, false, null, null, null, null, null, runs);
    }

    public static Token heading(int level, List<Run> runs) {
        return new Token(TokenType.HEADING, level, false, null, null, null, null, null, runs);
    }

    public static Token listItem(int level, boolean ordered, Boolean checked, List<Run> runs) {
        return new Token(TokenType.LIST_ITEM, level, ordered, checked, null, null, null, null, runs);
    }

    public static Token codeBlock(String language, String code) {
        return new Token(TokenType.CODE_BLOCK, 0, false, null, language, null, code, null, List.of());
    }

    public static Token blockquote(int depth, List<Run> runs) {
        return new Token(TokenType.BLOCKQUOTE, depth, false, null, null, null, null, null, runs);
    }

    public static Token alertBox(String alertType, List<Run> runs) {
        return new Token(TokenType.ALERT_BOX, 1, false, null, null, alertType, null, null, runs);
    }

    public static Token table(List<List<TableCell>> rows) {
        return new Token(TokenType.TABLE, 0, false, null, null, null, null, rows, List.of());
    }

    public static Token thematicBreak() {
        return new Token(TokenType.THEMATIC_BREAK, 0, false, null, null, null, null, null, List.of());
    }
}
