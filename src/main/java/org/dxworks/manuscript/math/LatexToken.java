package org.dxworks.manuscript.math;

public record LatexToken(Kind kind, String value) {

    public enum Kind {
        COMMAND,
        LBRACE,
        RBRACE,
        CARET,
        UNDERSCORE,
        AMPERSAND,
        TEXT,
        WHITESPACE,
        COMMENT
    }

    public boolean isCommand(String name) {
        return kind == Kind.COMMAND && value.equals(name);
    }
}
