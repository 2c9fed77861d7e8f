package org.dxworks.manuscript.model;

/**
 * Character formatting flags carried by text-like runs.
 */
public record RunFormatting(boolean bold, boolean italic, boolean underline,
                            boolean strikethrough, boolean superscript, boolean subscript) {

    public static final RunFormatting NONE = new RunFormatting(false, false, false, false, false, false);

    public RunFormatting withBold() {
        return new RunFormatting(true, italic, underline, strikethrough, superscript, subscript);
    }

    public RunFormatting withItalic() {
        return new RunFormatting(bold, true, underline, strikethrough, superscript, subscript);
    }

    public RunFormatting withUnderline() {
        return new RunFormatting(bold, italic, true, strikethrough, superscript, subscript);
    }

    public RunFormatting withStrikethrough() {
        return new RunFormatting(bold, italic, underline, true, superscript, subscript);
    }

    public RunFormatting withSuperscript() {
        return new RunFormatting(bold, italic, underline, strikethrough, true, false);
    }

    public RunFormatting withSubscript() {
        return new RunFormatting(bold, italic, underline, strikethrough, false, true);
    }

    /** Flags set on either side win. */
    public RunFormatting merge(RunFormatting other) {
        return new RunFormatting(bold || other.bold, italic || other.italic, underline || other.underline,
                strikethrough || other.strikethrough, superscript || other.superscript,
                subscript || other.subscript);
    }

    public boolean isPlain() {
        return this.equals(NONE);
    }
}
