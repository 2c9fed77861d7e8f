package org.dxworks.manuscript.docx;

import org.dxworks.manuscript.model.Frontmatter;

/**
 * Font names, sizes and code block colors resolved from frontmatter. Sizes are in half-points.
 */
public record StyleSettings(String font, int bodySize, String codeFont, int codeSize,
                            String codeBackgroundColor, String codeFontColor, Integer codeBlockInsetTwips) {

    public static final String DEFAULT_FONT = "Calibri";
    public static final String DEFAULT_CODE_FONT = "Consolas";
    public static final int DEFAULT_BODY_SIZE = 22;
    public static final int DEFAULT_CODE_SIZE = 20;
    public static final int TITLE_SIZE = 56;
    private static final int[] HEADING_SIZES = {32, 26, 24, 22, 22, 22};
    private static final int CODE_SIZE_OFFSET = 2;

    public static StyleSettings from(Frontmatter frontmatter) {
        int body = frontmatter.fontSize == null ? DEFAULT_BODY_SIZE : halfPoints(frontmatter.fontSize);
        int code;
        if (frontmatter.codeFontSize != null) {
            code = halfPoints(frontmatter.codeFontSize);
        } else if (frontmatter.fontSize != null) {
            code = Math.max(1, body - CODE_SIZE_OFFSET);
        } else {
            code = DEFAULT_CODE_SIZE;
        }
        Integer inset = frontmatter.codeBlockInset == null ? null : (int) Math.round(frontmatter.codeBlockInset * 20);
        return new StyleSettings(
                frontmatter.font == null ? DEFAULT_FONT : frontmatter.font,
                body,
                frontmatter.codeFont == null ? DEFAULT_CODE_FONT : frontmatter.codeFont,
                code,
                frontmatter.codeBackgroundColor,
                frontmatter.codeFontColor,
                inset);
    }

    public int titleSize() {
        return scaled(TITLE_SIZE);
    }

    /** Size of heading {@code level} (1-6), scaled with the body size. */
    public int headingSize(int level) {
        return scaled(HEADING_SIZES[Math.min(Math.max(level, 1), 6) - 1]);
    }

    private int scaled(int defaultSize) {
        return (int) Math.round(defaultSize * (double) bodySize / DEFAULT_BODY_SIZE);
    }

    private static int halfPoints(double points) {
        return Math.max(1, (int) Math.round(points * 2));
    }
}
