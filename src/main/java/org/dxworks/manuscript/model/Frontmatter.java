package org.dxworks.manuscript.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Document settings from the leading YAML block of a manuscript. Fields that failed validation stay null.
 */
public class Frontmatter {
    public List<String> titles = new ArrayList<>();
    public String author;
    public String csl;
    public String locale;
    public NoteType noteType;
    public String timezone;         // +HH:MM or -HH:MM
    public String bibliography;
    public String font;
    public Double fontSize;         // points
    public String codeFont;
    public Double codeFontSize;     // points
    public String codeBackgroundColor; // RRGGBB
    public String codeFontColor;    // RRGGBB
    public Double codeBlockInset;   // points

    public boolean isEmpty() {
        return titles.isEmpty() && author == null && csl == null && locale == null && noteType == null
                && timezone == null && bibliography == null && font == null && fontSize == null
                && codeFont == null && codeFontSize == null && codeBackgroundColor == null
                && codeFontColor == null && codeBlockInset == null;
    }
}
