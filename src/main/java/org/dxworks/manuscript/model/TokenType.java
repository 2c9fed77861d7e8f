package org.dxworks.manuscript.model;

public enum TokenType {
    TITLE,
    PARAGRAPH,
    HEADING,
    LIST_ITEM,
    CODE_BLOCK,
    BLOCKQUOTE,
    ALERT_BOX,
    TABLE,
    THEMATIC_BREAK
}
