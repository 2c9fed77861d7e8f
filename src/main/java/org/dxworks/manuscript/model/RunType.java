package org.dxworks.manuscript.model;

public enum RunType {
    TEXT,
    CODE,
    MATH,
    CITATION,
    CRITIC_ADDITION,
    CRITIC_DELETION,
    CRITIC_SUBSTITUTION,
    CRITIC_HIGHLIGHT,
    CRITIC_COMMENT,
    COMMENT_RANGE_START,
    COMMENT_RANGE_END,
    HIGHLIGHT,
    FOOTNOTE_REFERENCE,
    IMAGE,
    SOFT_BREAK,
    HTML_COMMENT
}
