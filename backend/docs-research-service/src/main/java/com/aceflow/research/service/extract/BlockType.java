package com.aceflow.research.service.extract;

public enum BlockType {
    HEADING,
    PARAGRAPH,
    LIST_ITEM,
    CODE,
    /** callout / admonition box (note, warning, caution ...) */
    ADMONITION
}
