package com.aceflow.research.service.extract;

/**
 * One block of a parsed document, in document order.
 *
 * @param language code language hint (CODE only), may be null
 * @param level    heading level (HEADING only), 0 otherwise
 * @param kind     admonition kind such as "warning" (ADMONITION only), may be null
 */
public record DocumentBlock(BlockType type, String text, String language, int level, String kind) {

    public static DocumentBlock heading(int level, String text) {
        return new DocumentBlock(BlockType.HEADING, text, null, level, null);
    }

    public static DocumentBlock paragraph(String text) {
        return new DocumentBlock(BlockType.PARAGRAPH, text, null, 0, null);
    }

    public static DocumentBlock listItem(String text) {
        return new DocumentBlock(BlockType.LIST_ITEM, text, null, 0, null);
    }

    public static DocumentBlock code(String text, String language) {
        return new DocumentBlock(BlockType.CODE, text, language, 0, null);
    }

    public static DocumentBlock admonition(String kind, String text) {
        return new DocumentBlock(BlockType.ADMONITION, text, null, 0, kind);
    }

    public boolean isProse() {
        return type == BlockType.PARAGRAPH || type == BlockType.LIST_ITEM;
    }
}
