package com.aceflow.research.dto;

import com.aceflow.research.entity.DocCategory;

/**
 * Reusable code fragment lifted from a fetched page.
 *
 * @param description the prose immediately preceding the code block
 * @param example     true when the surrounding text presents the code as a usage example
 */
public record ExtractedPattern(
        String sourceUrl,
        DocCategory category,
        String topic,
        String codeText,
        String description,
        String language,
        boolean example
) {
}
