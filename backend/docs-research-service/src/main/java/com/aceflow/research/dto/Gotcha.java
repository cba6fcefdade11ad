package com.aceflow.research.dto;

import com.aceflow.research.entity.DocCategory;

/**
 * Warning or pitfall lifted from a fetched page.
 *
 * @param indicator the lexicon entry (or "admonition") that triggered the match
 */
public record Gotcha(
        String sourceUrl,
        DocCategory category,
        String topic,
        String warningText,
        String nearbyContext,
        String indicator
) {
}
