package com.aceflow.research.service.aggregate;

import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.entity.DocCategory;

import java.util.List;
import java.util.Map;

/**
 * Category-grouped fragments of one run.
 *
 * @param duplicatesDropped patterns dropped because an identical one (same category and code) came first
 */
public record AggregatedResearch(
        Map<DocCategory, List<ExtractedPattern>> patterns,
        Map<DocCategory, List<Gotcha>> gotchas,
        int duplicatesDropped
) {
    public int patternCount() {
        return patterns.values().stream().mapToInt(List::size).sum();
    }

    public int gotchaCount() {
        return gotchas.values().stream().mapToInt(List::size).sum();
    }
}
