package com.aceflow.research.dto;

import com.aceflow.research.entity.BundleStatus;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.FetchStatus;
import com.aceflow.research.entity.IncompleteReason;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The research bundle of one pipeline run.
 *
 * Each run owns its bundle. The pipeline threads it through as a value and the only
 * change after aggregation is {@link #withCoverage}, applied by the validator step
 * before the writer persists it.
 *
 * @param passes       supplemental passes executed (0 when the initial pass was enough)
 * @param scoreHistory overall score after the initial pass and after every supplemental pass
 */
@Builder(toBuilder = true)
public record ResearchBundle(
        String runId,
        ResearchRequest request,
        Instant startedAt,
        List<FetchTarget> targets,
        List<FetchResult> fetchResults,
        Map<DocCategory, List<ExtractedPattern>> patterns,
        Map<DocCategory, List<Gotcha>> gotchas,
        CoverageReport coverage,
        double overallScore,
        BundleStatus status,
        IncompleteReason incompleteReason,
        int passes,
        List<Double> scoreHistory
) {
    public ResearchBundle {
        targets = targets == null ? List.of() : List.copyOf(targets);
        fetchResults = fetchResults == null ? List.of() : List.copyOf(fetchResults);
        patterns = freeze(patterns);
        gotchas = freeze(gotchas);
        scoreHistory = scoreHistory == null ? List.of() : List.copyOf(scoreHistory);
        status = status == null ? BundleStatus.INCOMPLETE : status;
        verifyProvenance(fetchResults, patterns, gotchas);
    }

    /**
     * Attach a coverage evaluation; the result is the finalized view of this bundle.
     */
    public ResearchBundle withCoverage(CoverageReport report, IncompleteReason reason) {
        return toBuilder()
                .coverage(report)
                .overallScore(report.overallScore())
                .status(report.status())
                .incompleteReason(report.isComplete() ? null : reason)
                .build();
    }

    public List<ExtractedPattern> patternsOf(DocCategory category) {
        return patterns.getOrDefault(category, List.of());
    }

    public List<Gotcha> gotchasOf(DocCategory category) {
        return gotchas.getOrDefault(category, List.of());
    }

    public long countByStatus(FetchStatus fetchStatus) {
        return fetchResults.stream().filter(r -> r.status() == fetchStatus).count();
    }

    private static <T> Map<DocCategory, List<T>> freeze(Map<DocCategory, List<T>> source) {
        EnumMap<DocCategory, List<T>> copy = new EnumMap<>(DocCategory.class);
        if (source != null) {
            source.forEach((category, items) -> copy.put(category, List.copyOf(items)));
        }
        return Collections.unmodifiableMap(copy);
    }

    // Every fragment must point at an OK fetch result of this bundle.
    private static void verifyProvenance(List<FetchResult> fetchResults,
                                         Map<DocCategory, List<ExtractedPattern>> patterns,
                                         Map<DocCategory, List<Gotcha>> gotchas) {
        Set<String> okUrls = fetchResults.stream()
                .filter(FetchResult::isOk)
                .map(FetchResult::url)
                .collect(Collectors.toSet());
        patterns.values().stream().flatMap(List::stream)
                .filter(p -> !okUrls.contains(p.sourceUrl()))
                .findFirst()
                .ifPresent(p -> {
                    throw new IllegalStateException("Pattern references a URL without an OK fetch result: " + p.sourceUrl());
                });
        gotchas.values().stream().flatMap(List::stream)
                .filter(g -> !okUrls.contains(g.sourceUrl()))
                .findFirst()
                .ifPresent(g -> {
                    throw new IllegalStateException("Gotcha references a URL without an OK fetch result: " + g.sourceUrl());
                });
    }
}
