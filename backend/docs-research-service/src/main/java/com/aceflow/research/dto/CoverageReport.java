package com.aceflow.research.dto;

import com.aceflow.research.entity.BundleStatus;
import com.aceflow.research.entity.DocCategory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Validator output for one evaluation of a bundle.
 *
 * @param categories    coverage per category present in the target set, in category order
 * @param threshold     overall score needed for COMPLETE
 * @param criticalFloor minimum score for every critical category
 */
public record CoverageReport(
        List<CategoryCoverage> categories,
        double overallScore,
        BundleStatus status,
        double threshold,
        double criticalFloor
) {
    public CoverageReport {
        categories = List.copyOf(categories);
    }

    public boolean isComplete() {
        return status == BundleStatus.COMPLETE;
    }

    public Optional<CategoryCoverage> coverageOf(DocCategory category) {
        return categories.stream().filter(c -> c.category() == category).findFirst();
    }

    /**
     * Categories that feed the resolver's supplemental pass.
     */
    public List<CategoryCoverage> underCovered() {
        return categories.stream()
                .filter(c -> c.score() < threshold || (c.isCritical() && c.score() < criticalFloor))
                .filter(c -> !c.missingSignals().isEmpty())
                .toList();
    }

    /**
     * Human-readable missing areas, e.g. "core-framework/storage: has-example".
     */
    public List<String> missingAreas() {
        List<String> areas = new ArrayList<>();
        for (CategoryCoverage coverage : categories) {
            coverage.missingSignals().forEach(signal -> areas.add(
                    coverage.category().getCode() + "/" + signal.topic() + ": " + signal.kind().getCode()));
        }
        return areas;
    }
}
