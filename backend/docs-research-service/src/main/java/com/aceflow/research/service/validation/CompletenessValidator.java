package com.aceflow.research.service.validation;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CategoryCoverage;
import com.aceflow.research.dto.CoverageReport;
import com.aceflow.research.dto.CoverageSignal;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.entity.BundleStatus;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.SignalKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 커버리지 / 완결성 검증 서비스
 *
 * 카테고리별 점수 = 관측된 필수 신호 수 / 필수 신호 수 (최대 1.0)
 * 전체 점수 = 카테고리 우선순위 가중 평균 (critical 3, important 2, supplementary 1)
 *
 * 완료 조건:
 * 1. 전체 점수 >= completenessThreshold (기본 0.85)
 * 2. critical 카테고리 중 criticalFloor (기본 0.6) 미만이 없음
 *
 * 신호는 카테고리와 토픽 단위로만 인정되며 다른 카테고리의 요구사항을 채우지 않습니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompletenessValidator {

    private final ResearchProperties properties;

    public CoverageReport evaluate(CoverageRequirements requirements,
                                   Collection<ExtractedPattern> patterns,
                                   Collection<Gotcha> gotchas) {
        Map<DocCategory, SortedSet<CoverageSignal>> observed = observedSignals(requirements, patterns, gotchas);

        List<CategoryCoverage> coverages = new ArrayList<>();
        for (DocCategory category : DocCategory.values()) {
            SortedSet<CoverageSignal> required = requirements.requiredFor(category);
            if (required.isEmpty()) {
                continue;
            }
            SortedSet<CoverageSignal> seen = observed.getOrDefault(category, new TreeSet<>());
            double score = round(Math.min(1.0, (double) seen.size() / required.size()));
            coverages.add(new CategoryCoverage(category, requirements.priorityOf(category), required, seen, score));
        }

        double overall = overallScore(coverages);
        BundleStatus status = decideStatus(overall, coverages);
        CoverageReport report = new CoverageReport(coverages, overall, status, threshold(), criticalFloor());

        log.info("Coverage evaluated: overall={}, status={}, categories={}", overall, status.getCode(),
                coverages.stream().map(c -> c.category().getCode() + "=" + c.score()).toList());
        if (!report.isComplete()) {
            log.info("Missing areas: {}", report.missingAreas());
        }
        return report;
    }

    /**
     * complete iff the overall score reaches the threshold and no critical category is
     * below the floor, however strong the other categories are.
     */
    public BundleStatus decideStatus(double overallScore, List<CategoryCoverage> coverages) {
        if (coverages.isEmpty() || overallScore < threshold()) {
            return BundleStatus.INCOMPLETE;
        }
        boolean criticalBelowFloor = coverages.stream()
                .anyMatch(c -> c.isCritical() && c.score() < criticalFloor());
        return criticalBelowFloor ? BundleStatus.INCOMPLETE : BundleStatus.COMPLETE;
    }

    double overallScore(List<CategoryCoverage> coverages) {
        double weighted = 0.0;
        int totalWeight = 0;
        for (CategoryCoverage coverage : coverages) {
            int weight = coverage.priority().getWeight();
            weighted += coverage.score() * weight;
            totalWeight += weight;
        }
        return totalWeight == 0 ? 0.0 : round(weighted / totalWeight);
    }

    private Map<DocCategory, SortedSet<CoverageSignal>> observedSignals(CoverageRequirements requirements,
                                                                        Collection<ExtractedPattern> patterns,
                                                                        Collection<Gotcha> gotchas) {
        Map<DocCategory, SortedSet<CoverageSignal>> observed = new EnumMap<>(DocCategory.class);
        for (ExtractedPattern pattern : patterns) {
            observe(observed, requirements, pattern.category(), new CoverageSignal(pattern.topic(), SignalKind.HAS_PATTERN));
            if (pattern.example()) {
                observe(observed, requirements, pattern.category(), new CoverageSignal(pattern.topic(), SignalKind.HAS_EXAMPLE));
            }
        }
        for (Gotcha gotcha : gotchas) {
            observe(observed, requirements, gotcha.category(), new CoverageSignal(gotcha.topic(), SignalKind.HAS_GOTCHA));
        }
        return observed;
    }

    private static void observe(Map<DocCategory, SortedSet<CoverageSignal>> observed,
                                CoverageRequirements requirements, DocCategory category, CoverageSignal signal) {
        if (requirements.requires(category, signal)) {
            observed.computeIfAbsent(category, c -> new TreeSet<>()).add(signal);
        }
    }

    private double threshold() {
        return properties.getValidation().getCompletenessThreshold();
    }

    private double criticalFloor() {
        return properties.getValidation().getCriticalFloor();
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
