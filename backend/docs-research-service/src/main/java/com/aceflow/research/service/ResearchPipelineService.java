package com.aceflow.research.service;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CoverageReport;
import com.aceflow.research.dto.DocumentExtraction;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.FetchResult;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.dto.ResearchBundle;
import com.aceflow.research.dto.ResearchOutcome;
import com.aceflow.research.dto.ResearchRequest;
import com.aceflow.research.entity.FetchFailureReason;
import com.aceflow.research.entity.IncompleteReason;
import com.aceflow.research.service.aggregate.AggregatedResearch;
import com.aceflow.research.service.aggregate.ResearchAggregator;
import com.aceflow.research.service.extract.ContentExtractionService;
import com.aceflow.research.service.fetch.DocumentFetchService;
import com.aceflow.research.service.resolver.TargetResolverService;
import com.aceflow.research.service.validation.CompletenessValidator;
import com.aceflow.research.service.validation.CoverageRequirements;
import com.aceflow.research.service.writer.BundleWriterService;
import com.aceflow.research.util.UrlUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Research Pipeline Orchestrator
 *
 * resolve -> fetch -> extract -> aggregate -> validate 를 수행하고, 커버리지가 부족하면
 * 보충 resolve/fetch 패스를 supplementalPassLimit 번까지 반복한 뒤 번들을 기록합니다.
 *
 * 1. 출력 경로 쓰기 가능 여부 확인 (실패 시 fetch 전에 FatalConfigException)
 * 2. 초기 대상 resolve, 필수 신호 고정
 * 3. 패스 반복: fetch, 추출, 집계, 평가
 * 4. 중단 조건: complete / 패스 한도 / 새 대상 없음 / 취소 또는 실행 타임아웃
 * 5. 최종 번들 기록 (incomplete도 기록됨)
 *
 * 개별 fetch/추출 실패는 실행을 중단하지 않습니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchPipelineService {

    public static final String MDC_RUN_ID = "runId";

    private final TargetResolverService resolver;
    private final DocumentFetchService fetchService;
    private final ContentExtractionService extractionService;
    private final ResearchAggregator aggregator;
    private final CompletenessValidator validator;
    private final BundleWriterService bundleWriter;
    private final ResearchProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Runs with the configured overall timeout.
     */
    public ResearchOutcome run(ResearchRequest request) {
        return run(request, RunCancellation.withTimeout(properties.getRun().getTimeout(), clock));
    }

    public ResearchOutcome run(ResearchRequest request, RunCancellation cancellation) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(runId, request, cancellation);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    /**
     * Resolves the initial targets without fetching anything (dry run).
     */
    public List<FetchTarget> plan(ResearchRequest request) {
        return resolver.resolve(request);
    }

    private ResearchOutcome execute(String runId, ResearchRequest request, RunCancellation cancellation) {
        Instant startedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        log.info("Research run started: request={}, bypassCache={}", request.describe(), request.bypassCache());

        bundleWriter.checkWritable(request);
        List<FetchTarget> initialTargets = resolver.resolve(request);
        CoverageRequirements requirements = CoverageRequirements.fromTargets(initialTargets);

        List<FetchTarget> allTargets = new ArrayList<>();
        Map<String, FetchResult> resultsByUrl = new LinkedHashMap<>();
        Map<String, DocumentExtraction> extractionsByUrl = new TreeMap<>();
        List<Double> scoreHistory = new ArrayList<>();

        List<FetchTarget> pending = initialTargets;
        int passes = 0;
        IncompleteReason incompleteReason;
        CoverageReport report;

        while (true) {
            allTargets.addAll(pending);
            List<FetchResult> results = fetchService.fetchAll(pending, cancellation, request.bypassCache());
            results.forEach(r -> resultsByUrl.put(UrlUtils.normalize(r.url()), r));
            extractionService.extractAll(results).forEach(x -> extractionsByUrl.put(x.sourceUrl(), x));

            // evidence only accumulates across passes, so the score cannot drop
            report = validator.evaluate(requirements, allPatterns(extractionsByUrl), allGotchas(extractionsByUrl));
            scoreHistory.add(report.overallScore());
            log.info("Pass {} evaluated: overallScore={}, status={}", passes, report.overallScore(),
                    report.status().getCode());

            if (report.isComplete()) {
                incompleteReason = null;
                break;
            }
            if (cancellation.isCancelled()) {
                incompleteReason = cancellation.reason() == FetchFailureReason.RUN_DEADLINE
                        ? IncompleteReason.RUN_TIMEOUT
                        : IncompleteReason.CANCELLED;
                log.warn("Run stopped early: {}", incompleteReason.getDescription());
                break;
            }
            if (passes >= properties.getResolver().getSupplementalPassLimit()) {
                incompleteReason = IncompleteReason.SUPPLEMENTAL_PASS_LIMIT;
                break;
            }
            List<FetchTarget> supplemental = resolver.resolveSupplemental(request, report.underCovered(),
                    resultsByUrl.keySet(), extractionsByUrl.values());
            if (supplemental.isEmpty()) {
                incompleteReason = IncompleteReason.NO_NEW_TARGETS;
                break;
            }
            passes++;
            pending = supplemental;
        }

        AggregatedResearch aggregated = aggregator.aggregate(new ArrayList<>(extractionsByUrl.values()));
        ResearchBundle bundle = ResearchBundle.builder()
                .runId(runId)
                .request(request)
                .startedAt(startedAt)
                .targets(allTargets)
                .fetchResults(new ArrayList<>(resultsByUrl.values()))
                .patterns(aggregated.patterns())
                .gotchas(aggregated.gotchas())
                .passes(passes)
                .scoreHistory(scoreHistory)
                .build()
                .withCoverage(report, incompleteReason);

        Path outputPath = bundleWriter.write(bundle);
        recordRun(bundle);

        log.info("Research run finished: status={}, overallScore={}, passes={}, targets={}, patterns={}, gotchas={}, elapsed={}ms",
                bundle.status().getCode(), bundle.overallScore(), passes, allTargets.size(),
                aggregated.patternCount(), aggregated.gotchaCount(),
                Duration.between(startedAt, clock.instant()).toMillis());
        return ResearchOutcome.written(bundle, outputPath);
    }

    private static List<ExtractedPattern> allPatterns(Map<String, DocumentExtraction> extractions) {
        return extractions.values().stream().flatMap(x -> x.patterns().stream()).toList();
    }

    private static List<Gotcha> allGotchas(Map<String, DocumentExtraction> extractions) {
        return extractions.values().stream().flatMap(x -> x.gotchas().stream()).toList();
    }

    private void recordRun(ResearchBundle bundle) {
        Counter.builder("research.runs")
                .description("Finished research runs by bundle status")
                .tag("status", bundle.status().getCode())
                .register(meterRegistry)
                .increment();
    }
}
