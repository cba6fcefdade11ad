package com.aceflow.research.service.writer;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CategoryCoverage;
import com.aceflow.research.dto.CoverageReport;
import com.aceflow.research.dto.CoverageSignal;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.FetchResult;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.dto.ResearchBundle;
import com.aceflow.research.dto.ResearchRequest;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.FetchStatus;
import com.aceflow.research.exception.FatalConfigException;
import com.aceflow.research.exception.ResearchPipelineException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Research Bundle Writer
 *
 * 번들을 카테고리별 파일로 저장합니다. 레이아웃: {@code <output>/<pattern>-<domain-slug>/}
 * - summary.json / summary.md
 * - categories/&lt;category-code&gt;.md
 * - coverage-report.json
 * - fetch-report.json
 *
 * 같은 입력이면 summary.json의 runId, generatedAt을 제외하고 항상 같은 내용이 기록됩니다.
 * 모든 파일은 임시 파일에 쓴 뒤 원자적으로 이동합니다.
 */
@Service
@Slf4j
public class BundleWriterService {

    public static final String DOWNSTREAM_NOTE =
            "Consumers must refuse bundles with status=incomplete unless explicitly overridden.";

    static final String SUMMARY_JSON = "summary.json";
    static final String SUMMARY_MD = "summary.md";
    static final String COVERAGE_JSON = "coverage-report.json";
    static final String FETCH_JSON = "fetch-report.json";
    static final String CATEGORIES_DIR = "categories";

    private final ObjectWriter jsonWriter;
    private final ResearchProperties properties;
    private final Clock clock;

    public BundleWriterService(ObjectMapper objectMapper, ResearchProperties properties, Clock clock) {
        this.jsonWriter = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .writer();
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Output root for the request: the explicit directory or the configured default.
     */
    public Path outputRoot(ResearchRequest request) {
        return request.outputDirectory() != null ? request.outputDirectory() : properties.getOutput().getDirectory();
    }

    public Path bundleDirectory(ResearchRequest request) {
        return outputRoot(request).resolve(request.slug());
    }

    /**
     * Fails fast, before any fetch, when the bundle directory cannot be written.
     */
    public void checkWritable(ResearchRequest request) {
        Path dir = bundleDirectory(request);
        try {
            Files.createDirectories(dir);
            Path probe = Files.createTempFile(dir, ".write-check", ".tmp");
            Files.delete(probe);
        } catch (IOException | SecurityException e) {
            throw FatalConfigException.unwritableOutput(dir, e);
        }
    }

    /**
     * Persists the finalized bundle and returns its directory.
     */
    public Path write(ResearchBundle bundle) {
        Path dir = bundleDirectory(bundle.request());
        try {
            Files.createDirectories(dir.resolve(CATEGORIES_DIR));

            writeAtomically(dir.resolve(SUMMARY_JSON), jsonWriter.writeValueAsString(summary(bundle)));
            writeAtomically(dir.resolve(SUMMARY_MD), MarkdownRenderer.summary(bundle, DOWNSTREAM_NOTE));
            writeAtomically(dir.resolve(COVERAGE_JSON), jsonWriter.writeValueAsString(coverageReport(bundle.coverage())));
            writeAtomically(dir.resolve(FETCH_JSON), jsonWriter.writeValueAsString(fetchReport(bundle.fetchResults())));

            Set<String> written = new HashSet<>();
            for (CategoryCoverage coverage : bundle.coverage().categories()) {
                DocCategory category = coverage.category();
                String fileName = category.getCode() + ".md";
                writeAtomically(dir.resolve(CATEGORIES_DIR).resolve(fileName),
                        MarkdownRenderer.category(coverage, bundle.patternsOf(category), bundle.gotchasOf(category)));
                written.add(fileName);
            }
            removeStaleCategoryFiles(dir.resolve(CATEGORIES_DIR), written);
        } catch (IOException e) {
            throw new ResearchPipelineException("BUNDLE_WRITE_FAILED", "Failed to write bundle to " + dir, e);
        }

        log.info("Bundle written: dir={}, status={}, overallScore={}", dir, bundle.status().getCode(),
                bundle.overallScore());
        return dir;
    }

    Map<String, Object> summary(ResearchBundle bundle) {
        CoverageReport coverage = bundle.coverage();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("runId", bundle.runId());
        summary.put("generatedAt", clock.instant().truncatedTo(ChronoUnit.SECONDS).toString());
        summary.put("domain", bundle.request().domain());
        summary.put("pattern", bundle.request().pattern().getCode());
        summary.put("requestedPattern", bundle.request().rawPattern());
        summary.put("status", bundle.status().getCode());
        summary.put("overallScore", bundle.overallScore());
        summary.put("threshold", coverage.threshold());
        summary.put("criticalFloor", coverage.criticalFloor());
        summary.put("incompleteReason", bundle.incompleteReason() == null ? null : bundle.incompleteReason().getCode());

        Map<String, Object> categories = new LinkedHashMap<>();
        for (CategoryCoverage c : coverage.categories()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("priority", c.priority().getCode());
            entry.put("score", c.score());
            entry.put("patterns", bundle.patternsOf(c.category()).size());
            entry.put("gotchas", bundle.gotchasOf(c.category()).size());
            categories.put(c.category().getCode(), entry);
        }
        summary.put("categories", categories);
        summary.put("missingAreas", coverage.missingAreas());

        Map<String, Object> fetch = new LinkedHashMap<>();
        fetch.put("targets", bundle.targets().size());
        for (FetchStatus status : FetchStatus.values()) {
            fetch.put(status.getCode(), bundle.countByStatus(status));
        }
        fetch.put("fromCache", bundle.fetchResults().stream().filter(FetchResult::fromCache).count());
        summary.put("fetch", fetch);
        summary.put("passes", bundle.passes());
        summary.put("scoreHistory", bundle.scoreHistory());
        summary.put("note", DOWNSTREAM_NOTE);
        return summary;
    }

    static Map<String, Object> coverageReport(CoverageReport coverage) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("status", coverage.status().getCode());
        report.put("overallScore", coverage.overallScore());
        report.put("threshold", coverage.threshold());
        report.put("criticalFloor", coverage.criticalFloor());

        Map<String, Double> scores = new TreeMap<>();
        Map<String, Object> details = new TreeMap<>();
        for (CategoryCoverage c : coverage.categories()) {
            scores.put(c.category().getCode(), c.score());
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("priority", c.priority().getCode());
            detail.put("required", keys(c.requiredSignals()));
            detail.put("observed", keys(c.observedSignals()));
            detail.put("missing", keys(c.missingSignals()));
            details.put(c.category().getCode(), detail);
        }
        report.put("scores", scores);
        report.put("categories", details);
        return report;
    }

    static List<Map<String, Object>> fetchReport(List<FetchResult> results) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (FetchResult r : results) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("url", r.url());
            entry.put("category", r.target().category().getCode());
            entry.put("topic", r.target().topic());
            entry.put("priority", r.target().priority().getCode());
            entry.put("status", r.status().getCode());
            entry.put("attempts", r.attemptCount());
            entry.put("fromCache", r.fromCache());
            entry.put("contentType", r.contentType());
            entry.put("fetchedAt", r.fetchedAt() == null ? null : r.fetchedAt().toString());
            entry.put("error", r.errorDetail());
            entries.add(entry);
        }
        return entries;
    }

    private static List<String> keys(Iterable<CoverageSignal> signals) {
        List<String> keys = new ArrayList<>();
        signals.forEach(s -> keys.add(s.key()));
        return keys;
    }

    private void removeStaleCategoryFiles(Path categoriesDir, Set<String> keep) throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(categoriesDir, "*.md")) {
            for (Path file : files) {
                if (!keep.contains(file.getFileName().toString())) {
                    log.debug("Removing stale category file {}", file);
                    Files.deleteIfExists(file);
                }
            }
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content.endsWith("\n") ? content : content + "\n", StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
