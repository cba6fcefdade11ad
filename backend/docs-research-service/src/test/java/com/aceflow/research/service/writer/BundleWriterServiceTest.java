package com.aceflow.research.service.writer;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.dto.CoverageReport;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.FetchResult;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.dto.ResearchBundle;
import com.aceflow.research.dto.ResearchRequest;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.FetchFailureReason;
import com.aceflow.research.entity.IncompleteReason;
import com.aceflow.research.entity.TargetPriority;
import com.aceflow.research.exception.FatalConfigException;
import com.aceflow.research.service.validation.CompletenessValidator;
import com.aceflow.research.service.validation.CoverageRequirements;
import com.aceflow.research.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.aceflow.research.support.ResearchFixtures.FETCHED_AT;
import static com.aceflow.research.support.ResearchFixtures.objectMapper;
import static com.aceflow.research.support.ResearchFixtures.ok;
import static com.aceflow.research.support.ResearchFixtures.properties;
import static com.aceflow.research.support.ResearchFixtures.target;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BundleWriterServiceTest {

    private static final FetchTarget DATA = target("https://docs.example.com/data", DocCategory.CORE_FRAMEWORK, "data", TargetPriority.CRITICAL);
    private static final FetchTarget CRUD = target("https://docs.example.com/crud", DocCategory.PATTERN_SPECIFIC, "crud", TargetPriority.IMPORTANT);

    @TempDir
    Path tempDir;

    private ResearchProperties properties;
    private MutableClock clock;
    private BundleWriterService writer;
    private final ObjectMapper mapper = objectMapper();

    @BeforeEach
    void setUp() {
        properties = properties(tempDir);
        clock = new MutableClock(FETCHED_AT);
        writer = new BundleWriterService(mapper, properties, clock);
    }

    @Test
    @DisplayName("번들 디렉터리에 summary, coverage, fetch report, 카테고리 파일을 기록한다")
    void writesLayout() throws Exception {
        ResearchBundle bundle = bundle("run-1", request());

        Path dir = writer.write(bundle);

        assertThat(dir).isEqualTo(tempDir.resolve("out").resolve("simple_crud-contact-manager"));
        assertThat(dir.resolve(BundleWriterService.SUMMARY_JSON)).exists();
        assertThat(dir.resolve(BundleWriterService.SUMMARY_MD)).exists();
        assertThat(dir.resolve(BundleWriterService.COVERAGE_JSON)).exists();
        assertThat(dir.resolve(BundleWriterService.FETCH_JSON)).exists();
        assertThat(dir.resolve("categories/core-framework.md")).exists();
        assertThat(dir.resolve("categories/pattern-specific.md")).exists();

        JsonNode summary = mapper.readTree(dir.resolve(BundleWriterService.SUMMARY_JSON).toFile());
        assertThat(summary.get("status").asText()).isEqualTo("incomplete");
        assertThat(summary.get("incompleteReason").asText()).isEqualTo("no_new_targets");
        assertThat(summary.get("note").asText()).isEqualTo(BundleWriterService.DOWNSTREAM_NOTE);
        assertThat(summary.get("fetch").get("error").asInt()).isEqualTo(1);

        String summaryMd = Files.readString(dir.resolve(BundleWriterService.SUMMARY_MD));
        assertThat(summaryMd).contains("incomplete").contains(BundleWriterService.DOWNSTREAM_NOTE);

        String core = Files.readString(dir.resolve("categories/core-framework.md"));
        assertThat(core).contains("const data = 1;").contains(DATA.url());

        JsonNode fetchReport = mapper.readTree(dir.resolve(BundleWriterService.FETCH_JSON).toFile());
        assertThat(fetchReport).hasSize(2);
        assertThat(fetchReport.get(1).get("status").asText()).isEqualTo("error");
        assertThat(fetchReport.get(1).get("error").asText()).startsWith("http_server_error");
    }

    @Test
    @DisplayName("같은 번들을 다시 쓰면 summary.json의 runId, generatedAt 외에는 동일하다")
    void idempotent() throws Exception {
        Path dir = writer.write(bundle("run-1", request()));
        Map<String, String> first = snapshot(dir);

        clock.advance(Duration.ofMinutes(5));
        writer.write(bundle("run-2", request()));
        Map<String, String> second = snapshot(dir);

        assertThat(second.keySet()).isEqualTo(first.keySet());
        for (String file : first.keySet()) {
            if (!file.equals(BundleWriterService.SUMMARY_JSON)) {
                assertThat(second.get(file)).as(file).isEqualTo(first.get(file));
            }
        }
        ObjectNode firstSummary = (ObjectNode) mapper.readTree(first.get(BundleWriterService.SUMMARY_JSON));
        ObjectNode secondSummary = (ObjectNode) mapper.readTree(second.get(BundleWriterService.SUMMARY_JSON));
        assertThat(secondSummary.get("runId").asText()).isEqualTo("run-2");
        firstSummary.remove(List.of("runId", "generatedAt"));
        secondSummary.remove(List.of("runId", "generatedAt"));
        assertThat(secondSummary).isEqualTo(firstSummary);
    }

    @Test
    @DisplayName("이번 번들에 없는 카테고리 파일은 제거된다")
    void removesStaleCategoryFiles() throws Exception {
        Path dir = writer.write(bundle("run-1", request()));
        Files.writeString(dir.resolve("categories/integration.md"), "# old");

        writer.write(bundle("run-2", request()));

        assertThat(dir.resolve("categories/integration.md")).doesNotExist();
        assertThat(dir.resolve("categories/core-framework.md")).exists();
    }

    @Test
    @DisplayName("출력 경로가 일반 파일이면 FatalConfigException")
    void unwritableOutput() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        ResearchRequest request = request().withOutputDirectory(blocker);

        assertThatThrownBy(() -> writer.checkWritable(request))
                .isInstanceOf(FatalConfigException.class)
                .hasMessageContaining("not writable");
    }

    @Test
    @DisplayName("요청에 출력 경로가 없으면 설정된 기본 경로를 사용한다")
    void defaultOutputRoot() {
        assertThat(writer.outputRoot(request())).isEqualTo(properties.getOutput().getDirectory());
        assertThat(writer.outputRoot(request().withOutputDirectory(tempDir.resolve("custom"))))
                .isEqualTo(tempDir.resolve("custom"));
    }

    private static ResearchRequest request() {
        return ResearchRequest.of("Contact Manager", "simple_crud");
    }

    private ResearchBundle bundle(String runId, ResearchRequest request) {
        List<FetchTarget> targets = List.of(DATA, CRUD);
        FetchResult dataResult = ok(DATA, "<p>x</p>");
        FetchResult crudResult = FetchResult.failed(CRUD, FetchFailureReason.HTTP_SERVER_ERROR, "502 Bad Gateway", FETCHED_AT, 4);

        ExtractedPattern pattern = new ExtractedPattern(DATA.url(), DocCategory.CORE_FRAMEWORK, "data",
                "const data = 1;\nexport default data;", "For example", "ts", true);
        Gotcha gotcha = new Gotcha(DATA.url(), DocCategory.CORE_FRAMEWORK, "data",
                "Avoid sharing clients.", null, "avoid");

        CoverageReport report = new CompletenessValidator(properties)
                .evaluate(CoverageRequirements.fromTargets(targets), List.of(pattern), List.of(gotcha));

        return ResearchBundle.builder()
                .runId(runId)
                .request(request)
                .startedAt(FETCHED_AT)
                .targets(targets)
                .fetchResults(List.of(dataResult, crudResult))
                .patterns(Map.of(DocCategory.CORE_FRAMEWORK, List.of(pattern)))
                .gotchas(Map.of(DocCategory.CORE_FRAMEWORK, List.of(gotcha)))
                .passes(0)
                .scoreHistory(List.of(report.overallScore()))
                .build()
                .withCoverage(report, IncompleteReason.NO_NEW_TARGETS);
    }

    private static Map<String, String> snapshot(Path dir) throws Exception {
        Map<String, String> files = new TreeMap<>();
        try (var paths = Files.walk(dir)) {
            for (Path path : paths.filter(Files::isRegularFile).toList()) {
                files.put(dir.relativize(path).toString().replace('\\', '/'), Files.readString(path));
            }
        }
        return files;
    }
}
