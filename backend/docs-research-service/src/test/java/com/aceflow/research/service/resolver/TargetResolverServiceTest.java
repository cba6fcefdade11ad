package com.aceflow.research.service.resolver;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.config.TargetCatalogProperties;
import com.aceflow.research.config.TargetCatalogProperties.CatalogEntry;
import com.aceflow.research.dto.CategoryCoverage;
import com.aceflow.research.dto.CoverageSignal;
import com.aceflow.research.dto.DocumentExtraction;
import com.aceflow.research.dto.DocumentLink;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.ResearchRequest;
import com.aceflow.research.entity.ArchitecturePattern;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.SignalKind;
import com.aceflow.research.entity.TargetPriority;
import com.aceflow.research.exception.FatalConfigException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static com.aceflow.research.support.ResearchFixtures.entry;
import static com.aceflow.research.support.ResearchFixtures.ok;
import static com.aceflow.research.support.ResearchFixtures.supplemental;
import static com.aceflow.research.support.ResearchFixtures.target;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TargetResolverService 단위 테스트
 *
 * 패턴별 lookup, 우선순위 정렬, 중복 제거, fallback, 보충 패스를 검증합니다.
 */
class TargetResolverServiceTest {

    private static final String AMPLIFY = "https://docs.amplify.example";
    private static final String STRIPE = "https://docs.stripe.example";

    private TargetCatalogProperties catalog;
    private ResearchProperties properties;
    private TargetResolverService resolver;

    @BeforeEach
    void setUp() {
        catalog = new TargetCatalogProperties();
        catalog.setEntries(new ArrayList<>(List.of(
                entry(AMPLIFY + "/storage", DocCategory.CORE_FRAMEWORK, "storage", TargetPriority.IMPORTANT),
                entry(AMPLIFY + "/data", DocCategory.CORE_FRAMEWORK, "data", TargetPriority.CRITICAL),
                entry(AMPLIFY + "/auth", DocCategory.CORE_FRAMEWORK, "auth", TargetPriority.CRITICAL),
                entry(AMPLIFY + "/relationships", DocCategory.PATTERN_SPECIFIC, "relationships",
                        TargetPriority.CRITICAL, ArchitecturePattern.SOCIAL_PLATFORM),
                entry(AMPLIFY + "/crud", DocCategory.PATTERN_SPECIFIC, "crud",
                        TargetPriority.IMPORTANT, ArchitecturePattern.SIMPLE_CRUD),
                CatalogEntry.builder()
                        .url(STRIPE + "/quickstart")
                        .category(DocCategory.INTEGRATION)
                        .topic("payments")
                        .priority(TargetPriority.IMPORTANT)
                        .keywords(List.of("payment", "shop"))
                        .build(),
                supplemental(AMPLIFY + "/auth/setup", DocCategory.CORE_FRAMEWORK, "auth"),
                supplemental(AMPLIFY + "/storage/setup", DocCategory.CORE_FRAMEWORK, "storage")
        )));
        properties = new ResearchProperties();
        resolver = new TargetResolverService(catalog, properties);
    }

    @Nested
    @DisplayName("초기 resolve")
    class InitialResolveTests {

        @Test
        @DisplayName("알려진 패턴은 baseline과 패턴 전용 대상을 우선순위 순으로 반환한다")
        void knownPatternOrderedByPriority() {
            // when
            List<FetchTarget> targets = resolver.resolve(ResearchRequest.of("friends feed", "social_platform"));

            // then
            assertThat(targets).extracting(FetchTarget::url).containsExactly(
                    AMPLIFY + "/data",
                    AMPLIFY + "/auth",
                    AMPLIFY + "/relationships",
                    AMPLIFY + "/storage");
            assertThat(targets).allMatch(t -> t.originRequest().equals("social_platform:friends feed"));
        }

        @Test
        @DisplayName("키워드 조건이 있는 통합 문서는 도메인에 키워드가 있을 때만 포함된다")
        void keywordGatedIntegration() {
            List<FetchTarget> withoutKeyword = resolver.resolve(ResearchRequest.of("team blog", "content_management"));
            List<FetchTarget> withKeyword = resolver.resolve(ResearchRequest.of("online shop", "content_management"));

            assertThat(withoutKeyword).extracting(FetchTarget::category).doesNotContain(DocCategory.INTEGRATION);
            assertThat(withKeyword).extracting(FetchTarget::url).contains(STRIPE + "/quickstart");
        }

        @Test
        @DisplayName("보충 전용 항목은 초기 resolve에 포함되지 않는다")
        void supplementalExcluded() {
            List<FetchTarget> targets = resolver.resolve(ResearchRequest.of("team blog", "content_management"));

            assertThat(targets).extracting(FetchTarget::url)
                    .doesNotContain(AMPLIFY + "/auth/setup", AMPLIFY + "/storage/setup");
        }

        @Test
        @DisplayName("같은 URL은 정규화 후 한 번만, 가장 높은 우선순위로 남는다")
        void deduplicatesByNormalizedUrl() {
            // given
            catalog.getEntries().add(entry(AMPLIFY + "/storage/#top", DocCategory.CORE_FRAMEWORK, "storage",
                    TargetPriority.CRITICAL));

            // when
            List<FetchTarget> targets = resolver.resolve(ResearchRequest.of("team blog", "content_management"));

            // then
            List<FetchTarget> storage = targets.stream().filter(t -> t.topic().equals("storage")).toList();
            assertThat(storage).hasSize(1);
            assertThat(storage.get(0).priority()).isEqualTo(TargetPriority.CRITICAL);
        }

        @Test
        @DisplayName("simple_crud는 core-framework critical 대상만 반환한다")
        void simpleCrudIsCoreOnly() {
            // when
            List<FetchTarget> targets = resolver.resolve(ResearchRequest.of("contact-manager", "simple_crud"));
            List<FetchTarget> shop = resolver.resolve(ResearchRequest.of("online shop", "simple_crud"));

            // then
            assertThat(targets).isNotEmpty().allMatch(t -> t.priority() == TargetPriority.CRITICAL
                    && t.category() == DocCategory.CORE_FRAMEWORK);
            assertThat(targets).extracting(FetchTarget::topic).containsExactly("data", "auth");
            assertThat(shop).extracting(FetchTarget::url).containsExactlyElementsOf(
                    targets.stream().map(FetchTarget::url).toList());
        }

        @Test
        @DisplayName("core-only 패턴 목록에서 빠지면 simple_crud도 패턴 전용 대상을 받는다")
        void coreOnlyPatternsConfigurable() {
            // given
            catalog.setCoreOnlyPatterns(EnumSet.noneOf(ArchitecturePattern.class));

            // when
            List<FetchTarget> targets = resolver.resolve(ResearchRequest.of("contact-manager", "simple_crud"));

            // then
            assertThat(targets).extracting(FetchTarget::url).contains(AMPLIFY + "/crud", AMPLIFY + "/storage");
        }

        @Test
        @DisplayName("알 수 없는 패턴은 core-framework critical 대상만 반환한다")
        void unknownPatternFallsBack() {
            List<FetchTarget> targets = resolver.resolve(ResearchRequest.of("anything", "blockchain_dapp"));

            assertThat(targets).isNotEmpty();
            assertThat(targets).allMatch(t -> t.category() == DocCategory.CORE_FRAMEWORK
                    && t.priority() == TargetPriority.CRITICAL);
            assertThat(targets).extracting(FetchTarget::topic).containsExactly("data", "auth");
        }

        @Test
        @DisplayName("fallback 집합도 비어 있으면 FatalConfigException")
        void emptyFallbackIsFatal() {
            catalog.setEntries(List.of(
                    entry(AMPLIFY + "/storage", DocCategory.CORE_FRAMEWORK, "storage", TargetPriority.IMPORTANT)));

            assertThatThrownBy(() -> resolver.resolve(ResearchRequest.of("x", "nonexistent")))
                    .isInstanceOf(FatalConfigException.class)
                    .hasMessageContaining("nonexistent");
        }
    }

    @Nested
    @DisplayName("보충 resolve")
    class SupplementalResolveTests {

        private final ResearchRequest request = ResearchRequest.of("contact manager", "simple_crud");

        @Test
        @DisplayName("부족한 토픽의 보충 항목 중 아직 resolve되지 않은 URL만 반환한다")
        void returnsOnlyNewTargetsForMissingTopics() {
            // given: auth만 example이 없음
            CategoryCoverage core = coverage(
                    Set.of(signal("auth", SignalKind.HAS_PATTERN), signal("auth", SignalKind.HAS_EXAMPLE),
                            signal("storage", SignalKind.HAS_PATTERN), signal("storage", SignalKind.HAS_EXAMPLE)),
                    Set.of(signal("auth", SignalKind.HAS_PATTERN),
                            signal("storage", SignalKind.HAS_PATTERN), signal("storage", SignalKind.HAS_EXAMPLE)));

            // when
            List<FetchTarget> targets = resolver.resolveSupplemental(request, List.of(core),
                    List.of(AMPLIFY + "/auth", AMPLIFY + "/storage"), List.of());

            // then
            assertThat(targets).extracting(FetchTarget::url).containsExactly(AMPLIFY + "/auth/setup");
            assertThat(targets.get(0).category()).isEqualTo(DocCategory.CORE_FRAMEWORK);
            assertThat(targets.get(0).topic()).isEqualTo("auth");
        }

        @Test
        @DisplayName("이미 resolve된 URL은 다시 반환하지 않는다")
        void setDifference() {
            CategoryCoverage core = coverage(
                    Set.of(signal("auth", SignalKind.HAS_EXAMPLE)), Set.of());

            List<FetchTarget> targets = resolver.resolveSupplemental(request, List.of(core),
                    List.of(AMPLIFY + "/auth/setup/"), List.of());

            assertThat(targets).isEmpty();
        }

        @Test
        @DisplayName("같은 호스트의 링크 중 부족한 토픽을 언급하는 링크를 추가한다")
        void discoversSameHostLinks() {
            // given
            catalog.setEntries(List.of());
            FetchTarget source = target(AMPLIFY + "/overview", DocCategory.CORE_FRAMEWORK, "auth", TargetPriority.CRITICAL);
            DocumentExtraction extraction = new DocumentExtraction(ok(source, "<p>x</p>"), List.of(), List.of(),
                    List.of(new DocumentLink(AMPLIFY + "/guides/auth-flows", "Auth flows"),
                            new DocumentLink("https://elsewhere.example/auth", "Auth elsewhere"),
                            new DocumentLink(AMPLIFY + "/pricing", "Pricing")),
                    null);
            CategoryCoverage core = coverage(Set.of(signal("auth", SignalKind.HAS_EXAMPLE)), Set.of());

            // when
            List<FetchTarget> targets = resolver.resolveSupplemental(request, List.of(core),
                    List.of(source.url()), List.of(extraction));

            // then
            assertThat(targets).extracting(FetchTarget::url).containsExactly(AMPLIFY + "/guides/auth-flows");
            assertThat(targets.get(0).priority()).isEqualTo(TargetPriority.SUPPLEMENTARY);
            assertThat(targets.get(0).topic()).isEqualTo("auth");
        }

        @Test
        @DisplayName("발견 링크 수는 패스당 한도를 넘지 않는다")
        void discoveredLinksCapped() {
            catalog.setEntries(List.of());
            properties.getResolver().setMaxDiscoveredLinksPerPass(2);
            FetchTarget source = target(AMPLIFY + "/overview", DocCategory.CORE_FRAMEWORK, "auth", TargetPriority.CRITICAL);
            List<DocumentLink> links = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                links.add(new DocumentLink(AMPLIFY + "/auth/page-" + i, "Auth page " + i));
            }
            DocumentExtraction extraction = new DocumentExtraction(ok(source, "<p>x</p>"), List.of(), List.of(), links, null);
            CategoryCoverage core = coverage(Set.of(signal("auth", SignalKind.HAS_EXAMPLE)), Set.of());

            List<FetchTarget> targets = resolver.resolveSupplemental(request, List.of(core),
                    List.of(source.url()), List.of(extraction));

            assertThat(targets).hasSize(2);
        }
    }

    private static CoverageSignal signal(String topic, SignalKind kind) {
        return new CoverageSignal(topic, kind);
    }

    private static CategoryCoverage coverage(Set<CoverageSignal> required, Set<CoverageSignal> observed) {
        double score = required.isEmpty() ? 1.0 : (double) observed.size() / required.size();
        return new CategoryCoverage(DocCategory.CORE_FRAMEWORK, TargetPriority.CRITICAL,
                new TreeSet<>(required), new TreeSet<>(observed), score);
    }
}
