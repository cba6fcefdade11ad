package com.aceflow.research.service.resolver;

import com.aceflow.research.config.ResearchProperties;
import com.aceflow.research.config.TargetCatalogProperties;
import com.aceflow.research.config.TargetCatalogProperties.CatalogEntry;
import com.aceflow.research.dto.CategoryCoverage;
import com.aceflow.research.dto.DocumentExtraction;
import com.aceflow.research.dto.DocumentLink;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.ResearchRequest;
import com.aceflow.research.entity.ArchitecturePattern;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.TargetPriority;
import com.aceflow.research.exception.FatalConfigException;
import com.aceflow.research.util.UrlUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 리서치 요청(domain, pattern)을 fetch 대상 목록으로 변환하는 서비스.
 *
 * - 초기 패스: 카탈로그 lookup table에서 패턴별 대상 선택, 우선순위 순 정렬, URL 기준 중복 제거
 * - 알 수 없는 패턴: core-framework critical 대상만 사용하는 degraded mode
 * - core-only 패턴(기본 simple_crud): 같은 core-framework critical 집합, 경고 없음
 * - 보충 패스: 커버리지가 부족한 카테고리/토픽에 대해 아직 resolve되지 않은 URL만 반환
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TargetResolverService {

    private static final Comparator<FetchTarget> TARGET_ORDER = Comparator
            .comparing((FetchTarget t) -> -t.priority().getWeight())
            .thenComparing(FetchTarget::category);

    private final TargetCatalogProperties catalog;
    private final ResearchProperties properties;

    /**
     * Initial resolve for a request. Never returns an empty list.
     *
     * @throws FatalConfigException when neither the pattern nor the fallback set yields a target
     */
    public List<FetchTarget> resolve(ResearchRequest request) {
        ArchitecturePattern pattern = request.pattern();
        List<CatalogEntry> selected;

        if (catalog.isCoreOnly(pattern)) {
            selected = fallbackEntries();
        } else if (pattern.isKnown()) {
            selected = catalog.getEntries().stream()
                    .filter(e -> !e.isSupplemental())
                    .filter(e -> e.appliesTo(pattern))
                    .filter(e -> e.matchesDomain(request.domain()))
                    .toList();
        } else {
            log.warn("Unrecognized pattern '{}', falling back to core-framework critical targets", request.rawPattern());
            selected = fallbackEntries();
        }

        if (selected.isEmpty()) {
            selected = fallbackEntries();
        }

        List<FetchTarget> targets = toTargets(selected, request);
        if (targets.isEmpty()) {
            throw FatalConfigException.noTargetsResolvable(request.rawPattern());
        }

        log.info("Resolved {} targets for pattern={}, domain='{}' ({})", targets.size(), pattern.getCode(),
                request.domain(), summarize(targets));
        return targets;
    }

    /**
     * Supplemental resolve for under-covered categories.
     *
     * Only topics that are still missing a required signal are addressed, so the requirement
     * set fixed by the initial pass never grows. Catalog supplemental entries come first, then
     * same-host links discovered in pages of the same category.
     *
     * @param underCovered  coverage of the categories below threshold
     * @param resolvedUrls  URLs already resolved in this run (normalized or raw)
     * @param extractions   extractions so far, mined for outbound links
     * @return new targets only; empty when nothing more can be resolved
     */
    public List<FetchTarget> resolveSupplemental(ResearchRequest request,
                                                 Collection<CategoryCoverage> underCovered,
                                                 Collection<String> resolvedUrls,
                                                 Collection<DocumentExtraction> extractions) {
        Set<String> known = resolvedUrls.stream().map(UrlUtils::normalize).collect(Collectors.toCollection(HashSet::new));
        Map<String, FetchTarget> added = new LinkedHashMap<>();

        for (CategoryCoverage coverage : underCovered) {
            DocCategory category = coverage.category();
            SortedSet<String> missingTopics = coverage.missingTopics();
            if (missingTopics.isEmpty()) {
                continue;
            }

            catalog.getEntries().stream()
                    .filter(CatalogEntry::isSupplemental)
                    .filter(e -> e.getCategory() == category)
                    .filter(e -> missingTopics.contains(normalizeTopic(e.getTopic())))
                    .filter(e -> e.appliesTo(request.pattern()) || !request.pattern().isKnown())
                    .forEach(e -> addIfNew(added, known, new FetchTarget(e.getUrl(), category,
                            e.getTopic(), e.getPriority(), request.describe())));

            addDiscoveredLinks(added, known, request, category, missingTopics, extractions);
        }

        List<FetchTarget> targets = new ArrayList<>(added.values());
        targets.sort(TARGET_ORDER);
        log.info("Supplemental resolve: {} new targets for {}", targets.size(),
                underCovered.stream().map(c -> c.category().getCode()).toList());
        return targets;
    }

    private void addDiscoveredLinks(Map<String, FetchTarget> added, Set<String> known, ResearchRequest request,
                                    DocCategory category, SortedSet<String> missingTopics,
                                    Collection<DocumentExtraction> extractions) {
        int limit = properties.getResolver().getMaxDiscoveredLinksPerPass();
        int count = 0;

        // deterministic order: by source url, then document order
        List<DocumentExtraction> sources = extractions.stream()
                .filter(x -> x.source().isOk() && x.source().target().category() == category)
                .sorted(Comparator.comparing(DocumentExtraction::sourceUrl))
                .toList();

        for (DocumentExtraction extraction : sources) {
            String sourceHost = extraction.source().target().host();
            for (DocumentLink link : extraction.links()) {
                if (count >= limit) {
                    return;
                }
                if (!UrlUtils.isHttpUrl(link.url()) || !sourceHost.equals(UrlUtils.hostOf(link.url()))) {
                    continue;
                }
                String topic = matchTopic(link, missingTopics);
                if (topic == null) {
                    continue;
                }
                if (addIfNew(added, known, new FetchTarget(link.url(), category, topic,
                        TargetPriority.SUPPLEMENTARY, request.describe()))) {
                    count++;
                }
            }
        }
    }

    private static String matchTopic(DocumentLink link, SortedSet<String> missingTopics) {
        String haystack = (link.url() + " " + (link.anchorText() == null ? "" : link.anchorText()))
                .toLowerCase(Locale.ROOT);
        for (String topic : missingTopics) {
            if (haystack.contains(topic)) {
                return topic;
            }
        }
        return null;
    }

    private static boolean addIfNew(Map<String, FetchTarget> added, Set<String> known, FetchTarget target) {
        String key = UrlUtils.normalize(target.url());
        if (known.contains(key) || added.containsKey(key)) {
            return false;
        }
        added.put(key, target);
        return true;
    }

    private List<CatalogEntry> fallbackEntries() {
        return catalog.getEntries().stream()
                .filter(e -> !e.isSupplemental())
                .filter(CatalogEntry::isBaseline)
                .filter(e -> !e.isKeywordGated())
                .filter(e -> e.getCategory() == DocCategory.CORE_FRAMEWORK)
                .filter(e -> e.getPriority() == TargetPriority.CRITICAL)
                .toList();
    }

    /**
     * Sorts by priority then category (catalog order breaks ties) and keeps the
     * highest-priority occurrence of every URL.
     */
    private List<FetchTarget> toTargets(List<CatalogEntry> entries, ResearchRequest request) {
        List<FetchTarget> candidates = new ArrayList<>();
        for (CatalogEntry entry : entries) {
            if (!UrlUtils.isHttpUrl(entry.getUrl())) {
                log.warn("Skipping catalog entry with invalid url: {}", entry.getUrl());
                continue;
            }
            candidates.add(new FetchTarget(entry.getUrl(), entry.getCategory(), entry.getTopic(),
                    entry.getPriority(), request.describe()));
        }
        candidates.sort(TARGET_ORDER);

        Map<String, FetchTarget> unique = new LinkedHashMap<>();
        for (FetchTarget candidate : candidates) {
            unique.putIfAbsent(UrlUtils.normalize(candidate.url()), candidate);
        }
        return new ArrayList<>(unique.values());
    }

    private static String normalizeTopic(String topic) {
        return topic == null || topic.isBlank() ? "general" : topic.trim().toLowerCase(Locale.ROOT);
    }

    private static String summarize(List<FetchTarget> targets) {
        return targets.stream()
                .collect(Collectors.groupingBy(t -> t.category().getCode() + "/" + t.priority().getCode(),
                        TreeMap::new, Collectors.counting()))
                .toString();
    }
}
