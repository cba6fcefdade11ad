package com.aceflow.research.service.aggregate;

import com.aceflow.research.dto.DocumentExtraction;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.entity.DocCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 추출 결과를 카테고리별로 묶습니다.
 *
 * 같은 카테고리에서 코드가 동일한(공백 정규화 기준) 패턴은 첫 번째만 유지합니다.
 * 순서는 source URL 순, 문서 내 순서이므로 fetch 완료 순서와 무관하게 결정적입니다.
 */
@Component
@Slf4j
public class ResearchAggregator {

    public AggregatedResearch aggregate(List<DocumentExtraction> extractions) {
        List<DocumentExtraction> ordered = extractions.stream()
                .filter(x -> x.source().isOk())
                .sorted(Comparator.comparing(DocumentExtraction::sourceUrl))
                .toList();

        Map<DocCategory, List<ExtractedPattern>> patterns = new EnumMap<>(DocCategory.class);
        Map<DocCategory, List<Gotcha>> gotchas = new EnumMap<>(DocCategory.class);
        Set<String> seen = new HashSet<>();
        int dropped = 0;

        for (DocumentExtraction extraction : ordered) {
            for (ExtractedPattern pattern : extraction.patterns()) {
                if (!seen.add(pattern.category().getCode() + "\u0000" + normalizeCode(pattern.codeText()))) {
                    dropped++;
                    continue;
                }
                patterns.computeIfAbsent(pattern.category(), c -> new ArrayList<>()).add(pattern);
            }
            for (Gotcha gotcha : extraction.gotchas()) {
                gotchas.computeIfAbsent(gotcha.category(), c -> new ArrayList<>()).add(gotcha);
            }
        }

        AggregatedResearch aggregated = new AggregatedResearch(patterns, gotchas, dropped);
        log.info("Aggregated {} documents: patterns={}, gotchas={}, duplicatesDropped={}",
                ordered.size(), aggregated.patternCount(), aggregated.gotchaCount(), dropped);
        return aggregated;
    }

    static String normalizeCode(String code) {
        return code == null ? "" : code.strip().replaceAll("[ \\t]+", " ").replaceAll("\\s*\\R\\s*", "\n");
    }
}
