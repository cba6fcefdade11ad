package com.aceflow.research.config;

import com.aceflow.research.entity.ArchitecturePattern;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.TargetPriority;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 리서치 대상 문서 카탈로그 (prefix {@code research.catalog}).
 *
 * 패턴별 lookup table 역할을 합니다. 기본 카탈로그는 application.yml에 정의되어 있습니다.
 * - patterns가 비어 있는 항목: 모든 패턴의 baseline
 * - keywords가 있는 항목: 도메인 텍스트에 키워드가 포함될 때만 활성화
 * - supplemental 항목: 커버리지가 부족할 때 보충 패스에서만 사용
 * - coreOnlyPatterns: baseline 대신 core-framework critical 대상만 받는 패턴
 */
@Configuration
@ConfigurationProperties(prefix = "research.catalog")
@Data
public class TargetCatalogProperties {

    private List<CatalogEntry> entries = new ArrayList<>();

    private Set<ArchitecturePattern> coreOnlyPatterns = EnumSet.of(ArchitecturePattern.SIMPLE_CRUD);

    public boolean isCoreOnly(ArchitecturePattern pattern) {
        return coreOnlyPatterns != null && coreOnlyPatterns.contains(pattern);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CatalogEntry {
        private String url;

        private DocCategory category;

        /** Sub-area such as data, auth, storage, or an integration/pattern topic */
        private String topic;

        @Builder.Default
        private TargetPriority priority = TargetPriority.IMPORTANT;

        @Builder.Default
        private Set<ArchitecturePattern> patterns = EnumSet.noneOf(ArchitecturePattern.class);

        @Builder.Default
        private List<String> keywords = new ArrayList<>();

        private boolean supplemental;

        public boolean isBaseline() {
            return patterns == null || patterns.isEmpty();
        }

        public boolean appliesTo(ArchitecturePattern pattern) {
            return isBaseline() || patterns.contains(pattern);
        }

        /**
         * Keyword-gated entries only activate when the domain text mentions one of their keywords.
         */
        public boolean matchesDomain(String domain) {
            if (keywords == null || keywords.isEmpty()) {
                return true;
            }
            String lowerDomain = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
            return keywords.stream().anyMatch(k -> lowerDomain.contains(k.toLowerCase(Locale.ROOT)));
        }

        public boolean isKeywordGated() {
            return keywords != null && !keywords.isEmpty();
        }
    }
}
