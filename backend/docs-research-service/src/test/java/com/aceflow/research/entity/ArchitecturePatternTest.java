package com.aceflow.research.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class ArchitecturePatternTest {

    @ParameterizedTest
    @ValueSource(strings = {"social_platform", "Social Platform", "social-platform", "SOCIALPLATFORM", " social_platform "})
    @DisplayName("패턴 이름은 대소문자, 공백, 하이픈을 구분하지 않는다")
    void lenientNames(String name) {
        assertThat(ArchitecturePattern.fromName(name)).isEqualTo(ArchitecturePattern.SOCIAL_PLATFORM);
    }

    @Test
    @DisplayName("기본 로케일이 터키어여도 대문자 패턴 이름을 인식한다")
    void upperCaseNamesUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertThat(ArchitecturePattern.fromName("SIMPLE_CRUD")).isEqualTo(ArchitecturePattern.SIMPLE_CRUD);
            assertThat(ArchitecturePattern.fromName("DASHBOARD-ANALYTICS"))
                    .isEqualTo(ArchitecturePattern.DASHBOARD_ANALYTICS);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"microservices", "blockchain_dapp"})
    @DisplayName("알 수 없는 패턴은 UNKNOWN")
    void unknownNames(String name) {
        ArchitecturePattern pattern = ArchitecturePattern.fromName(name);

        assertThat(pattern).isEqualTo(ArchitecturePattern.UNKNOWN);
        assertThat(pattern.isKnown()).isFalse();
    }

    @Test
    @DisplayName("카테고리별 필수 신호")
    void requiredSignalsPerCategory() {
        assertThat(DocCategory.CORE_FRAMEWORK.getRequiredSignals())
                .containsExactlyInAnyOrder(SignalKind.HAS_PATTERN, SignalKind.HAS_EXAMPLE);
        assertThat(DocCategory.INTEGRATION.getRequiredSignals())
                .containsExactlyInAnyOrder(SignalKind.HAS_PATTERN, SignalKind.HAS_GOTCHA);
        assertThat(DocCategory.PATTERN_SPECIFIC.getRequiredSignals())
                .containsExactlyInAnyOrder(SignalKind.HAS_GOTCHA, SignalKind.HAS_PATTERN);
    }
}
