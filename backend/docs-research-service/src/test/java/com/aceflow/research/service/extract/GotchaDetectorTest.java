package com.aceflow.research.service.extract;

import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.TargetPriority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static com.aceflow.research.support.ResearchFixtures.target;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * GotchaDetector 단위 테스트
 */
class GotchaDetectorTest {

    private static final FetchTarget TARGET = target("https://docs.example.com/auth",
            DocCategory.PATTERN_SPECIFIC, "authorization", TargetPriority.CRITICAL);

    private final GotchaDetector detector = new GotchaDetector();

    @Test
    @DisplayName("Warning 문장 하나는 gotcha 하나가 된다")
    void warningSentence() {
        // given
        List<DocumentBlock> blocks = List.of(
                DocumentBlock.paragraph("Warning: policy must be attached to user, not group."),
                DocumentBlock.paragraph("Policies attached to groups are ignored at runtime."));

        // when
        List<Gotcha> gotchas = detector.detect(blocks, TARGET);

        // then
        assertThat(gotchas).hasSize(1);
        Gotcha gotcha = gotchas.get(0);
        assertThat(gotcha.warningText()).isEqualTo("Warning: policy must be attached to user, not group.");
        assertThat(gotcha.nearbyContext()).isEqualTo("Policies attached to groups are ignored at runtime.");
        assertThat(gotcha.sourceUrl()).isEqualTo(TARGET.url());
        assertThat(gotcha.category()).isEqualTo(DocCategory.PATTERN_SPECIFIC);
        assertThat(gotcha.topic()).isEqualTo("authorization");
        assertThat(gotcha.indicator()).isEqualTo("warning:");
    }

    @Test
    @DisplayName("문단 안에서 지표가 있는 문장만 gotcha가 된다")
    void onlyMatchingSentences() {
        List<DocumentBlock> blocks = List.of(DocumentBlock.paragraph(
                "Create the bucket first. Make sure the bucket name is unique. Then deploy."));

        List<Gotcha> gotchas = detector.detect(blocks, TARGET);

        assertThat(gotchas).extracting(Gotcha::warningText).containsExactly("Make sure the bucket name is unique.");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "NOTE: tokens expire after one hour.",
            "Important: enable MFA before production.",
            "Avoid storing secrets in the client bundle.",
            "This is a common mistake when migrating.",
            "The v5 API is deprecated."
    })
    @DisplayName("lexicon 지표는 대소문자를 구분하지 않는다")
    void lexiconCaseInsensitive(String sentence) {
        List<Gotcha> gotchas = detector.detect(List.of(DocumentBlock.paragraph(sentence)), TARGET);

        assertThat(gotchas).hasSize(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Denote the owner field explicitly.",
            "Our notebook sample uses React.",
            "The avoidance list is optional."
    })
    @DisplayName("단어 경계가 맞지 않으면 지표로 보지 않는다")
    void wordBoundaries(String sentence) {
        assertThat(detector.detect(List.of(DocumentBlock.paragraph(sentence)), TARGET)).isEmpty();
    }

    @Test
    @DisplayName("admonition 블록은 lexicon 없이도 gotcha가 된다")
    void admonitionIsGotcha() {
        List<DocumentBlock> blocks = List.of(DocumentBlock.admonition("caution", "Rotating keys invalidates sessions"));

        List<Gotcha> gotchas = detector.detect(blocks, TARGET);

        assertThat(gotchas).hasSize(1);
        assertThat(gotchas.get(0).indicator()).isEqualTo("admonition:caution");
    }

    @Test
    @DisplayName("Troubleshooting 헤딩 다음 문단은 gotcha가 된다")
    void indicatorHeading() {
        List<DocumentBlock> blocks = List.of(
                DocumentBlock.heading(2, "Troubleshooting"),
                DocumentBlock.paragraph("Sign-in fails when the user pool client has a secret."),
                DocumentBlock.paragraph("Another paragraph without indicators."));

        List<Gotcha> gotchas = detector.detect(blocks, TARGET);

        assertThat(gotchas).extracting(Gotcha::warningText)
                .containsExactly("Sign-in fails when the user pool client has a secret.");
    }

    @Test
    @DisplayName("코드 블록의 주석은 gotcha로 보지 않는다")
    void codeIgnored() {
        List<DocumentBlock> blocks = List.of(DocumentBlock.code("// Note: this is a comment\nconst a = 1;", "ts"));

        assertThat(detector.detect(blocks, TARGET)).isEmpty();
    }
}
