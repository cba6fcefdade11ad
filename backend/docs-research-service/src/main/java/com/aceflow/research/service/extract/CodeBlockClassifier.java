package com.aceflow.research.service.extract;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 코드 블록이 재사용 가능한 패턴인지 판정합니다.
 *
 * 패턴 조건:
 * - 공백이 아닌 줄이 2줄 이상
 * - 셸 명령만으로 구성되지 않음 (npm install, $ 프롬프트 등)
 * - 선언, 할당, 블록 구조 중 하나 이상 포함
 *
 * 예제 판정: 설명 문단, 가까운 헤딩, 첫 주석 줄에 예제 단서(example, usage, how to ...)가 있는 경우
 */
@Component
public class CodeBlockClassifier {

    private static final Set<String> SHELL_LANGUAGES =
            Set.of("bash", "sh", "shell", "zsh", "console", "terminal", "powershell", "ps", "cmd", "shell-session");

    private static final Pattern SHELL_LINE = Pattern.compile(
            "^(\\$\\s|>\\s|#!|(npm|npx|yarn|pnpm|bun|pip|brew|git|cd|mkdir|curl|wget|amplify|docker|sudo|node|ls|cp|mv|rm)\\b).*");

    private static final Pattern DECLARATION = Pattern.compile(
            "\\b(const|let|var|function|class|interface|type|enum|import|export|def|fun|func|public|private|async)\\b");

    private static final Pattern ASSIGNMENT = Pattern.compile("[^=!<>]=[^=>]|=>|:=");

    private static final Pattern BLOCK_MARKER = Pattern.compile("[{}\\[\\]]|\\)\\s*:$|^\\s*<\\w+[^>]*>", Pattern.MULTILINE);

    private static final List<String> EXAMPLE_CUES = List.of(
            "example", "usage", "for instance", "e.g.", "sample", "quickstart",
            "getting started", "tutorial", "how to", "demo");

    public boolean isPattern(String code, String language) {
        if (code == null) {
            return false;
        }
        List<String> lines = nonBlankLines(code);
        if (lines.size() < 2) {
            return false;
        }
        if (isShellOnly(lines, language)) {
            return false;
        }
        return DECLARATION.matcher(code).find()
                || ASSIGNMENT.matcher(code).find()
                || BLOCK_MARKER.matcher(code).find();
    }

    public boolean isShellOnly(List<String> lines, String language) {
        if (language != null && SHELL_LANGUAGES.contains(language.toLowerCase(Locale.ROOT))) {
            return true;
        }
        return lines.stream()
                .map(String::trim)
                .allMatch(line -> line.startsWith("#") && !line.startsWith("#!") && !line.startsWith("#include")
                        || SHELL_LINE.matcher(line).matches());
    }

    /**
     * @param cues description, nearest heading and the first comment line of the code, any may be null
     */
    public boolean isExample(String code, String... cues) {
        for (String cue : cues) {
            if (hasExampleCue(cue)) {
                return true;
            }
        }
        return hasExampleCue(firstCommentLine(code));
    }

    static boolean hasExampleCue(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return EXAMPLE_CUES.stream().anyMatch(lower::contains);
    }

    static String firstCommentLine(String code) {
        if (code == null) {
            return null;
        }
        return nonBlankLines(code).stream()
                .map(String::trim)
                .filter(line -> line.startsWith("//") || line.startsWith("#") || line.startsWith("/*")
                        || line.startsWith("*") || line.startsWith("<!--"))
                .findFirst()
                .orElse(null);
    }

    private static List<String> nonBlankLines(String code) {
        return Arrays.stream(code.split("\\R"))
                .filter(line -> !line.isBlank())
                .toList();
    }
}
