package com.aceflow.research.service.extract;

import com.aceflow.research.dto.DocumentExtraction;
import com.aceflow.research.dto.ExtractedPattern;
import com.aceflow.research.dto.FetchResult;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.dto.Gotcha;
import com.aceflow.research.exception.ExtractionSkipException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Content Extraction Service
 *
 * status=ok 인 FetchResult에서 코드 패턴, 예제, gotcha, 링크를 추출합니다.
 * 바이너리/빈 문서/파싱 불가 문서는 WARN 로그 후 빈 추출 결과로 처리되며 실행을 중단하지 않습니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentExtractionService {

    private static final Set<String> NON_TEXT_TYPES = Set.of(
            "application/pdf", "application/octet-stream", "application/zip", "application/gzip",
            "application/json", "application/javascript", "text/css");

    private final List<DocumentParser> parsers;
    private final CodeBlockClassifier classifier;
    private final GotchaDetector gotchaDetector;

    /**
     * Extracts every OK result in parallel. Non-OK results are ignored.
     * The returned list is ordered by source URL.
     */
    public List<DocumentExtraction> extractAll(List<FetchResult> results) {
        List<DocumentExtraction> extractions = Flux.fromIterable(results)
                .filter(FetchResult::isOk)
                .parallel()
                .runOn(Schedulers.parallel())
                .map(this::extract)
                .sequential()
                .collectList()
                .block();
        List<DocumentExtraction> sorted = new ArrayList<>(extractions == null ? List.of() : extractions);
        sorted.sort(Comparator.comparing(DocumentExtraction::sourceUrl));
        return sorted;
    }

    public DocumentExtraction extract(FetchResult result) {
        if (!result.isOk()) {
            throw new IllegalArgumentException("Only OK fetch results can be extracted: " + result.url());
        }
        try {
            return doExtract(result);
        } catch (ExtractionSkipException e) {
            log.warn("Skipping extraction of {}: {}", e.getUrl(), e.getMessage());
            return DocumentExtraction.skipped(result, e.getMessage());
        }
    }

    private DocumentExtraction doExtract(FetchResult result) {
        String url = result.url();
        String content = result.rawContent();
        checkExtractable(url, content, result.contentType());

        DocumentParser parser = parsers.stream()
                .filter(p -> p.supports(result.contentType(), content))
                .findFirst()
                .orElseThrow(() -> ExtractionSkipException.unsupportedContentType(url, result.contentType()));

        ParsedDocument document;
        try {
            document = parser.parse(url, content);
        } catch (RuntimeException e) {
            throw ExtractionSkipException.unparseable(url, e);
        }
        if (document.isEmpty()) {
            throw ExtractionSkipException.emptyContent(url);
        }

        List<ExtractedPattern> patterns = extractPatterns(document.blocks(), result.target());
        List<Gotcha> gotchas = gotchaDetector.detect(document.blocks(), result.target());

        log.debug("Extracted {}: patterns={}, gotchas={}, links={}",
                url, patterns.size(), gotchas.size(), document.links().size());
        return new DocumentExtraction(result, patterns, gotchas, document.links(), null);
    }

    private List<ExtractedPattern> extractPatterns(List<DocumentBlock> blocks, FetchTarget target) {
        List<ExtractedPattern> patterns = new ArrayList<>();
        String nearestHeading = null;
        DocumentBlock previous = null;

        for (DocumentBlock block : blocks) {
            if (block.type() == BlockType.HEADING) {
                nearestHeading = block.text();
            } else if (block.type() == BlockType.CODE && classifier.isPattern(block.text(), block.language())) {
                String description = previous != null && (previous.isProse() || previous.type() == BlockType.HEADING)
                        ? previous.text()
                        : null;
                boolean example = classifier.isExample(block.text(), description, nearestHeading);
                patterns.add(new ExtractedPattern(target.url(), target.category(), target.topic(),
                        block.text(), description, block.language(), example));
            }
            previous = block;
        }
        return patterns;
    }

    /**
     * @throws ExtractionSkipException for empty, binary or non-document content
     */
    void checkExtractable(String url, String content, String contentType) {
        if (content == null || content.isBlank()) {
            throw ExtractionSkipException.emptyContent(url);
        }
        if (contentType != null) {
            String ct = contentType.toLowerCase(Locale.ROOT);
            int semicolon = ct.indexOf(';');
            String mime = (semicolon >= 0 ? ct.substring(0, semicolon) : ct).trim();
            if (mime.startsWith("image/") || mime.startsWith("audio/") || mime.startsWith("video/")
                    || mime.startsWith("font/") || NON_TEXT_TYPES.contains(mime)) {
                throw ExtractionSkipException.unsupportedContentType(url, contentType);
            }
        }
        if (looksBinary(content)) {
            throw ExtractionSkipException.binaryContent(url);
        }
    }

    static boolean looksBinary(String content) {
        int sample = Math.min(content.length(), 4096);
        int suspicious = 0;
        for (int i = 0; i < sample; i++) {
            char c = content.charAt(i);
            if (c == '\0') {
                return true;
            }
            if (c == '\uFFFD' || (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t')) {
                suspicious++;
            }
        }
        return sample > 0 && suspicious > sample / 10;
    }
}
