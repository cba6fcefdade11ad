package com.aceflow.research.dto;

import java.util.List;

/**
 * Everything the extractor produced for one fetch result.
 *
 * @param skipReason why the document yielded nothing, null when it was processed
 */
public record DocumentExtraction(
        FetchResult source,
        List<ExtractedPattern> patterns,
        List<Gotcha> gotchas,
        List<DocumentLink> links,
        String skipReason
) {
    public DocumentExtraction {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        gotchas = gotchas == null ? List.of() : List.copyOf(gotchas);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public static DocumentExtraction skipped(FetchResult source, String reason) {
        return new DocumentExtraction(source, List.of(), List.of(), List.of(), reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public String sourceUrl() {
        return source.url();
    }
}
