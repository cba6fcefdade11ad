package com.aceflow.research.exception;

/**
 * Malformed or binary content. Logged by the extractor and turned into an empty extraction.
 */
public class ExtractionSkipException extends ResearchPipelineException {

    private final String url;

    public ExtractionSkipException(String url, String message) {
        super("EXTRACTION_SKIP", message);
        this.url = url;
    }

    public ExtractionSkipException(String url, String message, Throwable cause) {
        super("EXTRACTION_SKIP", message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public static ExtractionSkipException emptyContent(String url) {
        return new ExtractionSkipException(url, "empty content");
    }

    public static ExtractionSkipException binaryContent(String url) {
        return new ExtractionSkipException(url, "binary content");
    }

    public static ExtractionSkipException unsupportedContentType(String url, String contentType) {
        return new ExtractionSkipException(url, "unsupported content type: " + contentType);
    }

    public static ExtractionSkipException unparseable(String url, Throwable cause) {
        return new ExtractionSkipException(url, "unparseable document: " + cause.getMessage(), cause);
    }
}
