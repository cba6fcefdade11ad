package com.aceflow.research.exception;

import com.aceflow.research.entity.FetchFailureReason;

/**
 * Raised inside the fetch chain. Never escapes the fetcher: it is recorded on the FetchResult.
 */
public class FetchFailureException extends ResearchPipelineException
        implements FetchFailureReason.FetchFailureCarrier {

    private final FetchFailureReason reason;
    private final String url;

    public FetchFailureException(FetchFailureReason reason, String url, String message) {
        super("FETCH_" + reason.name(), message);
        this.reason = reason;
        this.url = url;
    }

    @Override
    public FetchFailureReason getReason() {
        return reason;
    }

    public String getUrl() {
        return url;
    }

    public static FetchFailureException emptyContent(String url) {
        return new FetchFailureException(FetchFailureReason.EMPTY_CONTENT, url, "Empty response body from " + url);
    }

    public static FetchFailureException invalidUrl(String url) {
        return new FetchFailureException(FetchFailureReason.INVALID_URL, url, "Invalid URL: " + url);
    }
}
