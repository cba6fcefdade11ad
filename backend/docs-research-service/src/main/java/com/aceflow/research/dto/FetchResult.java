package com.aceflow.research.dto;

import com.aceflow.research.entity.FetchFailureReason;
import com.aceflow.research.entity.FetchStatus;

import java.time.Instant;

/**
 * Outcome of fetching one target within one run.
 *
 * @param rawContent   body text, null unless status is OK
 * @param fetchedAt    network fetch time, or the cache write time for cache hits
 * @param attemptCount network attempts made, 0 for cache hits
 * @param errorDetail  "&lt;failure code&gt;: message", null when OK
 */
public record FetchResult(
        FetchTarget target,
        FetchStatus status,
        String rawContent,
        String contentType,
        Instant fetchedAt,
        int attemptCount,
        String errorDetail,
        boolean fromCache
) {
    public static FetchResult ok(FetchTarget target, String content, String contentType,
                                 Instant fetchedAt, int attempts) {
        return new FetchResult(target, FetchStatus.OK, content, contentType, fetchedAt, attempts, null, false);
    }

    public static FetchResult cached(FetchTarget target, CachedContent cached) {
        return new FetchResult(target, FetchStatus.OK, cached.content(), cached.contentType(),
                cached.cachedAt(), 0, null, true);
    }

    public static FetchResult failed(FetchTarget target, FetchFailureReason reason, String message,
                                     Instant at, int attempts) {
        return new FetchResult(target, FetchStatus.ERROR, null, null, at, attempts,
                reason.getCode() + ": " + message, false);
    }

    /**
     * In-flight or queued fetch aborted by cancellation or the run deadline.
     */
    public static FetchResult aborted(FetchTarget target, FetchFailureReason reason, Instant at, int attempts) {
        return new FetchResult(target, FetchStatus.TIMEOUT, null, null, at, attempts,
                reason.getCode() + ": " + reason.getDescription(), false);
    }

    public String url() {
        return target.url();
    }

    public boolean isOk() {
        return status == FetchStatus.OK;
    }
}
