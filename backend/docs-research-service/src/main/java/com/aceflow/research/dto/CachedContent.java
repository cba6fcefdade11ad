package com.aceflow.research.dto;

import java.time.Instant;

/**
 * Immutable cache entry for one URL.
 */
public record CachedContent(
        String url,
        String content,
        String contentType,
        Instant cachedAt
) {
}
