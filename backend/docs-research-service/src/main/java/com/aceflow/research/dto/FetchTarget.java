package com.aceflow.research.dto;

import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.TargetPriority;
import com.aceflow.research.util.UrlUtils;

import java.util.Locale;

/**
 * One URL scheduled for fetching. Identity is the URL.
 */
public record FetchTarget(
        String url,
        DocCategory category,
        String topic,
        TargetPriority priority,
        String originRequest
) {
    public FetchTarget {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Target url must not be blank");
        }
        if (category == null || priority == null) {
            throw new IllegalArgumentException("Target category and priority are required: " + url);
        }
        topic = topic == null || topic.isBlank() ? "general" : topic.trim().toLowerCase(Locale.ROOT);
    }

    public String host() {
        return UrlUtils.hostOf(url);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FetchTarget other)) return false;
        return url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }
}
