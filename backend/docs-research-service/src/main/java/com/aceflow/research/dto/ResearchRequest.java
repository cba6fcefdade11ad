package com.aceflow.research.dto;

import com.aceflow.research.entity.ArchitecturePattern;

import java.nio.file.Path;
import java.util.Locale;

/**
 * One research invocation: the (domain, pattern) pair produced by the interview.
 *
 * @param domain          free-text domain description, may be blank
 * @param pattern         parsed architecture pattern (UNKNOWN when unrecognized)
 * @param rawPattern      pattern name exactly as given
 * @param outputDirectory where the bundle is written, null for the configured default
 * @param bypassCache     skip cache reads (cache writes still happen)
 */
public record ResearchRequest(
        String domain,
        ArchitecturePattern pattern,
        String rawPattern,
        Path outputDirectory,
        boolean bypassCache
) {
    public ResearchRequest {
        domain = domain == null ? "" : domain.trim();
        pattern = pattern == null ? ArchitecturePattern.UNKNOWN : pattern;
    }

    public static ResearchRequest of(String domain, String pattern) {
        return new ResearchRequest(domain, ArchitecturePattern.fromName(pattern), pattern, null, false);
    }

    public ResearchRequest withOutputDirectory(Path outputDirectory) {
        return new ResearchRequest(domain, pattern, rawPattern, outputDirectory, bypassCache);
    }

    public ResearchRequest withBypassCache(boolean bypassCache) {
        return new ResearchRequest(domain, pattern, rawPattern, outputDirectory, bypassCache);
    }

    /**
     * Stable description stamped on every target as its origin request.
     */
    public String describe() {
        return pattern.getCode() + ":" + domain;
    }

    /**
     * Directory-safe name for the bundle, e.g. "simple_crud-contact-manager".
     */
    public String slug() {
        String domainSlug = domain.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (domainSlug.length() > 60) {
            domainSlug = domainSlug.substring(0, 60).replaceAll("-+$", "");
        }
        return domainSlug.isEmpty() ? pattern.getCode() : pattern.getCode() + "-" + domainSlug;
    }
}
