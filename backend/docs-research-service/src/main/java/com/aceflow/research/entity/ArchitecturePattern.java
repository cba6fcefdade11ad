package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Architecture patterns the research catalog knows about.
 * Anything the interview produces outside this set maps to UNKNOWN and gets the
 * core-framework fallback target set.
 */
public enum ArchitecturePattern {
    SOCIAL_PLATFORM("social_platform"),
    E_COMMERCE("e_commerce"),
    CONTENT_MANAGEMENT("content_management"),
    DASHBOARD_ANALYTICS("dashboard_analytics"),
    SIMPLE_CRUD("simple_crud"),
    UNKNOWN("unknown");

    private final String code;

    ArchitecturePattern(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Lenient lookup: "Social-Platform", "social platform" and "social_platform" are the same.
     */
    public static ArchitecturePattern fromName(String name) {
        if (name == null || name.isBlank()) return UNKNOWN;
        String normalized = name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        for (ArchitecturePattern pattern : values()) {
            if (pattern.code.equals(normalized)) {
                return pattern;
            }
        }
        // "ecommerce" style spellings
        String compact = normalized.replace("_", "");
        for (ArchitecturePattern pattern : values()) {
            if (pattern.code.replace("_", "").equals(compact)) {
                return pattern;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return code;
    }
}
