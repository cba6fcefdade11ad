package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Logical grouping of documentation used for coverage scoring.
 *
 * Each category declares the signal kinds every one of its topics must show:
 * - CORE_FRAMEWORK: framework areas (data, auth, storage ...) need a reusable pattern and a worked example
 * - INTEGRATION: third-party services need a pattern and at least one pitfall
 * - PATTERN_SPECIFIC: architecture pattern guidance needs a pitfall and a pattern
 */
public enum DocCategory {
    CORE_FRAMEWORK("core-framework", "Core Framework",
            EnumSet.of(SignalKind.HAS_PATTERN, SignalKind.HAS_EXAMPLE)),
    INTEGRATION("integration", "Integration",
            EnumSet.of(SignalKind.HAS_PATTERN, SignalKind.HAS_GOTCHA)),
    PATTERN_SPECIFIC("pattern-specific", "Pattern Specific",
            EnumSet.of(SignalKind.HAS_GOTCHA, SignalKind.HAS_PATTERN));

    private final String code;
    private final String label;
    private final Set<SignalKind> requiredSignals;

    DocCategory(String code, String label, Set<SignalKind> requiredSignals) {
        this.code = code;
        this.label = label;
        this.requiredSignals = Collections.unmodifiableSet(requiredSignals);
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Signal kinds required per topic of this category.
     */
    public Set<SignalKind> getRequiredSignals() {
        return requiredSignals;
    }

    @Override
    public String toString() {
        return code;
    }
}
