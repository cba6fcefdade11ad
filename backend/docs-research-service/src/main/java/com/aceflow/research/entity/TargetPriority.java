package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fetch priority tier. The weight feeds the overall coverage score.
 */
public enum TargetPriority {
    CRITICAL("critical", 3),
    IMPORTANT("important", 2),
    SUPPLEMENTARY("supplementary", 1);

    private final String code;
    private final int weight;

    TargetPriority(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getWeight() {
        return weight;
    }

    public static TargetPriority highest(TargetPriority a, TargetPriority b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.weight >= b.weight ? a : b;
    }

    @Override
    public String toString() {
        return code;
    }
}
