package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of knowledge signal a category is expected to show.
 */
public enum SignalKind {
    HAS_PATTERN("has-pattern"),
    HAS_GOTCHA("has-gotcha"),
    HAS_EXAMPLE("has-example");

    private final String code;

    SignalKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
