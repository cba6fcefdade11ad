package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the resolve/fetch loop stopped before coverage reached the gate.
 */
public enum IncompleteReason {
    SUPPLEMENTAL_PASS_LIMIT("supplemental_pass_limit", "Supplemental pass limit reached with categories still under threshold"),
    NO_NEW_TARGETS("no_new_targets", "No further targets could be resolved for the under-covered categories"),
    CANCELLED("cancelled", "Run was cancelled; validation used the results collected so far"),
    RUN_TIMEOUT("run_timeout", "Overall run timeout exceeded; validation used the results collected so far");

    private final String code;
    private final String description;

    IncompleteReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return code;
    }
}
