package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Gate status read by downstream consumers before they use a bundle.
 */
public enum BundleStatus {
    COMPLETE("complete", 0),
    INCOMPLETE("incomplete", 1);

    private final String code;
    private final int exitCode;

    BundleStatus(String code, int exitCode) {
        this.code = code;
        this.exitCode = exitCode;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getExitCode() {
        return exitCode;
    }

    @Override
    public String toString() {
        return code;
    }
}
