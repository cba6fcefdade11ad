package com.aceflow.research.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FetchStatus {
    OK("ok"),
    ERROR("error"),
    TIMEOUT("timeout");

    private final String code;

    FetchStatus(String code) {
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
