package com.aceflow.research.dto;

import com.aceflow.research.entity.SignalKind;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Comparator;

/**
 * A signal kind scoped to one topic of a category, e.g. "auth/has-example".
 */
public record CoverageSignal(String topic, SignalKind kind) implements Comparable<CoverageSignal> {

    private static final Comparator<CoverageSignal> ORDER = Comparator
            .comparing(CoverageSignal::topic)
            .thenComparing(CoverageSignal::kind);

    @JsonValue
    public String key() {
        return topic + "/" + kind.getCode();
    }

    @Override
    public int compareTo(CoverageSignal other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return key();
    }
}
