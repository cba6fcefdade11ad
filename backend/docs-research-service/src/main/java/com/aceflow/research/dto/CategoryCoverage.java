package com.aceflow.research.dto;

import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.TargetPriority;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Coverage of one category: which required signals were observed and the resulting score.
 */
public record CategoryCoverage(
        DocCategory category,
        TargetPriority priority,
        SortedSet<CoverageSignal> requiredSignals,
        SortedSet<CoverageSignal> observedSignals,
        double score
) {
    public CategoryCoverage {
        requiredSignals = Collections.unmodifiableSortedSet(new TreeSet<>(requiredSignals));
        observedSignals = Collections.unmodifiableSortedSet(new TreeSet<>(observedSignals));
    }

    public SortedSet<CoverageSignal> missingSignals() {
        TreeSet<CoverageSignal> missing = new TreeSet<>(requiredSignals);
        missing.removeAll(observedSignals);
        return missing;
    }

    public SortedSet<String> missingTopics() {
        TreeSet<String> topics = new TreeSet<>();
        missingSignals().forEach(signal -> topics.add(signal.topic()));
        return topics;
    }

    public boolean isCritical() {
        return priority == TargetPriority.CRITICAL;
    }
}
