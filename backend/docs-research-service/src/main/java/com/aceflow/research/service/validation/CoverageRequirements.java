package com.aceflow.research.service.validation;

import com.aceflow.research.dto.CoverageSignal;
import com.aceflow.research.dto.FetchTarget;
import com.aceflow.research.entity.DocCategory;
import com.aceflow.research.entity.SignalKind;
import com.aceflow.research.entity.TargetPriority;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Required signals per category, fixed from the initial target set of a run.
 *
 * Every (category, topic) pair of the initial targets requires the signal kinds of its
 * category. A category's weight comes from the highest priority among its initial targets.
 */
public final class CoverageRequirements {

    private final Map<DocCategory, SortedSet<CoverageSignal>> required;
    private final Map<DocCategory, TargetPriority> priorities;

    private CoverageRequirements(Map<DocCategory, SortedSet<CoverageSignal>> required,
                                 Map<DocCategory, TargetPriority> priorities) {
        this.required = Collections.unmodifiableMap(required);
        this.priorities = Collections.unmodifiableMap(priorities);
    }

    public static CoverageRequirements fromTargets(List<FetchTarget> initialTargets) {
        Map<DocCategory, SortedSet<CoverageSignal>> required = new EnumMap<>(DocCategory.class);
        Map<DocCategory, TargetPriority> priorities = new EnumMap<>(DocCategory.class);

        for (FetchTarget target : initialTargets) {
            SortedSet<CoverageSignal> signals = required.computeIfAbsent(target.category(), c -> new TreeSet<>());
            for (SignalKind kind : target.category().getRequiredSignals()) {
                signals.add(new CoverageSignal(target.topic(), kind));
            }
            priorities.merge(target.category(), target.priority(), TargetPriority::highest);
        }
        required.replaceAll((category, signals) -> Collections.unmodifiableSortedSet(signals));
        return new CoverageRequirements(required, priorities);
    }

    public Set<DocCategory> categories() {
        return required.keySet();
    }

    public SortedSet<CoverageSignal> requiredFor(DocCategory category) {
        return required.getOrDefault(category, Collections.emptySortedSet());
    }

    public TargetPriority priorityOf(DocCategory category) {
        return priorities.getOrDefault(category, TargetPriority.SUPPLEMENTARY);
    }

    public boolean requires(DocCategory category, CoverageSignal signal) {
        return requiredFor(category).contains(signal);
    }
}
