package com.traceconform.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Relation footprint of a log, a trace or a model.
 *
 * {@code sequence} holds pairs (a, b) where a is directly followed by b but never the other way round;
 * {@code parallel} holds pairs seen in both directions (stored in both orientations).
 */
public record Footprint(
        Set<String> activities,
        Set<String> startActivities,
        Set<String> endActivities,
        Set<ActivityPair> sequence,
        Set<ActivityPair> parallel,
        int minTraceLength
) {
    public Footprint {
        activities = copy(activities);
        startActivities = copy(startActivities);
        endActivities = copy(endActivities);
        sequence = copy(sequence);
        parallel = copy(parallel);
    }

    private static <T> Set<T> copy(Set<T> s) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(s));
    }

    public FootprintRelation relation(String a, String b) {
        ActivityPair pair = new ActivityPair(a, b);
        if (parallel.contains(pair)) {
            return FootprintRelation.PARALLEL;
        }
        if (sequence.contains(pair)) {
            return FootprintRelation.DIRECTLY_FOLLOWS;
        }
        return FootprintRelation.NEVER_FOLLOWS;
    }
}
