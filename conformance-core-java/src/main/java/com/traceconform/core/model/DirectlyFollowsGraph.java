package com.traceconform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frequency graph: directly-follows counts plus start and end activity counts.
 */
public record DirectlyFollowsGraph(
        Map<ActivityPair, Long> frequencies,
        Map<String, Long> startActivities,
        Map<String, Long> endActivities
) {
    public DirectlyFollowsGraph {
        frequencies = Collections.unmodifiableMap(new LinkedHashMap<>(frequencies));
        startActivities = Collections.unmodifiableMap(new LinkedHashMap<>(startActivities));
        endActivities = Collections.unmodifiableMap(new LinkedHashMap<>(endActivities));
    }
}
