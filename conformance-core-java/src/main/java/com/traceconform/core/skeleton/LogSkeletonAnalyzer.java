package com.traceconform.core.skeleton;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Trace;
import com.traceconform.core.model.ActivityPair;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates every case of a log against the six families of a {@link LogSkeleton}.
 */
public class LogSkeletonAnalyzer {

    private final LogSkeleton skeleton;

    public LogSkeletonAnalyzer(LogSkeleton skeleton) {
        this.skeleton = skeleton;
    }

    /** One result per case, in log order. */
    public List<SkeletonConformanceResult> analyze(EventLog log, ConformanceProperties properties) {
        List<SkeletonConformanceResult> results = new ArrayList<>(log.size());
        for (Trace trace : log.traces()) {
            results.add(analyzeTrace(trace, properties));
        }
        return results;
    }

    public SkeletonConformanceResult analyzeTrace(Trace trace, ConformanceProperties properties) {
        CaseProfile c = new CaseProfile(trace.activities(properties.getActivityKey()));
        Set<SkeletonViolation> violations = new LinkedHashSet<>();

        for (Map.Entry<ActivityPair, CountBounds> e : skeleton.directlyFollows().entrySet()) {
            ActivityPair pair = e.getKey();
            if (c.count(pair.source()) > 0 && !e.getValue().contains(c.adjacentCount(pair))) {
                violations.add(SkeletonViolation.of(ConstraintFamily.DIRECTLY_FOLLOWS, pair.source(), pair.target()));
            }
        }
        for (ActivityPair pair : skeleton.alwaysBefore()) {
            String activity = pair.source();
            String prerequisite = pair.target();
            if (c.count(activity) > 0 && !c.occursBefore(prerequisite, activity)) {
                violations.add(SkeletonViolation.of(ConstraintFamily.ALWAYS_BEFORE, activity, prerequisite));
            }
        }
        for (ActivityPair pair : skeleton.alwaysAfter()) {
            String activity = pair.source();
            String consequent = pair.target();
            if (c.count(activity) > 0 && !c.occursBefore(activity, consequent)) {
                violations.add(SkeletonViolation.of(ConstraintFamily.ALWAYS_AFTER, activity, consequent));
            }
        }
        for (ActivityPair pair : skeleton.equivalence()) {
            if (c.count(pair.source()) != c.count(pair.target())) {
                violations.add(SkeletonViolation.of(ConstraintFamily.EQUIVALENCE, pair.source(), pair.target()));
            }
        }
        for (ActivityPair pair : skeleton.neverTogether()) {
            if (c.count(pair.source()) > 0 && c.count(pair.target()) > 0) {
                violations.add(SkeletonViolation.of(ConstraintFamily.NEVER_TOGETHER, pair.source(), pair.target()));
            }
        }
        for (Map.Entry<String, Set<Integer>> e : skeleton.activityOccurrences().entrySet()) {
            if (!e.getValue().contains(c.count(e.getKey()))) {
                violations.add(SkeletonViolation.of(ConstraintFamily.ACTIV_OCCURRENCES, e.getKey()));
            }
        }
        return new SkeletonConformanceResult(violations, skeleton.constraintCount());
    }

    /** Occurrence counts, first/last positions and adjacent pairs of one case. */
    private static final class CaseProfile {
        private final Map<String, Integer> counts = new HashMap<>();
        private final Map<String, Integer> firstIndex = new HashMap<>();
        private final Map<String, Integer> lastIndex = new HashMap<>();
        private final Map<ActivityPair, Integer> adjacent = new HashMap<>();

        CaseProfile(List<String> activities) {
            for (int i = 0; i < activities.size(); i++) {
                String a = activities.get(i);
                counts.merge(a, 1, Integer::sum);
                firstIndex.putIfAbsent(a, i);
                lastIndex.put(a, i);
                if (i + 1 < activities.size()) {
                    adjacent.merge(new ActivityPair(a, activities.get(i + 1)), 1, Integer::sum);
                }
            }
        }

        int count(String activity) {
            return counts.getOrDefault(activity, 0);
        }

        int adjacentCount(ActivityPair pair) {
            return adjacent.getOrDefault(pair, 0);
        }

        /** True if some occurrence of {@code earlier} is strictly before some occurrence of {@code later}. */
        boolean occursBefore(String earlier, String later) {
            Integer first = firstIndex.get(earlier);
            Integer last = lastIndex.get(later);
            return first != null && last != null && first < last;
        }
    }
}
