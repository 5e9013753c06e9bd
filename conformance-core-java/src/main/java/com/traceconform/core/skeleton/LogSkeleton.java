package com.traceconform.core.skeleton;

import com.traceconform.core.model.ActivityPair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Declarative model made of six independent constraint families.
 *
 * Always-before pairs are (activity, prerequisite); always-after pairs are (activity, consequent).
 */
public final class LogSkeleton {

    private final Map<ActivityPair, CountBounds> directlyFollows;
    private final Set<ActivityPair> alwaysBefore;
    private final Set<ActivityPair> alwaysAfter;
    private final Set<ActivityPair> equivalence;
    private final Set<ActivityPair> neverTogether;
    private final Map<String, Set<Integer>> activityOccurrences;

    private LogSkeleton(Builder b) {
        this.directlyFollows = Collections.unmodifiableMap(new LinkedHashMap<>(b.directlyFollows));
        this.alwaysBefore = Collections.unmodifiableSet(new LinkedHashSet<>(b.alwaysBefore));
        this.alwaysAfter = Collections.unmodifiableSet(new LinkedHashSet<>(b.alwaysAfter));
        this.equivalence = Collections.unmodifiableSet(new LinkedHashSet<>(b.equivalence));
        this.neverTogether = Collections.unmodifiableSet(new LinkedHashSet<>(b.neverTogether));
        Map<String, Set<Integer>> occ = new LinkedHashMap<>();
        b.activityOccurrences.forEach((k, v) -> occ.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
        this.activityOccurrences = Collections.unmodifiableMap(occ);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<ActivityPair, CountBounds> directlyFollows()   { return directlyFollows; }
    public Set<ActivityPair> alwaysBefore()                   { return alwaysBefore; }
    public Set<ActivityPair> alwaysAfter()                    { return alwaysAfter; }
    public Set<ActivityPair> equivalence()                    { return equivalence; }
    public Set<ActivityPair> neverTogether()                  { return neverTogether; }
    public Map<String, Set<Integer>> activityOccurrences()    { return activityOccurrences; }

    /** Number of declared constraint instances over all families. */
    public int constraintCount() {
        return directlyFollows.size() + alwaysBefore.size() + alwaysAfter.size()
                + equivalence.size() + neverTogether.size() + activityOccurrences.size();
    }

    public static final class Builder {
        private final Map<ActivityPair, CountBounds> directlyFollows = new LinkedHashMap<>();
        private final Set<ActivityPair> alwaysBefore = new LinkedHashSet<>();
        private final Set<ActivityPair> alwaysAfter = new LinkedHashSet<>();
        private final Set<ActivityPair> equivalence = new LinkedHashSet<>();
        private final Set<ActivityPair> neverTogether = new LinkedHashSet<>();
        private final Map<String, Set<Integer>> activityOccurrences = new LinkedHashMap<>();

        private Builder() {}

        public Builder directlyFollows(String source, String target, CountBounds bounds) {
            directlyFollows.put(new ActivityPair(source, target), bounds);
            return this;
        }

        public Builder alwaysBefore(String activity, String prerequisite) {
            alwaysBefore.add(new ActivityPair(activity, prerequisite));
            return this;
        }

        public Builder alwaysAfter(String activity, String consequent) {
            alwaysAfter.add(new ActivityPair(activity, consequent));
            return this;
        }

        public Builder equivalence(String first, String second) {
            equivalence.add(new ActivityPair(first, second));
            return this;
        }

        public Builder neverTogether(String first, String second) {
            neverTogether.add(new ActivityPair(first, second));
            return this;
        }

        public Builder activityOccurrences(String activity, Set<Integer> allowedCounts) {
            activityOccurrences.put(activity, allowedCounts);
            return this;
        }

        public LogSkeleton build() {
            return new LogSkeleton(this);
        }
    }
}
