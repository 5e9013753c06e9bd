package com.traceconform.core.temporal;

import com.traceconform.core.model.ActivityPair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Expected time gaps per ordered activity pair, in the time unit of the log's timestamps
 * (seconds for temporal timestamp values).
 */
public final class TemporalProfile {

    private final Map<ActivityPair, TemporalStatistics> entries;

    public TemporalProfile(Map<ActivityPair, TemporalStatistics> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public TemporalStatistics get(String source, String target) {
        return entries.get(new ActivityPair(source, target));
    }

    public Map<ActivityPair, TemporalStatistics> entries() { return entries; }
    public int size() { return entries.size(); }

    public static final class Builder {
        private final Map<ActivityPair, TemporalStatistics> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String source, String target, double mean, double stdev) {
            entries.put(new ActivityPair(source, target), new TemporalStatistics(mean, stdev));
            return this;
        }

        public TemporalProfile build() {
            return new TemporalProfile(entries);
        }
    }
}
