package com.traceconform.core.temporal;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.Event;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Timestamps;
import com.traceconform.core.log.Trace;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags, per case, every pair of events (a before b, not necessarily adjacent) whose elapsed time
 * deviates from the profile by more than zeta standard deviations.
 *
 * Pairs without a profile entry are skipped. Within a case, deviations are listed in the order
 * the pair completes: by position of b, then by position of a.
 */
public class TemporalProfileAnalyzer {

    public static final double DEFAULT_ZETA = 1.0;

    private final TemporalProfile profile;
    private final double zeta;

    public TemporalProfileAnalyzer(TemporalProfile profile, double zeta) {
        if (Double.isNaN(zeta) || zeta < 0) {
            throw new IllegalArgumentException("zeta must be >= 0, got " + zeta);
        }
        this.profile = profile;
        this.zeta = zeta;
    }

    /** One deviation list per case, in log order. */
    public List<List<TemporalDeviation>> analyze(EventLog log, ConformanceProperties properties) {
        List<List<TemporalDeviation>> result = new ArrayList<>(log.size());
        for (Trace trace : log.traces()) {
            result.add(analyzeTrace(trace, properties));
        }
        return result;
    }

    public List<TemporalDeviation> analyzeTrace(Trace trace, ConformanceProperties properties) {
        String activityKey = properties.getActivityKey();
        String timestampKey = properties.getTimestampKey();

        int n = trace.size();
        String[] activities = new String[n];
        double[] times = new double[n];
        for (int i = 0; i < n; i++) {
            Event e = trace.get(i);
            activities[i] = String.valueOf(e.require(activityKey));
            times[i] = Timestamps.toSeconds(e.require(timestampKey), timestampKey);
        }

        List<TemporalDeviation> deviations = new ArrayList<>();
        for (int j = 1; j < n; j++) {
            for (int i = 0; i < j; i++) {
                TemporalStatistics stats = profile.get(activities[i], activities[j]);
                if (stats == null) {
                    continue;
                }
                double gap = times[j] - times[i];
                double distance = Math.abs(gap - stats.mean());
                double bound = zeta * stats.stdev();
                if (distance > bound) {
                    double score = stats.stdev() > 0 ? distance / stats.stdev() : Double.POSITIVE_INFINITY;
                    deviations.add(new TemporalDeviation(activities[i], activities[j], gap,
                            stats.mean(), stats.stdev(), bound, score));
                }
            }
        }
        return deviations;
    }

    public double getZeta() { return zeta; }
}
