package com.traceconform.core.temporal;

/**
 * Expected elapsed time between two activities.
 */
public record TemporalStatistics(double mean, double stdev) {

    public TemporalStatistics {
        if (Double.isNaN(mean) || Double.isNaN(stdev)) {
            throw new IllegalArgumentException("mean and stdev must be numbers");
        }
        if (stdev < 0) {
            throw new IllegalArgumentException("stdev must be >= 0, got " + stdev);
        }
    }
}
