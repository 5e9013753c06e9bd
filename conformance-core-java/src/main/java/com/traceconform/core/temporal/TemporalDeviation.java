package com.traceconform.core.temporal;

/**
 * An activity pair whose observed gap lies outside {@code mean ± zeta * stdev}.
 *
 * @param allowedBound the tolerated distance from the mean ({@code zeta * stdev})
 * @param zetaScore    {@code |observedGap - mean| / stdev}; positive infinity when stdev is 0
 */
public record TemporalDeviation(
        String source,
        String target,
        double observedGap,
        double expectedMean,
        double expectedStdev,
        double allowedBound,
        double zetaScore
) {}
