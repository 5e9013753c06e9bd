package com.traceconform.core.evaluation;

/**
 * Log-level fitness.
 *
 * @param averageTraceFitness       mean of the per-trace fitness values
 * @param percentageOfFittingTraces share of perfectly fitting traces, 0..100
 * @param logFitness                fitness aggregated over token counts (replay) or costs (alignments)
 */
public record FitnessSummary(double averageTraceFitness, double percentageOfFittingTraces, double logFitness) {

    public static FitnessSummary empty() {
        return new FitnessSummary(0.0, 0.0, 0.0);
    }
}
