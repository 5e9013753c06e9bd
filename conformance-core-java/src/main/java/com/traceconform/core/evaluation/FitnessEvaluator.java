package com.traceconform.core.evaluation;

import com.traceconform.core.ConformanceException;
import com.traceconform.core.engine.AlignmentResult;
import com.traceconform.core.engine.ReplayResult;

import java.util.List;

/**
 * Aggregates per-trace diagnostics into log-level fitness and guards precision values.
 */
public final class FitnessEvaluator {

    private static final double PRECISION_SLACK = 1e-9;

    private FitnessEvaluator() {}

    public static FitnessSummary fromReplay(List<ReplayResult> results) {
        if (results.isEmpty()) {
            return FitnessSummary.empty();
        }
        int fit = 0;
        double fitnessSum = 0.0;
        long missing = 0, remaining = 0, produced = 0, consumed = 0;
        for (ReplayResult r : results) {
            if (r.traceIsFit()) fit++;
            fitnessSum += r.traceFitness();
            missing += r.missingTokens();
            remaining += r.remainingTokens();
            produced += r.producedTokens();
            consumed += r.consumedTokens();
        }
        double consumedPart = consumed > 0 ? 1.0 - (double) missing / consumed : 1.0;
        double producedPart = produced > 0 ? 1.0 - (double) remaining / produced : 1.0;
        return new FitnessSummary(
                fitnessSum / results.size(),
                100.0 * fit / results.size(),
                0.5 * consumedPart + 0.5 * producedPart);
    }

    /** A {@code null} alignment counts as fitness 0 and is left out of the cost sums. */
    public static FitnessSummary fromAlignments(List<AlignmentResult> results) {
        if (results.isEmpty()) {
            return FitnessSummary.empty();
        }
        int fit = 0;
        int skipped = 0;
        double fitnessSum = 0.0;
        double costSum = 0.0;
        double bwcSum = 0.0;
        for (AlignmentResult r : results) {
            if (r == null) {
                skipped++;
                continue;
            }
            if (r.isPerfectlyFit()) fit++;
            fitnessSum += r.fitness();
            costSum += r.cost();
            bwcSum += r.bestWorstCost();
        }
        if (skipped > 0) {
            System.err.println("[conformance] WARNING: " + skipped + " of " + results.size()
                    + " traces have no alignment and count as unfit");
        }
        double logFitness = bwcSum > 0 ? 1.0 - costSum / bwcSum : 1.0;
        return new FitnessSummary(
                fitnessSum / results.size(),
                100.0 * fit / results.size(),
                logFitness);
    }

    /**
     * Returns the precision within [0, 1]. Floating-point overshoot is clamped; anything else is an engine defect.
     */
    public static double checkPrecision(double precision) {
        if (Double.isNaN(precision) || precision < -PRECISION_SLACK || precision > 1.0 + PRECISION_SLACK) {
            throw new ConformanceException("Precision engine returned a value outside [0, 1]: " + precision);
        }
        return Math.min(1.0, Math.max(0.0, precision));
    }
}
