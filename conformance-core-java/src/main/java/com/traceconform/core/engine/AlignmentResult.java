package com.traceconform.core.engine;

import java.util.List;

/**
 * Alignment of one trace: the move sequence, its cost, the fitness derived from it and the
 * best worst-case cost used to normalize it.
 */
public record AlignmentResult(
        List<AlignmentMove> alignment,
        double cost,
        double fitness,
        double bestWorstCost
) {
    public AlignmentResult {
        alignment = List.copyOf(alignment);
    }

    public boolean isPerfectlyFit() {
        return fitness == 1.0;
    }
}
