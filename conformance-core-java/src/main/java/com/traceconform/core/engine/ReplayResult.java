package com.traceconform.core.engine;

/**
 * Token-based replay outcome for one trace.
 */
public record ReplayResult(
        boolean traceIsFit,
        double traceFitness,
        int missingTokens,
        int remainingTokens,
        int producedTokens,
        int consumedTokens
) {}
