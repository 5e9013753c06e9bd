package com.traceconform.core.cascade;

/**
 * Outcome of the fitness cascade and the stage that decided it.
 */
public record CascadeVerdict(boolean fit, CascadeStage decidedBy) {

    static CascadeVerdict fit(CascadeStage stage) {
        return new CascadeVerdict(true, stage);
    }

    static CascadeVerdict notFit(CascadeStage stage) {
        return new CascadeVerdict(false, stage);
    }
}
