package com.traceconform.core.engine;

import com.traceconform.core.model.ActivityPair;

import java.util.Set;

/**
 * Footprint comparison outcome for one trace (trace-extensive) or the whole log (log-extensive).
 */
public record FootprintDiagnostic(boolean isFootprintsFit, Set<ActivityPair> deviations) {

    public FootprintDiagnostic {
        deviations = Set.copyOf(deviations);
    }
}
