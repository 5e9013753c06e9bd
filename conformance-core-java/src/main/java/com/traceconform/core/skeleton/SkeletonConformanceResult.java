package com.traceconform.core.skeleton;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Log skeleton conformance of one case.
 *
 * @param violations      violated constraint instances; empty when the case complies
 * @param constraintCount number of constraint instances the case was checked against
 */
public record SkeletonConformanceResult(Set<SkeletonViolation> violations, int constraintCount) {

    public SkeletonConformanceResult {
        violations = Collections.unmodifiableSet(new LinkedHashSet<>(violations));
    }

    public int deviationCount() {
        return violations.size();
    }

    /** 1 - violations / constraints; 1.0 when nothing is constrained. */
    public double fitness() {
        return constraintCount == 0 ? 1.0 : 1.0 - (double) violations.size() / constraintCount;
    }

    public boolean isFit() {
        return violations.isEmpty();
    }
}
