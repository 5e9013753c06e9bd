package com.traceconform.core.skeleton;

import java.util.List;

/**
 * One violated constraint instance: its family and the activity or activity pair it constrains.
 */
public record SkeletonViolation(ConstraintFamily family, List<String> activities) {

    public SkeletonViolation {
        activities = List.copyOf(activities);
    }

    public static SkeletonViolation of(ConstraintFamily family, String... activities) {
        return new SkeletonViolation(family, List.of(activities));
    }

    @Override
    public String toString() {
        return family.key() + activities;
    }
}
