package com.traceconform.core.skeleton;

/**
 * Inclusive bounds on how often something may happen within one case.
 */
public record CountBounds(int min, int max) {

    public CountBounds {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid bounds [" + min + ", " + max + "]");
        }
    }

    public static CountBounds between(int min, int max) {
        return new CountBounds(min, max);
    }

    public static CountBounds atMost(int max) {
        return new CountBounds(0, max);
    }

    public boolean contains(int count) {
        return count >= min && count <= max;
    }
}
