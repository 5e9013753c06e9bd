package com.traceconform.core.model;

import java.util.Objects;

/**
 * An ordered pair of activity names.
 */
public record ActivityPair(String source, String target) {

    public ActivityPair {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }

    public static ActivityPair of(String source, String target) {
        return new ActivityPair(source, target);
    }

    public ActivityPair reversed() {
        return new ActivityPair(target, source);
    }

    @Override
    public String toString() {
        return "(" + source + ", " + target + ")";
    }
}
