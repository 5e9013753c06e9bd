package com.traceconform.core.model;

/**
 * Classification of an ordered activity pair in a footprint.
 */
public enum FootprintRelation {
    DIRECTLY_FOLLOWS,
    PARALLEL,
    NEVER_FOLLOWS
}
