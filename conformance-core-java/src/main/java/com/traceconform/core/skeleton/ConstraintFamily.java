package com.traceconform.core.skeleton;

/**
 * The six log skeleton constraint families, in reporting order.
 */
public enum ConstraintFamily {
    DIRECTLY_FOLLOWS("directly_follows"),
    ALWAYS_BEFORE("always_before"),
    ALWAYS_AFTER("always_after"),
    EQUIVALENCE("equivalence"),
    NEVER_TOGETHER("never_together"),
    ACTIV_OCCURRENCES("activ_occurrences");

    private final String key;

    ConstraintFamily(String key) {
        this.key = key;
    }

    /** Name used in serialized skeletons and results. */
    public String key() { return key; }

    public static ConstraintFamily fromKey(String key) {
        for (ConstraintFamily f : values()) {
            if (f.key.equals(key)) return f;
        }
        throw new IllegalArgumentException("Unknown constraint family: " + key);
    }
}
