package com.traceconform.core.cascade;

/**
 * Stages of the fitness cascade, cheapest first.
 */
public enum CascadeStage {
    /** Footprint comparison; only a negative outcome is conclusive. */
    FOOTPRINTS,
    /** Trace activities missing from the net's visible labels; only a negative outcome is conclusive. */
    LABELS,
    /** Token-based replay; only a positive outcome is conclusive. */
    TOKEN_REPLAY,
    /** Alignments; always conclusive. */
    ALIGNMENTS
}
