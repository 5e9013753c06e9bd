package com.traceconform.core.engine;

public enum PrecisionVariant {
    /** Escaping-edges precision computed on token-based replay. */
    TOKEN_REPLAY,
    /** Escaping-edges precision computed on alignments. */
    ALIGNMENTS
}
