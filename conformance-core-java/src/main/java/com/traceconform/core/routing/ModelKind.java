package com.traceconform.core.routing;

public enum ModelKind {
    /** Petri net with initial and final marking. */
    PROCEDURAL,
    /** Directly-follows graph with start and end activities. */
    FREQUENCY_GRAPH,
    /** Process tree. */
    HIERARCHICAL
}
