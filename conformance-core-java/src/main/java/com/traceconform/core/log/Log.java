package com.traceconform.core.log;

/**
 * Marker for the two supported log representations: {@link EventLog} and {@link EventTable}.
 */
public interface Log {
}
