package com.traceconform.core;

/**
 * The log (or a trace/variant argument) is not one of the supported representations.
 */
public class InputShapeException extends ConformanceException {
    public InputShapeException(String message) { super(message); }
}
