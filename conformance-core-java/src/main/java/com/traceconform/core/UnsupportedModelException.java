package com.traceconform.core;

/**
 * The model arguments match no supported shape and no conversion could coerce them.
 */
public class UnsupportedModelException extends ConformanceException {
    public UnsupportedModelException(String message) { super(message); }
}
