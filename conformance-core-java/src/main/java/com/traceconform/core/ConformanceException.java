package com.traceconform.core;

/**
 * Base type of every error raised by the conformance engine itself.
 * Errors raised by external engines are not wrapped and reach the caller unchanged.
 */
public class ConformanceException extends RuntimeException {
    public ConformanceException(String message) { super(message); }
    public ConformanceException(String message, Throwable cause) { super(message, cause); }
}
