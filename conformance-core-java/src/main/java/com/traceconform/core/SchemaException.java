package com.traceconform.core;

/**
 * A required column or event attribute is missing.
 */
public class SchemaException extends ConformanceException {

    private final String field;

    public SchemaException(String field, String message) {
        super(message);
        this.field = field;
    }

    /** Name of the missing column or attribute. */
    public String getField() { return field; }
}
