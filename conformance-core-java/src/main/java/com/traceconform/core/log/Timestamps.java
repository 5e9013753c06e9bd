package com.traceconform.core.log;

import com.traceconform.core.SchemaException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Converts timestamp attribute values to a numeric time axis.
 *
 * Temporal types map to seconds since the epoch (fractional part kept); numbers are taken as-is,
 * in whatever unit the log uses.
 */
public final class Timestamps {

    private Timestamps() {}

    public static double toSeconds(Object value, String timestampKey) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        Instant instant;
        if (value instanceof Instant i) {
            instant = i;
        } else if (value instanceof OffsetDateTime odt) {
            instant = odt.toInstant();
        } else if (value instanceof ZonedDateTime zdt) {
            instant = zdt.toInstant();
        } else if (value instanceof LocalDateTime ldt) {
            instant = ldt.toInstant(ZoneOffset.UTC);
        } else if (value instanceof Date d) {
            instant = d.toInstant();
        } else {
            String type = value == null ? "null" : value.getClass().getName();
            throw new SchemaException(timestampKey,
                    "Attribute '" + timestampKey + "' is not a timestamp (" + type + "): " + value);
        }
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
