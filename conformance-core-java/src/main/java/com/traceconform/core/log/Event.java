package com.traceconform.core.log;

import com.traceconform.core.SchemaException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One activity occurrence: an immutable attribute name to value mapping.
 */
public final class Event {

    private final Map<String, Object> attributes;

    public Event(Map<String, ?> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Event of(String key, Object value) {
        return new Event(Map.of(key, value));
    }

    public Object get(String key) {
        return attributes.get(key);
    }

    /**
     * @throws SchemaException if the attribute is absent or null
     */
    public Object require(String key) {
        Object value = attributes.get(key);
        if (value == null) {
            throw new SchemaException(key, "Event is missing required attribute '" + key + "': " + attributes);
        }
        return value;
    }

    public boolean has(String key) {
        return attributes.get(key) != null;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Event other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Event" + attributes;
    }
}
