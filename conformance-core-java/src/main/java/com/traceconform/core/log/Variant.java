package com.traceconform.core.log;

import java.util.ArrayList;
import java.util.List;

/**
 * A plain activity sequence without event attributes.
 */
public record Variant(List<String> activities) {

    public Variant {
        activities = List.copyOf(activities);
    }

    public static Variant of(String... activities) {
        return new Variant(List.of(activities));
    }

    /** Parses the comma-separated variant string form, e.g. {@code "A,B,C"}. Empty string is the empty variant. */
    public static Variant parse(String variant) {
        List<String> activities = new ArrayList<>();
        if (!variant.isEmpty()) {
            for (String part : variant.split(",", -1)) {
                activities.add(part);
            }
        }
        return new Variant(activities);
    }

    public Trace toTrace(String activityKey) {
        return Trace.ofActivities(activityKey, activities);
    }
}
