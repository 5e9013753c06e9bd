package com.traceconform.core.cascade;

import com.traceconform.core.InputShapeException;
import com.traceconform.core.log.Trace;
import com.traceconform.core.log.Variant;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the accepted trace inputs into a {@link Trace}: a trace as-is, a {@link Variant},
 * a list of activity names, or a comma-separated variant string.
 */
final class TracePromotion {

    private TracePromotion() {}

    static Trace promote(Object input, String activityKey) {
        if (input instanceof Trace trace) {
            return trace;
        }
        if (input instanceof Variant variant) {
            return variant.toTrace(activityKey);
        }
        if (input instanceof String s) {
            return Variant.parse(s).toTrace(activityKey);
        }
        if (input instanceof List<?> list) {
            List<String> activities = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof String activity)) {
                    throw new InputShapeException("Variant elements must be activity names, got: " + item);
                }
                activities.add(activity);
            }
            return Trace.ofActivities(activityKey, activities);
        }
        String type = input == null ? "null" : input.getClass().getName();
        throw new InputShapeException("Expected a trace or a variant, got: " + type);
    }
}
