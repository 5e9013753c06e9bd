package com.traceconform.core.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered sequence of events belonging to one case.
 * Event order is the ground truth; timestamps are informative only.
 */
public final class Trace {

    private final Map<String, Object> attributes;
    private final List<Event> events;

    public Trace(Map<String, ?> attributes, List<Event> events) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.events = List.copyOf(events);
    }

    public Trace(List<Event> events) {
        this(Map.of(), events);
    }

    /** Builds a trace with one event per activity, each carrying only the activity attribute. */
    public static Trace ofActivities(String activityKey, List<String> activities) {
        List<Event> events = new ArrayList<>(activities.size());
        for (String activity : activities) {
            events.add(Event.of(activityKey, activity));
        }
        return new Trace(events);
    }

    public List<Event> events() { return events; }
    public Map<String, Object> attributes() { return attributes; }
    public int size() { return events.size(); }
    public Event get(int index) { return events.get(index); }

    /** Activities of this trace in event order. */
    public List<String> activities(String activityKey) {
        List<String> result = new ArrayList<>(events.size());
        for (Event e : events) {
            result.add(String.valueOf(e.require(activityKey)));
        }
        return result;
    }

    @Override
    public String toString() {
        return "Trace" + attributes + events;
    }
}
