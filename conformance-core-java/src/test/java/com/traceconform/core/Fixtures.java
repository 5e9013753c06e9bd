package com.traceconform.core;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.Event;
import com.traceconform.core.log.Trace;
import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.Marking;
import com.traceconform.core.model.PetriNet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders shared by the core tests.
 */
public final class Fixtures {

    public static final String ACT = ConformanceProperties.DEFAULT_ACTIVITY_KEY;
    public static final String TS = ConformanceProperties.DEFAULT_TIMESTAMP_KEY;
    public static final String CASE = ConformanceProperties.DEFAULT_CASE_ID_KEY;

    private Fixtures() {}

    /** Trace of activity names without timestamps. */
    public static Trace trace(String... activities) {
        return Trace.ofActivities(ACT, List.of(activities));
    }

    /**
     * Trace from alternating activity / numeric timestamp arguments, e.g. {@code timed("A", 0, "B", 24)}.
     */
    public static Trace timed(Object... activityTimePairs) {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < activityTimePairs.length; i += 2) {
            Map<String, Object> attrs = new LinkedHashMap<>();
            attrs.put(ACT, activityTimePairs[i]);
            attrs.put(TS, activityTimePairs[i + 1]);
            events.add(new Event(attrs));
        }
        return new Trace(events);
    }

    public static Map<String, Object> row(String caseId, String activity, Object timestamp) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(CASE, caseId);
        row.put(ACT, activity);
        row.put(TS, timestamp);
        return row;
    }

    /** Sequential net source -> A -> ... -> sink with one visible transition per label. */
    public static AcceptingPetriNet sequenceNet(String... labels) {
        PetriNet net = new PetriNet("seq");
        PetriNet.Place previous = net.addPlace("source");
        PetriNet.Place source = previous;
        for (int i = 0; i < labels.length; i++) {
            PetriNet.Transition t = net.addTransition("t" + i, labels[i]);
            PetriNet.Place next = net.addPlace(i == labels.length - 1 ? "sink" : "p" + i);
            net.addArc(previous, t);
            net.addArc(t, next);
            previous = next;
        }
        return new AcceptingPetriNet(net, Marking.of(source), Marking.of(previous));
    }
}
