package com.traceconform.core.log;

import java.util.List;

/**
 * Structured log: a list of traces, one per case, in log order.
 */
public final class EventLog implements Log {

    private final List<Trace> traces;

    public EventLog(List<Trace> traces) {
        this.traces = List.copyOf(traces);
    }

    public static EventLog of(Trace... traces) {
        return new EventLog(List.of(traces));
    }

    public List<Trace> traces() { return traces; }
    public int size() { return traces.size(); }
    public Trace get(int index) { return traces.get(index); }
}
