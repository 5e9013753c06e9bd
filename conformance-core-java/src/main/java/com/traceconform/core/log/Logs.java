package com.traceconform.core.log;

import com.traceconform.core.InputShapeException;
import com.traceconform.core.SchemaException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape checks and the table-to-cases view shared by every entry point.
 */
public final class Logs {

    private Logs() {}

    /**
     * @throws InputShapeException if {@code log} is null or neither an {@link EventLog} nor an {@link EventTable}
     */
    public static Log requireSupported(Object log) {
        if (log instanceof EventLog || log instanceof EventTable) {
            return (Log) log;
        }
        String type = log == null ? "null" : log.getClass().getName();
        throw new InputShapeException("the method can be applied only to an event log or an event table, got: " + type);
    }

    /**
     * Returns the log as cases. Table rows are grouped by the case-id column; cases appear in the
     * order of their first row and rows keep their table order within a case.
     */
    public static EventLog toEventLog(Log log, String caseIdKey) {
        Log supported = requireSupported(log);
        if (supported instanceof EventLog eventLog) {
            return eventLog;
        }
        EventTable table = (EventTable) supported;
        Map<Object, List<Event>> byCase = new LinkedHashMap<>();
        for (Map<String, Object> row : table.rows()) {
            Object caseId = row.get(caseIdKey);
            if (caseId == null) {
                throw new SchemaException(caseIdKey, "Row has no value for case id column '" + caseIdKey + "': " + row);
            }
            byCase.computeIfAbsent(caseId, k -> new ArrayList<>()).add(new Event(row));
        }
        List<Trace> traces = new ArrayList<>(byCase.size());
        for (Map.Entry<Object, List<Event>> entry : byCase.entrySet()) {
            traces.add(new Trace(Map.of(caseIdKey, entry.getKey()), entry.getValue()));
        }
        return new EventLog(traces);
    }

    /** Wraps a single trace as a one-case log. */
    public static EventLog singleton(Trace trace) {
        return new EventLog(List.of(trace));
    }
}
