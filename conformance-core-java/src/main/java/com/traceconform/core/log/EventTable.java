package com.traceconform.core.log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flat event table: one row per event, keyed by column name.
 * The column set is the union of all row keys unless given explicitly.
 */
public final class EventTable implements Log {

    private final Set<String> columns;
    private final List<Map<String, Object>> rows;

    public EventTable(Set<String> columns, List<? extends Map<String, ?>> rows) {
        this.columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns));
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public static EventTable fromRows(List<? extends Map<String, ?>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, ?> row : rows) {
            columns.addAll(row.keySet());
        }
        return new EventTable(columns, rows);
    }

    public Set<String> columns() { return columns; }
    public List<Map<String, Object>> rows() { return rows; }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }
}
