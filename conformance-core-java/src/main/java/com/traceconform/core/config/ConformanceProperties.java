package com.traceconform.core.config;

import com.traceconform.core.SchemaException;
import com.traceconform.core.log.EventTable;
import com.traceconform.core.log.Log;
import com.traceconform.core.log.Logs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable configuration record handed to every component and external engine:
 * the three attribute names plus algorithm-specific extras.
 */
public final class ConformanceProperties {

    public static final String DEFAULT_ACTIVITY_KEY = "concept:name";
    public static final String DEFAULT_TIMESTAMP_KEY = "time:timestamp";
    public static final String DEFAULT_CASE_ID_KEY = "case:concept:name";

    /** Number of standard deviations tolerated by temporal profile checks. */
    public static final String ZETA = "zeta";
    /** Requests the parallel alignment variant. */
    public static final String MULTIPROCESSING = "multiprocessing";
    /** Worker count of the parallel alignment variant. */
    public static final String WORKERS = "workers";
    /** Runs the footprint stage of the fitness cascade on Petri nets too. */
    public static final String FOOTPRINTS_ON_NETS = "footprintsOnNets";

    private final String activityKey;
    private final String timestampKey;
    private final String caseIdKey;
    private final Map<String, Object> extras;

    private ConformanceProperties(String activityKey, String timestampKey, String caseIdKey,
                                  Map<String, Object> extras) {
        this.activityKey = requireKey(activityKey, "activity key");
        this.timestampKey = requireKey(timestampKey, "timestamp key");
        this.caseIdKey = requireKey(caseIdKey, "case id key");
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static ConformanceProperties defaults() {
        return of(DEFAULT_ACTIVITY_KEY, DEFAULT_TIMESTAMP_KEY, DEFAULT_CASE_ID_KEY);
    }

    public static ConformanceProperties of(String activityKey, String timestampKey, String caseIdKey) {
        return new ConformanceProperties(activityKey, timestampKey, caseIdKey, Map.of());
    }

    /**
     * Validates the log and builds the properties for it.
     *
     * @throws com.traceconform.core.InputShapeException if the log is not a supported representation
     * @throws SchemaException if the log is a table lacking one of the three columns
     */
    public static ConformanceProperties forLog(Object log, String activityKey, String timestampKey, String caseIdKey) {
        Log supported = Logs.requireSupported(log);
        ConformanceProperties properties = of(activityKey, timestampKey, caseIdKey);
        if (supported instanceof EventTable table) {
            properties.checkColumns(table);
        }
        return properties;
    }

    private void checkColumns(EventTable table) {
        for (String column : new String[]{activityKey, timestampKey, caseIdKey}) {
            if (!table.hasColumn(column)) {
                throw new SchemaException(column,
                        "Event table is missing required column '" + column + "' (columns: " + table.columns() + ")");
            }
        }
    }

    private static String requireKey(String key, String what) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(what + " must not be blank");
        }
        return key;
    }

    public ConformanceProperties withExtra(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(extras);
        copy.put(key, value);
        return new ConformanceProperties(activityKey, timestampKey, caseIdKey, copy);
    }

    public String getActivityKey()  { return activityKey; }
    public String getTimestampKey() { return timestampKey; }
    public String getCaseIdKey()    { return caseIdKey; }
    public Map<String, Object> getExtras() { return extras; }

    public double getDouble(String key, double defaultValue) {
        Object v = extras.get(key);
        return v instanceof Number n ? n.doubleValue() : defaultValue;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = extras.get(key);
        return v instanceof Boolean b ? b : defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object v = extras.get(key);
        return v instanceof Number n ? n.intValue() : defaultValue;
    }

    @Override
    public String toString() {
        return "ConformanceProperties{activity=" + activityKey + ", timestamp=" + timestampKey
                + ", caseId=" + caseIdKey + ", extras=" + extras + "}";
    }
}
