package com.traceconform.cli.io;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.reflect.TypeToken;
import com.traceconform.core.log.EventTable;
import com.traceconform.core.skeleton.CountBounds;
import com.traceconform.core.skeleton.LogSkeleton;
import com.traceconform.core.temporal.TemporalProfile;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Reads the event table, temporal profile and log skeleton files named by a request.
 */
public class JsonInputReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads an array of flat event objects. String values of {@code timestampKey} are parsed as
     * ISO-8601 instants; integral numbers become longs, other numbers doubles. A null
     * {@code timestampKey} leaves every string value as read.
     */
    public EventTable readEventTable(Path path, String timestampKey) {
        JsonElement root = parse(path);
        if (!root.isJsonArray()) {
            throw new InputReadException("Event table must be a JSON array of objects: " + path);
        }
        JsonArray array = root.getAsJsonArray();
        List<Map<String, Object>> rows = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement element = array.get(i);
            if (!element.isJsonObject()) {
                throw new InputReadException("Event " + i + " in " + path + " is not an object");
            }
            rows.add(toRow(element.getAsJsonObject(), timestampKey, path, i));
        }
        return EventTable.fromRows(rows);
    }

    public TemporalProfile readTemporalProfile(Path path) {
        List<InputDocuments.ProfileEntry> entries =
                fromJson(path, new TypeToken<List<InputDocuments.ProfileEntry>>() {}.getType());
        TemporalProfile.Builder builder = TemporalProfile.builder();
        for (InputDocuments.ProfileEntry e : entries) {
            if (e == null || e.source == null || e.target == null || e.mean == null || e.stdev == null) {
                throw new InputReadException("Temporal profile entries need source, target, mean and stdev: " + path);
            }
            try {
                builder.put(e.source, e.target, e.mean, e.stdev);
            } catch (IllegalArgumentException ex) {
                throw new InputReadException("Invalid profile entry " + e.source + " -> " + e.target
                        + " in " + path + ": " + ex.getMessage(), ex);
            }
        }
        return builder.build();
    }

    public LogSkeleton readLogSkeleton(Path path) {
        InputDocuments.SkeletonDocument doc = fromJson(path, InputDocuments.SkeletonDocument.class);
        LogSkeleton.Builder builder = LogSkeleton.builder();
        if (doc.directlyFollows != null) {
            for (InputDocuments.DirectlyFollowsEntry e : doc.directlyFollows) {
                if (e == null || e.source == null || e.target == null || e.max == null) {
                    throw new InputReadException("directly_follows entries need source, target and max: " + path);
                }
                int min = e.min != null ? e.min : 0;
                try {
                    builder.directlyFollows(e.source, e.target, CountBounds.between(min, e.max));
                } catch (IllegalArgumentException ex) {
                    throw new InputReadException(ex.getMessage() + " for " + e.source + " -> " + e.target, ex);
                }
            }
        }
        pairs(doc.alwaysBefore, "always_before", path, builder::alwaysBefore);
        pairs(doc.alwaysAfter, "always_after", path, builder::alwaysAfter);
        pairs(doc.equivalence, "equivalence", path, builder::equivalence);
        pairs(doc.neverTogether, "never_together", path, builder::neverTogether);
        if (doc.activOccurrences != null) {
            doc.activOccurrences.forEach((activity, counts) -> {
                if (counts == null || counts.contains(null)) {
                    throw new InputReadException("activ_occurrences for " + activity + " must be a list of counts");
                }
                builder.activityOccurrences(activity, new LinkedHashSet<>(counts));
            });
        }
        return builder.build();
    }

    private static void pairs(List<List<String>> pairs, String family, Path path, BiConsumer<String, String> sink) {
        if (pairs == null) {
            return;
        }
        for (List<String> pair : pairs) {
            if (pair == null || pair.size() != 2 || pair.contains(null)) {
                throw new InputReadException(family + " entries must be two activity names, got " + pair
                        + " in " + path);
            }
            sink.accept(pair.get(0), pair.get(1));
        }
    }

    private static Map<String, Object> toRow(JsonObject object, String timestampKey, Path path, int index) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> field : object.entrySet()) {
            JsonElement value = field.getValue();
            if (value.isJsonNull()) {
                row.put(field.getKey(), null);
            } else if (value.isJsonPrimitive()) {
                row.put(field.getKey(), toValue(field.getKey(), value.getAsJsonPrimitive(), timestampKey, path, index));
            } else {
                throw new InputReadException("Event " + index + " in " + path + " has a nested value for '"
                        + field.getKey() + "'; events must be flat");
            }
        }
        return row;
    }

    private static Object toValue(String key, JsonPrimitive p, String timestampKey, Path path, int index) {
        if (p.isBoolean()) {
            return p.getAsBoolean();
        }
        if (p.isNumber()) {
            BigDecimal number = p.getAsBigDecimal();
            if (!p.getAsString().contains(".")) {
                try {
                    return number.longValueExact();
                } catch (ArithmeticException notIntegral) {
                    return number.doubleValue();
                }
            }
            return number.doubleValue();
        }
        String s = p.getAsString();
        if (timestampKey != null && key.equals(timestampKey)) {
            try {
                return OffsetDateTime.parse(s).toInstant();
            } catch (DateTimeParseException e) {
                throw new InputReadException("Event " + index + " in " + path + ": '" + s
                        + "' is not an ISO-8601 timestamp with offset", e);
            }
        }
        return s;
    }

    private static JsonElement parse(Path path) {
        try (Reader reader = open(path)) {
            return JsonParser.parseReader(reader);
        } catch (IOException | JsonParseException e) {
            throw new InputReadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private static <T> T fromJson(Path path, Type type) {
        T value;
        try (Reader reader = open(path)) {
            value = GSON.fromJson(reader, type);
        } catch (IOException | JsonParseException e) {
            throw new InputReadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
        if (value == null) {
            throw new InputReadException("Input file is empty: " + path);
        }
        return value;
    }

    private static Reader open(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new InputReadException("Input file not found: " + path);
        }
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    public static class InputReadException extends RuntimeException {
        public InputReadException(String message) { super(message); }
        public InputReadException(String message, Throwable cause) { super(message, cause); }
    }
}
