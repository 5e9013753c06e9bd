package com.traceconform.core.engine;

/**
 * One step of an alignment. {@link #SKIP} on the log side is a model move, on the model side a log move;
 * a {@code null} model label is a silent model move.
 */
public record AlignmentMove(String logLabel, String modelLabel) {

    public static final String SKIP = ">>";

    public static AlignmentMove sync(String activity) {
        return new AlignmentMove(activity, activity);
    }

    public static AlignmentMove logMove(String activity) {
        return new AlignmentMove(activity, SKIP);
    }

    public static AlignmentMove modelMove(String label) {
        return new AlignmentMove(SKIP, label);
    }

    public boolean isSynchronous() {
        return !SKIP.equals(logLabel) && !SKIP.equals(modelLabel);
    }
}
