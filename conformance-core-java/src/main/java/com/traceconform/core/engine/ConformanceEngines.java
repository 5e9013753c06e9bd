package com.traceconform.core.engine;

/**
 * The external engines the conformance layer delegates to. Any of them may be absent;
 * an operation needing an absent engine fails with {@link IllegalStateException}.
 */
public final class ConformanceEngines {

    private final TokenReplayEngine replay;
    private final AlignmentEngine alignment;
    private final PrecisionEngine precision;
    private final FootprintEngine footprints;
    private final ModelConverter converter;

    private ConformanceEngines(Builder b) {
        this.replay = b.replay;
        this.alignment = b.alignment;
        this.precision = b.precision;
        this.footprints = b.footprints;
        this.converter = b.converter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConformanceEngines none() {
        return builder().build();
    }

    public TokenReplayEngine replay()   { return require(replay, "token replay engine"); }
    public AlignmentEngine alignment()  { return require(alignment, "alignment engine"); }
    public PrecisionEngine precision()  { return require(precision, "precision engine"); }
    public FootprintEngine footprints() { return require(footprints, "footprint engine"); }

    /** The converter is optional; callers decide what a missing converter means. */
    public boolean hasConverter() { return converter != null; }
    public ModelConverter converter()  { return require(converter, "model converter"); }

    private static <T> T require(T engine, String name) {
        if (engine == null) {
            throw new IllegalStateException("No " + name + " configured");
        }
        return engine;
    }

    public static final class Builder {
        private TokenReplayEngine replay;
        private AlignmentEngine alignment;
        private PrecisionEngine precision;
        private FootprintEngine footprints;
        private ModelConverter converter;

        private Builder() {}

        public Builder replay(TokenReplayEngine replay)        { this.replay = replay; return this; }
        public Builder alignment(AlignmentEngine alignment)    { this.alignment = alignment; return this; }
        public Builder precision(PrecisionEngine precision)    { this.precision = precision; return this; }
        public Builder footprints(FootprintEngine footprints)  { this.footprints = footprints; return this; }
        public Builder converter(ModelConverter converter)     { this.converter = converter; return this; }

        public ConformanceEngines build() {
            return new ConformanceEngines(this);
        }
    }
}
