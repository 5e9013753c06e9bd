package com.traceconform.core.routing;

import com.traceconform.core.ConformanceException;
import com.traceconform.core.UnsupportedModelException;
import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.AlignmentEngine;
import com.traceconform.core.engine.AlignmentResult;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.engine.ModelConverter;
import com.traceconform.core.engine.ReplayResult;
import com.traceconform.core.log.EventLog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Resolves model arguments once and forwards the call to the matching engine family.
 * Performs no computation of its own.
 */
public class ModelRouter {

    private final ConformanceEngines engines;
    private final List<ModelConversion> conversions;

    public ModelRouter(ConformanceEngines engines) {
        this(engines, defaultConversions(engines));
    }

    public ModelRouter(ConformanceEngines engines, List<ModelConversion> conversions) {
        this.engines = engines;
        this.conversions = List.copyOf(conversions);
    }

    /** Unrecognized arguments are converted to a Petri net when a converter is available. */
    public static List<ModelConversion> defaultConversions(ConformanceEngines engines) {
        List<ModelConversion> result = new ArrayList<>();
        if (engines.hasConverter()) {
            ModelConverter converter = engines.converter();
            result.add(new ModelConversion("petri-net",
                    args -> converter.toPetriNet(args).map(ResolvedModel::procedural)));
        }
        return result;
    }

    /**
     * @throws UnsupportedModelException if the arguments match no shape and every conversion attempt fails
     */
    public ResolvedModel resolve(Object... modelArgs) {
        Optional<ResolvedModel> direct = ModelShapes.classify(modelArgs);
        if (direct.isPresent()) {
            return direct.get();
        }
        for (ModelConversion conversion : conversions) {
            Optional<ResolvedModel> converted = conversion.apply(modelArgs);
            if (converted.isPresent()) {
                System.err.println("[conformance] WARNING: model arguments " + describe(modelArgs)
                        + " converted via " + conversion.name() + " to " + converted.get().kind());
                return converted.get();
            }
        }
        throw new UnsupportedModelException("Unsupported model arguments " + describe(modelArgs)
                + " (tried " + conversions.size() + " conversion(s))");
    }

    /** Token-based replay; only procedural models can be replayed. */
    public List<ReplayResult> replay(EventLog log, ResolvedModel model, ConformanceProperties properties) {
        if (model.kind() != ModelKind.PROCEDURAL) {
            throw new UnsupportedModelException("Token-based replay requires a Petri net, got " + model.kind());
        }
        return checkCount(engines.replay().replay(log, model.asPetriNet(), properties), log);
    }

    /**
     * Alignments for any model kind. With {@link ConformanceProperties#MULTIPROCESSING} set, Petri nets and
     * process trees are aligned trace by trace on parallel workers; frequency graphs ignore the flag.
     */
    public List<AlignmentResult> align(EventLog log, ResolvedModel model, ConformanceProperties properties) {
        AlignmentEngine engine = engines.alignment();
        boolean parallel = properties.getBoolean(ConformanceProperties.MULTIPROCESSING, false);
        List<AlignmentResult> results;
        switch (model.kind()) {
            case PROCEDURAL -> results = parallel
                    ? parallelRunner(properties).run(log, single -> engine.align(single, model.asPetriNet(), properties))
                    : engine.align(log, model.asPetriNet(), properties);
            case HIERARCHICAL -> results = parallel
                    ? parallelRunner(properties).run(log, single -> engine.align(single, model.asProcessTree(), properties))
                    : engine.align(log, model.asProcessTree(), properties);
            case FREQUENCY_GRAPH -> results = engine.align(log, model.asDirectlyFollowsGraph(), properties);
            default -> throw new UnsupportedModelException("No alignment variant for " + model.kind());
        }
        return checkCount(results, log);
    }

    private static ParallelAlignmentRunner parallelRunner(ConformanceProperties properties) {
        int workers = properties.getInt(ConformanceProperties.WORKERS, Runtime.getRuntime().availableProcessors());
        return new ParallelAlignmentRunner(workers);
    }

    private static <T> List<T> checkCount(List<T> results, EventLog log) {
        if (results == null || results.size() != log.size()) {
            throw new ConformanceException("Engine returned " + (results == null ? "null" : results.size())
                    + " results for " + log.size() + " traces");
        }
        return results;
    }

    private static String describe(Object[] args) {
        if (args == null) return "null";
        return Arrays.stream(args)
                .map(a -> a == null ? "null" : a.getClass().getSimpleName())
                .toList()
                .toString();
    }
}
