package com.traceconform.core.footprints;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.engine.FootprintDiagnostic;
import com.traceconform.core.engine.FootprintEngine;
import com.traceconform.core.evaluation.FitnessEvaluator;
import com.traceconform.core.model.Footprint;
import com.traceconform.core.routing.ModelRouter;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Footprint-based diagnostics, fitness and precision.
 *
 * The first argument is the log side (a log, a trace, or footprints discovered from them);
 * the remaining arguments are the model (or its footprint).
 *
 * @deprecated footprint-based conformance will not be exposed in a future release
 */
@Deprecated(since = "0.1.0", forRemoval = true)
@SuppressWarnings("removal")
public class LegacyFootprintConformance {

    private static final AtomicBoolean WARNED = new AtomicBoolean();

    private final FootprintEngine engine;
    private final FootprintBridge bridge;

    public LegacyFootprintConformance(ConformanceEngines engines, ConformanceProperties properties) {
        this.engine = engines.footprints();
        this.bridge = new FootprintBridge(engine, new ModelRouter(engines), properties);
    }

    /**
     * Trace-extensive diagnostics (one per trace) when the log side is a list of per-trace footprints,
     * otherwise a single log-extensive diagnostic.
     */
    public List<FootprintDiagnostic> diagnostics(Object logSide, Object... model) {
        warnOnce();
        return compare(bridge.toFootprints(logSide), bridge.toModelFootprint(model));
    }

    public FootprintEngine.FootprintFitness fitness(Object logSide, Object... model) {
        warnOnce();
        FootprintBridge.Footprints logFootprints = bridge.toFootprints(logSide);
        Footprint modelFootprint = bridge.toModelFootprint(model);
        return engine.fitness(logFootprints.raw(), modelFootprint, compare(logFootprints, modelFootprint));
    }

    private List<FootprintDiagnostic> compare(FootprintBridge.Footprints logFootprints, Footprint modelFootprint) {
        if (logFootprints.isPerTrace()) {
            return engine.compareTraces(logFootprints.perTrace(), modelFootprint);
        }
        return List.of(engine.compareLog(logFootprints.single(), modelFootprint));
    }

    public double precision(Object logSide, Object... model) {
        warnOnce();
        double precision = engine.precision(bridge.toFootprints(logSide).raw(), bridge.toModelFootprint(model));
        return FitnessEvaluator.checkPrecision(precision);
    }

    private static void warnOnce() {
        if (WARNED.compareAndSet(false, true)) {
            System.err.println("[conformance] WARNING: footprint-based conformance checking is deprecated"
                    + " and will be removed in a future release");
        }
    }
}
