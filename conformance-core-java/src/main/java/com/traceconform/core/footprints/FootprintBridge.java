package com.traceconform.core.footprints;

import com.traceconform.core.InputShapeException;
import com.traceconform.core.UnsupportedModelException;
import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.FootprintEngine;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.EventTable;
import com.traceconform.core.log.Log;
import com.traceconform.core.log.Logs;
import com.traceconform.core.log.Trace;
import com.traceconform.core.model.Footprint;
import com.traceconform.core.routing.ModelRouter;
import com.traceconform.core.routing.ResolvedModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a log, a trace, pre-computed footprints or model arguments into footprints,
 * so that footprint comparison can run on any of them.
 *
 * @deprecated footprint-based conformance is kept for backward compatibility only
 */
@Deprecated(since = "0.1.0", forRemoval = true)
public class FootprintBridge {

    /** Either one footprint (log-level or model) or one footprint per trace. */
    public record Footprints(Footprint single, List<Footprint> perTrace) {

        public static Footprints of(Footprint footprint) {
            return new Footprints(footprint, null);
        }

        public static Footprints ofTraces(List<Footprint> footprints) {
            return new Footprints(null, List.copyOf(footprints));
        }

        public boolean isPerTrace() {
            return perTrace != null;
        }

        /** The footprints as handed to engine evaluation: a {@link Footprint} or a list of them. */
        public Object raw() {
            return isPerTrace() ? perTrace : single;
        }
    }

    private final FootprintEngine engine;
    private final ModelRouter router;
    private final ConformanceProperties properties;

    public FootprintBridge(FootprintEngine engine, ModelRouter router, ConformanceProperties properties) {
        this.engine = engine;
        this.router = router;
        this.properties = properties;
    }

    public Footprints toFootprints(Object... args) {
        if (args != null && args.length == 1) {
            Object arg = args[0];
            if (arg instanceof Footprint fp) {
                return Footprints.of(fp);
            }
            if (arg instanceof List<?> list && !list.isEmpty() && allFootprints(list)) {
                List<Footprint> perTrace = new ArrayList<>(list.size());
                for (Object o : list) perTrace.add((Footprint) o);
                return Footprints.ofTraces(perTrace);
            }
            if (arg instanceof Trace trace) {
                return Footprints.of(engine.discover(Logs.singleton(trace), properties.getActivityKey()));
            }
            if (arg instanceof EventLog || arg instanceof EventTable) {
                EventLog log = Logs.toEventLog((Log) arg, properties.getCaseIdKey());
                return Footprints.of(engine.discover(log, properties.getActivityKey()));
            }
        }
        return Footprints.of(modelFootprint(router.resolve(args)));
    }

    /** Footprint of the model side; a per-trace list is not a model. */
    public Footprint toModelFootprint(Object... args) {
        Footprints fps = toFootprints(args);
        if (fps.isPerTrace()) {
            throw new InputShapeException("Model side of a footprint comparison must be a single footprint");
        }
        return fps.single();
    }

    private Footprint modelFootprint(ResolvedModel model) {
        return switch (model.kind()) {
            case HIERARCHICAL -> engine.discover(model.asProcessTree());
            case PROCEDURAL -> engine.discover(model.asPetriNet());
            default -> throw new UnsupportedModelException("No footprint discovery for " + model.kind());
        };
    }

    private static boolean allFootprints(List<?> list) {
        for (Object o : list) {
            if (!(o instanceof Footprint)) return false;
        }
        return true;
    }
}
