package com.traceconform.core;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.AlignmentEngine;
import com.traceconform.core.engine.AlignmentMove;
import com.traceconform.core.engine.AlignmentResult;
import com.traceconform.core.engine.FootprintDiagnostic;
import com.traceconform.core.engine.FootprintEngine;
import com.traceconform.core.engine.ModelConverter;
import com.traceconform.core.engine.ReplayResult;
import com.traceconform.core.engine.TokenReplayEngine;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Trace;
import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.DirectlyFollowsGraph;
import com.traceconform.core.model.Footprint;
import com.traceconform.core.model.ProcessTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Hand-written stand-ins for the external engines. Each records how often it was called.
 */
public final class FakeEngines {

    private FakeEngines() {}

    public static final class Replay implements TokenReplayEngine {
        public final AtomicInteger calls = new AtomicInteger();
        private final Function<Trace, Boolean> fit;

        public Replay(Function<Trace, Boolean> fit) {
            this.fit = fit;
        }

        @Override
        public List<ReplayResult> replay(EventLog log, AcceptingPetriNet model, ConformanceProperties properties) {
            calls.incrementAndGet();
            List<ReplayResult> results = new ArrayList<>();
            for (Trace t : log.traces()) {
                boolean ok = fit.apply(t);
                results.add(new ReplayResult(ok, ok ? 1.0 : 0.5, ok ? 0 : 1, ok ? 0 : 1, t.size() + 1, t.size() + 1));
            }
            return results;
        }
    }

    /** Alignment fitness is computed by a function of the trace; the same for every model kind. */
    public static final class Alignment implements AlignmentEngine {
        public final AtomicInteger netCalls = new AtomicInteger();
        public final AtomicInteger treeCalls = new AtomicInteger();
        public final AtomicInteger dfgCalls = new AtomicInteger();
        private final Function<Trace, Double> fitness;

        public Alignment(Function<Trace, Double> fitness) {
            this.fitness = fitness;
        }

        @Override
        public List<AlignmentResult> align(EventLog log, AcceptingPetriNet model, ConformanceProperties properties) {
            netCalls.incrementAndGet();
            return alignAll(log, properties);
        }

        @Override
        public List<AlignmentResult> align(EventLog log, ProcessTree model, ConformanceProperties properties) {
            treeCalls.incrementAndGet();
            return alignAll(log, properties);
        }

        @Override
        public List<AlignmentResult> align(EventLog log, DirectlyFollowsGraph model, ConformanceProperties properties) {
            dfgCalls.incrementAndGet();
            return alignAll(log, properties);
        }

        private List<AlignmentResult> alignAll(EventLog log, ConformanceProperties properties) {
            List<AlignmentResult> results = new ArrayList<>();
            for (Trace t : log.traces()) {
                results.add(alignOne(t, properties));
            }
            return results;
        }

        private AlignmentResult alignOne(Trace t, ConformanceProperties properties) {
            Double f = fitness.apply(t);
            if (f == null) {
                return null;
            }
            List<AlignmentMove> moves = new ArrayList<>();
            for (String a : t.activities(properties.getActivityKey())) {
                moves.add(AlignmentMove.sync(a));
            }
            double bwc = 10.0 * (t.size() + 1);
            return new AlignmentResult(moves, (1.0 - f) * bwc, f, bwc);
        }
    }

    /** Footprint engine whose comparison verdict is fixed. */
    public static final class Footprints implements FootprintEngine {
        public final AtomicInteger compareCalls = new AtomicInteger();
        public final AtomicInteger netDiscoveries = new AtomicInteger();
        private final boolean fit;

        public Footprints(boolean fit) {
            this.fit = fit;
        }

        public static Footprint footprintOf(Set<String> activities) {
            return new Footprint(activities, Set.of(), Set.of(), Set.of(), Set.of(), 0);
        }

        @Override
        public Footprint discover(EventLog log, String activityKey) {
            Set<String> acts = new java.util.LinkedHashSet<>();
            log.traces().forEach(t -> acts.addAll(t.activities(activityKey)));
            return footprintOf(acts);
        }

        @Override
        public Footprint discover(ProcessTree model) {
            return footprintOf(model.labels());
        }

        @Override
        public Footprint discover(AcceptingPetriNet model) {
            netDiscoveries.incrementAndGet();
            return footprintOf(model.net().visibleLabels());
        }

        @Override
        public List<FootprintDiagnostic> compareTraces(List<Footprint> traceFootprints, Footprint model) {
            compareCalls.incrementAndGet();
            List<FootprintDiagnostic> result = new ArrayList<>();
            for (int i = 0; i < traceFootprints.size(); i++) {
                result.add(new FootprintDiagnostic(fit, Set.of()));
            }
            return result;
        }

        @Override
        public FootprintDiagnostic compareLog(Footprint logFootprint, Footprint model) {
            compareCalls.incrementAndGet();
            return new FootprintDiagnostic(fit, Set.of());
        }

        @Override
        public FootprintFitness fitness(Object logFootprints, Footprint model, List<FootprintDiagnostic> diagnostics) {
            long fitting = diagnostics.stream().filter(FootprintDiagnostic::isFootprintsFit).count();
            return new FootprintFitness(100.0 * fitting / diagnostics.size(), fit ? 1.0 : 0.0);
        }

        @Override
        public double precision(Object logFootprints, Footprint model) {
            return fit ? 1.0 : 0.5;
        }
    }

    /** Converts process trees to a fixed net; refuses everything else unless told otherwise. */
    public static final class Converter implements ModelConverter {
        public final AtomicInteger toNetCalls = new AtomicInteger();
        private final AcceptingPetriNet net;
        private final ProcessTree tree;

        public Converter(AcceptingPetriNet net, ProcessTree tree) {
            this.net = net;
            this.tree = tree;
        }

        @Override
        public Optional<AcceptingPetriNet> toPetriNet(Object... modelArgs) {
            toNetCalls.incrementAndGet();
            return Optional.ofNullable(net);
        }

        @Override
        public Optional<ProcessTree> toProcessTree(Object... modelArgs) {
            return Optional.ofNullable(tree);
        }
    }
}
