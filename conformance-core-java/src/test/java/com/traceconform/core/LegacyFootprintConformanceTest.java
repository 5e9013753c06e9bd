package com.traceconform.core;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.engine.FootprintDiagnostic;
import com.traceconform.core.engine.FootprintEngine;
import com.traceconform.core.footprints.LegacyFootprintConformance;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.model.ActivityPair;
import com.traceconform.core.model.DirectlyFollowsGraph;
import com.traceconform.core.model.Footprint;
import com.traceconform.core.model.ProcessTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.traceconform.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SuppressWarnings("removal")
class LegacyFootprintConformanceTest {

    private static final ProcessTree TREE = ProcessTree.node(ProcessTree.Operator.SEQUENCE,
            ProcessTree.leaf("A"), ProcessTree.leaf("B"));

    private final FakeEngines.Footprints engine = new FakeEngines.Footprints(true);
    private final LegacyFootprintConformance legacy = new LegacyFootprintConformance(
            ConformanceEngines.builder().footprints(engine).build(), ConformanceProperties.defaults());

    @Test
    void perTraceFootprintsGiveTraceExtensiveDiagnostics() {
        List<Footprint> perTrace = List.of(
                FakeEngines.Footprints.footprintOf(Set.of("A")),
                FakeEngines.Footprints.footprintOf(Set.of("B")),
                FakeEngines.Footprints.footprintOf(Set.of("A", "B")));

        List<FootprintDiagnostic> diagnostics = legacy.diagnostics(perTrace, TREE);

        assertEquals(3, diagnostics.size());
    }

    @Test
    void logGivesSingleLogExtensiveDiagnostic() {
        assertEquals(1, legacy.diagnostics(EventLog.of(trace("A", "B"), trace("A")), TREE).size());
        assertEquals(1, legacy.diagnostics(trace("A", "B"), TREE).size());
    }

    @Test
    void precomputedFootprintsAreAcceptedOnBothSides() {
        Footprint log = FakeEngines.Footprints.footprintOf(Set.of("A"));
        Footprint model = FakeEngines.Footprints.footprintOf(Set.of("A", "B"));

        assertEquals(1, legacy.diagnostics(log, model).size());
        assertEquals(1.0, legacy.precision(log, model));
    }

    @Test
    void fitnessComparesOnce() {
        FootprintEngine.FootprintFitness fitness = legacy.fitness(
                List.of(FakeEngines.Footprints.footprintOf(Set.of("A"))), TREE);

        assertEquals(100.0, fitness.percentageOfFittingTraces());
        assertEquals(1, engine.compareCalls.get());
    }

    @Test
    void perTraceListIsNotAModel() {
        List<Footprint> perTrace = List.of(FakeEngines.Footprints.footprintOf(Set.of("A")));
        assertThrows(InputShapeException.class, () -> legacy.diagnostics(trace("A"), perTrace));
    }

    @Test
    void frequencyGraphHasNoFootprint() {
        DirectlyFollowsGraph dfg = new DirectlyFollowsGraph(
                Map.of(ActivityPair.of("A", "B"), 1L), Map.of("A", 1L), Map.of("B", 1L));
        assertThrows(UnsupportedModelException.class, () -> legacy.diagnostics(trace("A"), dfg));
    }

    @Test
    void netModelIsDiscovered() {
        legacy.diagnostics(trace("A"), sequenceNet("A", "B"));
        assertEquals(1, engine.netDiscoveries.get());
    }
}
