package com.traceconform.core.cascade;

import com.traceconform.core.UnsupportedModelException;
import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.AlignmentResult;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.engine.FootprintEngine;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Logs;
import com.traceconform.core.log.Trace;
import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.Footprint;
import com.traceconform.core.model.ProcessTree;
import com.traceconform.core.routing.ModelConversion;
import com.traceconform.core.routing.ModelRouter;
import com.traceconform.core.routing.ResolvedModel;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a single trace fits a model, escalating from cheap to exact techniques.
 *
 * Process trees: footprints (a mismatch is conclusive) -> token replay on the converted net
 * (a fit is conclusive) -> alignment fitness == 1.0.
 * Petri nets: unknown activities (conclusive) -> token replay -> alignments. The footprint stage is
 * skipped on nets unless {@link ConformanceProperties#FOOTPRINTS_ON_NETS} is set.
 *
 * Stateless; safe to share between threads working on different traces.
 */
public class CascadeFitnessVerifier {

    private final ConformanceEngines engines;
    private final ModelRouter router;
    private final List<ModelConversion> coercions;

    public CascadeFitnessVerifier(ConformanceEngines engines, ModelRouter router) {
        this.engines = engines;
        this.router = router;
        this.coercions = CascadeModels.attempts(engines);
    }

    public boolean isFitting(Object trace, ConformanceProperties properties, Object... model) {
        return verify(trace, properties, model).fit();
    }

    public CascadeVerdict verify(Object traceOrVariant, ConformanceProperties properties, Object... modelArgs) {
        Trace trace = TracePromotion.promote(traceOrVariant, properties.getActivityKey());
        ResolvedModel model = CascadeModels.coerce(coercions, modelArgs);
        EventLog log = Logs.singleton(trace);

        return switch (model.kind()) {
            case HIERARCHICAL -> verifyTree(log, model.asProcessTree(), properties);
            case PROCEDURAL -> verifyNet(log, model.asPetriNet(), properties);
            default -> throw new UnsupportedModelException("Cannot check fitness against " + model.kind());
        };
    }

    private CascadeVerdict verifyTree(EventLog log, ProcessTree tree, ConformanceProperties properties) {
        if (!footprintsFit(log, engines.footprints().discover(tree), properties)) {
            return CascadeVerdict.notFit(CascadeStage.FOOTPRINTS);
        }
        if (replayFits(log, toNet(tree), properties)) {
            return CascadeVerdict.fit(CascadeStage.TOKEN_REPLAY);
        }
        return alignmentVerdict(log, ResolvedModel.hierarchical(tree), properties);
    }

    private CascadeVerdict verifyNet(EventLog log, AcceptingPetriNet net, ConformanceProperties properties) {
        if (properties.getBoolean(ConformanceProperties.FOOTPRINTS_ON_NETS, false)
                && !footprintsFit(log, engines.footprints().discover(net), properties)) {
            return CascadeVerdict.notFit(CascadeStage.FOOTPRINTS);
        }
        Set<String> unknown = new LinkedHashSet<>(log.get(0).activities(properties.getActivityKey()));
        unknown.removeAll(net.net().visibleLabels());
        if (!unknown.isEmpty()) {
            return CascadeVerdict.notFit(CascadeStage.LABELS);
        }
        if (replayFits(log, net, properties)) {
            return CascadeVerdict.fit(CascadeStage.TOKEN_REPLAY);
        }
        return alignmentVerdict(log, ResolvedModel.procedural(net), properties);
    }

    private boolean footprintsFit(EventLog log, Footprint modelFootprint, ConformanceProperties properties) {
        FootprintEngine footprints = engines.footprints();
        Footprint traceFootprint = footprints.discover(log, properties.getActivityKey());
        return footprints.compareTraces(List.of(traceFootprint), modelFootprint).get(0).isFootprintsFit();
    }

    private boolean replayFits(EventLog log, AcceptingPetriNet net, ConformanceProperties properties) {
        return router.replay(log, ResolvedModel.procedural(net), properties).get(0).traceIsFit();
    }

    private CascadeVerdict alignmentVerdict(EventLog log, ResolvedModel model, ConformanceProperties properties) {
        AlignmentResult alignment = router.align(log, model, properties).get(0);
        boolean fit = alignment != null && alignment.isPerfectlyFit();
        return new CascadeVerdict(fit, CascadeStage.ALIGNMENTS);
    }

    private AcceptingPetriNet toNet(ProcessTree tree) {
        if (!engines.hasConverter()) {
            throw new UnsupportedModelException("Token replay on a process tree needs a model converter");
        }
        return engines.converter().toPetriNet(tree)
                .orElseThrow(() -> new UnsupportedModelException("Process tree cannot be converted to a Petri net: " + tree));
    }
}
