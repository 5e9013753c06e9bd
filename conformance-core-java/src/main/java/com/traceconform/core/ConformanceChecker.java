package com.traceconform.core;

import com.traceconform.core.cascade.CascadeFitnessVerifier;
import com.traceconform.core.cascade.CascadeVerdict;
import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.engine.AlignmentResult;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.engine.PrecisionVariant;
import com.traceconform.core.engine.ReplayResult;
import com.traceconform.core.evaluation.FitnessEvaluator;
import com.traceconform.core.evaluation.FitnessSummary;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.log.Logs;
import com.traceconform.core.model.Marking;
import com.traceconform.core.model.PetriNet;
import com.traceconform.core.routing.ModelRouter;
import com.traceconform.core.routing.ResolvedModel;
import com.traceconform.core.skeleton.LogSkeleton;
import com.traceconform.core.skeleton.LogSkeletonAnalyzer;
import com.traceconform.core.skeleton.SkeletonConformanceResult;
import com.traceconform.core.temporal.TemporalDeviation;
import com.traceconform.core.temporal.TemporalProfile;
import com.traceconform.core.temporal.TemporalProfileAnalyzer;

import java.util.List;

/**
 * Entry points of the conformance engine.
 *
 * Every operation validates the log (shape, and the three columns for tables) before doing any work
 * and returns per-trace results in input order. Errors from the external engines propagate unchanged;
 * a failed call never returns partial results.
 *
 * Instances are immutable; {@link #withKeys} returns a copy using other attribute names.
 */
public class ConformanceChecker {

    private final ConformanceEngines engines;
    private final ModelRouter router;
    private final CascadeFitnessVerifier cascade;
    private final String activityKey;
    private final String timestampKey;
    private final String caseIdKey;

    public ConformanceChecker(ConformanceEngines engines) {
        this(engines, ConformanceProperties.DEFAULT_ACTIVITY_KEY, ConformanceProperties.DEFAULT_TIMESTAMP_KEY,
                ConformanceProperties.DEFAULT_CASE_ID_KEY);
    }

    private ConformanceChecker(ConformanceEngines engines, String activityKey, String timestampKey, String caseIdKey) {
        this.engines = engines;
        this.router = new ModelRouter(engines);
        this.cascade = new CascadeFitnessVerifier(engines, router);
        this.activityKey = activityKey;
        this.timestampKey = timestampKey;
        this.caseIdKey = caseIdKey;
    }

    public ConformanceChecker withKeys(String activityKey, String timestampKey, String caseIdKey) {
        return new ConformanceChecker(engines, activityKey, timestampKey, caseIdKey);
    }

    // -----------------------------------------------------------------------
    // Diagnostics
    // -----------------------------------------------------------------------

    /** Token-based replay diagnostics, one record per trace. */
    public List<ReplayResult> tokenReplayDiagnostics(Object log, PetriNet net, Marking initial, Marking fin) {
        ConformanceProperties properties = properties(log);
        return router.replay(cases(log, properties), router.resolve(net, initial, fin), properties);
    }

    /** Alignment diagnostics against any supported model shape. */
    public List<AlignmentResult> alignmentDiagnostics(Object log, Object... model) {
        return alignments(log, false, model);
    }

    /**
     * Alignment diagnostics computed trace by trace on parallel workers (Petri nets and process trees;
     * frequency graphs are aligned sequentially). Results keep input order.
     */
    public List<AlignmentResult> parallelAlignmentDiagnostics(Object log, Object... model) {
        return alignments(log, true, model);
    }

    private List<AlignmentResult> alignments(Object log, boolean multiProcessing, Object[] model) {
        ConformanceProperties properties = properties(log)
                .withExtra(ConformanceProperties.MULTIPROCESSING, multiProcessing);
        EventLog cases = cases(log, properties);
        return router.align(cases, router.resolve(model), properties);
    }

    // -----------------------------------------------------------------------
    // Fitness and precision
    // -----------------------------------------------------------------------

    public FitnessSummary tokenReplayFitness(Object log, PetriNet net, Marking initial, Marking fin) {
        return FitnessEvaluator.fromReplay(tokenReplayDiagnostics(log, net, initial, fin));
    }

    /** Alignment-based fitness; the model may be given in any shape {@link #alignmentDiagnostics} accepts. */
    public FitnessSummary alignmentFitness(Object log, Object... model) {
        return FitnessEvaluator.fromAlignments(alignments(log, false, model));
    }

    public FitnessSummary parallelAlignmentFitness(Object log, Object... model) {
        return FitnessEvaluator.fromAlignments(alignments(log, true, model));
    }

    public double tokenReplayPrecision(Object log, PetriNet net, Marking initial, Marking fin) {
        return precision(log, PrecisionVariant.TOKEN_REPLAY, false, net, initial, fin);
    }

    public double alignmentPrecision(Object log, PetriNet net, Marking initial, Marking fin) {
        return alignmentPrecision(log, net, initial, fin, false);
    }

    public double alignmentPrecision(Object log, PetriNet net, Marking initial, Marking fin, boolean multiProcessing) {
        return precision(log, PrecisionVariant.ALIGNMENTS, multiProcessing, net, initial, fin);
    }

    private double precision(Object log, PrecisionVariant variant, boolean multiProcessing,
                             PetriNet net, Marking initial, Marking fin) {
        ConformanceProperties properties = properties(log)
                .withExtra(ConformanceProperties.MULTIPROCESSING, multiProcessing);
        EventLog cases = cases(log, properties);
        ResolvedModel model = router.resolve(net, initial, fin);
        double value = engines.precision().precision(cases, model.asPetriNet(), variant, properties);
        return FitnessEvaluator.checkPrecision(value);
    }

    // -----------------------------------------------------------------------
    // Temporal profile and log skeleton
    // -----------------------------------------------------------------------

    public List<List<TemporalDeviation>> temporalProfileConformance(Object log, TemporalProfile profile) {
        return temporalProfileConformance(log, profile, TemporalProfileAnalyzer.DEFAULT_ZETA);
    }

    /** Per case, the activity pairs whose time gap lies outside {@code mean ± zeta * stdev}. */
    public List<List<TemporalDeviation>> temporalProfileConformance(Object log, TemporalProfile profile, double zeta) {
        ConformanceProperties properties = properties(log).withExtra(ConformanceProperties.ZETA, zeta);
        TemporalProfileAnalyzer analyzer = new TemporalProfileAnalyzer(profile, zeta);
        return analyzer.analyze(cases(log, properties), properties);
    }

    /** Per case, the violated log skeleton constraint instances. */
    public List<SkeletonConformanceResult> logSkeletonConformance(Object log, LogSkeleton skeleton) {
        ConformanceProperties properties = properties(log);
        return new LogSkeletonAnalyzer(skeleton).analyze(cases(log, properties), properties);
    }

    // -----------------------------------------------------------------------
    // Single-trace fitness
    // -----------------------------------------------------------------------

    /**
     * Checks whether one trace (or variant) fits the model, using the cheapest conclusive technique.
     */
    public boolean isFitting(Object traceOrVariant, Object... model) {
        return verifyFitting(traceOrVariant, model).fit();
    }

    public CascadeVerdict verifyFitting(Object traceOrVariant, Object... model) {
        return cascade.verify(traceOrVariant, ConformanceProperties.of(activityKey, timestampKey, caseIdKey), model);
    }

    /**
     * Like {@link #verifyFitting}, also running the footprint stage on Petri nets.
     */
    public CascadeVerdict verifyFittingWithNetFootprints(Object traceOrVariant, Object... model) {
        ConformanceProperties properties = ConformanceProperties.of(activityKey, timestampKey, caseIdKey)
                .withExtra(ConformanceProperties.FOOTPRINTS_ON_NETS, true);
        return cascade.verify(traceOrVariant, properties, model);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private ConformanceProperties properties(Object log) {
        return ConformanceProperties.forLog(log, activityKey, timestampKey, caseIdKey);
    }

    private static EventLog cases(Object log, ConformanceProperties properties) {
        return Logs.toEventLog(Logs.requireSupported(log), properties.getCaseIdKey());
    }
}
