package com.traceconform.core.engine;

import com.traceconform.core.log.EventLog;
import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.Footprint;
import com.traceconform.core.model.ProcessTree;

import java.util.List;

/**
 * Footprint discovery, comparison and evaluation.
 */
public interface FootprintEngine {

    Footprint discover(EventLog log, String activityKey);

    Footprint discover(ProcessTree model);

    Footprint discover(AcceptingPetriNet model);

    /** One diagnostic per trace footprint, in order. */
    List<FootprintDiagnostic> compareTraces(List<Footprint> traceFootprints, Footprint model);

    FootprintDiagnostic compareLog(Footprint logFootprint, Footprint model);

    FootprintFitness fitness(Object logFootprints, Footprint model, List<FootprintDiagnostic> diagnostics);

    double precision(Object logFootprints, Footprint model);

    record FootprintFitness(double percentageOfFittingTraces, double logFitness) {}
}
