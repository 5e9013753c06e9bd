package com.traceconform.core.engine;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.DirectlyFollowsGraph;
import com.traceconform.core.model.ProcessTree;

import java.util.List;

/**
 * Computes optimal alignments. Every method returns one entry per trace in log order;
 * an entry may be {@code null} when the engine gave up on that trace.
 */
public interface AlignmentEngine {

    List<AlignmentResult> align(EventLog log, AcceptingPetriNet model, ConformanceProperties properties);

    List<AlignmentResult> align(EventLog log, ProcessTree model, ConformanceProperties properties);

    List<AlignmentResult> align(EventLog log, DirectlyFollowsGraph model, ConformanceProperties properties);
}
