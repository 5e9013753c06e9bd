package com.traceconform.core.engine;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.model.AcceptingPetriNet;

import java.util.List;

public interface TokenReplayEngine {

    /** One result per trace, in log order. */
    List<ReplayResult> replay(EventLog log, AcceptingPetriNet model, ConformanceProperties properties);
}
