package com.traceconform.core.engine;

import com.traceconform.core.config.ConformanceProperties;
import com.traceconform.core.log.EventLog;
import com.traceconform.core.model.AcceptingPetriNet;

public interface PrecisionEngine {

    double precision(EventLog log, AcceptingPetriNet model, PrecisionVariant variant, ConformanceProperties properties);
}
