package com.traceconform.core.engine;

import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.ProcessTree;

import java.util.Optional;

/**
 * Converts between model representations. An empty result means the arguments cannot be
 * expressed in the target representation; thrown exceptions are real failures.
 */
public interface ModelConverter {

    Optional<AcceptingPetriNet> toPetriNet(Object... modelArgs);

    Optional<ProcessTree> toProcessTree(Object... modelArgs);
}
