package com.traceconform.core.cascade;

import com.traceconform.core.UnsupportedModelException;
import com.traceconform.core.engine.ConformanceEngines;
import com.traceconform.core.engine.ModelConverter;
import com.traceconform.core.routing.ModelConversion;
import com.traceconform.core.routing.ModelKind;
import com.traceconform.core.routing.ModelShapes;
import com.traceconform.core.routing.ResolvedModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Coerces the cascade's model arguments to a process tree when possible, otherwise to a Petri net.
 */
final class CascadeModels {

    private CascadeModels() {}

    static List<ModelConversion> attempts(ConformanceEngines engines) {
        List<ModelConversion> attempts = new ArrayList<>();
        attempts.add(new ModelConversion("process-tree", args -> directly(args, ModelKind.HIERARCHICAL)));
        if (engines.hasConverter()) {
            ModelConverter converter = engines.converter();
            attempts.add(new ModelConversion("to-process-tree",
                    args -> converter.toProcessTree(args).map(ResolvedModel::hierarchical)));
        }
        attempts.add(new ModelConversion("petri-net", args -> directly(args, ModelKind.PROCEDURAL)));
        if (engines.hasConverter()) {
            ModelConverter converter = engines.converter();
            attempts.add(new ModelConversion("to-petri-net",
                    args -> converter.toPetriNet(args).map(ResolvedModel::procedural)));
        }
        return attempts;
    }

    static ResolvedModel coerce(List<ModelConversion> attempts, Object[] modelArgs) {
        for (ModelConversion attempt : attempts) {
            Optional<ResolvedModel> model = attempt.apply(modelArgs);
            if (model.isPresent()) {
                return model.get();
            }
        }
        throw new UnsupportedModelException("Model can be expressed neither as a process tree nor as a Petri net");
    }

    private static Optional<ResolvedModel> directly(Object[] args, ModelKind kind) {
        return ModelShapes.classify(args).filter(m -> m.kind() == kind);
    }
}
