package com.traceconform.core.routing;

import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.DirectlyFollowsGraph;
import com.traceconform.core.model.ProcessTree;

import java.util.Objects;

/**
 * A model argument list classified into exactly one {@link ModelKind}.
 * Only the accessor matching the kind returns a value; the others throw.
 */
public final class ResolvedModel {

    private final ModelKind kind;
    private final Object model;

    private ResolvedModel(ModelKind kind, Object model) {
        this.kind = kind;
        this.model = Objects.requireNonNull(model, "model");
    }

    public static ResolvedModel procedural(AcceptingPetriNet net) {
        return new ResolvedModel(ModelKind.PROCEDURAL, net);
    }

    public static ResolvedModel frequencyGraph(DirectlyFollowsGraph dfg) {
        return new ResolvedModel(ModelKind.FREQUENCY_GRAPH, dfg);
    }

    public static ResolvedModel hierarchical(ProcessTree tree) {
        return new ResolvedModel(ModelKind.HIERARCHICAL, tree);
    }

    public ModelKind kind() { return kind; }

    public AcceptingPetriNet asPetriNet() {
        return (AcceptingPetriNet) expect(ModelKind.PROCEDURAL);
    }

    public DirectlyFollowsGraph asDirectlyFollowsGraph() {
        return (DirectlyFollowsGraph) expect(ModelKind.FREQUENCY_GRAPH);
    }

    public ProcessTree asProcessTree() {
        return (ProcessTree) expect(ModelKind.HIERARCHICAL);
    }

    private Object expect(ModelKind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Model is " + kind + ", not " + expected);
        }
        return model;
    }

    @Override
    public String toString() {
        return "ResolvedModel{" + kind + "}";
    }
}
