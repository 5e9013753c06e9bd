package com.traceconform.core.model;

import java.util.Objects;

/**
 * A Petri net together with its initial and final marking.
 */
public record AcceptingPetriNet(PetriNet net, Marking initialMarking, Marking finalMarking) {

    public AcceptingPetriNet {
        Objects.requireNonNull(net, "net");
        Objects.requireNonNull(initialMarking, "initialMarking");
        Objects.requireNonNull(finalMarking, "finalMarking");
    }
}
