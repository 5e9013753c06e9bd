package com.traceconform.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Procedural model: a bipartite graph of places and transitions.
 * A transition without a label is silent.
 */
public final class PetriNet {

    public record Place(String name) {
        public Place {
            Objects.requireNonNull(name, "name");
        }
    }

    public record Transition(String name, String label) {
        public Transition {
            Objects.requireNonNull(name, "name");
        }

        public boolean isSilent() {
            return label == null;
        }
    }

    /** Arc from a place to a transition or from a transition to a place. */
    public record Arc(Object source, Object target, int weight) {}

    private final String name;
    private final Set<Place> places = new LinkedHashSet<>();
    private final Set<Transition> transitions = new LinkedHashSet<>();
    private final List<Arc> arcs = new ArrayList<>();

    public PetriNet(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public Place addPlace(String placeName) {
        Place p = new Place(placeName);
        places.add(p);
        return p;
    }

    public Transition addTransition(String transitionName, String label) {
        Transition t = new Transition(transitionName, label);
        transitions.add(t);
        return t;
    }

    public void addArc(Place from, Transition to) {
        requireMember(from, to);
        arcs.add(new Arc(from, to, 1));
    }

    public void addArc(Transition from, Place to) {
        requireMember(to, from);
        arcs.add(new Arc(from, to, 1));
    }

    private void requireMember(Place p, Transition t) {
        if (!places.contains(p)) {
            throw new IllegalArgumentException("Place not in net: " + p.name());
        }
        if (!transitions.contains(t)) {
            throw new IllegalArgumentException("Transition not in net: " + t.name());
        }
    }

    public Set<Place> places() { return Collections.unmodifiableSet(places); }
    public Set<Transition> transitions() { return Collections.unmodifiableSet(transitions); }
    public List<Arc> arcs() { return Collections.unmodifiableList(arcs); }

    /** Labels of all visible transitions. */
    public Set<String> visibleLabels() {
        Set<String> labels = new LinkedHashSet<>();
        for (Transition t : transitions) {
            if (!t.isSilent()) {
                labels.add(t.label());
            }
        }
        return labels;
    }
}
