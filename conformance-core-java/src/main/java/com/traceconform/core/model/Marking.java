package com.traceconform.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token distribution over places. Places with zero tokens are not stored.
 */
public final class Marking {

    private final Map<PetriNet.Place, Integer> tokens;

    public Marking(Map<PetriNet.Place, Integer> tokens) {
        Map<PetriNet.Place, Integer> copy = new LinkedHashMap<>();
        for (Map.Entry<PetriNet.Place, Integer> e : tokens.entrySet()) {
            if (e.getValue() < 0) {
                throw new IllegalArgumentException("Negative token count on place " + e.getKey().name());
            }
            if (e.getValue() > 0) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        this.tokens = Collections.unmodifiableMap(copy);
    }

    public static Marking of(PetriNet.Place place) {
        return new Marking(Map.of(place, 1));
    }

    public static Marking empty() {
        return new Marking(Map.of());
    }

    public int tokensOn(PetriNet.Place place) {
        return tokens.getOrDefault(place, 0);
    }

    public Map<PetriNet.Place, Integer> tokens() { return tokens; }

    @Override
    public boolean equals(Object o) {
        return o instanceof Marking other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "Marking" + tokens;
    }
}
