package com.traceconform.core.routing;

import com.traceconform.core.model.AcceptingPetriNet;
import com.traceconform.core.model.ActivityPair;
import com.traceconform.core.model.DirectlyFollowsGraph;
import com.traceconform.core.model.Marking;
import com.traceconform.core.model.PetriNet;
import com.traceconform.core.model.ProcessTree;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Structural classification of model argument lists.
 *
 * Recognized shapes:
 *   (PetriNet, Marking, Marking) or (AcceptingPetriNet)         -> PROCEDURAL
 *   (Map&lt;ActivityPair, Number&gt;, Map&lt;String, Number&gt;, Map&lt;String, Number&gt;)
 *     or (DirectlyFollowsGraph)                                 -> FREQUENCY_GRAPH
 *   (ProcessTree)                                               -> HIERARCHICAL
 */
public final class ModelShapes {

    private ModelShapes() {}

    public static Optional<ResolvedModel> classify(Object... args) {
        if (args == null) {
            return Optional.empty();
        }
        if (args.length == 3) {
            if (args[0] instanceof PetriNet net && args[1] instanceof Marking im && args[2] instanceof Marking fm) {
                return Optional.of(ResolvedModel.procedural(new AcceptingPetriNet(net, im, fm)));
            }
            if (isPairCountMap(args[0]) && isActivityCountMap(args[1]) && isActivityCountMap(args[2])) {
                return Optional.of(ResolvedModel.frequencyGraph(new DirectlyFollowsGraph(
                        pairCounts((Map<?, ?>) args[0]),
                        activityCounts((Map<?, ?>) args[1]),
                        activityCounts((Map<?, ?>) args[2]))));
            }
        } else if (args.length == 1) {
            if (args[0] instanceof AcceptingPetriNet apn) {
                return Optional.of(ResolvedModel.procedural(apn));
            }
            if (args[0] instanceof DirectlyFollowsGraph dfg) {
                return Optional.of(ResolvedModel.frequencyGraph(dfg));
            }
            if (args[0] instanceof ProcessTree tree) {
                return Optional.of(ResolvedModel.hierarchical(tree));
            }
        }
        return Optional.empty();
    }

    private static boolean isPairCountMap(Object o) {
        if (!(o instanceof Map<?, ?> map)) return false;
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof ActivityPair) || !(e.getValue() instanceof Number)) return false;
        }
        return true;
    }

    private static boolean isActivityCountMap(Object o) {
        if (!(o instanceof Map<?, ?> map)) return false;
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String) || !(e.getValue() instanceof Number)) return false;
        }
        return true;
    }

    private static Map<ActivityPair, Long> pairCounts(Map<?, ?> raw) {
        Map<ActivityPair, Long> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put((ActivityPair) k, ((Number) v).longValue()));
        return result;
    }

    private static Map<String, Long> activityCounts(Map<?, ?> raw) {
        Map<String, Long> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put((String) k, ((Number) v).longValue()));
        return result;
    }
}
