package com.hcltech.composable.graph;

import com.hcltech.composable.common.errorsor.ErrorsOr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/** Audits a {@link LinkGraph} against the forest invariant. Reports every violation; never throws. */
public interface ForestValidation {

    static ErrorsOr<Boolean> validate(LinkGraph graph) {
        Objects.requireNonNull(graph);
        return validate(graph.edges(), graph.reverseIndex(), graph.maxDepth());
    }

    static ErrorsOr<Boolean> validate(Map<NodeId, NodeId> edges, Map<NodeId, Set<NodeId>> reverse, int maxDepth) {
        List<String> errors = new ArrayList<>();

        // deterministic for messages
        Map<NodeId, NodeId> ordered = new TreeMap<>(edges);

        for (var e : ordered.entrySet()) {
            NodeId source = e.getKey();
            NodeId target = e.getValue();
            if (source.equals(target)) errors.add("Self edge on " + source);
            Set<NodeId> kids = reverse.get(target);
            if (kids == null || !kids.contains(source))
                errors.add("Edge " + source + " -> " + target + " missing from reverse index");
        }

        for (var e : new TreeMap<>(reverse).entrySet()) {
            if (e.getValue().isEmpty()) errors.add("Empty reverse index entry for " + e.getKey());
            for (NodeId child : e.getValue()) {
                if (!e.getKey().equals(edges.get(child)))
                    errors.add("Reverse index lists " + child + " under " + e.getKey()
                            + " but its target is " + edges.get(child));
            }
        }

        Set<NodeId> reported = new HashSet<>();
        for (NodeId start : ordered.keySet()) {
            Set<NodeId> seen = new HashSet<>();
            NodeId current = start;
            int hops = 0;
            while (current != null) {
                if (!seen.add(current)) {
                    // report each loop once, from the first start that reaches it
                    if (Collections.disjoint(reported, seen))
                        errors.add("Cycle through " + current + " reachable from " + start);
                    reported.addAll(seen);
                    break;
                }
                if (hops++ > maxDepth) {
                    errors.add("Depth of " + start + " exceeds " + maxDepth);
                    break;
                }
                current = edges.get(current);
            }
        }

        return errors.isEmpty() ? ErrorsOr.lift(Boolean.TRUE) : ErrorsOr.errors(errors);
    }
}
