package ai.callgraph.graph.analysis;

import ai.callgraph.graph.CallGraph;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Functions called from exactly one call site, which makes them candidates for inlining into their caller.
 *
 * <p>Incoming edges are counted per call site: a function called twice by the same caller has two incoming edges and
 * does not qualify. A function whose only incoming edge is its own recursive call does not qualify either.
 */
public final class InlineCandidates {
    private InlineCandidates() {}

    /** Qualifying nodes in node order. */
    public static List<String> compute(CallGraph graph) {
        var incoming = new HashMap<String, Integer>();
        var lastCaller = new HashMap<String, String>();
        graph.asMap().forEach((caller, callees) -> {
            for (var callee : callees) {
                incoming.merge(callee, 1, Integer::sum);
                lastCaller.put(callee, caller);
            }
        });

        var candidates = new ArrayList<String>();
        for (var node : graph.nodes()) {
            if (incoming.getOrDefault(node, 0) == 1 && !node.equals(lastCaller.get(node))) {
                candidates.add(node);
            }
        }
        return List.copyOf(candidates);
    }
}
