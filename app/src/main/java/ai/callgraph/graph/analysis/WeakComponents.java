package ai.callgraph.graph.analysis;

import ai.callgraph.graph.CallGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a call graph into weakly connected components: groups of nodes linked when edge direction is ignored. A
 * component with no connection to the rest of the graph is code that nothing else reaches.
 */
public final class WeakComponents {
    private WeakComponents() {}

    /**
     * Components in order of their first node; members in breadth-first order from that node. Every node appears in
     * exactly one component.
     */
    public static List<List<String>> compute(CallGraph graph) {
        var neighbours = undirected(graph);
        var assigned = new HashSet<String>();
        var components = new ArrayList<List<String>>();

        for (var seed : graph.nodes()) {
            if (!assigned.add(seed)) {
                continue;
            }
            var component = new ArrayList<String>();
            var queue = new ArrayDeque<String>();
            queue.add(seed);
            while (!queue.isEmpty()) {
                var node = queue.poll();
                component.add(node);
                for (var next : neighbours.get(node)) {
                    if (assigned.add(next)) {
                        queue.add(next);
                    }
                }
            }
            components.add(List.copyOf(component));
        }
        return List.copyOf(components);
    }

    private static Map<String, Set<String>> undirected(CallGraph graph) {
        var neighbours = new HashMap<String, Set<String>>();
        for (var node : graph.nodes()) {
            neighbours.put(node, new LinkedHashSet<>());
        }
        graph.asMap().forEach((caller, callees) -> {
            for (var callee : callees) {
                neighbours.get(caller).add(callee);
                neighbours.get(callee).add(caller);
            }
        });
        return neighbours;
    }
}
