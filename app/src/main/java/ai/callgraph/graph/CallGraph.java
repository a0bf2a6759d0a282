package ai.callgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable call graph of one module: every node maps to the names it calls, in call-site order, one entry per call
 * site.
 *
 * <p>Nodes are scopes (top-level functions and the module scope {@value CallGraphBuilder#MODULE_SCOPE}) and leaves,
 * names that are called but never defined. Iteration follows first appearance in the source. The node set is closed:
 * every callee is itself a node.
 */
public final class CallGraph {
    private final Map<String, List<String>> adjacency;

    CallGraph(Map<String, List<String>> adjacency) {
        var copy = new LinkedHashMap<String, List<String>>();
        adjacency.forEach((node, callees) -> copy.put(node, List.copyOf(callees)));
        for (var callees : copy.values()) {
            for (var callee : callees) {
                if (!copy.containsKey(callee)) {
                    throw new IllegalArgumentException("Callee %s is not a node".formatted(callee));
                }
            }
        }
        this.adjacency = Collections.unmodifiableMap(copy);
    }

    /**
     * A graph from an explicit adjacency map, keeping the map's iteration order.
     *
     * @throws IllegalArgumentException if a callee is not itself a key
     */
    public static CallGraph of(Map<String, List<String>> adjacency) {
        return new CallGraph(adjacency);
    }

    /** All nodes, in order of first appearance. */
    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public boolean contains(String node) {
        return adjacency.containsKey(node);
    }

    /**
     * Outgoing edges of {@code node}, in call-site order and with duplicates.
     *
     * @throws IllegalArgumentException if {@code node} is not in the graph
     */
    public List<String> callees(String node) {
        var callees = adjacency.get(node);
        if (callees == null) {
            throw new IllegalArgumentException("Unknown node " + node);
        }
        return callees;
    }

    /**
     * Distinct nodes with at least one edge to {@code node}, in node order.
     *
     * @throws IllegalArgumentException if {@code node} is not in the graph
     */
    public List<String> callers(String node) {
        if (!adjacency.containsKey(node)) {
            throw new IllegalArgumentException("Unknown node " + node);
        }
        var callers = new LinkedHashSet<String>();
        adjacency.forEach((caller, callees) -> {
            if (callees.contains(node)) {
                callers.add(caller);
            }
        });
        return List.copyOf(callers);
    }

    /** True for a node with no outgoing edges. */
    public boolean isLeaf(String node) {
        return callees(node).isEmpty();
    }

    public int nodeCount() {
        return adjacency.size();
    }

    /** Number of edges, counting repeated call sites separately. */
    public int edgeCount() {
        return adjacency.values().stream().mapToInt(List::size).sum();
    }

    /** Unmodifiable view of the whole graph. */
    public Map<String, List<String>> asMap() {
        return adjacency;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) return true;
        if (!(o instanceof CallGraph other)) return false;
        return adjacency.equals(other.adjacency) && List.copyOf(nodes()).equals(List.copyOf(other.nodes()));
    }

    @Override
    public int hashCode() {
        return adjacency.hashCode();
    }

    @Override
    public String toString() {
        return adjacency.toString();
    }
}
