package ai.callgraph.graph.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.callgraph.graph.CallGraph;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/** Small graphs and assertions shared by the analysis tests. */
final class GraphFixtures {
    private GraphFixtures() {}

    /** Builds a graph from alternating node names and callee lists; keys keep their order. */
    static CallGraph graph(Object... entries) {
        var map = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < entries.length; i += 2) {
            @SuppressWarnings("unchecked")
            var callees = (List<String>) entries[i + 1];
            map.put((String) entries[i], callees);
        }
        return CallGraph.of(map);
    }

    /** A chain n0 -> n1 -> ... -> n(length-1). */
    static CallGraph chain(int length) {
        var map = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < length; i++) {
            map.put("n" + i, i + 1 < length ? List.of("n" + (i + 1)) : List.of());
        }
        return CallGraph.of(map);
    }

    static void assertPartition(CallGraph graph, List<List<String>> components) {
        var seen = new HashSet<String>();
        for (var component : components) {
            assertTrue(!component.isEmpty(), "empty component");
            for (var node : component) {
                assertTrue(seen.add(node), node + " appears in more than one component");
            }
        }
        assertEquals(Set.copyOf(graph.nodes()), seen, "components must cover every node");
    }

    static Set<Set<String>> asSets(List<List<String>> components) {
        var sets = new HashSet<Set<String>>();
        for (var component : components) {
            sets.add(Set.copyOf(component));
        }
        return sets;
    }
}
