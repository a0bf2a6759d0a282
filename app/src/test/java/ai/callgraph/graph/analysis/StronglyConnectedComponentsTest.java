package ai.callgraph.graph.analysis;

import static ai.callgraph.graph.analysis.GraphFixtures.asSets;
import static ai.callgraph.graph.analysis.GraphFixtures.assertPartition;
import static ai.callgraph.graph.analysis.GraphFixtures.chain;
import static ai.callgraph.graph.analysis.GraphFixtures.graph;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.callgraph.graph.CallGraph;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class StronglyConnectedComponentsTest {

    @Test
    public void mutualRecursion_formsOneComponent() {
        var graph = graph(
                "main", List.of("even"),
                "even", List.of("odd"),
                "odd", List.of("even", "log"),
                "log", List.of());

        var components = StronglyConnectedComponents.compute(graph);

        assertPartition(graph, components);
        assertEquals(Set.of(Set.of("main"), Set.of("even", "odd"), Set.of("log")), asSets(components));
    }

    @Test
    public void callersComeBeforeTheComponentsTheyCall() {
        var graph = graph(
                "main", List.of("even"),
                "even", List.of("odd"),
                "odd", List.of("even", "log"),
                "log", List.of());

        var components = StronglyConnectedComponents.compute(graph);

        assertEquals(List.of("main"), components.get(0));
        assertEquals(Set.of("even", "odd"), Set.copyOf(components.get(1)));
        assertEquals(List.of("log"), components.get(2));
    }

    @Test
    public void selfLoop_isItsOwnComponent() {
        var graph = graph("a", List.of("a"));
        assertEquals(List.of(List.of("a")), StronglyConnectedComponents.compute(graph));
    }

    @Test
    public void acyclicNodes_areSingletons() {
        var graph = graph("a", List.of("b", "c"), "b", List.of("c"), "c", List.of());
        var components = StronglyConnectedComponents.compute(graph);
        assertEquals(3, components.size());
        assertPartition(graph, components);
    }

    @Test
    public void twoCyclesJoinedOneWay_stayApart() {
        var graph = graph(
                "a", List.of("b"),
                "b", List.of("a", "c"),
                "c", List.of("d"),
                "d", List.of("c"));
        assertEquals(
                Set.of(Set.of("a", "b"), Set.of("c", "d")), asSets(StronglyConnectedComponents.compute(graph)));
    }

    @Test
    public void longChain_doesNotOverflowTheStack() {
        var graph = chain(100_000);
        var components = StronglyConnectedComponents.compute(graph);
        assertEquals(100_000, components.size());
        assertEquals(List.of("n0"), components.get(0));
    }

    @Test
    public void longCycle_isOneComponent() {
        var map = new LinkedHashMap<String, List<String>>();
        int length = 100_000;
        for (int i = 0; i < length; i++) {
            map.put("n" + i, List.of("n" + ((i + 1) % length)));
        }
        var components = StronglyConnectedComponents.compute(CallGraph.of(map));
        assertEquals(1, components.size());
        assertEquals(length, components.get(0).size());
    }
}
