package ai.callgraph.graph.analysis;

import ai.callgraph.graph.CallGraph;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A call graph together with the results of the analyses that were run on it. Analyses that were not selected are
 * null and left out of the JSON form.
 *
 * @param displayId the module the graph was built from
 * @param graph every node with its callees, in node order
 * @param weakComponents result of {@link WeakComponents}, if selected
 * @param stronglyConnectedComponents result of {@link StronglyConnectedComponents}, if selected
 * @param inlineCandidates result of {@link InlineCandidates}, if selected
 * @param summary node, edge and leaf counts
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallGraphReport(
        String displayId,
        Map<String, List<String>> graph,
        @Nullable List<List<String>> weakComponents,
        @JsonProperty("sccs") @Nullable List<List<String>> stronglyConnectedComponents,
        @Nullable List<String> inlineCandidates,
        Summary summary) {

    public record Summary(int nodes, int edges, int leaves) {}

    /** Runs the selected analyses over {@code graph}. */
    public static CallGraphReport of(String displayId, CallGraph graph, Set<GraphAnalysis> analyses) {
        var leaves = (int) graph.nodes().stream().filter(graph::isLeaf).count();
        return new CallGraphReport(
                displayId,
                graph.asMap(),
                analyses.contains(GraphAnalysis.COMPONENTS) ? WeakComponents.compute(graph) : null,
                analyses.contains(GraphAnalysis.SCC) ? StronglyConnectedComponents.compute(graph) : null,
                analyses.contains(GraphAnalysis.INLINE) ? InlineCandidates.compute(graph) : null,
                new Summary(graph.nodeCount(), graph.edgeCount(), leaves));
    }
}
