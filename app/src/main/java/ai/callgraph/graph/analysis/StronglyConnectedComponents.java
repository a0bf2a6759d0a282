package ai.callgraph.graph.analysis;

import ai.callgraph.graph.CallGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strongly connected components of a call graph (Kosaraju). Two nodes share a component when each can reach the
 * other; a component with more than one node, or a single self-calling node, is recursion.
 *
 * <p>Both depth-first passes keep their own stack so a long call chain cannot overflow the thread stack.
 */
public final class StronglyConnectedComponents {
    private StronglyConnectedComponents() {}

    /**
     * Components in the order the second pass discovers them, which puts callers before the components they call.
     * Every node appears in exactly one component, self-loops get no special treatment.
     */
    public static List<List<String>> compute(CallGraph graph) {
        var finishOrder = finishOrder(graph);
        var transposed = transpose(graph);

        var assigned = new HashSet<String>();
        var components = new ArrayList<List<String>>();
        for (var it = finishOrder.descendingIterator(); it.hasNext(); ) {
            var root = it.next();
            if (!assigned.add(root)) {
                continue;
            }
            var component = new ArrayList<String>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                var node = stack.pop();
                component.add(node);
                for (var caller : transposed.get(node)) {
                    if (assigned.add(caller)) {
                        stack.push(caller);
                    }
                }
            }
            components.add(List.copyOf(component));
        }
        return List.copyOf(components);
    }

    /** Nodes in the order their depth-first visit on the forward graph completes. */
    private static Deque<String> finishOrder(CallGraph graph) {
        Deque<String> finished = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (var start : graph.nodes()) {
            if (!visited.add(start)) {
                continue;
            }
            stack.push(new Frame(start, graph.callees(start).iterator()));
            while (!stack.isEmpty()) {
                var frame = stack.peek();
                if (frame.callees.hasNext()) {
                    var next = frame.callees.next();
                    if (visited.add(next)) {
                        stack.push(new Frame(next, graph.callees(next).iterator()));
                    }
                } else {
                    stack.pop();
                    finished.add(frame.node);
                }
            }
        }
        return finished;
    }

    private static Map<String, List<String>> transpose(CallGraph graph) {
        var transposed = new HashMap<String, List<String>>();
        for (var node : graph.nodes()) {
            transposed.put(node, new ArrayList<>());
        }
        graph.asMap().forEach((caller, callees) -> {
            for (var callee : callees) {
                transposed.get(callee).add(caller);
            }
        });
        return transposed;
    }

    private record Frame(String node, Iterator<String> callees) {}
}
