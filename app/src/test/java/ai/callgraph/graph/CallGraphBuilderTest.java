package ai.callgraph.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.callgraph.analyzer.ParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class CallGraphBuilderTest {
    private final CallGraphExtractor extractor = new CallGraphExtractor();

    private CallGraph build(String source) throws ParseException {
        return extractor.build(source, "test.py");
    }

    /** Expected adjacency in the given order, for comparisons that include node order. */
    private static Map<String, List<String>> graph(Object... entries) {
        var map = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < entries.length; i += 2) {
            @SuppressWarnings("unchecked")
            var callees = (List<String>) entries[i + 1];
            map.put((String) entries[i], callees);
        }
        return map;
    }

    private static void assertGraph(Map<String, List<String>> expected, CallGraph actual) {
        assertEquals(expected, actual.asMap());
        assertEquals(List.copyOf(expected.keySet()), List.copyOf(actual.nodes()), "node order");
    }

    @Test
    public void definedCallee_hasItsOwnScope() throws ParseException {
        String source =
                """
                def a():
                    b()

                def b():
                    pass
                """;
        assertGraph(graph("a", List.of("b"), "b", List.of()), build(source));
    }

    @Test
    public void methodCall_recordsMethodNameOnly() throws ParseException {
        String source =
                """
                def a():
                    x.foo()
                """;
        var graph = build(source);
        assertGraph(graph("a", List.of("foo"), "foo", List.of()), graph);
        assertFalse(graph.contains("x"));
    }

    @Test
    public void chainedCall_recordsOnlyTheOuterMethod() throws ParseException {
        String source =
                """
                def a():
                    b().c()
                """;
        assertGraph(graph("a", List.of("c"), "c", List.of()), build(source));
    }

    @Test
    public void selfCall_isASelfLoop() throws ParseException {
        String source =
                """
                def a():
                    a()
                """;
        assertGraph(graph("a", List.of("a")), build(source));
    }

    @Test
    public void repeatedCalls_keepEveryCallSite() throws ParseException {
        String source =
                """
                def a():
                    c()
                    c()
                """;
        var graph = build(source);
        assertEquals(List.of("c", "c"), graph.callees("a"));
        assertEquals(2, graph.edgeCount());
        assertEquals(List.of("a"), graph.callers("c"));
    }

    @Test
    public void moduleLevelCode_isAttributedToModuleScope() throws ParseException {
        String source =
                """
                import os

                def main():
                    run()

                if __name__ == "__main__":
                    main()
                setup()
                main()
                """;
        var graph = build(source);
        assertGraph(
                graph(
                        "main", List.of("run"),
                        "run", List.of(),
                        CallGraphBuilder.MODULE_SCOPE, List.of("setup", "main"),
                        "setup", List.of()),
                graph);
    }

    @Test
    public void moduleScope_appearsOnlyWithCalls() throws ParseException {
        String source =
                """
                import os
                X = 1

                def a():
                    pass
                """;
        assertGraph(graph("a", List.of()), build(source));
    }

    @Test
    public void asyncFunction_isAScope() throws ParseException {
        String source =
                """
                async def fetch():
                    await client.get(url())
                """;
        assertGraph(graph("fetch", List.of("get", "url"), "get", List.of(), "url", List.of()), build(source));
    }

    @Test
    public void redefinition_keepsFirstPositionAndLastBody() throws ParseException {
        String source =
                """
                def a():
                    old()

                def b():
                    pass

                def a():
                    new()
                """;
        var graph = build(source);
        assertEquals(List.of("a", "old", "b", "new"), List.copyOf(graph.nodes()));
        assertEquals(List.of("new"), graph.callees("a"));
        assertTrue(graph.callers("old").isEmpty(), "old stays as a leaf nobody calls");
    }

    @Test
    public void handledStatements_contributeInSourceOrder() throws ParseException {
        String source =
                """
                def f():
                    expr()
                    x = assign()
                    y: int = annotated()
                    z += augmented()
                    del items[index()]
                    assert check(), message()
                    for item in source():
                        loop_body()
                    while condition():
                        while_body()
                    with manager() as handle:
                        with_body()
                    try:
                        try_body()
                    except Error:
                        handler()
                    else:
                        try_else()
                    finally:
                        try_finally()
                    return result()
                """;
        assertEquals(
                List.of(
                        "expr",
                        "assign",
                        "annotated",
                        "augmented",
                        "index",
                        "check",
                        "message",
                        "source",
                        "loop_body",
                        "condition",
                        "while_body",
                        "manager",
                        "with_body",
                        "try_body",
                        "try_else",
                        "try_finally",
                        "result"),
                build(source).callees("f"));
    }

    @Test
    public void unvisitedStatements_contributeNothing() throws ParseException {
        String source =
                """
                def f():
                    if cond():
                        in_if()
                    else:
                        in_else()
                    class Inner:
                        x = in_class()
                    def nested():
                        in_nested()
                    match subject():
                        case _:
                            in_case()
                    raise failure()
                    for i in range(3):
                        pass
                    else:
                        in_for_else()
                    while flag:
                        pass
                    else:
                        in_while_else()
                """;
        assertEquals(List.of("range"), build(source).callees("f"));
    }

    @Test
    public void asyncLoopAndWith_contributeNothing() throws ParseException {
        String source =
                """
                async def f():
                    async for item in stream():
                        in_loop()
                    async with session():
                        in_with()
                """;
        assertGraph(graph("f", List.of()), build(source));
    }

    @Test
    public void exceptionHandlers_areNotVisited() throws ParseException {
        String source =
                """
                def f():
                    try:
                        pass
                    except Error as e:
                        recover()
                """;
        assertTrue(build(source).callees("f").isEmpty());
    }

    @Test
    public void keywordArgumentsAndComprehensionClauses_areNotVisited() throws ParseException {
        String source =
                """
                def f():
                    run(key=hidden())
                    return [shown(x) for x in also_hidden() if filtered(x)]
                """;
        assertEquals(List.of("run", "shown"), build(source).callees("f"));
    }

    @Test
    public void topLevelCompoundStatements_useModuleScope() throws ParseException {
        String source =
                """
                for path in paths():
                    load(path)
                with lock():
                    update()
                """;
        assertEquals(List.of("paths", "load", "lock", "update"), build(source).callees(CallGraphBuilder.MODULE_SCOPE));
    }

    @Test
    public void everyCallee_isANode() throws ParseException {
        String source =
                """
                def a():
                    b(c(d()), e.f())
                    [g() for _ in h()]

                x = {k(): v() for k in ks}
                """;
        var graph = build(source);
        for (var node : graph.nodes()) {
            for (var callee : graph.callees(node)) {
                assertTrue(graph.contains(callee), callee + " is referenced but not a node");
            }
        }
    }

    @Test
    public void buildingTwice_yieldsIdenticalGraphs() throws ParseException {
        String source =
                """
                def z():
                    y()
                    x()
                    y()

                def y():
                    z()

                w()
                """;
        var first = build(source);
        var second = build(source);
        assertEquals(first, second);
        assertEquals(List.copyOf(first.nodes()), List.copyOf(second.nodes()));
        assertEquals(List.of("z", "y", "x", CallGraphBuilder.MODULE_SCOPE, "w"), List.copyOf(first.nodes()));
    }

    @Test
    public void typeAlias_contributesNothing() throws ParseException {
        String source =
                """
                type Handler = Callable[[Request], Response]
                type Pair[T] = tuple[T, T]

                def a():
                    b()
                """;
        assertGraph(graph("a", List.of("b"), "b", List.of()), build(source));
    }

    @Test
    public void starredCallsInBareItemList_areRecorded() throws ParseException {
        String source =
                """
                for x in *a(), *b():
                    pass
                """;
        assertGraph(
                graph(CallGraphBuilder.MODULE_SCOPE, List.of("a", "b"), "a", List.of(), "b", List.of()), build(source));
    }
}
