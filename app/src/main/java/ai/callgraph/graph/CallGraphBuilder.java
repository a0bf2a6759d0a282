package ai.callgraph.graph;

import ai.callgraph.ast.Expr;
import ai.callgraph.ast.SourceModule;
import ai.callgraph.ast.Stmt;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds the {@link CallGraph} of a parsed module.
 *
 * <p>Each top-level {@code def} or {@code async def} is a scope named after the function. All other top-level
 * statements contribute to the module scope {@value #MODULE_SCOPE}, which only appears once it records a call. A
 * function defined twice keeps its first position but only the edges of its last definition. Every called name is
 * added as a node, so callees without a definition become leaves.
 *
 * <p>Not thread-safe; use one instance per module.
 */
public final class CallGraphBuilder {
    private static final Logger log = LogManager.getLogger(CallGraphBuilder.class);

    /** Scope name for calls made outside any top-level function. */
    public static final String MODULE_SCOPE = "...";

    private final Map<String, List<String>> adjacency = new LinkedHashMap<>();

    public static CallGraph build(SourceModule module) {
        var builder = new CallGraphBuilder();
        for (var statement : module.body()) {
            builder.addTopLevel(statement);
        }
        log.trace("Built graph for {}: {}", module.displayId(), builder.adjacency);
        return new CallGraph(builder.adjacency);
    }

    private CallGraphBuilder() {}

    private void addTopLevel(Stmt statement) {
        if (statement instanceof Stmt.FunctionDef def) {
            addFunction(def.name(), def.body());
        } else if (statement instanceof Stmt.AsyncFunctionDef def) {
            addFunction(def.name(), def.body());
        } else {
            statement.accept(new StatementWalker(this, MODULE_SCOPE));
        }
    }

    private void addFunction(String name, List<Stmt> body) {
        // put keeps the insertion position of an earlier definition while replacing its edges
        adjacency.put(name, new ArrayList<>());
        new StatementWalker(this, name).walk(body);
    }

    /** Records one edge from {@code scope} per call found in {@code expr}. */
    void addCalls(String scope, Expr expr) {
        for (var callee : CallReferenceCollector.collect(expr)) {
            adjacency.computeIfAbsent(scope, k -> new ArrayList<>()).add(callee);
            adjacency.computeIfAbsent(callee, k -> new ArrayList<>());
        }
    }
}
