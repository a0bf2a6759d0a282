package ai.callgraph.ast;

import java.util.List;

/**
 * Root of a parsed module: the top-level statements in source order.
 *
 * @param displayId identifier the module was parsed under, for diagnostics only
 */
public record SourceModule(String displayId, List<Stmt> body) {
    public SourceModule {
        body = List.copyOf(body);
    }
}
