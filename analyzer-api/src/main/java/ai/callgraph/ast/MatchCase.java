package ai.callgraph.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A {@code case} arm. Patterns are kept as source text; they never contain calls. */
public record MatchCase(String pattern, @Nullable Expr guard, List<Stmt> body) {
    public MatchCase {
        body = List.copyOf(body);
    }
}
