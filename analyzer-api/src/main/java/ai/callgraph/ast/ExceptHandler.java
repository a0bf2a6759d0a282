package ai.callgraph.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

public record ExceptHandler(@Nullable Expr type, @Nullable String name, List<Stmt> body) {
    public ExceptHandler {
        body = List.copyOf(body);
    }
}
