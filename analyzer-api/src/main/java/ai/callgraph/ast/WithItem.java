package ai.callgraph.ast;

import org.jetbrains.annotations.Nullable;

/** {@code contextExpr as optionalVars} inside a {@code with} header. */
public record WithItem(Expr contextExpr, @Nullable Expr optionalVars) {}
