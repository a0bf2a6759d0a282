package ai.callgraph.graph;

import ai.callgraph.ast.Expr;
import ai.callgraph.ast.Stmt;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Walks statements of one scope and hands every expression it covers to the builder. Nested blocks stay in the same
 * scope.
 *
 * <p>Covered: expression statements, {@code return}, {@code assert}, {@code try} (body, {@code else} and
 * {@code finally}, not the handlers), {@code with}, {@code for} (target, iterable, body), assignments of all three
 * kinds, {@code del} and {@code while} (test, body). Everything else, including {@code if}, {@code class},
 * {@code match}, nested {@code def}, {@code async for}/{@code async with}, {@code raise} and loop {@code else}
 * blocks, is skipped together with any calls it contains.
 */
final class StatementWalker implements Stmt.Visitor<Void> {
    private final CallGraphBuilder builder;
    private final String scope;

    StatementWalker(CallGraphBuilder builder, String scope) {
        this.builder = builder;
        this.scope = scope;
    }

    void walk(List<Stmt> statements) {
        for (var statement : statements) {
            statement.accept(this);
        }
    }

    private void expression(@Nullable Expr expr) {
        if (expr != null) {
            builder.addCalls(scope, expr);
        }
    }

    private void expressions(List<Expr> exprs) {
        exprs.forEach(this::expression);
    }

    @Override
    public Void visitExpr(Stmt.ExprStmt stmt) {
        expression(stmt.value());
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return stmt) {
        expression(stmt.value());
        return null;
    }

    @Override
    public Void visitAssert(Stmt.Assert stmt) {
        expression(stmt.test());
        expression(stmt.msg());
        return null;
    }

    @Override
    public Void visitTry(Stmt.Try stmt) {
        walk(stmt.body());
        walk(stmt.orelse());
        walk(stmt.finalbody());
        return null;
    }

    @Override
    public Void visitWith(Stmt.With stmt) {
        for (var item : stmt.items()) {
            expression(item.contextExpr());
            expression(item.optionalVars());
        }
        walk(stmt.body());
        return null;
    }

    @Override
    public Void visitFor(Stmt.For stmt) {
        expression(stmt.target());
        expression(stmt.iter());
        walk(stmt.body());
        return null;
    }

    @Override
    public Void visitAssign(Stmt.Assign stmt) {
        expressions(stmt.targets());
        expression(stmt.value());
        return null;
    }

    @Override
    public Void visitAnnAssign(Stmt.AnnAssign stmt) {
        expression(stmt.target());
        expression(stmt.value());
        return null;
    }

    @Override
    public Void visitDelete(Stmt.Delete stmt) {
        expressions(stmt.targets());
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While stmt) {
        expression(stmt.test());
        walk(stmt.body());
        return null;
    }

    @Override
    public Void visitAugAssign(Stmt.AugAssign stmt) {
        expression(stmt.target());
        expression(stmt.value());
        return null;
    }

    // Not walked. Each kind is listed so that new statement kinds have to be triaged here.

    @Override
    public Void visitFunctionDef(Stmt.FunctionDef stmt) {
        return null;
    }

    @Override
    public Void visitAsyncFunctionDef(Stmt.AsyncFunctionDef stmt) {
        return null;
    }

    @Override
    public Void visitClassDef(Stmt.ClassDef stmt) {
        return null;
    }

    @Override
    public Void visitIf(Stmt.If stmt) {
        return null;
    }

    @Override
    public Void visitMatch(Stmt.Match stmt) {
        return null;
    }

    @Override
    public Void visitAsyncFor(Stmt.AsyncFor stmt) {
        return null;
    }

    @Override
    public Void visitAsyncWith(Stmt.AsyncWith stmt) {
        return null;
    }

    @Override
    public Void visitTryStar(Stmt.TryStar stmt) {
        return null;
    }

    @Override
    public Void visitRaise(Stmt.Raise stmt) {
        return null;
    }

    @Override
    public Void visitImport(Stmt.Import stmt) {
        return null;
    }

    @Override
    public Void visitImportFrom(Stmt.ImportFrom stmt) {
        return null;
    }

    @Override
    public Void visitGlobal(Stmt.Global stmt) {
        return null;
    }

    @Override
    public Void visitNonlocal(Stmt.Nonlocal stmt) {
        return null;
    }

    @Override
    public Void visitPass(Stmt.Pass stmt) {
        return null;
    }

    @Override
    public Void visitBreak(Stmt.Break stmt) {
        return null;
    }

    @Override
    public Void visitContinue(Stmt.Continue stmt) {
        return null;
    }

    @Override
    public Void visitTypeAlias(Stmt.TypeAlias stmt) {
        return null;
    }
}
