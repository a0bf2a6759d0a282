package ai.callgraph.graph;

import ai.callgraph.ast.Expr;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Collects the callee names of every call inside an expression, in traversal order.
 *
 * <p>A call records the attribute name for {@code recv.name(...)}, the name for {@code name(...)}, and nothing for
 * any other callee; the callee expression itself is never descended into, so {@code b().c()} yields only {@code c}.
 * After the callee, positional arguments are visited. Not visited:
 *
 * <ul>
 *   <li>keyword argument values, {@code f(key=g())} yields only {@code f};
 *   <li>comprehension {@code for}/{@code if} clauses, only the element expression is visited;
 *   <li>literals and names outside call position.
 * </ul>
 */
final class CallReferenceCollector implements Expr.Visitor<Void> {
    private final List<String> names = new ArrayList<>();

    private CallReferenceCollector() {}

    /** Callee names of all calls in {@code expr}, one entry per call. */
    static List<String> collect(Expr expr) {
        var collector = new CallReferenceCollector();
        expr.accept(collector);
        return collector.names;
    }

    private void visit(@Nullable Expr expr) {
        if (expr != null) {
            expr.accept(this);
        }
    }

    private void visitAll(List<? extends @Nullable Expr> exprs) {
        for (var expr : exprs) {
            visit(expr);
        }
    }

    @Override
    public Void visitCall(Expr.Call expr) {
        if (expr.func() instanceof Expr.Attribute attribute) {
            names.add(attribute.attr());
        } else if (expr.func() instanceof Expr.Name name) {
            names.add(name.id());
        }
        visitAll(expr.args());
        return null;
    }

    // Sequences

    @Override
    public Void visitBoolOp(Expr.BoolOp expr) {
        visitAll(expr.values());
        return null;
    }

    @Override
    public Void visitList(Expr.ListExpr expr) {
        visitAll(expr.elts());
        return null;
    }

    @Override
    public Void visitSet(Expr.SetExpr expr) {
        visitAll(expr.elts());
        return null;
    }

    @Override
    public Void visitTuple(Expr.TupleExpr expr) {
        visitAll(expr.elts());
        return null;
    }

    @Override
    public Void visitJoinedStr(Expr.JoinedStr expr) {
        visitAll(expr.values());
        return null;
    }

    /** Values first, then the keys that are present. */
    @Override
    public Void visitDict(Expr.DictExpr expr) {
        visitAll(expr.values());
        visitAll(expr.keys());
        return null;
    }

    // Two operands

    @Override
    public Void visitBinOp(Expr.BinOp expr) {
        visit(expr.left());
        visit(expr.right());
        return null;
    }

    @Override
    public Void visitNamedExpr(Expr.NamedExpr expr) {
        visit(expr.target());
        visit(expr.value());
        return null;
    }

    @Override
    public Void visitDictComp(Expr.DictComp expr) {
        visit(expr.key());
        visit(expr.value());
        return null;
    }

    @Override
    public Void visitSubscript(Expr.Subscript expr) {
        visit(expr.value());
        visit(expr.slice());
        return null;
    }

    // One operand

    @Override
    public Void visitUnaryOp(Expr.UnaryOp expr) {
        visit(expr.operand());
        return null;
    }

    @Override
    public Void visitLambda(Expr.Lambda expr) {
        visit(expr.body());
        return null;
    }

    @Override
    public Void visitAwait(Expr.Await expr) {
        visit(expr.value());
        return null;
    }

    @Override
    public Void visitYield(Expr.Yield expr) {
        visit(expr.value());
        return null;
    }

    @Override
    public Void visitYieldFrom(Expr.YieldFrom expr) {
        visit(expr.value());
        return null;
    }

    @Override
    public Void visitListComp(Expr.ListComp expr) {
        visit(expr.elt());
        return null;
    }

    @Override
    public Void visitSetComp(Expr.SetComp expr) {
        visit(expr.elt());
        return null;
    }

    @Override
    public Void visitGeneratorExp(Expr.GeneratorExp expr) {
        visit(expr.elt());
        return null;
    }

    @Override
    public Void visitAttribute(Expr.Attribute expr) {
        visit(expr.value());
        return null;
    }

    @Override
    public Void visitStarred(Expr.Starred expr) {
        visit(expr.value());
        return null;
    }

    // Others

    @Override
    public Void visitIfExp(Expr.IfExp expr) {
        visit(expr.test());
        visit(expr.body());
        visit(expr.orelse());
        return null;
    }

    @Override
    public Void visitCompare(Expr.Compare expr) {
        visit(expr.left());
        visitAll(expr.comparators());
        return null;
    }

    @Override
    public Void visitFormattedValue(Expr.FormattedValue expr) {
        visit(expr.value());
        visit(expr.formatSpec());
        return null;
    }

    /** Bounds are visited upper, lower, step. */
    @Override
    public Void visitSlice(Expr.Slice expr) {
        visit(expr.upper());
        visit(expr.lower());
        visit(expr.step());
        return null;
    }

    // Terminals

    @Override
    public Void visitConstant(Expr.Constant expr) {
        return null;
    }

    @Override
    public Void visitName(Expr.Name expr) {
        return null;
    }
}
