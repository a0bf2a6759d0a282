package ai.callgraph.ast;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Python statement nodes, one record per kind of the Python abstract grammar. {@code async for}, {@code async with}
 * and {@code try/except*} are kinds of their own rather than flags, as in Python's {@code ast} module.
 */
public sealed interface Stmt {

    <R> R accept(Visitor<R> visitor);

    /** One method per statement kind and no defaults: a new kind must be handled by every visitor. */
    interface Visitor<R> {
        R visitFunctionDef(FunctionDef stmt);

        R visitAsyncFunctionDef(AsyncFunctionDef stmt);

        R visitClassDef(ClassDef stmt);

        R visitReturn(Return stmt);

        R visitDelete(Delete stmt);

        R visitAssign(Assign stmt);

        R visitAugAssign(AugAssign stmt);

        R visitAnnAssign(AnnAssign stmt);

        R visitFor(For stmt);

        R visitAsyncFor(AsyncFor stmt);

        R visitWhile(While stmt);

        R visitIf(If stmt);

        R visitWith(With stmt);

        R visitAsyncWith(AsyncWith stmt);

        R visitMatch(Match stmt);

        R visitRaise(Raise stmt);

        R visitTry(Try stmt);

        R visitTryStar(TryStar stmt);

        R visitAssert(Assert stmt);

        R visitImport(Import stmt);

        R visitImportFrom(ImportFrom stmt);

        R visitGlobal(Global stmt);

        R visitNonlocal(Nonlocal stmt);

        R visitExpr(ExprStmt stmt);

        R visitPass(Pass stmt);

        R visitBreak(Break stmt);

        R visitContinue(Continue stmt);

        R visitTypeAlias(TypeAlias stmt);
    }

    /** Parameters and return annotation are not modelled. */
    record FunctionDef(String name, List<Stmt> body, List<Expr> decoratorList) implements Stmt {
        public FunctionDef {
            body = List.copyOf(body);
            decoratorList = List.copyOf(decoratorList);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }
    }

    record AsyncFunctionDef(String name, List<Stmt> body, List<Expr> decoratorList) implements Stmt {
        public AsyncFunctionDef {
            body = List.copyOf(body);
            decoratorList = List.copyOf(decoratorList);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAsyncFunctionDef(this);
        }
    }

    record ClassDef(String name, List<Expr> bases, List<Keyword> keywords, List<Stmt> body, List<Expr> decoratorList)
            implements Stmt {
        public ClassDef {
            bases = List.copyOf(bases);
            keywords = List.copyOf(keywords);
            body = List.copyOf(body);
            decoratorList = List.copyOf(decoratorList);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitClassDef(this);
        }
    }

    record Return(@Nullable Expr value) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Delete(List<Expr> targets) implements Stmt {
        public Delete {
            targets = List.copyOf(targets);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    /** {@code a = b = value} has targets {@code [a, b]}. */
    record Assign(List<Expr> targets, Expr value) implements Stmt {
        public Assign {
            targets = List.copyOf(targets);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /** {@code op} is the full token, e.g. {@code "+="}. */
    record AugAssign(Expr target, String op, Expr value) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }
    }

    record AnnAssign(Expr target, Expr annotation, @Nullable Expr value) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnnAssign(this);
        }
    }

    record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public For {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record AsyncFor(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public AsyncFor {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAsyncFor(this);
        }
    }

    record While(Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public While {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /** {@code elif} chains nest as a single {@code If} in {@code orelse}. */
    record If(Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public If {
            body = List.copyOf(body);
            orelse = List.copyOf(orelse);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record With(List<WithItem> items, List<Stmt> body) implements Stmt {
        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }

    record AsyncWith(List<WithItem> items, List<Stmt> body) implements Stmt {
        public AsyncWith {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAsyncWith(this);
        }
    }

    record Match(Expr subject, List<MatchCase> cases) implements Stmt {
        public Match {
            cases = List.copyOf(cases);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    record Raise(@Nullable Expr exc, @Nullable Expr cause) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRaise(this);
        }
    }

    record Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse, List<Stmt> finalbody)
            implements Stmt {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orelse = List.copyOf(orelse);
            finalbody = List.copyOf(finalbody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    /** {@code try} with {@code except*} handlers. */
    record TryStar(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse, List<Stmt> finalbody)
            implements Stmt {
        public TryStar {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orelse = List.copyOf(orelse);
            finalbody = List.copyOf(finalbody);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTryStar(this);
        }
    }

    record Assert(Expr test, @Nullable Expr msg) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    /** Imported names as written, including any {@code as} alias. */
    record Import(List<String> names) implements Stmt {
        public Import {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /**
     * @param module the module path without leading dots, or null for {@code from . import x}
     * @param level number of leading dots of a relative import
     */
    record ImportFrom(@Nullable String module, List<String> names, int level) implements Stmt {
        public ImportFrom {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitImportFrom(this);
        }
    }

    record Global(List<String> names) implements Stmt {
        public Global {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGlobal(this);
        }
    }

    record Nonlocal(List<String> names) implements Stmt {
        public Nonlocal {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNonlocal(this);
        }
    }

    /** An expression used as a statement, typically a call. */
    record ExprStmt(Expr value) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpr(this);
        }
    }

    record Pass() implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPass(this);
        }
    }

    record Break() implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue() implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }

    /** {@code type name = value} */
    record TypeAlias(Expr name, Expr value) implements Stmt {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypeAlias(this);
        }
    }
}
