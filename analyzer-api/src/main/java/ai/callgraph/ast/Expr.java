package ai.callgraph.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Python expression nodes, one record per kind of the Python abstract grammar. Operators are kept as their source
 * token ({@code "+"}, {@code "not in"}, ...). Collection literals carry an {@code Expr} suffix so they do not shadow
 * {@link java.util.List} and friends.
 */
public sealed interface Expr {

    <R> R accept(Visitor<R> visitor);

    /** One method per expression kind and no defaults: a new kind must be handled by every visitor. */
    interface Visitor<R> {
        R visitBoolOp(BoolOp expr);

        R visitNamedExpr(NamedExpr expr);

        R visitBinOp(BinOp expr);

        R visitUnaryOp(UnaryOp expr);

        R visitLambda(Lambda expr);

        R visitIfExp(IfExp expr);

        R visitDict(DictExpr expr);

        R visitSet(SetExpr expr);

        R visitListComp(ListComp expr);

        R visitSetComp(SetComp expr);

        R visitDictComp(DictComp expr);

        R visitGeneratorExp(GeneratorExp expr);

        R visitAwait(Await expr);

        R visitYield(Yield expr);

        R visitYieldFrom(YieldFrom expr);

        R visitCompare(Compare expr);

        R visitCall(Call expr);

        R visitFormattedValue(FormattedValue expr);

        R visitJoinedStr(JoinedStr expr);

        R visitConstant(Constant expr);

        R visitAttribute(Attribute expr);

        R visitSubscript(Subscript expr);

        R visitStarred(Starred expr);

        R visitName(Name expr);

        R visitList(ListExpr expr);

        R visitTuple(TupleExpr expr);

        R visitSlice(Slice expr);
    }

    /** {@code a and b and c}; chains of the same operator are flattened into one node. */
    record BoolOp(String op, List<Expr> values) implements Expr {
        public BoolOp {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    /** {@code target := value} */
    record NamedExpr(Expr target, Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNamedExpr(this);
        }
    }

    record BinOp(Expr left, String op, Expr right) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinOp(this);
        }
    }

    /** Includes {@code not x}. */
    record UnaryOp(String op, Expr operand) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    /** Parameters are not modelled. */
    record Lambda(Expr body) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    /** {@code body if test else orelse} */
    record IfExp(Expr test, Expr body, Expr orelse) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfExp(this);
        }
    }

    /**
     * Dict display. {@code keys} and {@code values} are parallel; a null key marks a {@code **mapping} entry whose
     * mapping is the corresponding value.
     */
    record DictExpr(List<@Nullable Expr> keys, List<Expr> values) implements Expr {
        public DictExpr {
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException(
                        "Dict keys and values differ in size: %d vs %d".formatted(keys.size(), values.size()));
            }
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDict(this);
        }
    }

    record SetExpr(List<Expr> elts) implements Expr {
        public SetExpr {
            elts = List.copyOf(elts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSet(this);
        }
    }

    record ListComp(Expr elt, List<Comprehension> generators) implements Expr {
        public ListComp {
            generators = List.copyOf(generators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitListComp(this);
        }
    }

    record SetComp(Expr elt, List<Comprehension> generators) implements Expr {
        public SetComp {
            generators = List.copyOf(generators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSetComp(this);
        }
    }

    record DictComp(Expr key, Expr value, List<Comprehension> generators) implements Expr {
        public DictComp {
            generators = List.copyOf(generators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDictComp(this);
        }
    }

    record GeneratorExp(Expr elt, List<Comprehension> generators) implements Expr {
        public GeneratorExp {
            generators = List.copyOf(generators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGeneratorExp(this);
        }
    }

    record Await(Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    /** Bare {@code yield} has a null value. */
    record Yield(@Nullable Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    record YieldFrom(Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitYieldFrom(this);
        }
    }

    /** {@code left op[0] comparators[0] op[1] comparators[1] ...} */
    record Compare(Expr left, List<String> ops, List<Expr> comparators) implements Expr {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    /** {@code *x} positional arguments appear in {@code args} as {@link Starred}. */
    record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * A replacement field of an f-string.
     *
     * @param conversion {@code "r"}, {@code "s"} or {@code "a"}, or null
     * @param formatSpec nested {@link JoinedStr}, or null
     */
    record FormattedValue(Expr value, @Nullable String conversion, @Nullable Expr formatSpec) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFormattedValue(this);
        }
    }

    /** An f-string: literal {@link Constant} parts interleaved with {@link FormattedValue} parts. */
    record JoinedStr(List<Expr> values) implements Expr {
        public JoinedStr {
            values = List.copyOf(values);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitJoinedStr(this);
        }
    }

    /** Any literal, kept as its source text. */
    record Constant(String text) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    /** {@code value.attr} */
    record Attribute(Expr value, String attr) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    /** {@code value[slice]}; several indices are a {@link TupleExpr} slice. */
    record Subscript(Expr value, Expr slice) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    record Starred(Expr value) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStarred(this);
        }
    }

    record Name(String id) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    record ListExpr(List<Expr> elts) implements Expr {
        public ListExpr {
            elts = List.copyOf(elts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    record TupleExpr(List<Expr> elts) implements Expr {
        public TupleExpr {
            elts = List.copyOf(elts);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    /** {@code lower:upper:step}, each bound optional. */
    record Slice(@Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) implements Expr {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSlice(this);
        }
    }
}
