package ai.callgraph.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.callgraph.ast.Comprehension;
import ai.callgraph.ast.Expr;
import ai.callgraph.ast.Keyword;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Exercises the expression walker on hand-built trees, independent of the parser. */
public class CallReferenceCollectorTest {

    private static Expr.Name name(String id) {
        return new Expr.Name(id);
    }

    private static Expr.Call call(String callee, Expr... args) {
        return new Expr.Call(name(callee), List.of(args), List.of());
    }

    @Test
    public void bareNameCall_recordsName() {
        assertEquals(List.of("f"), CallReferenceCollector.collect(call("f")));
    }

    @Test
    public void attributeCall_recordsAttributeOnly() {
        var expr = new Expr.Call(new Expr.Attribute(name("x"), "foo"), List.of(), List.of());
        assertEquals(List.of("foo"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void calleeExpression_isNotDescendedInto() {
        // b().c()
        var receiver = call("b");
        var expr = new Expr.Call(new Expr.Attribute(receiver, "c"), List.of(), List.of());
        assertEquals(List.of("c"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void otherCalleeForms_recordNothingButArgumentsStillVisited() {
        // handlers[0](g())
        var expr = new Expr.Call(
                new Expr.Subscript(name("handlers"), new Expr.Constant("0")), List.of(call("g")), List.of());
        assertEquals(List.of("g"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void positionalArguments_visitedInOrderAfterCallee() {
        var expr = call("f", call("g", call("h")), call("k"));
        assertEquals(List.of("f", "g", "h", "k"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void keywordArguments_areNotVisited() {
        var expr = new Expr.Call(name("f"), List.of(), List.of(new Keyword("key", call("g"))));
        assertEquals(List.of("f"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void attributeValue_outsideCallPosition_isVisited() {
        // g().attr
        var expr = new Expr.Attribute(call("g"), "attr");
        assertEquals(List.of("g"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void dict_visitsValuesThenPresentKeys() {
        var expr = new Expr.DictExpr(Arrays.asList(call("k1"), null), List.of(call("v1"), call("v2")));
        assertEquals(List.of("v1", "v2", "k1"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void comprehensions_visitOnlyTheElement() {
        var generators = List.of(new Comprehension(name("x"), call("source"), List.of(call("keep")), false));

        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.ListComp(call("f"), generators)));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.SetComp(call("f"), generators)));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.GeneratorExp(call("f"), generators)));
        assertEquals(
                List.of("k", "v"),
                CallReferenceCollector.collect(new Expr.DictComp(call("k"), call("v"), generators)));
    }

    @Test
    public void slice_visitsUpperLowerStep() {
        var expr = new Expr.Slice(call("lower"), call("upper"), call("step"));
        assertEquals(List.of("upper", "lower", "step"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void ternary_visitsTestBodyOrelse() {
        var expr = new Expr.IfExp(call("test"), call("body"), call("orelse"));
        assertEquals(List.of("test", "body", "orelse"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void comparison_visitsLeftThenComparators() {
        var expr = new Expr.Compare(call("a"), List.of("<", "<"), List.of(call("b"), call("c")));
        assertEquals(List.of("a", "b", "c"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void formattedValue_visitsValueAndFormatSpec() {
        var spec = new Expr.JoinedStr(List.of(new Expr.FormattedValue(call("width"), null, null)));
        var expr = new Expr.JoinedStr(
                List.of(new Expr.Constant("x="), new Expr.FormattedValue(call("value"), "r", spec)));
        assertEquals(List.of("value", "width"), CallReferenceCollector.collect(expr));
    }

    @Test
    public void singleOperandForms_visitTheirOperand() {
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.UnaryOp("-", call("f"))));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.Lambda(call("f"))));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.Await(call("f"))));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.Yield(call("f"))));
        assertEquals(List.of(), CallReferenceCollector.collect(new Expr.Yield(null)));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.YieldFrom(call("f"))));
        assertEquals(List.of("f"), CallReferenceCollector.collect(new Expr.Starred(call("f"))));
    }

    @Test
    public void twoOperandForms_visitBothSides() {
        assertEquals(List.of("a", "b"), CallReferenceCollector.collect(new Expr.BinOp(call("a"), "+", call("b"))));
        assertEquals(List.of("v"), CallReferenceCollector.collect(new Expr.NamedExpr(name("x"), call("v"))));
        assertEquals(
                List.of("a", "b"), CallReferenceCollector.collect(new Expr.Subscript(call("a"), call("b"))));
    }

    @Test
    public void sequences_visitEveryElement() {
        assertEquals(
                List.of("a", "b"),
                CallReferenceCollector.collect(new Expr.BoolOp("or", List.of(call("a"), call("b")))));
        assertEquals(List.of("a", "b"), CallReferenceCollector.collect(new Expr.ListExpr(List.of(call("a"), call("b")))));
        assertEquals(List.of("a", "b"), CallReferenceCollector.collect(new Expr.SetExpr(List.of(call("a"), call("b")))));
        assertEquals(
                List.of("a", "b"), CallReferenceCollector.collect(new Expr.TupleExpr(List.of(call("a"), call("b")))));
    }

    @Test
    public void terminals_contributeNothing() {
        assertEquals(List.of(), CallReferenceCollector.collect(name("x")));
        assertEquals(List.of(), CallReferenceCollector.collect(new Expr.Constant("1")));
    }

    @Test
    public void repeatedCalls_areKept() {
        var expr = new Expr.TupleExpr(List.of(call("f"), call("f")));
        assertEquals(List.of("f", "f"), CallReferenceCollector.collect(expr));
    }
}
