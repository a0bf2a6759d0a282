package ai.callgraph.analyzer;

import static ai.callgraph.analyzer.ASTTraversalUtils.field;
import static ai.callgraph.analyzer.ASTTraversalUtils.hasChildOfType;
import static ai.callgraph.analyzer.ASTTraversalUtils.namedChildren;
import static ai.callgraph.analyzer.ASTTraversalUtils.namedChildrenOfType;
import static ai.callgraph.analyzer.PythonTreeSitterNodeTypes.*;

import ai.callgraph.ast.Comprehension;
import ai.callgraph.ast.ExceptHandler;
import ai.callgraph.ast.Expr;
import ai.callgraph.ast.Keyword;
import ai.callgraph.ast.MatchCase;
import ai.callgraph.ast.SourceModule;
import ai.callgraph.ast.Stmt;
import ai.callgraph.ast.WithItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Lowers an error-free tree-sitter Python tree into {@link SourceModule}, following the shapes of Python's
 * {@code ast} module: parentheses disappear, chained {@code and}/{@code or} flatten, {@code a = b = v} is one
 * assignment with two targets, f-strings become {@link Expr.JoinedStr}, decorated definitions keep their kind.
 *
 * <p>One instance lowers one module. Node types the lowering does not know raise {@link ParseException} instead of
 * being dropped.
 */
final class PythonAstLowering {
    private static final Logger log = LogManager.getLogger(PythonAstLowering.class);

    private static final Set<String> ANNOTATION_ONLY_TYPES =
            Set.of(GENERIC_TYPE, UNION_TYPE, CONSTRAINED_TYPE, MEMBER_TYPE, SPLAT_TYPE);

    private final SourceContent source;
    private final String displayId;

    PythonAstLowering(SourceContent source, String displayId) {
        this.source = source;
        this.displayId = displayId;
    }

    SourceModule lowerModule(TSNode root) throws ParseException {
        return new SourceModule(displayId, lowerStatements(root));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------------------------------------------------

    private List<Stmt> lowerStatements(TSNode container) throws ParseException {
        var statements = new ArrayList<Stmt>();
        for (var child : namedChildren(container)) {
            statements.add(lowerStatement(child));
        }
        return statements;
    }

    private List<Stmt> lowerBody(TSNode owner, String fieldName) throws ParseException {
        var body = field(owner, fieldName);
        return body == null ? List.of() : lowerStatements(body);
    }

    /** Body of an {@code else:} or {@code finally:} clause. */
    private List<Stmt> lowerClauseBody(@Nullable TSNode clause) throws ParseException {
        if (clause == null) {
            return List.of();
        }
        var body = field(clause, "body");
        if (body != null) {
            return lowerStatements(body);
        }
        var blocks = namedChildrenOfType(clause, BLOCK);
        return blocks.isEmpty() ? List.of() : lowerStatements(blocks.get(0));
    }

    private Stmt lowerStatement(TSNode node) throws ParseException {
        return switch (node.getType()) {
            case FUNCTION_DEFINITION -> lowerFunction(node, List.of());
            case CLASS_DEFINITION -> lowerClass(node, List.of());
            case DECORATED_DEFINITION -> lowerDecorated(node);
            case EXPRESSION_STATEMENT -> lowerExpressionStatement(node);
            case RETURN_STATEMENT -> new Stmt.Return(lowerOptional(firstNamedOrNull(node)));
            case DELETE_STATEMENT -> new Stmt.Delete(lowerElements(firstNamed(node)));
            case RAISE_STATEMENT -> lowerRaise(node);
            case ASSERT_STATEMENT -> lowerAssert(node);
            case PASS_STATEMENT -> new Stmt.Pass();
            case BREAK_STATEMENT -> new Stmt.Break();
            case CONTINUE_STATEMENT -> new Stmt.Continue();
            case GLOBAL_STATEMENT -> new Stmt.Global(texts(namedChildren(node)));
            case NONLOCAL_STATEMENT -> new Stmt.Nonlocal(texts(namedChildren(node)));
            case IMPORT_STATEMENT -> new Stmt.Import(texts(namedChildren(node)));
            case IMPORT_FROM_STATEMENT -> lowerImportFrom(node);
            case FUTURE_IMPORT_STATEMENT -> new Stmt.ImportFrom("__future__", texts(namedChildren(node)), 0);
            case TYPE_ALIAS_STATEMENT -> lowerTypeAlias(node);
            case PRINT_STATEMENT, EXEC_STATEMENT -> lowerLegacyStatement(node);
            case IF_STATEMENT -> lowerIf(node);
            case FOR_STATEMENT -> lowerFor(node);
            case WHILE_STATEMENT -> new Stmt.While(
                    lowerExpr(requiredField(node, "condition")),
                    lowerBody(node, "body"),
                    lowerClauseBody(field(node, "alternative")));
            case TRY_STATEMENT -> lowerTry(node);
            case WITH_STATEMENT -> lowerWith(node);
            case MATCH_STATEMENT -> lowerMatch(node);
            default -> throw unsupported(node);
        };
    }

    /** {@code type Name[T] = value}: the grammar exposes no fields, only the two {@code type} children. */
    private Stmt lowerTypeAlias(TSNode node) throws ParseException {
        var types = namedChildrenOfType(node, TYPE);
        if (types.size() < 2) {
            throw error(node, "type alias without a value");
        }
        return new Stmt.TypeAlias(
                lowerTypeExpression(types.get(0)), lowerTypeExpression(types.get(types.size() - 1)));
    }

    private Stmt lowerFunction(TSNode node, List<Expr> decorators) throws ParseException {
        var name = text(requiredField(node, "name"));
        var body = lowerBody(node, "body");
        log.trace("Lowering function {} ({} statements)", name, body.size());
        return hasChildOfType(node, ASYNC)
                ? new Stmt.AsyncFunctionDef(name, body, decorators)
                : new Stmt.FunctionDef(name, body, decorators);
    }

    private Stmt lowerClass(TSNode node, List<Expr> decorators) throws ParseException {
        var superclasses = field(node, "superclasses");
        var arguments = superclasses == null ? Arguments.EMPTY : lowerArguments(superclasses);
        return new Stmt.ClassDef(
                text(requiredField(node, "name")),
                arguments.args(),
                arguments.keywords(),
                lowerBody(node, "body"),
                decorators);
    }

    private Stmt lowerDecorated(TSNode node) throws ParseException {
        var decorators = new ArrayList<Expr>();
        for (var decorator : namedChildrenOfType(node, DECORATOR)) {
            decorators.add(lowerExpr(firstNamed(decorator)));
        }
        var definition = requiredField(node, "definition");
        return switch (definition.getType()) {
            case FUNCTION_DEFINITION -> lowerFunction(definition, decorators);
            case CLASS_DEFINITION -> lowerClass(definition, decorators);
            default -> throw unsupported(definition);
        };
    }

    private Stmt lowerExpressionStatement(TSNode node) throws ParseException {
        var children = namedChildren(node);
        if (children.size() != 1) {
            // a, b
            return new Stmt.ExprStmt(new Expr.TupleExpr(lowerAll(children)));
        }
        var child = children.get(0);
        return switch (child.getType()) {
            case ASSIGNMENT -> lowerAssignment(child);
            case AUGMENTED_ASSIGNMENT -> new Stmt.AugAssign(
                    lowerExpr(requiredField(child, "left")),
                    text(requiredField(child, "operator")),
                    lowerExpr(requiredField(child, "right")));
            default -> new Stmt.ExprStmt(lowerExpr(child));
        };
    }

    private Stmt lowerAssignment(TSNode node) throws ParseException {
        var targets = new ArrayList<Expr>();
        var current = node;
        while (true) {
            var left = requiredField(current, "left");
            var annotation = field(current, "type");
            var right = field(current, "right");
            if (annotation != null) {
                if (!targets.isEmpty()) {
                    throw error(current, "annotated assignment cannot be chained");
                }
                return new Stmt.AnnAssign(lowerExpr(left), lowerTypeExpression(annotation), lowerOptional(right));
            }
            targets.add(lowerExpr(left));
            if (right == null) {
                throw error(current, "assignment without a value");
            }
            if (ASSIGNMENT.equals(right.getType())) {
                current = right;
                continue;
            }
            return new Stmt.Assign(targets, lowerExpr(right));
        }
    }

    private Stmt lowerRaise(TSNode node) throws ParseException {
        var cause = field(node, "cause");
        var exc = firstNamedOrNull(node);
        if (exc != null && cause != null && exc.getStartByte() == cause.getStartByte()) {
            exc = null;
        }
        return new Stmt.Raise(lowerOptional(exc), lowerOptional(cause));
    }

    private Stmt lowerAssert(TSNode node) throws ParseException {
        var children = namedChildren(node);
        if (children.isEmpty()) {
            throw error(node, "assert without a test");
        }
        var msg = children.size() > 1 ? lowerExpr(children.get(1)) : null;
        return new Stmt.Assert(lowerExpr(children.get(0)), msg);
    }

    private Stmt lowerImportFrom(TSNode node) throws ParseException {
        var moduleName = requiredField(node, "module_name");
        var moduleText = text(moduleName);
        int level = 0;
        while (level < moduleText.length() && moduleText.charAt(level) == '.') {
            level++;
        }
        var module = level == moduleText.length() ? null : moduleText.substring(level);

        var names = new ArrayList<String>();
        for (var child : namedChildren(node)) {
            if (child.getStartByte() != moduleName.getStartByte()) {
                names.add(WILDCARD_IMPORT.equals(child.getType()) ? "*" : text(child));
            }
        }
        return new Stmt.ImportFrom(module, names, level);
    }

    /** {@code print x} and {@code exec code} are lowered as the equivalent calls. */
    private Stmt lowerLegacyStatement(TSNode node) throws ParseException {
        var callee = PRINT_STATEMENT.equals(node.getType()) ? "print" : "exec";
        return new Stmt.ExprStmt(new Expr.Call(new Expr.Name(callee), lowerAll(namedChildren(node)), List.of()));
    }

    private Stmt lowerIf(TSNode node) throws ParseException {
        var clauses = namedChildren(node).stream()
                .filter(c -> ELIF_CLAUSE.equals(c.getType()) || ELSE_CLAUSE.equals(c.getType()))
                .toList();
        List<Stmt> orelse = List.of();
        for (int i = clauses.size() - 1; i >= 0; i--) {
            var clause = clauses.get(i);
            if (ELSE_CLAUSE.equals(clause.getType())) {
                orelse = lowerClauseBody(clause);
            } else {
                orelse = List.of(new Stmt.If(
                        lowerExpr(requiredField(clause, "condition")), lowerBody(clause, "consequence"), orelse));
            }
        }
        return new Stmt.If(lowerExpr(requiredField(node, "condition")), lowerBody(node, "consequence"), orelse);
    }

    private Stmt lowerFor(TSNode node) throws ParseException {
        var target = lowerExpr(requiredField(node, "left"));
        var iter = lowerExpr(requiredField(node, "right"));
        var body = lowerBody(node, "body");
        var orelse = lowerClauseBody(field(node, "alternative"));
        return hasChildOfType(node, ASYNC)
                ? new Stmt.AsyncFor(target, iter, body, orelse)
                : new Stmt.For(target, iter, body, orelse);
    }

    private Stmt lowerTry(TSNode node) throws ParseException {
        var handlers = new ArrayList<ExceptHandler>();
        List<Stmt> orelse = List.of();
        List<Stmt> finalbody = List.of();
        boolean star = false;
        for (var child : namedChildren(node)) {
            switch (child.getType()) {
                case EXCEPT_CLAUSE -> handlers.add(lowerHandler(child));
                case EXCEPT_GROUP_CLAUSE -> {
                    star = true;
                    handlers.add(lowerHandler(child));
                }
                case ELSE_CLAUSE -> orelse = lowerClauseBody(child);
                case FINALLY_CLAUSE -> finalbody = lowerClauseBody(child);
                default -> {
                    // the body block
                }
            }
        }
        var body = lowerBody(node, "body");
        return star
                ? new Stmt.TryStar(body, handlers, orelse, finalbody)
                : new Stmt.Try(body, handlers, orelse, finalbody);
    }

    private ExceptHandler lowerHandler(TSNode clause) throws ParseException {
        var children = namedChildren(clause);
        var blocks = children.stream().filter(c -> BLOCK.equals(c.getType())).toList();
        var exprs = children.stream().filter(c -> !BLOCK.equals(c.getType())).toList();
        var body = blocks.isEmpty() ? List.<Stmt>of() : lowerStatements(blocks.get(blocks.size() - 1));

        if (exprs.isEmpty()) {
            return new ExceptHandler(null, null, body);
        }
        var first = exprs.get(0);
        if (AS_PATTERN.equals(first.getType())) {
            var alias = field(first, "alias");
            return new ExceptHandler(lowerExpr(firstNamed(first)), alias == null ? null : text(alias), body);
        }
        var name = exprs.size() > 1 ? text(exprs.get(1)) : null;
        return new ExceptHandler(lowerExpr(first), name, body);
    }

    private Stmt lowerWith(TSNode node) throws ParseException {
        var items = new ArrayList<WithItem>();
        for (var clause : namedChildrenOfType(node, WITH_CLAUSE)) {
            for (var item : namedChildrenOfType(clause, WITH_ITEM)) {
                items.add(lowerWithItem(item));
            }
        }
        var body = lowerBody(node, "body");
        return hasChildOfType(node, ASYNC) ? new Stmt.AsyncWith(items, body) : new Stmt.With(items, body);
    }

    private WithItem lowerWithItem(TSNode item) throws ParseException {
        var value = field(item, "value");
        if (value == null) {
            value = firstNamed(item);
        }
        if (!AS_PATTERN.equals(value.getType())) {
            return new WithItem(lowerExpr(value), null);
        }
        var alias = requiredField(value, "alias");
        return new WithItem(lowerExpr(firstNamed(value)), lowerAsPatternTarget(alias));
    }

    private Expr lowerAsPatternTarget(TSNode target) throws ParseException {
        var inner = firstNamedOrNull(target);
        return inner == null ? new Expr.Name(text(target)) : lowerExpr(inner);
    }

    private Stmt lowerMatch(TSNode node) throws ParseException {
        var subjects = new ArrayList<TSNode>();
        var cases = new ArrayList<MatchCase>();
        for (var child : namedChildren(node)) {
            if (BLOCK.equals(child.getType())) {
                for (var clause : namedChildrenOfType(child, CASE_CLAUSE)) {
                    cases.add(lowerCase(clause));
                }
            } else if (CASE_CLAUSE.equals(child.getType())) {
                cases.add(lowerCase(child));
            } else {
                subjects.add(child);
            }
        }
        if (subjects.isEmpty()) {
            throw error(node, "match without a subject");
        }
        var subject = subjects.size() == 1 ? lowerExpr(subjects.get(0)) : new Expr.TupleExpr(lowerAll(subjects));
        return new Stmt.Match(subject, cases);
    }

    private MatchCase lowerCase(TSNode clause) throws ParseException {
        var pattern = namedChildrenOfType(clause, CASE_PATTERN).stream()
                .map(this::text)
                .collect(Collectors.joining(", "));
        var guardClause = field(clause, "guard");
        var guard = guardClause == null ? null : lowerExpr(firstNamed(guardClause));
        return new MatchCase(pattern, guard, lowerBody(clause, "consequence"));
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------------------------------------------------

    private Expr lowerExpr(TSNode node) throws ParseException {
        return switch (node.getType()) {
            case IDENTIFIER -> new Expr.Name(text(node));
            case INTEGER, FLOAT, TRUE, FALSE, NONE, ELLIPSIS -> new Expr.Constant(text(node));
            case STRING -> lowerString(node);
            case CONCATENATED_STRING -> lowerConcatenatedString(node);
            case CALL -> lowerCall(node);
            case ATTRIBUTE -> new Expr.Attribute(
                    lowerExpr(requiredField(node, "object")), text(requiredField(node, "attribute")));
            case SUBSCRIPT -> lowerSubscript(node);
            case SLICE -> lowerSlice(node);
            case BINARY_OPERATOR -> new Expr.BinOp(
                    lowerExpr(requiredField(node, "left")),
                    text(requiredField(node, "operator")),
                    lowerExpr(requiredField(node, "right")));
            case UNARY_OPERATOR -> new Expr.UnaryOp(
                    text(requiredField(node, "operator")), lowerExpr(requiredField(node, "argument")));
            case NOT_OPERATOR -> new Expr.UnaryOp("not", lowerExpr(requiredField(node, "argument")));
            case BOOLEAN_OPERATOR -> lowerBooleanOperator(node);
            case COMPARISON_OPERATOR -> lowerComparison(node);
            case CONDITIONAL_EXPRESSION -> lowerConditional(node);
            case NAMED_EXPRESSION -> new Expr.NamedExpr(
                    lowerExpr(requiredField(node, "name")), lowerExpr(requiredField(node, "value")));
            case LAMBDA -> new Expr.Lambda(lowerExpr(requiredField(node, "body")));
            case AWAIT -> new Expr.Await(lowerExpr(firstNamed(node)));
            case YIELD -> lowerYield(node);
            case PARENTHESIZED_EXPRESSION, PARENTHESIZED_LIST_SPLAT -> lowerExpr(firstNamed(node));
            case EXPRESSION_LIST, PATTERN_LIST, TUPLE, TUPLE_PATTERN -> new Expr.TupleExpr(
                    lowerAll(namedChildren(node)));
            case LIST, LIST_PATTERN -> new Expr.ListExpr(lowerAll(namedChildren(node)));
            case SET -> new Expr.SetExpr(lowerAll(namedChildren(node)));
            case DICTIONARY -> lowerDictionary(node);
            case LIST_SPLAT, LIST_SPLAT_PATTERN -> new Expr.Starred(lowerExpr(firstNamed(node)));
            case LIST_COMPREHENSION -> new Expr.ListComp(
                    lowerExpr(requiredField(node, "body")), lowerGenerators(node));
            case SET_COMPREHENSION -> new Expr.SetComp(
                    lowerExpr(requiredField(node, "body")), lowerGenerators(node));
            case GENERATOR_EXPRESSION -> new Expr.GeneratorExp(
                    lowerExpr(requiredField(node, "body")), lowerGenerators(node));
            case DICTIONARY_COMPREHENSION -> lowerDictComprehension(node);
            case TYPE -> lowerTypeExpression(node);
            default -> throw unsupported(node);
        };
    }

    private @Nullable Expr lowerOptional(@Nullable TSNode node) throws ParseException {
        return node == null ? null : lowerExpr(node);
    }

    private List<Expr> lowerAll(List<TSNode> nodes) throws ParseException {
        var exprs = new ArrayList<Expr>(nodes.size());
        for (var node : nodes) {
            exprs.add(lowerExpr(node));
        }
        return exprs;
    }

    /** {@code del a, b} deletes two targets, {@code del (a, b)} one tuple. */
    private List<Expr> lowerElements(TSNode node) throws ParseException {
        return EXPRESSION_LIST.equals(node.getType()) ? lowerAll(namedChildren(node)) : List.of(lowerExpr(node));
    }

    private Expr lowerCall(TSNode node) throws ParseException {
        var functionNode = requiredField(node, "function");
        if (LIST_SPLAT.equals(functionNode.getType())) {
            // in a bare item list `*a()` parses as a call on `*a`; the star applies to the call
            return new Expr.Starred(lowerCallOn(lowerExpr(firstNamed(functionNode)), node));
        }
        return lowerCallOn(lowerExpr(functionNode), node);
    }

    private Expr lowerCallOn(Expr func, TSNode node) throws ParseException {
        var argumentsNode = requiredField(node, "arguments");
        if (GENERATOR_EXPRESSION.equals(argumentsNode.getType())) {
            // f(x for x in xs)
            return new Expr.Call(func, List.of(lowerExpr(argumentsNode)), List.of());
        }
        var arguments = lowerArguments(argumentsNode);
        return new Expr.Call(func, arguments.args(), arguments.keywords());
    }

    private record Arguments(List<Expr> args, List<Keyword> keywords) {
        static final Arguments EMPTY = new Arguments(List.of(), List.of());
    }

    private Arguments lowerArguments(TSNode argumentList) throws ParseException {
        var args = new ArrayList<Expr>();
        var keywords = new ArrayList<Keyword>();
        for (var child : namedChildren(argumentList)) {
            switch (child.getType()) {
                case KEYWORD_ARGUMENT -> keywords.add(new Keyword(
                        text(requiredField(child, "name")), lowerExpr(requiredField(child, "value"))));
                case DICTIONARY_SPLAT -> keywords.add(new Keyword(null, lowerExpr(firstNamed(child))));
                default -> args.add(lowerExpr(child));
            }
        }
        return new Arguments(args, keywords);
    }

    private Expr lowerSubscript(TSNode node) throws ParseException {
        var children = namedChildren(node);
        if (children.size() < 2) {
            throw error(node, "subscript without an index");
        }
        var value = lowerExpr(children.get(0));
        var indices = children.subList(1, children.size());
        var slice = indices.size() == 1 ? lowerExpr(indices.get(0)) : new Expr.TupleExpr(lowerAll(indices));
        return new Expr.Subscript(value, slice);
    }

    private Expr lowerSlice(TSNode node) throws ParseException {
        var bounds = new Expr[3];
        int position = 0;
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (COLON.equals(child.getType())) {
                position++;
            } else if (child.isNamed() && !COMMENT.equals(child.getType()) && position < bounds.length) {
                bounds[position] = lowerExpr(child);
            }
        }
        return new Expr.Slice(bounds[0], bounds[1], bounds[2]);
    }

    private Expr lowerBooleanOperator(TSNode node) throws ParseException {
        var op = text(requiredField(node, "operator"));
        var values = new ArrayList<Expr>();
        collectBooleanOperands(node, op, values);
        return new Expr.BoolOp(op, values);
    }

    private void collectBooleanOperands(TSNode node, String op, List<Expr> values) throws ParseException {
        for (var side : List.of(requiredField(node, "left"), requiredField(node, "right"))) {
            if (BOOLEAN_OPERATOR.equals(side.getType()) && op.equals(text(requiredField(side, "operator")))) {
                collectBooleanOperands(side, op, values);
            } else {
                values.add(lowerExpr(side));
            }
        }
    }

    private Expr lowerComparison(TSNode node) throws ParseException {
        var operands = new ArrayList<Expr>();
        var ops = new ArrayList<String>();
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (!child.isNamed()) {
                ops.add(child.getType());
            } else if (!COMMENT.equals(child.getType())) {
                operands.add(lowerExpr(child));
            }
        }
        if (operands.size() < 2) {
            throw error(node, "comparison needs two operands");
        }
        return new Expr.Compare(operands.get(0), ops, operands.subList(1, operands.size()));
    }

    /** {@code body if test else orelse}: the grammar has no fields here, children come in source order. */
    private Expr lowerConditional(TSNode node) throws ParseException {
        var children = namedChildren(node);
        if (children.size() != 3) {
            throw error(node, "conditional expression needs three operands");
        }
        return new Expr.IfExp(lowerExpr(children.get(1)), lowerExpr(children.get(0)), lowerExpr(children.get(2)));
    }

    private Expr lowerYield(TSNode node) throws ParseException {
        if (hasChildOfType(node, FROM)) {
            return new Expr.YieldFrom(lowerExpr(firstNamed(node)));
        }
        return new Expr.Yield(lowerOptional(firstNamedOrNull(node)));
    }

    private Expr lowerDictionary(TSNode node) throws ParseException {
        var keys = new ArrayList<@Nullable Expr>();
        var values = new ArrayList<Expr>();
        for (var child : namedChildren(node)) {
            if (PAIR.equals(child.getType())) {
                keys.add(lowerExpr(requiredField(child, "key")));
                values.add(lowerExpr(requiredField(child, "value")));
            } else if (DICTIONARY_SPLAT.equals(child.getType())) {
                keys.add(null);
                values.add(lowerExpr(firstNamed(child)));
            } else {
                throw unsupported(child);
            }
        }
        return new Expr.DictExpr(keys, values);
    }

    private Expr lowerDictComprehension(TSNode node) throws ParseException {
        var pair = requiredField(node, "body");
        return new Expr.DictComp(
                lowerExpr(requiredField(pair, "key")), lowerExpr(requiredField(pair, "value")), lowerGenerators(node));
    }

    /** Each {@code for} clause opens a generator; the {@code if} clauses after it are its filters. */
    private List<Comprehension> lowerGenerators(TSNode comprehension) throws ParseException {
        var generators = new ArrayList<Comprehension>();
        TSNode forClause = null;
        var ifs = new ArrayList<Expr>();
        for (var child : namedChildren(comprehension)) {
            if (FOR_IN_CLAUSE.equals(child.getType())) {
                if (forClause != null) {
                    generators.add(lowerComprehension(forClause, ifs));
                    ifs = new ArrayList<>();
                }
                forClause = child;
            } else if (IF_CLAUSE.equals(child.getType())) {
                ifs.add(lowerExpr(firstNamed(child)));
            }
        }
        if (forClause != null) {
            generators.add(lowerComprehension(forClause, ifs));
        }
        return generators;
    }

    private Comprehension lowerComprehension(TSNode forClause, List<Expr> ifs) throws ParseException {
        return new Comprehension(
                lowerExpr(requiredField(forClause, "left")),
                lowerExpr(requiredField(forClause, "right")),
                ifs,
                hasChildOfType(forClause, ASYNC));
    }

    private Expr lowerString(TSNode node) throws ParseException {
        if (namedChildrenOfType(node, INTERPOLATION).isEmpty()) {
            return new Expr.Constant(text(node));
        }
        var parts = new ArrayList<Expr>();
        for (var child : namedChildren(node)) {
            switch (child.getType()) {
                case INTERPOLATION -> parts.add(lowerInterpolation(child));
                case STRING_START, STRING_END -> {
                    // quotes and prefix
                }
                default -> parts.add(new Expr.Constant(text(child)));
            }
        }
        return new Expr.JoinedStr(parts);
    }

    /** Adjacent literals concatenate; if any part is an f-string the whole literal is one {@link Expr.JoinedStr}. */
    private Expr lowerConcatenatedString(TSNode node) throws ParseException {
        var parts = new ArrayList<Expr>();
        boolean formatted = false;
        for (var child : namedChildren(node)) {
            var part = lowerExpr(child);
            if (part instanceof Expr.JoinedStr joined) {
                formatted = true;
                parts.addAll(joined.values());
            } else {
                parts.add(part);
            }
        }
        return formatted ? new Expr.JoinedStr(parts) : new Expr.Constant(text(node));
    }

    private Expr lowerInterpolation(TSNode node) throws ParseException {
        var expression = field(node, "expression");
        if (expression == null) {
            expression = firstNamed(node);
        }
        String conversion = null;
        Expr formatSpec = null;
        for (var child : namedChildren(node)) {
            if (TYPE_CONVERSION.equals(child.getType())) {
                conversion = text(child).replace("!", "");
            } else if (FORMAT_SPECIFIER.equals(child.getType())) {
                formatSpec = lowerFormatSpecifier(child);
            }
        }
        return new Expr.FormattedValue(lowerExpr(expression), conversion, formatSpec);
    }

    private Expr lowerFormatSpecifier(TSNode node) throws ParseException {
        var parts = new ArrayList<Expr>();
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            var type = child.getType();
            if (INTERPOLATION.equals(type) || FORMAT_EXPRESSION.equals(type)) {
                parts.add(lowerInterpolation(child));
            } else if (!COLON.equals(type)) {
                parts.add(new Expr.Constant(text(child)));
            }
        }
        return new Expr.JoinedStr(parts);
    }

    /** Annotations may use forms that are not expressions ({@code int | None} as a union type); those stay text. */
    private Expr lowerTypeExpression(TSNode node) throws ParseException {
        if (!TYPE.equals(node.getType())) {
            return lowerExpr(node);
        }
        var inner = firstNamedOrNull(node);
        if (inner == null || ANNOTATION_ONLY_TYPES.contains(inner.getType())) {
            return new Expr.Constant(text(node));
        }
        return lowerExpr(inner);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------------------------------------------------

    private String text(TSNode node) {
        return source.substringFrom(node).trim();
    }

    private List<String> texts(List<TSNode> nodes) {
        return nodes.stream().map(this::text).toList();
    }

    private @Nullable TSNode firstNamedOrNull(TSNode node) {
        var children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    private TSNode firstNamed(TSNode node) throws ParseException {
        var child = firstNamedOrNull(node);
        if (child == null) {
            throw error(node, "empty " + node.getType());
        }
        return child;
    }

    private TSNode requiredField(TSNode node, String fieldName) throws ParseException {
        var child = field(node, fieldName);
        if (child == null) {
            throw error(node, "%s without %s".formatted(node.getType(), fieldName));
        }
        return child;
    }

    private ParseException unsupported(TSNode node) {
        return error(node, "unsupported syntax: " + node.getType());
    }

    private ParseException error(TSNode node, String detail) {
        return new ParseException(displayId, detail, source.locationOf(node.getStartByte()));
    }
}
