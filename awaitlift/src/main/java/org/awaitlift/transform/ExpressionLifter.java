/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;
import org.awaitlift.Kit;
import org.awaitlift.Token;
import org.awaitlift.ast.Arguments;
import org.awaitlift.ast.AsExpression;
import org.awaitlift.ast.AwaitExpression;
import org.awaitlift.ast.Block;
import org.awaitlift.ast.BlockExpression;
import org.awaitlift.ast.ConditionalExpression;
import org.awaitlift.ast.EmptyStatement;
import org.awaitlift.ast.EqualsCall;
import org.awaitlift.ast.EqualsNull;
import org.awaitlift.ast.Expression;
import org.awaitlift.ast.ExpressionStatement;
import org.awaitlift.ast.FunctionExpression;
import org.awaitlift.ast.FunctionInvocation;
import org.awaitlift.ast.FunctionTearOff;
import org.awaitlift.ast.IfStatement;
import org.awaitlift.ast.InstanceTearOff;
import org.awaitlift.ast.InvocationExpression;
import org.awaitlift.ast.IsExpression;
import org.awaitlift.ast.KeywordLiteral;
import org.awaitlift.ast.Let;
import org.awaitlift.ast.ListLiteral;
import org.awaitlift.ast.LogicalExpression;
import org.awaitlift.ast.MapLiteral;
import org.awaitlift.ast.MapLiteralEntry;
import org.awaitlift.ast.MethodInvocation;
import org.awaitlift.ast.NamedExpression;
import org.awaitlift.ast.Not;
import org.awaitlift.ast.PropertyGet;
import org.awaitlift.ast.PropertySet;
import org.awaitlift.ast.Statement;
import org.awaitlift.ast.StaticInvocation;
import org.awaitlift.ast.StaticSet;
import org.awaitlift.ast.StringConcatenation;
import org.awaitlift.ast.SuperPropertySet;
import org.awaitlift.ast.Throw;
import org.awaitlift.ast.TreeNode;
import org.awaitlift.ast.VariableDeclaration;
import org.awaitlift.ast.VariableGet;
import org.awaitlift.ast.VariableSet;
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;

/**
 * Introduces temporary variables for all subexpressions that are live across await points.
 *
 * <p>The lifter is invoked by passing {@link #rewrite} a top-level expression, that is, an
 * expression directly under a statement. All intermediate values that are possibly live across
 * an await are named in local variables, and every await becomes a call to the await helper
 * followed by a {@link org.awaitlift.ast.ContinuationPoint}.
 *
 * <p>One lifter serves one function body. Nested function literals are lowered by a fresh
 * rewriter and share no state with this one.
 */
public class ExpressionLifter {

    static final String ASYNC_RESULT_NAME = ":result_or_exception";

    private final AsyncFunctionRewriter continuationRewriter;
    private final ContinuationHelper helper;
    private final StaticTypeContext typeContext;
    private final TemporaryAllocator temporaries;

    /**
     * Have we seen an await to the right in the expression tree.
     *
     * <p>Subexpressions are visited right-to-left, in the reverse of evaluation order. On entry to
     * a node this tells whether a sibling to the right contains an await; if so the node is named
     * in a temporary because its value is potentially live across that await. On exit it tells
     * whether the node itself or a sibling to the right contains an await.
     */
    private boolean seenAwait = false;

    /**
     * The (reverse order) sequence of statements that have been emitted.
     *
     * <p>Children are visited right-to-left, so this list is built in reverse and flipped once when
     * it is flushed. An expression that should be named is named before its children are visited,
     * so the naming assignment ends up after everything its children emit.
     *
     * <p>Conditionally evaluated children (the right operand of a logical expression, the
     * branches of a conditional) are delimited: they emit into a fresh list which is merged back
     * under the matching runtime condition.
     */
    private List<Statement> statements = new ArrayList<>();

    /**
     * The number of currently live named intermediate values, which is also the index of the next
     * free temporary.
     *
     * <p>When an expression is named before visiting its children the index is not reserved yet,
     * because a child can freely use the same temporary as its parent (in practice the rightmost
     * named child does). After the children, the index is bumped to one more than it was before
     * them.
     */
    private int nameIndex = 0;

    private final VariableDeclaration asyncResult = new VariableDeclaration(ASYNC_RESULT_NAME);

    public ExpressionLifter(AsyncFunctionRewriter continuationRewriter) {
        this.continuationRewriter = continuationRewriter;
        this.helper = continuationRewriter.getHelper();
        this.typeContext = continuationRewriter.getStaticTypeContext();
        this.temporaries =
                new TemporaryAllocator(continuationRewriter.getEnvirons().getTemporaryNamePrefix());
    }

    /** The variable the driver stores the resumption value (or error) of an await into. */
    public VariableDeclaration getAsyncResult() {
        return asyncResult;
    }

    /** Returns the temporaries allocated so far, in index order. */
    public List<VariableDeclaration> getVariables() {
        return temporaries.getVariables();
    }

    /** Whether an await has been seen, for the statement rewriter's bookkeeping. */
    boolean hasSeenAwait() {
        return seenAwait;
    }

    int getNameIndex() {
        return nameIndex;
    }

    /**
     * Rewrites a top-level expression (top-level with respect to a statement).
     *
     * <p>Rewriting produces a sequence of statements and an expression. The statements, in
     * evaluation order, are appended to {@code outer}; they must run before the returned
     * expression is evaluated. Pass an empty list if the rewritten expression should be delimited
     * from the surrounding context.
     */
    public Expression rewrite(Expression expression, List<Statement> outer) {
        if (!statements.isEmpty()) throw Kit.codeBug("rewrite re-entered with pending statements");
        boolean saved = seenAwait;
        seenAwait = false;
        Expression result = transform(expression);
        for (int i = statements.size() - 1; i >= 0; --i) {
            outer.add(statements.get(i));
        }
        statements.clear();
        seenAwait = seenAwait || saved;
        return result;
    }

    private static Block blockOf(List<Statement> reversed) {
        List<Statement> ordered = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; --i) {
            ordered.add(reversed.get(i));
        }
        return new Block(ordered);
    }

    /**
     * Performs an action with a given list of statements so that it cannot emit statements into
     * the outer list.
     */
    private Expression delimit(Supplier<Expression> action, List<Statement> inner) {
        List<Statement> outer = statements;
        statements = inner;
        Expression result = action.get();
        statements = outer;
        return result;
    }

    /** Reads a variable, reasserting {@code type} unless it is dynamic. */
    private Expression unsafeCastVariableGet(VariableDeclaration variable, StaticType type) {
        if (!type.isDynamic()) {
            return helper.unsafeCast(new VariableGet(variable), type);
        }
        return new VariableGet(variable);
    }

    /** Names an expression by emitting an assignment to a temporary variable. */
    private Expression name(Expression expr) {
        StaticType type = typeContext.getStaticType(expr);
        VariableDeclaration temp = temporaries.allocate(nameIndex, type);
        statements.add(new ExpressionStatement(new VariableSet(temp, expr)));
        // The unsafeCast passes the type on even if the temporary is later widened to dynamic.
        return unsafeCastVariableGet(temp, type);
    }

    /**
     * Transforms one expression node. This is the expression-only entry point: statements must go
     * through the statement rewriter, and reaching here with one is a caller bug.
     */
    public Expression transform(TreeNode node) {
        switch (node.getType()) {
            // Simple literals. These are pure, so they can be evaluated after an await to their
            // right.
            case Token.NUMBER:
            case Token.STRING:
            case Token.TRUE:
            case Token.FALSE:
            case Token.NULL:
            case Token.THIS:
            case Token.SYMBOL_LITERAL:
            case Token.TYPE_LITERAL:
                return (Expression) node;

            // Nullary expressions with effects.
            case Token.SUPER_PROPERTY_GET:
            case Token.STATIC_GET:
            case Token.STATIC_TEAR_OFF:
            case Token.RETHROW:
                return nullary((Expression) node);

            case Token.VARIABLE_GET:
                return visitVariableGet((VariableGet) node);

            case Token.VARIABLE_SET:
                {
                    VariableSet expr = (VariableSet) node;
                    return transformTreeNode(expr, () -> expr.setValue(transform(expr.getValue())));
                }
            case Token.SUPER_PROPERTY_SET:
                {
                    SuperPropertySet expr = (SuperPropertySet) node;
                    return transformTreeNode(expr, () -> expr.setValue(transform(expr.getValue())));
                }
            case Token.STATIC_SET:
                {
                    StaticSet expr = (StaticSet) node;
                    return transformTreeNode(expr, () -> expr.setValue(transform(expr.getValue())));
                }
            case Token.PROPERTY_GET:
                {
                    PropertyGet expr = (PropertyGet) node;
                    return transformTreeNode(
                            expr, () -> expr.setReceiver(transform(expr.getReceiver())));
                }
            case Token.PROPERTY_SET:
                {
                    PropertySet expr = (PropertySet) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                expr.setValue(transform(expr.getValue()));
                                expr.setReceiver(transform(expr.getReceiver()));
                            });
                }
            case Token.INSTANCE_TEAR_OFF:
                {
                    InstanceTearOff expr = (InstanceTearOff) node;
                    return transformTreeNode(
                            expr, () -> expr.setReceiver(transform(expr.getReceiver())));
                }
            case Token.FUNCTION_TEAR_OFF:
                {
                    FunctionTearOff expr = (FunctionTearOff) node;
                    return transformTreeNode(
                            expr, () -> expr.setReceiver(transform(expr.getReceiver())));
                }
            case Token.NOT:
                {
                    Not expr = (Not) node;
                    return transformTreeNode(
                            expr, () -> expr.setOperand(transform(expr.getOperand())));
                }
            case Token.IS:
                {
                    IsExpression expr = (IsExpression) node;
                    return transformTreeNode(
                            expr, () -> expr.setOperand(transform(expr.getOperand())));
                }
            case Token.AS:
                {
                    AsExpression expr = (AsExpression) node;
                    return transformTreeNode(
                            expr, () -> expr.setOperand(transform(expr.getOperand())));
                }
            case Token.THROW:
                {
                    Throw expr = (Throw) node;
                    return transformTreeNode(
                            expr, () -> expr.setExpression(transform(expr.getExpression())));
                }
            case Token.EQUALS_NULL:
                {
                    EqualsNull expr = (EqualsNull) node;
                    return transformTreeNode(
                            expr, () -> expr.setExpression(transform(expr.getExpression())));
                }
            case Token.EQUALS_CALL:
                {
                    EqualsCall expr = (EqualsCall) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                expr.setRight(transform(expr.getRight()));
                                expr.setLeft(transform(expr.getLeft()));
                            });
                }

            case Token.METHOD_INVOCATION:
                {
                    MethodInvocation expr = (MethodInvocation) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                visitArguments(expr.getArguments());
                                expr.setReceiver(transform(expr.getReceiver()));
                            });
                }
            case Token.FUNCTION_INVOCATION:
                {
                    FunctionInvocation expr = (FunctionInvocation) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                visitArguments(expr.getArguments());
                                expr.setReceiver(transform(expr.getReceiver()));
                            });
                }
            case Token.LOCAL_FUNCTION_INVOCATION:
            case Token.STATIC_INVOCATION:
            case Token.CONSTRUCTOR_INVOCATION:
            case Token.SUPER_METHOD_INVOCATION:
                {
                    InvocationExpression expr = (InvocationExpression) node;
                    return transformTreeNode(expr, () -> visitArguments(expr.getArguments()));
                }

            case Token.STRING_CONCATENATION:
                {
                    StringConcatenation expr = (StringConcatenation) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                List<Expression> expressions = expr.getExpressions();
                                for (int i = expressions.size() - 1; i >= 0; --i) {
                                    expr.setExpression(i, transform(expressions.get(i)));
                                }
                            });
                }
            case Token.LIST_LITERAL:
                {
                    ListLiteral expr = (ListLiteral) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                List<Expression> expressions = expr.getExpressions();
                                for (int i = expressions.size() - 1; i >= 0; --i) {
                                    expr.setExpression(i, transform(expressions.get(i)));
                                }
                            });
                }
            case Token.MAP_LITERAL:
                {
                    MapLiteral expr = (MapLiteral) node;
                    return transformTreeNode(
                            expr,
                            () -> {
                                List<MapLiteralEntry> entries = expr.getEntries();
                                for (int i = entries.size() - 1; i >= 0; --i) {
                                    MapLiteralEntry entry = entries.get(i);
                                    entry.setValue(transform(entry.getValue()));
                                    entry.setKey(transform(entry.getKey()));
                                }
                            });
                }

            // Control flow.
            case Token.AND:
            case Token.OR:
                return visitLogicalExpression((LogicalExpression) node);
            case Token.CONDITIONAL:
                return visitConditionalExpression((ConditionalExpression) node);

            // Others.
            case Token.AWAIT:
                return visitAwaitExpression((AwaitExpression) node);
            case Token.FUNCTION_EXPRESSION:
                return visitFunctionExpression((FunctionExpression) node);
            case Token.LET:
                return visitLet((Let) node);
            case Token.BLOCK_EXPRESSION:
                return visitBlockExpression((BlockExpression) node);

            default:
                if (Token.isStatement(node.getType())) {
                    throw Kit.codeBug("Use rewriteStatement to transform statement: " + node);
                }
                throw Kit.codeBug("unexpected node " + Token.typeToName(node.getType()));
        }
    }

    private Expression nullary(Expression expr) {
        if (seenAwait) {
            expr = name(expr);
            ++nameIndex;
        }
        return expr;
    }

    // Getting a final or const variable is not an effect so it can be evaluated after an await
    // to its right.
    private Expression visitVariableGet(VariableGet expr) {
        Expression result = expr;
        VariableDeclaration variable = expr.getVariable();
        if (seenAwait && !variable.isFinal() && !variable.isConst()) {
            result = name(expr);
            ++nameIndex;
        }
        return result;
    }

    /**
     * Transforms an expression given an action to transform its children. The action should
     * translate the children right to left, in the reverse of evaluation order.
     */
    private Expression transformTreeNode(Expression expr, Runnable action) {
        boolean shouldName = seenAwait;

        // 1. If there is an await in a sibling to the right, emit an assignment to a temporary
        // variable before transforming the children.
        Expression result = shouldName ? name(expr) : expr;

        // 2. Remember the number of live temporaries before transforming the children.
        int index = nameIndex;

        // 3. Transform the children. Initially they do not have an await in a sibling to their
        // right.
        seenAwait = false;
        action.run();

        // 4. If the expression was named, the temporaries used by the children are dead but the
        // one holding the expression is live. A sibling to the left still must not reuse what the
        // children used: their assignments could overwrite its values before they are read.
        if (shouldName) {
            if (index + 1 > nameIndex) nameIndex = index + 1;
            seenAwait = true;
        }
        return result;
    }

    /** Named arguments first, then positional ones, each group right to left. */
    private void visitArguments(Arguments args) {
        List<NamedExpression> named = args.getNamed();
        for (int i = named.size() - 1; i >= 0; --i) {
            NamedExpression argument = named.get(i);
            argument.setValue(transform(argument.getValue()));
        }
        List<Expression> positional = args.getPositional();
        for (int i = positional.size() - 1; i >= 0; --i) {
            args.setPositional(i, transform(positional.get(i)));
        }
    }

    private Expression visitLogicalExpression(LogicalExpression expr) {
        boolean shouldName = seenAwait;

        // Right is delimited because it is conditionally evaluated.
        List<Statement> rightStatements = new ArrayList<>();
        seenAwait = false;
        expr.setRight(delimit(() -> transform(expr.getRight()), rightStatements));
        boolean rightAwait = seenAwait;

        if (rightStatements.isEmpty()) {
            // Easy case: right did not emit any statements.
            seenAwait = shouldName;
            return transformTreeNode(
                    expr,
                    () -> {
                        expr.setLeft(transform(expr.getLeft()));
                        seenAwait = seenAwait || rightAwait;
                    });
        }

        // If right has emitted statements we produce a temporary t and emit for && (|| puts the
        // right side in the else branch instead):
        //
        // t = [left] == true;
        // if (t) {
        //   t = [right] == true;
        // }
        //
        // Statements are emitted in reverse, so first the if statement, then the assignment of
        // [left] == true, and then whatever translating left emits.
        Block rightBody = blockOf(rightStatements);
        StaticType type = CoreTypes.BOOL;
        VariableDeclaration result = temporaries.allocate(nameIndex, type);
        rightBody.addStatement(
                new ExpressionStatement(
                        new VariableSet(
                                result, new EqualsCall(expr.getRight(), KeywordLiteral.of(true)))));
        Statement then;
        Statement otherwise;
        if (expr.getType() == Token.AND) {
            then = rightBody;
            otherwise = null;
        } else {
            then = new EmptyStatement();
            otherwise = rightBody;
        }
        statements.add(new IfStatement(unsafeCastVariableGet(result, type), then, otherwise));

        EqualsCall test = new EqualsCall(expr.getLeft(), KeywordLiteral.of(true));
        statements.add(new ExpressionStatement(new VariableSet(result, test)));

        seenAwait = false;
        test.setLeft(transform(test.getLeft()));

        ++nameIndex;
        seenAwait = seenAwait || rightAwait;
        return unsafeCastVariableGet(result, type);
    }

    private Expression visitConditionalExpression(ConditionalExpression expr) {
        // Then and otherwise are delimited because they are conditionally evaluated.
        boolean shouldName = seenAwait;

        int savedNameIndex = nameIndex;

        List<Statement> thenStatements = new ArrayList<>();
        seenAwait = false;
        expr.setThen(delimit(() -> transform(expr.getThen()), thenStatements));
        boolean thenAwait = seenAwait;

        int thenNameIndex = nameIndex;
        nameIndex = savedNameIndex;

        List<Statement> otherwiseStatements = new ArrayList<>();
        seenAwait = false;
        expr.setOtherwise(delimit(() -> transform(expr.getOtherwise()), otherwiseStatements));
        boolean otherwiseAwait = seenAwait;

        // Only one branch runs, so there must be enough temporaries for either, not for both.
        if (thenNameIndex > nameIndex) {
            nameIndex = thenNameIndex;
        }

        if (thenStatements.isEmpty() && otherwiseStatements.isEmpty()) {
            // Easy case: neither then nor otherwise emitted any statements.
            seenAwait = shouldName;
            return transformTreeNode(
                    expr,
                    () -> {
                        expr.setCondition(transform(expr.getCondition()));
                        seenAwait = seenAwait || thenAwait || otherwiseAwait;
                    });
        }

        // If then or otherwise has emitted statements we produce a temporary t and emit:
        //
        // if ([condition]) {
        //   t = [then];
        // } else {
        //   t = [otherwise];
        // }
        StaticType type = typeContext.getStaticType(expr);
        VariableDeclaration result = temporaries.allocate(nameIndex, type);
        Block thenBody = blockOf(thenStatements);
        Block otherwiseBody = blockOf(otherwiseStatements);
        thenBody.addStatement(new ExpressionStatement(new VariableSet(result, expr.getThen())));
        otherwiseBody.addStatement(
                new ExpressionStatement(new VariableSet(result, expr.getOtherwise())));
        IfStatement branch = new IfStatement(expr.getCondition(), thenBody, otherwiseBody);
        statements.add(branch);

        seenAwait = false;
        branch.setCondition(transform(branch.getCondition()));

        ++nameIndex;
        seenAwait = seenAwait || thenAwait || otherwiseAwait;
        return unsafeCastVariableGet(result, type);
    }

    private Expression visitAwaitExpression(AwaitExpression expr) {
        boolean shouldName = seenAwait;
        StaticType type = typeContext.getStaticType(expr);
        Expression result = unsafeCastVariableGet(asyncResult, type);

        // The statements are in reverse order, so name the result first if necessary and then
        // add the suspend statement.
        if (shouldName) result = name(result);
        Arguments arguments =
                new Arguments(
                        Arrays.asList(
                                expr.getOperand(),
                                new VariableGet(continuationRewriter.getThenContinuationVariable()),
                                new VariableGet(
                                        continuationRewriter.getCatchErrorContinuationVariable())));

        // We are building
        //
        //     [yield] let _ = _awaitHelper(...) in null;
        //
        // so the suspend statement carries no value of its own: the resumption value arrives in
        // the async result variable.
        StaticInvocation awaitCall = new StaticInvocation(helper.getAwaitHelper(), arguments);
        awaitCall.setFileOffset(expr.getFileOffset());
        Statement continuationPoint =
                continuationRewriter.createContinuationPoint(
                        new Let(
                                new VariableDeclaration(null, awaitCall),
                                new KeywordLiteral(Token.NULL)));
        continuationPoint.setFileOffset(expr.getFileOffset());
        statements.add(continuationPoint);

        seenAwait = false;
        int index = nameIndex;
        arguments.setPositional(0, transform(arguments.getPositional().get(0)));

        if (shouldName && index + 1 > nameIndex) nameIndex = index + 1;
        seenAwait = true;
        return result;
    }

    private Expression visitFunctionExpression(FunctionExpression expr) {
        RecursiveContinuationRewriter nestedRewriter =
                new RecursiveContinuationRewriter(
                        helper, typeContext, continuationRewriter.getEnvirons());
        nestedRewriter.transform(expr.getFunction());
        return expr;
    }

    private Expression visitLet(Let expr) {
        Expression body = transform(expr.getBody());

        VariableDeclaration variable = expr.getVariable();
        if (seenAwait) {
            // There is an await in the body of `let var x = initializer in body` or to its right.
            // We produce the sequence of statements:
            //
            // <initializer's statements>
            // var x = <initializer's value>
            // <body's statements>
            //
            // and return the body's value. x stays in scope for all of the body's statements and
            // its value.
            statements.add(variable);
            int index = nameIndex;
            seenAwait = false;
            variable.setInitializer(transform(variable.getInitializer()));
            // Temporaries used in the initializer or the body are not live but the temporary used
            // for the body is.
            if (index + 1 > nameIndex) nameIndex = index + 1;
            seenAwait = true;
            return body;
        }
        // The body did not contain an await, so the let expression stays.
        return transformTreeNode(
                expr,
                () -> {
                    expr.setBody(body);
                    variable.setInitializer(transform(variable.getInitializer()));
                });
    }

    private Expression visitBlockExpression(BlockExpression expr) {
        return transformTreeNode(
                expr,
                () -> {
                    expr.setValue(transform(expr.getValue()));
                    List<Statement> original = new ArrayList<>(expr.getBody().getStatements());
                    List<Statement> body = new ArrayList<>();
                    for (int i = original.size() - 1; i >= 0; --i) {
                        Statement translation = rewriteStatement(original.get(i));
                        if (translation != null) body.add(translation);
                    }
                    expr.setBody(blockOf(body));
                });
    }

    /**
     * Translates a statement nested in an expression. Returns the translated statement, or {@code
     * null} if its translation was spliced into the emitted statements because an await occurs in
     * it or to its right.
     */
    private Statement rewriteStatement(Statement stmt) {
        // Both the lifter's inner list and the statement rewriter's outer list are in use by the
        // enclosing translation, so both are set aside.
        List<Statement> savedInner = statements;
        List<Statement> savedOuter = continuationRewriter.statements;
        statements = new ArrayList<>();
        continuationRewriter.statements = new ArrayList<>();
        continuationRewriter.transform(stmt);

        List<Statement> results = continuationRewriter.statements;
        statements = savedInner;
        continuationRewriter.statements = savedOuter;
        if (!seenAwait && results.size() == 1) return results.get(0);
        for (int i = results.size() - 1; i >= 0; --i) {
            statements.add(results.get(i));
        }
        return null;
    }
}
