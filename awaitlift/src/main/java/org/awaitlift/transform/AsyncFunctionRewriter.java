/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.transform;

import java.util.ArrayList;
import java.util.List;
import org.awaitlift.Kit;
import org.awaitlift.LoweringEnvirons;
import org.awaitlift.Token;
import org.awaitlift.ast.Block;
import org.awaitlift.ast.ContinuationPoint;
import org.awaitlift.ast.Expression;
import org.awaitlift.ast.ExpressionStatement;
import org.awaitlift.ast.FunctionNode;
import org.awaitlift.ast.IfStatement;
import org.awaitlift.ast.ReturnStatement;
import org.awaitlift.ast.Statement;
import org.awaitlift.ast.VariableDeclaration;
import org.awaitlift.types.StaticTypeContext;

/**
 * Lowers the body of one async function. Statements are rewritten one at a time: each
 * expression directly under a statement goes through the {@link ExpressionLifter}, and the
 * statements it emits are placed in front of the statement that owned the expression.
 *
 * <p>The lowered body starts with the declarations of the async result variable, the two
 * continuation variables and every temporary the lifter allocated, followed by the rewritten
 * statements. Turning that into a state machine is left to the code generator.
 */
public class AsyncFunctionRewriter {

    static final String THEN_CONTINUATION_NAME = ":async_op_then";
    static final String ERROR_CONTINUATION_NAME = ":async_op_error";

    private final ContinuationHelper helper;
    private final StaticTypeContext staticTypeContext;
    private final LoweringEnvirons env;

    private final VariableDeclaration thenContinuationVariable =
            new VariableDeclaration(THEN_CONTINUATION_NAME);
    private final VariableDeclaration catchErrorContinuationVariable =
            new VariableDeclaration(ERROR_CONTINUATION_NAME);

    private final ExpressionLifter expressionRewriter;

    // Output of the statement being rewritten, in order. The lifter swaps it out while
    // rewriting statements nested in block expressions.
    List<Statement> statements = new ArrayList<>();

    public AsyncFunctionRewriter(
            ContinuationHelper helper, StaticTypeContext staticTypeContext, LoweringEnvirons env) {
        this.helper = helper;
        this.staticTypeContext = staticTypeContext;
        this.env = env;
        this.expressionRewriter = new ExpressionLifter(this);
    }

    public ContinuationHelper getHelper() {
        return helper;
    }

    public StaticTypeContext getStaticTypeContext() {
        return staticTypeContext;
    }

    public LoweringEnvirons getEnvirons() {
        return env;
    }

    public VariableDeclaration getThenContinuationVariable() {
        return thenContinuationVariable;
    }

    public VariableDeclaration getCatchErrorContinuationVariable() {
        return catchErrorContinuationVariable;
    }

    public ExpressionLifter getExpressionRewriter() {
        return expressionRewriter;
    }

    /**
     * Lowers the body of {@code function}, installs the lowered body and returns it.
     *
     * @throws IllegalStateException if the function is not async
     */
    public Block rewrite(FunctionNode function) {
        if (!function.isAsync()) throw Kit.codeBug("not an async function: " + function);
        statements = new ArrayList<>();
        Statement body = function.getBody();
        if (body.getType() == Token.BLOCK) {
            for (Statement stmt : new ArrayList<>(((Block) body).getStatements())) {
                transform(stmt);
            }
        } else {
            transform(body);
        }

        List<Statement> lowered = new ArrayList<>();
        lowered.add(expressionRewriter.getAsyncResult());
        lowered.add(thenContinuationVariable);
        lowered.add(catchErrorContinuationVariable);
        lowered.addAll(expressionRewriter.getVariables());
        lowered.addAll(statements);
        statements = new ArrayList<>();

        Block result = new Block(lowered);
        function.setBody(result);
        if (env.isPrintTrees()) {
            System.out.println(function.toSource());
        }
        return result;
    }

    /** Marks {@code value} as a suspend boundary. */
    public Statement createContinuationPoint(Expression value) {
        return new ContinuationPoint(value);
    }

    /** Rewrites one statement, appending its translation to the current output list. */
    public void transform(Statement stmt) {
        switch (stmt.getType()) {
            case Token.EXPR_STATEMENT:
                {
                    ExpressionStatement es = (ExpressionStatement) stmt;
                    es.setExpression(expressionRewriter.rewrite(es.getExpression(), statements));
                    statements.add(es);
                    break;
                }
            case Token.VARIABLE_DECLARATION:
                {
                    VariableDeclaration decl = (VariableDeclaration) stmt;
                    if (decl.getInitializer() != null) {
                        decl.setInitializer(
                                expressionRewriter.rewrite(decl.getInitializer(), statements));
                    }
                    statements.add(decl);
                    break;
                }
            case Token.RETURN:
                {
                    ReturnStatement ret = (ReturnStatement) stmt;
                    if (ret.getExpression() != null) {
                        ret.setExpression(
                                expressionRewriter.rewrite(ret.getExpression(), statements));
                    }
                    statements.add(ret);
                    break;
                }
            case Token.IF:
                {
                    IfStatement ifStmt = (IfStatement) stmt;
                    ifStmt.setCondition(
                            expressionRewriter.rewrite(ifStmt.getCondition(), statements));
                    ifStmt.setThen(visitDelimited(ifStmt.getThen()));
                    if (ifStmt.getOtherwise() != null) {
                        ifStmt.setOtherwise(visitDelimited(ifStmt.getOtherwise()));
                    }
                    statements.add(ifStmt);
                    break;
                }
            case Token.BLOCK:
                {
                    List<Statement> saved = statements;
                    statements = new ArrayList<>();
                    for (Statement s : new ArrayList<>(((Block) stmt).getStatements())) {
                        transform(s);
                    }
                    saved.add(new Block(statements));
                    statements = saved;
                    break;
                }
            case Token.EMPTY:
                statements.add(stmt);
                break;
            default:
                throw Kit.codeBug("unexpected statement " + Token.typeToName(stmt.getType()));
        }
    }

    /** Rewrites a conditionally executed statement into a statement of its own. */
    private Statement visitDelimited(Statement stmt) {
        List<Statement> saved = statements;
        statements = new ArrayList<>();
        transform(stmt);
        Statement result = statements.size() == 1 ? statements.get(0) : new Block(statements);
        statements = saved;
        return result;
    }
}
