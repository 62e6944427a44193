/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.tests;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.awaitlift.Token;
import org.awaitlift.ast.Arguments;
import org.awaitlift.ast.AwaitExpression;
import org.awaitlift.ast.Block;
import org.awaitlift.ast.BlockExpression;
import org.awaitlift.ast.ConditionalExpression;
import org.awaitlift.ast.ContinuationPoint;
import org.awaitlift.ast.EqualsCall;
import org.awaitlift.ast.EqualsNull;
import org.awaitlift.ast.Expression;
import org.awaitlift.ast.ExpressionStatement;
import org.awaitlift.ast.FunctionNode;
import org.awaitlift.ast.IfStatement;
import org.awaitlift.ast.Let;
import org.awaitlift.ast.ListLiteral;
import org.awaitlift.ast.LogicalExpression;
import org.awaitlift.ast.Member;
import org.awaitlift.ast.MethodInvocation;
import org.awaitlift.ast.NamedExpression;
import org.awaitlift.ast.Not;
import org.awaitlift.ast.NumberLiteral;
import org.awaitlift.ast.ReturnStatement;
import org.awaitlift.ast.Statement;
import org.awaitlift.ast.StaticGet;
import org.awaitlift.ast.StaticInvocation;
import org.awaitlift.ast.StaticSet;
import org.awaitlift.ast.StringConcatenation;
import org.awaitlift.ast.StringLiteral;
import org.awaitlift.ast.VariableDeclaration;
import org.awaitlift.ast.VariableGet;
import org.awaitlift.ast.VariableSet;
import org.awaitlift.transform.ContinuationHelper;

/**
 * Evaluates function bodies before and after lowering so both can be compared by their results
 * and by the events they record. An await completes immediately with its operand's value; in a
 * lowered body the await helper stores that value in the async result variable.
 *
 * <p>Only the node kinds the scenario tests build are supported.
 */
public class TreeInterpreter {

    private final ContinuationHelper helper;
    private final Map<VariableDeclaration, Object> locals = new IdentityHashMap<>();
    private final Map<Member, Object> statics = new IdentityHashMap<>();
    private final Map<Member, Function<List<Object>, Object>> procedures =
            new IdentityHashMap<>();
    private final List<String> events = new ArrayList<>();
    private VariableDeclaration asyncResult;

    public TreeInterpreter(ContinuationHelper helper) {
        this.helper = helper;
    }

    /** The variable the await helper writes to, required to run a lowered body. */
    public void setAsyncResult(VariableDeclaration asyncResult) {
        this.asyncResult = asyncResult;
    }

    public void define(Member procedure, Function<List<Object>, Object> body) {
        procedures.put(procedure, body);
    }

    public Object getStatic(Member field) {
        return statics.get(field);
    }

    public void setStatic(Member field, Object value) {
        statics.put(field, value);
    }

    /** Calls, static reads and writes and awaits, in execution order. */
    public List<String> getEvents() {
        return events;
    }

    public Object run(FunctionNode function) {
        try {
            execute(function.getBody());
            return null;
        } catch (ReturnSignal signal) {
            return signal.value;
        }
    }

    public void execute(Statement stmt) {
        switch (stmt.getType()) {
            case Token.EXPR_STATEMENT:
                evaluate(((ExpressionStatement) stmt).getExpression());
                break;
            case Token.CONTINUATION_POINT:
                evaluate(((ContinuationPoint) stmt).getExpression());
                break;
            case Token.VARIABLE_DECLARATION:
                {
                    VariableDeclaration decl = (VariableDeclaration) stmt;
                    Expression init = decl.getInitializer();
                    locals.put(decl, init == null ? null : evaluate(init));
                    break;
                }
            case Token.BLOCK:
                for (Statement s : ((Block) stmt).getStatements()) {
                    execute(s);
                }
                break;
            case Token.IF:
                {
                    IfStatement ifStmt = (IfStatement) stmt;
                    if (isTrue(evaluate(ifStmt.getCondition()))) {
                        execute(ifStmt.getThen());
                    } else if (ifStmt.getOtherwise() != null) {
                        execute(ifStmt.getOtherwise());
                    }
                    break;
                }
            case Token.EMPTY:
                break;
            case Token.RETURN:
                {
                    Expression value = ((ReturnStatement) stmt).getExpression();
                    throw new ReturnSignal(value == null ? null : evaluate(value));
                }
            default:
                throw new UnsupportedOperationException(Token.typeToName(stmt.getType()));
        }
    }

    public Object evaluate(Expression expr) {
        switch (expr.getType()) {
            case Token.NUMBER:
                return ((NumberLiteral) expr).getValue();
            case Token.STRING:
                return ((StringLiteral) expr).getValue();
            case Token.TRUE:
                return Boolean.TRUE;
            case Token.FALSE:
                return Boolean.FALSE;
            case Token.NULL:
                return null;
            case Token.VARIABLE_GET:
                return locals.get(((VariableGet) expr).getVariable());
            case Token.VARIABLE_SET:
                {
                    VariableSet set = (VariableSet) expr;
                    Object value = evaluate(set.getValue());
                    locals.put(set.getVariable(), value);
                    return value;
                }
            case Token.STATIC_GET:
                {
                    Member target = ((StaticGet) expr).getTarget();
                    events.add("get " + target.getName());
                    return statics.get(target);
                }
            case Token.STATIC_SET:
                {
                    StaticSet set = (StaticSet) expr;
                    Object value = evaluate(set.getValue());
                    events.add("set " + set.getTarget().getName() + "=" + value);
                    statics.put(set.getTarget(), value);
                    return value;
                }
            case Token.STATIC_INVOCATION:
                return invoke((StaticInvocation) expr);
            case Token.METHOD_INVOCATION:
                {
                    MethodInvocation call = (MethodInvocation) expr;
                    Object receiver = evaluate(call.getReceiver());
                    List<Object> args = evaluateArguments(call.getArguments());
                    return operator(call.getName(), (Integer) receiver, (Integer) args.get(0));
                }
            case Token.EQUALS_CALL:
                {
                    EqualsCall equals = (EqualsCall) expr;
                    Object left = evaluate(equals.getLeft());
                    return Objects.equals(left, evaluate(equals.getRight()));
                }
            case Token.EQUALS_NULL:
                return evaluate(((EqualsNull) expr).getExpression()) == null;
            case Token.NOT:
                return !isTrue(evaluate(((Not) expr).getOperand()));
            case Token.AND:
                {
                    LogicalExpression logical = (LogicalExpression) expr;
                    return isTrue(evaluate(logical.getLeft()))
                            && isTrue(evaluate(logical.getRight()));
                }
            case Token.OR:
                {
                    LogicalExpression logical = (LogicalExpression) expr;
                    return isTrue(evaluate(logical.getLeft()))
                            || isTrue(evaluate(logical.getRight()));
                }
            case Token.CONDITIONAL:
                {
                    ConditionalExpression conditional = (ConditionalExpression) expr;
                    return isTrue(evaluate(conditional.getCondition()))
                            ? evaluate(conditional.getThen())
                            : evaluate(conditional.getOtherwise());
                }
            case Token.LET:
                {
                    Let let = (Let) expr;
                    locals.put(let.getVariable(), evaluate(let.getVariable().getInitializer()));
                    return evaluate(let.getBody());
                }
            case Token.BLOCK_EXPRESSION:
                {
                    BlockExpression block = (BlockExpression) expr;
                    execute(block.getBody());
                    return evaluate(block.getValue());
                }
            case Token.AWAIT:
                {
                    Object value = evaluate(((AwaitExpression) expr).getOperand());
                    events.add("await " + value);
                    return value;
                }
            case Token.LIST_LITERAL:
                {
                    List<Object> values = new ArrayList<>();
                    for (Expression e : ((ListLiteral) expr).getExpressions()) {
                        values.add(evaluate(e));
                    }
                    return values;
                }
            case Token.STRING_CONCATENATION:
                {
                    StringBuilder sb = new StringBuilder();
                    for (Expression e : ((StringConcatenation) expr).getExpressions()) {
                        sb.append(evaluate(e));
                    }
                    return sb.toString();
                }
            default:
                throw new UnsupportedOperationException(Token.typeToName(expr.getType()));
        }
    }

    private Object invoke(StaticInvocation call) {
        Member target = call.getTarget();
        List<Object> args = evaluateArguments(call.getArguments());
        if (target == helper.getUnsafeCast()) {
            return args.get(0);
        }
        if (target == helper.getAwaitHelper()) {
            if (asyncResult == null) throw new IllegalStateException("no async result variable");
            events.add("await " + args.get(0));
            locals.put(asyncResult, args.get(0));
            return null;
        }
        Function<List<Object>, Object> body = procedures.get(target);
        if (body == null) throw new IllegalStateException("undefined " + target.getName());
        events.add(target.getName() + args);
        return body.apply(args);
    }

    private List<Object> evaluateArguments(Arguments arguments) {
        List<Object> values = new ArrayList<>();
        for (Expression e : arguments.getPositional()) {
            values.add(evaluate(e));
        }
        for (NamedExpression e : arguments.getNamed()) {
            values.add(evaluate(e.getValue()));
        }
        return values;
    }

    private static Object operator(String name, Integer left, Integer right) {
        switch (name) {
            case "+":
                return left + right;
            case "-":
                return left - right;
            case "*":
                return left * right;
            case "<":
                return left < right;
            case ">":
                return left > right;
            default:
                throw new UnsupportedOperationException(name);
        }
    }

    private static boolean isTrue(Object value) {
        return Boolean.TRUE.equals(value);
    }

    private static final class ReturnSignal extends RuntimeException {
        private static final long serialVersionUID = 1L;

        final Object value;

        ReturnSignal(Object value) {
            super(null, null, false, false);
            this.value = value;
        }
    }
}
