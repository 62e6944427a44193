/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.tests;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import org.awaitlift.Token;
import org.awaitlift.ast.Arguments;
import org.awaitlift.ast.AsyncMarker;
import org.awaitlift.ast.AwaitExpression;
import org.awaitlift.ast.Block;
import org.awaitlift.ast.BlockExpression;
import org.awaitlift.ast.ConditionalExpression;
import org.awaitlift.ast.Expression;
import org.awaitlift.ast.ExpressionStatement;
import org.awaitlift.ast.FunctionNode;
import org.awaitlift.ast.IfStatement;
import org.awaitlift.ast.KeywordLiteral;
import org.awaitlift.ast.Let;
import org.awaitlift.ast.ListLiteral;
import org.awaitlift.ast.LogicalExpression;
import org.awaitlift.ast.Member;
import org.awaitlift.ast.MethodInvocation;
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
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.junit.jupiter.api.Test;

class LoweringBehaviourTest {

    private static final Member COUNTER = new Member("counter", CoreTypes.INT);
    private static final Member BUMP = new Member("bump", CoreTypes.future(CoreTypes.INT));
    private static final Member FETCH = new Member("fetch", CoreTypes.future(CoreTypes.INT));
    private static final Member CHECK = new Member("check", CoreTypes.future(CoreTypes.BOOL));
    private static final Member TICK = new Member("tick", CoreTypes.INT);
    private static final Member NEXT = new Member("next", CoreTypes.INT);
    private static final Member F3 = new Member("f3", CoreTypes.INT);

    private final LoweringHarness harness =
            new LoweringHarness(
                    interpreter -> {
                        interpreter.setStatic(COUNTER, 0);
                        interpreter.define(
                                BUMP,
                                args -> {
                                    interpreter.setStatic(COUNTER, 10);
                                    return 1;
                                });
                        interpreter.define(FETCH, args -> (Integer) args.get(0) + 100);
                        interpreter.define(CHECK, args -> Boolean.TRUE);
                        interpreter.define(TICK, args -> args.get(0));
                        interpreter.define(
                                NEXT,
                                args -> {
                                    int next = (Integer) interpreter.getStatic(COUNTER) + 1;
                                    interpreter.setStatic(COUNTER, next);
                                    return next;
                                });
                        interpreter.define(
                                F3,
                                args ->
                                        (Integer) args.get(0) * 100
                                                + (Integer) args.get(1) * 10
                                                + (Integer) args.get(2));
                    });

    private static StaticInvocation call(Member target, Expression... args) {
        return new StaticInvocation(target, new Arguments(Arrays.asList(args)));
    }

    private static Expression await(Expression operand) {
        return new AwaitExpression(operand);
    }

    private static Expression number(int value) {
        return new NumberLiteral(value);
    }

    private static Expression plus(Expression left, Expression right) {
        return new MethodInvocation(
                left, "+", new Arguments(Collections.singletonList(right)), CoreTypes.INT);
    }

    private static FunctionNode async(Statement... body) {
        return new FunctionNode(
                Collections.<VariableDeclaration>emptyList(),
                new Block(Arrays.asList(body)),
                AsyncMarker.ASYNC,
                CoreTypes.future(StaticType.DYNAMIC));
    }

    private static FunctionNode returning(Supplier<Expression> value) {
        return async(new ReturnStatement(value.get()));
    }

    private LoweringHarness.Outcome assertSameBehaviour(Supplier<FunctionNode> factory) {
        LoweringHarness.Outcome original = harness.original(factory);
        LoweringHarness.Outcome lowered = harness.lowered(factory);
        assertEquals(original.value, lowered.value, "result");
        assertEquals(original.events, lowered.events, "events");
        return lowered;
    }

    @Test
    void staticReadHappensBeforeAwait() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () -> returning(() -> plus(new StaticGet(COUNTER), await(call(BUMP)))));
        assertEquals(1, outcome.value);
        assertEquals(Arrays.asList("get counter", "bump[]", "await 1"), outcome.events);
    }

    @Test
    void localIsCapturedBeforeLaterAssignment() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () -> {
                            VariableDeclaration x =
                                    new VariableDeclaration("x", CoreTypes.INT, number(1));
                            Expression fetch = await(call(FETCH, new VariableSet(x, number(5))));
                            Expression sum =
                                    call(F3, new VariableGet(x), fetch, new VariableGet(x));
                            return async(x, new ReturnStatement(sum));
                        });
        assertEquals(100 + 1050 + 5, outcome.value);
    }

    @Test
    void everyCallRunsOnce() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () ->
                                returning(
                                        () ->
                                                call(
                                                        F3,
                                                        call(NEXT),
                                                        await(call(FETCH, number(0))),
                                                        call(NEXT))));
        assertEquals(100 + 1000 + 2, outcome.value);
        assertEquals(
                Arrays.asList("next[]", "fetch[0]", "await 100", "next[]", "f3[1, 100, 2]"),
                outcome.events);
    }

    @Test
    void effectsKeepTheirOrderAroundSeveralAwaits() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () ->
                                returning(
                                        () ->
                                                new ListLiteral(
                                                        Arrays.asList(
                                                                call(TICK, number(1)),
                                                                await(call(FETCH, number(2))),
                                                                call(TICK, number(3)),
                                                                await(call(FETCH, number(4))),
                                                                call(TICK, number(5))),
                                                        CoreTypes.INT)));
        assertEquals(Arrays.asList(1, 102, 3, 104, 5), outcome.value);
    }

    @Test
    void andSkipsRightOperandWhenLeftIsFalse() {
        for (boolean flag : new boolean[] {false, true}) {
            LoweringHarness.Outcome outcome =
                    assertSameBehaviour(
                            () ->
                                    returning(
                                            () ->
                                                    new LogicalExpression(
                                                            Token.AND,
                                                            KeywordLiteral.of(flag),
                                                            await(call(CHECK)))));
            assertEquals(flag, outcome.value);
            assertEquals(flag ? 2 : 0, outcome.events.size());
        }
    }

    @Test
    void orSkipsRightOperandWhenLeftIsTrue() {
        for (boolean flag : new boolean[] {false, true}) {
            LoweringHarness.Outcome outcome =
                    assertSameBehaviour(
                            () ->
                                    returning(
                                            () ->
                                                    new LogicalExpression(
                                                            Token.OR,
                                                            KeywordLiteral.of(flag),
                                                            await(call(CHECK)))));
            assertEquals(Boolean.TRUE, outcome.value);
            assertEquals(flag ? 0 : 2, outcome.events.size());
        }
    }

    @Test
    void conditionalRunsOnlyTheChosenBranch() {
        for (boolean flag : new boolean[] {false, true}) {
            LoweringHarness.Outcome outcome =
                    assertSameBehaviour(
                            () ->
                                    returning(
                                            () ->
                                                    plus(
                                                            call(TICK, number(7)),
                                                            new ConditionalExpression(
                                                                    KeywordLiteral.of(flag),
                                                                    await(call(FETCH, number(1))),
                                                                    call(TICK, number(2)),
                                                                    CoreTypes.INT))));
            assertEquals(flag ? 108 : 9, outcome.value);
        }
    }

    @Test
    void awaitInsideConditionOfConditional() {
        for (boolean flag : new boolean[] {false, true}) {
            assertSameBehaviour(
                    () ->
                            returning(
                                    () ->
                                            new ConditionalExpression(
                                                    new LogicalExpression(
                                                            Token.AND,
                                                            KeywordLiteral.of(flag),
                                                            await(call(CHECK))),
                                                    await(call(FETCH, number(1))),
                                                    call(TICK, number(0)),
                                                    CoreTypes.INT)));
        }
    }

    @Test
    void letVariableIsVisibleAcrossAwait() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () -> {
                            VariableDeclaration v =
                                    new VariableDeclaration("v", CoreTypes.INT, call(NEXT));
                            Expression fetch = await(call(FETCH, new VariableGet(v)));
                            return returning(
                                    () -> new Let(v, plus(new VariableGet(v), fetch)));
                        });
        assertEquals(1 + 101, outcome.value);
    }

    @Test
    void blockExpressionStatementsRunBeforeItsValue() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () -> {
                            VariableDeclaration x =
                                    new VariableDeclaration("x", CoreTypes.INT, number(0));
                            Expression fetch = await(call(FETCH, number(1)));
                            Block body =
                                    new Block(
                                            Collections.singletonList(
                                                    new ExpressionStatement(
                                                            new VariableSet(x, fetch))));
                            Expression value = plus(new VariableGet(x), call(TICK, number(2)));
                            return async(
                                    x,
                                    new ReturnStatement(
                                            plus(
                                                    call(TICK, number(3)),
                                                    new BlockExpression(body, value))));
                        });
        assertEquals(3 + 101 + 2, outcome.value);
    }

    @Test
    void stringInterpolationAroundAwait() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () ->
                                returning(
                                        () ->
                                                new StringConcatenation(
                                                        Arrays.asList(
                                                                new StringLiteral("a"),
                                                                call(TICK, number(1)),
                                                                await(call(FETCH, number(2))),
                                                                new StringLiteral("b")))));
        assertEquals("a1102b", outcome.value);
    }

    @Test
    void staticWriteAfterAwaitIsNotReordered() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () -> {
                            Expression bumped = plus(new StaticGet(COUNTER), await(call(BUMP)));
                            return async(
                                    new ExpressionStatement(new StaticSet(COUNTER, bumped)),
                                    new ReturnStatement(new StaticGet(COUNTER)));
                        });
        assertEquals(1, outcome.value);
    }

    @Test
    void ifStatementWithAwaitInConditionAndBranch() {
        LoweringHarness.Outcome outcome =
                assertSameBehaviour(
                        () -> {
                            Expression sum = plus(call(NEXT), await(call(FETCH, number(1))));
                            return async(
                                    new IfStatement(
                                            await(call(CHECK)), new ReturnStatement(sum), null),
                                    new ReturnStatement(number(-1)));
                        });
        assertEquals(102, outcome.value);
    }

    @Test
    void loweredBodyHasNoAwaitLeft() {
        FunctionNode function =
                returning(() -> plus(new StaticGet(COUNTER), await(call(BUMP))));
        harness.lowered(() -> function);

        List<Statement> statements = ((Block) function.getBody()).getStatements();
        boolean[] found = new boolean[1];
        function.getBody()
                .visit(
                        node -> {
                            if (node.getType() == Token.AWAIT) found[0] = true;
                            return true;
                        });
        assertFalse(found[0]);
        assertEquals(Token.CONTINUATION_POINT, statements.get(5).getType());
    }
}
