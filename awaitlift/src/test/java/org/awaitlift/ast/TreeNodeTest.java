/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.awaitlift.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.awaitlift.Token;
import org.awaitlift.types.CoreTypes;
import org.awaitlift.types.StaticType;
import org.awaitlift.types.StaticTypeContext;
import org.junit.jupiter.api.Test;

class TreeNodeTest {

    private final Member f = new Member("f", CoreTypes.INT);

    @Test
    void settersMaintainParents() {
        VariableDeclaration a = new VariableDeclaration("a", CoreTypes.INT);
        VariableGet read = new VariableGet(a);
        StaticInvocation call =
                new StaticInvocation(f, new Arguments(Collections.singletonList(read)));
        ExpressionStatement stmt = new ExpressionStatement(call);

        assertSame(call.getArguments(), read.getParent());
        assertSame(call, call.getArguments().getParent());
        assertSame(stmt, call.getParent());

        NumberLiteral one = new NumberLiteral(1);
        call.getArguments().setPositional(0, one);
        assertSame(call.getArguments(), one.getParent());
        assertEquals("f(1);", stmt.toSource());
    }

    @Test
    void nullChildIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ExpressionStatement(null));
        assertThrows(IllegalArgumentException.class, () -> new AwaitExpression(null));
        assertThrows(
                IllegalArgumentException.class,
                () -> new Let(new VariableDeclaration("v"), new NumberLiteral(0)));
    }

    @Test
    void rendersSource() {
        VariableDeclaration x = new VariableDeclaration("x", CoreTypes.INT);
        VariableDeclaration k =
                new VariableDeclaration("k", CoreTypes.STRING, new StringLiteral("s"));
        k.setIsFinal(true);

        assertEquals("final String k = \"s\";", k.toSource());
        assertEquals("int x;", x.toSource());
        assertEquals(
                "if (x == null) return; else { x = 2; }",
                new IfStatement(
                                new EqualsNull(new VariableGet(x)),
                                new ReturnStatement(),
                                new Block(
                                        Collections.singletonList(
                                                new ExpressionStatement(
                                                        new VariableSet(x, new NumberLiteral(2))))))
                        .toSource());
        assertEquals(
                "<int>[1, x]",
                new ListLiteral(
                                Arrays.asList(new NumberLiteral(1), new VariableGet(x)),
                                CoreTypes.INT)
                        .toSource());
        assertEquals(
                "\"a${x}b\"",
                new StringConcatenation(
                                Arrays.asList(
                                        new StringLiteral("a"),
                                        new VariableGet(x),
                                        new StringLiteral("b")))
                        .toSource());
        assertEquals("{}", new Block().toSource());
        assertEquals(
                "await f()",
                new AwaitExpression(new StaticInvocation(f, Arguments.empty())).toSource());
        assertEquals("EXPR_STATEMENT x;", new ExpressionStatement(new VariableGet(x)).toString());
    }

    @Test
    void staticTypes() {
        StaticTypeContext context = new StaticTypeContext();
        VariableDeclaration b = new VariableDeclaration("b", CoreTypes.BOOL);

        assertEquals(CoreTypes.INT, new NumberLiteral(3).getStaticType(context));
        assertEquals(CoreTypes.DOUBLE, new NumberLiteral(3.5).getStaticType(context));
        assertEquals(CoreTypes.BOOL, new Not(new VariableGet(b)).getStaticType(context));
        assertEquals(
                CoreTypes.BOOL,
                new LogicalExpression(Token.OR, new VariableGet(b), KeywordLiteral.of(true))
                        .getStaticType(context));
        assertSame(StaticType.NEVER, new Rethrow().getStaticType(context));
        assertEquals(
                CoreTypes.list(CoreTypes.STRING),
                new ListLiteral(Collections.<Expression>emptyList(), CoreTypes.STRING)
                        .getStaticType(context));
    }

    @Test
    void visitorCanPruneSubtrees() {
        FunctionNode inner =
                new FunctionNode(
                        Collections.<VariableDeclaration>emptyList(),
                        new ReturnStatement(new NumberLiteral(1)),
                        AsyncMarker.SYNC,
                        CoreTypes.INT);
        Block body =
                new Block(
                        Arrays.asList(
                                new ExpressionStatement(new FunctionExpression(inner)),
                                new ReturnStatement(new NumberLiteral(2))));

        List<Integer> seen = new ArrayList<>();
        body.visit(
                node -> {
                    seen.add(node.getType());
                    return node.getType() != Token.FUNCTION;
                });

        assertEquals(
                Arrays.asList(
                        Token.BLOCK,
                        Token.EXPR_STATEMENT,
                        Token.FUNCTION_EXPRESSION,
                        Token.FUNCTION,
                        Token.RETURN,
                        Token.NUMBER),
                seen);
    }
}
